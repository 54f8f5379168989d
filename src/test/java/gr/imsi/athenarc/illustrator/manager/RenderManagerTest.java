package gr.imsi.athenarc.illustrator.manager;

import static gr.imsi.athenarc.illustrator.Fixtures.rect;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import gr.imsi.athenarc.illustrator.config.LayoutConfig;
import gr.imsi.athenarc.illustrator.config.MapStylesheet;
import gr.imsi.athenarc.illustrator.config.Stylesheet;
import gr.imsi.athenarc.illustrator.domain.Box;
import gr.imsi.athenarc.illustrator.error.ConstraintException;
import gr.imsi.athenarc.illustrator.error.LayoutException;
import gr.imsi.athenarc.illustrator.io.SceneJsonWriter;
import gr.imsi.athenarc.illustrator.model.ConnectionSpec;
import gr.imsi.athenarc.illustrator.model.ConstraintExpression;
import gr.imsi.athenarc.illustrator.model.ContainsSpec;
import gr.imsi.athenarc.illustrator.model.Diagram;
import gr.imsi.athenarc.illustrator.model.DiagramBuilder;
import gr.imsi.athenarc.illustrator.model.NodeKind;
import gr.imsi.athenarc.illustrator.model.NodeSpec;
import gr.imsi.athenarc.illustrator.scene.PlacedLabel;
import gr.imsi.athenarc.illustrator.scene.PositionedShape;
import gr.imsi.athenarc.illustrator.scene.Scene;

public class RenderManagerTest {

    private final RenderManager manager = RenderManager.createDefault();

    private static Map<String, PositionedShape> byName(Scene scene) {
        return scene.getShapes().stream().collect(Collectors.toMap(PositionedShape::getName, s -> s));
    }

    @Test
    public void testRowOfTwo() {
        Scene scene = manager.render(new DiagramBuilder()
                .withNode(NodeSpec.builder(NodeKind.ROW).children(rect("a", 50), rect("b", 50)).build())
                .build(), Stylesheet.empty());

        Map<String, PositionedShape> shapes = byName(scene);
        assertEquals(2, shapes.size());
        assertEquals(0, shapes.get("a").getBox().getX());
        assertEquals(60, shapes.get("b").getBox().getX());
        assertEquals(Box.of(0, 0, 110, 50), scene.getBounds());
    }

    @Test
    public void testUnknownConstraintNodeFailsWholeRender() {
        Diagram diagram = new DiagramBuilder()
                .withNode(rect("a", 50))
                .constrain("missing", "left", ConstraintExpression.constant(10))
                .build();

        ConstraintException e = assertThrows(ConstraintException.class,
                () -> manager.render(diagram, Stylesheet.empty()));
        assertTrue(e.getIdentifiers().contains("missing"));
        assertThrows(ConstraintException.class, () -> manager.validate(diagram, Stylesheet.empty()));
    }

    @Test
    public void testUnresolvedContainmentIsLayoutError() {
        Diagram diagram = new DiagramBuilder()
                .withNode(rect("a", 50))
                .withContainment(new ContainsSpec("a", List.of("ghost"), 0))
                .build();
        LayoutException e = assertThrows(LayoutException.class, () -> manager.render(diagram, Stylesheet.empty()));
        assertEquals(LayoutException.Reason.UNRESOLVED_REFERENCE, e.getReason());
    }

    @Test
    public void testTopLevelNodesStackVertically() {
        Scene scene = manager.render(new DiagramBuilder().withNode(rect("a", 50)).withNode(rect("b", 50)).build(),
                Stylesheet.empty());
        assertEquals(60, byName(scene).get("b").getBox().getY());
    }

    @Test
    public void testContainersAppearOnlyWhenStyled() {
        Diagram diagram = new DiagramBuilder().withNode(NodeSpec.builder(NodeKind.COLUMN).id("outer").children(
                NodeSpec.builder(NodeKind.ROW).id("plain").children(rect("a", 10)).build(),
                NodeSpec.builder(NodeKind.ROW).id("framed").option("stroke", "accent-1")
                        .option("label", "Group").children(rect("b", 10)).build()).build()).build();

        Scene scene = manager.render(diagram, MapStylesheet.overDefaults(Map.of("accent-1", "#00aa00")));
        Map<String, PositionedShape> shapes = byName(scene);
        assertEquals(3, shapes.size());
        assertTrue(shapes.get("framed").isContainer());
        assertEquals("#00aa00", shapes.get("framed").getStyle().getStroke());

        PlacedLabel label = scene.getLabels().get(0);
        assertEquals("Group", label.getText());
        assertEquals(PlacedLabel.Owner.SHAPE, label.getOwnerKind());
        assertTrue(label.getPosition().getY() < shapes.get("framed").getBox().getTop());
    }

    @Test
    public void testConnectionLabelsAreOwnedByTheConnection() {
        Diagram diagram = new DiagramBuilder()
                .withNode(NodeSpec.builder(NodeKind.ROW).option("gap", 100).children(rect("a", 20), rect("b", 20)).build())
                .withConnection(ConnectionSpec.builder("a", "b").label("calls").build())
                .build();
        Scene scene = manager.render(diagram, Stylesheet.empty());
        assertEquals(1, scene.getPaths().size());
        PlacedLabel label = scene.getLabels().get(0);
        assertEquals("a -> b", label.getOwner());
        assertTrue(label.getRelatedNodes().isEmpty());
        assertEquals("#333333", label.getColor());
    }

    @Test
    public void testRenderIsDeterministic() throws Exception {
        Diagram diagram = new DiagramBuilder()
                .withNode(NodeSpec.builder(NodeKind.GRID).option("columns", 2).children(
                        rect("a", 20), rect("b", 30), rect("c", 10), rect("d", 40)).build())
                .connect("a", "d")
                .connect("b", "c.bottom")
                .constrain("c", "left", ConstraintExpression.edge("a", "left", 0))
                .build();
        SceneJsonWriter writer = new SceneJsonWriter();
        String first = writer.toJson(manager.render(diagram, Stylesheet.empty()));
        String second = writer.toJson(RenderManager.createDefault().render(diagram, Stylesheet.empty()));
        assertEquals(first, second);
    }

    @Test
    public void testOriginFromConfig() {
        RenderManager shifted = RenderManager.builder()
                .withLayoutConfig(LayoutConfig.builder().origin(100, 50).build())
                .build();
        Scene scene = shifted.render(new DiagramBuilder().withNode(rect("a", 10)).build(), Stylesheet.empty());
        assertEquals(Box.of(100, 50, 10, 10), scene.getBounds());
    }

    static Stream<Long> seeds() {
        return LongStream.range(0, 30).map(i -> 0xc0ffeeL + i * 31337).boxed();
    }

    private static NodeSpec randomTree(Random random, int depth) {
        if (depth == 0 || random.nextInt(4) == 0) {
            return NodeSpec.builder(NodeKind.RECTANGLE)
                    .option("width", 5 + random.nextInt(60)).option("height", 5 + random.nextInt(60)).build();
        }
        NodeKind[] kinds = {NodeKind.ROW, NodeKind.COLUMN, NodeKind.STACK, NodeKind.GRID, NodeKind.GROUP};
        NodeSpec.Builder container = NodeSpec.builder(kinds[random.nextInt(kinds.length)])
                .option("padding", random.nextInt(15))
                .option("gap", random.nextInt(15))
                .option("align", new String[] {"start", "center", "end"}[random.nextInt(3)]);
        int children = 1 + random.nextInt(4);
        for (int i = 0; i < children; i++) {
            container.child(randomTree(random, depth - 1));
        }
        return container.build();
    }

    @ParameterizedTest
    @MethodSource("seeds")
    public void testAutomaticLayoutHasNoDefects(long seed) {
        Diagram diagram = new DiagramBuilder().withNode(randomTree(new Random(seed), 4)).build();
        RenderResult result = manager.validate(diagram, Stylesheet.empty());
        assertTrue(result.getDiagnostics().isEmpty(), "seed " + seed + ": " + result.getDiagnostics());
    }
}
