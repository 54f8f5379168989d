package gr.imsi.athenarc.illustrator.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import gr.imsi.athenarc.illustrator.config.MapStylesheet;
import gr.imsi.athenarc.illustrator.domain.Point;
import gr.imsi.athenarc.illustrator.error.LayoutException;
import gr.imsi.athenarc.illustrator.model.ConnectionDirection;
import gr.imsi.athenarc.illustrator.model.ConnectionSpec;
import gr.imsi.athenarc.illustrator.model.ConstraintSpec;
import gr.imsi.athenarc.illustrator.model.Diagram;
import gr.imsi.athenarc.illustrator.model.Midpoint;
import gr.imsi.athenarc.illustrator.model.NodeKind;
import gr.imsi.athenarc.illustrator.model.Relation;
import gr.imsi.athenarc.illustrator.model.RoutingMode;

public class DiagramJsonReaderTest {

    private final DiagramJsonReader reader = new DiagramJsonReader();

    private static final String DIAGRAM = "{"
            + "\"root\": {\"kind\": \"row\", \"id\": \"r\", \"options\": {\"gap\": 20},"
            + "  \"children\": [{\"kind\": \"rect\", \"id\": \"a\"}, {\"kind\": \"circle\", \"id\": \"b\", \"options\": {\"size\": 40}}]},"
            + "\"connections\": [{\"from\": \"a.right\", \"to\": \"b\", \"arrow\": \"<->\", \"routing\": \"curved\","
            + "  \"waypoints\": [[10, 20]], \"label\": \"x\", \"label_at\": 0.25, \"trunk\": 7,"
            + "  \"style\": {\"stroke\": \"accent-1\", \"stroke_dasharray\": \"dotted\"}}],"
            + "\"constraints\": [{\"target\": \"b\", \"edge\": \"left\", \"ref\": \"a.right\", \"offset\": 5},"
            + "  {\"target\": \"b\", \"edge\": \"top\", \"relation\": \">=\", \"value\": 100},"
            + "  {\"target\": \"b\", \"edge\": \"center_x\", \"midpoint\": [\"a\", \"r\"]}],"
            + "\"contains\": [{\"container\": \"r\", \"members\": [\"a\", \"b\"], \"padding\": 4}]"
            + "}";

    @Test
    public void testReadsEverySection() throws Exception {
        Diagram diagram = reader.read(DIAGRAM);

        assertEquals(NodeKind.ROW, diagram.getRoot().getKind());
        assertEquals(20.0, diagram.getRoot().getOptions().get("gap"));
        assertEquals(2, diagram.getRoot().getChildren().size());

        ConnectionSpec connection = diagram.getConnections().get(0);
        assertEquals("a", connection.getFrom().getNodeId());
        assertEquals("right", connection.getFrom().getAnchor());
        assertEquals(ConnectionDirection.BIDIRECTIONAL, connection.getDirection());
        assertEquals(RoutingMode.CURVED, connection.getRouting());
        assertEquals(List.of(new Point(10, 20)), connection.getWaypoints());
        assertEquals(0.25, connection.getLabelAt());
        assertEquals(7.0, connection.getTrunk());
        assertEquals("dotted", connection.getStrokeDasharray());

        List<ConstraintSpec> constraints = diagram.getConstraints();
        assertEquals("b.left = a.right + 5", constraints.get(0).toString());
        assertEquals(Relation.AT_LEAST, constraints.get(1).getRelation());
        assertTrue(constraints.get(2).getExpression() instanceof Midpoint);

        assertEquals(List.of("a", "b"), diagram.getContainments().get(0).getMemberIds());
        assertEquals(4, diagram.getContainments().get(0).getPadding());
    }

    @Test
    public void testSeveralTopLevelNodes() throws Exception {
        Diagram diagram = reader.read("{\"nodes\": [{\"kind\": \"rect\"}, {\"kind\": \"text\", \"options\": {\"text\": \"hi\"}}]}");
        assertEquals(NodeKind.COLUMN, diagram.getRoot().getKind());
        assertEquals(2, diagram.getRoot().getChildren().size());
    }

    @Test
    public void testUnknownConnectionStyle() {
        LayoutException e = assertThrows(LayoutException.class, () -> reader.read(
                "{\"root\": {\"kind\": \"rect\", \"id\": \"a\"},"
                        + "\"connections\": [{\"from\": \"a\", \"to\": \"a\", \"style\": {\"glow\": 1}}]}"));
        assertEquals(List.of("a -> a", "glow"), e.getIdentifiers());
    }

    @Test
    public void testMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> reader.read("{\"root\": {\"kind\": \"hexagon\"}}"));
        assertThrows(IllegalArgumentException.class, () -> reader.read("{\"root\": {\"id\": \"a\"}}"));
        assertThrows(IllegalStateException.class, () -> reader.read("{}"));
    }

    @Test
    public void testStylesheetOverridesPalette(@TempDir Path dir) throws Exception {
        Path nested = dir.resolve("nested.json");
        Files.write(nested, "{\"colors\": {\"accent-1\": \"#010203\"}}".getBytes(StandardCharsets.UTF_8));
        Path flat = dir.resolve("flat.json");
        Files.write(flat, "{\"brand\": \"#abcdef\"}".getBytes(StandardCharsets.UTF_8));

        MapStylesheet first = reader.readStylesheet(nested);
        assertEquals(Optional.of("#010203"), first.lookup("accent-1"));
        assertEquals(Optional.of("#ff9800"), first.lookup("secondary-1"));
        assertEquals(Optional.of("#abcdef"), reader.readStylesheet(flat).lookup("brand"));
    }
}
