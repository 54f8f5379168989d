package gr.imsi.athenarc.illustrator.layout;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Random;
import java.util.stream.LongStream;
import java.util.stream.Stream;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import gr.imsi.athenarc.illustrator.config.LayoutConfig;
import gr.imsi.athenarc.illustrator.model.NodeKind;
import gr.imsi.athenarc.illustrator.model.NodeSpec;

/**
 * Sequential container size is sum of children + (n - 1) x gap + 2 x padding on the main
 * axis, over randomly generated trees of primitive shapes.
 */
public class SequentialSizingTest {

    private static final NodeKind[] LEAVES = {
            NodeKind.RECTANGLE, NodeKind.CIRCLE, NodeKind.ELLIPSE, NodeKind.LINE, NodeKind.POLYGON};
    private static final NodeKind[] SEQUENTIAL = {NodeKind.ROW, NodeKind.COLUMN, NodeKind.GROUP};

    static Stream<Long> seeds() {
        return LongStream.range(0, 50).map(i -> 0x5eed_0000L + i * 7919).boxed();
    }

    static NodeSpec randomTree(Random random, int depth) {
        if (depth == 0 || random.nextInt(3) == 0) {
            NodeSpec.Builder leaf = NodeSpec.builder(LEAVES[random.nextInt(LEAVES.length)]);
            if (random.nextBoolean()) {
                leaf.option("size", 1 + random.nextInt(120));
            }
            return leaf.build();
        }
        NodeSpec.Builder container = NodeSpec.builder(SEQUENTIAL[random.nextInt(SEQUENTIAL.length)]);
        if (random.nextBoolean()) {
            container.option("gap", random.nextInt(40));
        }
        if (random.nextBoolean()) {
            container.option("padding", random.nextInt(25));
        }
        if (random.nextBoolean()) {
            container.option("align", random.nextBoolean() ? "center" : "end");
        }
        int children = 1 + random.nextInt(5);
        for (int i = 0; i < children; i++) {
            container.child(randomTree(random, depth - 1));
        }
        return container.build();
    }

    @ParameterizedTest
    @MethodSource("seeds")
    public void testMainAxisSizeIsExactSum(long seed) {
        Random random = new Random(seed);
        LayoutConfig config = LayoutConfig.defaults();
        LayoutNode root = new GeometryTreeBuilder(config).build(randomTree(random, 4));
        new LayoutEngine(config).arrange(root);

        for (LayoutNode node : NodeIndex.of(root).getNodes()) {
            if (!node.getKind().isSequential()) {
                continue;
            }
            boolean horizontal = node.getKind() == NodeKind.ROW;
            List<LayoutNode> children = node.getChildren();
            double gap = node.getOptions().getGap(config);
            double padding = node.getOptions().getPadding(config);

            double sum = 0;
            for (LayoutNode child : children) {
                sum += horizontal ? child.getBox().getWidth() : child.getBox().getHeight();
            }
            double expected = sum + (children.size() - 1) * gap + 2 * padding;
            double actual = horizontal ? node.getBox().getWidth() : node.getBox().getHeight();
            assertEquals(expected, actual, 1e-9, "seed " + seed + " at " + node.getName());

            double cursor = (horizontal ? node.getBox().getLeft() : node.getBox().getTop()) + padding;
            for (LayoutNode child : children) {
                double start = horizontal ? child.getBox().getLeft() : child.getBox().getTop();
                assertEquals(cursor, start, 1e-9, "seed " + seed + " at " + child.getName());
                cursor += (horizontal ? child.getBox().getWidth() : child.getBox().getHeight()) + gap;
            }
        }
    }
}
