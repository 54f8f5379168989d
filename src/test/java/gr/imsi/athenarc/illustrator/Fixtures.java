package gr.imsi.athenarc.illustrator;

import gr.imsi.athenarc.illustrator.config.LayoutConfig;
import gr.imsi.athenarc.illustrator.layout.GeometryTreeBuilder;
import gr.imsi.athenarc.illustrator.layout.LayoutEngine;
import gr.imsi.athenarc.illustrator.layout.LayoutNode;
import gr.imsi.athenarc.illustrator.layout.NodeIndex;
import gr.imsi.athenarc.illustrator.model.NodeKind;
import gr.imsi.athenarc.illustrator.model.NodeSpec;

/**
 * Shared builders for tests.
 */
public final class Fixtures {

    private Fixtures() {}

    public static NodeSpec rect(String id, double size) {
        return NodeSpec.builder(NodeKind.RECTANGLE).id(id).option("size", size).build();
    }

    public static NodeSpec rect(String id, double width, double height) {
        return NodeSpec.builder(NodeKind.RECTANGLE).id(id).option("width", width).option("height", height).build();
    }

    /**
     * A rectangle that ends up at (x, y) when placed in a stack with no padding at the origin.
     */
    public static NodeSpec placed(String id, double x, double y, double width, double height) {
        return NodeSpec.builder(NodeKind.RECTANGLE).id(id)
                .option("width", width).option("height", height)
                .option("dx", x).option("dy", y)
                .build();
    }

    public static NodeSpec stack(NodeSpec... children) {
        return NodeSpec.builder(NodeKind.STACK).id("canvas").children(children).build();
    }

    public static NodeIndex layout(NodeSpec root) {
        return layout(root, LayoutConfig.defaults());
    }

    public static NodeIndex layout(NodeSpec root, LayoutConfig config) {
        LayoutNode tree = new GeometryTreeBuilder(config).build(root);
        new LayoutEngine(config).arrange(tree);
        return NodeIndex.of(tree);
    }

    public static LayoutNode node(NodeIndex index, String id) {
        return index.find(id).orElseThrow(() -> new AssertionError("No node " + id));
    }
}
