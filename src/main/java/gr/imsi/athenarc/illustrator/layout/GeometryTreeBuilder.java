package gr.imsi.athenarc.illustrator.layout;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.illustrator.config.LayoutConfig;
import gr.imsi.athenarc.illustrator.config.NodeOptions;
import gr.imsi.athenarc.illustrator.domain.Box;
import gr.imsi.athenarc.illustrator.model.NodeKind;
import gr.imsi.athenarc.illustrator.model.NodeSpec;

/**
 * Builds the geometry tree from the structural tree: checks every node's options and
 * measures intrinsic sizes bottom-up.
 */
public class GeometryTreeBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(GeometryTreeBuilder.class);

    private final LayoutConfig config;
    private int nextOrdinal;

    public GeometryTreeBuilder(LayoutConfig config) {
        this.config = config;
    }

    /**
     * @param root root of the structural tree
     * @return root of a new, measured geometry tree
     * @throws gr.imsi.athenarc.illustrator.error.LayoutException on an unrecognized or malformed option
     */
    public LayoutNode build(NodeSpec root) {
        nextOrdinal = 0;
        return build(root, null, 0);
    }

    private LayoutNode build(NodeSpec spec, String parentName, int position) {
        String name = nameOf(spec, parentName, position);
        NodeOptions options = NodeOptions.parse(spec.getKind(), name, spec.getOptions());
        int ordinal = nextOrdinal++;

        List<LayoutNode> children = new ArrayList<>(spec.getChildren().size());
        for (int i = 0; i < spec.getChildren().size(); i++) {
            children.add(build(spec.getChildren().get(i), name, i + 1));
        }
        LayoutNode node = new LayoutNode(ordinal, spec.getKind(), spec.getId(), name, options, children);
        measure(node);
        return node;
    }

    private static String nameOf(NodeSpec spec, String parentName, int position) {
        if (spec.getId() != null) {
            return spec.getId();
        }
        if (parentName == null) {
            return "<root>";
        }
        return "<child #" + position + " of " + parentName + ">";
    }

    private void measure(LayoutNode node) {
        NodeOptions options = node.getOptions();
        double width;
        double height;
        NodeKind kind = node.getKind();
        if (!kind.isContainer()) {
            Box size = kind == NodeKind.TEXT
                    ? TextMetrics.measureText(options.getText(), options.getFontSize(config), config)
                    : config.getDefaultSize(kind);
            width = size.getWidth();
            height = size.getHeight();
            if (options.getSize() != null) {
                width = options.getSize();
                height = options.getSize();
            }
        } else {
            double[] content = measureContainer(node);
            double padding = options.getPadding(config);
            width = content[0] + 2 * padding;
            height = content[1] + 2 * padding;
        }
        if (options.getWidth() != null) {
            width = options.getWidth();
        }
        if (options.getHeight() != null) {
            height = options.getHeight();
        }
        node.setIntrinsicSize(width, height);
        LOG.debug("Measured {} {} as {} x {}", kind.getName(), node.getName(), width, height);
    }

    private double[] measureContainer(LayoutNode node) {
        List<LayoutNode> children = node.getChildren();
        if (children.isEmpty()) {
            return new double[] {0, 0};
        }
        double gap = node.getOptions().getGap(config);
        switch (node.getKind()) {
            case ROW: {
                double main = 0;
                double cross = 0;
                for (LayoutNode child : children) {
                    main += child.getIntrinsicWidth();
                    cross = Math.max(cross, child.getIntrinsicHeight());
                }
                return new double[] {main + (children.size() - 1) * gap, cross};
            }
            case COLUMN:
            case GROUP: {
                double main = 0;
                double cross = 0;
                for (LayoutNode child : children) {
                    main += child.getIntrinsicHeight();
                    cross = Math.max(cross, child.getIntrinsicWidth());
                }
                return new double[] {cross, main + (children.size() - 1) * gap};
            }
            case STACK: {
                double width = 0;
                double height = 0;
                for (LayoutNode child : children) {
                    width = Math.max(width, child.getIntrinsicWidth());
                    height = Math.max(height, child.getIntrinsicHeight());
                }
                return new double[] {width, height};
            }
            case GRID: {
                int[] dimensions = gridDimensions(children.size(),
                        node.getOptions().getColumns(), node.getOptions().getRows());
                int columns = dimensions[0];
                int rows = dimensions[1];
                double cellWidth = 0;
                double cellHeight = 0;
                for (LayoutNode child : children) {
                    cellWidth = Math.max(cellWidth, child.getIntrinsicWidth());
                    cellHeight = Math.max(cellHeight, child.getIntrinsicHeight());
                }
                node.setGrid(columns, cellWidth, cellHeight);
                return new double[] {
                        cellWidth * columns + (columns - 1) * gap,
                        cellHeight * rows + (rows - 1) * gap};
            }
            default:
                throw new UnsupportedOperationException("Unsupported container kind: " + node.getKind());
        }
    }

    /**
     * Columns and rows of a grid holding {@code count} children. Explicit columns win over
     * explicit rows; rows grow until every child has a cell. Without either the grid is the
     * smallest square-ish arrangement: {@code ceil(sqrt(count))} columns.
     */
    static int[] gridDimensions(int count, Integer columns, Integer rows) {
        int c;
        int r;
        if (columns != null) {
            c = columns;
            r = Math.max(rows != null ? rows : 0, ceilDiv(count, c));
        } else if (rows != null) {
            r = rows;
            c = ceilDiv(count, r);
        } else {
            c = (int) Math.ceil(Math.sqrt(count));
            r = ceilDiv(count, c);
        }
        return new int[] {Math.max(c, 1), Math.max(r, 1)};
    }

    private static int ceilDiv(int a, int b) {
        return (a + b - 1) / b;
    }
}
