package gr.imsi.athenarc.illustrator.layout;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.illustrator.config.Alignment;
import gr.imsi.athenarc.illustrator.config.LayoutConfig;
import gr.imsi.athenarc.illustrator.config.NodeOptions;
import gr.imsi.athenarc.illustrator.domain.Box;
import gr.imsi.athenarc.illustrator.domain.Point;

/**
 * Arrange pass: assigns absolute boxes top-down to a measured geometry tree.
 * <p>
 * Sequential containers place children one after the other from the padded origin, each
 * advancing by its own size plus the gap; the cross axis follows the alignment. Stacked
 * children share the padded origin. Grid children fill uniform cells row by row. A node's
 * {@code dx}/{@code dy} offset is added after its normal position is known and moves its
 * subtree only.
 */
public class LayoutEngine {

    private static final Logger LOG = LoggerFactory.getLogger(LayoutEngine.class);

    private final LayoutConfig config;

    public LayoutEngine(LayoutConfig config) {
        this.config = config;
    }

    public void arrange(LayoutNode root) {
        arrange(root, config.getOrigin());
    }

    /**
     * @param root measured root
     * @param origin where the root's top left corner goes before its own offset
     */
    public void arrange(LayoutNode root, Point origin) {
        place(root, origin.getX(), origin.getY());
        LOG.debug("Arranged root {} at {}", root.getName(), root.getBox());
    }

    private void place(LayoutNode node, double x, double y) {
        NodeOptions options = node.getOptions();
        node.setBox(Box.of(x + options.getDx(), y + options.getDy(),
                node.getIntrinsicWidth(), node.getIntrinsicHeight()));
        if (node.getChildren().isEmpty()) {
            return;
        }
        Box content = node.getBox().inset(options.getPadding(config));
        double gap = options.getGap(config);
        Alignment align = options.getAlign(config);
        List<LayoutNode> children = node.getChildren();

        switch (node.getKind()) {
            case ROW: {
                double cursor = content.getLeft();
                for (LayoutNode child : children) {
                    double cy = content.getTop() + align.offset(content.getHeight(), child.getIntrinsicHeight());
                    place(child, cursor, cy);
                    cursor += child.getIntrinsicWidth() + gap;
                }
                break;
            }
            case COLUMN:
            case GROUP: {
                double cursor = content.getTop();
                for (LayoutNode child : children) {
                    double cx = content.getLeft() + align.offset(content.getWidth(), child.getIntrinsicWidth());
                    place(child, cx, cursor);
                    cursor += child.getIntrinsicHeight() + gap;
                }
                break;
            }
            case STACK:
                for (LayoutNode child : children) {
                    place(child,
                            content.getLeft() + align.offset(content.getWidth(), child.getIntrinsicWidth()),
                            content.getTop() + align.offset(content.getHeight(), child.getIntrinsicHeight()));
                }
                break;
            case GRID: {
                int columns = node.getGridColumns();
                double cellWidth = node.getCellWidth();
                double cellHeight = node.getCellHeight();
                for (int i = 0; i < children.size(); i++) {
                    LayoutNode child = children.get(i);
                    int column = i % columns;
                    int row = i / columns;
                    double cellX = content.getLeft() + column * (cellWidth + gap);
                    double cellY = content.getTop() + row * (cellHeight + gap);
                    place(child,
                            cellX + align.offset(cellWidth, child.getIntrinsicWidth()),
                            cellY + align.offset(cellHeight, child.getIntrinsicHeight()));
                }
                break;
            }
            default:
                throw new UnsupportedOperationException("Unsupported container kind: " + node.getKind());
        }
    }
}
