package gr.imsi.athenarc.illustrator.layout;

import java.util.List;

import org.jetbrains.annotations.Nullable;

import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.illustrator.config.NodeOptions;
import gr.imsi.athenarc.illustrator.domain.Box;
import gr.imsi.athenarc.illustrator.model.NodeKind;

/**
 * A node of the geometry tree. Owns its children; holds no reference to its parent
 * (see {@link NodeIndex}). The box is assigned by the layout engine and afterwards only
 * translated, or resized on explicit request, by the constraint applicator.
 */
public class LayoutNode {

    private final int ordinal;
    private final NodeKind kind;
    private final String id;
    private final String name;
    private final NodeOptions options;
    private final ImmutableList<LayoutNode> children;

    private double intrinsicWidth;
    private double intrinsicHeight;
    private int gridColumns;
    private double cellWidth;
    private double cellHeight;
    private Box box;

    LayoutNode(int ordinal, NodeKind kind, @Nullable String id, String name,
               NodeOptions options, List<LayoutNode> children) {
        this.ordinal = ordinal;
        this.kind = kind;
        this.id = id;
        this.name = name;
        this.options = options;
        this.children = ImmutableList.copyOf(children);
    }

    /**
     * @return position of this node in a pre-order walk of the tree
     */
    public int getOrdinal() {
        return ordinal;
    }

    public NodeKind getKind() {
        return kind;
    }

    @Nullable
    public String getId() {
        return id;
    }

    /**
     * @return the identifier, or a positional name such as {@code <child #2 of row1>}
     */
    public String getName() {
        return name;
    }

    public NodeOptions getOptions() {
        return options;
    }

    public ImmutableList<LayoutNode> getChildren() {
        return children;
    }

    public boolean isLeaf() {
        return !kind.isContainer();
    }

    public double getIntrinsicWidth() {
        return intrinsicWidth;
    }

    public double getIntrinsicHeight() {
        return intrinsicHeight;
    }

    void setIntrinsicSize(double width, double height) {
        this.intrinsicWidth = width;
        this.intrinsicHeight = height;
    }

    int getGridColumns() {
        return gridColumns;
    }

    double getCellWidth() {
        return cellWidth;
    }

    double getCellHeight() {
        return cellHeight;
    }

    void setGrid(int columns, double cellWidth, double cellHeight) {
        this.gridColumns = columns;
        this.cellWidth = cellWidth;
        this.cellHeight = cellHeight;
    }

    public Box getBox() {
        if (box == null) {
            throw new IllegalStateException("Node " + name + " has not been laid out");
        }
        return box;
    }

    public void setBox(Box box) {
        this.box = box;
    }

    /**
     * Moves this node and its whole subtree by the same delta.
     */
    public void translate(double dx, double dy) {
        if (dx == 0 && dy == 0) {
            return;
        }
        box = getBox().translate(dx, dy);
        for (LayoutNode child : children) {
            child.translate(dx, dy);
        }
    }

    @Override
    public String toString() {
        return kind.getName() + " " + name + (box == null ? "" : " " + box);
    }
}
