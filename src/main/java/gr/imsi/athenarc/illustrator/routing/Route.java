package gr.imsi.athenarc.illustrator.routing;

import org.jetbrains.annotations.Nullable;

import gr.imsi.athenarc.illustrator.domain.Box;
import gr.imsi.athenarc.illustrator.domain.Point;
import gr.imsi.athenarc.illustrator.layout.LayoutNode;
import gr.imsi.athenarc.illustrator.model.ConnectionSpec;

/**
 * The routed geometry of one connection, with its label placement if it has a label.
 */
public final class Route {

    private final ConnectionSpec connection;
    private final LayoutNode source;
    private final LayoutNode target;
    private final PathGeometry path;
    private final Point labelPosition;
    private final Box labelBox;

    public Route(ConnectionSpec connection, LayoutNode source, LayoutNode target, PathGeometry path,
                 @Nullable Point labelPosition, @Nullable Box labelBox) {
        this.connection = connection;
        this.source = source;
        this.target = target;
        this.path = path;
        this.labelPosition = labelPosition;
        this.labelBox = labelBox;
    }

    public ConnectionSpec getConnection() {
        return connection;
    }

    public LayoutNode getSource() {
        return source;
    }

    public LayoutNode getTarget() {
        return target;
    }

    public PathGeometry getPath() {
        return path;
    }

    @Nullable
    public Point getLabelPosition() {
        return labelPosition;
    }

    @Nullable
    public Box getLabelBox() {
        return labelBox;
    }

    @Override
    public String toString() {
        return connection.getDisplayName() + " " + path;
    }
}
