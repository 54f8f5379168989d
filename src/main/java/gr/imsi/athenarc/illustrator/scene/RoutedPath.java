package gr.imsi.athenarc.illustrator.scene;

import gr.imsi.athenarc.illustrator.model.ConnectionDirection;
import gr.imsi.athenarc.illustrator.routing.PathGeometry;

/**
 * A connection ready to draw.
 */
public final class RoutedPath {

    private final String name;
    private final String from;
    private final String to;
    private final ConnectionDirection direction;
    private final PathGeometry geometry;
    private final ResolvedStyle style;

    public RoutedPath(String name, String from, String to, ConnectionDirection direction,
                      PathGeometry geometry, ResolvedStyle style) {
        this.name = name;
        this.from = from;
        this.to = to;
        this.direction = direction;
        this.geometry = geometry;
        this.style = style;
    }

    public String getName() {
        return name;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    public ConnectionDirection getDirection() {
        return direction;
    }

    public PathGeometry getGeometry() {
        return geometry;
    }

    public ResolvedStyle getStyle() {
        return style;
    }

    @Override
    public String toString() {
        return name + " " + geometry;
    }
}
