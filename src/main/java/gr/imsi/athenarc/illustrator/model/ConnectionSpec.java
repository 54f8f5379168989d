package gr.imsi.athenarc.illustrator.model;

import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Nullable;

import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.illustrator.domain.Point;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A declared connection between two nodes. Connections reference nodes by identifier
 * and never change the tree.
 */
public final class ConnectionSpec {

    private final EndpointRef from;
    private final EndpointRef to;
    private final ConnectionDirection direction;
    private final RoutingMode routing;
    private final ImmutableList<Point> waypoints;
    private final ImmutableList<String> via;
    private final String label;
    private final Double labelAt;
    private final double labelOffset;
    private final Double trunk;
    private final String stroke;
    private final Double strokeWidth;
    private final String strokeDasharray;
    private final Double opacity;
    private final Double fontSize;
    private final String cssClass;

    private ConnectionSpec(Builder builder) {
        this.from = builder.from;
        this.to = builder.to;
        this.direction = builder.direction;
        this.routing = builder.routing;
        this.waypoints = builder.waypoints.build();
        this.via = builder.via.build();
        this.label = builder.label;
        this.labelAt = builder.labelAt;
        this.labelOffset = builder.labelOffset;
        this.trunk = builder.trunk;
        this.stroke = builder.stroke;
        this.strokeWidth = builder.strokeWidth;
        this.strokeDasharray = builder.strokeDasharray;
        this.opacity = builder.opacity;
        this.fontSize = builder.fontSize;
        this.cssClass = builder.cssClass;
    }

    public static Builder builder(EndpointRef from, EndpointRef to) {
        return new Builder(from, to);
    }

    public static Builder builder(String from, String to) {
        return new Builder(EndpointRef.parse(from), EndpointRef.parse(to));
    }

    public EndpointRef getFrom() {
        return from;
    }

    public EndpointRef getTo() {
        return to;
    }

    public ConnectionDirection getDirection() {
        return direction;
    }

    public RoutingMode getRouting() {
        return routing;
    }

    public ImmutableList<Point> getWaypoints() {
        return waypoints;
    }

    public ImmutableList<String> getVia() {
        return via;
    }

    @Nullable
    public String getLabel() {
        return label;
    }

    @Nullable
    public Double getLabelAt() {
        return labelAt;
    }

    public double getLabelOffset() {
        return labelOffset;
    }

    @Nullable
    public Double getTrunk() {
        return trunk;
    }

    @Nullable
    public String getStroke() {
        return stroke;
    }

    @Nullable
    public Double getStrokeWidth() {
        return strokeWidth;
    }

    @Nullable
    public String getStrokeDasharray() {
        return strokeDasharray;
    }

    @Nullable
    public Double getOpacity() {
        return opacity;
    }

    @Nullable
    public Double getFontSize() {
        return fontSize;
    }

    @Nullable
    public String getCssClass() {
        return cssClass;
    }

    /**
     * Human readable name used in errors and diagnostics, e.g. {@code a -> b.top}.
     */
    public String getDisplayName() {
        String arrow;
        switch (direction) {
            case BACKWARD:
                arrow = " <- ";
                break;
            case BIDIRECTIONAL:
                arrow = " <-> ";
                break;
            case UNDIRECTED:
                arrow = " -- ";
                break;
            default:
                arrow = " -> ";
        }
        return from + arrow + to;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConnectionSpec)) return false;
        ConnectionSpec that = (ConnectionSpec) o;
        return Double.compare(that.labelOffset, labelOffset) == 0
                && from.equals(that.from) && to.equals(that.to)
                && direction == that.direction && routing == that.routing
                && waypoints.equals(that.waypoints) && via.equals(that.via)
                && Objects.equals(label, that.label) && Objects.equals(labelAt, that.labelAt)
                && Objects.equals(trunk, that.trunk) && Objects.equals(stroke, that.stroke)
                && Objects.equals(strokeWidth, that.strokeWidth)
                && Objects.equals(strokeDasharray, that.strokeDasharray)
                && Objects.equals(opacity, that.opacity) && Objects.equals(fontSize, that.fontSize)
                && Objects.equals(cssClass, that.cssClass);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, direction, routing, waypoints, via, label, labelAt, labelOffset, trunk);
    }

    @Override
    public String toString() {
        return getDisplayName();
    }

    public static class Builder {
        private final EndpointRef from;
        private final EndpointRef to;
        private ConnectionDirection direction = ConnectionDirection.FORWARD;
        private RoutingMode routing = RoutingMode.ORTHOGONAL;
        private final ImmutableList.Builder<Point> waypoints = ImmutableList.builder();
        private final ImmutableList.Builder<String> via = ImmutableList.builder();
        private String label;
        private Double labelAt;
        private double labelOffset;
        private Double trunk;
        private String stroke;
        private Double strokeWidth;
        private String strokeDasharray;
        private Double opacity;
        private Double fontSize;
        private String cssClass;

        private Builder(EndpointRef from, EndpointRef to) {
            this.from = checkNotNull(from, "from");
            this.to = checkNotNull(to, "to");
        }

        public Builder direction(ConnectionDirection direction) {
            this.direction = checkNotNull(direction);
            return this;
        }

        public Builder routing(RoutingMode routing) {
            this.routing = checkNotNull(routing);
            return this;
        }

        public Builder waypoint(double x, double y) {
            waypoints.add(new Point(x, y));
            return this;
        }

        public Builder waypoints(List<Point> points) {
            waypoints.addAll(points);
            return this;
        }

        public Builder via(String nodeId) {
            via.add(nodeId);
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder labelAt(double fraction) {
            this.labelAt = fraction;
            return this;
        }

        public Builder labelOffset(double offset) {
            this.labelOffset = offset;
            return this;
        }

        public Builder trunk(double coordinate) {
            this.trunk = coordinate;
            return this;
        }

        public Builder stroke(String stroke) {
            this.stroke = stroke;
            return this;
        }

        public Builder strokeWidth(double strokeWidth) {
            this.strokeWidth = strokeWidth;
            return this;
        }

        public Builder strokeDasharray(String strokeDasharray) {
            this.strokeDasharray = strokeDasharray;
            return this;
        }

        public Builder opacity(double opacity) {
            this.opacity = opacity;
            return this;
        }

        public Builder fontSize(double fontSize) {
            this.fontSize = fontSize;
            return this;
        }

        public Builder cssClass(String cssClass) {
            this.cssClass = cssClass;
            return this;
        }

        public ConnectionSpec build() {
            return new ConnectionSpec(this);
        }
    }
}
