package gr.imsi.athenarc.illustrator.routing;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.illustrator.config.LayoutConfig;
import gr.imsi.athenarc.illustrator.domain.Anchor;
import gr.imsi.athenarc.illustrator.domain.Box;
import gr.imsi.athenarc.illustrator.domain.Point;
import gr.imsi.athenarc.illustrator.domain.Side;
import gr.imsi.athenarc.illustrator.error.RoutingException;
import gr.imsi.athenarc.illustrator.layout.LayoutNode;
import gr.imsi.athenarc.illustrator.layout.NodeIndex;
import gr.imsi.athenarc.illustrator.layout.TextMetrics;
import gr.imsi.athenarc.illustrator.model.ConnectionSpec;
import gr.imsi.athenarc.illustrator.model.EndpointRef;

/**
 * Routes every declared connection over the final node boxes.
 * <p>
 * Orthogonal routes are axis aligned with at most two bends, bending halfway across the
 * gap between the boxes; routes that share an endpoint side converge on a common trunk
 * (see {@link TrunkPlanner}). Direct routes are straight segments. Curved routes are
 * quadratic curves whose control point sits off the chord midpoint. Routing only reads
 * node boxes.
 */
public class ConnectionRouter {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionRouter.class);

    private final LayoutConfig config;
    private final TrunkPlanner trunkPlanner;

    public ConnectionRouter(LayoutConfig config) {
        this(config, new TrunkPlanner());
    }

    public ConnectionRouter(LayoutConfig config, TrunkPlanner trunkPlanner) {
        this.config = config;
        this.trunkPlanner = trunkPlanner;
    }

    /**
     * @return one route per connection, in declaration order
     * @throws RoutingException on an unknown anchor, an unresolved endpoint or a label position outside [0, 1]
     */
    public List<Route> route(NodeIndex index, List<ConnectionSpec> connections) {
        List<Pending> pending = new ArrayList<>(connections.size());
        List<TrunkPlanner.Leg> legs = new ArrayList<>();
        for (ConnectionSpec connection : connections) {
            Pending p = prepare(index, connection);
            if (p.leg != null) {
                p.legIndex = legs.size();
                legs.add(p.leg);
            }
            pending.add(p);
        }

        double[] trunks = trunkPlanner.plan(legs);

        ImmutableList.Builder<Route> routes = ImmutableList.builder();
        for (Pending p : pending) {
            PathGeometry path = p.path != null ? p.path : twoBend(p.start, p.end, p.leg.isHorizontal(), trunks[p.legIndex]);
            routes.add(withLabel(p, path));
            LOG.debug("Routed {} as {}", p.connection.getDisplayName(), path);
        }
        return routes.build();
    }

    private Pending prepare(NodeIndex index, ConnectionSpec connection) {
        Double labelAt = connection.getLabelAt();
        if (labelAt != null && (labelAt < 0 || labelAt > 1 || labelAt.isNaN())) {
            throw RoutingException.invalidLabelPosition(connection.getDisplayName(), labelAt);
        }
        LayoutNode source = endpointNode(index, connection.getFrom(), connection);
        LayoutNode target = endpointNode(index, connection.getTo(), connection);
        Optional<Anchor> sourceAnchor = AnchorResolver.anchorOf(connection.getFrom());
        Optional<Anchor> targetAnchor = AnchorResolver.anchorOf(connection.getTo());

        List<Point> waypoints = new ArrayList<>(connection.getWaypoints());
        for (String via : connection.getVia()) {
            LayoutNode node = index.find(via)
                    .orElseThrow(() -> RoutingException.unresolvedEndpoint(via, connection.getDisplayName()));
            waypoints.add(node.getBox().getCenter());
        }

        Box sourceBox = source.getBox();
        Box targetBox = target.getBox();
        Box sourceToward = waypoints.isEmpty() ? targetBox : pointBox(waypoints.get(0));
        Box targetToward = waypoints.isEmpty() ? sourceBox : pointBox(waypoints.get(waypoints.size() - 1));
        AnchorResolver.Endpoint start = AnchorResolver.resolve(sourceBox, sourceAnchor, sourceToward);
        AnchorResolver.Endpoint end = AnchorResolver.resolve(targetBox, targetAnchor, targetToward);

        Pending p = new Pending(connection, source, target, start.getPoint(), end.getPoint());
        switch (connection.getRouting()) {
            case DIRECT:
                p.path = PathGeometry.polyline(concat(start.getPoint(), waypoints, end.getPoint()));
                break;
            case CURVED:
                p.path = curve(start.getPoint(), waypoints, end.getPoint());
                break;
            default:
                if (!waypoints.isEmpty()) {
                    p.path = orthogonalThrough(concat(start.getPoint(), waypoints, end.getPoint()));
                } else {
                    planOrthogonal(p, start, end);
                }
        }
        return p;
    }

    private static LayoutNode endpointNode(NodeIndex index, EndpointRef ref, ConnectionSpec connection) {
        return index.find(ref.getNodeId())
                .orElseThrow(() -> RoutingException.unresolvedEndpoint(ref.getNodeId(), connection.getDisplayName()));
    }

    private static Box pointBox(Point p) {
        return Box.of(p.getX(), p.getY(), 0, 0);
    }

    private static List<Point> concat(Point start, List<Point> middle, Point end) {
        List<Point> points = new ArrayList<>(middle.size() + 2);
        points.add(start);
        points.addAll(middle);
        points.add(end);
        return points;
    }

    /**
     * Straight, L-shaped, or two-bend route. Two-bend routes are left for the trunk planner.
     */
    private void planOrthogonal(Pending p, AnchorResolver.Endpoint start, AnchorResolver.Endpoint end) {
        Point s = start.getPoint();
        Point e = end.getPoint();
        boolean alignedX = Math.abs(s.getX() - e.getX()) < Box.EPSILON;
        boolean alignedY = Math.abs(s.getY() - e.getY()) < Box.EPSILON;
        if (alignedX || alignedY) {
            p.path = PathGeometry.polyline(List.of(s, e));
            return;
        }
        boolean sourceHorizontal = start.getSide().map(Side::isHorizontal).orElse(dominantHorizontal(s, e));
        boolean targetHorizontal = end.getSide().map(Side::isHorizontal).orElse(dominantHorizontal(s, e));
        if (sourceHorizontal && !targetHorizontal) {
            p.path = PathGeometry.polyline(List.of(s, new Point(e.getX(), s.getY()), e));
        } else if (!sourceHorizontal && targetHorizontal) {
            p.path = PathGeometry.polyline(List.of(s, new Point(s.getX(), e.getY()), e));
        } else {
            String sourceKey = p.source.getName() + "." + start.getSide().map(Enum::name).orElse("*");
            String targetKey = p.target.getName() + "." + end.getSide().map(Enum::name).orElse("*");
            p.leg = new TrunkPlanner.Leg(sourceKey, targetKey, s, e, sourceHorizontal, p.connection.getTrunk());
        }
    }

    private static boolean dominantHorizontal(Point s, Point e) {
        return Math.abs(e.getX() - s.getX()) >= Math.abs(e.getY() - s.getY());
    }

    private static PathGeometry twoBend(Point s, Point e, boolean horizontal, double trunk) {
        if (horizontal) {
            return PathGeometry.polyline(List.of(s, new Point(trunk, s.getY()), new Point(trunk, e.getY()), e));
        }
        return PathGeometry.polyline(List.of(s, new Point(s.getX(), trunk), new Point(e.getX(), trunk), e));
    }

    /**
     * Axis aligned hops through every point, horizontal first.
     */
    private static PathGeometry orthogonalThrough(List<Point> points) {
        List<Point> out = new ArrayList<>();
        out.add(points.get(0));
        for (int i = 1; i < points.size(); i++) {
            Point from = points.get(i - 1);
            Point to = points.get(i);
            if (Math.abs(from.getX() - to.getX()) >= Box.EPSILON && Math.abs(from.getY() - to.getY()) >= Box.EPSILON) {
                out.add(new Point(to.getX(), from.getY()));
            }
            out.add(to);
        }
        return PathGeometry.polyline(out);
    }

    /**
     * Quadratic route. Without waypoints the control point is the chord midpoint moved
     * perpendicular to the chord by a fixed fraction of its length; one waypoint is the
     * control point; several waypoints become chained curves joined halfway between them.
     */
    PathGeometry curve(Point start, List<Point> waypoints, Point end) {
        if (waypoints.isEmpty()) {
            return PathGeometry.quadratic(List.of(start, controlPoint(start, end), end));
        }
        List<Point> points = new ArrayList<>();
        points.add(start);
        for (int i = 0; i < waypoints.size(); i++) {
            points.add(waypoints.get(i));
            if (i < waypoints.size() - 1) {
                points.add(waypoints.get(i).midpoint(waypoints.get(i + 1)));
            }
        }
        points.add(end);
        return PathGeometry.quadratic(points);
    }

    Point controlPoint(Point start, Point end) {
        double chordX = end.getX() - start.getX();
        double chordY = end.getY() - start.getY();
        double length = Math.hypot(chordX, chordY);
        if (length < Box.EPSILON) {
            return start;
        }
        double offset = length * config.getCurveOffsetFraction();
        Point mid = start.midpoint(end);
        return mid.translate(-chordY / length * offset, chordX / length * offset);
    }

    private Route withLabel(Pending p, PathGeometry path) {
        ConnectionSpec connection = p.connection;
        if (connection.getLabel() == null) {
            return new Route(connection, p.source, p.target, path, null, null);
        }
        double fraction = connection.getLabelAt() != null ? connection.getLabelAt() : LabelPlacer.DEFAULT_POSITION;
        Point position = LabelPlacer.place(path, fraction, connection.getLabelOffset());
        double fontSize = connection.getFontSize() != null ? connection.getFontSize() : config.getFontSize();
        Box box = TextMetrics.labelBox(connection.getLabel(), fontSize, position, config);
        return new Route(connection, p.source, p.target, path, position, box);
    }

    private static final class Pending {
        private final ConnectionSpec connection;
        private final LayoutNode source;
        private final LayoutNode target;
        private final Point start;
        private final Point end;
        private PathGeometry path;
        private TrunkPlanner.Leg leg;
        private int legIndex = -1;

        Pending(ConnectionSpec connection, LayoutNode source, LayoutNode target, Point start, Point end) {
            this.connection = connection;
            this.source = source;
            this.target = target;
            this.start = start;
            this.end = end;
        }
    }
}
