package gr.imsi.athenarc.illustrator.routing;

import java.util.Optional;

import gr.imsi.athenarc.illustrator.domain.Anchor;
import gr.imsi.athenarc.illustrator.domain.Box;
import gr.imsi.athenarc.illustrator.domain.Point;
import gr.imsi.athenarc.illustrator.domain.Side;
import gr.imsi.athenarc.illustrator.error.RoutingException;
import gr.imsi.athenarc.illustrator.model.EndpointRef;

/**
 * Turns endpoint references into points on node boxes.
 */
public final class AnchorResolver {

    /** Vertical placement wins when the vertical center offset exceeds the horizontal one by this factor. */
    static final double VERTICAL_BIAS = 1.5;

    private AnchorResolver() {}

    /**
     * A resolved endpoint: the point and, when the point lies on a side, that side.
     */
    public static final class Endpoint {
        private final Point point;
        private final Side side;

        Endpoint(Point point, Side side) {
            this.point = point;
            this.side = side;
        }

        public Point getPoint() {
            return point;
        }

        public Optional<Side> getSide() {
            return Optional.ofNullable(side);
        }
    }

    /**
     * Parses the anchor name of a reference.
     *
     * @return the anchor, empty when the reference has none
     * @throws RoutingException if the name is not one of the nine anchors
     */
    public static Optional<Anchor> anchorOf(EndpointRef ref) {
        if (!ref.hasAnchor()) {
            return Optional.empty();
        }
        return Optional.of(Anchor.parse(ref.getAnchor())
                .orElseThrow(() -> RoutingException.unknownAnchor(ref.getNodeId(), ref.getAnchor())));
    }

    /**
     * Resolves one endpoint. An explicit anchor is used as is; otherwise the endpoint is the
     * midpoint of the side of {@code box} that faces {@code toward}.
     */
    public static Endpoint resolve(Box box, Optional<Anchor> anchor, Box toward) {
        if (anchor.isPresent()) {
            return new Endpoint(anchor.get().pointOn(box), anchor.get().getSide().orElse(null));
        }
        Side side = facingSides(box, toward)[0];
        return new Endpoint(side.toAnchor().pointOn(box), side);
    }

    /**
     * Picks the facing sides of two boxes by comparing their center offsets. Boxes that
     * overlap on one axis only face each other across the other axis; otherwise the larger
     * offset decides, with a bias towards vertical placement.
     *
     * @return {@code [side of from, side of to]}
     */
    public static Side[] facingSides(Box from, Box to) {
        double dx = to.getCenterX() - from.getCenterX();
        double dy = to.getCenterY() - from.getCenterY();
        boolean horizontalOverlap = from.getLeft() < to.getRight() && from.getRight() > to.getLeft();
        boolean verticalOverlap = from.getTop() < to.getBottom() && from.getBottom() > to.getTop();
        boolean primarilyVertical = Math.abs(dy) > Math.abs(dx) * VERTICAL_BIAS;

        boolean vertical;
        if ((horizontalOverlap && !verticalOverlap) || primarilyVertical) {
            vertical = true;
        } else if (verticalOverlap && !horizontalOverlap) {
            vertical = false;
        } else {
            vertical = Math.abs(dx) <= Math.abs(dy);
        }
        if (vertical) {
            return dy > 0 ? new Side[] {Side.BOTTOM, Side.TOP} : new Side[] {Side.TOP, Side.BOTTOM};
        }
        return dx > 0 ? new Side[] {Side.RIGHT, Side.LEFT} : new Side[] {Side.LEFT, Side.RIGHT};
    }
}
