package gr.imsi.athenarc.illustrator.routing;

import java.util.List;

import gr.imsi.athenarc.illustrator.domain.Point;

/**
 * Places a label along a path by arc length.
 */
public final class LabelPlacer {

    public static final double DEFAULT_POSITION = 0.5;

    private LabelPlacer() {}

    /**
     * Point at {@code fraction} of the path's arc length, moved {@code offset} along the
     * normal of the local tangent. Positive offsets go to the right of the travel direction
     * (y grows downwards, so travelling east the right side is south).
     *
     * @param path routed path
     * @param fraction position in [0, 1]
     * @param offset perpendicular displacement
     */
    public static Point place(PathGeometry path, double fraction, double offset) {
        List<Point> points = path.flatten();
        double total = path.getLength();
        if (total == 0) {
            return points.get(0);
        }
        double wanted = total * fraction;
        double walked = 0;
        for (int i = 1; i < points.size(); i++) {
            Point a = points.get(i - 1);
            Point b = points.get(i);
            double length = a.distanceTo(b);
            if (length == 0) {
                continue;
            }
            boolean last = i == points.size() - 1;
            if (walked + length >= wanted || last) {
                double t = Math.min(1.0, Math.max(0.0, (wanted - walked) / length));
                Point on = a.lerp(b, t);
                if (offset == 0) {
                    return on;
                }
                double tx = (b.getX() - a.getX()) / length;
                double ty = (b.getY() - a.getY()) / length;
                return on.translate(-ty * offset, tx * offset);
            }
            walked += length;
        }
        return points.get(points.size() - 1);
    }
}
