package gr.imsi.athenarc.illustrator.lint;

import java.util.List;

import gr.imsi.athenarc.illustrator.domain.Box;
import gr.imsi.athenarc.illustrator.domain.Point;

public final class GeometryUtils {

    private GeometryUtils() {}

    /**
     * True when segment {@code a-b} passes through the interior of {@code box}. Running
     * along or touching an edge does not count.
     */
    public static boolean segmentEntersInterior(Point a, Point b, Box box) {
        double xMin = box.getLeft() + Box.EPSILON;
        double xMax = box.getRight() - Box.EPSILON;
        double yMin = box.getTop() + Box.EPSILON;
        double yMax = box.getBottom() - Box.EPSILON;
        if (xMin >= xMax || yMin >= yMax) {
            return false;
        }
        double dx = b.getX() - a.getX();
        double dy = b.getY() - a.getY();
        if (dx == 0 && dy == 0) {
            return box.containsStrictly(a);
        }
        double[] p = {-dx, dx, -dy, dy};
        double[] q = {a.getX() - xMin, xMax - a.getX(), a.getY() - yMin, yMax - a.getY()};
        double t0 = 0;
        double t1 = 1;
        for (int i = 0; i < 4; i++) {
            if (p[i] == 0) {
                if (q[i] < 0) {
                    return false;
                }
            } else {
                double r = q[i] / p[i];
                if (p[i] < 0) {
                    t0 = Math.max(t0, r);
                } else {
                    t1 = Math.min(t1, r);
                }
            }
        }
        return t0 < t1;
    }

    public static boolean polylineEntersInterior(List<Point> points, Box box) {
        for (int i = 1; i < points.size(); i++) {
            if (segmentEntersInterior(points.get(i - 1), points.get(i), box)) {
                return true;
            }
        }
        return false;
    }
}
