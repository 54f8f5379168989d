package gr.imsi.athenarc.illustrator.routing;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.illustrator.domain.Point;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Geometry of a routed path.
 * <p>
 * A {@link Kind#POLYLINE} is the list of its vertices. A {@link Kind#QUADRATIC} path is a
 * chain of quadratic curves written {@code start, control1, end1, control2, end2, ...}; the
 * end of one curve is the start of the next.
 */
public final class PathGeometry {

    /** Segments each quadratic curve is split into when measured or tested. */
    public static final int CURVE_STEPS = 32;

    public enum Kind {
        POLYLINE,
        QUADRATIC
    }

    private final Kind kind;
    private final ImmutableList<Point> points;

    private PathGeometry(Kind kind, List<Point> points) {
        this.kind = kind;
        this.points = ImmutableList.copyOf(points);
    }

    public static PathGeometry polyline(List<Point> points) {
        checkArgument(points.size() >= 2, "A polyline needs at least two points, got %s", points.size());
        return new PathGeometry(Kind.POLYLINE, dedupe(points));
    }

    public static PathGeometry quadratic(List<Point> points) {
        checkArgument(points.size() >= 3 && points.size() % 2 == 1,
                "A quadratic chain needs start, then control/end pairs, got %s points", points.size());
        return new PathGeometry(Kind.QUADRATIC, points);
    }

    private static List<Point> dedupe(List<Point> points) {
        List<Point> out = new ArrayList<>(points.size());
        for (Point p : points) {
            if (out.isEmpty() || !out.get(out.size() - 1).equals(p)) {
                out.add(p);
            }
        }
        if (out.size() == 1) {
            out.add(out.get(0));
        }
        return out;
    }

    public Kind getKind() {
        return kind;
    }

    public ImmutableList<Point> getPoints() {
        return points;
    }

    public Point getStart() {
        return points.get(0);
    }

    public Point getEnd() {
        return points.get(points.size() - 1);
    }

    /**
     * Number of direction changes of a polyline. Curves report zero.
     */
    public int getBendCount() {
        return kind == Kind.POLYLINE ? points.size() - 2 : 0;
    }

    /**
     * @return the path as a polyline, curves sampled with {@link #CURVE_STEPS} segments each
     */
    public List<Point> flatten() {
        if (kind == Kind.POLYLINE) {
            return points;
        }
        List<Point> out = new ArrayList<>();
        out.add(points.get(0));
        for (int i = 1; i + 1 < points.size(); i += 2) {
            Point start = points.get(i - 1);
            Point control = points.get(i);
            Point end = points.get(i + 1);
            for (int step = 1; step <= CURVE_STEPS; step++) {
                out.add(quadraticAt(start, control, end, step / (double) CURVE_STEPS));
            }
        }
        return out;
    }

    static Point quadraticAt(Point p0, Point p1, Point p2, double t) {
        double u = 1 - t;
        double x = u * u * p0.getX() + 2 * u * t * p1.getX() + t * t * p2.getX();
        double y = u * u * p0.getY() + 2 * u * t * p1.getY() + t * t * p2.getY();
        return new Point(x, y);
    }

    public double getLength() {
        List<Point> flat = flatten();
        double length = 0;
        for (int i = 1; i < flat.size(); i++) {
            length += flat.get(i - 1).distanceTo(flat.get(i));
        }
        return length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PathGeometry)) return false;
        PathGeometry that = (PathGeometry) o;
        return kind == that.kind && points.equals(that.points);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + points.hashCode();
    }

    @Override
    public String toString() {
        return kind + points.toString();
    }
}
