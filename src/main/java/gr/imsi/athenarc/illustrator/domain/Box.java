package gr.imsi.athenarc.illustrator.domain;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An immutable axis-aligned rectangle: absolute position and size of a node.
 */
public final class Box {

    /** Geometric comparisons ignore differences below this. */
    public static final double EPSILON = 1e-6;

    private final double x;
    private final double y;
    private final double width;
    private final double height;

    public Box(double x, double y, double width, double height) {
        checkArgument(width >= 0 && height >= 0, "Box size must be non-negative, got %s x %s", width, height);
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public static Box of(double x, double y, double width, double height) {
        return new Box(x, y, width, height);
    }

    public static Box sized(double width, double height) {
        return new Box(0, 0, width, height);
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double getLeft() {
        return x;
    }

    public double getRight() {
        return x + width;
    }

    public double getTop() {
        return y;
    }

    public double getBottom() {
        return y + height;
    }

    public double getCenterX() {
        return x + width / 2.0;
    }

    public double getCenterY() {
        return y + height / 2.0;
    }

    public Point getCenter() {
        return new Point(getCenterX(), getCenterY());
    }

    public Box translate(double dx, double dy) {
        return new Box(x + dx, y + dy, width, height);
    }

    public Box resize(double newWidth, double newHeight) {
        return new Box(x, y, newWidth, newHeight);
    }

    /**
     * Shrinks the box by {@code amount} on every side, never below zero size.
     */
    public Box inset(double amount) {
        double w = Math.max(0, width - 2 * amount);
        double h = Math.max(0, height - 2 * amount);
        return new Box(x + amount, y + amount, w, h);
    }

    public Box union(Box other) {
        double left = Math.min(getLeft(), other.getLeft());
        double top = Math.min(getTop(), other.getTop());
        double right = Math.max(getRight(), other.getRight());
        double bottom = Math.max(getBottom(), other.getBottom());
        return new Box(left, top, right - left, bottom - top);
    }

    /**
     * True when both boxes share a region of positive area. Touching edges do not count.
     */
    public boolean intersects(Box other) {
        double overlapX = Math.min(getRight(), other.getRight()) - Math.max(getLeft(), other.getLeft());
        double overlapY = Math.min(getBottom(), other.getBottom()) - Math.max(getTop(), other.getTop());
        return overlapX > EPSILON && overlapY > EPSILON;
    }

    /**
     * True when {@code other} lies entirely inside this box, edges included.
     */
    public boolean contains(Box other) {
        return other.getLeft() >= getLeft() - EPSILON
                && other.getTop() >= getTop() - EPSILON
                && other.getRight() <= getRight() + EPSILON
                && other.getBottom() <= getBottom() + EPSILON;
    }

    public boolean contains(Point p) {
        return p.getX() >= getLeft() - EPSILON && p.getX() <= getRight() + EPSILON
                && p.getY() >= getTop() - EPSILON && p.getY() <= getBottom() + EPSILON;
    }

    /**
     * True when {@code p} lies strictly inside, away from every edge.
     */
    public boolean containsStrictly(Point p) {
        return p.getX() > getLeft() + EPSILON && p.getX() < getRight() - EPSILON
                && p.getY() > getTop() + EPSILON && p.getY() < getBottom() - EPSILON;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Box)) return false;
        Box box = (Box) o;
        return Double.compare(box.x, x) == 0 && Double.compare(box.y, y) == 0
                && Double.compare(box.width, width) == 0 && Double.compare(box.height, height) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, width, height);
    }

    @Override
    public String toString() {
        return "Box{x=" + x + ", y=" + y + ", width=" + width + ", height=" + height + "}";
    }
}
