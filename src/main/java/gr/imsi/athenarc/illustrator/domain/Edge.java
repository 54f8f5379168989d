package gr.imsi.athenarc.illustrator.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * A constrainable edge of a box. Position edges move the box, size edges resize it.
 */
public enum Edge {
    LEFT,
    RIGHT,
    TOP,
    BOTTOM,
    CENTER_X,
    CENTER_Y,
    WIDTH,
    HEIGHT;

    /**
     * Parses an edge name. {@code x} and {@code y} are aliases of {@code left} and {@code top};
     * {@code center_x}, {@code centerX} and {@code center-x} are all accepted.
     */
    public static Optional<Edge> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        switch (normalized) {
            case "left":
            case "x":
                return Optional.of(LEFT);
            case "right":
                return Optional.of(RIGHT);
            case "top":
            case "y":
                return Optional.of(TOP);
            case "bottom":
                return Optional.of(BOTTOM);
            case "centerx":
                return Optional.of(CENTER_X);
            case "centery":
                return Optional.of(CENTER_Y);
            case "width":
                return Optional.of(WIDTH);
            case "height":
                return Optional.of(HEIGHT);
            default:
                return Optional.empty();
        }
    }

    public boolean isSize() {
        return this == WIDTH || this == HEIGHT;
    }

    public boolean isHorizontal() {
        return this == LEFT || this == RIGHT || this == CENTER_X || this == WIDTH;
    }

    public double valueOf(Box box) {
        switch (this) {
            case LEFT:
                return box.getLeft();
            case RIGHT:
                return box.getRight();
            case TOP:
                return box.getTop();
            case BOTTOM:
                return box.getBottom();
            case CENTER_X:
                return box.getCenterX();
            case CENTER_Y:
                return box.getCenterY();
            case WIDTH:
                return box.getWidth();
            default:
                return box.getHeight();
        }
    }

    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
