package gr.imsi.athenarc.illustrator.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * The nine named points on a box. Anchors are computed from the box on demand.
 */
public enum Anchor {
    TOP("top"),
    BOTTOM("bottom"),
    LEFT("left"),
    RIGHT("right"),
    CENTER("center"),
    TOP_LEFT("top_left"),
    TOP_RIGHT("top_right"),
    BOTTOM_LEFT("bottom_left"),
    BOTTOM_RIGHT("bottom_right");

    private final String name;

    Anchor(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Accepts {@code top_left}, {@code top-left} and {@code topleft} spellings, any case.
     */
    public static Optional<Anchor> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        for (Anchor anchor : values()) {
            if (anchor.name.replace("_", "").equals(normalized)) {
                return Optional.of(anchor);
            }
        }
        return Optional.empty();
    }

    public Point pointOn(Box box) {
        switch (this) {
            case TOP:
                return new Point(box.getCenterX(), box.getTop());
            case BOTTOM:
                return new Point(box.getCenterX(), box.getBottom());
            case LEFT:
                return new Point(box.getLeft(), box.getCenterY());
            case RIGHT:
                return new Point(box.getRight(), box.getCenterY());
            case TOP_LEFT:
                return new Point(box.getLeft(), box.getTop());
            case TOP_RIGHT:
                return new Point(box.getRight(), box.getTop());
            case BOTTOM_LEFT:
                return new Point(box.getLeft(), box.getBottom());
            case BOTTOM_RIGHT:
                return new Point(box.getRight(), box.getBottom());
            default:
                return box.getCenter();
        }
    }

    /**
     * @return the side a route leaves through, empty for corners and the center
     */
    public Optional<Side> getSide() {
        switch (this) {
            case TOP:
                return Optional.of(Side.TOP);
            case BOTTOM:
                return Optional.of(Side.BOTTOM);
            case LEFT:
                return Optional.of(Side.LEFT);
            case RIGHT:
                return Optional.of(Side.RIGHT);
            default:
                return Optional.empty();
        }
    }
}
