package gr.imsi.athenarc.illustrator.config;

import java.util.Locale;
import java.util.Optional;

/**
 * Cross axis placement of children inside a container.
 */
public enum Alignment {
    START,
    CENTER,
    END;

    public static Optional<Alignment> parse(String value) {
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "start":
            case "left":
            case "top":
                return Optional.of(START);
            case "center":
            case "centre":
            case "middle":
                return Optional.of(CENTER);
            case "end":
            case "right":
            case "bottom":
                return Optional.of(END);
            default:
                return Optional.empty();
        }
    }

    /**
     * Offset of an item of size {@code extent} inside a span of size {@code available}.
     */
    public double offset(double available, double extent) {
        switch (this) {
            case CENTER:
                return (available - extent) / 2.0;
            case END:
                return available - extent;
            default:
                return 0;
        }
    }
}
