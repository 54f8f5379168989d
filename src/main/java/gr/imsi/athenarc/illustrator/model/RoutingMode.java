package gr.imsi.athenarc.illustrator.model;

import java.util.Locale;

public enum RoutingMode {
    ORTHOGONAL,
    DIRECT,
    CURVED;

    public static RoutingMode parse(String value) {
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "orthogonal":
            case "sequential":
                return ORTHOGONAL;
            case "direct":
            case "straight":
                return DIRECT;
            case "curved":
            case "curve":
                return CURVED;
            default:
                throw new IllegalArgumentException("Unknown routing mode: " + value);
        }
    }
}
