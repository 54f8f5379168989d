package gr.imsi.athenarc.illustrator.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of nodes in a diagram tree: leaf shapes and containers.
 */
public enum NodeKind {
    RECTANGLE(false),
    CIRCLE(false),
    ELLIPSE(false),
    LINE(false),
    POLYGON(false),
    ICON(false),
    TEXT(false),
    /** Sequential-horizontal container. */
    ROW(true),
    /** Sequential-vertical container. */
    COLUMN(true),
    STACK(true),
    GRID(true),
    /** Semantic grouping; arranged like {@link #COLUMN}. */
    GROUP(true);

    private final boolean container;

    NodeKind(boolean container) {
        this.container = container;
    }

    public boolean isContainer() {
        return container;
    }

    public boolean isSequential() {
        return this == ROW || this == COLUMN || this == GROUP;
    }

    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<NodeKind> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "rect":
            case "rectangle":
                return Optional.of(RECTANGLE);
            case "circle":
                return Optional.of(CIRCLE);
            case "ellipse":
                return Optional.of(ELLIPSE);
            case "line":
                return Optional.of(LINE);
            case "polygon":
                return Optional.of(POLYGON);
            case "icon":
                return Optional.of(ICON);
            case "text":
                return Optional.of(TEXT);
            case "row":
                return Optional.of(ROW);
            case "col":
            case "column":
                return Optional.of(COLUMN);
            case "stack":
                return Optional.of(STACK);
            case "grid":
                return Optional.of(GRID);
            case "group":
                return Optional.of(GROUP);
            default:
                return Optional.empty();
        }
    }
}
