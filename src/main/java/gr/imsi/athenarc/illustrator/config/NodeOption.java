package gr.imsi.athenarc.illustrator.config;

import java.util.Optional;

/**
 * The closed set of option keys a node may carry.
 */
public enum NodeOption {
    SIZE("size"),
    WIDTH("width"),
    HEIGHT("height"),
    GAP("gap"),
    PADDING("padding"),
    ALIGN("align"),
    COLUMNS("columns"),
    ROWS("rows"),
    DX("dx"),
    DY("dy"),
    FILL("fill"),
    STROKE("stroke"),
    STROKE_WIDTH("stroke_width"),
    STROKE_DASHARRAY("stroke_dasharray"),
    OPACITY("opacity"),
    FONT_SIZE("font_size"),
    CLASS("class"),
    LABEL("label"),
    TEXT("text");

    private final String key;

    NodeOption(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<NodeOption> fromKey(String key) {
        for (NodeOption option : values()) {
            if (option.key.equals(key)) {
                return Optional.of(option);
            }
        }
        return Optional.empty();
    }
}
