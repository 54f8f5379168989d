package gr.imsi.athenarc.illustrator.scene;

import java.util.regex.Pattern;

import org.jetbrains.annotations.Nullable;

import gr.imsi.athenarc.illustrator.config.MapStylesheet;
import gr.imsi.athenarc.illustrator.config.NodeOptions;
import gr.imsi.athenarc.illustrator.config.Stylesheet;
import gr.imsi.athenarc.illustrator.model.ConnectionSpec;

/**
 * Resolves node and connection styles against a stylesheet.
 * <p>
 * A color written as a symbolic token ({@code accent-1}, {@code text-dark}, ...) is looked
 * up in the stylesheet, then in the default palette, then falls back to its category's
 * default. Any other color value is used as written.
 */
public class StyleResolver {

    public static final String DEFAULT_FILL = "#f0f0f0";
    public static final String DEFAULT_STROKE = "#333333";
    public static final String NO_FILL = "none";
    public static final double DEFAULT_STROKE_WIDTH = 2;

    private static final Pattern SYMBOLIC =
            Pattern.compile("^(foreground|background|text|accent|secondary|status)(-[a-z0-9]+)*$");

    private final Stylesheet stylesheet;

    public StyleResolver(Stylesheet stylesheet) {
        this.stylesheet = stylesheet;
    }

    public ResolvedStyle forShape(NodeOptions options) {
        return new ResolvedStyle(
                color(options.getFill(), DEFAULT_FILL),
                color(options.getStroke(), DEFAULT_STROKE),
                options.getStrokeWidth() != null ? options.getStrokeWidth() : DEFAULT_STROKE_WIDTH,
                dashArray(options.getStrokeDasharray()),
                options.getOpacity(),
                options.getCssClass());
    }

    /**
     * Containers are drawn only with the fill and stroke they declare.
     */
    public ResolvedStyle forContainer(NodeOptions options) {
        return new ResolvedStyle(
                color(options.getFill(), NO_FILL),
                color(options.getStroke(), NO_FILL),
                options.getStrokeWidth() != null ? options.getStrokeWidth() : (options.getStroke() != null ? DEFAULT_STROKE_WIDTH : 0),
                dashArray(options.getStrokeDasharray()),
                options.getOpacity(),
                options.getCssClass());
    }

    public ResolvedStyle forConnection(ConnectionSpec connection) {
        return new ResolvedStyle(
                NO_FILL,
                color(connection.getStroke(), DEFAULT_STROKE),
                connection.getStrokeWidth() != null ? connection.getStrokeWidth() : DEFAULT_STROKE_WIDTH,
                dashArray(connection.getStrokeDasharray()),
                connection.getOpacity() != null ? connection.getOpacity() : 1.0,
                connection.getCssClass());
    }

    public String textColor() {
        return color("text-1", DEFAULT_STROKE);
    }

    /**
     * @param value color as written, may be null
     * @param fallback used when {@code value} is null
     */
    public String color(@Nullable String value, String fallback) {
        if (value == null) {
            return fallback;
        }
        String trimmed = value.trim();
        if (!SYMBOLIC.matcher(trimmed).matches()) {
            return trimmed;
        }
        return stylesheet.lookup(trimmed)
                .or(() -> MapStylesheet.defaultPalette().lookup(trimmed))
                .orElseGet(() -> categoryDefault(trimmed));
    }

    private static String categoryDefault(String token) {
        if (token.startsWith("background")) {
            return "#ffffff";
        }
        if (token.startsWith("accent")) {
            return "#2196f3";
        }
        if (token.startsWith("secondary")) {
            return "#ff9800";
        }
        if (token.startsWith("status")) {
            return "#666666";
        }
        return "#333333";
    }

    @Nullable
    static String dashArray(@Nullable String value) {
        if (value == null) {
            return null;
        }
        switch (value.trim()) {
            case "dashed":
                return "8,4";
            case "dotted":
                return "2,2";
            case "solid":
            case "none":
                return null;
            default:
                return value.trim();
        }
    }
}
