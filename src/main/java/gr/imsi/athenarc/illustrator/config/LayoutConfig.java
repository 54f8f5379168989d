package gr.imsi.athenarc.illustrator.config;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import com.google.common.collect.ImmutableMap;

import gr.imsi.athenarc.illustrator.domain.Box;
import gr.imsi.athenarc.illustrator.domain.Point;
import gr.imsi.athenarc.illustrator.model.NodeKind;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Engine wide layout defaults. Immutable; create with {@link #builder()}, {@link #defaults()}
 * or {@link #fromProperties(Properties)}.
 */
public class LayoutConfig {

    public static final String PREFIX = "layout.";

    private double gap;
    private double padding;
    private Alignment alignment;
    private double fontSize;
    private double textWidthFactor;
    private double textHeightFactor;
    private double labelWidthFactor;
    private double curveOffsetFraction;
    private ImmutableMap<NodeKind, Box> defaultSizes;
    private Point origin;

    private LayoutConfig() {}

    public static Builder builder() {
        return new Builder();
    }

    public static LayoutConfig defaults() {
        return builder().build();
    }

    /**
     * Reads {@code layout.*} keys, e.g. {@code layout.gap=10} or {@code layout.size.rectangle=80x30}.
     * Missing keys keep their defaults.
     */
    public static LayoutConfig fromProperties(Properties properties) {
        Builder builder = builder();
        String value;
        if ((value = properties.getProperty(PREFIX + "gap")) != null) {
            builder.gap(Double.parseDouble(value.trim()));
        }
        if ((value = properties.getProperty(PREFIX + "padding")) != null) {
            builder.padding(Double.parseDouble(value.trim()));
        }
        if ((value = properties.getProperty(PREFIX + "align")) != null) {
            String align = value;
            builder.alignment(Alignment.parse(align)
                    .orElseThrow(() -> new IllegalArgumentException("Unsupported alignment: " + align)));
        }
        if ((value = properties.getProperty(PREFIX + "origin")) != null) {
            String[] parts = value.split(",");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Expected X,Y for origin, got " + value);
            }
            builder.origin(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()));
        }
        if ((value = properties.getProperty(PREFIX + "font-size")) != null) {
            builder.fontSize(Double.parseDouble(value.trim()));
        }
        if ((value = properties.getProperty(PREFIX + "text-width-factor")) != null) {
            builder.textWidthFactor(Double.parseDouble(value.trim()));
        }
        if ((value = properties.getProperty(PREFIX + "text-height-factor")) != null) {
            builder.textHeightFactor(Double.parseDouble(value.trim()));
        }
        if ((value = properties.getProperty(PREFIX + "label-width-factor")) != null) {
            builder.labelWidthFactor(Double.parseDouble(value.trim()));
        }
        if ((value = properties.getProperty(PREFIX + "curve-offset")) != null) {
            builder.curveOffsetFraction(Double.parseDouble(value.trim()));
        }
        for (NodeKind kind : NodeKind.values()) {
            if (kind.isContainer()) {
                continue;
            }
            value = properties.getProperty(PREFIX + "size." + kind.getName());
            if (value != null) {
                String[] parts = value.toLowerCase(Locale.ROOT).split("x");
                if (parts.length != 2) {
                    throw new IllegalArgumentException("Expected WIDTHxHEIGHT for " + kind.getName() + ", got " + value);
                }
                builder.defaultSize(kind, Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()));
            }
        }
        return builder.build();
    }

    public static class Builder {
        private double gap = 10;
        private double padding = 0;
        private Alignment alignment = Alignment.START;
        private double fontSize = 14;
        private double textWidthFactor = 0.6;
        private double textHeightFactor = 1.4;
        private double labelWidthFactor = 0.5;
        private double curveOffsetFraction = 0.25;
        private final Map<NodeKind, Box> defaultSizes = new EnumMap<>(NodeKind.class);
        private Point origin = new Point(0, 0);

        private Builder() {
            defaultSizes.put(NodeKind.RECTANGLE, Box.sized(80, 30));
            defaultSizes.put(NodeKind.CIRCLE, Box.sized(50, 50));
            defaultSizes.put(NodeKind.ELLIPSE, Box.sized(80, 45));
            defaultSizes.put(NodeKind.LINE, Box.sized(80, 4));
            defaultSizes.put(NodeKind.POLYGON, Box.sized(80, 30));
            defaultSizes.put(NodeKind.ICON, Box.sized(80, 30));
            defaultSizes.put(NodeKind.TEXT, Box.sized(0, 0));
        }

        public Builder gap(double gap) {
            this.gap = gap;
            return this;
        }

        public Builder padding(double padding) {
            this.padding = padding;
            return this;
        }

        public Builder alignment(Alignment alignment) {
            this.alignment = alignment;
            return this;
        }

        public Builder fontSize(double fontSize) {
            this.fontSize = fontSize;
            return this;
        }

        public Builder textWidthFactor(double textWidthFactor) {
            this.textWidthFactor = textWidthFactor;
            return this;
        }

        public Builder textHeightFactor(double textHeightFactor) {
            this.textHeightFactor = textHeightFactor;
            return this;
        }

        public Builder labelWidthFactor(double labelWidthFactor) {
            this.labelWidthFactor = labelWidthFactor;
            return this;
        }

        public Builder curveOffsetFraction(double curveOffsetFraction) {
            this.curveOffsetFraction = curveOffsetFraction;
            return this;
        }

        public Builder origin(double x, double y) {
            this.origin = new Point(x, y);
            return this;
        }

        public Builder defaultSize(NodeKind kind, double width, double height) {
            checkArgument(!kind.isContainer(), "Containers are sized by their children, not by default: %s", kind);
            defaultSizes.put(kind, Box.sized(width, height));
            return this;
        }

        public LayoutConfig build() {
            checkArgument(gap >= 0, "gap must be non-negative, got %s", gap);
            checkArgument(padding >= 0, "padding must be non-negative, got %s", padding);
            checkArgument(fontSize > 0, "font size must be positive, got %s", fontSize);
            LayoutConfig config = new LayoutConfig();
            config.gap = this.gap;
            config.padding = this.padding;
            config.alignment = this.alignment;
            config.fontSize = this.fontSize;
            config.textWidthFactor = this.textWidthFactor;
            config.textHeightFactor = this.textHeightFactor;
            config.labelWidthFactor = this.labelWidthFactor;
            config.curveOffsetFraction = this.curveOffsetFraction;
            config.defaultSizes = ImmutableMap.copyOf(this.defaultSizes);
            config.origin = this.origin;
            return config;
        }
    }

    public double getGap() { return gap; }
    public double getPadding() { return padding; }
    public Alignment getAlignment() { return alignment; }
    public double getFontSize() { return fontSize; }
    public double getTextWidthFactor() { return textWidthFactor; }
    public double getTextHeightFactor() { return textHeightFactor; }
    public double getLabelWidthFactor() { return labelWidthFactor; }
    public double getCurveOffsetFraction() { return curveOffsetFraction; }
    public Point getOrigin() { return origin; }

    /**
     * @return the default size of a leaf kind as a box at the origin
     */
    public Box getDefaultSize(NodeKind kind) {
        Box size = defaultSizes.get(kind);
        if (size == null) {
            throw new IllegalArgumentException("No default size for kind: " + kind);
        }
        return size;
    }
}
