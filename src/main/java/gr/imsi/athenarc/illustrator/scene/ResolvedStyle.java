package gr.imsi.athenarc.illustrator.scene;

import java.util.Objects;

import org.jetbrains.annotations.Nullable;

/**
 * Concrete style of a scene element. Colors are final values, never symbolic names.
 */
public final class ResolvedStyle {

    private final String fill;
    private final String stroke;
    private final double strokeWidth;
    private final String strokeDasharray;
    private final double opacity;
    private final String cssClass;

    public ResolvedStyle(String fill, String stroke, double strokeWidth,
                         @Nullable String strokeDasharray, double opacity, @Nullable String cssClass) {
        this.fill = fill;
        this.stroke = stroke;
        this.strokeWidth = strokeWidth;
        this.strokeDasharray = strokeDasharray;
        this.opacity = opacity;
        this.cssClass = cssClass;
    }

    public String getFill() {
        return fill;
    }

    public String getStroke() {
        return stroke;
    }

    public double getStrokeWidth() {
        return strokeWidth;
    }

    @Nullable
    public String getStrokeDasharray() {
        return strokeDasharray;
    }

    public double getOpacity() {
        return opacity;
    }

    @Nullable
    public String getCssClass() {
        return cssClass;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedStyle)) return false;
        ResolvedStyle that = (ResolvedStyle) o;
        return Double.compare(that.strokeWidth, strokeWidth) == 0 && Double.compare(that.opacity, opacity) == 0
                && fill.equals(that.fill) && stroke.equals(that.stroke)
                && Objects.equals(strokeDasharray, that.strokeDasharray) && Objects.equals(cssClass, that.cssClass);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fill, stroke, strokeWidth, strokeDasharray, opacity, cssClass);
    }

    @Override
    public String toString() {
        return "ResolvedStyle{fill=" + fill + ", stroke=" + stroke + ", strokeWidth=" + strokeWidth
                + (strokeDasharray == null ? "" : ", dash=" + strokeDasharray)
                + (opacity == 1 ? "" : ", opacity=" + opacity) + "}";
    }
}
