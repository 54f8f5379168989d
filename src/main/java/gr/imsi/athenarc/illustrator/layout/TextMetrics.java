package gr.imsi.athenarc.illustrator.layout;

import gr.imsi.athenarc.illustrator.config.LayoutConfig;
import gr.imsi.athenarc.illustrator.domain.Box;
import gr.imsi.athenarc.illustrator.domain.Point;

/**
 * Font independent text size estimates.
 */
public final class TextMetrics {

    private TextMetrics() {}

    /**
     * Size of a text node's content.
     */
    public static Box measureText(String text, double fontSize, LayoutConfig config) {
        int length = text == null ? 0 : text.codePointCount(0, text.length());
        return Box.sized(length * fontSize * config.getTextWidthFactor(), fontSize * config.getTextHeightFactor());
    }

    /**
     * Box of a label centered on {@code center}.
     */
    public static Box labelBox(String text, double fontSize, Point center, LayoutConfig config) {
        int length = text.codePointCount(0, text.length());
        double width = length * fontSize * config.getLabelWidthFactor();
        double height = fontSize;
        return Box.of(center.getX() - width / 2.0, center.getY() - height / 2.0, width, height);
    }
}
