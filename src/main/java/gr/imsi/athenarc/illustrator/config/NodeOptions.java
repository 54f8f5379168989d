package gr.imsi.athenarc.illustrator.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.jetbrains.annotations.Nullable;

import gr.imsi.athenarc.illustrator.error.LayoutException;
import gr.imsi.athenarc.illustrator.model.NodeKind;

/**
 * Typed view of the options of one node. Built once from the raw option map; every key
 * must belong to {@link RecognizedOptions#getOptions(NodeKind)} for the node's kind.
 */
public final class NodeOptions {

    private Double size;
    private Double width;
    private Double height;
    private Double gap;
    private Double padding;
    private Alignment align;
    private Integer columns;
    private Integer rows;
    private double dx;
    private double dy;
    private String fill;
    private String stroke;
    private Double strokeWidth;
    private String strokeDasharray;
    private double opacity = 1.0;
    private Double fontSize;
    private String cssClass;
    private String label;
    private String text;

    private NodeOptions() {
    }

    /**
     * Parses and checks the raw options of a node.
     *
     * @param kind the node kind
     * @param nodeName name used in errors
     * @param raw option map as produced by the parser
     * @throws LayoutException if a key is not recognized for {@code kind} or a value is malformed
     */
    public static NodeOptions parse(NodeKind kind, String nodeName, Map<String, Object> raw) {
        Set<NodeOption> allowed = RecognizedOptions.getOptions(kind);
        NodeOptions options = new NodeOptions();
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            Optional<NodeOption> option = NodeOption.fromKey(key);
            if (option.isEmpty() || !allowed.contains(option.get())) {
                throw LayoutException.invalidModifier(nodeName, key, kind.getName(), keys(allowed));
            }
            switch (option.get()) {
                case SIZE:
                    options.size = nonNegative(nodeName, key, value);
                    break;
                case WIDTH:
                    options.width = nonNegative(nodeName, key, value);
                    break;
                case HEIGHT:
                    options.height = nonNegative(nodeName, key, value);
                    break;
                case GAP:
                    options.gap = nonNegative(nodeName, key, value);
                    break;
                case PADDING:
                    options.padding = nonNegative(nodeName, key, value);
                    break;
                case ALIGN:
                    options.align = Alignment.parse(string(nodeName, key, value))
                            .orElseThrow(() -> LayoutException.invalidValue(nodeName, key, "start, center or end", value));
                    break;
                case COLUMNS:
                    options.columns = positiveInt(nodeName, key, value);
                    break;
                case ROWS:
                    options.rows = positiveInt(nodeName, key, value);
                    break;
                case DX:
                    options.dx = number(nodeName, key, value);
                    break;
                case DY:
                    options.dy = number(nodeName, key, value);
                    break;
                case FILL:
                    options.fill = string(nodeName, key, value);
                    break;
                case STROKE:
                    options.stroke = string(nodeName, key, value);
                    break;
                case STROKE_WIDTH:
                    options.strokeWidth = nonNegative(nodeName, key, value);
                    break;
                case STROKE_DASHARRAY:
                    options.strokeDasharray = string(nodeName, key, value);
                    break;
                case OPACITY:
                    double opacity = number(nodeName, key, value);
                    if (opacity < 0 || opacity > 1) {
                        throw LayoutException.invalidValue(nodeName, key, "a number between 0 and 1", value);
                    }
                    options.opacity = opacity;
                    break;
                case FONT_SIZE:
                    options.fontSize = positive(nodeName, key, value);
                    break;
                case CLASS:
                    options.cssClass = string(nodeName, key, value);
                    break;
                case LABEL:
                    options.label = string(nodeName, key, value);
                    break;
                case TEXT:
                    options.text = string(nodeName, key, value);
                    break;
                default:
                    throw LayoutException.invalidModifier(nodeName, key, kind.getName(), keys(allowed));
            }
        }
        return options;
    }

    private static List<String> keys(Set<NodeOption> options) {
        List<String> keys = new ArrayList<>(options.size());
        for (NodeOption option : options) {
            keys.add(option.getKey());
        }
        return keys;
    }

    private static double number(String node, String key, Object value) {
        double number;
        if (value instanceof Number) {
            number = ((Number) value).doubleValue();
        } else if (value instanceof String) {
            try {
                number = Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                throw LayoutException.invalidValue(node, key, "a number", value);
            }
        } else {
            throw LayoutException.invalidValue(node, key, "a number", value);
        }
        if (!Double.isFinite(number)) {
            throw LayoutException.invalidValue(node, key, "a finite number", value);
        }
        return number;
    }

    private static double nonNegative(String node, String key, Object value) {
        double number = number(node, key, value);
        if (number < 0) {
            throw LayoutException.invalidValue(node, key, "a non-negative number", value);
        }
        return number;
    }

    private static double positive(String node, String key, Object value) {
        double number = nonNegative(node, key, value);
        if (number == 0) {
            throw LayoutException.invalidValue(node, key, "a positive number", value);
        }
        return number;
    }

    private static int positiveInt(String node, String key, Object value) {
        double number = number(node, key, value);
        if (number < 1 || number != Math.rint(number)) {
            throw LayoutException.invalidValue(node, key, "a positive integer", value);
        }
        return (int) number;
    }

    private static String string(String node, String key, Object value) {
        if (value instanceof String || value instanceof Number) {
            return value.toString();
        }
        throw LayoutException.invalidValue(node, key, "a string", value);
    }

    @Nullable
    public Double getSize() {
        return size;
    }

    @Nullable
    public Double getWidth() {
        return width;
    }

    @Nullable
    public Double getHeight() {
        return height;
    }

    public double getGap(LayoutConfig config) {
        return gap != null ? gap : config.getGap();
    }

    public double getPadding(LayoutConfig config) {
        return padding != null ? padding : config.getPadding();
    }

    public Alignment getAlign(LayoutConfig config) {
        return align != null ? align : config.getAlignment();
    }

    @Nullable
    public Integer getColumns() {
        return columns;
    }

    @Nullable
    public Integer getRows() {
        return rows;
    }

    public double getDx() {
        return dx;
    }

    public double getDy() {
        return dy;
    }

    @Nullable
    public String getFill() {
        return fill;
    }

    @Nullable
    public String getStroke() {
        return stroke;
    }

    @Nullable
    public Double getStrokeWidth() {
        return strokeWidth;
    }

    @Nullable
    public String getStrokeDasharray() {
        return strokeDasharray;
    }

    public double getOpacity() {
        return opacity;
    }

    public double getFontSize(LayoutConfig config) {
        return fontSize != null ? fontSize : config.getFontSize();
    }

    @Nullable
    public String getCssClass() {
        return cssClass;
    }

    @Nullable
    public String getLabel() {
        return label;
    }

    @Nullable
    public String getText() {
        return text;
    }
}
