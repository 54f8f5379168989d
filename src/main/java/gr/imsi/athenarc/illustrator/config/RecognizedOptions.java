package gr.imsi.athenarc.illustrator.config;

import java.util.EnumSet;
import java.util.Set;

import com.google.common.collect.Sets;

import gr.imsi.athenarc.illustrator.model.NodeKind;

/**
 * Central configuration of the options each node kind accepts.
 */
public class RecognizedOptions {

    private static final Set<NodeOption> STYLE = EnumSet.of(
            NodeOption.FILL, NodeOption.STROKE, NodeOption.STROKE_WIDTH, NodeOption.STROKE_DASHARRAY,
            NodeOption.OPACITY, NodeOption.FONT_SIZE, NodeOption.CLASS, NodeOption.LABEL);

    private static final Set<NodeOption> SHAPE_OPTIONS = Sets.immutableEnumSet(Sets.union(
            EnumSet.of(NodeOption.SIZE, NodeOption.WIDTH, NodeOption.HEIGHT, NodeOption.DX, NodeOption.DY),
            STYLE));

    private static final Set<NodeOption> TEXT_OPTIONS = Sets.immutableEnumSet(Sets.union(
            SHAPE_OPTIONS, EnumSet.of(NodeOption.TEXT)));

    private static final Set<NodeOption> CONTAINER_OPTIONS = Sets.immutableEnumSet(Sets.union(
            EnumSet.of(NodeOption.WIDTH, NodeOption.HEIGHT, NodeOption.GAP, NodeOption.PADDING,
                    NodeOption.ALIGN, NodeOption.DX, NodeOption.DY),
            STYLE));

    private static final Set<NodeOption> GRID_OPTIONS = Sets.immutableEnumSet(Sets.union(
            CONTAINER_OPTIONS, EnumSet.of(NodeOption.COLUMNS, NodeOption.ROWS)));

    /**
     * Gets the options a node of the given kind may carry.
     *
     * @param kind The node kind
     * @return Immutable set of recognized options
     */
    public static Set<NodeOption> getOptions(NodeKind kind) {
        switch (kind) {
            case RECTANGLE:
            case CIRCLE:
            case ELLIPSE:
            case LINE:
            case POLYGON:
            case ICON:
                return SHAPE_OPTIONS;
            case TEXT:
                return TEXT_OPTIONS;
            case GRID:
                return GRID_OPTIONS;
            case ROW:
            case COLUMN:
            case STACK:
            case GROUP:
                return CONTAINER_OPTIONS;
            default:
                throw new IllegalArgumentException("Unsupported kind: " + kind);
        }
    }
}
