package gr.imsi.athenarc.illustrator.error;

import java.util.List;

/**
 * Raised when a constraint names a node or an edge that does not exist.
 * Constraints are checked before any of them is applied.
 */
public class ConstraintException extends DiagramException {

    public enum Reason {
        UNKNOWN_NODE,
        UNKNOWN_EDGE
    }

    private final Reason reason;

    public ConstraintException(Reason reason, String summary, List<String> identifiers, String expected, String found) {
        super(describe(summary, expected, found), identifiers, expected, found);
        this.reason = reason;
    }

    public static ConstraintException unknownNode(String id, String constraint) {
        return new ConstraintException(Reason.UNKNOWN_NODE,
                "Constraint '" + constraint + "' references unknown node '" + id + "'",
                List.of(id), "a declared node identifier", id);
    }

    public static ConstraintException unknownEdge(String id, String edge, String constraint) {
        return new ConstraintException(Reason.UNKNOWN_EDGE,
                "Constraint '" + constraint + "' uses unknown edge '" + edge + "' on node '" + id + "'",
                List.of(id, edge),
                "left, right, top, bottom, x, y, center_x, center_y, width or height", edge);
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String getPhase() {
        return "constraint";
    }
}
