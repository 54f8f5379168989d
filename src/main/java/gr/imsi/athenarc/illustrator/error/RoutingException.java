package gr.imsi.athenarc.illustrator.error;

import java.util.List;

/**
 * Raised when a connection can not be routed.
 */
public class RoutingException extends DiagramException {

    public enum Reason {
        UNKNOWN_ANCHOR,
        UNRESOLVED_ENDPOINT,
        INVALID_LABEL_POSITION
    }

    private final Reason reason;

    public RoutingException(Reason reason, String summary, List<String> identifiers, String expected, String found) {
        super(describe(summary, expected, found), identifiers, expected, found);
        this.reason = reason;
    }

    public static RoutingException unknownAnchor(String node, String anchor) {
        return new RoutingException(Reason.UNKNOWN_ANCHOR,
                "Unknown anchor '" + anchor + "' on node '" + node + "'",
                List.of(node, anchor),
                "top, bottom, left, right, center, top_left, top_right, bottom_left or bottom_right", anchor);
    }

    public static RoutingException unresolvedEndpoint(String node, String connection) {
        return new RoutingException(Reason.UNRESOLVED_ENDPOINT,
                "Connection " + connection + " references unknown node '" + node + "'",
                List.of(node), "a declared node identifier", node);
    }

    public static RoutingException invalidLabelPosition(String connection, double labelAt) {
        return new RoutingException(Reason.INVALID_LABEL_POSITION,
                "Connection " + connection + " has label position outside the path",
                List.of(connection), "a fraction between 0 and 1", String.valueOf(labelAt));
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String getPhase() {
        return "routing";
    }
}
