package gr.imsi.athenarc.illustrator.error;

import java.util.List;

/**
 * Raised while building or arranging the geometry tree.
 */
public class LayoutException extends DiagramException {

    public enum Reason {
        UNRESOLVED_REFERENCE,
        AMBIGUOUS_REFERENCE,
        INVALID_MODIFIER,
        INVALID_VALUE
    }

    private final Reason reason;

    public LayoutException(Reason reason, String summary, List<String> identifiers, String expected, String found) {
        super(describe(summary, expected, found), identifiers, expected, found);
        this.reason = reason;
    }

    public static LayoutException invalidModifier(String node, String key, String kind, Iterable<String> allowed) {
        return new LayoutException(Reason.INVALID_MODIFIER,
                "Node " + node + " has unrecognized option '" + key + "' for kind " + kind,
                List.of(node, key), "one of " + allowed, key);
    }

    public static LayoutException invalidValue(String node, String key, String expected, Object found) {
        return new LayoutException(Reason.INVALID_VALUE,
                "Node " + node + " has an invalid value for option '" + key + "'",
                List.of(node, key), expected, String.valueOf(found));
    }

    public static LayoutException unresolved(String id, String usage) {
        return new LayoutException(Reason.UNRESOLVED_REFERENCE,
                "Unresolved node reference '" + id + "' in " + usage,
                List.of(id), "a declared node identifier", id);
    }

    public static LayoutException ambiguous(String id, int count) {
        return new LayoutException(Reason.AMBIGUOUS_REFERENCE,
                "Node identifier '" + id + "' is declared " + count + " times",
                List.of(id), "exactly one declaration", count + " declarations");
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String getPhase() {
        return "layout";
    }
}
