package gr.imsi.athenarc.illustrator.error;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Base class of every failure raised while turning a diagram into a scene.
 * A render that throws one of these never produces a partial scene.
 * <p>
 * Each exception names the identifiers it concerns, and when it helps the
 * author, what was expected in place of what was found.
 */
public abstract class DiagramException extends RuntimeException {

    private final ImmutableList<String> identifiers;
    private final String expected;
    private final String found;

    protected DiagramException(String message, List<String> identifiers, String expected, String found) {
        super(message);
        this.identifiers = ImmutableList.copyOf(identifiers);
        this.expected = expected;
        this.found = found;
    }

    /**
     * @return the pipeline phase that failed, e.g. {@code layout}
     */
    public abstract String getPhase();

    public ImmutableList<String> getIdentifiers() {
        return identifiers;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }

    protected static String describe(String summary, String expected, String found) {
        StringBuilder sb = new StringBuilder(summary);
        if (expected != null) {
            sb.append(" (expected ").append(expected);
            if (found != null) {
                sb.append(", found ").append(found);
            }
            sb.append(')');
        } else if (found != null) {
            sb.append(" (found ").append(found).append(')');
        }
        return sb.toString();
    }
}
