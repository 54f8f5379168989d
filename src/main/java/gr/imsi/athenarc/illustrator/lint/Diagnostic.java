package gr.imsi.athenarc.illustrator.lint;

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * A geometric defect found by the {@link Validator}.
 */
public final class Diagnostic {

    private final DiagnosticKind kind;
    private final Severity severity;
    private final ImmutableList<String> identifiers;
    private final String message;

    public Diagnostic(DiagnosticKind kind, List<String> identifiers, String message) {
        this.kind = kind;
        this.severity = Severity.ADVISORY;
        this.identifiers = ImmutableList.copyOf(identifiers);
        this.message = message;
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    public Severity getSeverity() {
        return severity;
    }

    public ImmutableList<String> getIdentifiers() {
        return identifiers;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic that = (Diagnostic) o;
        return kind == that.kind && identifiers.equals(that.identifiers) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, identifiers, message);
    }

    @Override
    public String toString() {
        return kind.getCode() + ": " + message;
    }
}
