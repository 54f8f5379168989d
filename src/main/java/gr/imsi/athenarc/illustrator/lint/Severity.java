package gr.imsi.athenarc.illustrator.lint;

/**
 * Diagnostics never fail a render; the caller decides what to do with them.
 */
public enum Severity {
    ADVISORY
}
