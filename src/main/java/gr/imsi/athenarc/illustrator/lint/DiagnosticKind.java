package gr.imsi.athenarc.illustrator.lint;

public enum DiagnosticKind {
    SIBLING_OVERLAP("sibling-overlap"),
    CONTAINMENT("containment"),
    LABEL_OVERLAP("label-overlap"),
    CONNECTION_CROSSING("connection-crossing");

    private final String code;

    DiagnosticKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
