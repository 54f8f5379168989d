package gr.imsi.athenarc.illustrator.model;

/**
 * Which ends of a connection carry an arrow head. {@code ->}, {@code <-}, {@code <->} and {@code --}.
 */
public enum ConnectionDirection {
    FORWARD,
    BACKWARD,
    BIDIRECTIONAL,
    UNDIRECTED;

    public boolean hasStartMarker() {
        return this == BACKWARD || this == BIDIRECTIONAL;
    }

    public boolean hasEndMarker() {
        return this == FORWARD || this == BIDIRECTIONAL;
    }

    public static ConnectionDirection fromArrow(String arrow) {
        switch (arrow) {
            case "->":
                return FORWARD;
            case "<-":
                return BACKWARD;
            case "<->":
                return BIDIRECTIONAL;
            case "--":
                return UNDIRECTED;
            default:
                throw new IllegalArgumentException("Unknown connection arrow: " + arrow);
        }
    }
}
