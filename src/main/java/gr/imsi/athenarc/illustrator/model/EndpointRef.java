package gr.imsi.athenarc.illustrator.model;

import java.util.Objects;

import org.jetbrains.annotations.Nullable;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A connection endpoint: a node identifier with an optional anchor name, written {@code id} or
 * {@code id.anchor}. The anchor name is validated when the connection is routed.
 */
public final class EndpointRef {

    private final String nodeId;
    private final String anchor;

    public EndpointRef(String nodeId, @Nullable String anchor) {
        checkArgument(nodeId != null && !nodeId.isEmpty(), "Endpoint node identifier must not be empty");
        this.nodeId = nodeId;
        this.anchor = anchor;
    }

    public static EndpointRef parse(String reference) {
        checkArgument(reference != null && !reference.isEmpty(), "Endpoint reference must not be empty");
        int dot = reference.lastIndexOf('.');
        if (dot <= 0 || dot == reference.length() - 1) {
            return new EndpointRef(reference, null);
        }
        return new EndpointRef(reference.substring(0, dot), reference.substring(dot + 1));
    }

    public String getNodeId() {
        return nodeId;
    }

    @Nullable
    public String getAnchor() {
        return anchor;
    }

    public boolean hasAnchor() {
        return anchor != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EndpointRef)) return false;
        EndpointRef that = (EndpointRef) o;
        return nodeId.equals(that.nodeId) && Objects.equals(anchor, that.anchor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeId, anchor);
    }

    @Override
    public String toString() {
        return anchor == null ? nodeId : nodeId + "." + anchor;
    }
}
