package gr.imsi.athenarc.illustrator.model;

import java.util.List;

import com.google.common.collect.ImmutableList;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The complete, template-expanded input of one render call: a single-rooted node tree
 * plus the connection, constraint and containment declarations that refer to it.
 */
public final class Diagram {

    private final NodeSpec root;
    private final ImmutableList<ConnectionSpec> connections;
    private final ImmutableList<ConstraintSpec> constraints;
    private final ImmutableList<ContainsSpec> containments;

    public Diagram(NodeSpec root, List<ConnectionSpec> connections,
                   List<ConstraintSpec> constraints, List<ContainsSpec> containments) {
        this.root = checkNotNull(root, "root");
        this.connections = ImmutableList.copyOf(connections);
        this.constraints = ImmutableList.copyOf(constraints);
        this.containments = ImmutableList.copyOf(containments);
    }

    public static DiagramBuilder builder() {
        return new DiagramBuilder();
    }

    public NodeSpec getRoot() {
        return root;
    }

    public ImmutableList<ConnectionSpec> getConnections() {
        return connections;
    }

    public ImmutableList<ConstraintSpec> getConstraints() {
        return constraints;
    }

    public ImmutableList<ContainsSpec> getContainments() {
        return containments;
    }

    @Override
    public String toString() {
        return "Diagram{root=" + root.getKind().getName()
                + ", connections=" + connections.size()
                + ", constraints=" + constraints.size()
                + ", containments=" + containments.size() + "}";
    }
}
