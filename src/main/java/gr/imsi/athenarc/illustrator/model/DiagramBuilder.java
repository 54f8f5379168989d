package gr.imsi.athenarc.illustrator.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Builder class for creating Diagram objects using a fluent interface.
 * Top level nodes added with {@link #withNode(NodeSpec)} are wrapped in an implicit
 * column unless exactly one was added.
 */
public class DiagramBuilder {
    private final List<NodeSpec> nodes = new ArrayList<>();
    private final List<ConnectionSpec> connections = new ArrayList<>();
    private final List<ConstraintSpec> constraints = new ArrayList<>();
    private final List<ContainsSpec> containments = new ArrayList<>();

    /**
     * Add a top level node.
     *
     * @param node The node to add
     * @return This builder for method chaining
     */
    public DiagramBuilder withNode(NodeSpec node) {
        nodes.add(node);
        return this;
    }

    public DiagramBuilder withConnection(ConnectionSpec connection) {
        connections.add(connection);
        return this;
    }

    /**
     * Add a forward orthogonal connection between two references such as {@code a} or {@code a.top}.
     */
    public DiagramBuilder connect(String from, String to) {
        return withConnection(ConnectionSpec.builder(from, to).build());
    }

    public DiagramBuilder withConstraint(ConstraintSpec constraint) {
        constraints.add(constraint);
        return this;
    }

    /**
     * Add {@code target.edge = expression}.
     */
    public DiagramBuilder constrain(String target, String edge, ConstraintExpression expression) {
        return withConstraint(ConstraintSpec.equal(target, edge, expression));
    }

    public DiagramBuilder withContainment(ContainsSpec containment) {
        containments.add(containment);
        return this;
    }

    /**
     * Build the Diagram.
     *
     * @return A new Diagram instance
     * @throws IllegalStateException if no node was added
     */
    public Diagram build() {
        if (nodes.isEmpty()) {
            throw new IllegalStateException("Cannot build Diagram. Missing nodes");
        }
        NodeSpec root = nodes.size() == 1
                ? nodes.get(0)
                : NodeSpec.builder(NodeKind.COLUMN).children(nodes).build();
        return new Diagram(root, connections, constraints, containments);
    }
}
