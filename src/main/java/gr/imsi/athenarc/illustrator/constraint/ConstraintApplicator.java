package gr.imsi.athenarc.illustrator.constraint;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.illustrator.domain.Box;
import gr.imsi.athenarc.illustrator.domain.Edge;
import gr.imsi.athenarc.illustrator.error.ConstraintException;
import gr.imsi.athenarc.illustrator.layout.LayoutNode;
import gr.imsi.athenarc.illustrator.layout.NodeIndex;
import gr.imsi.athenarc.illustrator.model.ConstraintExpression;
import gr.imsi.athenarc.illustrator.model.ConstraintSpec;
import gr.imsi.athenarc.illustrator.model.Relation;

/**
 * Applies explicit edge constraints to an arranged tree.
 * <p>
 * Constraints are directional assignments evaluated one at a time in declaration order
 * against the boxes as they are at that moment; a later constraint on the same edge wins.
 * Moving a position edge translates the target's whole subtree by the same delta.
 * Setting {@code width} or {@code height} resizes the target only, its children stay put.
 * <p>
 * Every constraint is resolved before the first one is applied, so an unknown node or edge
 * leaves the tree untouched.
 */
public class ConstraintApplicator {

    private static final Logger LOG = LoggerFactory.getLogger(ConstraintApplicator.class);

    /**
     * @throws ConstraintException if any constraint names an unknown node or edge
     */
    public void apply(NodeIndex index, List<ConstraintSpec> constraints) {
        List<ResolvedConstraint> resolved = resolve(index, constraints);
        for (ResolvedConstraint constraint : resolved) {
            apply(constraint);
        }
    }

    List<ResolvedConstraint> resolve(NodeIndex index, List<ConstraintSpec> constraints) {
        List<ResolvedConstraint> resolved = new ArrayList<>(constraints.size());
        for (ConstraintSpec spec : constraints) {
            String description = spec.toString();
            LayoutNode target = index.find(spec.getTargetId())
                    .orElseThrow(() -> ConstraintException.unknownNode(spec.getTargetId(), description));
            Edge edge = Edge.parse(spec.getEdge())
                    .orElseThrow(() -> ConstraintException.unknownEdge(spec.getTargetId(), spec.getEdge(), description));

            ImmutableList.Builder<LayoutNode> operandNodes = ImmutableList.builder();
            ImmutableList.Builder<Edge> operandEdges = ImmutableList.builder();
            for (ConstraintExpression.Operand operand : spec.getExpression().getOperands(spec.getEdge())) {
                operandNodes.add(index.find(operand.getNodeId())
                        .orElseThrow(() -> ConstraintException.unknownNode(operand.getNodeId(), description)));
                operandEdges.add(Edge.parse(operand.getEdge())
                        .orElseThrow(() -> ConstraintException.unknownEdge(operand.getNodeId(), operand.getEdge(), description)));
            }
            resolved.add(new ResolvedConstraint(spec, target, edge, operandNodes.build(), operandEdges.build()));
        }
        return resolved;
    }

    private void apply(ResolvedConstraint constraint) {
        LayoutNode target = constraint.target;
        Edge edge = constraint.edge;
        double[] values = new double[constraint.operandNodes.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = constraint.operandEdges.get(i).valueOf(constraint.operandNodes.get(i).getBox());
        }
        double desired = constraint.spec.getExpression().combine(values);
        double current = edge.valueOf(target.getBox());

        Relation relation = constraint.spec.getRelation();
        if ((relation == Relation.AT_LEAST && current >= desired)
                || (relation == Relation.AT_MOST && current <= desired)) {
            LOG.debug("Constraint {} already holds ({} vs {})", constraint.spec, current, desired);
            return;
        }

        if (edge.isSize()) {
            resize(target, edge, desired, constraint.spec);
            return;
        }
        double delta = desired - current;
        if (edge.isHorizontal()) {
            target.translate(delta, 0);
        } else {
            target.translate(0, delta);
        }
        LOG.debug("Constraint {} moved {} by {}", constraint.spec, target.getName(), delta);
    }

    private static void resize(LayoutNode target, Edge edge, double desired, ConstraintSpec spec) {
        double size = desired;
        if (size < 0) {
            LOG.warn("Constraint {} asks for negative {} {}, using 0", spec, edge.getName(), desired);
            size = 0;
        }
        Box box = target.getBox();
        target.setBox(edge == Edge.WIDTH ? box.resize(size, box.getHeight()) : box.resize(box.getWidth(), size));
        LOG.debug("Constraint {} resized {} to {}", spec, target.getName(), target.getBox());
    }

    static final class ResolvedConstraint {
        private final ConstraintSpec spec;
        private final LayoutNode target;
        private final Edge edge;
        private final ImmutableList<LayoutNode> operandNodes;
        private final ImmutableList<Edge> operandEdges;

        ResolvedConstraint(ConstraintSpec spec, LayoutNode target, Edge edge,
                           ImmutableList<LayoutNode> operandNodes, ImmutableList<Edge> operandEdges) {
            this.spec = spec;
            this.target = target;
            this.edge = edge;
            this.operandNodes = operandNodes;
            this.operandEdges = operandEdges;
        }
    }
}
