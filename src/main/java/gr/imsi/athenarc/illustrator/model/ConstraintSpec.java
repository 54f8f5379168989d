package gr.imsi.athenarc.illustrator.model;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A directional assignment {@code target.edge = expression}. The edge name is kept as
 * written so that an unknown edge is reported when constraints are applied.
 */
public final class ConstraintSpec {

    private final String targetId;
    private final String edge;
    private final Relation relation;
    private final ConstraintExpression expression;

    public ConstraintSpec(String targetId, String edge, Relation relation, ConstraintExpression expression) {
        this.targetId = checkNotNull(targetId, "targetId");
        this.edge = checkNotNull(edge, "edge");
        this.relation = checkNotNull(relation, "relation");
        this.expression = checkNotNull(expression, "expression");
    }

    public static ConstraintSpec equal(String targetId, String edge, ConstraintExpression expression) {
        return new ConstraintSpec(targetId, edge, Relation.EQUAL, expression);
    }

    public String getTargetId() {
        return targetId;
    }

    public String getEdge() {
        return edge;
    }

    public Relation getRelation() {
        return relation;
    }

    public ConstraintExpression getExpression() {
        return expression;
    }

    @Override
    public String toString() {
        return targetId + "." + edge + " " + relation.getSymbol() + " " + expression.describe(edge);
    }
}
