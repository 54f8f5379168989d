package gr.imsi.athenarc.illustrator.model;

import java.util.List;

/**
 * {@code a.left = b.right + 20}
 */
public final class EdgeReference implements ConstraintExpression {

    private final String nodeId;
    private final String edge;
    private final double offset;

    public EdgeReference(String nodeId, String edge, double offset) {
        this.nodeId = nodeId;
        this.edge = edge;
        this.offset = offset;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getEdge() {
        return edge;
    }

    public double getOffset() {
        return offset;
    }

    @Override
    public List<Operand> getOperands(String targetEdge) {
        return List.of(new Operand(nodeId, edge));
    }

    @Override
    public double combine(double[] operandValues) {
        return operandValues[0] + offset;
    }

    @Override
    public String describe(String targetEdge) {
        return nodeId + "." + edge + ConstraintExpression.offsetSuffix(offset);
    }
}
