package gr.imsi.athenarc.illustrator.model;

import java.util.List;
import java.util.Objects;

/**
 * Right hand side of a constraint. An expression reads zero or more edges of other
 * nodes (its operands) and combines their current values into the target value.
 */
public interface ConstraintExpression {

    /**
     * @param targetEdge edge name on the left hand side, used by expressions that mirror it
     * @return the edges this expression reads, in evaluation order
     */
    List<Operand> getOperands(String targetEdge);

    /**
     * @param operandValues current values of {@link #getOperands(String)}, same order
     */
    double combine(double[] operandValues);

    String describe(String targetEdge);

    static ConstraintExpression constant(double value) {
        return new Constant(value);
    }

    static ConstraintExpression edge(String nodeId, String edge, double offset) {
        return new EdgeReference(nodeId, edge, offset);
    }

    static ConstraintExpression midpoint(String first, String second, double offset) {
        return new Midpoint(first, second, offset);
    }

    /**
     * An edge of a node, by name, as written by the author.
     */
    final class Operand {
        private final String nodeId;
        private final String edge;

        public Operand(String nodeId, String edge) {
            this.nodeId = nodeId;
            this.edge = edge;
        }

        public String getNodeId() {
            return nodeId;
        }

        public String getEdge() {
            return edge;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Operand)) return false;
            Operand operand = (Operand) o;
            return nodeId.equals(operand.nodeId) && edge.equals(operand.edge);
        }

        @Override
        public int hashCode() {
            return Objects.hash(nodeId, edge);
        }

        @Override
        public String toString() {
            return nodeId + "." + edge;
        }
    }

    static String offsetSuffix(double offset) {
        if (offset == 0) {
            return "";
        }
        return offset > 0 ? " + " + format(offset) : " - " + format(-offset);
    }

    static String format(double value) {
        return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
    }
}
