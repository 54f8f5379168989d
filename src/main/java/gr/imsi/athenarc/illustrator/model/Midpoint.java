package gr.imsi.athenarc.illustrator.model;

import java.util.List;

/**
 * {@code a.center_x = midpoint(b, c) + 10}: the mean of the same edge on two other nodes.
 */
public final class Midpoint implements ConstraintExpression {

    private final String first;
    private final String second;
    private final double offset;

    public Midpoint(String first, String second, double offset) {
        this.first = first;
        this.second = second;
        this.offset = offset;
    }

    public String getFirst() {
        return first;
    }

    public String getSecond() {
        return second;
    }

    public double getOffset() {
        return offset;
    }

    @Override
    public List<Operand> getOperands(String targetEdge) {
        return List.of(new Operand(first, targetEdge), new Operand(second, targetEdge));
    }

    @Override
    public double combine(double[] operandValues) {
        return (operandValues[0] + operandValues[1]) / 2.0 + offset;
    }

    @Override
    public String describe(String targetEdge) {
        return "midpoint(" + first + ", " + second + ")" + ConstraintExpression.offsetSuffix(offset);
    }
}
