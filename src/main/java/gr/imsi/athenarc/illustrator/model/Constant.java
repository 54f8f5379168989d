package gr.imsi.athenarc.illustrator.model;

import java.util.List;

/**
 * {@code a.left = 100}
 */
public final class Constant implements ConstraintExpression {

    private final double value;

    public Constant(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public List<Operand> getOperands(String targetEdge) {
        return List.of();
    }

    @Override
    public double combine(double[] operandValues) {
        return value;
    }

    @Override
    public String describe(String targetEdge) {
        return ConstraintExpression.format(value);
    }
}
