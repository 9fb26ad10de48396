package logicexpr.expression;

import java.util.Objects;

public final class Not implements Expression
{
    private final Expression operand;

    public Not(Expression operand)
    {
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public Expression getOperand()
    {
        return operand;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor)
    {
        return visitor.visitNot(this);
    }

    @Override
    public boolean equals(Object o)
    {
        return o == this || o instanceof Not && operand.equals(((Not) o).operand);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash("Not", operand);
    }

    @Override
    public String toString()
    {
        return String.format("Not(%s)", operand);
    }
}
