package logicexpr.expression;

import java.util.Objects;

public final class BinOp implements Expression
{
    private final Operator op;
    private final Expression left;
    private final Expression right;

    public BinOp(Operator op, Expression left, Expression right)
    {
        this.op = Objects.requireNonNull(op, "op");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public static BinOp and(Expression left, Expression right)
    {
        return new BinOp(Operator.AND, left, right);
    }

    public static BinOp or(Expression left, Expression right)
    {
        return new BinOp(Operator.OR, left, right);
    }

    public Operator getOp()
    {
        return op;
    }

    public Expression getLeft()
    {
        return left;
    }

    public Expression getRight()
    {
        return right;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor)
    {
        return visitor.visitBinOp(this);
    }

    @Override
    public boolean equals(Object o)
    {
        if (o == this)
            return true;
        if (!(o instanceof BinOp))
            return false;

        BinOp other = (BinOp) o;
        return op == other.op && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(op, left, right);
    }

    @Override
    public String toString()
    {
        return String.format("BinOp(%s, %s, %s)", op, left, right);
    }
}
