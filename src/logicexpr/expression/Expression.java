package logicexpr.expression;

/**
 * A node of the expression tree. The only implementations are {@link Var},
 * {@link BoolLit}, {@link Not} and {@link BinOp}; all are immutable and compare
 * structurally.
 */
public interface Expression
{
    <T> T accept(ExpressionVisitor<T> visitor);
}
