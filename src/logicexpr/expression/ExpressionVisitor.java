package logicexpr.expression;

public interface ExpressionVisitor<T>
{
    T visitVar(Var var);

    T visitBoolLit(BoolLit literal);

    T visitNot(Not not);

    T visitBinOp(BinOp binOp);
}
