package logicexpr.expression;

import logicexpr.LogicExpr;

/**
 * Constant folding, bottom up. Children are folded before their parent, so a
 * single pass leaves nothing to fold and running it again changes nothing.
 * The input tree is never modified.
 */
public class Optimizer implements ExpressionVisitor<Expression>
{
    private boolean debug = false;

    public Optimizer setDebug(boolean debug)
    {
        this.debug = debug;
        return this;
    }

    public Expression optimize(Expression expression)
    {
        return expression.accept(this);
    }

    @Override
    public Expression visitVar(Var var)
    {
        return var;
    }

    @Override
    public Expression visitBoolLit(BoolLit literal)
    {
        return literal;
    }

    @Override
    public Expression visitNot(Not not)
    {
        Expression operand = not.getOperand().accept(this);

        if (operand instanceof BoolLit)
        {
            boolean value = ((BoolLit) operand).getValue();
            trace("NOT " + literal(value) + " -> " + literal(!value));
            return BoolLit.of(!value);
        }
        if (operand instanceof Not)
        {
            trace("NOT NOT X -> X");
            return ((Not) operand).getOperand();
        }

        return operand == not.getOperand() ? not : new Not(operand);
    }

    @Override
    public Expression visitBinOp(BinOp binOp)
    {
        Expression left = binOp.getLeft().accept(this);
        Expression right = binOp.getRight().accept(this);
        Operator op = binOp.getOp();

        // TRUE is the identity of AND and absorbs OR; FALSE the other way round
        boolean identity = op == Operator.AND;

        if (left instanceof BoolLit)
        {
            boolean value = ((BoolLit) left).getValue();
            trace(literal(value) + " " + op + " X -> " + (value == identity ? "X" : literal(value)));
            return value == identity ? right : left;
        }
        if (right instanceof BoolLit)
        {
            boolean value = ((BoolLit) right).getValue();
            trace("X " + op + " " + literal(value) + " -> " + (value == identity ? "X" : literal(value)));
            return value == identity ? left : right;
        }

        if (left == binOp.getLeft() && right == binOp.getRight())
            return binOp;

        return new BinOp(op, left, right);
    }

    private static String literal(boolean value)
    {
        return value ? Lexer.TRUE_LITERAL : Lexer.FALSE_LITERAL;
    }

    private void trace(String message)
    {
        if (debug)
            LogicExpr.printOut("[Optimizer] " + message);
    }
}
