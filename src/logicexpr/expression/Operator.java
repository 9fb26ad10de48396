package logicexpr.expression;

public enum Operator
{
    OR(1, Lexer.OR_LITERAL),
    AND(2, Lexer.AND_LITERAL);

    private final int precedence;
    private final String keyword;

    Operator(int precedence, String keyword)
    {
        this.precedence = precedence;
        this.keyword = keyword;
    }

    /** Higher binds tighter. */
    public int getPrecedence()
    {
        return precedence;
    }

    public String getKeyword()
    {
        return keyword;
    }

    public boolean apply(boolean left, boolean right)
    {
        return this == AND ? left & right : left | right;
    }
}
