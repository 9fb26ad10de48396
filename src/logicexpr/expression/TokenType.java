package logicexpr.expression;

public enum TokenType
{
    IDENT,
    BOOL,
    AND,
    OR,
    NOT,
    LPAREN,
    RPAREN,
    EOF
}
