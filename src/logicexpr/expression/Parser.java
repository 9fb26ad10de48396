package logicexpr.expression;

import logicexpr.LogicExpr;
import logicexpr.expression.error.EndOfInputException;
import logicexpr.expression.error.MissingOperandException;
import logicexpr.expression.error.MissingParenthesisException;
import logicexpr.expression.error.UnexpectedTokenException;

import java.util.List;
import java.util.Locale;

/**
 * Recursive descent over
 * <pre>
 * expression := term (OR term)*
 * term       := factor (AND factor)*
 * factor     := NOT factor | primary
 * primary    := IDENT | BOOL | '(' expression ')'
 * </pre>
 */
public class Parser
{
    private static final String PRIMARY = "identifier, TRUE, FALSE, NOT or '('";

    private final List<Token> tokens;
    private final String source;
    private int current = 0;
    private boolean debug = false;
    private Expression root;

    public Parser(String source)
    {
        this(new Lexer(source).tokenize(), source);
    }

    public Parser(List<Token> tokens, String source)
    {
        if (tokens == null || tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF))
            throw new IllegalArgumentException("Token sequence must end with EOF");

        this.tokens = tokens;
        this.source = source;
    }

    public Parser setDebug(boolean debug)
    {
        this.debug = debug;
        return this;
    }

    public Expression build()
    {
        if (root != null)
            return root;

        Expression expr = expression();

        Token trailing = peek();
        if (!trailing.is(TokenType.EOF))
            throw new UnexpectedTokenException(trailing.describe(), "end of input",
                    trailing.getLine(), trailing.getColumn(), source);

        root = expr;
        return root;
    }

    private Expression expression()
    {
        trace("enter expression");
        Expression expr = term(null);
        while (peek().is(TokenType.OR))
        {
            Token or = advance();
            expr = new BinOp(Operator.OR, expr, term(or));
            trace("reduce OR");
        }
        trace("exit expression");
        return expr;
    }

    private Expression term(Token operator)
    {
        Expression expr = factor(operator);
        while (peek().is(TokenType.AND))
        {
            Token and = advance();
            expr = new BinOp(Operator.AND, expr, factor(and));
            trace("reduce AND");
        }
        return expr;
    }

    // operator is the token that asked for this operand, null at the start of an expression
    private Expression factor(Token operator)
    {
        // NOT chains are read in a loop so their length is not bound by the stack
        int nots = 0;
        while (peek().is(TokenType.NOT))
        {
            operator = advance();
            nots++;
        }

        Expression expr = primary(operator);
        for (int i = 0; i < nots; i++)
            expr = new Not(expr);

        if (nots > 0)
            trace("reduce " + nots + "x NOT");
        return expr;
    }

    private Expression primary(Token operator)
    {
        Token token = peek();
        switch (token.getType())
        {
            case IDENT:
                advance();
                trace("reduce IDENT " + token.getText());
                return new Var(token.getText());

            case BOOL:
                advance();
                trace("reduce BOOL " + token.getValue());
                return BoolLit.of(token.getValue());

            case LPAREN:
            {
                Token open = advance();
                Expression inner = expression();
                Token close = peek();
                if (!close.is(TokenType.RPAREN))
                    throw new MissingParenthesisException(close.describe(), open.getLine(), open.getColumn(), source);

                advance();
                return inner;
            }

            default:
                if (operator != null)
                    throw new MissingOperandException(operator.getText().toUpperCase(Locale.ROOT),
                            operator.getLine(), operator.getColumn(), source);
                if (token.is(TokenType.EOF))
                    throw new EndOfInputException(PRIMARY, token.getLine(), token.getColumn(), source);

                throw new UnexpectedTokenException(token.describe(), PRIMARY, token.getLine(), token.getColumn(), source);
        }
    }

    /** Looks {@code k} tokens ahead without consuming anything; past the end this is EOF. */
    Token peek(int k)
    {
        int index = current + k;
        return index < tokens.size() ? tokens.get(index) : tokens.get(tokens.size() - 1);
    }

    private Token peek()
    {
        return peek(0);
    }

    private Token advance()
    {
        Token token = peek();
        if (!token.is(TokenType.EOF))
            current++;
        return token;
    }

    private void trace(String message)
    {
        if (debug)
            LogicExpr.printOut("[Parser] " + message + " @ " + peek());
    }
}
