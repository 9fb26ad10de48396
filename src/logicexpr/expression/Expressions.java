package logicexpr.expression;

import logicexpr.expression.error.UnknownVariableException;
import org.json.JSONObject;

import java.util.List;
import java.util.Map;

/**
 * Entry points of the expression pipeline. Every method is a pure function of
 * its arguments; failures are thrown as {@link logicexpr.expression.error.ExpressionException}
 * subtypes.
 */
public final class Expressions
{
    private Expressions() {}

    /**
     * @throws logicexpr.expression.error.LexicalException on a character outside the language
     */
    public static List<Token> tokenize(String source)
    {
        return new Lexer(source).tokenize();
    }

    /**
     * Tokenizes and parses {@code source}.
     *
     * @throws logicexpr.expression.error.LexicalException on a character outside the language
     * @throws logicexpr.expression.error.ParseException when the tokens do not form an expression
     */
    public static Expression parse(String source)
    {
        return parse(tokenize(source), source);
    }

    public static Expression parse(List<Token> tokens, String source)
    {
        return new Parser(tokens, source).build();
    }

    /**
     * @throws UnknownVariableException when a variable of the tree is missing from {@code environment}
     */
    public static boolean evaluate(Expression expression, Map<String, Boolean> environment)
    {
        return new Evaluator(environment).evaluate(expression);
    }

    /**
     * Parses and evaluates {@code source}. An unknown variable is reported at
     * its first occurrence in the source.
     */
    public static boolean evaluate(String source, Map<String, Boolean> environment)
    {
        List<Token> tokens = tokenize(source);
        Expression expression = parse(tokens, source);
        try
        {
            return evaluate(expression, environment);
        }
        catch (UnknownVariableException e)
        {
            throw locate(e, tokens, source);
        }
    }

    /**
     * Points {@code e} at the first token naming its variable, or returns it
     * unchanged when no token does.
     */
    public static UnknownVariableException locate(UnknownVariableException e, List<Token> tokens, String source)
    {
        for (Token token : tokens)
            if (token.is(TokenType.IDENT) && token.getText().equals(e.getName()))
                return e.withLocation(token.getLine(), token.getColumn(), source);

        return e;
    }

    public static Expression optimize(Expression expression)
    {
        return new Optimizer().optimize(expression);
    }

    public static String prettyPrint(Expression expression)
    {
        return prettyPrint(expression, PrettyOptions.DEFAULT);
    }

    public static String prettyPrint(Expression expression, PrettyOptions options)
    {
        return new PrettyPrinter(options).print(expression);
    }

    public static JSONObject toRecord(Expression expression)
    {
        return Records.toRecord(expression);
    }

    /**
     * @throws logicexpr.expression.error.FormatException when the record does not describe a tree
     */
    public static Expression fromRecord(JSONObject record)
    {
        return Records.fromRecord(record);
    }

    public static Expression fromRecord(String json)
    {
        return Records.fromRecord(json);
    }
}
