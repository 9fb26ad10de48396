package logicexpr.expression.error;

/**
 * A token sequence that does not match the grammar.
 */
public class ParseException extends ExpressionException
{
    public ParseException(String message, int line, int column, String source)
    {
        super(message, line, column, source);
    }
}
