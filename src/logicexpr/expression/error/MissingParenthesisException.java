package logicexpr.expression.error;

/**
 * Raised at the position of a '(' that is never closed.
 */
public class MissingParenthesisException extends ParseException
{
    private final String found;

    public MissingParenthesisException(String found, int line, int column, String source)
    {
        super("Missing closing parenthesis for '(' at " + line + ":" + column + ", found '" + found + "'",
                line, column, source);

        this.found = found;
    }

    public String getFound()
    {
        return found;
    }
}
