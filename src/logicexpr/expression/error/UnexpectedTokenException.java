package logicexpr.expression.error;

public class UnexpectedTokenException extends ParseException
{
    private final String found;
    private final String expected;

    public UnexpectedTokenException(String found, String expected, int line, int column, String source)
    {
        super("Unexpected token '" + found + "', expected " + expected, line, column, source);

        this.found = found;
        this.expected = expected;
    }

    public String getFound()
    {
        return found;
    }

    public String getExpected()
    {
        return expected;
    }
}
