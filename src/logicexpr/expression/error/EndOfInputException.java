package logicexpr.expression.error;

public class EndOfInputException extends ParseException
{
    private final String expected;

    public EndOfInputException(String expected, int line, int column, String source)
    {
        super("Unexpected end of input, expected " + expected, line, column, source);

        this.expected = expected;
    }

    public String getExpected()
    {
        return expected;
    }
}
