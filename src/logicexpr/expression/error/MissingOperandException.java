package logicexpr.expression.error;

public class MissingOperandException extends ParseException
{
    private final String operator;

    public MissingOperandException(String operator, int line, int column, String source)
    {
        super("Missing operand for operator '" + operator + "'", line, column, source);

        this.operator = operator;
    }

    public String getOperator()
    {
        return operator;
    }
}
