package logicexpr.expression;

public final class BoolLit implements Expression
{
    public static final BoolLit TRUE = new BoolLit(true);
    public static final BoolLit FALSE = new BoolLit(false);

    private final boolean value;

    private BoolLit(boolean value)
    {
        this.value = value;
    }

    public static BoolLit of(boolean value)
    {
        return value ? TRUE : FALSE;
    }

    public boolean getValue()
    {
        return value;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor)
    {
        return visitor.visitBoolLit(this);
    }

    @Override
    public boolean equals(Object o)
    {
        return o == this || o instanceof BoolLit && value == ((BoolLit) o).value;
    }

    @Override
    public int hashCode()
    {
        return Boolean.hashCode(value);
    }

    @Override
    public String toString()
    {
        return String.format("BoolLit(%s)", value);
    }
}
