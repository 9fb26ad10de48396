package logicexpr.expression;

import java.util.Objects;

public final class Var implements Expression
{
    private final String name;

    public Var(String name)
    {
        Objects.requireNonNull(name, "name");
        if (!Lexer.isIdentifier(name))
            throw new IllegalArgumentException("'" + name + "' is not a valid variable name");

        this.name = name;
    }

    public String getName()
    {
        return name;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor)
    {
        return visitor.visitVar(this);
    }

    @Override
    public boolean equals(Object o)
    {
        return o == this || o instanceof Var && name.equals(((Var) o).name);
    }

    @Override
    public int hashCode()
    {
        return name.hashCode();
    }

    @Override
    public String toString()
    {
        return String.format("Var(%s)", name);
    }
}
