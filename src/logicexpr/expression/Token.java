package logicexpr.expression;

import java.util.Objects;

/**
 * A classified lexeme. Keywords and identifiers keep their source spelling in
 * {@code text}; punctuation and end of input have empty text.
 */
public final class Token
{
    private final TokenType type;
    private final String text;
    private final boolean value;
    private final int line;
    private final int column;
    private final int offset;

    public Token(TokenType type, String text, boolean value, int line, int column, int offset)
    {
        this.type = Objects.requireNonNull(type, "type");
        this.text = text == null ? "" : text;
        this.value = value;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public TokenType getType()
    {
        return type;
    }

    public String getText()
    {
        return text;
    }

    /** Decoded literal, only meaningful for {@link TokenType#BOOL}. */
    public boolean getValue()
    {
        return value;
    }

    public int getLine()
    {
        return line;
    }

    public int getColumn()
    {
        return column;
    }

    public int getOffset()
    {
        return offset;
    }

    public boolean is(TokenType type)
    {
        return this.type == type;
    }

    /** The token as it reads in an error message. */
    public String describe()
    {
        switch (type)
        {
            case LPAREN:
                return "(";
            case RPAREN:
                return ")";
            case EOF:
                return "end of input";
            default:
                return text;
        }
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof Token))
            return false;

        Token other = (Token) o;
        return type == other.type && value == other.value && line == other.line && column == other.column
                && offset == other.offset && text.equals(other.text);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(type, text, value, line, column, offset);
    }

    @Override
    public String toString()
    {
        if (type == TokenType.EOF)
            return String.format("EOF@%d:%d", line, column);

        return String.format("%s('%s')@%d:%d", type, describe(), line, column);
    }
}
