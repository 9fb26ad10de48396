package logicexpr.expression.error;

public class LexicalException extends ExpressionException
{
    private final char character;

    public LexicalException(char character, int line, int column, String source)
    {
        super("Unexpected character '" + character + "'", line, column, source);

        this.character = character;
    }

    public char getCharacter()
    {
        return character;
    }
}
