package logicexpr.expression.error;

/**
 * A serialized expression record that cannot be turned back into a tree.
 * The path points at the failing record, {@code $} being the root.
 */
public class FormatException extends ExpressionException
{
    private final String path;

    public FormatException(String message, String path)
    {
        this(message, path, null);
    }

    public FormatException(String message, String path, Throwable cause)
    {
        super(message + " at " + path, 0, 0, null, cause);

        this.path = path;
    }

    public String getPath()
    {
        return path;
    }
}
