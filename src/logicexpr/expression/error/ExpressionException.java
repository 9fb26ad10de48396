package logicexpr.expression.error;

/**
 * Base of every failure raised while tokenizing, parsing, evaluating or
 * reading back an expression.
 * <p>
 * Line and column are 1-based; both are 0 when the failure has no position
 * in a source text (a record, or an expression built by hand).
 */
public class ExpressionException extends RuntimeException
{
    private final int line;
    private final int column;
    private final String source;

    public ExpressionException(String message, int line, int column, String source)
    {
        this(message, line, column, source, null);
    }

    public ExpressionException(String message, int line, int column, String source, Throwable cause)
    {
        super(message, cause);

        this.line = line;
        this.column = column;
        this.source = source;
    }

    public int getLine()
    {
        return line;
    }

    public int getColumn()
    {
        return column;
    }

    public String getSource()
    {
        return source;
    }

    public boolean hasLocation()
    {
        return line > 0 && column > 0;
    }

    public String formatError()
    {
        return formatError(2);
    }

    /**
     * Renders the message GCC style: the location, up to {@code contextLines}
     * lines either side of the failing one and a caret under its column.
     */
    public String formatError(int contextLines)
    {
        String header = getClass().getSimpleName() + ": " + getMessage();
        if (!hasLocation() || source == null)
            return header;

        String[] lines = source.split("\n", -1);
        int index = line - 1;
        if (index >= lines.length)
            return header;

        StringBuilder sb = new StringBuilder(header);
        sb.append('\n').append("  --> ").append(line).append(':').append(column);

        int start = Math.max(0, index - contextLines);
        int end = Math.min(lines.length, index + contextLines + 1);
        for (int i = start; i < end; i++)
        {
            String text = stripCarriageReturn(lines[i]);
            sb.append('\n').append(String.format("%s %4d | %s", i == index ? ">>>" : "   ", i + 1, text));

            if (i == index)
                sb.append('\n').append(String.format("%8s | %s^", "", caretPadding(text, column)));
        }

        return sb.toString();
    }

    private static String stripCarriageReturn(String text)
    {
        return text.endsWith("\r") ? text.substring(0, text.length() - 1) : text;
    }

    // keep tabs so the caret lines up with the text above it
    private static String caretPadding(String text, int column)
    {
        StringBuilder pad = new StringBuilder();
        for (int i = 0; i < column - 1; i++)
            pad.append(i < text.length() && text.charAt(i) == '\t' ? '\t' : ' ');

        return pad.toString();
    }
}
