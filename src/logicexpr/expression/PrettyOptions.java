package logicexpr.expression;

import java.util.Locale;
import java.util.Objects;

public final class PrettyOptions
{
    public enum CaseStyle
    {
        UPPER,
        LOWER,
        MIXED;

        public String apply(String keyword)
        {
            switch (this)
            {
                case LOWER:
                    return keyword.toLowerCase(Locale.ROOT);
                case MIXED:
                    return keyword.substring(0, 1).toUpperCase(Locale.ROOT) + keyword.substring(1).toLowerCase(Locale.ROOT);
                default:
                    return keyword.toUpperCase(Locale.ROOT);
            }
        }
    }

    public enum Parentheses
    {
        MINIMAL,
        ALWAYS,
        /** Drops every parenthesis, so the output may group differently when read back. */
        NEVER
    }

    public static final PrettyOptions DEFAULT = new PrettyOptions(CaseStyle.UPPER, Parentheses.MINIMAL, 0);

    private final CaseStyle caseStyle;
    private final Parentheses parentheses;
    private final int indent;

    public PrettyOptions(CaseStyle caseStyle, Parentheses parentheses, int indent)
    {
        if (indent < 0)
            throw new IllegalArgumentException("indent must not be negative: " + indent);

        this.caseStyle = Objects.requireNonNull(caseStyle, "caseStyle");
        this.parentheses = Objects.requireNonNull(parentheses, "parentheses");
        this.indent = indent;
    }

    public CaseStyle getCaseStyle()
    {
        return caseStyle;
    }

    public Parentheses getParentheses()
    {
        return parentheses;
    }

    /** Spaces per nesting level; 0 keeps the whole expression on one line. */
    public int getIndent()
    {
        return indent;
    }

    public PrettyOptions withCaseStyle(CaseStyle caseStyle)
    {
        return new PrettyOptions(caseStyle, parentheses, indent);
    }

    public PrettyOptions withParentheses(Parentheses parentheses)
    {
        return new PrettyOptions(caseStyle, parentheses, indent);
    }

    public PrettyOptions withIndent(int indent)
    {
        return new PrettyOptions(caseStyle, parentheses, indent);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof PrettyOptions))
            return false;

        PrettyOptions other = (PrettyOptions) o;
        return caseStyle == other.caseStyle && parentheses == other.parentheses && indent == other.indent;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(caseStyle, parentheses, indent);
    }

    @Override
    public String toString()
    {
        return String.format("PrettyOptions(%s, %s, indent=%d)", caseStyle, parentheses, indent);
    }
}
