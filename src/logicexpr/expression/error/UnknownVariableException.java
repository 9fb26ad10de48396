package logicexpr.expression.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class UnknownVariableException extends ExpressionException
{
    private final String name;
    private final List<String> suggestions;

    public UnknownVariableException(String name, List<String> suggestions)
    {
        this(name, suggestions, 0, 0, null);
    }

    public UnknownVariableException(String name, List<String> suggestions, int line, int column, String source)
    {
        super(message(name, suggestions), line, column, source);

        this.name = name;
        this.suggestions = suggestions == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(suggestions));
    }

    private static String message(String name, List<String> suggestions)
    {
        if (suggestions == null || suggestions.isEmpty())
            return "Unknown variable '" + name + "'";

        return "Unknown variable '" + name + "', did you mean " + String.join(", ", suggestions) + "?";
    }

    public String getName()
    {
        return name;
    }

    public List<String> getSuggestions()
    {
        return suggestions;
    }

    public UnknownVariableException withLocation(int line, int column, String source)
    {
        return new UnknownVariableException(name, suggestions, line, column, source);
    }
}
