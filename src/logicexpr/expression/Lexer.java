package logicexpr.expression;

import logicexpr.expression.error.LexicalException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public class Lexer
{
    public static final String AND_LITERAL = "AND";
    public static final String OR_LITERAL = "OR";
    public static final String NOT_LITERAL = "NOT";
    public static final String TRUE_LITERAL = "TRUE";
    public static final String FALSE_LITERAL = "FALSE";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String source;
    private final boolean comments;
    private final Matcher identifier;

    private int offset = 0;
    private int line = 1;
    private int column = 1;

    public Lexer(String source)
    {
        this(source, true);
    }

    public Lexer(String source, boolean comments)
    {
        this.source = source == null ? "" : source;
        this.comments = comments;
        this.identifier = IDENTIFIER.matcher(this.source);
    }

    /**
     * Reads the whole source. The returned list always ends with a single
     * {@link TokenType#EOF} token placed just past the last character.
     */
    public List<Token> tokenize()
    {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do
        {
            token = nextToken();
            tokens.add(token);
        }
        while (!token.is(TokenType.EOF));

        return Collections.unmodifiableList(tokens);
    }

    private Token nextToken()
    {
        skipIgnored();

        final int startLine = line;
        final int startColumn = column;
        final int startOffset = offset;

        if (offset >= source.length())
            return new Token(TokenType.EOF, "", false, startLine, startColumn, startOffset);

        char c = source.charAt(offset);
        switch (c)
        {
            case '(':
                advance(1);
                return new Token(TokenType.LPAREN, "", false, startLine, startColumn, startOffset);
            case ')':
                advance(1);
                return new Token(TokenType.RPAREN, "", false, startLine, startColumn, startOffset);
        }

        identifier.region(offset, source.length());
        if (identifier.lookingAt())
        {
            String word = identifier.group();
            advance(word.length());

            switch (word.toUpperCase(Locale.ROOT))
            {
                case AND_LITERAL:
                    return new Token(TokenType.AND, word, false, startLine, startColumn, startOffset);
                case OR_LITERAL:
                    return new Token(TokenType.OR, word, false, startLine, startColumn, startOffset);
                case NOT_LITERAL:
                    return new Token(TokenType.NOT, word, false, startLine, startColumn, startOffset);
                case TRUE_LITERAL:
                    return new Token(TokenType.BOOL, word, true, startLine, startColumn, startOffset);
                case FALSE_LITERAL:
                    return new Token(TokenType.BOOL, word, false, startLine, startColumn, startOffset);
                default:
                    return new Token(TokenType.IDENT, word, false, startLine, startColumn, startOffset);
            }
        }

        throw new LexicalException(c, startLine, startColumn, source);
    }

    private void skipIgnored()
    {
        while (offset < source.length())
        {
            char c = source.charAt(offset);
            if (Character.isWhitespace(c))
                advance(1);
            else if (c == '#' && comments)
            {
                while (offset < source.length() && source.charAt(offset) != '\n')
                    advance(1);
            }
            else
                break;
        }
    }

    private void advance(int count)
    {
        for (int i = 0; i < count && offset < source.length(); i++)
        {
            if (source.charAt(offset) == '\n')
            {
                line++;
                column = 1;
            }
            else
                column++;

            offset++;
        }
    }

    /**
     * Whether {@code word} would be read back as a single {@link TokenType#IDENT} token.
     */
    public static boolean isIdentifier(String word)
    {
        if (word == null || !IDENTIFIER.matcher(word).matches())
            return false;

        switch (word.toUpperCase(Locale.ROOT))
        {
            case AND_LITERAL:
            case OR_LITERAL:
            case NOT_LITERAL:
            case TRUE_LITERAL:
            case FALSE_LITERAL:
                return false;
            default:
                return true;
        }
    }

    public static String debugTokens(List<Token> tokens)
    {
        return tokens.stream().map(Token::toString).collect(Collectors.joining(", "));
    }
}
