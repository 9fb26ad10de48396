package logicexpr.expression;

/**
 * Renders a tree back to source text that parses to an equal tree (except
 * with {@link PrettyOptions.Parentheses#NEVER}).
 */
public class PrettyPrinter implements ExpressionVisitor<String>
{
    private static final int NOT_PRECEDENCE = 3;

    private final PrettyOptions options;

    // context handed down from the parent node
    private int parentPrecedence = 0;
    private boolean rightOperand = false;
    private int depth = 0;

    public PrettyPrinter()
    {
        this(PrettyOptions.DEFAULT);
    }

    public PrettyPrinter(PrettyOptions options)
    {
        this.options = options == null ? PrettyOptions.DEFAULT : options;
    }

    public String print(Expression expression)
    {
        parentPrecedence = 0;
        rightOperand = false;
        depth = 0;
        return expression.accept(this);
    }

    @Override
    public String visitVar(Var var)
    {
        return var.getName();
    }

    @Override
    public String visitBoolLit(BoolLit literal)
    {
        return keyword(literal.getValue() ? Lexer.TRUE_LITERAL : Lexer.FALSE_LITERAL);
    }

    @Override
    public String visitNot(Not not)
    {
        Expression operand = not.getOperand();
        int operandDepth = operand instanceof BinOp ? depth + 1 : depth;

        return keyword(Lexer.NOT_LITERAL) + " " + child(operand, NOT_PRECEDENCE, true, operandDepth);
    }

    @Override
    public String visitBinOp(BinOp binOp)
    {
        Operator op = binOp.getOp();
        int precedence = op.getPrecedence();
        boolean wrap = wraps(precedence, parentPrecedence, rightOperand);
        int lineDepth = depth;

        String left = child(binOp.getLeft(), precedence, false, childDepth(op, binOp.getLeft(), false));
        String right = child(binOp.getRight(), precedence, true, childDepth(op, binOp.getRight(), true));

        String separator = options.getIndent() > 0 ? "\n" + spaces(options.getIndent() * lineDepth) : " ";
        String text = left + separator + keyword(op.getKeyword()) + " " + right;

        return wrap ? "(" + text + ")" : text;
    }

    private String child(Expression child, int precedence, boolean right, int childDepth)
    {
        int savedPrecedence = parentPrecedence;
        boolean savedRight = rightOperand;
        int savedDepth = depth;

        parentPrecedence = precedence;
        rightOperand = right;
        depth = childDepth;
        try
        {
            return child.accept(this);
        }
        finally
        {
            parentPrecedence = savedPrecedence;
            rightOperand = savedRight;
            depth = savedDepth;
        }
    }

    // nested operators of another kind, or parenthesized ones, go one level deeper
    private int childDepth(Operator op, Expression child, boolean right)
    {
        if (!(child instanceof BinOp))
            return depth;

        BinOp binOp = (BinOp) child;
        boolean deeper = binOp.getOp() != op || wraps(binOp.getOp().getPrecedence(), op.getPrecedence(), right);
        return deeper ? depth + 1 : depth;
    }

    private boolean wraps(int precedence, int parentPrecedence, boolean right)
    {
        switch (options.getParentheses())
        {
            case ALWAYS:
                return true;
            case NEVER:
                return false;
            default:
                // AND and OR group to the left, so an equal operator on the right needs them too
                return precedence < parentPrecedence || right && precedence == parentPrecedence;
        }
    }

    private String keyword(String keyword)
    {
        return options.getCaseStyle().apply(keyword);
    }

    private static String spaces(int count)
    {
        StringBuilder sb = new StringBuilder(count);
        for (int i = 0; i < count; i++)
            sb.append(' ');
        return sb.toString();
    }
}
