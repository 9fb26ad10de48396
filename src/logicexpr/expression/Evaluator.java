package logicexpr.expression;

import logicexpr.LogicExpr;
import logicexpr.expression.error.UnknownVariableException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Reduces a tree to a boolean against a read-only environment.
 * <p>
 * Both operands of AND and OR are always evaluated, so a reference to an
 * unknown variable fails the evaluation wherever it sits in the tree.
 */
public class Evaluator implements ExpressionVisitor<Boolean>
{
    public static final int SUGGESTION_DISTANCE = 2;

    private final Map<String, Boolean> environment;
    private boolean debug = false;

    public Evaluator(Map<String, Boolean> environment)
    {
        this.environment = environment == null ? Collections.emptyMap() : environment;
    }

    public Evaluator setDebug(boolean debug)
    {
        this.debug = debug;
        return this;
    }

    public boolean evaluate(Expression expression)
    {
        return expression.accept(this);
    }

    @Override
    public Boolean visitVar(Var var)
    {
        Boolean value = environment.get(var.getName());
        if (value == null)
            throw new UnknownVariableException(var.getName(), suggest(var.getName(), environment.keySet()));

        trace(var.getName() + " = " + value);
        return value;
    }

    @Override
    public Boolean visitBoolLit(BoolLit literal)
    {
        return literal.getValue();
    }

    @Override
    public Boolean visitNot(Not not)
    {
        // unwind NOT chains in a loop, they can be as long as the input
        int count = 0;
        Expression node = not;
        while (node instanceof Not)
        {
            count++;
            node = ((Not) node).getOperand();
        }

        boolean operand = node.accept(this);
        boolean result = count % 2 == 0 ? operand : !operand;

        trace(count + "x NOT " + operand + " = " + result);
        return result;
    }

    @Override
    public Boolean visitBinOp(BinOp binOp)
    {
        // walk the left spine iteratively, left-deep chains come straight out of the parser
        Deque<BinOp> spine = new ArrayDeque<>();
        Expression node = binOp;
        while (node instanceof BinOp)
        {
            spine.push((BinOp) node);
            node = ((BinOp) node).getLeft();
        }

        boolean result = node.accept(this);
        while (!spine.isEmpty())
        {
            BinOp current = spine.pop();
            boolean left = result;
            boolean right = current.getRight().accept(this);
            result = current.getOp().apply(left, right);

            trace(left + " " + current.getOp() + " " + right + " = " + result);
        }
        return result;
    }

    /**
     * Names within {@link #SUGGESTION_DISTANCE} edits of {@code name}, keeping
     * only the closest ones, in the iteration order of {@code known}.
     */
    public static List<String> suggest(String name, Iterable<String> known)
    {
        List<String> closest = new ArrayList<>();
        int best = SUGGESTION_DISTANCE + 1;

        for (String candidate : known)
        {
            if (candidate == null || candidate.equals(name))
                continue;

            int distance = levenshtein(name, candidate);
            if (distance > SUGGESTION_DISTANCE)
                continue;

            if (distance < best)
            {
                best = distance;
                closest.clear();
                closest.add(candidate);
            }
            else if (distance == best)
                closest.add(candidate);
        }

        return closest;
    }

    public static int levenshtein(String a, String b)
    {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++)
            previous[j] = j;

        for (int i = 1; i <= a.length(); i++)
        {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++)
            {
                int substitution = previous[j - 1] + (a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1);
                current[j] = Math.min(substitution, Math.min(previous[j] + 1, current[j - 1] + 1));
            }

            int[] swap = previous;
            previous = current;
            current = swap;
        }

        return previous[b.length()];
    }

    private void trace(String message)
    {
        if (debug)
            LogicExpr.printOut("[Evaluator] " + message);
    }
}
