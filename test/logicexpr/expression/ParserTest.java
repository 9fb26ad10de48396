package logicexpr.expression;

import logicexpr.expression.error.EndOfInputException;
import logicexpr.expression.error.LexicalException;
import logicexpr.expression.error.MissingOperandException;
import logicexpr.expression.error.MissingParenthesisException;
import logicexpr.expression.error.ParseException;
import logicexpr.expression.error.UnexpectedTokenException;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static logicexpr.expression.BinOp.and;
import static logicexpr.expression.BinOp.or;
import static org.junit.jupiter.api.Assertions.*;

class ParserTest
{
    private static final Var A = new Var("A");
    private static final Var B = new Var("B");
    private static final Var C = new Var("C");

    @Test
    void testPrecedenceNotAndOr()
    {
        assertEquals(or(A, and(B, new Not(C))), Expressions.parse("A OR B AND NOT C"));
    }

    @Test
    void testParenthesesOverridePrecedence()
    {
        assertEquals(and(or(A, B), C), Expressions.parse("(A OR B) AND C"));
    }

    @Test
    void testBinaryOperatorsAreLeftAssociative()
    {
        assertEquals(and(and(A, B), C), Expressions.parse("A AND B AND C"));
        assertEquals(or(or(A, B), C), Expressions.parse("A or B or C"));
    }

    @Test
    void testNotStacks()
    {
        assertEquals(new Not(new Not(A)), Expressions.parse("NOT NOT A"));
        assertEquals(and(new Not(A), B), Expressions.parse("NOT A AND B"));
        assertEquals(new Not(and(A, B)), Expressions.parse("NOT (A AND B)"));
    }

    @Test
    void testLongNotChain()
    {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 20000; i++)
            sb.append("NOT ");

        Expression expr = Expressions.parse(sb + "A");
        int depth = 0;
        while (expr instanceof Not)
        {
            depth++;
            expr = ((Not) expr).getOperand();
        }
        assertEquals(20000, depth);
        assertEquals(A, expr);

        assertEquals("NOT", assertThrows(MissingOperandException.class, () -> Expressions.parse(sb.toString())).getOperator());
    }

    @Test
    void testLiterals()
    {
        assertEquals(and(BoolLit.TRUE, BoolLit.FALSE), Expressions.parse("TRUE AND false"));
        assertEquals(BoolLit.TRUE, Expressions.parse("((True))"));
    }

    @Test
    void testCommentsAndNewlines()
    {
        assertEquals(or(A, B), Expressions.parse("A # first\nOR\nB"));
    }

    @Test
    void testMissingOperandAfterAnd()
    {
        MissingOperandException e = assertThrows(MissingOperandException.class, () -> Expressions.parse("A AND"));

        assertEquals("AND", e.getOperator());
        assertEquals(1, e.getLine());
        assertEquals(3, e.getColumn());
        assertTrue(e.getMessage().contains("AND"));
    }

    @Test
    void testMissingOperandNamesOperatorInSourceOrder()
    {
        assertEquals("OR", assertThrows(MissingOperandException.class, () -> Expressions.parse("A or )")).getOperator());
        assertEquals("NOT", assertThrows(MissingOperandException.class, () -> Expressions.parse("A AND NOT")).getOperator());
        assertEquals("AND", assertThrows(MissingOperandException.class, () -> Expressions.parse("A AND OR B")).getOperator());
    }

    @Test
    void testMissingParenthesis()
    {
        MissingParenthesisException e = assertThrows(MissingParenthesisException.class, () -> Expressions.parse("(A OR B"));

        assertEquals(1, e.getLine());
        assertEquals(1, e.getColumn());
        assertEquals("end of input", e.getFound());
    }

    @Test
    void testMissingParenthesisBeforeUnexpectedToken()
    {
        MissingParenthesisException e = assertThrows(MissingParenthesisException.class, () -> Expressions.parse("A AND\n (B C)"));

        assertEquals(2, e.getLine());
        assertEquals(2, e.getColumn());
        assertEquals("C", e.getFound());
    }

    @Test
    void testTrailingInput()
    {
        UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class, () -> Expressions.parse("A AND B C"));

        assertEquals("C", e.getFound());
        assertEquals(9, e.getColumn());

        e = assertThrows(UnexpectedTokenException.class, () -> Expressions.parse("A)"));
        assertEquals(")", e.getFound());
    }

    @Test
    void testUnexpectedLeadingOperator()
    {
        UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class, () -> Expressions.parse("AND B"));

        assertEquals("AND", e.getFound());
        assertEquals(1, e.getColumn());
    }

    @Test
    void testEmptyParentheses()
    {
        assertEquals(")", assertThrows(UnexpectedTokenException.class, () -> Expressions.parse("()")).getFound());
    }

    @Test
    void testEndOfInput()
    {
        EndOfInputException e = assertThrows(EndOfInputException.class, () -> Expressions.parse("  "));
        assertEquals(1, e.getLine());
        assertEquals(3, e.getColumn());

        assertThrows(EndOfInputException.class, () -> Expressions.parse("# only a comment"));
        assertThrows(EndOfInputException.class, () -> Expressions.parse("A AND ("));
    }

    @Test
    void testAllParseErrorsShareBase()
    {
        for (String source : new String[] {"A AND", "(A", "A B", ""})
            assertThrows(ParseException.class, () -> Expressions.parse(source), source);
    }

    @Test
    void testLexicalErrorsPassThrough()
    {
        assertThrows(LexicalException.class, () -> Expressions.parse("A | B"));
    }

    @Test
    void testLookaheadDoesNotConsume()
    {
        Parser parser = new Parser("A AND B");

        assertEquals(TokenType.AND, parser.peek(1).getType());
        assertEquals(TokenType.IDENT, parser.peek(0).getType());
        assertEquals(TokenType.EOF, parser.peek(10).getType());
        assertEquals(and(A, B), parser.build());
    }

    @Test
    void testBuildIsRepeatable()
    {
        Parser parser = new Parser("NOT A");

        assertSame(parser.build(), parser.build());
    }

    @Test
    void testTokensMustEndWithEof()
    {
        assertThrows(IllegalArgumentException.class, () -> new Parser(Collections.emptyList(), ""));
    }

    @Test
    void testDebugTraceDoesNotChangeResult()
    {
        assertEquals(or(A, B), new Parser("A OR B").setDebug(true).build());
    }
}
