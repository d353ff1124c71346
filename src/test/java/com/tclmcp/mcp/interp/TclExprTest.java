package com.tclmcp.mcp.interp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.tclmcp.mcp.errors.InterpreterException;

class TclExprTest {

    private EmbeddedTclRuntime tcl;

    @BeforeEach
    void setUp() {
        tcl = new EmbeddedTclRuntime();
    }

    private String expr(String expression) throws InterpreterException {
        return tcl.eval("expr {" + expression + "}");
    }

    @ParameterizedTest
    @CsvSource(delimiterString = "=>", value = {
        "1 + 2 * 3 => 7",
        "(1 + 2) * 3 => 9",
        "7 / 2 => 3",
        "-7 / 2 => -4",
        "7 % -2 => -1",
        "7.0 / 2 => 3.5",
        "1.0 * 2 => 2.0",
        "2 ** 10 => 1024",
        "1e3 => 1000.0",
        "0x10 + 1 => 17",
        "1 << 4 => 16",
        "5 & 3 => 1",
        "5 | 3 => 7",
        "5 ^ 3 => 6",
        "~0 => -1",
        "!0 => 1",
        "3 >= 3 => 1",
        "2 != 2 => 0",
    })
    void testArithmeticAndBitwise(String expression, String expected) throws InterpreterException {
        assertEquals(expected, expr(expression));
    }

    @ParameterizedTest
    @CsvSource(delimiterString = "=>", value = {
        "abs(-5) => 5",
        "round(2.5) => 3",
        "sqrt(16) => 4.0",
        "max(1, 5, 3) => 5",
        "min(2.5, 1) => 1",
        "int(3.9) => 3",
        "double(3) => 3.0",
        "floor(2.7) => 2.0",
        "ceil(2.1) => 3.0",
        "pow(2, 3) => 8.0",
    })
    void testFunctions(String expression, String expected) throws InterpreterException {
        assertEquals(expected, expr(expression));
    }

    @Test
    void testStringComparison() throws InterpreterException {
        assertEquals("1", expr("\"abc\" eq \"abc\""));
        assertEquals("1", expr("\"abc\" ne \"abd\""));
        assertEquals("1", expr("\"apple\" < \"banana\""));
    }

    @Test
    void testVariablesAndCommands() throws InterpreterException {
        tcl.setVar("a", "2");
        tcl.setVar("b", "3");

        assertEquals("5", expr("$a + $b"));
        assertEquals("8", expr("[string length $a$b] * 4"));
    }

    @Test
    void testTernary() throws InterpreterException {
        assertEquals("yes", expr("1 < 2 ? \"yes\" : \"no\""));
        assertEquals("2", expr("0 ? [error boom] : 2"));
    }

    @Test
    void testLogicalOperatorsShortCircuit() throws InterpreterException {
        assertEquals("0", expr("0 && [error boom]"));
        assertEquals("1", expr("1 || [error boom]"));
        assertEquals("0", expr("0 && $undefined"));
    }

    @Test
    void testBooleanWords() throws InterpreterException {
        assertEquals("1", expr("true && yes"));
        assertEquals("0", expr("off || false"));
    }

    @Test
    void testUnbracedArgumentsAreJoined() throws InterpreterException {
        assertEquals("3", tcl.eval("expr 1 + 2"));
    }

    @Test
    void testDivideByZero() {
        final InterpreterException e = assertThrows(InterpreterException.class, () -> expr("1 / 0"));

        assertTrue(e.getMessage().contains("divide by zero"));
    }

    @Test
    void testInvalidBareword() {
        final InterpreterException e = assertThrows(InterpreterException.class, () -> expr("foo + 1"));

        assertTrue(e.getMessage().contains("invalid bareword \"foo\""));
    }

    @Test
    void testNonNumericOperand() {
        assertThrows(InterpreterException.class, () -> expr("\"abc\" + 1"));
    }

    @Test
    void testEmptyExpression() {
        assertThrows(InterpreterException.class, () -> tcl.eval("expr {}"));
    }

    @Test
    void testUnbalancedParentheses() {
        assertThrows(InterpreterException.class, () -> expr("(1 + 2"));
    }

    @Test
    void testFormat() {
        assertEquals("2.0", TclExpr.format(2.0));
        assertEquals("2.5", TclExpr.format(2.5));
        assertEquals("Inf", TclExpr.format(Double.POSITIVE_INFINITY));
        assertEquals("42", TclExpr.format(42L));
    }

    @Test
    void testAsNumber() {
        assertEquals(42L, TclExpr.asNumber(" 42 "));
        assertEquals(255L, TclExpr.asNumber("0xff"));
        assertEquals(1.5, TclExpr.asNumber("1.5"));
        assertNull(TclExpr.asNumber("abc"));
        assertNull(TclExpr.asNumber(""));
    }

    @Test
    void testToBoolean() {
        assertTrue(TclExpr.toBoolean("yes"));
        assertFalse(TclExpr.toBoolean("0"));
        assertTrue(TclExpr.toBoolean(2.5));
        assertThrows(TclError.class, () -> TclExpr.toBoolean("maybe"));
    }
}
