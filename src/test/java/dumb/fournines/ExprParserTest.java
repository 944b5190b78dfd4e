package dumb.fournines;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static dumb.fournines.Operator.Binary.*;
import static dumb.fournines.Operator.Unary.*;
import static org.junit.jupiter.api.Assertions.*;

class ExprParserTest extends AbstractTest {

    @Test
    void parsesFullyParenthesizedBinary() {
        var expr = parse("((1 + 1) * (1 + 1))");
        var b = assertInstanceOf(Expr.BinaryOp.class, expr);
        assertEquals(MULTIPLY, b.op());
        assertValue("4", expr);
        assertEquals("((1 + 1) * (1 + 1))", expr.toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "sqrt(16)", "(5!)", "-5", "-(sqrt(4))", "-((5 + 5))", "(5 - -5)",
            "((sqrt(4)!) + 0.5)", "(-((1 + 1)) * 5)", "sqrt(sqrt(16))", "((9 % 2) ^ 0.5)"
    })
    void canonicalFormsRoundTrip(String text) {
        assertEquals(text, parse(text).toString());
    }

    @Test
    void unaryForms() {
        assertEquals(new Expr.UnaryOp(SQRT, num("16")), parse("sqrt(16)"));
        assertEquals(new Expr.UnaryOp(FACTORIAL, num("5")), parse("(5!)"));
        assertEquals(new Expr.UnaryOp(NEGATE, unary(SQRT, num("4"))), parse("-(sqrt(4))"));
        assertEquals(new Expr.UnaryOp(FACTORIAL, unary(SQRT, num("4"))), parse("sqrt(4)!"));
    }

    @Test
    void negativeLiterals() {
        assertEquals(num("-5"), parse("-5"));
        assertEquals(num("-0.5"), parse("-.5"));
        assertValue("10", parse("(5 - -5)"));
        assertValue("-10", parse("(-(1 + 1) * 5)"));
    }

    @Test
    void precedenceWithoutParentheses() {
        assertValue("7", parse("1 + 2 * 3"));
        assertValue("3", parse("8 - 3 - 2"));
        assertValue("18", parse("2 * 3 ^ 2"));
        assertValue("5", parse("sqrt(4) + sqrt(9)"));
        assertValue("-4", parse("-2 * 2"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "()", "(1 + 1", "1 + 1)", "1 +", "* 2", "abc", "sqrt()", "5 5", "-", "!"})
    void rejectsMalformedInput(String text) {
        assertThrows(ExprParser.ParseException.class, () -> ExprParser.parse(text));
    }

    @Test
    void errorCarriesFragment() {
        var e = assertThrows(ExprParser.ParseException.class, () -> ExprParser.parse("(1 + x)"));
        assertEquals("x", e.fragment());
        assertEquals("Invalid number near 'x'", e.getMessage());
    }
}
