package dumb.fournines;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static dumb.fournines.EvalException.Kind.*;
import static dumb.fournines.Expr.Step.*;
import static dumb.fournines.Operator.Binary.*;
import static dumb.fournines.Operator.Unary.*;
import static org.junit.jupiter.api.Assertions.*;

class ExprTest extends AbstractTest {

    @Test
    void numberEvaluatesToItself() {
        var n = num("5");
        assertValue("5", n);
        assertEquals("5", n.toString());
    }

    @Test
    void leadingDotLiteralRendersPlain() {
        assertEquals("0.5", num(".5").toString());
        assertEquals("55.55", num("55.55").toString());
    }

    @Test
    void factorial() {
        var f = unary(FACTORIAL, num("5"));
        assertValue("120", f);
        assertEquals("(5!)", f.toString());
        assertValue("1", unary(FACTORIAL, num("0")));
    }

    @Test
    void squareRoot() {
        var s = unary(SQRT, num("16"));
        assertValue("4", s);
        assertEquals("sqrt(16)", s.toString());
        assertValue("1.5", unary(SQRT, num("2.25")));
    }

    @Test
    void fixedPoints() {
        assertEquals(num("1").value(), eval(unary(FACTORIAL, num("1"))));
        assertEquals(num("0").value(), eval(unary(SQRT, num("0"))));
        assertEquals(num("1").value(), eval(unary(SQRT, num("1"))));
    }

    @ParameterizedTest
    @CsvSource({
            "+, 5, 3, 8",
            "-, 5, 3, 2",
            "*, 5, 3, 15",
            "/, 15, 3, 5",
            "^, 2, 3, 8",
            "%, 17, 5, 2",
            "^, -2, 3, -8",
            "^, 2, -2, 0.25",
            "^, 4, 0.5, 2",
            "/, 1, 3, 0.3333333333",
    })
    void binaryOperators(String op, String left, String right, String expected) {
        assertValue(expected, binary(Operator.Binary.of(op.charAt(0)), num(left), num(right)));
    }

    @Test
    void nestedExpression() {
        var expr = binary(MULTIPLY,
                binary(ADD, unary(FACTORIAL, num("5")), unary(SQRT, num("16"))),
                num("2"));
        assertValue("248", expr);
        assertEquals("(((5!) + sqrt(16)) * 2)", expr.toString());
    }

    @Test
    void negationRendering() {
        assertEquals("-5", unary(NEGATE, num("5")).toString());
        assertEquals("-((5 + 5))", unary(NEGATE, binary(ADD, num("5"), num("5"))).toString());
        assertEquals("-(sqrt(4))", unary(NEGATE, unary(SQRT, num("4"))).toString());
        assertValue("-10", unary(NEGATE, binary(ADD, num("5"), num("5"))));
    }

    @Test
    void renderingIsDeterministic() {
        var expr = binary(DIVIDE, unary(NEGATE, num("1.1")), binary(POWER, num("11"), unary(SQRT, num("1"))));
        assertEquals(expr.toString(), expr.toString());
        assertEquals(expr.toString(), expr.copy().toString());
    }

    @Test
    void evaluationFailures() {
        assertFails(RANGE, binary(POWER, num("2"), num("21")));
        assertFails(RANGE, binary(POWER, num("101"), num("2")));
        assertFails(DOMAIN, binary(POWER, num("-8"), num("0.5")));
        assertFails(DOMAIN, binary(POWER, num("0"), num("0")));
        assertFails(DIVISION_BY_ZERO, binary(POWER, num("0"), num("-1")));
        assertFails(DOMAIN, binary(MODULO, num("5.5"), num("2")));
        assertFails(DOMAIN, binary(MODULO, num("5"), num("0.5")));
        assertFails(DIVISION_BY_ZERO, binary(MODULO, num("5"), num("0")));
        assertFails(DIVISION_BY_ZERO, binary(DIVIDE, num("5"), binary(SUBTRACT, num("5"), num("5"))));
        assertFails(DOMAIN, unary(SQRT, num("-4")));
        assertFails(DOMAIN, unary(FACTORIAL, num("2.5")));
        assertFails(DOMAIN, unary(FACTORIAL, num("-3")));
        assertFails(RANGE, unary(FACTORIAL, num("21")));
        assertFails(OVERFLOW, binary(MULTIPLY, unary(FACTORIAL, num("20")), num("100")));
        assertFails(OVERFLOW, binary(POWER, num("100"), num("20")));
    }

    @Test
    void failureMessageNamesReason() {
        var e = assertFails(DIVISION_BY_ZERO, binary(DIVIDE, num("1"), num("0")));
        assertEquals("evaluation failed: division by zero", e.getMessage());
    }

    @Test
    void doubleNegationIsRejected() {
        assertFails(DOUBLE_NEGATION, unary(NEGATE, unary(NEGATE, num("5"))));
        assertFails(DOUBLE_NEGATION, unary(NEGATE, unary(NEGATE, binary(ADD, num("1"), num("1")))));
        assertFails(DOUBLE_NEGATION, unary(NEGATE, unary(NEGATE, unary(SQRT, num("-1")))));
    }

    @Test
    void copyIsDeepAndEqual() {
        var original = binary(ADD, unary(SQRT, num("4")), num("5"));
        var copy = (Expr.BinaryOp) original.copy();
        assertEquals(original, copy);
        assertNotSame(original, copy);
        assertNotSame(original.left(), copy.left());
        assertNotSame(((Expr.UnaryOp) original.left()).operand(), ((Expr.UnaryOp) copy.left()).operand());
    }

    @Test
    void pathsAddressEveryNonRootSubtree() {
        var expr = binary(ADD, unary(SQRT, num("4")), num("5"));
        assertEquals(List.of(List.of(LEFT), List.of(LEFT, OPERAND), List.of(RIGHT)), expr.paths());
        assertEquals("4", expr.at(List.of(LEFT, OPERAND)).toString());
        assertTrue(num("4").paths().isEmpty());
    }

    @Test
    void replaceRebuildsAlongPath() {
        var expr = binary(ADD, unary(SQRT, num("4")), num("5"));
        var replaced = expr.replace(List.of(LEFT, OPERAND), num("9"));
        assertEquals("(sqrt(9) + 5)", replaced.toString());
        assertEquals("(sqrt(4) + 5)", expr.toString());
        assertSame(expr.right(), ((Expr.BinaryOp) replaced).right());
    }

    @Test
    void structuralMeasures() {
        var expr = binary(ADD, unary(SQRT, num("4")), num("5"));
        assertEquals(3, expr.depth());
        assertEquals(4, expr.weight());
        assertEquals(List.of("+", "sqrt"), List.copyOf(expr.operators()));
    }

    @Test
    void negationAndSubtractionShareSymbol() {
        var expr = binary(SUBTRACT, unary(NEGATE, num("4")), num("4"));
        assertEquals(List.of("-"), List.copyOf(expr.operators()));
        assertEquals(2, expr.operatorKinds().size());
    }

    @Test
    void digitCountIsTakenOverTheRendering() {
        assertEquals(3, Expr.countDigit("(11 + 1)", 1));
        assertEquals(4, Expr.countDigit("-((0.5 + 5) * 55)", 5));
        assertEquals(0, Expr.countDigit("sqrt(4)", 9));
    }
}
