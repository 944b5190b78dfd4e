package dumb.fournines;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.fail;

public abstract class AbstractTest {

    protected static Expr parse(String text) {
        try {
            return ExprParser.parse(text);
        } catch (ExprParser.ParseException e) {
            fail("Failed to parse expression '" + text + "': " + e.getMessage());
            return null;
        }
    }

    protected static Expr.Num num(String literal) {
        return Expr.Num.of(literal);
    }

    protected static Expr.UnaryOp unary(Operator.Unary op, Expr operand) {
        return new Expr.UnaryOp(op, operand);
    }

    protected static Expr.BinaryOp binary(Operator.Binary op, Expr left, Expr right) {
        return new Expr.BinaryOp(op, left, right);
    }

    protected static BigDecimal eval(Expr expr) {
        try {
            return expr.eval();
        } catch (EvalException e) {
            fail("Unexpected evaluation failure for " + expr + ": " + e.getMessage());
            return null;
        }
    }

    protected static void assertValue(String expected, Expr expr) {
        var actual = eval(expr);
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
                () -> expr + " evaluated to " + actual.toPlainString() + ", expected " + expected);
    }

    protected static EvalException assertFails(EvalException.Kind kind, Expr expr) {
        var e = assertThrows(EvalException.class, expr::eval, () -> expr + " should not evaluate");
        assertEquals(kind, e.kind(), e.getMessage());
        return e;
    }
}
