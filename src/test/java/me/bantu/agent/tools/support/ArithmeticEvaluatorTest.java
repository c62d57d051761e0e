package me.bantu.agent.tools.support;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ArithmeticEvaluatorTest {

    private static String eval(String expression) {
        return ArithmeticEvaluator.format(ArithmeticEvaluator.evaluate(expression));
    }

    // ===== Precedence =====

    @Test
    void shouldRespectOperatorPrecedence() {
        assertEquals("8", eval("2 + 2 * 3"));
        assertEquals("12", eval("(2 + 2) * 3"));
        assertEquals("1", eval("7 - 3 - 3"));
    }

    @Test
    void shouldTreatPowerAsRightAssociative() {
        assertEquals("512", eval("2 ** 3 ** 2"));
    }

    @Test
    void shouldBindPowerTighterThanUnaryMinus() {
        assertEquals("-4", eval("-2 ** 2"));
        assertEquals("4", eval("(-2) ** 2"));
        assertEquals("0.5", eval("2 ** -1"));
    }

    @Test
    void shouldSupportUnaryOperators() {
        assertEquals("-3", eval("-3"));
        assertEquals("3", eval("--3"));
        assertEquals("5", eval("2 ++3"));
        assertEquals("-6", eval("2 * -3"));
    }

    // ===== Numbers =====

    @Test
    void shouldAlwaysDivideToFloat() {
        assertEquals("2.0", eval("4 / 2"));
        assertEquals("2.5", eval("5 / 2"));
    }

    @Test
    void shouldKeepIntegersExact() {
        assertEquals("1267650600228229401496703205376", eval("2 ** 100"));
    }

    @Test
    void shouldMixIntegersAndFloats() {
        assertEquals("3.5", eval("1.5 + 2"));
        assertEquals("0.30000000000000004", eval("0.1 + 0.2"));
        assertEquals("1000.0", eval("1e3"));
        assertEquals("0.5", eval(".5"));
    }

    @Test
    void shouldTakeModuloSignFromDivisor() {
        assertEquals("1", eval("7 % 3"));
        assertEquals("2", eval("-7 % 3"));
        assertEquals("-2", eval("7 % -3"));
        assertEquals("1.5", eval("5.5 % 2"));
        assertEquals("0.5", eval("-1.5 % 2"));
    }

    // ===== Errors =====

    @Test
    void shouldRejectDivisionByZero() {
        ArithmeticException error = assertThrows(ArithmeticException.class, () -> eval("1 / 0"));
        assertEquals("division by zero", error.getMessage());
        assertThrows(ArithmeticException.class, () -> eval("1 % 0"));
        assertThrows(ArithmeticException.class, () -> eval("0 ** -1"));
    }

    @Test
    void shouldRejectHugeExponent() {
        assertThrows(ArithmeticException.class, () -> eval("2 ** 100000"));
    }

    @Test
    void shouldRejectNames() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> eval("__import__('os')"));
        assertEquals("Invalid expression", error.getMessage());
        assertEquals("Unsupported expression",
                assertThrows(IllegalArgumentException.class, () -> eval("abs(1)")).getMessage());
    }

    @Test
    void shouldRejectFloorDivision() {
        assertEquals("Unsupported expression",
                assertThrows(IllegalArgumentException.class, () -> eval("7 // 2")).getMessage());
    }

    @Test
    void shouldRejectMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> eval("1 +"));
        assertThrows(IllegalArgumentException.class, () -> eval("(1 + 2"));
        assertThrows(IllegalArgumentException.class, () -> eval("1 2"));
        assertThrows(IllegalArgumentException.class, () -> eval("   "));
        assertThrows(IllegalArgumentException.class, () -> eval("."));
    }
}
