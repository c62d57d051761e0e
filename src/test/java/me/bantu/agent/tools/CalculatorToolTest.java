package me.bantu.agent.tools;

import me.bantu.agent.domain.component.ToolArgumentException;
import me.bantu.agent.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CalculatorToolTest {

    private static final String EXPRESSION = "expression";

    private final CalculatorTool tool = new CalculatorTool();

    private ToolResult calculate(String expression) throws InterruptedException {
        return FileToolsTestSupport.run(tool, Map.of(EXPRESSION, expression));
    }

    @Test
    void shouldRespectOperatorPrecedence() throws Exception {
        ToolResult result = calculate("2 + 2 * 3");

        assertTrue(result.isSuccess());
        assertEquals("8", result.getOutput());
        assertEquals(BigInteger.valueOf(8), result.getData());
    }

    @Test
    void shouldKeepLargeIntegersExact() throws Exception {
        assertEquals("1267650600228229401496703205376", calculate("2 ** 100").getOutput());
    }

    @Test
    void shouldAlwaysDivideAsFloatingPoint() throws Exception {
        assertEquals("3.5", calculate("7 / 2").getOutput());
        assertEquals("2.0", calculate("10 / 5").getOutput());
    }

    @Test
    void shouldTakeModuloSignFromDivisor() throws Exception {
        assertEquals("2", calculate("-7 % 3").getOutput());
    }

    @Test
    void shouldFailOnDivisionByZero() throws Exception {
        ToolResult result = calculate("1 / 0");

        assertFalse(result.isSuccess());
        assertEquals("division by zero", result.getError());
    }

    @Test
    void shouldRejectFunctionCalls() throws Exception {
        ToolResult result = calculate("abs(-1)");

        assertFalse(result.isSuccess());
        assertEquals("Unsupported expression", result.getError());
    }

    @Test
    void shouldRejectMissingExpression() {
        Map<String, Object> empty = Map.of();

        ToolArgumentException error = assertThrows(ToolArgumentException.class, () -> tool.execute(empty));
        assertEquals("missing required argument 'expression'", error.getMessage());
    }

    @Test
    void shouldRejectNonStringExpression() {
        Map<String, Object> args = Map.of(EXPRESSION, 42);

        assertThrows(ToolArgumentException.class, () -> tool.execute(args));
    }
}
