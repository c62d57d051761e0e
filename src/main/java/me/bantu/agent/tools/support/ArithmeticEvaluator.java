package me.bantu.agent.tools.support;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.math.BigInteger;

/**
 * Evaluates arithmetic expressions over numeric literals.
 *
 * <p>
 * Supported: {@code + - * / % **}, unary {@code +} and {@code -}, and
 * parentheses. Integer operands stay exact (arbitrary precision) under
 * {@code + - * %} and non-negative powers; {@code /} always yields a
 * floating-point result. {@code %} takes the sign of the divisor and
 * {@code **} binds tighter than a unary minus on its left, so {@code -2**2}
 * is {@code -4}. Names, calls and every other operator are rejected.
 */
public final class ArithmeticEvaluator {

    private static final int MAX_EXPONENT = 10_000;

    private final String source;
    private int pos;

    private ArithmeticEvaluator(String source) {
        this.source = source;
    }

    /**
     * @throws IllegalArgumentException
     *             if the expression is malformed or uses unsupported syntax
     * @throws ArithmeticException
     *             on division by zero or an oversized exponent
     */
    public static Number evaluate(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Invalid expression");
        }
        ArithmeticEvaluator evaluator = new ArithmeticEvaluator(expression);
        Number result = evaluator.parseExpression();
        evaluator.skipWhitespace();
        if (evaluator.pos < evaluator.source.length()) {
            throw evaluator.unexpected();
        }
        return result;
    }

    /**
     * Formats a result the way it is shown to the user: integers without a
     * fractional part, doubles in their shortest round-trip form.
     */
    public static String format(Number value) {
        if (value instanceof BigInteger integer) {
            return integer.toString();
        }
        return Double.toString(value.doubleValue());
    }

    // ==================== Grammar ====================

    private Number parseExpression() {
        Number left = parseTerm();
        while (true) {
            if (consume('+')) {
                left = add(left, parseTerm());
            } else if (consume('-')) {
                left = subtract(left, parseTerm());
            } else {
                return left;
            }
        }
    }

    private Number parseTerm() {
        Number left = parseFactor();
        while (true) {
            skipWhitespace();
            if (lookingAt("//")) {
                throw new IllegalArgumentException("Unsupported expression");
            }
            if (consume('*')) {
                left = multiply(left, parseFactor());
            } else if (consume('/')) {
                left = divide(left, parseFactor());
            } else if (consume('%')) {
                left = modulo(left, parseFactor());
            } else {
                return left;
            }
        }
    }

    private Number parseFactor() {
        if (consume('+')) {
            return parseFactor();
        }
        if (consume('-')) {
            return negate(parseFactor());
        }
        return parsePower();
    }

    private Number parsePower() {
        Number base = parsePrimary();
        skipWhitespace();
        if (lookingAt("**")) {
            pos += 2;
            return power(base, parseFactor());
        }
        return base;
    }

    private Number parsePrimary() {
        skipWhitespace();
        if (consume('(')) {
            Number inner = parseExpression();
            if (!consume(')')) {
                throw unexpected();
            }
            return inner;
        }
        if (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '.')) {
            return parseNumber();
        }
        if (pos < source.length() && Character.isLetter(source.charAt(pos))) {
            throw new IllegalArgumentException("Unsupported expression");
        }
        throw unexpected();
    }

    private Number parseNumber() {
        int start = pos;
        boolean floating = false;
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos < source.length() && source.charAt(pos) == '.') {
            floating = true;
            pos++;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                floating = true;
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    pos++;
                }
            } else {
                pos = mark;
            }
        }
        String literal = source.substring(start, pos);
        if (".".equals(literal)) {
            throw new IllegalArgumentException("Invalid expression");
        }
        return floating ? (Number) Double.parseDouble(literal) : (Number) new BigInteger(literal);
    }

    private boolean consume(char expected) {
        skipWhitespace();
        if (pos < source.length() && source.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private boolean lookingAt(String token) {
        return source.startsWith(token, pos);
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private IllegalArgumentException unexpected() {
        return new IllegalArgumentException("Invalid expression");
    }

    // ==================== Arithmetic ====================

    private static Number add(Number a, Number b) {
        if (a instanceof BigInteger x && b instanceof BigInteger y) {
            return x.add(y);
        }
        return a.doubleValue() + b.doubleValue();
    }

    private static Number subtract(Number a, Number b) {
        if (a instanceof BigInteger x && b instanceof BigInteger y) {
            return x.subtract(y);
        }
        return a.doubleValue() - b.doubleValue();
    }

    private static Number multiply(Number a, Number b) {
        if (a instanceof BigInteger x && b instanceof BigInteger y) {
            return x.multiply(y);
        }
        return a.doubleValue() * b.doubleValue();
    }

    private static Number divide(Number a, Number b) {
        if (b.doubleValue() == 0.0) {
            throw new ArithmeticException("division by zero");
        }
        return a.doubleValue() / b.doubleValue();
    }

    private static Number modulo(Number a, Number b) {
        if (a instanceof BigInteger x && b instanceof BigInteger y) {
            if (y.signum() == 0) {
                throw new ArithmeticException("integer modulo by zero");
            }
            BigInteger r = x.mod(y.abs());
            return y.signum() < 0 && r.signum() != 0 ? r.add(y) : r;
        }
        double divisor = b.doubleValue();
        if (divisor == 0.0) {
            throw new ArithmeticException("float modulo");
        }
        double r = a.doubleValue() % divisor;
        if (r != 0.0 && (r < 0) != (divisor < 0)) {
            r += divisor;
        }
        return r;
    }

    private static Number negate(Number a) {
        if (a instanceof BigInteger x) {
            return x.negate();
        }
        return -a.doubleValue();
    }

    private static Number power(Number base, Number exponent) {
        if (base instanceof BigInteger x && exponent instanceof BigInteger y && y.signum() >= 0) {
            if (y.compareTo(BigInteger.valueOf(MAX_EXPONENT)) > 0) {
                throw new ArithmeticException("exponent too large");
            }
            return x.pow(y.intValue());
        }
        if (base.doubleValue() == 0.0 && exponent.doubleValue() < 0) {
            throw new ArithmeticException("0.0 cannot be raised to a negative power");
        }
        return Math.pow(base.doubleValue(), exponent.doubleValue());
    }
}
