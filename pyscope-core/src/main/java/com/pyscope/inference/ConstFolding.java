package com.pyscope.inference;

import com.pyscope.ast.Const;
import com.pyscope.ast.Node;
import com.pyscope.ast.Uninferable;

/**
 * Arithmetic on number and string constants.
 */
final class ConstFolding {

    private static final int MAX_STRING_LENGTH = 1 << 16;

    private ConstFolding() {
        // Utility class
    }

    /**
     * Folds {@code left op right}, or returns {@link Uninferable} when the
     * operation is unsupported, overflows or would raise at runtime.
     */
    static Node fold(Const left, String op, Const right) {
        Object a = left.value();
        Object b = right.value();
        Object result;
        try {
            if (a instanceof String text && b instanceof String other) {
                result = "+".equals(op) ? text + other : null;
            } else if (a instanceof String text && isInt(b)) {
                result = "*".equals(op) ? repeat(text, asLong(b)) : null;
            } else if (isInt(a) && b instanceof String text) {
                result = "*".equals(op) ? repeat(text, asLong(a)) : null;
            } else if (isInt(a) && isInt(b)) {
                result = integral(asLong(a), op, asLong(b));
            } else if (isNumber(a) && isNumber(b)) {
                result = floating(asDouble(a), op, asDouble(b));
            } else {
                result = null;
            }
        } catch (ArithmeticException e) {
            // division by zero or overflow
            result = null;
        }
        return result == null ? Uninferable.INSTANCE : new Const(left.line(), left.col(), result);
    }

    private static Object integral(long a, String op, long b) {
        switch (op) {
            case "+":
                return Math.addExact(a, b);
            case "-":
                return Math.subtractExact(a, b);
            case "*":
                return Math.multiplyExact(a, b);
            case "/":
                if (b == 0) {
                    throw new ArithmeticException("division by zero");
                }
                return (double) a / b;
            case "//":
                return Math.floorDiv(a, b);
            case "%":
                return Math.floorMod(a, b);
            case "**":
                if (b < 0) {
                    return Math.pow(a, b);
                }
                return power(a, b);
            default:
                return null;
        }
    }

    private static Object floating(double a, String op, double b) {
        switch (op) {
            case "+":
                return a + b;
            case "-":
                return a - b;
            case "*":
                return a * b;
            case "/":
                if (b == 0) {
                    throw new ArithmeticException("division by zero");
                }
                return a / b;
            case "//":
                if (b == 0) {
                    throw new ArithmeticException("division by zero");
                }
                return Math.floor(a / b);
            case "**":
                return Math.pow(a, b);
            default:
                return null;
        }
    }

    private static long power(long base, long exponent) {
        if (base == 0 || base == 1) {
            return exponent == 0 ? 1 : base;
        }
        if (base == -1) {
            return exponent % 2 == 0 ? 1 : -1;
        }
        long result = 1;
        for (long i = 0; i < exponent; i++) {
            result = Math.multiplyExact(result, base);
        }
        return result;
    }

    private static String repeat(String text, long times) {
        if (times <= 0 || text.isEmpty()) {
            return "";
        }
        if (times > MAX_STRING_LENGTH / text.length()) {
            throw new ArithmeticException("string too long");
        }
        return text.repeat((int) times);
    }

    private static boolean isInt(Object value) {
        return Containers.isIntegral(value);
    }

    private static boolean isNumber(Object value) {
        return value instanceof Number;
    }

    private static long asLong(Object value) {
        return ((Number) value).longValue();
    }

    private static double asDouble(Object value) {
        return ((Number) value).doubleValue();
    }
}
