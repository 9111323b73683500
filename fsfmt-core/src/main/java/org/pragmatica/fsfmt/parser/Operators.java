package org.pragmatica.fsfmt.parser;

import java.util.Set;

/**
 * Precedence and associativity of infix operators, classified by their leading characters.
 */
public final class Operators {
    public static final int RANGE = 1;
    public static final int ASSIGNMENT = 2;
    public static final int OR = 3;
    public static final int AND = 4;
    public static final int COMPARISON = 5;
    public static final int CONCAT = 6;
    public static final int CONS = 7;
    public static final int ADDITIVE = 8;
    public static final int MULTIPLICATIVE = 9;
    public static final int POWER = 10;

    private static final Set<String> NEVER_BREAK = Set.of("=", "<", ">", "%");

    private Operators() {}

    public static int precedence(String operator) {
        if (operator.equals("..")) {
            return RANGE;
        }
        if (operator.equals("<-") || operator.equals(":=")) {
            return ASSIGNMENT;
        }
        if (operator.equals("||") || operator.equals("or")) {
            return OR;
        }
        if (operator.equals("&&") || operator.equals("&")) {
            return AND;
        }
        if (operator.equals("::")) {
            return CONS;
        }
        if (operator.startsWith("**")) {
            return POWER;
        }
        return switch (operator.charAt(0)) {
            case '^', '@' -> CONCAT;
            case '+', '-' -> ADDITIVE;
            case '*', '/', '%' -> MULTIPLICATIVE;
            default -> COMPARISON;
        };
    }

    public static boolean isRightAssociative(String operator) {
        var precedence = precedence(operator);
        return precedence == ASSIGNMENT || precedence == CONCAT || precedence == CONS || precedence == POWER;
    }

    /**
     * Operators whose chains always stay on one line.
     */
    public static boolean neverBreaks(String operator) {
        return NEVER_BREAK.contains(operator);
    }

    /**
     * Operators that may start an expression.
     */
    public static boolean isPrefix(String operator) {
        return operator.equals("-") || operator.equals("+") || operator.equals("-.") || operator.equals("+.")
               || operator.startsWith("!") || operator.startsWith("~") || operator.equals("&")
               || operator.equals("&&") || operator.equals("%") || operator.equals("%%");
    }

    /**
     * Operators that never appear between two operands.
     */
    public static boolean isPrefixOnly(String operator) {
        return (operator.startsWith("!") && !operator.equals("!=")) || operator.startsWith("~");
    }

    /**
     * Type-test and cast operators take a type on the right and are not supported as infix expressions.
     */
    public static boolean isTypeOperator(String operator) {
        return operator.equals(":>") || operator.equals(":?>") || operator.equals(":?");
    }
}
