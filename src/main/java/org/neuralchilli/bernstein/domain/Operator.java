package org.neuralchilli.bernstein.domain;

import java.util.OptionalInt;

/**
 * Binary integer operators available to {@link Instruction.Arithmetic}.
 */
public enum Operator {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    /**
     * Floor division. Division by zero yields no value.
     */
    DIV("/");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public OptionalInt apply(int left, int right) {
        return switch (this) {
            case ADD -> OptionalInt.of(left + right);
            case SUB -> OptionalInt.of(left - right);
            case MUL -> OptionalInt.of(left * right);
            case DIV -> right == 0 ? OptionalInt.empty() : OptionalInt.of(Math.floorDiv(left, right));
        };
    }

    /**
     * Parse operator from its lowercase name (add, sub, mul, div)
     */
    public static Operator fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Operator cannot be null");
        }
        try {
            return valueOf(value.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown operator: " + value, e);
        }
    }
}
