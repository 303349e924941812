package org.neuralchilli.bernstein.domain;

/**
 * Thrown when an instruction is built with an operand that yields no value
 * (a sleep) in a slot that requires one.
 * Raised at construction time, so a malformed instruction tree never exists.
 */
public class CompositionException extends RuntimeException {

    public CompositionException(String message) {
        super(message);
    }
}
