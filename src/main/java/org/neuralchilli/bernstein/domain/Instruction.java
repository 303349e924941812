package org.neuralchilli.bernstein.domain;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;

/**
 * An operation executed by a task.
 * Instructions nest: arithmetic, assignment and print take other instructions as operands.
 * Every variant declares the variables it reads and writes so that task domains can be derived
 * without running anything.
 */
public sealed interface Instruction {

    /**
     * Evaluate the instruction against the context's variables.
     *
     * @return the produced value, or empty when the instruction yields nothing
     * (a sleep) or was short-circuited by an operand without a value
     */
    OptionalInt evaluate(ExecutionContext context);

    /**
     * Whether this instruction produces an integer and may be used as an operand
     */
    default boolean yieldsValue() {
        return true;
    }

    default List<Instruction> operands() {
        return List.of();
    }

    /**
     * Variable read by this instruction itself, not counting operands
     */
    default Optional<String> directRead() {
        return Optional.empty();
    }

    /**
     * Variable written by this instruction itself, not counting operands
     */
    default Optional<String> directWrite() {
        return Optional.empty();
    }

    /**
     * All variables read by this instruction and its operands
     */
    default Set<String> reads() {
        Set<String> result = new TreeSet<>();
        directRead().ifPresent(result::add);
        for (Instruction operand : operands()) {
            result.addAll(operand.reads());
        }
        return result;
    }

    /**
     * All variables written by this instruction and its operands
     */
    default Set<String> writes() {
        Set<String> result = new TreeSet<>();
        directWrite().ifPresent(result::add);
        for (Instruction operand : operands()) {
            result.addAll(operand.writes());
        }
        return result;
    }

    // Factories

    static Instruction constant(int value) {
        return new Constant(value);
    }

    static Instruction read(String variable) {
        return new Read(variable);
    }

    static Instruction assign(String variable, Instruction value) {
        return new Assign(variable, value);
    }

    static Instruction assign(String variable, int value) {
        return new Assign(variable, new Constant(value));
    }

    static Instruction add(Instruction left, Instruction right) {
        return new Arithmetic(Operator.ADD, left, right);
    }

    static Instruction sub(Instruction left, Instruction right) {
        return new Arithmetic(Operator.SUB, left, right);
    }

    static Instruction mul(Instruction left, Instruction right) {
        return new Arithmetic(Operator.MUL, left, right);
    }

    static Instruction div(Instruction left, Instruction right) {
        return new Arithmetic(Operator.DIV, left, right);
    }

    static Instruction sleep(int ticks) {
        return new Sleep(ticks);
    }

    static Instruction print(Instruction operand) {
        return new Print(operand);
    }

    private static Instruction requireValue(String owner, String slot, Instruction operand) {
        if (operand == null) {
            throw new IllegalArgumentException(owner + ": operand '" + slot + "' cannot be null");
        }
        if (!operand.yieldsValue()) {
            throw new CompositionException(
                    owner + ": operand '" + slot + "' requires a value but " + operand + " yields none"
            );
        }
        return operand;
    }

    private static String requireName(String variable) {
        if (variable == null || variable.isBlank()) {
            throw new IllegalArgumentException("Variable name cannot be null or empty");
        }
        return variable;
    }

    /**
     * Integer literal
     */
    record Constant(int value) implements Instruction {

        @Override
        public OptionalInt evaluate(ExecutionContext context) {
            return OptionalInt.of(value);
        }

        @Override
        public String toString() {
            return Integer.toString(value);
        }
    }

    /**
     * Current value of a variable; empty while the variable is unset
     */
    record Read(String variable) implements Instruction {

        public Read {
            requireName(variable);
        }

        @Override
        public OptionalInt evaluate(ExecutionContext context) {
            return context.variables().valueOf(variable);
        }

        @Override
        public Optional<String> directRead() {
            return Optional.of(variable);
        }

        @Override
        public String toString() {
            return variable;
        }
    }

    /**
     * Stores the value of an instruction into a variable and yields that value.
     */
    record Assign(String variable, Instruction value) implements Instruction {

        public Assign {
            requireName(variable);
            requireValue("Assign to '" + variable + "'", "value", value);
        }

        @Override
        public OptionalInt evaluate(ExecutionContext context) {
            OptionalInt result = value.evaluate(context);
            if (result.isPresent()) {
                context.variables().assign(variable, result.getAsInt());
            }
            return result;
        }

        @Override
        public List<Instruction> operands() {
            return List.of(value);
        }

        @Override
        public Optional<String> directWrite() {
            return Optional.of(variable);
        }

        @Override
        public String toString() {
            return variable + " = " + value;
        }
    }

    record Arithmetic(Operator operator, Instruction left, Instruction right) implements Instruction {

        public Arithmetic {
            if (operator == null) {
                throw new IllegalArgumentException("Operator cannot be null");
            }
            requireValue(operator.name(), "left", left);
            requireValue(operator.name(), "right", right);
        }

        @Override
        public OptionalInt evaluate(ExecutionContext context) {
            OptionalInt l = left.evaluate(context);
            if (l.isEmpty()) {
                return OptionalInt.empty();
            }
            OptionalInt r = right.evaluate(context);
            if (r.isEmpty()) {
                return OptionalInt.empty();
            }
            return operator.apply(l.getAsInt(), r.getAsInt());
        }

        @Override
        public List<Instruction> operands() {
            return List.of(left, right);
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator.symbol() + " " + right + ")";
        }
    }

    /**
     * Logical delay marker. Does not suspend the worker and yields no value.
     */
    record Sleep(int ticks) implements Instruction {

        public Sleep {
            if (ticks < 0) {
                throw new IllegalArgumentException("Sleep ticks cannot be negative, got: " + ticks);
            }
        }

        @Override
        public OptionalInt evaluate(ExecutionContext context) {
            return OptionalInt.empty();
        }

        @Override
        public boolean yieldsValue() {
            return false;
        }

        @Override
        public String toString() {
            return "sleep(" + ticks + ")";
        }
    }

    /**
     * Writes the operand's value to the run transcript and passes the value through.
     */
    record Print(Instruction operand) implements Instruction {

        public Print {
            requireValue("Print", "operand", operand);
        }

        @Override
        public OptionalInt evaluate(ExecutionContext context) {
            OptionalInt result = operand.evaluate(context);
            if (result.isPresent()) {
                context.emit(operand + " = " + result.getAsInt());
            }
            return result;
        }

        @Override
        public List<Instruction> operands() {
            return List.of(operand);
        }

        @Override
        public String toString() {
            return "print(" + operand + ")";
        }
    }
}
