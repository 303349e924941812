package org.neuralchilli.bernstein.worker;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.bernstein.domain.ExecutionContext;
import org.neuralchilli.bernstein.domain.Instruction;
import org.neuralchilli.bernstein.domain.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalInt;

/**
 * Executes the instructions of one task, strictly in order.
 * An instruction that should yield a value but does not (an unset variable was read, or a
 * division by zero occurred) performed no write and is reported as skipped.
 */
@ApplicationScoped
public class TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    /**
     * Execute a task against the context's variables.
     *
     * @return counts of executed and skipped instructions
     */
    public TaskResult execute(Task task, ExecutionContext context) {
        int executed = 0;
        int skipped = 0;

        for (Instruction instruction : task.instructions()) {
            trace(context, "[{}] Starting {}", task.name(), instruction);

            OptionalInt value = instruction.evaluate(context);

            if (instruction.yieldsValue() && value.isEmpty()) {
                skipped++;
                trace(context, "[{}] Skipped {} (operand without value)", task.name(), instruction);
            } else {
                executed++;
                trace(context, "[{}] Finished {}", task.name(), instruction);
            }
        }

        return new TaskResult(task.name(), executed, skipped);
    }

    private void trace(ExecutionContext context, String format, Object taskName, Object instruction) {
        if (context.verbose()) {
            log.info(format, taskName, instruction);
        } else {
            log.debug(format, taskName, instruction);
        }
    }

    /**
     * Instruction counts for one task execution.
     */
    public record TaskResult(String taskName, int executed, int skipped) {
        public boolean hasSkipped() {
            return skipped > 0;
        }
    }
}
