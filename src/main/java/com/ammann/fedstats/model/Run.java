/* (C)2026 */
package com.ammann.fedstats.model;

import com.ammann.fedstats.exception.RunNotFoundException;
import com.ammann.fedstats.exception.ValidationException;
import java.util.List;
import java.util.Optional;

/**
 * One federated job: identity plus the ordered task specifications.
 * <p>
 * Immutable once rounds begin. Task {@code i} (1-based) is addressed by sequence {@code i}.
 */
public record Run(
        String runId,
        String projectId,
        String batchId,
        List<ModelSpecification> tasks,
        int totalRound) {

    public Run {
        if (runId == null || runId.isBlank()) {
            throw ValidationException.missingField("run_id");
        }
        if (!runId.matches("[A-Za-z0-9._-]+")) {
            throw ValidationException.invalidParameter("run_id", runId, "letters, digits, '.', '_' or '-'");
        }
        if (tasks == null || tasks.isEmpty()) {
            throw ValidationException.missingField("tasks");
        }
        if (totalRound < 1) {
            throw ValidationException.invalidParameter("total_round", totalRound, "at least 1");
        }
        tasks = List.copyOf(tasks);
    }

    /**
     * Returns the specification of the task at the given sequence.
     *
     * @throws RunNotFoundException if the sequence is outside the task list
     */
    public ModelSpecification task(int sequence) {
        if (sequence < 1 || sequence > tasks.size()) {
            throw new RunNotFoundException(runId, sequence);
        }
        return tasks.get(sequence - 1);
    }

    /**
     * Checks that the reference points at an existing task and a round within its round count.
     */
    public boolean contains(RoundReference ref) {
        return ref.sequence() <= tasks.size() && ref.round() < task(ref.sequence()).totalRound();
    }

    /**
     * Returns the round preceding {@code ref}: the previous round of the same task, or the
     * last round of the previous task when {@code ref} is a task's first round.
     *
     * @param ref current round
     * @return previous round, empty for the first round of the run
     */
    public Optional<RoundReference> previousRound(RoundReference ref) {
        if (ref.round() > 0) {
            return Optional.of(new RoundReference(ref.sequence(), ref.round() - 1));
        }
        if (ref.sequence() > 1) {
            int previousSequence = ref.sequence() - 1;
            return Optional.of(new RoundReference(previousSequence, task(previousSequence).totalRound() - 1));
        }
        return Optional.empty();
    }
}
