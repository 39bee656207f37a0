/* (C)2026 */
package com.ammann.fedstats.lifecycle;

import com.ammann.fedstats.model.ModelSpecification;
import com.ammann.fedstats.model.RoundReference;
import com.ammann.fedstats.model.Run;
import java.util.Optional;

/**
 * Everything a task needs to know about the round it is executing.
 *
 * @param run         the run the round belongs to
 * @param round       round being executed
 * @param participant site id, null for the coordinator
 */
public record RoundContext(Run run, RoundReference round, String participant) {

    public RoundContext {
        if (run == null || round == null) {
            throw new IllegalArgumentException("Run and round must not be null");
        }
    }

    public String runId() {
        return run.runId();
    }

    public ModelSpecification specification() {
        return run.task(round.sequence());
    }

    public Optional<RoundReference> previousRound() {
        return run.previousRound(round);
    }

    @Override
    public String toString() {
        return String.format("run %s round %s%s", run.runId(), round,
                participant != null ? " participant " + participant : " coordinator");
    }
}
