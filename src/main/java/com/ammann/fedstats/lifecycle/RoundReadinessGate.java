/* (C)2026 */
package com.ammann.fedstats.lifecycle;

import com.ammann.fedstats.enumeration.ReadinessStatus;
import com.ammann.fedstats.model.QuorumPolicy;
import com.ammann.fedstats.model.RoundReference;
import com.ammann.fedstats.store.ArtifactStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.jboss.logging.Logger;

/**
 * Decides whether the coordinator may aggregate a round.
 *
 * <p>A round is READY once every expected participant has published. Before that it stays
 * NOT_READY until either the round is closed or its deadline passes; at that point it is
 * READY with at least {@code minQuorum} payloads, QUORUM_NOT_MET with fewer, and EMPTY with
 * none.
 */
public class RoundReadinessGate {

    private static final Logger LOG = Logger.getLogger(RoundReadinessGate.class);

    private final ArtifactStore store;
    private final QuorumPolicy policy;
    private final Clock clock;

    public RoundReadinessGate(ArtifactStore store, QuorumPolicy policy, Clock clock) {
        this.store = store;
        this.policy = policy;
        this.clock = clock;
    }

    /**
     * Pure readiness decision.
     *
     * @param published      local payloads currently in the store
     * @param closed         whether the round-closure signal was observed
     * @param deadlinePassed whether the round's maximum wait has elapsed
     */
    public ReadinessStatus evaluate(int published, boolean closed, boolean deadlinePassed) {
        int expected = policy.expectedParticipants();
        if (expected > 0 && published >= expected) {
            return ReadinessStatus.READY;
        }
        if (closed || deadlinePassed) {
            if (published == 0) {
                return ReadinessStatus.EMPTY;
            }
            return published < policy.minQuorum() ? ReadinessStatus.QUORUM_NOT_MET : ReadinessStatus.READY;
        }
        return ReadinessStatus.NOT_READY;
    }

    /**
     * Evaluates a round against the store.
     *
     * @param deadline instant after which the round counts as expired, or null for no deadline
     */
    public ReadinessStatus evaluate(String runId, RoundReference round, Instant deadline) {
        int published = store.listLocal(runId, round).size();
        boolean closed = store.isClosed(runId, round);
        boolean expired = deadline != null && !clock.instant().isBefore(deadline);
        ReadinessStatus status = evaluate(published, closed, expired);
        LOG.debugf("Round %s of run %s: %d published, expected %d, closed=%b, expired=%b -> %s",
                round, runId, published, policy.expectedParticipants(), closed, expired, status);
        return status;
    }

    /**
     * Blocks until the round is no longer NOT_READY, polling the store.
     *
     * @param deadline instant after which the round counts as expired; required so the wait ends
     * @return final readiness status
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public ReadinessStatus await(String runId, RoundReference round, Instant deadline)
            throws InterruptedException {
        if (deadline == null) {
            throw new IllegalArgumentException("Blocking wait requires a deadline");
        }
        ReadinessStatus status = evaluate(runId, round, deadline);
        while (status == ReadinessStatus.NOT_READY) {
            Duration remaining = Duration.between(clock.instant(), deadline);
            Duration pause = remaining.compareTo(policy.pollInterval()) < 0 ? remaining : policy.pollInterval();
            if (!pause.isNegative() && !pause.isZero()) {
                Thread.sleep(pause.toMillis(), pause.toNanosPart() % 1_000_000);
            }
            status = evaluate(runId, round, deadline);
        }
        return status;
    }

    public QuorumPolicy getPolicy() {
        return policy;
    }
}
