/* (C)2026 */
package com.ammann.fedstats.lifecycle;

import static org.assertj.core.api.Assertions.*;

import com.ammann.fedstats.enumeration.ReadinessStatus;
import com.ammann.fedstats.model.QuorumPolicy;
import com.ammann.fedstats.model.RoundReference;
import com.ammann.fedstats.store.ArtifactKey;
import com.ammann.fedstats.store.FileArtifactStore;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RoundReadinessGateTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");
    private static final RoundReference ROUND = RoundReference.first();

    @TempDir
    Path root;

    private FileArtifactStore store;

    @BeforeEach
    void setUp() {
        store = new FileArtifactStore(root);
    }

    private RoundReadinessGate gate(int expected, int minQuorum) {
        return new RoundReadinessGate(store,
                new QuorumPolicy(expected, minQuorum, Duration.ofMinutes(5), Duration.ofMillis(10)),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @ParameterizedTest(name = "expected={0} quorum={1} published={2} closed={3} expired={4} -> {5}")
    @CsvSource({
        "3, 1, 3, false, false, READY",
        "3, 1, 4, false, false, READY",
        "3, 1, 2, false, false, NOT_READY",
        "3, 2, 2, true,  false, READY",
        "3, 2, 1, true,  false, QUORUM_NOT_MET",
        "3, 2, 1, false, true,  QUORUM_NOT_MET",
        "3, 1, 0, true,  false, EMPTY",
        "3, 1, 0, false, true,  EMPTY",
        "0, 1, 5, false, false, NOT_READY",
        "0, 1, 5, true,  false, READY",
        "0, 1, 0, false, false, NOT_READY",
    })
    void decidesReadiness(int expected, int minQuorum, int published, boolean closed, boolean expired,
            ReadinessStatus status) {
        assertThat(gate(expected, minQuorum).evaluate(published, closed, expired)).isEqualTo(status);
    }

    @Test
    void countsPublishedPayloadsAndClosure() {
        RoundReadinessGate gate = gate(3, 1);
        store.write(ArtifactKey.local("run-1", ROUND, "site-a"), "a");

        assertThat(gate.evaluate("run-1", ROUND, null)).isEqualTo(ReadinessStatus.NOT_READY);

        store.close("run-1", ROUND);

        assertThat(gate.evaluate("run-1", ROUND, null)).isEqualTo(ReadinessStatus.READY);
    }

    @Test
    void deadlineCountsAsPassedAtItsInstant() {
        RoundReadinessGate gate = gate(3, 2);
        store.write(ArtifactKey.local("run-1", ROUND, "site-a"), "a");

        assertThat(gate.evaluate("run-1", ROUND, NOW.plusSeconds(1))).isEqualTo(ReadinessStatus.NOT_READY);
        assertThat(gate.evaluate("run-1", ROUND, NOW)).isEqualTo(ReadinessStatus.QUORUM_NOT_MET);
    }

    @Test
    void awaitReturnsOnceDeadlineHasPassed() throws InterruptedException {
        assertThat(gate(3, 1).await("run-1", ROUND, NOW.minusSeconds(1))).isEqualTo(ReadinessStatus.EMPTY);
    }

    @Test
    void awaitPollsUntilAllParticipantsPublished() throws InterruptedException {
        RoundReadinessGate gate = new RoundReadinessGate(store,
                new QuorumPolicy(2, 1, Duration.ofMinutes(1), Duration.ofMillis(10)), Clock.systemUTC());
        store.write(ArtifactKey.local("run-1", ROUND, "site-a"), "a");
        Thread publisher = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            store.write(ArtifactKey.local("run-1", ROUND, "site-b"), "b");
        });
        publisher.start();

        ReadinessStatus status = gate.await("run-1", ROUND, Instant.now().plusSeconds(30));
        publisher.join();

        assertThat(status).isEqualTo(ReadinessStatus.READY);
    }

    @Test
    void awaitRequiresDeadline() {
        assertThatThrownBy(() -> gate(3, 1).await("run-1", ROUND, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
