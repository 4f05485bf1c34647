package net.tenure.core.engine;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing parameters of an election.
 * The lease outlives roughly three heartbeats, so a leader survives two missed renewals.
 */
public record ElectionTimings(
        Duration competitionJitter,   // random delay in [0, jitter) before each acquisition attempt
        Duration followerBackoff,     // wait after losing a race
        Duration heartbeatInterval,
        Duration leaseDuration
) {
    public static final ElectionTimings DEFAULTS = new ElectionTimings(
            Duration.ofMillis(2000), Duration.ofMillis(5000), Duration.ofMillis(3000), Duration.ofMillis(10000));

    public ElectionTimings {
        Objects.requireNonNull(competitionJitter, "competitionJitter");
        Objects.requireNonNull(followerBackoff, "followerBackoff");
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        Objects.requireNonNull(leaseDuration, "leaseDuration");
        if (competitionJitter.isNegative()) throw new IllegalArgumentException("competitionJitter < 0");
        if (followerBackoff.isNegative() || followerBackoff.isZero()) throw new IllegalArgumentException("followerBackoff must be > 0");
        if (heartbeatInterval.isNegative() || heartbeatInterval.isZero()) throw new IllegalArgumentException("heartbeatInterval must be > 0");
        if (leaseDuration.compareTo(heartbeatInterval) <= 0) {
            throw new IllegalArgumentException("leaseDuration (" + leaseDuration + ") must exceed heartbeatInterval (" + heartbeatInterval + ")");
        }
    }
}
