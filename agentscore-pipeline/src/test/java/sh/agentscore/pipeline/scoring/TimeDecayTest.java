// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.scoring;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class TimeDecayTest {
    private final TimeDecay decay = new TimeDecay(90.0);

    @Test
    void halvesEveryHalfLife() {
        assertEquals(1.0, decay.weight(0.0), 1e-9);
        assertEquals(0.5, decay.weight(90.0), 1e-3);
        assertEquals(0.25, decay.weight(180.0), 1e-3);
    }

    @Test
    void futureFeedbackWeighsOne() {
        assertEquals(1.0, decay.weight(-3.0), 1e-12);

        Instant reference = Instant.parse("2026-01-01T00:00:00Z");
        assertEquals(1.0, decay.weight(reference.plusSeconds(3600), reference), 1e-12);
    }

    @Test
    void instantOverloadUsesFractionalDays() {
        Instant reference = Instant.parse("2026-06-01T00:00:00Z");
        Instant halfLifeAgo = reference.minus(Duration.ofDays(90));
        Instant thirtySixHoursAgo = reference.minus(Duration.ofHours(36));

        assertEquals(0.5, decay.weight(halfLifeAgo, reference), 1e-9);
        assertEquals(TimeDecay.weight(1.5, 90.0), decay.weight(thirtySixHoursAgo, reference), 1e-12);
    }

    @Test
    void weightsStayPositive() {
        double w = decay.weight(90.0 * 60);
        assertTrue(w > 0.0);
        assertTrue(w < 1e-15);
    }

    @Test
    void effectiveWindowInvertsWeight() {
        assertEquals(90.0, decay.effectiveWindow(0.5), 1e-9);
        assertEquals(180.0, TimeDecay.effectiveWindow(0.25, 90.0), 1e-9);
        assertEquals(0.0, decay.effectiveWindow(1.0), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> decay.effectiveWindow(0.0));
    }

    @Test
    void halfLifeMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new TimeDecay(0.0));
        assertThrows(IllegalArgumentException.class, () -> new TimeDecay(-1.0));
        assertThrows(IllegalArgumentException.class, () -> TimeDecay.weight(1.0, Double.NaN));
    }
}
