// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.oracle;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;

/**
 * A score as currently stored by the oracle contract.
 *
 * @param rawScore    score scaled by 100 ({@code 7020} is 70.20)
 * @param lastUpdated block time of the last update
 */
public record OnChainScore(BigInteger rawScore, Instant lastUpdated) {

    public OnChainScore {
        Objects.requireNonNull(rawScore, "rawScore");
        Objects.requireNonNull(lastUpdated, "lastUpdated");
    }

    /** The score on the 0-100 scale. */
    public BigDecimal score() {
        return new BigDecimal(rawScore, 2);
    }
}
