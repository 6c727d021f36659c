// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.store;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import sh.agentscore.core.erc8004.FeedbackValue;
import sh.agentscore.core.types.Address;
import sh.agentscore.core.types.Hash;

/**
 * One feedback entry as stored.
 *
 * <p>Empty tags are stored as null. {@code tag3} holds the rated endpoint and
 * {@code comment} the feedback URI.
 *
 * @param id            {@code <agentId>-<client>-<feedbackIndex>}
 * @param subject       rated agent id
 * @param author        client address
 * @param tag1          category tag
 * @param tag2          secondary tag
 * @param tag3          rated endpoint
 * @param value         raw signed value
 * @param valueDecimals decimal places of {@code value}, any {@code uint8}
 * @param comment       feedback URI
 * @param revoked       whether the author revoked it
 * @param blockNumber   block of the {@code NewFeedback} event
 * @param txHash        transaction of the {@code NewFeedback} event
 * @param timestamp     block time
 */
public record Feedback(
        String id,
        String subject,
        Address author,
        @Nullable String tag1,
        @Nullable String tag2,
        @Nullable String tag3,
        BigInteger value,
        int valueDecimals,
        @Nullable String comment,
        boolean revoked,
        long blockNumber,
        Hash txHash,
        Instant timestamp) {

    public Feedback {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(author, "author");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(txHash, "txHash");
        Objects.requireNonNull(timestamp, "timestamp");
        if (valueDecimals < 0 || valueDecimals > FeedbackValue.MAX_DECIMALS) {
            throw new IllegalArgumentException(
                    "valueDecimals must be 0-" + FeedbackValue.MAX_DECIMALS + ", got " + valueDecimals);
        }
        tag1 = blankToNull(tag1);
        tag2 = blankToNull(tag2);
        tag3 = blankToNull(tag3);
        comment = blankToNull(comment);
    }

    /** {@code value / 10^valueDecimals}. */
    public BigDecimal decimalValue() {
        return new BigDecimal(value, valueDecimals);
    }

    private static @Nullable String blankToNull(final @Nullable String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
