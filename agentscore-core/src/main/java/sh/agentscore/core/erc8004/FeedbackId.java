// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.erc8004;

import java.math.BigInteger;
import java.util.Objects;
import sh.agentscore.core.types.Address;

/**
 * Identity of one feedback entry: the rated agent, the client that wrote it and the
 * client's per-agent feedback index.
 *
 * <p>The string form {@code <agentId>-<clientAddress>-<feedbackIndex>} (lowercase
 * address) is the persisted primary key; a submission and its later revocation map to
 * the same key.
 */
public record FeedbackId(AgentId agentId, Address client, BigInteger feedbackIndex) {

    public FeedbackId {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(feedbackIndex, "feedbackIndex");
        if (feedbackIndex.signum() < 0) {
            throw new IllegalArgumentException("feedbackIndex must be non-negative");
        }
    }

    @Override
    public String toString() {
        return agentId + "-" + client.value() + "-" + feedbackIndex;
    }
}
