// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.erc8004;

import java.math.BigInteger;
import sh.agentscore.core.types.Address;

/**
 * {@code event FeedbackRevoked(uint256 indexed agentId, address indexed clientAddress,
 * uint64 indexed feedbackIndex)} from the Reputation Registry.
 */
public record FeedbackRevoked(AgentId agentId, Address client, BigInteger feedbackIndex) implements Erc8004Event {

    public FeedbackId feedbackId() {
        return new FeedbackId(agentId, client, feedbackIndex);
    }
}
