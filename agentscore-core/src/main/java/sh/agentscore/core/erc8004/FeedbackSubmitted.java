// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.erc8004;

import java.math.BigInteger;
import sh.agentscore.core.types.Address;
import sh.agentscore.core.types.Hash;

/**
 * {@code event NewFeedback(uint256 indexed agentId, address indexed clientAddress,
 * uint64 feedbackIndex, int128 value, uint8 valueDecimals, string indexed indexedTag1,
 * string tag1, string tag2, string endpoint, string feedbackURI, bytes32 feedbackHash)}
 * from the Reputation Registry.
 *
 * @param agentId       the rated agent
 * @param client        the feedback author
 * @param feedbackIndex the author's index for this agent
 * @param value         the score
 * @param tag1          primary tag, empty when unset
 * @param tag2          secondary tag, empty when unset
 * @param endpoint      the rated endpoint, empty when unset
 * @param feedbackURI   off-chain feedback document, empty when unset
 * @param feedbackHash  hash of the off-chain document
 */
public record FeedbackSubmitted(
        AgentId agentId,
        Address client,
        BigInteger feedbackIndex,
        FeedbackValue value,
        String tag1,
        String tag2,
        String endpoint,
        String feedbackURI,
        Hash feedbackHash) implements Erc8004Event {

    public FeedbackId feedbackId() {
        return new FeedbackId(agentId, client, feedbackIndex);
    }
}
