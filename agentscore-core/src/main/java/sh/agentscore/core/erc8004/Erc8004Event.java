// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.erc8004;

/**
 * A decoded ERC-8004 registry event.
 */
public sealed interface Erc8004Event
        permits AgentRegistered, AgentUriUpdated, MetadataSet, FeedbackSubmitted, FeedbackRevoked {

    AgentId agentId();
}
