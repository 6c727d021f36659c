// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.erc8004;

import org.jspecify.annotations.Nullable;
import sh.agentscore.core.types.Address;

/**
 * URI change from the Identity Registry. Covers both
 * {@code URIUpdated(uint256 indexed agentId, string newURI, address indexed updatedBy)}
 * and the older {@code AgentURIUpdated(uint256 indexed agentId, string agentURI)}, which
 * carries no updater.
 */
public record AgentUriUpdated(AgentId agentId, String newURI, @Nullable Address updatedBy) implements Erc8004Event {}
