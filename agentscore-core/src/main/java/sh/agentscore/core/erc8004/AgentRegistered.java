// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.erc8004;

import sh.agentscore.core.types.Address;

/**
 * {@code event Registered(uint256 indexed agentId, string agentURI, address indexed owner)}
 * from the Identity Registry.
 */
public record AgentRegistered(AgentId agentId, String agentURI, Address owner) implements Erc8004Event {}
