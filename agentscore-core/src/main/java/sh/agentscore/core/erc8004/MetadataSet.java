// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.erc8004;

/**
 * {@code event MetadataSet(uint256 indexed agentId, string indexed indexedMetadataKey,
 * string metadataKey, bytes metadataValue)} from the Identity Registry.
 */
public record MetadataSet(AgentId agentId, String metadataKey, byte[] metadataValue) implements Erc8004Event {

    public MetadataSet {
        metadataValue = metadataValue.clone();
    }

    @Override
    public byte[] metadataValue() {
        return metadataValue.clone();
    }
}
