// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.erc8004;

import sh.agentscore.core.types.Address;

/**
 * Known ERC-8004 registry deployments.
 *
 * <p>The registries are deployed with CREATE2 under a {@code 0x8004} vanity prefix, so
 * every mainnet EVM chain shares one pair of addresses and the Sepolia testnets share
 * another.
 *
 * @see <a href="https://github.com/erc-8004/erc-8004-contracts">erc-8004-contracts</a>
 */
public final class Erc8004Addresses {

    public static final Address MAINNET_IDENTITY =
            new Address("0x8004a169fb4a3325136eb29fa0ceb6d2e539a432");

    public static final Address MAINNET_REPUTATION =
            new Address("0x8004baa17c55a88189ae136b182e5fda19de9b63");

    public static final Address SEPOLIA_IDENTITY =
            new Address("0x8004a818bfb912233c491871b3d84c89a494bd9e");

    public static final Address SEPOLIA_REPUTATION =
            new Address("0x8004b663056a597dffe9eccc1965a193b7388713");

    private Erc8004Addresses() {}
}
