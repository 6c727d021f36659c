// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.erc8004;

import java.math.BigInteger;
import java.util.Objects;

/**
 * ERC-8004 agent token identifier: the {@code uint256} ERC-721 token ID assigned by
 * the Identity Registry.
 *
 * <p>Persisted and compared by its canonical decimal form ({@link #toString()}).
 *
 * @param value the token ID, non-negative
 * @see <a href="https://eips.ethereum.org/EIPS/eip-8004">EIP-8004</a>
 */
public record AgentId(BigInteger value) implements Comparable<AgentId> {
    private static final int MAX_BITS = 256;

    public AgentId {
        Objects.requireNonNull(value, "agentId");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("agentId must be non-negative");
        }
        if (value.bitLength() > MAX_BITS) {
            throw new IllegalArgumentException("agentId exceeds uint256");
        }
    }

    public static AgentId of(long id) {
        return new AgentId(BigInteger.valueOf(id));
    }

    /**
     * Parses the canonical decimal form.
     *
     * @param decimal the decimal token ID
     * @return the agent identifier
     * @throws IllegalArgumentException if the string is not a non-negative integer
     */
    public static AgentId parse(String decimal) {
        Objects.requireNonNull(decimal, "agentId");
        try {
            return new AgentId(new BigInteger(decimal.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("agentId is not a decimal integer: " + decimal, e);
        }
    }

    @Override
    public int compareTo(AgentId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
