// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.error;

/**
 * Thrown when a value does not fit the ABI type it is encoded as.
 */
public final class AbiEncodingException extends AgentScoreException {
    public AbiEncodingException(final String message) {
        super(message);
    }
}
