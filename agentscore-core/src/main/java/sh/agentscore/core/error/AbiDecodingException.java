// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.error;

/**
 * Thrown when event data or a call result cannot be decoded.
 */
public final class AbiDecodingException extends AgentScoreException {
    public AbiDecodingException(final String message) {
        super(message);
    }

    public AbiDecodingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
