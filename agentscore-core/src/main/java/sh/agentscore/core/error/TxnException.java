// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.error;

/**
 * Transaction signing or submission failure.
 */
public final class TxnException extends AgentScoreException {
    public TxnException(final String message) {
        super(message);
    }

    public TxnException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public boolean isNonceTooLow() {
        final String msg = getMessage();
        return msg != null && msg.toLowerCase().contains("nonce too low");
    }
}
