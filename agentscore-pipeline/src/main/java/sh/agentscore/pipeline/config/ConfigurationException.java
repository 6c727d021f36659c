// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.config;

/**
 * A setting is missing, malformed or out of range.
 */
public final class ConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String key;

    public ConfigurationException(final String key, final String message) {
        super(key + ": " + message);
        this.key = key;
    }

    public ConfigurationException(final String key, final String message, final Throwable cause) {
        super(key + ": " + message, cause);
        this.key = key;
    }

    /** The offending configuration key. */
    public String key() {
        return key;
    }
}
