// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.store;

/**
 * What applying one domain mutation did to the store.
 */
public enum WriteOutcome {
    /** A new row was created. */
    INSERTED,
    /** An existing row changed. */
    UPDATED,
    /** The mutation was already applied; nothing changed. */
    DUPLICATE,
    /** The row the mutation targets does not exist; nothing changed. */
    MISSING
}
