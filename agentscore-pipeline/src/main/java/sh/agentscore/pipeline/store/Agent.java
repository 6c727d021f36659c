// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.store;

import java.time.Instant;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import sh.agentscore.core.types.Address;
import sh.agentscore.core.types.Hash;

/**
 * A registered agent.
 *
 * @param id                decimal token id
 * @param owner             registering owner
 * @param metadataUri       current agent URI
 * @param registrationBlock block of the {@code Registered} event
 * @param registrationTx    transaction of the {@code Registered} event
 * @param createdAt         when the row was first written
 * @param updatedAt         last time the row was touched
 */
public record Agent(
        String id,
        Address owner,
        @Nullable String metadataUri,
        long registrationBlock,
        Hash registrationTx,
        Instant createdAt,
        Instant updatedAt) {

    public Agent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(registrationTx, "registrationTx");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
    }
}
