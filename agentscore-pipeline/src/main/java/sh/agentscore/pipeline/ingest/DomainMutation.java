// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.ingest;

import java.time.Instant;
import java.util.Objects;
import sh.agentscore.pipeline.store.Agent;
import sh.agentscore.pipeline.store.DomainStore;
import sh.agentscore.pipeline.store.Feedback;
import sh.agentscore.pipeline.store.WriteOutcome;

/**
 * One store change derived from one registry event.
 *
 * <p>Applying a mutation twice leaves the store as applying it once; the second
 * application reports {@link WriteOutcome#DUPLICATE} or {@link WriteOutcome#UPDATED}
 * with unchanged values.
 */
public sealed interface DomainMutation
        permits DomainMutation.RegisterAgent,
                DomainMutation.UpdateAgentUri,
                DomainMutation.TouchAgent,
                DomainMutation.RecordFeedback,
                DomainMutation.RevokeFeedback {

    /** Applies the change in its own store transaction. */
    WriteOutcome applyTo(DomainStore store);

    /** Insert the agent, or refresh URI and {@code updatedAt} of an existing one. */
    record RegisterAgent(Agent agent) implements DomainMutation {
        public RegisterAgent {
            Objects.requireNonNull(agent, "agent");
        }

        @Override
        public WriteOutcome applyTo(final DomainStore store) {
            return store.registerAgent(agent);
        }
    }

    record UpdateAgentUri(String agentId, String metadataUri, Instant at) implements DomainMutation {
        public UpdateAgentUri {
            Objects.requireNonNull(agentId, "agentId");
            Objects.requireNonNull(metadataUri, "metadataUri");
            Objects.requireNonNull(at, "at");
        }

        @Override
        public WriteOutcome applyTo(final DomainStore store) {
            return store.updateAgentUri(agentId, metadataUri, at);
        }
    }

    /** Advance {@code updatedAt} only. */
    record TouchAgent(String agentId, Instant at) implements DomainMutation {
        public TouchAgent {
            Objects.requireNonNull(agentId, "agentId");
            Objects.requireNonNull(at, "at");
        }

        @Override
        public WriteOutcome applyTo(final DomainStore store) {
            return store.touchAgent(agentId, at);
        }
    }

    record RecordFeedback(Feedback feedback) implements DomainMutation {
        public RecordFeedback {
            Objects.requireNonNull(feedback, "feedback");
        }

        @Override
        public WriteOutcome applyTo(final DomainStore store) {
            return store.insertFeedback(feedback);
        }
    }

    record RevokeFeedback(String feedbackId) implements DomainMutation {
        public RevokeFeedback {
            Objects.requireNonNull(feedbackId, "feedbackId");
        }

        @Override
        public WriteOutcome applyTo(final DomainStore store) {
            return store.revokeFeedback(feedbackId);
        }
    }
}
