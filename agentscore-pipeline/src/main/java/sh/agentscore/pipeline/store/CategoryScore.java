// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.store;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Decayed score of one feedback category.
 *
 * @param score weighted mean on the 0-100 scale, two decimals
 * @param count feedback entries tagged with the category
 */
public record CategoryScore(@JsonProperty("score") double score, @JsonProperty("count") int count) {}
