// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;

/**
 * Per-category scores of one agent, keyed by tag.
 *
 * <p>Serialized as {@code {"<category>":{"score":<double>,"count":<int>}}}, in key order.
 */
public final class CategoryScores {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final CategoryScores EMPTY = new CategoryScores(Map.of());

    private final Map<String, CategoryScore> byCategory;

    @JsonCreator
    public CategoryScores(final Map<String, CategoryScore> byCategory) {
        this.byCategory = Collections.unmodifiableMap(new TreeMap<>(byCategory));
    }

    @JsonValue
    public Map<String, CategoryScore> asMap() {
        return byCategory;
    }

    public Optional<CategoryScore> get(final String category) {
        return Optional.ofNullable(byCategory.get(category));
    }

    public boolean isEmpty() {
        return byCategory.isEmpty();
    }

    public int size() {
        return byCategory.size();
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Category scores are not serializable", e);
        }
    }

    /**
     * Parses the stored JSON form; null or blank reads as {@link #EMPTY}.
     *
     * @throws IllegalArgumentException if the text is not a category map
     */
    public static CategoryScores fromJson(final @Nullable String json) {
        if (json == null || json.isBlank()) {
            return EMPTY;
        }
        try {
            return MAPPER.readValue(json, CategoryScores.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed category scores: " + json, e);
        }
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof CategoryScores other && byCategory.equals(other.byCategory);
    }

    @Override
    public int hashCode() {
        return byCategory.hashCode();
    }

    @Override
    public String toString() {
        return "CategoryScores" + byCategory;
    }
}
