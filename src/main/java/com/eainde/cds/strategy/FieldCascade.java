package com.eainde.cds.strategy;

import com.eainde.cds.ingest.DocumentContent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An ordered list of strategies for one field, evaluated until the first one succeeds.
 *
 * <pre>{@code
 * FieldCascade<Integer> applied = FieldCascade.<Integer>named("applied")
 *         .then(TextRuleStrategy.count(rules.rule(TextField.APPLIED)))
 *         .then(TableScanStrategy.count(RowScanRules.APPLIED))
 *         .build();
 * int value = applied.resolveOr(document, 0);
 * }</pre>
 *
 * @param <T> the field's value type
 */
@Slf4j
public final class FieldCascade<T> {

    private final String field;
    private final List<ExtractionStrategy<T>> strategies;

    private FieldCascade(Builder<T> builder) {
        this.field = builder.field;
        this.strategies = List.copyOf(builder.strategies);
    }

    public Optional<T> resolve(DocumentContent document) {
        for (ExtractionStrategy<T> strategy : strategies) {
            Optional<T> value = strategy.attempt(document);
            if (value.isPresent()) {
                log.debug("{} resolved by {}: {}", field, strategy.describe(), value.get());
                return value;
            }
        }
        log.debug("{} unresolved after {} strategies", field, strategies.size());
        return Optional.empty();
    }

    public T resolveOr(DocumentContent document, T fallback) {
        return resolve(document).orElse(fallback);
    }

    public String field() {
        return field;
    }

    public List<ExtractionStrategy<T>> strategies() {
        return strategies;
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static <T> Builder<T> named(String field) {
        return new Builder<>(field);
    }

    public static class Builder<T> {

        private final String field;
        private final List<ExtractionStrategy<T>> strategies = new ArrayList<>();

        private Builder(String field) {
            this.field = field;
        }

        public Builder<T> then(ExtractionStrategy<T> strategy) {
            strategies.add(strategy);
            return this;
        }

        public FieldCascade<T> build() {
            if (field == null || field.isBlank()) {
                throw new IllegalArgumentException("Cascade field name is required");
            }
            if (strategies.isEmpty()) {
                throw new IllegalArgumentException("Cascade for " + field + " has no strategies");
            }
            return new FieldCascade<>(this);
        }
    }
}
