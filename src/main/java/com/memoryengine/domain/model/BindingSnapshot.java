package com.memoryengine.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable alias -> value environment for one evaluation cycle.
 *
 * <p>Built only when every binding of the IF memory resolved; the evaluator never
 * sees a partial snapshot.
 */
public final class BindingSnapshot {

    private static final BindingSnapshot EMPTY = new BindingSnapshot(Map.of());

    private final Map<String, Scalar> values;

    private BindingSnapshot(Map<String, Scalar> values) {
        this.values = values;
    }

    public static BindingSnapshot of(Map<String, Scalar> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new BindingSnapshot(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static BindingSnapshot empty() {
        return EMPTY;
    }

    public boolean contains(String alias) {
        return values.containsKey(alias);
    }

    public Scalar get(String alias) {
        return values.get(alias);
    }

    public Set<String> aliases() {
        return values.keySet();
    }

    public Map<String, Scalar> asMap() {
        return values;
    }

    /** Values converted for the condition evaluator ({@link Boolean} or {@link Double}). */
    public Map<String, Object> toEvaluationVariables() {
        Map<String, Object> variables = new LinkedHashMap<>();
        values.forEach((alias, scalar) -> variables.put(alias, scalar.toEvaluationValue()));
        return variables;
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
