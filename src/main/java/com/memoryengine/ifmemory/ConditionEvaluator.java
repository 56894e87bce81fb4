package com.memoryengine.ifmemory;

import com.memoryengine.domain.model.BindingSnapshot;
import com.memoryengine.domain.model.ConditionResult;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates branch condition text against a binding snapshot.
 *
 * <p>Conditions refer to bound variables as {@code [alias]}. Evaluation never throws:
 * bad syntax, an alias missing from the snapshot and non-boolean results all come back
 * as {@link ConditionResult#error(String)}. The engine and the dry-run endpoints share
 * one implementation so both give identical answers for the same input.
 */
public interface ConditionEvaluator {

    ConditionResult evaluate(String condition, BindingSnapshot snapshot);

    /**
     * Parses without evaluating and checks every referenced alias is in {@code boundAliases}.
     *
     * @return the first problem found, or empty if the condition is acceptable
     */
    Optional<String> validate(String condition, Set<String> boundAliases);

    /** Aliases written as {@code [alias]} in the condition, in order of first appearance. */
    Set<String> referencedAliases(String condition);
}
