package com.venueops.common.result;

import java.util.List;
import java.util.Optional;

/**
 * Primary outcome of an engine operation together with the outcomes of its side effects.
 */
public record OperationResult<T>(T value, List<SideEffectOutcome> sideEffects) {

    public OperationResult {
        sideEffects = sideEffects == null ? List.of() : List.copyOf(sideEffects);
    }

    public static <T> OperationResult<T> of(T value, List<SideEffectOutcome> sideEffects) {
        return new OperationResult<>(value, sideEffects);
    }

    public static <T> OperationResult<T> of(T value) {
        return new OperationResult<>(value, List.of());
    }

    public boolean allSideEffectsSucceeded() {
        return sideEffects.stream().allMatch(SideEffectOutcome::succeeded);
    }

    public Optional<SideEffectOutcome> sideEffect(String name) {
        return sideEffects.stream().filter(outcome -> outcome.name().equals(name)).findFirst();
    }
}
