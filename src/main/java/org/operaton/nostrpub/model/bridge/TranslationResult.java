package org.operaton.nostrpub.model.bridge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of a translation: a best-effort value (absent when nothing could be produced)
 * plus the degradations that happened on the way.
 *
 * @param <T> translated value type
 */
public final class TranslationResult<T> {

    private final T value;
    private final List<Degradation> degradations;

    private TranslationResult(T value, List<Degradation> degradations) {
        this.value = value;
        this.degradations = Collections.unmodifiableList(degradations);
    }

    public static <T> TranslationResult<T> of(T value, List<Degradation> degradations) {
        return new TranslationResult<>(value, new ArrayList<>(degradations));
    }

    public static <T> TranslationResult<T> of(T value) {
        return new TranslationResult<>(value, List.of());
    }

    /**
     * No counterpart could be produced.
     */
    public static <T> TranslationResult<T> skipped(Degradation reason) {
        return new TranslationResult<>(null, List.of(reason));
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public boolean isSkipped() {
        return value == null;
    }

    public List<Degradation> getDegradations() {
        return degradations;
    }

    public boolean isDegraded() {
        return !degradations.isEmpty();
    }
}
