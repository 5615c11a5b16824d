package de.anton.spectral.analyser.spectral_analyzer.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a transform, mapping or analysis call on a {@link SpectralDataset}.
 * Carries the outcome kind, a human-readable message and, for completed
 * mapping calls, the value produced (usually the new {@link DerivedMap}).
 *
 * @param <T> type of the produced value
 */
public final class OperationResult<T> {

    private final ResultKind kind;
    private final String message;
    private final T value;

    private OperationResult(ResultKind kind, String message, T value) {
        this.kind = Objects.requireNonNull(kind, "Result kind cannot be null.");
        this.message = message != null ? message : "";
        this.value = value;
    }

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(ResultKind.SUCCESS, "", value);
    }

    public static <T> OperationResult<T> success() {
        return new OperationResult<>(ResultKind.SUCCESS, "", null);
    }

    /** Completed result with a caveat, e.g. a clamped component index. */
    public static <T> OperationResult<T> warning(T value, String message) {
        return new OperationResult<>(ResultKind.WARNING, message, value);
    }

    /**
     * Aborted result. No value is attached.
     *
     * @throws IllegalArgumentException if kind denotes a completed operation
     */
    public static <T> OperationResult<T> failure(ResultKind kind, String message) {
        if (kind.isCompleted()) {
            throw new IllegalArgumentException("Failure result requires a non-completed kind, got " + kind);
        }
        return new OperationResult<>(kind, message, null);
    }

    public ResultKind getKind() { return kind; }
    public String getMessage() { return message; }
    public Optional<T> getValue() { return Optional.ofNullable(value); }
    public boolean isCompleted() { return kind.isCompleted(); }

    @Override
    public String toString() {
        return "OperationResult{" + kind + (message.isEmpty() ? "" : ", '" + message + "'") + '}';
    }
}
