package org.pragmatica.fsfmt.format;

import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Outcome of a formatting operation: either a value or a {@link FormattingError}.
 */
public sealed interface FormatResult<T> {
    record Success<T>(T value) implements FormatResult<T> {}

    record Failure<T>(FormattingError error) implements FormatResult<T> {}

    static <T> FormatResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> FormatResult<T> failure(FormattingError error) {
        return new Failure<>(error);
    }

    /**
     * Run the supplier, converting a thrown {@link FormattingException} into a failure.
     */
    static <T> FormatResult<T> lift(Supplier<T> supplier) {
        try {
            return success(supplier.get());
        } catch (FormattingException e) {
            return failure(e.error());
        }
    }

    default boolean isSuccess() {
        return this instanceof Success<T>;
    }

    default boolean isFailure() {
        return this instanceof Failure<T>;
    }

    @SuppressWarnings("unchecked")
    default <U> FormatResult<U> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Success<T> success) {
            return success(mapper.apply(success.value()));
        }
        return (FormatResult<U>) this;
    }

    @SuppressWarnings("unchecked")
    default <U> FormatResult<U> flatMap(Function<? super T, FormatResult<U>> mapper) {
        if (this instanceof Success<T> success) {
            return mapper.apply(success.value());
        }
        return (FormatResult<U>) this;
    }

    default FormatResult<T> onSuccess(Consumer<? super T> action) {
        if (this instanceof Success<T> success) {
            action.accept(success.value());
        }
        return this;
    }

    default FormatResult<T> onFailure(Consumer<FormattingError> action) {
        if (this instanceof Failure<T> failure) {
            action.accept(failure.error());
        }
        return this;
    }

    default <U> U fold(Function<FormattingError, U> onFailure, Function<? super T, U> onSuccess) {
        if (this instanceof Success<T> success) {
            return onSuccess.apply(success.value());
        }
        return onFailure.apply(((Failure<T>) this).error());
    }

    /**
     * Value of a success, or {@link FormattingException} for a failure.
     */
    default T unwrap() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        throw ((Failure<T>) this).error()
                                 .exception();
    }
}
