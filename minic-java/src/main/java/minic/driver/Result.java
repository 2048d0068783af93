package minic.driver;

import minic.CompileException;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a compiler phase: either a value or the {@link CompileException} that stopped it.
 * Internal errors are not captured here and still propagate as exceptions.
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

    record Ok<T>(T value) implements Result<T> {}

    record Err<T>(CompileException error) implements Result<T> {
        public Err {
            Objects.requireNonNull(error, "error");
        }
    }

    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> err(CompileException error) {
        return new Err<>(error);
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    default <U> Result<U> map(Function<? super T, ? extends U> f) {
        if (this instanceof Ok<T> ok) return new Ok<>(f.apply(ok.value()));
        return new Err<>(((Err<T>) this).error());
    }

    default <U> Result<U> flatMap(Function<? super T, Result<U>> f) {
        if (this instanceof Ok<T> ok) return f.apply(ok.value());
        return new Err<>(((Err<T>) this).error());
    }

    /** The value, or the original exception rethrown. */
    default T orElseThrow() {
        if (this instanceof Ok<T> ok) return ok.value();
        throw ((Err<T>) this).error();
    }
}
