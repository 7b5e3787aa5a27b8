package com.questrail.dispatch.core;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * StageResult
 * -----------------------------------------------------------------------------
 * Value-or-failure returned by every stage of an optimization pass.
 *
 * <h2>Contract</h2>
 * A stage never lets a recoverable failure escape. The orchestrator inspects
 * the variant and takes the degraded path for any {@link Failed}.
 *
 * <h2>What is captured</h2>
 * {@link RuntimeException}s and {@link LinkageError}s (missing or broken
 * native solver libraries). Other {@link Error}s are not recoverable and
 * propagate.
 */
public sealed interface StageResult<T>
        permits StageResult.Ok, StageResult.Failed
{
    record Ok<T>(T value) implements StageResult<T> {
        public Ok {
            Objects.requireNonNull(value, "value");
        }
    }

    record Failed<T>(OptimizerStage stage, Throwable cause) implements StageResult<T> {
        public Failed {
            Objects.requireNonNull(stage, "stage");
            Objects.requireNonNull(cause, "cause");
        }

        /**
         * Same failure, typed for a later stage.
         */
        <U> Failed<U> retype() {
            return new Failed<>(stage, cause);
        }
    }

    /**
     * Runs {@code work} and captures any recoverable failure as {@link Failed}.
     */
    static <T> StageResult<T> attempt(OptimizerStage stage, Supplier<T> work) {
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(work, "work");
        try {
            return new Ok<>(work.get());
        } catch (RuntimeException | LinkageError e) {
            return new Failed<>(stage, e);
        }
    }

    /**
     * Runs the next stage on success; passes a failure through untouched.
     */
    default <U> StageResult<U> then(OptimizerStage stage, Function<? super T, ? extends U> next) {
        if (this instanceof Ok<T> ok) {
            return attempt(stage, () -> next.apply(ok.value()));
        }
        return ((Failed<T>) this).retype();
    }

    default boolean isOk() {
        return this instanceof Ok;
    }
}
