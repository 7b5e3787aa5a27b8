package com.questrail.dispatch.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for the precedence optimizer.
 *
 * @param timeLimit     wall-clock budget for one constraint solve
 * @param searchWorkers solver worker threads; 1 keeps a pass single-threaded
 * @param policy        decision and scoring constants
 */
public record OptimizerConfig(
    Duration timeLimit,
    int searchWorkers,
    PrecedencePolicy policy
) {
    public static final Duration DEFAULT_TIME_LIMIT = Duration.ofSeconds(30);

    public OptimizerConfig {
        Objects.requireNonNull(timeLimit, "timeLimit");
        Objects.requireNonNull(policy, "policy");
        if (timeLimit.isNegative()) {
            throw new IllegalArgumentException("timeLimit must be non-negative");
        }
        if (searchWorkers < 1) {
            throw new IllegalArgumentException("searchWorkers must be >= 1");
        }
    }

    public static OptimizerConfig defaults() {
        return builder().build();
    }

    /**
     * Time limit as fractional seconds, the unit the solver expects.
     */
    public double timeLimitSeconds() {
        return timeLimit.toNanos() / 1_000_000_000.0;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration timeLimit = DEFAULT_TIME_LIMIT;
        private int searchWorkers = 1;
        private PrecedencePolicy policy = PrecedencePolicy.defaults();

        public Builder withTimeLimit(Duration timeLimit) {
            this.timeLimit = timeLimit;
            return this;
        }

        public Builder withSearchWorkers(int searchWorkers) {
            this.searchWorkers = searchWorkers;
            return this;
        }

        public Builder withPolicy(PrecedencePolicy policy) {
            this.policy = policy;
            return this;
        }

        public OptimizerConfig build() {
            return new OptimizerConfig(timeLimit, searchWorkers, policy);
        }
    }
}
