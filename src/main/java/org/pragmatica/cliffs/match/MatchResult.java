package org.pragmatica.cliffs.match;

import org.pragmatica.cliffs.call.CallMatch;
import org.pragmatica.cliffs.error.MatchFailure;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Outcome of matching a whole call against a command: the populated match, or the failure
 * together with the score reached before it.
 */
public sealed interface MatchResult {

    double score();

    boolean isSuccess();

    record Success(CallMatch match) implements MatchResult {
        public Success {
            checkNotNull(match, "match");
        }

        @Override
        public double score() {
            return match.score();
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure(MatchFailure failure, double score) implements MatchResult {
        public Failure {
            checkNotNull(failure, "failure");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }

    static MatchResult success(CallMatch match) {
        return new Success(match);
    }

    static MatchResult failure(MatchFailure failure, double score) {
        return new Failure(failure, score);
    }
}
