package org.neuralchilli.cellflow.domain;

import java.util.Optional;

/**
 * Result of one input file's branch: its merged artifact, or the reason it
 * has none.
 */
public sealed interface FileOutcome {

    String fileId();

    boolean isSuccess();

    Optional<Artifact> artifact();

    Optional<String> error();

    record Success(String fileId, Artifact merged) implements FileOutcome {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<Artifact> artifact() {
            return Optional.of(merged);
        }

        @Override
        public Optional<String> error() {
            return Optional.empty();
        }
    }

    record Failure(String fileId, String errorMessage) implements FileOutcome {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<Artifact> artifact() {
            return Optional.empty();
        }

        @Override
        public Optional<String> error() {
            return Optional.of(errorMessage);
        }
    }

    static FileOutcome success(String fileId, Artifact merged) {
        return new Success(fileId, merged);
    }

    static FileOutcome failure(String fileId, String error) {
        return new Failure(fileId, error);
    }
}
