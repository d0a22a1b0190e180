package org.javai.push;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on a failed outcome.
 * Unchecked because it signals misuse: the caller should have inspected the outcome first.
 */
public class PushFailureException extends RuntimeException {

    private final FailureKind failure;

    public PushFailureException(FailureKind failure) {
        super("Push operation failed: " + failure.render());
        this.failure = failure;
    }

    public FailureKind failure() {
        return failure;
    }
}
