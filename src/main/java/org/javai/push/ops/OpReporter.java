package org.javai.push.ops;

import org.javai.push.FailureKind;

/**
 * Reports failures for observability.
 * Implementations might emit metrics, structured logs or alerts.
 */
public interface OpReporter {

    /**
     * Reports a failure crossing into caller code.
     *
     * @param operation the operation that failed (e.g., "Gateway.send", "SigningKey.read")
     * @param failure the converted failure
     */
    void report(String operation, FailureKind failure);

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static OpReporter noOp() {
        return (operation, failure) -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     */
    static OpReporter composite(OpReporter... reporters) {
        return CompositeOpReporter.of(reporters);
    }
}
