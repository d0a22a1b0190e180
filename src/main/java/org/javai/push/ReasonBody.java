package org.javai.push;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Body of a gateway rejection.
 *
 * @param reason the reason string exactly as the gateway sent it
 * @param timestamp when the gateway last confirmed the device token was invalid, if it said so
 */
public record ReasonBody(String reason, Optional<Instant> timestamp) {

    public ReasonBody {
        Objects.requireNonNull(reason, "reason must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null, use Optional.empty()");
    }

    public ReasonBody(String reason) {
        this(reason, Optional.empty());
    }

    /**
     * Maps the reason onto a documented {@link RejectionReason}, if it is one.
     */
    public Optional<RejectionReason> knownReason() {
        return RejectionReason.fromText(reason);
    }
}
