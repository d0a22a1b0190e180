package org.javai.push;

import java.util.Objects;
import java.util.Optional;

/**
 * The gateway's answer to a single notification send.
 *
 * <p>Mirrors the gateway's response schema: an HTTP status, the notification identifier the
 * gateway assigned or echoed back, and for rejections a {@link ReasonBody}.
 *
 * @param status HTTP status reported by the gateway
 * @param notificationId identifier of the notification, if the gateway returned one
 * @param error the rejection body, if any
 */
public record DeliveryResponse(int status, Optional<String> notificationId, Optional<ReasonBody> error) {

    public DeliveryResponse {
        Objects.requireNonNull(notificationId, "notificationId must not be null, use Optional.empty()");
        Objects.requireNonNull(error, "error must not be null, use Optional.empty()");
    }

    public static DeliveryResponse accepted(int status, String notificationId) {
        return new DeliveryResponse(status, Optional.ofNullable(notificationId), Optional.empty());
    }

    public static DeliveryResponse rejected(int status, String notificationId, ReasonBody error) {
        return new DeliveryResponse(status, Optional.ofNullable(notificationId), Optional.ofNullable(error));
    }

    /**
     * Whether the status is in the 2xx range.
     */
    public boolean isAccepted() {
        return status >= 200 && status < 300;
    }

    /**
     * The machine-readable rejection reason, if the gateway sent one.
     */
    public Optional<String> reason() {
        return error.map(ReasonBody::reason);
    }
}
