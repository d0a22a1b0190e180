package org.javai.push.options;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.javai.push.FailureConversions;
import org.javai.push.Outcome;
import org.javai.push.boundary.Boundary;

/**
 * Per-notification request options sent to the gateway as headers.
 *
 * <p>Construct with {@link #builder()} and call {@link #validate(Boundary)} before sending; invalid
 * options come back as an {@code InvalidOptions} failure naming the offending option.
 *
 * @param notificationId canonical UUID identifying the notification
 * @param expiration when the gateway should stop trying to deliver
 * @param priority 10 for immediate delivery, 5 for power-considerate, 1 for lowest
 * @param topic the bundle topic the notification is for
 * @param collapseId identifier used to coalesce notifications, at most 64 bytes
 * @param pushType the push type, e.g. {@code alert} or {@code background}
 */
public record NotificationOptions(
        Optional<String> notificationId,
        Optional<Instant> expiration,
        Optional<Integer> priority,
        Optional<String> topic,
        Optional<String> collapseId,
        Optional<String> pushType
) {

    static final String VALIDATE_OPERATION = "NotificationOptions.validate";
    static final int MAX_COLLAPSE_ID_BYTES = 64;
    static final Set<Integer> PRIORITIES = Set.of(1, 5, 10);

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks every option and returns the first problem found, without reporting it.
     */
    public Outcome<NotificationOptions> validate() {
        return validate(Boundary.silent());
    }

    /**
     * Checks every option and reports the first problem found through {@code boundary}.
     */
    public Outcome<NotificationOptions> validate(Boundary boundary) {
        Objects.requireNonNull(boundary, "boundary must not be null");
        Optional<String> problem = firstProblem();
        if (problem.isPresent()) {
            return boundary.fail(VALIDATE_OPERATION, FailureConversions.invalidOptions(problem.get()));
        }
        return Outcome.ok(this);
    }

    private Optional<String> firstProblem() {
        if (notificationId.isPresent() && !isCanonicalUuid(notificationId.get())) {
            return Optional.of("notificationId: '" + notificationId.get() + "' is not a canonical UUID");
        }
        if (priority.isPresent() && !PRIORITIES.contains(priority.get())) {
            return Optional.of("priority: must be one of 1, 5 or 10 but was " + priority.get());
        }
        if (topic.isPresent() && topic.get().isBlank()) {
            return Optional.of("topic: must not be blank");
        }
        if (collapseId.isPresent()) {
            int length = collapseId.get().getBytes(StandardCharsets.UTF_8).length;
            if (length > MAX_COLLAPSE_ID_BYTES) {
                return Optional.of("collapseId: " + length + " bytes exceeds the limit of " + MAX_COLLAPSE_ID_BYTES);
            }
        }
        if (pushType.isPresent() && pushType.get().isBlank()) {
            return Optional.of("pushType: must not be blank");
        }
        return Optional.empty();
    }

    private static boolean isCanonicalUuid(String value) {
        try {
            return UUID.fromString(value).toString().equalsIgnoreCase(value);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public static class Builder {
        private String notificationId;
        private Instant expiration;
        private Integer priority;
        private String topic;
        private String collapseId;
        private String pushType;

        private Builder() {
        }

        public Builder notificationId(String notificationId) {
            this.notificationId = notificationId;
            return this;
        }

        public Builder expiration(Instant expiration) {
            this.expiration = expiration;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder topic(String topic) {
            this.topic = topic;
            return this;
        }

        public Builder collapseId(String collapseId) {
            this.collapseId = collapseId;
            return this;
        }

        public Builder pushType(String pushType) {
            this.pushType = pushType;
            return this;
        }

        public NotificationOptions build() {
            return new NotificationOptions(
                    Optional.ofNullable(notificationId),
                    Optional.ofNullable(expiration),
                    Optional.ofNullable(priority),
                    Optional.ofNullable(topic),
                    Optional.ofNullable(collapseId),
                    Optional.ofNullable(pushType));
        }
    }
}
