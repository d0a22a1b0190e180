package org.javai.push.options;

import org.javai.push.FailureKind;
import org.javai.push.Outcome;
import org.javai.push.boundary.Boundary;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class NotificationOptionsTest {

    @Test
    void validOptions_passThrough() {
        NotificationOptions options = NotificationOptions.builder()
                .notificationId("7b3f0c6e-1d6a-4c1f-9a4e-2b1c5d6e7f80")
                .expiration(Instant.parse("2030-01-01T00:00:00Z"))
                .priority(10)
                .topic("com.example.app")
                .collapseId("score-update")
                .pushType("alert")
                .build();

        assertThat(options.validate().getOrThrow()).isSameAs(options);
    }

    @Test
    void emptyOptions_areValid() {
        assertThat(NotificationOptions.builder().build().validate().isOk()).isTrue();
    }

    @Test
    void badPriority_namesTheOption() {
        Outcome<NotificationOptions> outcome = NotificationOptions.builder().priority(7).build().validate();

        assertThat(outcome.failure()).contains(
                new FailureKind.InvalidOptions("priority: must be one of 1, 5 or 10 but was 7"));
    }

    @Test
    void oversizedCollapseId_isRejected() {
        Outcome<NotificationOptions> outcome = NotificationOptions.builder()
                .collapseId("x".repeat(65))
                .build()
                .validate();

        FailureKind.InvalidOptions failure = (FailureKind.InvalidOptions) outcome.failure().orElseThrow();
        assertThat(failure.detail()).startsWith("collapseId:").contains("65 bytes");
        assertThat(failure.render()).isEqualTo("Invalid options for the notification payload");
    }

    @Test
    void collapseId_isMeasuredInUtf8Bytes() {
        Outcome<NotificationOptions> outcome = NotificationOptions.builder()
                .collapseId("é".repeat(33))
                .build()
                .validate();

        assertThat(outcome.isFail()).isTrue();
    }

    @Test
    void nonUuidNotificationId_isRejected() {
        Outcome<NotificationOptions> outcome = NotificationOptions.builder()
                .notificationId("not-a-uuid")
                .build()
                .validate();

        assertThat(((FailureKind.InvalidOptions) outcome.failure().orElseThrow()).detail())
                .startsWith("notificationId:");
    }

    @Test
    void blankTopic_isRejected() {
        Outcome<NotificationOptions> outcome = NotificationOptions.builder().topic("  ").build().validate();

        assertThat(outcome.failure()).contains(new FailureKind.InvalidOptions("topic: must not be blank"));
    }

    @Test
    void validateWithBoundary_reportsInvalidOptionsOnce() {
        List<String> operations = new ArrayList<>();
        List<FailureKind> failures = new ArrayList<>();
        Boundary boundary = new Boundary((operation, failure) -> {
            operations.add(operation);
            failures.add(failure);
        });

        Outcome<NotificationOptions> outcome = NotificationOptions.builder().priority(3).build().validate(boundary);

        FailureKind expected = new FailureKind.InvalidOptions("priority: must be one of 1, 5 or 10 but was 3");
        assertThat(outcome.failure()).contains(expected);
        assertThat(operations).containsExactly("NotificationOptions.validate");
        assertThat(failures).containsExactly(expected);
    }

    @Test
    void validateWithBoundary_validOptions_reportNothing() {
        List<FailureKind> failures = new ArrayList<>();
        Boundary boundary = new Boundary((operation, failure) -> failures.add(failure));

        Outcome<NotificationOptions> outcome = NotificationOptions.builder().topic("com.example.app").build()
                .validate(boundary);

        assertThat(outcome.isOk()).isTrue();
        assertThat(failures).isEmpty();
    }
}
