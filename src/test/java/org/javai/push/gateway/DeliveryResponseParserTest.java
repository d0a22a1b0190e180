package org.javai.push.gateway;

import org.javai.push.DeliveryResponse;
import org.javai.push.FailureCode;
import org.javai.push.FailureKind;
import org.javai.push.Outcome;
import org.javai.push.RejectionReason;
import org.javai.push.boundary.Boundary;
import org.javai.push.ops.OpReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DeliveryResponseParserTest {

    private DeliveryResponseParser parser;
    private List<FailureKind> reported;

    @BeforeEach
    void setUp() {
        reported = new ArrayList<>();
        OpReporter reporter = (operation, failure) -> reported.add(failure);
        parser = new DeliveryResponseParser(new Boundary(reporter));
    }

    @Test
    void success_returnsAcceptedResponse() {
        Outcome<DeliveryResponse> outcome = parser.interpret(200, "7b3f0c6e-1d6a-4c1f-9a4e-2b1c5d6e7f80", "");

        DeliveryResponse response = outcome.getOrThrow();
        assertThat(response.isAccepted()).isTrue();
        assertThat(response.notificationId()).contains("7b3f0c6e-1d6a-4c1f-9a4e-2b1c5d6e7f80");
        assertThat(response.error()).isEmpty();
        assertThat(reported).isEmpty();
    }

    @Test
    void payloadTooLarge_surfacesAsRemoteRejectionWithReason() {
        Outcome<DeliveryResponse> outcome = parser.interpret(413, null, "{\"reason\":\"PayloadTooLarge\"}");

        FailureKind failure = outcome.failure().orElseThrow();
        assertThat(failure.code()).isEqualTo(FailureCode.REMOTE_REJECTION);
        assertThat(failure.description()).isEqualTo("Notification was not accepted by the gateway");

        DeliveryResponse response = ((FailureKind.RemoteRejection) failure).response();
        assertThat(response.status()).isEqualTo(413);
        assertThat(response.reason()).contains("PayloadTooLarge");
        assertThat(response.notificationId()).isEmpty();
        assertThat(response.error().orElseThrow().knownReason()).contains(RejectionReason.PAYLOAD_TOO_LARGE);
        assertThat(reported).containsExactly(failure);
    }

    @Test
    void unregistered_keepsTimestamp() {
        Outcome<DeliveryResponse> outcome = parser.interpret(410, "abc",
                "{\"reason\":\"Unregistered\",\"timestamp\":1700000000000}");

        DeliveryResponse response = ((FailureKind.RemoteRejection) outcome.failure().orElseThrow()).response();
        assertThat(response.error().orElseThrow().timestamp()).contains(Instant.ofEpochMilli(1700000000000L));
        assertThat(response.notificationId()).contains("abc");
    }

    @Test
    void unknownFields_areIgnoredAndUnknownReasonKeptVerbatim() {
        Outcome<DeliveryResponse> outcome = parser.interpret(400, null,
                "{\"reason\":\"BrandNewReason\",\"extra\":true}");

        FailureKind failure = outcome.failure().orElseThrow();
        assertThat(failure.render()).endsWith("(reason: \"BrandNewReason\")");
    }

    @Test
    void emptyBody_isRejectionWithoutReason() {
        Outcome<DeliveryResponse> outcome = parser.interpret(503, null, null);

        FailureKind failure = outcome.failure().orElseThrow();
        assertThat(failure).isInstanceOf(FailureKind.RemoteRejection.class);
        assertThat(failure.render()).isEqualTo("Notification was not accepted by the gateway");
    }

    @Test
    void objectWithoutReason_isRejectionWithoutReason() {
        Outcome<DeliveryResponse> outcome = parser.interpret(500, null, "{}");

        DeliveryResponse response = ((FailureKind.RemoteRejection) outcome.failure().orElseThrow()).response();
        assertThat(response.error()).isEmpty();
    }

    @Test
    void malformedBody_isSerializeFailure() {
        Outcome<DeliveryResponse> outcome = parser.interpret(400, null, "<html>Bad Gateway</html>");

        assertThat(outcome.failure()).contains(new FailureKind.SerializeFailure());
        assertThat(reported).containsExactly(new FailureKind.SerializeFailure());
    }
}
