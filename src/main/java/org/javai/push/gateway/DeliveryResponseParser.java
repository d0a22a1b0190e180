package org.javai.push.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.push.DeliveryResponse;
import org.javai.push.FailureConversions;
import org.javai.push.Outcome;
import org.javai.push.ReasonBody;
import org.javai.push.boundary.Boundary;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Interprets the gateway's answer to a send.
 *
 * <p>A 2xx status is a delivery. Anything else is a {@code RemoteRejection} carrying the parsed
 * body, whose {@code reason} is kept exactly as sent. A body that is not valid JSON
 * is a {@code SerializeFailure}.
 *
 * <p>Rejection bodies look like {@code {"reason": "Unregistered", "timestamp": 1700000000000}};
 * the timestamp is in epoch milliseconds and only present for some reasons.
 */
public class DeliveryResponseParser {

    static final String OPERATION = "Gateway.interpret";

    private final Boundary boundary;
    private final ObjectMapper mapper;

    public DeliveryResponseParser() {
        this(Boundary.silent(), new ObjectMapper());
    }

    public DeliveryResponseParser(Boundary boundary) {
        this(boundary, new ObjectMapper());
    }

    public DeliveryResponseParser(Boundary boundary, ObjectMapper mapper) {
        this.boundary = Objects.requireNonNull(boundary, "boundary must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * @param status HTTP status reported by the gateway
     * @param notificationId the notification identifier header, may be null
     * @param body the response body, may be null or empty
     */
    public Outcome<DeliveryResponse> interpret(int status, String notificationId, String body) {
        if (status >= 200 && status < 300) {
            return Outcome.ok(DeliveryResponse.accepted(status, notificationId));
        }
        if (body == null || body.isBlank()) {
            return reject(DeliveryResponse.rejected(status, notificationId, null));
        }
        return boundary.call(OPERATION, () -> parseBody(body), JsonProcessingException.class, FailureConversions.JSON)
                .flatMap(error -> reject(DeliveryResponse.rejected(status, notificationId, error.orElse(null))));
    }

    private Optional<ReasonBody> parseBody(String body) throws JsonProcessingException {
        ErrorBody parsed = mapper.readValue(body, ErrorBody.class);
        if (parsed == null || parsed.reason() == null) {
            return Optional.empty();
        }
        Optional<Instant> timestamp = Optional.ofNullable(parsed.timestamp()).map(Instant::ofEpochMilli);
        return Optional.of(new ReasonBody(parsed.reason(), timestamp));
    }

    private Outcome<DeliveryResponse> reject(DeliveryResponse response) {
        return boundary.fail(OPERATION, FailureConversions.rejection(response));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ErrorBody(String reason, Long timestamp) {
    }
}
