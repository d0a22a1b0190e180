package org.javai.push.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.push.FailureKind;
import org.javai.push.ops.OpReporter;
import org.javai.push.ops.OpReporterUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Reports failures as JSON-lines metrics via SLF4J.
 *
 * <p>The tracking key is the failure's {@link org.javai.push.FailureCode#metricName()}, so all
 * rejections group together no matter which reason the gateway gave. The reason is emitted
 * as a separate field.</p>
 *
 * <pre>{@code
 * {"eventType":"failure","timestamp":"2024-01-20T10:30:00Z","trackingKey":"push.remote_rejection","category":"REMOTE_OUTCOME","operation":"Gateway.send","reason":"BadDeviceToken"}
 * }</pre>
 */
public class MetricsOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.push.Metrics";
	private static final Logger log = LoggerFactory.getLogger(MetricsOpReporter.class);

	private final String namespace;
	private final Logger logger;
	private final ObjectMapper mapper = new ObjectMapper();
	private final Clock clock;

	/**
	 * Creates a reporter whose namespace comes from {@code push.metrics.namespace} or
	 * {@code PUSH_METRICS_NAMESPACE}, if set.
	 */
	public MetricsOpReporter() {
		this(OpReporterUtils.resolveOptionalConfig("push.metrics.namespace", "PUSH_METRICS_NAMESPACE").orElse(null));
	}

	public MetricsOpReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Package-private for testing.
	 */
	MetricsOpReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void report(String operation, FailureKind failure) {
		try {
			logger.info(buildFailureJson(operation, failure));
		} catch (JsonProcessingException e) {
			log.warn("Could not encode metrics line for operation [{}]", operation, e);
		}
	}

	String buildFailureJson(String operation, FailureKind failure) throws JsonProcessingException {
		ObjectNode node = mapper.createObjectNode();
		node.put("eventType", "failure");
		node.put("timestamp", clock.instant().toString());
		node.put("trackingKey", buildTrackingKey(failure));
		node.put("category", failure.category().name());
		node.put("operation", operation);
		if (failure instanceof FailureKind.RemoteRejection rejection) {
			node.put("status", rejection.response().status());
			rejection.response().reason().ifPresent(reason -> node.put("reason", reason));
		}
		return mapper.writeValueAsString(node);
	}

	String buildTrackingKey(FailureKind failure) {
		String name = failure.code().metricName();
		return namespace == null ? name : namespace + "." + name;
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
