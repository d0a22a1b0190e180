package org.javai.push.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.push.FailureCategory;
import org.javai.push.FailureKind;
import org.javai.push.ops.OpReporter;
import org.javai.push.ops.OpReporterUtils;

/**
 * Reports failures using Log4j2.
 *
 * <p>Log level follows the {@link FailureCategory}:
 * <ul>
 *   <li>{@code INFRASTRUCTURE} → WARN</li>
 *   <li>{@code REMOTE_OUTCOME} → INFO</li>
 *   <li>{@code LOCAL_INPUT} → DEBUG</li>
 * </ul>
 *
 * <p>The default logger name can be overridden with the {@code push.log.name} system property
 * or the {@code PUSH_LOG_NAME} environment variable.
 */
public class Log4jOpReporter implements OpReporter {

	static final String DEFAULT_LOGGER_NAME = "org.javai.push.OpReporter";

	private static final Marker FAILURE_MARKER = MarkerManager.getMarker("PUSH_FAILURE");

	private final Logger logger;

	public Log4jOpReporter() {
		this(OpReporterUtils.resolveOptionalConfig("push.log.name", "PUSH_LOG_NAME").orElse(DEFAULT_LOGGER_NAME));
	}

	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(String operation, FailureKind failure) {
		logger.atLevel(levelFor(failure.category()))
			.withMarker(FAILURE_MARKER)
			.log(formatFailureMessage(operation, failure));
	}

	static String formatFailureMessage(String operation, FailureKind failure) {
		return "Failure in operation [%s]: %s | code=%s, category=%s%s".formatted(
				operation,
				failure.render(),
				failure.code().metricName(),
				failure.category(),
				formatDetail(failure));
	}

	private static String formatDetail(FailureKind failure) {
		String detail;
		if (failure instanceof FailureKind.SigningFailure signing) {
			detail = signing.detail();
		} else if (failure instanceof FailureKind.TlsFailure tls) {
			detail = tls.detail();
		} else if (failure instanceof FailureKind.ReadFailure read) {
			detail = read.detail();
		} else if (failure instanceof FailureKind.InvalidOptions options) {
			detail = options.detail();
		} else if (failure instanceof FailureKind.RemoteRejection rejection) {
			return ", status=" + rejection.response().status()
					+ rejection.response().notificationId().map(id -> ", notificationId=" + id).orElse("");
		} else {
			return "";
		}
		return ", detail=" + detail;
	}

	static Level levelFor(FailureCategory category) {
		return switch (category) {
			case INFRASTRUCTURE -> Level.WARN;
			case REMOTE_OUTCOME -> Level.INFO;
			case LOCAL_INPUT -> Level.DEBUG;
		};
	}
}
