package org.javai.push;

/**
 * Stable tag of a {@link FailureKind} variant.
 *
 * <p>Callers that must handle every category statically can {@code switch} over
 * {@link FailureKind#code()}; the compiler checks the switch expression is exhaustive.
 */
public enum FailureCode {
    SERIALIZE("serialize", "Error serializing to JSON", FailureCategory.LOCAL_INPUT),
    CONNECTION("connection", "Error connecting to the gateway", FailureCategory.INFRASTRUCTURE),
    TIMEOUT("timeout", "Timeout in sending a push notification", FailureCategory.INFRASTRUCTURE),
    SIGNING("signing", "Error creating a signature", FailureCategory.INFRASTRUCTURE),
    REMOTE_REJECTION("remote_rejection", "Notification was not accepted by the gateway", FailureCategory.REMOTE_OUTCOME),
    INVALID_OPTIONS("invalid_options", "Invalid options for the notification payload", FailureCategory.LOCAL_INPUT),
    TLS("tls", "Error in creating a TLS connection", FailureCategory.INFRASTRUCTURE),
    READ("read", "Error in reading a certificate file", FailureCategory.INFRASTRUCTURE);

    private final String metricName;
    private final String description;
    private final FailureCategory category;

    FailureCode(String metricName, String description, FailureCategory category) {
        this.metricName = metricName;
        this.description = description;
        this.category = category;
    }

    /**
     * Lowercase identifier suitable for metric names and log grouping.
     */
    public String metricName() {
        return metricName;
    }

    public String description() {
        return description;
    }

    public FailureCategory category() {
        return category;
    }
}
