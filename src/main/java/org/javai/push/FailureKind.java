package org.javai.push;

import java.util.Objects;

/**
 * Everything that can go wrong while preparing, signing, sending or interpreting a push notification.
 *
 * <p>The set of variants is closed. Only {@link RemoteRejection} means the gateway actually
 * received the request; every other variant means no structured response was issued.
 *
 * <p>Values are immutable and own their diagnostic text. They never keep a reference to
 * the lower-layer exception they were converted from.
 *
 * <pre>{@code
 * switch (failure.code()) {
 *     case REMOTE_REJECTION -> alertOperator(failure.render());
 *     case INVALID_OPTIONS, SERIALIZE -> fixRequest(failure);
 *     default -> checkConfiguration(failure);
 * }
 * }</pre>
 */
public sealed interface FailureKind permits
        FailureKind.SerializeFailure,
        FailureKind.ConnectionFailure,
        FailureKind.TimeoutFailure,
        FailureKind.SigningFailure,
        FailureKind.RemoteRejection,
        FailureKind.InvalidOptions,
        FailureKind.TlsFailure,
        FailureKind.ReadFailure {

    /**
     * Request or response JSON was malformed or could not be encoded.
     */
    record SerializeFailure() implements FailureKind {
        @Override
        public FailureCode code() {
            return FailureCode.SERIALIZE;
        }

        @Override
        public String toString() {
            return render();
        }
    }

    /**
     * The transport reported an error while connecting or sending.
     */
    record ConnectionFailure() implements FailureKind {
        @Override
        public FailureCode code() {
            return FailureCode.CONNECTION;
        }

        @Override
        public String toString() {
            return render();
        }
    }

    /**
     * The caller's time budget for a send elapsed before it completed.
     */
    record TimeoutFailure() implements FailureKind {
        @Override
        public FailureCode code() {
            return FailureCode.TIMEOUT;
        }

        @Override
        public String toString() {
            return render();
        }
    }

    /**
     * The signing key could not produce a token.
     *
     * @param detail message of the cryptographic failure
     */
    record SigningFailure(String detail) implements FailureKind {
        public SigningFailure {
            Objects.requireNonNull(detail, "detail must not be null");
        }

        @Override
        public FailureCode code() {
            return FailureCode.SIGNING;
        }

        @Override
        public String toString() {
            return render();
        }
    }

    /**
     * The gateway accepted the connection but refused the notification.
     *
     * @param response the gateway's response, reason and metadata kept verbatim
     */
    record RemoteRejection(DeliveryResponse response) implements FailureKind {
        public RemoteRejection {
            Objects.requireNonNull(response, "response must not be null");
        }

        @Override
        public FailureCode code() {
            return FailureCode.REMOTE_REJECTION;
        }

        @Override
        public String render() {
            return response.reason()
                    .map(reason -> description() + " (reason: \"" + reason + "\")")
                    .orElseGet(this::description);
        }

        @Override
        public String toString() {
            return render();
        }
    }

    /**
     * Notification options failed local validation.
     *
     * @param detail which option was rejected and why
     */
    record InvalidOptions(String detail) implements FailureKind {
        public InvalidOptions {
            Objects.requireNonNull(detail, "detail must not be null");
        }

        @Override
        public FailureCode code() {
            return FailureCode.INVALID_OPTIONS;
        }

        @Override
        public String toString() {
            return render();
        }
    }

    /**
     * The TLS session could not be established.
     *
     * @param detail message of the TLS failure
     */
    record TlsFailure(String detail) implements FailureKind {
        public TlsFailure {
            Objects.requireNonNull(detail, "detail must not be null");
        }

        @Override
        public FailureCode code() {
            return FailureCode.TLS;
        }

        @Override
        public String toString() {
            return render();
        }
    }

    /**
     * A certificate or key file could not be read.
     *
     * @param detail message of the I/O failure
     */
    record ReadFailure(String detail) implements FailureKind {
        public ReadFailure {
            Objects.requireNonNull(detail, "detail must not be null");
        }

        @Override
        public FailureCode code() {
            return FailureCode.READ;
        }

        @Override
        public String toString() {
            return render();
        }
    }

    /**
     * Returns the variant tag.
     */
    FailureCode code();

    /**
     * Returns the categorical description of this variant.
     * Depends on the variant only, never on embedded detail.
     */
    default String description() {
        return code().description();
    }

    default FailureCategory category() {
        return code().category();
    }

    /**
     * Renders this failure for humans and logs.
     *
     * <p>Equal to {@link #description()}, except that a {@link RemoteRejection} carrying a
     * reason appends it as {@code (reason: "BadDeviceToken")}.
     */
    default String render() {
        return description();
    }
}
