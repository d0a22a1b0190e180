package org.javai.push;

import com.fasterxml.jackson.core.JsonProcessingException;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.Objects;

/**
 * The conversion rules from each lower-layer failure source into {@link FailureKind}.
 *
 * <p>How much detail survives differs per source. JSON and connection failures are collapsed
 * to a bare variant; signing, TLS and read failures keep the exception message; gateway
 * rejections keep the whole response.
 */
public final class FailureConversions {

    public static final FailureConverter<JsonProcessingException> JSON = FailureConversions::fromJson;
    public static final FailureConverter<GeneralSecurityException> SIGNING = FailureConversions::fromSigning;
    public static final FailureConverter<IOException> READ = FailureConversions::fromRead;
    public static final FailureConverter<IOException> CONNECTION = FailureConversions::fromConnection;
    public static final FailureConverter<SSLException> TLS = FailureConversions::fromTls;

    private FailureConversions() {
        // Utility class
    }

    /**
     * Any JSON encode or decode failure. The parser's message is dropped.
     */
    public static FailureKind fromJson(JsonProcessingException e) {
        Objects.requireNonNull(e, "exception must not be null");
        return new FailureKind.SerializeFailure();
    }

    public static FailureKind fromSigning(GeneralSecurityException e) {
        return new FailureKind.SigningFailure(renderedMessage(e));
    }

    /**
     * Failure opening or reading a certificate or key from storage.
     */
    public static FailureKind fromRead(IOException e) {
        return new FailureKind.ReadFailure(renderedMessage(e));
    }

    /**
     * Any transport failure. The underlying error code is dropped.
     */
    public static FailureKind fromConnection(IOException e) {
        Objects.requireNonNull(e, "exception must not be null");
        return new FailureKind.ConnectionFailure();
    }

    public static FailureKind fromTls(SSLException e) {
        return new FailureKind.TlsFailure(renderedMessage(e));
    }

    /**
     * Built by whatever enforces the caller's time budget; no exception type signals a timeout uniformly.
     */
    public static FailureKind timeout() {
        return new FailureKind.TimeoutFailure();
    }

    public static FailureKind invalidOptions(String detail) {
        return new FailureKind.InvalidOptions(detail);
    }

    public static FailureKind rejection(DeliveryResponse response) {
        return new FailureKind.RemoteRejection(response);
    }

    static String renderedMessage(Throwable t) {
        Objects.requireNonNull(t, "exception must not be null");
        return t.getMessage() != null ? t.getMessage() : t.toString();
    }
}
