package org.javai.push;

/**
 * Groups failure kinds by who can act on them.
 */
public enum FailureCategory {
    /**
     * The request itself is at fault (bad JSON, invalid options).
     * The caller can correct it before trying again.
     */
    LOCAL_INPUT,

    /**
     * The environment or configuration is at fault: connection, TLS, timeout,
     * credential files, signing keys. Changing the request will not help.
     */
    INFRASTRUCTURE,

    /**
     * The gateway processed the request and refused it.
     * The reason it returned is authoritative.
     */
    REMOTE_OUTCOME
}
