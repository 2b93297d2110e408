package org.projectkessel.sdk.auth;

/**
 * Implemented by credentials that may refuse to travel over an unencrypted connection.
 *
 * <p>Builders reject combining insecure transport with credentials that return {@code true}.</p>
 */
public interface TransportSecurityAware {

    boolean requiresTransportSecurity();
}
