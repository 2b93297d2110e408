package org.projectkessel.sdk.auth;

/**
 * How the client id and secret are presented to the token endpoint.
 */
public enum ClientAuthenticationMethod {
    /**
     * {@code client_id} and {@code client_secret} as form fields.
     */
    CLIENT_SECRET_POST,
    /**
     * HTTP Basic authorization header.
     */
    CLIENT_SECRET_BASIC
}
