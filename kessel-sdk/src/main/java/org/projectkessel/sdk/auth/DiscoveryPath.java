package org.projectkessel.sdk.auth;

/**
 * Well-known location of the OpenID Connect metadata document, relative to the issuer.
 *
 * <p>Most providers publish {@code openid-configuration}; some older ones use an underscore.</p>
 */
public enum DiscoveryPath {
    OPENID_CONFIGURATION("/.well-known/openid-configuration"),
    OPENID_CONFIGURATION_UNDERSCORE("/.well-known/openid_configuration");

    private final String path;

    DiscoveryPath(String path) {
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
