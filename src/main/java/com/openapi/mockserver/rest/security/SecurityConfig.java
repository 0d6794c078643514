package com.openapi.mockserver.rest.security;

/**
 * Configuration for the security-requirement check.
 *
 * <p>Populated from MicroProfile Config:</p>
 * <pre>
 * openapi-mock:
 *   security:
 *     enabled: true
 *     realm: petstore
 * </pre>
 *
 * <p>When no realm is configured, the {@code WWW-Authenticate} challenge uses the
 * request's host name, or {@code server} if the host is unknown.</p>
 */
public class SecurityConfig {

    private final boolean enabled;
    private final String realm;

    private SecurityConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.realm = builder.realm;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * The configured realm, or null to derive it from the request.
     */
    public String getRealm() {
        return realm;
    }

    /**
     * Creates a disabled security configuration.
     */
    public static SecurityConfig disabled() {
        return builder().enabled(false).build();
    }

    public static SecurityConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean enabled = true;
        private String realm;

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder realm(String realm) {
            if (realm != null && realm.contains("\"")) {
                throw new IllegalArgumentException("realm must not contain double quotes");
            }
            this.realm = realm == null || realm.isBlank() ? null : realm.trim();
            return this;
        }

        public SecurityConfig build() {
            return new SecurityConfig(this);
        }
    }

    @Override
    public String toString() {
        return "SecurityConfig{" +
                "enabled=" + enabled +
                ", realm='" + realm + '\'' +
                '}';
    }
}
