package org.cloudfiles.storage.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for user sessions.
 * Maps to cloudfiles.session.* properties in application.yml
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "cloudfiles.session")
public class SessionProperties {

    /**
     * Time to live of a session after sign-in.
     */
    private Duration lifetime = Duration.ofHours(24);

    /**
     * Cookie carrying the session id.
     */
    private String cookieName = "session_id";

    /**
     * Prefix of the Redis keys holding sessions.
     */
    private String keyPrefix = "session:";

    @PostConstruct
    public void validate() {
        if (lifetime == null || lifetime.isNegative() || lifetime.isZero()) {
            throw new IllegalArgumentException("cloudfiles.session.lifetime must be positive. Current value: " + lifetime);
        }
    }
}
