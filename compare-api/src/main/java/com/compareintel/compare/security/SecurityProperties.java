package com.compareintel.compare.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Access settings under {@code compare.security}.
 *
 * @param staticToken bearer token required on every non-public path; blank leaves the API open
 * @param publicPaths path patterns reachable without the token while one is configured
 */
@ConfigurationProperties(prefix = "compare.security")
public record SecurityProperties(
        String staticToken,
        @DefaultValue({"/actuator/health/**", "/actuator/info"}) List<String> publicPaths
) {

    public SecurityProperties {
        staticToken = staticToken == null ? "" : staticToken.trim();
        publicPaths = publicPaths == null ? List.of() : List.copyOf(publicPaths);
    }

    public boolean hasStaticToken() {
        return !staticToken.isEmpty();
    }
}
