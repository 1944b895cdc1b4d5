package com.compareintel.compare.security;

import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.oauth2.server.resource.authentication.BearerTokenAuthenticationToken;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

public class StaticTokenAuthenticationManager implements ReactiveAuthenticationManager {

    private final byte[] expectedToken;

    public StaticTokenAuthenticationManager(String expectedToken) {
        this.expectedToken = expectedToken.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public Mono<Authentication> authenticate(Authentication authentication) {
        if (!(authentication instanceof BearerTokenAuthenticationToken bearer)) {
            return Mono.error(new BadCredentialsException("Unsupported authentication token"));
        }

        String token = bearer.getToken();
        if (token == null || !MessageDigest.isEqual(token.getBytes(StandardCharsets.UTF_8), expectedToken)) {
            return Mono.error(new BadCredentialsException("Invalid bearer token"));
        }

        return Mono.just(new UsernamePasswordAuthenticationToken(
                "compare-client",
                null,
                AuthorityUtils.NO_AUTHORITIES
        ));
    }
}
