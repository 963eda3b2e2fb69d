package com.payerdesk.chatbot.security;

import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.oauth2.server.resource.authentication.BearerTokenAuthenticationToken;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Shared-token mode for a single trusted front end. Every caller is the {@value #PRINCIPAL} chat client,
 * so threads are keyed by the front end rather than by the person typing.
 */
public class StaticTokenAuthenticationManager implements ReactiveAuthenticationManager {

    static final String PRINCIPAL = "chat-client";

    private final byte[] expectedToken;

    public StaticTokenAuthenticationManager(String expectedToken) {
        if (expectedToken == null || expectedToken.isBlank()) {
            throw new IllegalArgumentException("chat.security.static-token must not be blank");
        }
        this.expectedToken = expectedToken.trim().getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public Mono<Authentication> authenticate(Authentication authentication) {
        if (!(authentication instanceof BearerTokenAuthenticationToken bearer)) {
            return Mono.error(new BadCredentialsException("Chat routes take a bearer token"));
        }
        String token = bearer.getToken();
        if (token == null || !MessageDigest.isEqual(expectedToken, token.getBytes(StandardCharsets.UTF_8))) {
            return Mono.error(new BadCredentialsException("Unknown chat client token"));
        }
        return Mono.just(new UsernamePasswordAuthenticationToken(PRINCIPAL, null,
                AuthorityUtils.createAuthorityList(ChatRole.CHAT_CLIENT.authority())));
    }
}
