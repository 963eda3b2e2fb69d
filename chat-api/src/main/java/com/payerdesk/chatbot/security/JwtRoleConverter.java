package com.payerdesk.chatbot.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps {@code roles}, {@code user_role} and chat scopes on an access token to {@link ChatRole} authorities.
 * Values that name no chat role grant nothing.
 */
@Component
public class JwtRoleConverter implements Converter<Jwt, Collection<GrantedAuthority>> {

    static final String ROLES_CLAIM = "roles";
    static final String USER_ROLE_CLAIM = "user_role";
    static final String CHAT_SCOPE = "chat";

    private static final Logger log = LoggerFactory.getLogger(JwtRoleConverter.class);

    @Override
    public Collection<GrantedAuthority> convert(Jwt jwt) {
        List<String> claimed = new ArrayList<>();
        List<String> roles = jwt.getClaimAsStringList(ROLES_CLAIM);
        if (roles != null) {
            claimed.addAll(roles);
        }
        String userRole = jwt.getClaimAsString(USER_ROLE_CLAIM);
        if (userRole != null) {
            claimed.add(userRole);
        }

        Set<GrantedAuthority> authorities = new LinkedHashSet<>();
        for (String value : claimed) {
            ChatRole.fromClaim(value)
                    .ifPresentOrElse(role -> authorities.add(new SimpleGrantedAuthority(role.authority())),
                            () -> log.debug("Ignoring role claim {} for subject {}", value, jwt.getSubject()));
        }
        if (hasChatScope(jwt)) {
            authorities.add(new SimpleGrantedAuthority(ChatRole.CHAT_CLIENT.authority()));
        }
        return authorities;
    }

    private static boolean hasChatScope(Jwt jwt) {
        String scope = jwt.getClaimAsString("scope");
        if (scope == null) {
            return false;
        }
        for (String value : scope.split("\\s+")) {
            if (value.equals(CHAT_SCOPE) || value.startsWith(CHAT_SCOPE + ":")) {
                return true;
            }
        }
        return false;
    }
}
