package com.payerdesk.chatbot.security;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.config.web.server.SecurityWebFiltersOrder;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.NimbusReactiveJwtDecoder;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationConverter;
import org.springframework.security.oauth2.server.resource.web.server.authentication.ServerBearerTokenAuthenticationConverter;
import org.springframework.security.web.server.SecurityWebFilterChain;
import org.springframework.security.web.server.authentication.AuthenticationWebFilter;
import org.springframework.security.web.server.context.NoOpServerSecurityContextRepository;
import org.springframework.security.web.server.util.matcher.ServerWebExchangeMatchers;
import reactor.core.publisher.Mono;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;

/**
 * Static bearer token if configured, else HS256 JWTs if a secret is configured, else open.
 * When secured, chat routes need one of the {@link ChatRole} authorities. Health and actuator routes are always open.
 */
@Configuration
@EnableWebFluxSecurity
@EnableConfigurationProperties(SecurityProperties.class)
public class SecurityConfig {

    private static final String[] OPEN_PATHS = {"/actuator/**", "/health"};
    private static final String CHAT_PATHS = "/chat/**";

    private final JwtRoleConverter roleConverter;
    private final SecurityProperties securityProperties;

    public SecurityConfig(JwtRoleConverter roleConverter, SecurityProperties securityProperties) {
        this.roleConverter = roleConverter;
        this.securityProperties = securityProperties;
    }

    @Bean
    public SecurityWebFilterChain securityWebFilterChain(ServerHttpSecurity http) {
        boolean secured = securityProperties.hasStaticToken() || securityProperties.hasJwtSecret();
        ServerHttpSecurity security = http
                .csrf(ServerHttpSecurity.CsrfSpec::disable)
                .cors(Customizer.withDefaults())
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .securityContextRepository(NoOpServerSecurityContextRepository.getInstance())
                .authorizeExchange(registry -> {
                    registry.pathMatchers(OPEN_PATHS).permitAll();
                    if (secured) {
                        registry.pathMatchers(CHAT_PATHS).hasAnyRole(ChatRole.names());
                        registry.anyExchange().authenticated();
                    } else {
                        registry.anyExchange().permitAll();
                    }
                });

        if (securityProperties.hasStaticToken()) {
            security.addFilterAt(staticTokenAuthenticationFilter(), SecurityWebFiltersOrder.AUTHENTICATION);
            return security.build();
        }
        if (securityProperties.hasJwtSecret()) {
            return security
                    .oauth2ResourceServer(resourceServer -> resourceServer
                            .jwt(jwtSpec -> jwtSpec
                                    .jwtDecoder(hmacDecoder(securityProperties.getJwtSecret()))
                                    .jwtAuthenticationConverter(this::convertJwt)))
                    .build();
        }
        return security.build();
    }

    private Mono<AbstractAuthenticationToken> convertJwt(Jwt jwt) {
        JwtAuthenticationConverter converter = new JwtAuthenticationConverter();
        converter.setJwtGrantedAuthoritiesConverter(roleConverter);
        return Mono.justOrEmpty(converter.convert(jwt));
    }

    private static ReactiveJwtDecoder hmacDecoder(String secret) {
        SecretKeySpec key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        return NimbusReactiveJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
    }

    private AuthenticationWebFilter staticTokenAuthenticationFilter() {
        AuthenticationWebFilter filter = new AuthenticationWebFilter(
                new StaticTokenAuthenticationManager(securityProperties.getStaticToken()));
        filter.setServerAuthenticationConverter(new ServerBearerTokenAuthenticationConverter());
        filter.setRequiresAuthenticationMatcher(ServerWebExchangeMatchers.anyExchange());
        filter.setSecurityContextRepository(NoOpServerSecurityContextRepository.getInstance());
        return filter;
    }
}
