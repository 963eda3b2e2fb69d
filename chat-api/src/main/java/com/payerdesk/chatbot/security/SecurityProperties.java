package com.payerdesk.chatbot.security;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chat.security")
public class SecurityProperties {

    /**
     * Optional static bearer token. Takes precedence over JWT validation when set.
     */
    private String staticToken;

    /**
     * Optional HS256 secret for validating JWT access tokens.
     */
    private String jwtSecret;

    public String getStaticToken() {
        return staticToken;
    }

    public void setStaticToken(String staticToken) {
        this.staticToken = staticToken;
    }

    public String getJwtSecret() {
        return jwtSecret;
    }

    public void setJwtSecret(String jwtSecret) {
        this.jwtSecret = jwtSecret;
    }

    public boolean hasStaticToken() {
        return staticToken != null && !staticToken.isBlank();
    }

    public boolean hasJwtSecret() {
        return jwtSecret != null && !jwtSecret.isBlank();
    }
}
