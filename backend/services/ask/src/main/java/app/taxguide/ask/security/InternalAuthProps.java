package app.taxguide.ask.security;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.security")
public record InternalAuthProps(
        String internalToken
) {
}
