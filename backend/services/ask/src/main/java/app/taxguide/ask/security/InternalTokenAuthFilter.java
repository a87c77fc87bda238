package app.taxguide.ask.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Authenticates channel adapters (WhatsApp, Telegram, Messenger, web) that call
 * with the shared internal token instead of a user JWT.
 */
public class InternalTokenAuthFilter extends OncePerRequestFilter {

    public static final String INTERNAL_SCOPE = "ask.internal";

    private static final String AUTHORIZATION = "Authorization";
    private static final String BEARER_PREFIX = "Bearer ";

    private final InternalAuthProps props;

    public InternalTokenAuthFilter(InternalAuthProps props) {
        this.props = props;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        if (hasAuthentication()) {
            filterChain.doFilter(request, response);
            return;
        }

        String internalToken = props.internalToken();
        if (internalToken == null || internalToken.isBlank()) {
            filterChain.doFilter(request, response);
            return;
        }

        String auth = request.getHeader(AUTHORIZATION);
        if (auth == null || !auth.startsWith(BEARER_PREFIX)) {
            filterChain.doFilter(request, response);
            return;
        }

        String token = auth.substring(BEARER_PREFIX.length()).trim();
        if (!MessageDigest.isEqual(internalToken.getBytes(StandardCharsets.UTF_8), token.getBytes(StandardCharsets.UTF_8))) {
            filterChain.doFilter(request, response);
            return;
        }

        Jwt jwt = Jwt.withTokenValue(token)
                .header("alg", "none")
                .claim("scope", INTERNAL_SCOPE)
                .issuedAt(Instant.now())
                .expiresAt(Instant.now().plus(Duration.ofHours(1)))
                .build();

        var authorities = List.of(new SimpleGrantedAuthority("SCOPE_" + INTERNAL_SCOPE));
        AbstractAuthenticationToken authentication = new JwtAuthenticationToken(jwt, authorities);
        authentication.setAuthenticated(true);
        SecurityContextHolder.getContext().setAuthentication(authentication);

        filterChain.doFilter(request, response);
    }

    private boolean hasAuthentication() {
        var context = SecurityContextHolder.getContext();
        return context != null && context.getAuthentication() != null;
    }
}
