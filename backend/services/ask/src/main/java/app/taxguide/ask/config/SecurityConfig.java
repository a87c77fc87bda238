package app.taxguide.ask.config;

import app.taxguide.ask.security.InternalAuthProps;
import app.taxguide.ask.security.InternalTokenAuthFilter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.server.resource.web.BearerTokenResolver;
import org.springframework.security.oauth2.server.resource.web.authentication.BearerTokenAuthenticationFilter;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.List;

@Configuration
@EnableConfigurationProperties({CorsProps.class, InternalAuthProps.class})
public class SecurityConfig {

    private static final String INTERNAL = "SCOPE_" + InternalTokenAuthFilter.INTERNAL_SCOPE;
    private static final String ADMIN = "SCOPE_ask.admin";

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                   CorsConfigurationSource corsConfigurationSource,
                                                   InternalTokenAuthFilter internalTokenAuthFilter,
                                                   BearerTokenResolver bearerTokenResolver) throws Exception {
        http
                .cors(cors -> cors.configurationSource(corsConfigurationSource))
                .csrf(AbstractHttpConfigurer::disable)
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/actuator/health/**", "/actuator/info").permitAll()
                        .requestMatchers("/error").permitAll()
                        // signed by Paystack, verified in the fulfillment service
                        .requestMatchers(HttpMethod.POST, "/webhooks/paystack").permitAll()
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                        .requestMatchers("/admin/**").hasAuthority(ADMIN)
                        .requestMatchers("/ask", "/subscriptions/**", "/billing/**").hasAnyAuthority(INTERNAL, ADMIN)
                        .anyRequest().authenticated()
                )
                .oauth2ResourceServer(oauth2 -> oauth2
                        .jwt(Customizer.withDefaults())
                        .bearerTokenResolver(bearerTokenResolver)
                );

        http.addFilterBefore(internalTokenAuthFilter, BearerTokenAuthenticationFilter.class);

        return http.build();
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource(CorsProps props) {
        CorsConfiguration cfg = new CorsConfiguration();
        var origins = (props.origins() == null || props.origins().isEmpty())
                ? List.of("https://naijatax.guide", "http://localhost:3000")
                : props.origins();

        cfg.setAllowedOrigins(origins);
        cfg.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
        cfg.setAllowedHeaders(List.of("*"));
        cfg.setExposedHeaders(List.of("Authorization", "Content-Type"));
        cfg.setAllowCredentials(true);
        cfg.setMaxAge(3600L);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", cfg);
        return source;
    }

    @Bean
    public BearerTokenResolver bearerTokenResolver(InternalAuthProps props) {
        return request -> {
            String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
            if (authHeader == null || !authHeader.startsWith("Bearer ")) {
                return null;
            }
            String token = authHeader.substring("Bearer ".length());
            if (token.equals(props.internalToken())) {
                return null;
            }
            return token;
        };
    }

    @Bean
    public InternalTokenAuthFilter internalTokenAuthFilter(InternalAuthProps props) {
        return new InternalTokenAuthFilter(props);
    }

    // runs inside the security chain only
    @Bean
    public FilterRegistrationBean<InternalTokenAuthFilter> internalTokenAuthFilterRegistration(
            InternalTokenAuthFilter internalTokenAuthFilter) {
        FilterRegistrationBean<InternalTokenAuthFilter> registration =
                new FilterRegistrationBean<>(internalTokenAuthFilter);
        registration.setEnabled(false);
        return registration;
    }
}
