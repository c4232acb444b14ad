package io.clubone.outreach.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.security.oauth2.resource.servlet.OAuth2ResourceServerAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * JWT-protected outreach admin API. Enabled by setting OAUTH2_ISSUER_URI.
 * Reads need any valid token; runs, manual sends and failure actions need the outreach admin scope.
 */
@Configuration
@ConditionalOnProperty(
    prefix = "spring.security.oauth2.resourceserver.jwt",
    name = "issuer-uri"
)
@Import(OAuth2ResourceServerAutoConfiguration.class)
@EnableWebSecurity
public class SecurityConfig {

    static final String ADMIN_SCOPE = "SCOPE_outreach:admin";

    @Bean("oauth2SecurityFilterChain")
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/health", "/actuator/info").permitAll()
                .requestMatchers(HttpMethod.POST, "/api/crm/outreach/**", "/api/automation/failures/**")
                    .hasAuthority(ADMIN_SCOPE)
                .requestMatchers(HttpMethod.GET, "/api/crm/outreach/**", "/api/automation/failures/**")
                    .authenticated()
                .anyRequest().denyAll()
            )
            .oauth2ResourceServer(oauth2 -> oauth2.jwt(Customizer.withDefaults()));

        return http.build();
    }
}
