package io.clubone.outreach.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Open outreach admin API for local runs and deployments without an OAuth2 issuer.
 * Steps aside when {@link SecurityConfig} registers its filter chain.
 */
@Configuration
@EnableWebSecurity
public class DefaultSecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(DefaultSecurityConfig.class);

    @Bean("defaultSecurityFilterChain")
    @ConditionalOnMissingBean(name = "oauth2SecurityFilterChain")
    public SecurityFilterChain defaultSecurityFilterChain(HttpSecurity http) throws Exception {
        log.warn("No OAuth2 issuer configured: outreach admin endpoints are unauthenticated");
        http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .httpBasic(basic -> basic.disable())
            .formLogin(form -> form.disable())
            .authorizeHttpRequests(auth -> auth.anyRequest().permitAll());

        return http.build();
    }
}
