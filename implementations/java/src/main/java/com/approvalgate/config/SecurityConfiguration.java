package com.approvalgate.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;

/**
 * HTTP surface of the approval gate.
 *
 * <p>The service sits behind a gateway that authenticates users and forwards
 * their identity in the request body or {@code X-User-*} headers, so the tool
 * endpoints are open at this layer. Who may do what is decided per action by
 * the {@link com.approvalgate.infrastructure.security.AuthorizationGuard}, at
 * propose time and again at execute time, and row visibility by PostgreSQL RLS.
 * Anything not listed here is refused with 403.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfiguration {

    private static final String[] TOOL_ENDPOINTS = {"/tools/*", "/execute", "/confirm/*"};
    private static final String[] OPERATIONAL_ENDPOINTS = {
        "/actuator/health", "/actuator/health/**", "/actuator/info",
        "/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html"
    };

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .httpBasic(basic -> basic.disable())
            .formLogin(form -> form.disable())
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .exceptionHandling(errors -> errors.authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.FORBIDDEN)))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.POST, TOOL_ENDPOINTS).permitAll()
                .requestMatchers(HttpMethod.GET, OPERATIONAL_ENDPOINTS).permitAll()
                .anyRequest().denyAll()
            )
            .headers(headers -> headers
                .contentSecurityPolicy(csp -> csp.policyDirectives("default-src 'self'; frame-ancestors 'none'"))
                .frameOptions(frame -> frame.deny())
                .httpStrictTransportSecurity(hsts -> hsts.includeSubDomains(true).maxAgeInSeconds(31536000))
            );

        return http.build();
    }
}
