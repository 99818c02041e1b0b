package com.jreinhal.bastion.config;

import com.jreinhal.bastion.filter.ApiKeyFilter;
import com.jreinhal.bastion.filter.RequestIdFilter;
import com.jreinhal.bastion.filter.RateLimitFilter;
import com.jreinhal.bastion.filter.RequestSizeLimitFilter;
import jakarta.servlet.DispatcherType;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.context.SecurityContextHolderFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter;

/**
 * Filter order: request id, body size, API key, per-minute rate limit. The custom filters
 * run only inside this chain; their servlet auto-registration is disabled.
 */
@Configuration
public class SecurityConfig {
    private final RequestIdFilter requestIdFilter;
    private final RequestSizeLimitFilter requestSizeLimitFilter;
    private final ApiKeyFilter apiKeyFilter;
    private final RateLimitFilter rateLimitFilter;

    public SecurityConfig(RequestIdFilter requestIdFilter, RequestSizeLimitFilter requestSizeLimitFilter, ApiKeyFilter apiKeyFilter, RateLimitFilter rateLimitFilter) {
        this.requestIdFilter = requestIdFilter;
        this.requestSizeLimitFilter = requestSizeLimitFilter;
        this.apiKeyFilter = apiKeyFilter;
        this.rateLimitFilter = rateLimitFilter;
    }

    @Bean
    public FilterRegistrationBean<RequestIdFilter> requestIdFilterRegistration(RequestIdFilter filter) {
        FilterRegistrationBean<RequestIdFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<RequestSizeLimitFilter> requestSizeLimitFilterRegistration(RequestSizeLimitFilter filter) {
        FilterRegistrationBean<RequestSizeLimitFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<ApiKeyFilter> apiKeyFilterRegistration(ApiKeyFilter filter) {
        FilterRegistrationBean<ApiKeyFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilterRegistration(RateLimitFilter filter) {
        FilterRegistrationBean<RateLimitFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public SecurityFilterChain gatewaySecurityFilterChain(HttpSecurity http) throws Exception {
        http.addFilterBefore(this.requestIdFilter, SecurityContextHolderFilter.class)
                .addFilterBefore(this.requestSizeLimitFilter, AnonymousAuthenticationFilter.class)
                .addFilterBefore(this.apiKeyFilter, AnonymousAuthenticationFilter.class)
                .addFilterBefore(this.rateLimitFilter, AuthorizationFilter.class)
                .csrf(csrf -> csrf.disable())
                .cors(Customizer.withDefaults())
                .httpBasic(basic -> basic.disable())
                .formLogin(form -> form.disable())
                .logout(logout -> logout.disable())
                .requestCache(cache -> cache.disable())
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .headers(headers -> headers
                        .httpStrictTransportSecurity(hsts -> hsts.maxAgeInSeconds(63072000L).includeSubDomains(true))
                        .frameOptions(HeadersConfigurer.FrameOptionsConfig::deny)
                        .contentTypeOptions(Customizer.withDefaults())
                        .referrerPolicy(referrer -> referrer.policy(ReferrerPolicyHeaderWriter.ReferrerPolicy.STRICT_ORIGIN_WHEN_CROSS_ORIGIN)))
                .authorizeHttpRequests(auth -> {
                    auth.dispatcherTypeMatchers(DispatcherType.ASYNC, DispatcherType.ERROR).permitAll();
                    auth.requestMatchers("/api/v1/health").permitAll();
                    auth.requestMatchers("/swagger-ui.html", "/swagger-ui/**", "/v3/api-docs/**").permitAll();
                    auth.requestMatchers("/api/**").hasAuthority(ApiKeyFilter.API_CLIENT_AUTHORITY);
                    auth.anyRequest().denyAll();
                });
        return http.build();
    }
}
