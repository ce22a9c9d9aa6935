/*
 * Where: Notification security configuration
 * What: Restricts the bulk dispatch surface and debug API to the internal caller
 * Why: Only the trusted scheduler and back-office service hold the shared token
 */
package com.example.hotelops.notification.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;

@Configuration
@EnableConfigurationProperties(InternalApiProperties.class)
public class NotificationSecurityConfig {

  @Bean
  InternalApiAuthenticationFilter internalApiAuthenticationFilter(
      InternalApiProperties properties) {
    return new InternalApiAuthenticationFilter(properties);
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http, InternalApiAuthenticationFilter internalApiAuthenticationFilter)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .exceptionHandling(
            exceptions ->
                exceptions.authenticationEntryPoint(
                    new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
        .addFilterBefore(internalApiAuthenticationFilter, AuthorizationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/",
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    .requestMatchers("/v1/bulk-notifications", "/v1/bulk-notifications/**")
                    .hasRole("INTERNAL")
                    .requestMatchers("/debug/**")
                    .hasRole("INTERNAL")
                    .anyRequest()
                    .denyAll());
    return http.build();
  }
}
