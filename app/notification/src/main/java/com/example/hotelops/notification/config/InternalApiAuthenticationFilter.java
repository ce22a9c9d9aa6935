package com.example.hotelops.notification.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

public class InternalApiAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(InternalApiAuthenticationFilter.class);
  private static final String INTERNAL_ROLE = "ROLE_INTERNAL";
  private static final String BEARER_PREFIX = "Bearer ";
  private static final String INTERNAL_PRINCIPAL = "internal-caller";

  private final InternalApiProperties properties;

  public InternalApiAuthenticationFilter(InternalApiProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !isInternalProtectedPath(request);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    if (isValidInternalToken(request.getHeader(properties.headerName()))) {
      final UsernamePasswordAuthenticationToken authentication =
          new UsernamePasswordAuthenticationToken(
              INTERNAL_PRINCIPAL, "N/A", List.of(new SimpleGrantedAuthority(INTERNAL_ROLE)));
      logger.debug("internal authentication established for path={}", request.getRequestURI());
      SecurityContextHolder.getContext().setAuthentication(authentication);
    } else {
      logger.warn(
          "internal authentication rejected for path={} header={}",
          request.getRequestURI(),
          properties.headerName());
    }
    filterChain.doFilter(request, response);
  }

  private boolean isInternalProtectedPath(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri != null && (uri.startsWith("/v1/bulk-notifications") || uri.startsWith("/debug/"));
  }

  private boolean isValidInternalToken(String headerValue) {
    if (headerValue == null || properties.token().isBlank()) {
      return false;
    }
    final String actualToken =
        headerValue.startsWith(BEARER_PREFIX)
            ? headerValue.substring(BEARER_PREFIX.length())
            : headerValue;
    return MessageDigest.isEqual(
        actualToken.getBytes(StandardCharsets.UTF_8),
        properties.token().getBytes(StandardCharsets.UTF_8));
  }
}
