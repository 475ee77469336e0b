package io.intellixity.sift.server.web;

import io.intellixity.sift.server.config.SiftProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/** Guards /api/** with a single static key sent in {@value #API_KEY_HEADER}. */
@Component
public final class ApiKeyFilter extends OncePerRequestFilter {
  private static final Logger log = LoggerFactory.getLogger(ApiKeyFilter.class);

  public static final String API_KEY_HEADER = "X-API-Key";

  private final SiftProperties props;

  public ApiKeyFilter(SiftProperties props) {
    this.props = props;
  }

  /** Matches on the decoded path without ;params, as request mapping sees it. */
  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = UrlPathHelper.defaultInstance.getPathWithinApplication(request);
    return !(path.equals("/api") || path.startsWith("/api/"));
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {

    String expected = props.getApiKey();
    if (expected == null || expected.isBlank()) {
      log.warn("Refusing {} {}: sift.api-key is not configured", request.getMethod(), request.getRequestURI());
      response.sendError(500, "API key is not configured");
      return;
    }

    String presented = request.getHeader(API_KEY_HEADER);
    if (presented == null || !matches(expected, presented)) {
      log.debug("Rejected {} {}: {} missing or wrong", request.getMethod(), request.getRequestURI(), API_KEY_HEADER);
      response.sendError(401, "Missing or invalid header: " + API_KEY_HEADER);
      return;
    }

    filterChain.doFilter(request, response);
  }

  private static boolean matches(String expected, String presented) {
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8),
        presented.getBytes(StandardCharsets.UTF_8));
  }
}
