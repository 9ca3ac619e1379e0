package github.insight.global.filter;

import github.insight.config.ApiKeyProperties;
import github.insight.error.exception.ApiKeyRequiredException;
import github.insight.error.exception.InvalidApiKeyException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * 선택적 API 키 인증
 *
 * <p>{@code security.api-key.enabled=false}(기본)이면 모든 요청을 통과시킵니다. 활성화되면 헤더가 없을 때 401(C003), 목록에
 * 없는 키일 때 403(C004)을 응답합니다.
 */
@Slf4j
@RequiredArgsConstructor
public class ApiKeyAuthFilter extends OncePerRequestFilter {

  private static final int KEY_LOG_PREFIX = 8;

  private final ApiKeyProperties properties;
  private final FilterErrorResponder errorResponder;

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    if (!properties.isEnabled()) {
      return true;
    }
    String uri = request.getRequestURI();
    return properties.getExemptPaths().stream().anyMatch(uri::startsWith);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    String apiKey = request.getHeader(properties.getHeader());

    if (apiKey == null || apiKey.isBlank()) {
      log.warn("[ApiKey] Missing header {} for {}", properties.getHeader(), request.getRequestURI());
      errorResponder.write(response, new ApiKeyRequiredException(properties.getHeader()));
      return;
    }

    if (!properties.getValidKeys().contains(apiKey)) {
      log.warn("[ApiKey] Rejected key {}...", prefix(apiKey));
      errorResponder.write(response, new InvalidApiKeyException());
      return;
    }

    filterChain.doFilter(request, response);
  }

  static String prefix(String apiKey) {
    return apiKey.length() <= KEY_LOG_PREFIX ? apiKey : apiKey.substring(0, KEY_LOG_PREFIX);
  }
}
