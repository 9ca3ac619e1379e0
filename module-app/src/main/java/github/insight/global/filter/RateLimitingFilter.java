package github.insight.global.filter;

import github.insight.config.ApiKeyProperties;
import github.insight.config.RateLimitProperties;
import github.insight.error.exception.RateLimitExceededException;
import github.insight.global.ratelimit.ClientRateLimiter;
import github.insight.global.ratelimit.ConsumeResult;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * 클라이언트별 Rate Limiting
 *
 * <p>Filter Chain 위치: MDCFilter → RateLimitingFilter → ApiKeyAuthFilter
 *
 * <h4>클라이언트 식별</h4>
 *
 * <ol>
 *   <li>API 키 헤더가 있으면 {@code api_key:<앞 8자>}
 *   <li>없으면 {@code ip:<클라이언트 IP>} (trustedHeaders 우선, 없으면 remoteAddr)
 * </ol>
 *
 * <p>초과 시 429(C005)와 Retry-After 헤더로 응답하고, 허용 시 X-RateLimit-Remaining 헤더를 붙입니다.
 */
@Slf4j
@RequiredArgsConstructor
public class RateLimitingFilter extends OncePerRequestFilter {

  static final String REMAINING_HEADER = "X-RateLimit-Remaining";

  private final ClientRateLimiter rateLimiter;
  private final RateLimitProperties properties;
  private final ApiKeyProperties apiKeyProperties;
  private final FilterErrorResponder errorResponder;

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !properties.isEnabled();
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    ConsumeResult result = rateLimiter.tryConsume(resolveClientKey(request));

    if (!result.allowed()) {
      handleRateLimitExceeded(response, result);
      return;
    }

    // remainingTokens == -1 은 Fail-Open
    if (!result.isFailOpen()) {
      response.setHeader(REMAINING_HEADER, String.valueOf(result.remainingTokens()));
    }
    filterChain.doFilter(request, response);
  }

  String resolveClientKey(HttpServletRequest request) {
    String apiKey = request.getHeader(apiKeyProperties.getHeader());
    if (apiKey != null && !apiKey.isBlank()) {
      return "api_key:" + ApiKeyAuthFilter.prefix(apiKey);
    }
    return "ip:" + extractClientIp(request);
  }

  private String extractClientIp(HttpServletRequest request) {
    for (String header : properties.getTrustedHeaders()) {
      String headerValue = request.getHeader(header);
      if (headerValue != null && !headerValue.isBlank()) {
        // X-Forwarded-For는 콤마로 구분된 목록 → 첫 번째가 원 클라이언트
        String ip = headerValue.split(",")[0].trim();
        if (!ip.isBlank()) {
          return ip;
        }
      }
    }
    return request.getRemoteAddr();
  }

  private void handleRateLimitExceeded(HttpServletResponse response, ConsumeResult result)
      throws IOException {
    response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(result.retryAfterSeconds()));
    response.setHeader(REMAINING_HEADER, String.valueOf(Math.max(result.remainingTokens(), 0)));
    errorResponder.write(response, new RateLimitExceededException(result.retryAfterSeconds()));

    log.warn("[RateLimit-Exceeded] Retry-After={}s", result.retryAfterSeconds());
  }
}
