package github.insight.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import github.insight.global.filter.ApiKeyAuthFilter;
import github.insight.global.filter.FilterErrorResponder;
import github.insight.global.filter.MDCFilter;
import github.insight.global.filter.RateLimitingFilter;
import github.insight.global.ratelimit.ClientRateLimiter;
import github.insight.infrastructure.executor.LogicExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * 서블릿 필터 등록
 *
 * <p>순서: MDCFilter → RateLimitingFilter → ApiKeyAuthFilter. 필터는 @Component가 아닌 수동 등록으로 중복 등록을 막습니다.
 */
@Configuration
@EnableConfigurationProperties({ApiKeyProperties.class, RateLimitProperties.class})
public class WebFilterConfig {

  private static final String API_PATTERN = "/api/*";

  @Bean
  public FilterErrorResponder filterErrorResponder(ObjectMapper objectMapper) {
    return new FilterErrorResponder(objectMapper);
  }

  @Bean
  public ClientRateLimiter clientRateLimiter(
      RateLimitProperties properties, LogicExecutor executor, MeterRegistry meterRegistry) {
    return new ClientRateLimiter(properties, executor, meterRegistry);
  }

  @Bean
  public FilterRegistrationBean<MDCFilter> mdcFilterRegistration() {
    FilterRegistrationBean<MDCFilter> registration = new FilterRegistrationBean<>(new MDCFilter());
    registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
    registration.addUrlPatterns("/*");
    return registration;
  }

  @Bean
  public FilterRegistrationBean<RateLimitingFilter> rateLimitingFilterRegistration(
      ClientRateLimiter clientRateLimiter,
      RateLimitProperties rateLimitProperties,
      ApiKeyProperties apiKeyProperties,
      FilterErrorResponder filterErrorResponder) {
    FilterRegistrationBean<RateLimitingFilter> registration =
        new FilterRegistrationBean<>(
            new RateLimitingFilter(
                clientRateLimiter, rateLimitProperties, apiKeyProperties, filterErrorResponder));
    registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
    registration.addUrlPatterns(API_PATTERN);
    return registration;
  }

  @Bean
  public FilterRegistrationBean<ApiKeyAuthFilter> apiKeyAuthFilterRegistration(
      ApiKeyProperties apiKeyProperties, FilterErrorResponder filterErrorResponder) {
    FilterRegistrationBean<ApiKeyAuthFilter> registration =
        new FilterRegistrationBean<>(new ApiKeyAuthFilter(apiKeyProperties, filterErrorResponder));
    registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 20);
    registration.addUrlPatterns(API_PATTERN);
    return registration;
  }
}
