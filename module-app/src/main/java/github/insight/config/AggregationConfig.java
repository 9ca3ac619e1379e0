package github.insight.config;

import github.insight.domain.service.aggregation.AggregationEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** 순수 도메인 서비스(module-core)를 스프링 빈으로 등록 */
@Configuration
public class AggregationConfig {

  @Bean
  public AggregationEngine aggregationEngine() {
    return new AggregationEngine();
  }
}
