package github.insight.infrastructure.config;

import github.insight.infrastructure.executor.policy.LoggingPolicy;
import github.insight.infrastructure.executor.strategy.ExceptionTranslator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ExecutorLoggingProperties.class)
public class ExecutorConfig {

  @Bean
  public LoggingPolicy loggingPolicy(ExecutorLoggingProperties properties) {
    return new LoggingPolicy(properties.getSlowMs());
  }

  @Bean
  public ExceptionTranslator defaultExceptionTranslator() {
    return ExceptionTranslator.defaultTranslator();
  }
}
