package github.insight.config;

import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.DefaultUriBuilderFactory;
import reactor.netty.http.client.HttpClient;

@Configuration
@EnableConfigurationProperties(GitHubApiProperties.class)
@RequiredArgsConstructor
public class GitHubApiConfig {

  static final String GITHUB_V3_JSON = "application/vnd.github.v3+json";

  private final GitHubApiProperties properties;

  @Bean
  public WebClient gitHubWebClient(WebClient.Builder builder) {
    DefaultUriBuilderFactory factory = new DefaultUriBuilderFactory(properties.getBaseUrl());
    factory.setEncodingMode(DefaultUriBuilderFactory.EncodingMode.VALUES_ONLY);

    HttpClient httpClient =
        HttpClient.create()
            .option(
                ChannelOption.CONNECT_TIMEOUT_MILLIS,
                (int) properties.getConnectTimeout().toMillis())
            .responseTimeout(properties.getResponseTimeout())
            .compress(true);

    return builder
        .uriBuilderFactory(factory)
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .defaultHeaders(this::applyDefaultHeaders)
        .build();
  }

  void applyDefaultHeaders(HttpHeaders headers) {
    headers.set(HttpHeaders.ACCEPT, GITHUB_V3_JSON);
    headers.set(HttpHeaders.USER_AGENT, properties.getUserAgent());
    if (properties.hasToken()) {
      headers.set(HttpHeaders.AUTHORIZATION, "token " + properties.getToken());
    }
  }
}
