package github.insight.global.filter;

import static org.assertj.core.api.Assertions.assertThat;

import github.insight.config.ApiKeyProperties;
import github.insight.support.GitHubFixtures;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@Tag("unit")
@DisplayName("ApiKeyAuthFilter")
class ApiKeyAuthFilterTest {

  private ApiKeyProperties properties;
  private ApiKeyAuthFilter filter;
  private MockHttpServletResponse response;
  private MockFilterChain chain;

  @BeforeEach
  void setUp() {
    properties = new ApiKeyProperties();
    properties.setValidKeys(List.of("secret-key-0001"));
    filter = new ApiKeyAuthFilter(properties, new FilterErrorResponder(GitHubFixtures.MAPPER));
    response = new MockHttpServletResponse();
    chain = new MockFilterChain();
  }

  @Test
  @DisplayName("비활성화 상태면 헤더 없이도 통과")
  void disabled() throws Exception {
    filter.doFilter(new MockHttpServletRequest("GET", "/api/v1/users/octocat"), response, chain);

    assertThat(chain.getRequest()).isNotNull();
    assertThat(response.getStatus()).isEqualTo(200);
  }

  @Nested
  @DisplayName("활성화 상태")
  class Enabled {

    @BeforeEach
    void enable() {
      properties.setEnabled(true);
    }

    @Test
    @DisplayName("헤더 누락 → 401 + C003")
    void missingKey() throws Exception {
      filter.doFilter(new MockHttpServletRequest("GET", "/api/v1/users/octocat"), response, chain);

      assertThat(response.getStatus()).isEqualTo(401);
      assertThat(response.getContentAsString()).contains("\"code\":\"C003\"");
      assertThat(chain.getRequest()).isNull();
    }

    @Test
    @DisplayName("목록에 없는 키 → 403 + C004")
    void unknownKey() throws Exception {
      MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/users/octocat");
      request.addHeader("X-API-Key", "wrong");

      filter.doFilter(request, response, chain);

      assertThat(response.getStatus()).isEqualTo(403);
      assertThat(response.getContentAsString()).contains("\"code\":\"C004\"");
    }

    @Test
    @DisplayName("유효한 키는 통과")
    void validKey() throws Exception {
      MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/users/octocat");
      request.addHeader("X-API-Key", "secret-key-0001");

      filter.doFilter(request, response, chain);

      assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    @DisplayName("health 경로는 인증 면제")
    void exemptPath() throws Exception {
      filter.doFilter(new MockHttpServletRequest("GET", "/api/v1/health"), response, chain);

      assertThat(chain.getRequest()).isNotNull();
    }
  }

  @Test
  @DisplayName("로그용 키 접두사는 8자")
  void prefix() {
    assertThat(ApiKeyAuthFilter.prefix("abcdefghijkl")).isEqualTo("abcdefgh");
    assertThat(ApiKeyAuthFilter.prefix("abc")).isEqualTo("abc");
  }
}
