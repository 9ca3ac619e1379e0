package github.insight.infrastructure.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class CacheKeyGeneratorTest {

  private final CacheKeyGenerator generator = new CacheKeyGenerator();

  @Test
  @DisplayName("같은 입력이면 같은 키를 만든다")
  void is_deterministic() {
    String first = generator.derive("user", List.of("octocat"), Map.of("page", 1));
    String second = generator.derive("user", List.of("octocat"), Map.of("page", 1));

    assertThat(first).isEqualTo(second);
  }

  @Test
  @DisplayName("이름 있는 인자의 전달 순서는 키에 영향을 주지 않는다")
  void named_argument_order_is_irrelevant() {
    Map<String, Object> ab = new LinkedHashMap<>();
    ab.put("a", 1);
    ab.put("b", 2);
    Map<String, Object> ba = new LinkedHashMap<>();
    ba.put("b", 2);
    ba.put("a", 1);

    assertThat(generator.derive("ns", List.of(), ab))
        .isEqualTo(generator.derive("ns", List.of(), ba));
  }

  @Test
  @DisplayName("네임스페이스, 위치 인자, 값이 다르면 다른 키")
  void different_inputs_yield_different_keys() {
    String base = generator.derive("repos", "octocat", 1);

    assertThat(generator.derive("user", "octocat", 1)).isNotEqualTo(base);
    assertThat(generator.derive("repos", "octocat", 2)).isNotEqualTo(base);
    assertThat(generator.derive("repos", 1, "octocat")).isNotEqualTo(base);
  }

  @Test
  @DisplayName("키는 64자 소문자 hex (SHA-256)")
  void key_is_sha256_hex() {
    assertThat(generator.derive("ns", "x"))
        .hasSize(64)
        .matches("[0-9a-f]{64}")
        .isEqualTo(generator.derive("ns", List.of("x"), null));
  }

  @Test
  @DisplayName("null 인자도 키를 만들 수 있다")
  void null_arguments_are_allowed() {
    assertThat(generator.derive("ns", (Object) null)).hasSize(64);
  }
}
