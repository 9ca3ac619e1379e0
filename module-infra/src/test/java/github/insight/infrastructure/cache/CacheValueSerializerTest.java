package github.insight.infrastructure.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import github.insight.error.exception.CacheSerializationException;
import github.insight.support.TestLogicExecutors;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class CacheValueSerializerTest {

  private final CacheValueSerializer serializer =
      new CacheValueSerializer(
          CacheValueSerializer.defaultObjectMapper(), TestLogicExecutors.real());

  @Test
  @DisplayName("시각은 ISO-8601 문자열로 기록한다")
  void writes_iso_timestamps() {
    String json =
        serializer.serialize("k", Map.of("updated_at", Instant.parse("2024-03-01T12:00:00Z")));

    assertThat(json).isEqualTo("{\"updated_at\":\"2024-03-01T12:00:00Z\"}");
  }

  @Test
  @DisplayName("깨진 JSON은 CacheSerializationException")
  void malformed_payload_fails_with_cache_exception() {
    assertThatThrownBy(
            () -> serializer.deserialize("k", "{not json", serializer.typeOf(Map.class)))
        .isInstanceOf(CacheSerializationException.class)
        .hasMessageContaining("k");
  }

  @Test
  @DisplayName("트리가 아닌 원본 값은 이미 요청 타입이면 같은 인스턴스를 돌려준다")
  void convert_returns_same_instance() {
    Map<String, Object> value = Map.of("a", 1);

    Object converted = serializer.convert("k", value, serializer.typeOf(Map.class));

    assertThat(converted).isSameAs(value);
  }

  @Test
  @DisplayName("스냅샷 트리는 조회할 때마다 새 객체로 읽힌다")
  void snapshot_converts_to_fresh_instances() {
    Map<String, Object> original = new HashMap<>(Map.of("a", 1));
    JsonNode tree = serializer.snapshot("k", original);
    original.put("a", 2);

    Map<String, Object> first = serializer.convert("k", tree, serializer.typeOf(Map.class));
    Map<String, Object> second = serializer.convert("k", tree, serializer.typeOf(Map.class));

    assertThat(first).containsEntry("a", 1).isNotSameAs(second);
  }

  @Test
  @DisplayName("JsonNode 요청에는 깊은 사본을 돌려준다")
  void json_node_request_gets_deep_copy() {
    JsonNode tree = serializer.snapshot("k", Map.of("a", 1));

    JsonNode converted = serializer.convert("k", tree, serializer.typeOf(JsonNode.class));

    assertThat(converted).isEqualTo(tree).isNotSameAs(tree);
  }
}
