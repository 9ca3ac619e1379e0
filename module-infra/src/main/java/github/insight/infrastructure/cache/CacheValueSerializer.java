package github.insight.infrastructure.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import github.insight.infrastructure.executor.LogicExecutor;
import github.insight.infrastructure.executor.TaskContext;
import github.insight.infrastructure.executor.strategy.ExceptionTranslator;
import lombok.RequiredArgsConstructor;

/**
 * 캐시 값 JSON 직렬화기
 *
 * <p>원격 계층의 와이어 포맷은 JSON 텍스트이며 시각은 ISO-8601 문자열로 기록합니다. 실패는 {@code
 * CacheSerializationException}으로 전파되고, 호출 측(CacheStore)이 복구합니다.
 */
@RequiredArgsConstructor
public class CacheValueSerializer {

  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;

  public static ObjectMapper defaultObjectMapper() {
    return JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();
  }

  public String serialize(String key, Object value) {
    return executor.executeWithTranslation(
        () -> objectMapper.writeValueAsString(value),
        ExceptionTranslator.forCacheSerialization(),
        TaskContext.of("CacheSerializer", "serialize", key));
  }

  public <T> T deserialize(String key, String payload, JavaType type) {
    return executor.executeWithTranslation(
        () -> objectMapper.readValue(payload, type),
        ExceptionTranslator.forCacheSerialization(),
        TaskContext.of("CacheSerializer", "deserialize", key));
  }

  /**
   * 로컬 계층에 넣을 JSON 트리 사본
   *
   * <p>저장 후 호출자가 원본을 바꿔도 캐시 값은 변하지 않는다. 원격 계층의 JSON 스냅샷과 같은 의미다.
   */
  public JsonNode snapshot(String key, Object value) {
    return executor.executeWithTranslation(
        () -> objectMapper.valueToTree(value),
        ExceptionTranslator.forCacheSerialization(),
        TaskContext.of("CacheSerializer", "snapshot", key));
  }

  /**
   * 로컬 계층에 보관된 값을 요청 타입으로 맞춘다.
   *
   * <p>JSON 트리는 조회마다 새 객체로 읽어낸다. 트리로 만들 수 없어 원본 그대로 보관된 값은 요청 타입의 인스턴스면 그대로
   * 돌려준다.
   */
  @SuppressWarnings("unchecked")
  public <T> T convert(String key, Object value, JavaType type) {
    if (value instanceof JsonNode node) {
      if (JsonNode.class.isAssignableFrom(type.getRawClass())) {
        return (T) node.deepCopy();
      }
      return executor.executeWithTranslation(
          () -> objectMapper.readerFor(type).readValue(node),
          ExceptionTranslator.forCacheSerialization(),
          TaskContext.of("CacheSerializer", "convert", key));
    }
    if (type.getRawClass().isInstance(value)) {
      return (T) value;
    }
    return executor.executeWithTranslation(
        () -> objectMapper.convertValue(value, type),
        ExceptionTranslator.forCacheSerialization(),
        TaskContext.of("CacheSerializer", "convert", key));
  }

  public JavaType typeOf(Class<?> type) {
    return objectMapper.getTypeFactory().constructType(type);
  }

  public JavaType typeOf(TypeReference<?> type) {
    return objectMapper.getTypeFactory().constructType(type);
  }
}
