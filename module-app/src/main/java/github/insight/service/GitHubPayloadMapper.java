package github.insight.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.insight.infrastructure.executor.LogicExecutor;
import github.insight.infrastructure.executor.TaskContext;
import github.insight.infrastructure.executor.strategy.ExceptionTranslator;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * GitHub JSON → DTO 매핑
 *
 * <p>예상과 다른 구조는 {@code GitHubDataProcessingException}(S004)으로 변환됩니다.
 */
@Component
@RequiredArgsConstructor
public class GitHubPayloadMapper {

  private static final TypeReference<Map<String, Long>> BYTE_MAP = new TypeReference<>() {};
  private static final ExceptionTranslator PAYLOAD_TRANSLATOR =
      ExceptionTranslator.forGitHubPayload();

  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;

  public <T> T toObject(JsonNode node, Class<T> type) {
    return executor.executeWithTranslation(
        () -> objectMapper.treeToValue(node, type),
        PAYLOAD_TRANSLATOR,
        TaskContext.of("GitHubPayload", "toObject", type.getSimpleName()));
  }

  public <T> List<T> toList(JsonNode node, Class<T> elementType) {
    JavaType listType =
        objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
    return executor.executeWithTranslation(
        () -> objectMapper.treeToValue(node, listType),
        PAYLOAD_TRANSLATOR,
        TaskContext.of("GitHubPayload", "toList", elementType.getSimpleName()));
  }

  /** 검색 API 응답의 {@code items} 배열. 없으면 빈 목록입니다. */
  public <T> List<T> searchItems(JsonNode node, Class<T> elementType) {
    JsonNode items = node.path("items");
    if (items.isMissingNode() || items.isNull()) {
      return List.of();
    }
    return toList(items, elementType);
  }

  /** 언어 → 바이트 수 맵. 응답 순서를 유지합니다. */
  public Map<String, Long> toByteMap(JsonNode node) {
    return executor.executeWithTranslation(
        () -> objectMapper.readerFor(BYTE_MAP).readValue(node),
        PAYLOAD_TRANSLATOR,
        TaskContext.of("GitHubPayload", "toByteMap"));
  }
}
