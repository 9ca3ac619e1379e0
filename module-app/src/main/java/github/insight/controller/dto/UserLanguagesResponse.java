package github.insight.controller.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import github.insight.domain.model.repository.LanguageUsage;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * GET /users/{username}/languages
 *
 * <p>바이트가 아닌 저장소 수 기준 사용량입니다. 맵은 언어가 처음 등장한 순서입니다.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserLanguagesResponse(
    String username, Map<String, Usage> languages, int totalLanguages) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Usage(String name, long repositoryCount, long totalStars) {}

  public static UserLanguagesResponse of(String username, List<LanguageUsage> usages) {
    Map<String, Usage> languages = new LinkedHashMap<>();
    usages.forEach(
        usage ->
            languages.put(
                usage.name(),
                new Usage(usage.name(), usage.repositoryCount(), usage.totalStars())));
    return new UserLanguagesResponse(username, languages, languages.size());
  }
}
