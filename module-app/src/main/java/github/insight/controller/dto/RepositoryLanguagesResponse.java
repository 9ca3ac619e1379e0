package github.insight.controller.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import github.insight.domain.model.repository.LanguageShare;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** GET /repos/{owner}/{repo}/languages. 맵은 GitHub 응답 순서(바이트 내림차순)를 유지합니다. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RepositoryLanguagesResponse(
    String repository, Map<String, LanguageShare> languages, int totalLanguages) {

  public static RepositoryLanguagesResponse of(String repository, List<LanguageShare> shares) {
    Map<String, LanguageShare> languages = new LinkedHashMap<>();
    shares.forEach(share -> languages.put(share.name(), share));
    return new RepositoryLanguagesResponse(repository, languages, languages.size());
  }
}
