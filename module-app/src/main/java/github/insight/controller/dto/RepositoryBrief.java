package github.insight.controller.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import github.insight.domain.model.repository.RepositoryRecord;
import java.time.Instant;

/** 요약 응답에 들어가는 저장소 한 줄 정보 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RepositoryBrief(
    String name,
    String fullName,
    String description,
    String language,
    long stars,
    long forks,
    Instant updatedAt) {

  public static RepositoryBrief from(RepositoryRecord record) {
    return new RepositoryBrief(
        record.name(),
        record.fullName(),
        record.description(),
        record.language(),
        record.stars(),
        record.forks(),
        record.updatedAt());
  }
}
