package github.insight.domain.model.repository;

import java.time.Instant;

/**
 * 집계 대상 저장소 (Value Object)
 *
 * <p>순수 도메인 모델 - 직렬화/프레임워크 의존 없음. {@code language}와 {@code updatedAt}은 비어 있을 수 있습니다.
 */
public record RepositoryRecord(
    String name,
    String fullName,
    String description,
    String language,
    long stars,
    long forks,
    long watchers,
    long openIssues,
    long size,
    boolean privateRepository,
    boolean fork,
    Instant updatedAt) {

  public boolean hasLanguage() {
    return language != null && !language.isBlank();
  }
}
