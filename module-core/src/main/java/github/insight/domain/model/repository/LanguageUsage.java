package github.insight.domain.model.repository;

/**
 * 사용자 단위 언어 사용량
 *
 * <p>바이트가 아닌 저장소 수 기준입니다.
 */
public record LanguageUsage(String name, long repositoryCount, long totalStars) {}
