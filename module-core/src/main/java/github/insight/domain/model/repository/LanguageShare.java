package github.insight.domain.model.repository;

/** 단일 저장소의 언어별 바이트 비중 */
public record LanguageShare(String name, long bytes, double percentage) {}
