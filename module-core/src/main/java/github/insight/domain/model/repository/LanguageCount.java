package github.insight.domain.model.repository;

/** 언어 리더보드 항목. {@code count}는 기준에 따라 저장소 수 또는 스타 합계입니다. */
public record LanguageCount(String language, long count) {}
