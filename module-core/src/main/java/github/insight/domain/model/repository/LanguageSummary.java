package github.insight.domain.model.repository;

/**
 * 언어별 저장소 분포
 *
 * @param name 언어 이름
 * @param count 해당 언어를 가진 저장소 수
 * @param percentage 전체 저장소 대비 비율 (소수 둘째 자리 반올림). 언어가 없는 저장소도 분모에 포함되므로 합계가 100이 아닐 수 있다.
 */
public record LanguageSummary(String name, long count, double percentage) {}
