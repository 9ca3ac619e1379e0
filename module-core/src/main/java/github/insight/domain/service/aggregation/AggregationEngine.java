package github.insight.domain.service.aggregation;

import github.insight.domain.model.repository.LanguageCount;
import github.insight.domain.model.repository.LanguageShare;
import github.insight.domain.model.repository.LanguageSummary;
import github.insight.domain.model.repository.LanguageUsage;
import github.insight.domain.model.repository.RepositoryRecord;
import github.insight.domain.model.repository.RepositorySummary;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 저장소 컬렉션 집계 엔진 (순수 함수, I/O 없음)
 *
 * <h3>공통 규약</h3>
 *
 * <ul>
 *   <li>결정론적이며 부수효과가 없다. 같은 입력이면 항상 같은 출력을 낸다.
 *   <li>{@code null} 컬렉션은 빈 컬렉션으로, {@code null} 원소는 없는 것으로 취급한다.
 *   <li>정렬은 모두 안정 정렬이다. 동률이면 입력 순서를 유지한다.
 *   <li>비율은 {@link RoundingMode#HALF_UP}으로 소수 둘째 자리까지 반올림한다.
 * </ul>
 *
 * <p>상태가 없으므로 여러 스레드에서 하나의 인스턴스를 공유해도 된다.
 */
public class AggregationEngine {

  /** 요약/리더보드에 노출하는 상위 항목 수 */
  public static final int TOP_SIZE = 5;

  private static final int PERCENT_SCALE = 2;
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private static final Comparator<RepositoryRecord> BY_STARS_DESC =
      Comparator.comparingLong(RepositoryRecord::stars).reversed();

  // nullsFirst 후 reversed: 타임스탬프가 없는 레코드는 항상 마지막
  private static final Comparator<RepositoryRecord> BY_UPDATED_DESC =
      Comparator.comparing(
              RepositoryRecord::updatedAt,
              Comparator.<Instant>nullsFirst(Comparator.naturalOrder()))
          .reversed();

  /**
   * 저장소 집합 요약
   *
   * <p>빈 입력은 모든 수치가 0이고 목록이 빈 요약을 반환한다.
   */
  public RepositorySummary summarize(Collection<RepositoryRecord> repositories) {
    List<RepositoryRecord> repos = sanitize(repositories);
    long total = repos.size();

    long privateCount = 0;
    long forkCount = 0;
    long stars = 0;
    long forks = 0;
    long watchers = 0;
    long size = 0;
    long openIssues = 0;
    for (RepositoryRecord repo : repos) {
      if (repo.privateRepository()) privateCount++;
      if (repo.fork()) forkCount++;
      stars += repo.stars();
      forks += repo.forks();
      watchers += repo.watchers();
      size += repo.size();
      openIssues += repo.openIssues();
    }
    long publicCount = total - privateCount;

    return new RepositorySummary(
        total,
        publicCount,
        privateCount,
        percentage(publicCount, total),
        percentage(privateCount, total),
        forkCount,
        total - forkCount,
        stars,
        forks,
        watchers,
        size,
        openIssues,
        ratio(stars, total),
        histogramOf(repos),
        sortedHead(repos, BY_STARS_DESC, TOP_SIZE),
        sortedHead(repos, BY_UPDATED_DESC, TOP_SIZE));
  }

  /**
   * 언어 히스토그램
   *
   * <p>언어가 없는 저장소는 버킷에 포함하지 않지만 분모(전체 저장소 수)에는 포함한다. 결과 맵은 처음 등장한 순서를 유지한다.
   */
  public Map<String, LanguageSummary> languageHistogram(Collection<RepositoryRecord> repositories) {
    return histogramOf(sanitize(repositories));
  }

  /** 스타 수 내림차순 상위 {@code n}개. {@code n}이 0 이하이면 빈 목록. */
  public List<RepositoryRecord> topByStars(Collection<RepositoryRecord> repositories, int n) {
    return sortedHead(sanitize(repositories), BY_STARS_DESC, n);
  }

  /** 최근 업데이트 순 상위 {@code n}개. 업데이트 시각이 없는 레코드는 가장 오래된 것으로 본다. */
  public List<RepositoryRecord> mostRecentlyUpdated(
      Collection<RepositoryRecord> repositories, int n) {
    return sortedHead(sanitize(repositories), BY_UPDATED_DESC, n);
  }

  /** 저장소 수 기준 언어 리더보드 */
  public List<LanguageCount> languageLeaderboard(Collection<RepositoryRecord> repositories) {
    return languageLeaderboard(repositories, true);
  }

  /**
   * 언어 리더보드 (상위 {@value #TOP_SIZE}개)
   *
   * @param byRepoCount {@code true}면 저장소 수, {@code false}면 해당 언어 저장소의 스타 합계로 순위를 매긴다
   * @return 내림차순 목록. 동률이면 처음 등장한 언어가 앞선다.
   */
  public List<LanguageCount> languageLeaderboard(
      Collection<RepositoryRecord> repositories, boolean byRepoCount) {
    Map<String, Long> counts = new LinkedHashMap<>();
    for (RepositoryRecord repo : sanitize(repositories)) {
      if (!repo.hasLanguage()) continue;
      counts.merge(repo.language(), byRepoCount ? 1L : repo.stars(), Long::sum);
    }

    List<LanguageCount> entries = new ArrayList<>(counts.size());
    counts.forEach((language, count) -> entries.add(new LanguageCount(language, count)));
    return sortedHead(
        entries, Comparator.comparingLong(LanguageCount::count).reversed(), TOP_SIZE);
  }

  /**
   * 사용자 언어 사용량
   *
   * <p>바이트가 아닌 저장소 수 기준으로 집계한다. 순서는 처음 등장한 순서.
   */
  public List<LanguageUsage> languageUsage(Collection<RepositoryRecord> repositories) {
    Map<String, long[]> stats = new LinkedHashMap<>();
    for (RepositoryRecord repo : sanitize(repositories)) {
      if (!repo.hasLanguage()) continue;
      long[] acc = stats.computeIfAbsent(repo.language(), k -> new long[2]);
      acc[0]++;
      acc[1] += repo.stars();
    }

    List<LanguageUsage> usages = new ArrayList<>(stats.size());
    stats.forEach((name, acc) -> usages.add(new LanguageUsage(name, acc[0], acc[1])));
    return Collections.unmodifiableList(usages);
  }

  /**
   * 단일 저장소의 언어별 바이트 비중
   *
   * <p>전체 바이트가 0이면 모든 비율은 0이다. {@code null} 바이트 값은 0으로 본다.
   */
  public List<LanguageShare> languageShares(Map<String, Long> bytesByLanguage) {
    if (bytesByLanguage == null || bytesByLanguage.isEmpty()) {
      return List.of();
    }

    long totalBytes = 0;
    for (Long bytes : bytesByLanguage.values()) {
      totalBytes += bytes == null ? 0L : bytes;
    }

    List<LanguageShare> shares = new ArrayList<>(bytesByLanguage.size());
    for (Map.Entry<String, Long> entry : bytesByLanguage.entrySet()) {
      if (entry.getKey() == null) continue;
      long bytes = entry.getValue() == null ? 0L : entry.getValue();
      shares.add(new LanguageShare(entry.getKey(), bytes, percentage(bytes, totalBytes)));
    }
    return Collections.unmodifiableList(shares);
  }

  private static Map<String, LanguageSummary> histogramOf(List<RepositoryRecord> repos) {
    Map<String, Long> counts = new LinkedHashMap<>();
    for (RepositoryRecord repo : repos) {
      if (repo.hasLanguage()) {
        counts.merge(repo.language(), 1L, Long::sum);
      }
    }

    long total = repos.size();
    Map<String, LanguageSummary> histogram = new LinkedHashMap<>();
    counts.forEach(
        (language, count) ->
            histogram.put(language, new LanguageSummary(language, count, percentage(count, total))));
    return Collections.unmodifiableMap(histogram);
  }

  private static <T> List<T> sortedHead(List<T> items, Comparator<? super T> order, int n) {
    if (n <= 0 || items.isEmpty()) {
      return List.of();
    }
    List<T> sorted = new ArrayList<>(items);
    sorted.sort(order); // List.sort는 안정 정렬
    return List.copyOf(sorted.subList(0, Math.min(n, sorted.size())));
  }

  private static List<RepositoryRecord> sanitize(Collection<RepositoryRecord> repositories) {
    if (repositories == null || repositories.isEmpty()) {
      return List.of();
    }
    List<RepositoryRecord> result = new ArrayList<>(repositories.size());
    for (RepositoryRecord repo : repositories) {
      if (repo != null) result.add(repo);
    }
    return result;
  }

  private static double percentage(long part, long total) {
    if (total <= 0) {
      return 0.0;
    }
    return BigDecimal.valueOf(part)
        .multiply(HUNDRED)
        .divide(BigDecimal.valueOf(total), PERCENT_SCALE, RoundingMode.HALF_UP)
        .doubleValue();
  }

  private static double ratio(long numerator, long denominator) {
    if (denominator <= 0) {
      return 0.0;
    }
    return BigDecimal.valueOf(numerator)
        .divide(BigDecimal.valueOf(denominator), PERCENT_SCALE, RoundingMode.HALF_UP)
        .doubleValue();
  }
}
