package github.insight.infrastructure.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/** 시계(Ticker)를 직접 움직여 만료를 검증한다. */
@Tag("unit")
class LocalCacheTierTest {

  private final AtomicLong nanos = new AtomicLong();
  private LocalCacheTier tier;

  @BeforeEach
  void setUp() {
    tier = new LocalCacheTier(3, nanos::get);
  }

  private void advance(Duration duration) {
    nanos.addAndGet(duration.toNanos());
  }

  @Test
  @DisplayName("TTL이 지나면 조회되지 않는다")
  void entry_expires_after_ttl() {
    tier.put("k", "v", Duration.ofSeconds(10));

    advance(Duration.ofSeconds(9));
    assertThat(tier.get("k")).contains("v");

    advance(Duration.ofSeconds(1));
    assertThat(tier.get("k")).isEmpty();
  }

  @Test
  @DisplayName("덮어쓰면 새 TTL이 적용된다")
  void overwrite_resets_ttl() {
    tier.put("k", "v1", Duration.ofSeconds(10));
    advance(Duration.ofSeconds(8));
    tier.put("k", "v2", Duration.ofSeconds(10));
    advance(Duration.ofSeconds(8));

    assertThat(tier.get("k")).contains("v2");
  }

  @Test
  @DisplayName("용량을 넘겨도 쓰기는 성공하고 크기는 용량 이하로 유지된다")
  void capacity_bound_is_enforced() {
    for (int i = 0; i < 10; i++) {
      tier.put("k" + i, i, Duration.ofMinutes(1));
    }

    assertThat(tier.size()).isLessThanOrEqualTo(3);
    assertThat(tier.capacity()).isEqualTo(3);
  }

  @Test
  @DisplayName("remove는 실제로 지웠을 때만 true")
  void remove_reports_presence() {
    tier.put("k", "v", Duration.ofMinutes(1));

    assertThat(tier.remove("k")).isTrue();
    assertThat(tier.remove("k")).isFalse();
  }

  @Test
  @DisplayName("clear 후 크기는 0")
  void clear_empties_tier() {
    tier.put("a", 1, Duration.ofMinutes(1));
    tier.put("b", 2, Duration.ofMinutes(1));

    tier.clear();

    assertThat(tier.size()).isZero();
    assertThat(tier.get("a")).isEmpty();
  }

  @Test
  @DisplayName("적중/미스 수를 기록한다")
  void records_hit_and_miss() {
    tier.put("k", "v", Duration.ofMinutes(1));

    tier.get("k");
    tier.get("missing");

    assertThat(tier.hitCount()).isEqualTo(1);
    assertThat(tier.missCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("용량은 양수여야 한다")
  void rejects_non_positive_capacity() {
    assertThatThrownBy(() -> new LocalCacheTier(0)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("나노초로 표현할 수 없는 TTL은 최댓값으로 고정하고 저장한다")
  void very_long_ttl_saturates() {
    tier.put("k", "v", Duration.ofDays(365L * 1000));

    advance(Duration.ofDays(365L * 100));
    assertThat(tier.get("k")).contains("v");
    assertThat(LocalCacheTier.saturatedNanos(ChronoUnit.FOREVER.getDuration()))
        .isEqualTo(Long.MAX_VALUE);
    assertThat(LocalCacheTier.saturatedNanos(Duration.ofSeconds(1))).isEqualTo(1_000_000_000L);
  }
}
