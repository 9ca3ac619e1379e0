package github.insight.infrastructure.cache;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * 캐시 상태 스냅샷 (요청마다 새로 계산)
 *
 * <p>원격 계층 정보를 가져오지 못하면 {@code remoteConnected=false}이고 원격 수치는 {@code null}이다.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CacheStats(
    long localSize,
    long localCapacity,
    long localHitCount,
    long localMissCount,
    boolean remoteEnabled,
    boolean remoteConnected,
    String remoteUsedMemory,
    Long remoteKeyspaceHits,
    Long remoteKeyspaceMisses) {}
