package github.insight.infrastructure.cache.remote;

/**
 * 원격 계층 서버 정보 스냅샷
 *
 * @param connected 조회 성공 여부
 * @param usedMemory 사람이 읽을 수 있는 메모리 사용량 (예: "1.02M")
 * @param keyspaceHits 서버 누적 키 적중 수
 * @param keyspaceMisses 서버 누적 키 미스 수
 */
public record RemoteCacheInfo(
    boolean connected, String usedMemory, Long keyspaceHits, Long keyspaceMisses) {

  private static final RemoteCacheInfo UNAVAILABLE = new RemoteCacheInfo(false, null, null, null);

  public static RemoteCacheInfo unavailable() {
    return UNAVAILABLE;
  }
}
