package github.insight.controller.dto;

/** DELETE /cache/clear */
public record CacheClearResponse(boolean success, String message) {

  public static CacheClearResponse of(boolean success) {
    return new CacheClearResponse(
        success, success ? "캐시를 비웠습니다." : "캐시 비우기에 실패했습니다. 원격 캐시 상태를 확인하세요.");
  }
}
