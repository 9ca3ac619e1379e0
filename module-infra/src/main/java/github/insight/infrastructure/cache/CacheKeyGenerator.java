package github.insight.infrastructure.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 결정론적 캐시 키 생성기
 *
 * <h4>형식</h4>
 *
 * <pre>
 * SHA-256( namespace | positional... | name:value... )  → 64자 소문자 hex
 * </pre>
 *
 * <ul>
 *   <li>이름 있는 인자는 이름 순으로 정렬하므로 전달 순서와 무관하다.
 *   <li>값은 {@link String#valueOf(Object)}로 문자열화한다. {@code null}은 "null".
 *   <li>결과 키는 불투명 값이다. 호출자는 구조를 해석하지 않는다.
 * </ul>
 */
public final class CacheKeyGenerator {

  private static final String DELIMITER = "|";
  private static final HexFormat HEX = HexFormat.of();

  public String derive(String namespace, List<?> positional, Map<String, ?> named) {
    List<String> parts = new ArrayList<>();
    parts.add(String.valueOf(namespace));
    if (positional != null) {
      positional.forEach(arg -> parts.add(String.valueOf(arg)));
    }
    if (named != null) {
      new TreeMap<String, Object>(named).forEach((name, value) -> parts.add(name + ":" + value));
    }
    return sha256Hex(String.join(DELIMITER, parts));
  }

  public String derive(String namespace, Object... positional) {
    return derive(namespace, positional == null ? List.of() : Arrays.asList(positional), Map.of());
  }

  private static String sha256Hex(String raw) {
    return HEX.formatHex(sha256().digest(raw.getBytes(StandardCharsets.UTF_8)));
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      // 모든 JVM 구현체에 SHA-256 필수 포함
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
