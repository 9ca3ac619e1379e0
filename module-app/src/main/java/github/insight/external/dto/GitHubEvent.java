package github.insight.external.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** 저장소 이벤트. {@code payload}는 이벤트 유형마다 구조가 달라 원본 JSON으로 유지합니다. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GitHubEvent(
    String id,
    String type,
    GitHubUser actor,
    JsonNode repo,
    JsonNode payload,
    @JsonProperty("public") Boolean publicEvent,
    Instant createdAt) {}
