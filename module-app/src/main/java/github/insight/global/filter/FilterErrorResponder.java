package github.insight.global.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import github.insight.error.dto.ErrorResponse;
import github.insight.error.exception.base.BaseException;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;

/** 필터 단계에서 컨트롤러와 같은 형식의 {@link ErrorResponse}를 직접 씁니다. */
@RequiredArgsConstructor
public class FilterErrorResponder {

  private final ObjectMapper objectMapper;

  public void write(HttpServletResponse response, BaseException e) throws IOException {
    ErrorResponse body = ErrorResponse.from(e);
    response.setStatus(body.status());
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getWriter(), body);
  }
}
