package github.insight.global.filter;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;

/** 요청마다 Correlation ID를 MDC와 응답 헤더에 심습니다. */
public class MDCFilter implements Filter {

  public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
  public static final String REQUEST_ID_MDC_KEY = "requestId";

  @Override
  public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
      throws IOException, ServletException {

    HttpServletRequest httpRequest = (HttpServletRequest) request;
    HttpServletResponse httpResponse = (HttpServletResponse) response;

    // 게이트웨이가 전달한 ID가 있으면 이어 쓴다
    String correlationId = httpRequest.getHeader(CORRELATION_ID_HEADER);
    if (correlationId == null || correlationId.isBlank()) {
      correlationId = UUID.randomUUID().toString();
    }

    MDC.put(REQUEST_ID_MDC_KEY, correlationId);
    httpResponse.setHeader(CORRELATION_ID_HEADER, correlationId);

    try {
      chain.doFilter(request, response);
    } finally {
      // 스레드 풀 재사용 시 이전 요청 ID가 남지 않도록
      MDC.clear();
    }
  }
}
