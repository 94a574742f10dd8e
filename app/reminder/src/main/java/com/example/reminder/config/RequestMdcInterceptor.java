/*
 * どこで: reminder Web 設定
 * 何を: API リクエストの間 request_id・method・path を MDC に設定する
 */
package com.example.reminder.config;

import com.example.common.logging.MdcScope;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.UUID;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  private static final String ATTRIBUTE_SCOPE = RequestMdcInterceptor.class.getName() + ".SCOPE";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final MdcScope scope =
        MdcScope.open()
            .put("request_id", resolveRequestId(request))
            .put("http_method", request.getMethod())
            .put("http_path", request.getRequestURI());
    request.setAttribute(ATTRIBUTE_SCOPE, scope);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(ATTRIBUTE_SCOPE) instanceof MdcScope scope) {
      scope.close();
      request.removeAttribute(ATTRIBUTE_SCOPE);
    }
  }

  private String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader("X-Request-Id");
    if (requestId != null && !requestId.isBlank()) {
      return requestId;
    }
    return UUID.randomUUID().toString();
  }
}
