package com.example.reminder.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void propagatesRequestIdHeaderAndClearsOnCompletion() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("GET", "/v1/notifications/statistics");
    request.addHeader("X-Request-Id", "req-42");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());

    assertThat(MDC.get("request_id")).isEqualTo("req-42");
    assertThat(MDC.get("http_method")).isEqualTo("GET");
    assertThat(MDC.get("http_path")).isEqualTo("/v1/notifications/statistics");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("http_path")).isNull();
  }

  @Test
  void generatesRequestIdWhenHeaderIsMissing() {
    final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/v1/appointments/transitions");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("request_id")).isNotBlank();
  }
}
