package com.phillippitts.talkback.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.matches;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private static final String UUID_PATTERN = "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";

    private MdcFilter filter;
    private HttpServletRequest request;
    private HttpServletResponse response;
    private FilterChain chain;
    private final Map<String, String> seen = new HashMap<>();

    @BeforeEach
    void setUp() throws ServletException, IOException {
        filter = new MdcFilter();
        request = mock(HttpServletRequest.class);
        response = mock(HttpServletResponse.class);
        chain = mock(FilterChain.class);
        ThreadContext.clearAll();
        doAnswer(invocation -> {
            seen.putAll(ThreadContext.getContext());
            return null;
        }).when(chain).doFilter(any(), any());
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void putsRequestValuesIntoContextDuringChain() throws ServletException, IOException {
        givenRequest("req-xyz", "session-abc", "DELETE", "/api/turns/123");

        filter.doFilter(request, response, chain);

        assertThat(seen)
                .containsEntry("requestId", "req-xyz")
                .containsEntry("sessionId", "session-abc")
                .containsEntry("method", "DELETE")
                .containsEntry("uri", "/api/turns/123")
                .containsEntry("turnId", "123");
        verify(chain).doFilter(request, response);
    }

    @Test
    void echoesRequestIdInResponseHeader() throws ServletException, IOException {
        givenRequest("req-123", null, "GET", "/api/turns");

        filter.doFilter(request, response, chain);

        verify(response).setHeader(MdcFilter.REQUEST_ID_HEADER, "req-123");
    }

    @Test
    void generatesRequestIdWhenHeaderMissingOrBlank() throws ServletException, IOException {
        givenRequest("   ", null, "POST", "/api/turns/stop-all");

        filter.doFilter(request, response, chain);

        assertThat(seen.get("requestId")).matches(UUID_PATTERN);
        verify(response).setHeader(eq(MdcFilter.REQUEST_ID_HEADER), matches(UUID_PATTERN));
    }

    @Test
    void skipsBlankSessionId() throws ServletException, IOException {
        givenRequest("req-123", "  ", "GET", "/api/turns");

        filter.doFilter(request, response, chain);

        assertThat(seen).doesNotContainKey("sessionId");
    }

    @Test
    void tagsOnlyPathsThatNameATurn() throws ServletException, IOException {
        givenRequest("req-123", null, "GET", "/api/turns");

        filter.doFilter(request, response, chain);

        assertThat(seen).doesNotContainKey("turnId");
    }

    @Test
    void clearsContextAfterRequest() throws ServletException, IOException {
        givenRequest("req-123", "session-456", "GET", "/api/turns");

        filter.doFilter(request, response, chain);

        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void clearsContextEvenWhenChainThrows() throws ServletException, IOException {
        givenRequest("req-123", "session-456", "POST", "/api/turns/stop-all");
        doThrow(new ServletException("Test exception")).when(chain).doFilter(request, response);

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class)
                .hasMessage("Test exception");

        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void passesNonHttpRequestThroughUntouched() throws ServletException, IOException {
        ServletRequest plain = mock(ServletRequest.class);

        filter.doFilter(plain, response, chain);

        verify(chain).doFilter(plain, response);
        assertThat(seen).isEmpty();
    }

    @Test
    void doesNotLeakBetweenRequests() throws ServletException, IOException {
        givenRequest("req-1", "session-1", "GET", "/api/turns");
        filter.doFilter(request, response, chain);
        seen.clear();

        givenRequest("req-2", null, "POST", "/api/turns/stop-all");
        filter.doFilter(request, response, chain);

        assertThat(seen)
                .containsEntry("requestId", "req-2")
                .containsEntry("uri", "/api/turns/stop-all")
                .doesNotContainKey("sessionId")
                .doesNotContainKey("turnId");
    }

    private void givenRequest(String requestId, String sessionId, String method, String uri) {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn(requestId);
        when(request.getHeader(MdcFilter.SESSION_ID_HEADER)).thenReturn(sessionId);
        when(request.getMethod()).thenReturn(method);
        when(request.getRequestURI()).thenReturn(uri);
    }
}
