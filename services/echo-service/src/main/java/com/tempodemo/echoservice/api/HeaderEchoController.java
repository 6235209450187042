package com.tempodemo.echoservice.api;

import com.tempodemo.echoservice.domain.HeaderDump;
import com.tempodemo.echoservice.domain.ResponseDelay;
import com.tempodemo.observability.SensitiveDataRedactor;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * {@code GET /test}: writes back every request header, then pauses for a random delay.
 *
 * <p>The body is flushed before the pause, so clients see the headers immediately and the request
 * span covers the whole delay.
 */
@RestController
public class HeaderEchoController {

    private static final Logger log = LoggerFactory.getLogger(HeaderEchoController.class);

    private final ResponseDelay delay;
    private final SensitiveDataRedactor redactor;

    public HeaderEchoController(ResponseDelay delay, SensitiveDataRedactor redactor) {
        this.delay = delay;
        this.redactor = redactor;
    }

    @GetMapping("/test")
    public void echo(HttpServletRequest request, HttpServletResponse response)
            throws IOException {
        Map<String, List<String>> headers = headersOf(request);
        if (log.isDebugEnabled()) {
            log.debug("Echoing headers {}", redactor.redact(headers));
        }

        response.setContentType(MediaType.TEXT_PLAIN_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(HeaderDump.render(headers));
        response.flushBuffer();

        try {
            Duration paused = delay.pause();
            log.debug("Paused {} ms after response", paused.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Pause interrupted, response already sent");
        }
    }

    private static Map<String, List<String>> headersOf(HttpServletRequest request) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, Collections.list(request.getHeaders(name)));
        }
        return headers;
    }
}
