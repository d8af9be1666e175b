package de.jwiegmann.chunkupload.boundary.admission;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.jwiegmann.chunkupload.boundary.dto.ApiResponse;
import de.jwiegmann.chunkupload.boundary.dto.error.UploadError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.HandlerInterceptor;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Fragt vor jedem API-Request die {@link AdmissionControl}, Schlüssel ist die Client-Adresse.
 */
@Slf4j
public class AdmissionControlInterceptor implements HandlerInterceptor {

    private final AdmissionControl admissionControl;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AdmissionControlInterceptor(AdmissionControl admissionControl, ObjectMapper objectMapper, Clock clock) {
        this.admissionControl = admissionControl;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        String key = request.getRemoteAddr();
        if (admissionControl.allow(key)) {
            return true;
        }

        log.warn("Request from {} rejected: too many requests", key);
        Optional<Duration> retryAfter = admissionControl.retryAfter(key);
        retryAfter.ifPresent(d ->
                response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(1, d.toSeconds()))));

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        UploadError error = UploadError.of("TOO_MANY_REQUESTS",
                "Too many requests, please try again later", null, LocalDateTime.now(clock));
        objectMapper.writeValue(response.getOutputStream(), ApiResponse.failed(error));
        return false;
    }
}
