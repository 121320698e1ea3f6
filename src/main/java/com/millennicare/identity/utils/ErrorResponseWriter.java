package com.millennicare.identity.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Writes RFC 7807 problem documents. Used by the exception handler and by the
 * security entry point / access-denied handler, which run outside the MVC pipeline.
 */
@Component
public class ErrorResponseWriter {

    private final ObjectMapper objectMapper;

    public ErrorResponseWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(@NonNull HttpServletRequest req,
                      @NonNull HttpServletResponse resp,
                      @NonNull HttpStatus status,
                      String type,
                      @NonNull String title,
                      @NonNull String detail) throws IOException {

        if (resp.isCommitted()) return;

        ProblemDetail pd = ProblemDetail.forStatus(status);
        if (type != null && !type.isBlank()) {
            pd.setType(URI.create(type));
        }
        pd.setTitle(title);
        pd.setDetail(detail);
        pd.setInstance(URI.create(req.getRequestURI()));

        pd.setProperty("timestamp", OffsetDateTime.now(ZoneOffset.UTC).toString());
        pd.setProperty("path", req.getRequestURI());
        pd.setProperty("requestId", resolveRequestId(req, resp));

        resp.setStatus(status.value());
        resp.setHeader("Cache-Control", "no-store");
        resp.setHeader("Pragma", "no-cache");
        resp.setCharacterEncoding("UTF-8");
        resp.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);

        objectMapper.writeValue(resp.getOutputStream(), pd);
    }

    private String resolveRequestId(HttpServletRequest req, HttpServletResponse resp) {
        String id = resp.getHeader(RequestIdFilter.REQUEST_ID_HEADER);
        if (id == null || id.isBlank()) {
            id = req.getHeader(RequestIdFilter.REQUEST_ID_HEADER);
        }
        if (id == null || id.isBlank()) {
            Object attr = req.getAttribute(RequestIdFilter.REQUEST_ID_ATTR);
            if (attr instanceof String s && !s.isBlank()) {
                id = s;
            }
        }
        return id;
    }
}
