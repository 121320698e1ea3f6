package com.millennicare.identity.utils;

import com.millennicare.identity.model.ApiResponse;
import org.springframework.core.MethodParameter;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps successful JSON bodies in {@link ApiResponse}:
 * <pre>
 * { "timestamp": "...Z", "requestId": "...", "message": "OK", "data": {...} }
 * </pre>
 * Problem documents, non-2xx statuses, already-wrapped bodies, binary bodies
 * and non-JSON media types pass through untouched.
 */
@RestControllerAdvice(basePackages = "com.millennicare.identity.controller")
public class SuccessEnvelopeAdvice implements ResponseBodyAdvice<Object> {

    @Override
    public boolean supports(@NonNull MethodParameter returnType,
                            @NonNull Class<? extends HttpMessageConverter<?>> converterType) {
        return MappingJackson2HttpMessageConverter.class.isAssignableFrom(converterType);
    }

    @Override
    public Object beforeBodyWrite(@Nullable Object body,
                                  @NonNull MethodParameter returnType,
                                  @NonNull MediaType selectedContentType,
                                  @NonNull Class<? extends HttpMessageConverter<?>> selectedConverterType,
                                  @NonNull ServerHttpRequest request,
                                  @NonNull ServerHttpResponse response) {

        if (body instanceof ProblemDetail) return body;
        if (!isJsonLike(selectedContentType)) return body;
        if (shouldSkip(body)) return body;

        if (response instanceof ServletServerHttpResponse sResp) {
            HttpStatus status = HttpStatus.resolve(sResp.getServletResponse().getStatus());
            if (status != null && !status.is2xxSuccessful()) return body;
        }

        return ApiResponse.of(requestId(request, response), resolveMessage(returnType), body);
    }

    private boolean shouldSkip(@Nullable Object body) {
        return body == null
                || body instanceof ApiResponse<?>
                || body instanceof byte[]
                || body instanceof Resource;
    }

    private boolean isJsonLike(@NonNull MediaType mt) {
        if (MediaType.APPLICATION_PROBLEM_JSON.includes(mt)) return false;
        return MediaType.APPLICATION_JSON.includes(mt) || mt.getSubtype().endsWith("+json");
    }

    private String resolveMessage(@NonNull MethodParameter returnType) {
        ResponseMessage ann = returnType.getMethodAnnotation(ResponseMessage.class);
        if (ann == null) {
            ann = returnType.getContainingClass().getAnnotation(ResponseMessage.class);
        }
        return (ann != null && StringUtils.hasText(ann.value())) ? ann.value() : "OK";
    }

    private String requestId(@NonNull ServerHttpRequest req, @NonNull ServerHttpResponse resp) {
        String id = resp.getHeaders().getFirst(RequestIdFilter.REQUEST_ID_HEADER);
        if (!StringUtils.hasText(id)) {
            id = req.getHeaders().getFirst(RequestIdFilter.REQUEST_ID_HEADER);
        }
        if (!StringUtils.hasText(id) && req instanceof ServletServerHttpRequest sreq) {
            Object attr = sreq.getServletRequest().getAttribute(RequestIdFilter.REQUEST_ID_ATTR);
            if (attr instanceof String s && StringUtils.hasText(s)) id = s;
        }
        return id;
    }
}
