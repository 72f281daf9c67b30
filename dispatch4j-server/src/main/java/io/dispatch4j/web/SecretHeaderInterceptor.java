package io.dispatch4j.web;

import io.dispatch4j.CallbackSender;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Objects;

/**
 * Rejects requests whose {@code Scheduler-Secret} header does not match the configured secret.
 * The handler is never invoked and the body never read for a rejected request.
 */
public class SecretHeaderInterceptor implements HandlerInterceptor {
    private static final Logger log = LoggerFactory.getLogger(SecretHeaderInterceptor.class);

    private final byte[] secret;

    public SecretHeaderInterceptor(String secret) {
        Objects.requireNonNull(secret, "secret must not be null");
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws Exception {
        String provided = request.getHeader(CallbackSender.SECRET_HEADER);
        if (provided != null && MessageDigest.isEqual(secret, provided.getBytes(StandardCharsets.UTF_8))) {
            return true;
        }
        log.warn("Rejected {} {} from {}: bad secret.", request.getMethod(), request.getRequestURI(), request.getRemoteAddr());
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.TEXT_PLAIN_VALUE);
        response.getWriter().write(HttpStatus.UNAUTHORIZED.getReasonPhrase());
        return false;
    }
}
