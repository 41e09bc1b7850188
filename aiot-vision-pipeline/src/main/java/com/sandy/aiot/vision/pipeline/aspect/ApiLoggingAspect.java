package com.sandy.aiot.vision.pipeline.aspect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Logs every pipeline REST call. Ingestion calls are frequent, so they log at debug level and
 * collections are logged by size only.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class ApiLoggingAspect {

    private static final int MAX_BODY_CHARS = 2000;

    private final ObjectMapper objectMapper;

    @Around("within(com.sandy.aiot.vision.pipeline.controller..*)")
    public Object logApiCall(ProceedingJoinPoint pjp) throws Throwable {
        long start = System.currentTimeMillis();
        ServletRequestAttributes attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        HttpServletRequest request = attrs != null ? attrs.getRequest() : null;
        String method = request != null ? request.getMethod() : "";
        String uri = request != null ? request.getRequestURI() : "";
        boolean ingestion = uri.contains("/readings");

        MethodSignature sig = (MethodSignature) pjp.getSignature();
        String handler = sig.toShortString();
        if (ingestion) {
            log.debug("API Request: method={} uri={} handler={} args={}", method, uri, handler, describeArgs(sig, pjp.getArgs()));
        } else {
            log.info("API Request: method={} uri={} handler={} args={}", method, uri, handler, describeArgs(sig, pjp.getArgs()));
        }

        Object result = null;
        Throwable error = null;
        try {
            result = pjp.proceed();
            return result;
        } catch (Throwable t) {
            error = t;
            throw t;
        } finally {
            long cost = System.currentTimeMillis() - start;
            if (error != null) {
                log.error("API Error: method={} uri={} handler={} durationMs={} errorType={} message={}",
                        method, uri, handler, cost, error.getClass().getSimpleName(), error.getMessage());
            } else if (result instanceof SseEmitter) {
                log.info("API Stream opened: uri={} handler={}", uri, handler);
            } else if (result instanceof ResponseEntity<?> re) {
                if (ingestion) {
                    log.debug("API Response: method={} uri={} status={} durationMs={}", method, uri, re.getStatusCode(), cost);
                } else {
                    log.info("API Response: method={} uri={} handler={} status={} durationMs={} body={}",
                            method, uri, handler, re.getStatusCode(), cost, toJson(re.getBody()));
                }
            } else {
                log.info("API Response: method={} uri={} handler={} durationMs={} result={}",
                        method, uri, handler, cost, toJson(result));
            }
        }
    }

    private String describeArgs(MethodSignature sig, Object[] args) {
        String[] names = sig.getParameterNames();
        Map<String, Object> argMap = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            String name = names != null && i < names.length ? names[i] : ("arg" + i);
            Object a = args[i];
            argMap.put(name, a instanceof Collection<?> c ? ("size=" + c.size()) : a);
        }
        return toJson(argMap);
    }

    private String toJson(Object obj) {
        if (obj == null) return "null";
        try {
            String s = objectMapper.writeValueAsString(obj);
            if (s.length() > MAX_BODY_CHARS) {
                return s.substring(0, MAX_BODY_CHARS) + "...(" + (s.length() - MAX_BODY_CHARS) + " more chars)";
            }
            return s;
        } catch (JsonProcessingException e) {
            return String.valueOf(obj);
        }
    }
}
