package com.mobifone.broker.common;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mobifone.broker.utils.RequestInfo;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.time.Duration;
import java.time.Instant;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Aspect
@Component
@Slf4j
public class LogApiAspect {
    static final String REDACTED = "******";

    private static final Set<String> SECRET_HEADERS = Set.of(
            HttpHeaders.AUTHORIZATION.toLowerCase(),
            Constants.CONNECTION.SCRAMBLER_HEADER.toLowerCase());

    private final ObjectMapper objectMapper;

    public LogApiAspect(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Around("@annotation(com.mobifone.broker.common.LogApi)")
    public Object logApiCall(ProceedingJoinPoint joinPoint) throws Throwable {
        Instant timeStart = Instant.now();

        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attributes == null) {
            return joinPoint.proceed();
        }
        HttpServletRequest httpServletRequest = attributes.getRequest();

        String endpoint = httpServletRequest.getRequestURI();
        String httpMethod = httpServletRequest.getMethod();
        String requestHeader = redactHeaders(httpServletRequest).toString();
        String requestParams = redactParams(httpServletRequest.getParameterMap()).toString();

        String responseBody = null;
        String responseStatus = null;
        try {
            Object result = joinPoint.proceed();
            responseBody = objectMapper.writeValueAsString(result);
            responseStatus = String.valueOf(HttpStatus.OK.value());
            return result;
        } catch (Exception e) {
            responseBody = e.getClass().getSimpleName();
            responseStatus = String.valueOf(HttpStatus.INTERNAL_SERVER_ERROR.value());
            throw e;
        } finally {
            long tookMs = Duration.between(timeStart, Instant.now()).toMillis();
            log.info("API [{} {}] from {} status={} took={}ms params={} headers={}",
                    httpMethod, endpoint, RequestInfo.clientIp(httpServletRequest),
                    responseStatus, tookMs, requestParams, requestHeader);
            log.debug("API [{} {}] response: {}", httpMethod, endpoint, responseBody);
        }
    }

    static Map<String, String> redactParams(Map<String, String[]> params) {
        Map<String, String> out = new LinkedHashMap<>();
        params.forEach((name, values) -> {
            if (Constants.CONNECTION.PASSWORD_PARAM.equalsIgnoreCase(name)) {
                out.put(name, REDACTED);
            } else {
                out.put(name, String.join(",", values));
            }
        });
        return out;
    }

    private Map<String, String> redactHeaders(HttpServletRequest request) {
        Map<String, String> headersMap = new LinkedHashMap<>();
        Enumeration<String> headerNames = request.getHeaderNames();
        while (headerNames != null && headerNames.hasMoreElements()) {
            String headerName = headerNames.nextElement();
            String value = SECRET_HEADERS.contains(headerName.toLowerCase()) ? REDACTED : request.getHeader(headerName);
            headersMap.put(headerName, value);
        }
        return headersMap;
    }
}
