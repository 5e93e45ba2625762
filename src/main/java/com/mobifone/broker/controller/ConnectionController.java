package com.mobifone.broker.controller;

import com.mobifone.broker.common.Constants;
import com.mobifone.broker.common.LogApi;
import com.mobifone.broker.dto.response.ResultEnvelope;
import com.mobifone.broker.service.auth.CurrentUserService;
import com.mobifone.broker.service.connection.ConnectionRequest;
import com.mobifone.broker.service.connection.ConnectionRequestRouter;
import com.mobifone.broker.utils.RequestInfo;
import jakarta.servlet.http.HttpServletRequest;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class ConnectionController {
    ConnectionRequestRouter connectionRequestRouter;
    CurrentUserService currentUserService;

    @LogApi
    @GetMapping({Constants.CONNECTION.BASE_PATH, Constants.CONNECTION.BASE_PATH + "/**"})
    public ResultEnvelope connection(HttpServletRequest request,
                                     @RequestParam(value = Constants.CONNECTION.PASSWORD_PARAM, required = false) String password,
                                     @RequestHeader(value = Constants.CONNECTION.SCRAMBLER_HEADER, required = false) String scrambler) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return connectionRequestRouter.route(ConnectionRequest.builder()
                .segments(segmentsOf(path))
                .user(currentUserService.currentUser())
                .clientOs(RequestInfo.clientOs(request))
                .clientIp(RequestInfo.clientIp(request))
                .password(password)
                .scrambler(scrambler)
                .build());
    }

    /** Positional arguments after /connection, URL-decoded. */
    static List<String> segmentsOf(String path) {
        String rest = path.startsWith(Constants.CONNECTION.BASE_PATH)
                ? path.substring(Constants.CONNECTION.BASE_PATH.length())
                : path;
        return Arrays.stream(rest.split("/"))
                .filter(s -> !s.isEmpty())
                .map(s -> UriUtils.decode(s, StandardCharsets.UTF_8))
                .collect(Collectors.toList());
    }
}
