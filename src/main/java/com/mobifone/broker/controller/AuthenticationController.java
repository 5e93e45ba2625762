package com.mobifone.broker.controller;

import com.mobifone.broker.common.LogApi;
import com.mobifone.broker.dto.ApiResponse;
import com.mobifone.broker.dto.request.AuthenticationRequest;
import com.mobifone.broker.dto.response.AuthenticationResponse;
import com.mobifone.broker.service.auth.AuthenticationService;
import jakarta.validation.Valid;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class AuthenticationController {
    AuthenticationService authenticationService;

    @LogApi
    @PostMapping("/token")
    ApiResponse<AuthenticationResponse> authenticate(@RequestBody @Valid AuthenticationRequest request) {
        return ApiResponse.<AuthenticationResponse>builder()
                .result(authenticationService.authenticate(request))
                .build();
    }
}
