package com.mobifone.broker.controller;

import com.mobifone.broker.common.LogApi;
import com.mobifone.broker.dto.ApiResponse;
import com.mobifone.broker.dto.response.AuthenticatorResponse;
import com.mobifone.broker.dto.response.SearchItemResponse;
import com.mobifone.broker.service.auth.AuthenticatorService;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/authenticators")
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class AuthenticatorController {
    AuthenticatorService authenticatorService;

    @GetMapping
    ApiResponse<List<AuthenticatorResponse>> getAuthenticators() {
        return ApiResponse.<List<AuthenticatorResponse>>builder()
                .result(authenticatorService.list())
                .build();
    }

    @LogApi
    @GetMapping("/{name}/search")
    ApiResponse<List<SearchItemResponse>> search(@PathVariable String name,
                                                 @RequestParam String type,
                                                 @RequestParam(defaultValue = "") String term,
                                                 @RequestParam(defaultValue = "50") int limit) {
        return ApiResponse.<List<SearchItemResponse>>builder()
                .result(authenticatorService.search(name, type, term, limit))
                .build();
    }
}
