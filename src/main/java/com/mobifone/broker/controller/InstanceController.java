package com.mobifone.broker.controller;

import com.mobifone.broker.common.LogApi;
import com.mobifone.broker.dto.ApiResponse;
import com.mobifone.broker.dto.response.InstanceResponse;
import com.mobifone.broker.service.assignment.AssignmentService;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/instances")
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class InstanceController {
    AssignmentService assignmentService;

    @LogApi
    @GetMapping
    ApiResponse<List<InstanceResponse>> getInstances(@RequestParam String serviceId) {
        return ApiResponse.<List<InstanceResponse>>builder()
                .result(assignmentService.listForService(serviceId))
                .build();
    }

    @LogApi
    @DeleteMapping("/{instanceId}")
    ApiResponse<InstanceResponse> releaseInstance(@PathVariable String instanceId) {
        return ApiResponse.<InstanceResponse>builder()
                .message("Instance has been released")
                .result(assignmentService.release(instanceId))
                .build();
    }

    @LogApi
    @DeleteMapping("/users/{userId}")
    ApiResponse<List<InstanceResponse>> releaseUserInstances(@PathVariable String userId) {
        return ApiResponse.<List<InstanceResponse>>builder()
                .result(assignmentService.releaseAllForUser(userId))
                .build();
    }
}
