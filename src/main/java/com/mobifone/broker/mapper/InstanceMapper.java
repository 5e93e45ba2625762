package com.mobifone.broker.mapper;

import com.mobifone.broker.dto.response.InstanceResponse;
import com.mobifone.broker.entity.ServiceInstance;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface InstanceMapper {
    @Mapping(target = "serviceId", source = "logicalService.id")
    @Mapping(target = "userId", source = "user.id")
    InstanceResponse toInstanceResponse(ServiceInstance instance);
}
