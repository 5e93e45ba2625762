package com.mobifone.broker.mapper;

import com.mobifone.broker.dto.response.ServiceItemResponse;
import com.mobifone.broker.dto.response.TransportItemResponse;
import com.mobifone.broker.entity.LogicalService;
import com.mobifone.broker.entity.Transport;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface CatalogMapper {
    @Mapping(target = "inUse", ignore = true)
    @Mapping(target = "transports", ignore = true)
    ServiceItemResponse toServiceItemResponse(LogicalService service);

    TransportItemResponse toTransportItemResponse(Transport transport);
}
