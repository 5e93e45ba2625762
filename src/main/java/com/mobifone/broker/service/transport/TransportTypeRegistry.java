package com.mobifone.broker.service.transport;

import com.mobifone.broker.entity.enumeration.TransportProtocol;
import com.mobifone.broker.exception.AppException;
import com.mobifone.broker.exception.ErrorCode;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class TransportTypeRegistry {
    private final Map<TransportProtocol, TransportType> types = new EnumMap<>(TransportProtocol.class);

    public TransportTypeRegistry(List<TransportType> transportTypes) {
        transportTypes.forEach(type -> types.put(type.getProtocol(), type));
    }

    public TransportType get(TransportProtocol protocol) {
        TransportType type = protocol == null ? null : types.get(protocol);
        if (type == null) {
            throw new AppException(ErrorCode.TRANSPORT_NOT_FOUND);
        }
        return type;
    }
}
