package com.mobifone.broker.service;

import com.mobifone.broker.dto.response.ServiceItemResponse;
import com.mobifone.broker.entity.LogicalService;
import com.mobifone.broker.entity.Transport;
import com.mobifone.broker.entity.User;
import com.mobifone.broker.entity.UserGroup;
import com.mobifone.broker.entity.enumeration.ClientOs;
import com.mobifone.broker.mapper.CatalogMapper;
import com.mobifone.broker.repository.LogicalServiceRepository;
import com.mobifone.broker.service.assignment.AssignmentService;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/** Services and transports a user may pick from, as shown by the client. */
@Slf4j
@Service
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class ServiceCatalogService {
    LogicalServiceRepository logicalServiceRepository;
    AssignmentService assignmentService;
    CatalogMapper catalogMapper;

    public List<ServiceItemResponse> listFor(User user, ClientOs clientOs) {
        Set<String> groupIds = user.getGroups().stream().map(UserGroup::getId).collect(Collectors.toSet());
        if (groupIds.isEmpty()) {
            return List.of();
        }
        return logicalServiceRepository.findVisibleForGroups(groupIds).stream()
                .map(service -> toItem(service, user, clientOs))
                .filter(item -> !item.getTransports().isEmpty())
                .collect(Collectors.toList());
    }

    private ServiceItemResponse toItem(LogicalService service, User user, ClientOs clientOs) {
        ServiceItemResponse item = catalogMapper.toServiceItemResponse(service);
        item.setInUse(assignmentService.findActive(user.getId(), service.getId()).isPresent());
        item.setTransports(service.getTransports().stream()
                .filter(t -> Boolean.TRUE.equals(t.getEnabled()) && t.isValidForOs(clientOs))
                .sorted(Comparator.comparing(Transport::getPriority, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(Transport::getName, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(catalogMapper::toTransportItemResponse)
                .collect(Collectors.toList()));
        return item;
    }
}
