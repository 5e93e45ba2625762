package com.mobifone.broker.service.connection;

import com.mobifone.broker.common.Constants;
import com.mobifone.broker.configuration.BrokerProperties;
import com.mobifone.broker.dto.response.ConnectionInfo;
import com.mobifone.broker.dto.response.ResultEnvelope;
import com.mobifone.broker.entity.User;
import com.mobifone.broker.entity.enumeration.ClientOs;
import com.mobifone.broker.exception.AppException;
import com.mobifone.broker.exception.ErrorCode;
import com.mobifone.broker.repository.UserRepository;
import com.mobifone.broker.service.ServiceCatalogService;
import com.mobifone.broker.service.assignment.AssignmentService;
import com.mobifone.broker.service.assignment.ResolveResult;
import com.mobifone.broker.service.assignment.ResolvedService;
import com.mobifone.broker.service.assignment.ServiceAssignmentResolver;
import com.mobifone.broker.service.crypto.CredentialCipher;
import com.mobifone.broker.service.ticket.TicketBroker;
import com.mobifone.broker.service.transport.TransportNegotiator;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Dispatches a positional /connection request by its shape:
 * <pre>
 *   []                                  list services
 *   [ticket]                            ticket content (not implemented)
 *   [service, transport]                connection info, access checked
 *   [service, transport, skipChecking]  connection info, no access check
 *   [service, transport, udslink]       one-time client link
 *   [service, transport, scrambler, hostname]  launcher script
 * </pre>
 * Any other shape is rejected with INVALID_REQUEST. Failures of the operations themselves
 * come back as error envelopes, never as exceptions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class ConnectionRequestRouter {
    ServiceCatalogService serviceCatalogService;
    ServiceAssignmentResolver serviceAssignmentResolver;
    TransportNegotiator transportNegotiator;
    AssignmentService assignmentService;
    CredentialCipher credentialCipher;
    TicketBroker ticketBroker;
    UserRepository userRepository;
    BrokerProperties brokerProperties;

    public ResultEnvelope route(ConnectionRequest request) {
        log.debug("Connection request {}", request);
        switch (request.getSegments().size()) {
            case 0:
                return guarded(() -> serviceList(request));
            case 1:
                return ResultEnvelope.error(ErrorCode.NOT_IMPLEMENTED);
            case 2:
                return guarded(() -> connection(request, true));
            case 3:
                if (Constants.CONNECTION.SKIP_CHECKING.equals(request.segment(2))) {
                    return guarded(() -> connection(request, false));
                }
                if (Constants.CONNECTION.UDS_LINK.equals(request.segment(2))) {
                    return guarded(() -> udsLink(request));
                }
                break;
            case 4:
                return guarded(() -> script(request));
            default:
                break;
        }
        throw new AppException(ErrorCode.INVALID_REQUEST);
    }

    /**
     * Redeems a link issued by the udslink route and returns the launcher script for it. The
     * ticket is only consumed once the machine is ready, so a not-ready answer can be retried
     * with the same link.
     */
    public ResultEnvelope redeemLink(String ticketId, String scrambler, String hostname, ClientOs clientOs, String clientIp) {
        return guarded(() -> {
            Map<String, Object> payload = ticketBroker.peek(ticketId)
                    .orElseThrow(() -> new AppException(ErrorCode.TICKET_NOT_FOUND));
            User user = userRepository.findById(String.valueOf(payload.get("userId")))
                    .orElseThrow(() -> new AppException(ErrorCode.TICKET_NOT_FOUND));
            ConnectionRequest request = ConnectionRequest.builder()
                    .segment(String.valueOf(payload.get("serviceId")))
                    .segment(String.valueOf(payload.get("transportId")))
                    .segment(scrambler)
                    .segment(Optional.ofNullable(hostname).orElse(""))
                    .user(user)
                    .clientOs(clientOs)
                    .clientIp(clientIp)
                    .password((String) payload.get("password"))
                    .scrambler(scrambler)
                    .build();

            ResolveResult<ResolvedService> result = resolve(request, true);
            if (!result.isReady()) {
                return toEnvelope(result);
            }
            if (ticketBroker.redeem(ticketId).isEmpty()) {
                // a concurrent redemption won
                throw new AppException(ErrorCode.TICKET_NOT_FOUND);
            }
            return script(request, result.getValue());
        });
    }

    private ResultEnvelope serviceList(ConnectionRequest request) {
        return ResultEnvelope.ok(serviceCatalogService.listFor(request.getUser(), request.getClientOs()));
    }

    private ResultEnvelope connection(ConnectionRequest request, boolean check) {
        ResolveResult<ResolvedService> result = resolve(request, check);
        if (!result.isReady()) {
            return toEnvelope(result);
        }
        ResolvedService resolved = result.getValue();
        ConnectionInfo info = check
                ? transportNegotiator.getConnectionInfo(resolved, request.getUser(), Constants.CONNECTION.UNKNOWN_PASSWORD)
                : ConnectionInfo.builder().ip(resolved.getAddress()).build();
        return ResultEnvelope.ok(info);
    }

    private ResultEnvelope udsLink(ConnectionRequest request) {
        if (request.getPassword() == null || request.getScrambler() == null) {
            throw new AppException(ErrorCode.INVALID_REQUEST);
        }
        // reject a payload the script route could not open later
        credentialCipher.decrypt(request.getPassword(), request.getScrambler());

        ResolveResult<ResolvedService> result = resolve(request, true);
        if (!result.isReady()) {
            return toEnvelope(result);
        }
        ResolvedService resolved = result.getValue();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("userId", request.getUser().getId());
        payload.put("serviceId", resolved.getService().getId());
        payload.put("transportId", resolved.getTransport().getId());
        payload.put("password", request.getPassword());

        BrokerProperties.Link link = brokerProperties.getLink();
        String ticketId = ticketBroker.issue(resolved.getInstance(), resolved.getTransport(), payload,
                brokerProperties.getTicket().getTtl());
        return ResultEnvelope.ok(link.getScheme() + "://" + link.getHost() + "/" + ticketId + "/" + request.getScrambler());
    }

    private ResultEnvelope script(ConnectionRequest request) {
        ResolveResult<ResolvedService> result = resolve(request, true);
        if (!result.isReady()) {
            return toEnvelope(result);
        }
        return script(request, result.getValue());
    }

    private ResultEnvelope script(ConnectionRequest request, ResolvedService resolved) {
        String scrambler = request.segment(2);
        String hostname = request.segment(3);

        String password = credentialCipher.decrypt(request.getPassword(), scrambler);
        assignmentService.recordConnectionSource(resolved.getInstance().getId(), request.getClientIp(), hostname);

        return ResultEnvelope.ok(transportNegotiator.buildConnection(
                resolved, request.getClientOs(), request.getUser(), password, scrambler));
    }

    private ResolveResult<ResolvedService> resolve(ConnectionRequest request, boolean validateAccess) {
        return serviceAssignmentResolver.resolve(request.getUser(), request.segment(0), request.segment(1),
                request.getClientOs(), request.getClientIp(), validateAccess);
    }

    private static ResultEnvelope toEnvelope(ResolveResult<?> result) {
        if (result.isNotReady()) {
            return ResultEnvelope.retry(ErrorCode.SERVICE_NOT_READY, result.getReason().getCode());
        }
        return ResultEnvelope.error(result.getErrorCode());
    }

    private static ResultEnvelope guarded(Supplier<ResultEnvelope> operation) {
        try {
            return operation.get();
        } catch (AppException e) {
            return ResultEnvelope.error(e.getErrorCode());
        } catch (RuntimeException e) {
            String incident = UUID.randomUUID().toString();
            log.error("Connection request failed, incident {}", incident, e);
            return ResultEnvelope.error("Internal error, incident " + incident);
        }
    }
}
