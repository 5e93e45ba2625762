package com.mobifone.broker.service.provisioning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mobifone.broker.common.Constants;
import com.mobifone.broker.configuration.BrokerProperties;
import com.mobifone.broker.entity.LogicalService;
import com.mobifone.broker.exception.AppException;
import com.mobifone.broker.exception.ErrorCode;
import lombok.AccessLevel;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provisioning through the OpenStack VDI API. One auth token is kept per region and reused
 * until it expires.
 */
@Slf4j
@Component
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class OpenStackProvisioningBackend implements ProvisioningBackend {

    WebClient webClient;
    BrokerProperties.OpenStack config;
    ObjectMapper objectMapper;
    Clock clock;

    static final class TokenCache {
        volatile String token;
        volatile Instant expiry = Instant.EPOCH;
    }
    // key = region, "" without region
    ConcurrentHashMap<String, TokenCache> tokenByRegion = new ConcurrentHashMap<>();

    public OpenStackProvisioningBackend(WebClient.Builder builder, BrokerProperties properties,
                                        ObjectMapper objectMapper, Clock clock) {
        this.config = properties.getProvisioning().getOpenstack();
        this.webClient = builder.baseUrl(Optional.ofNullable(config.getUrl()).orElse("")).build();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public boolean isApplicable(String backendType) {
        return Constants.OPENSTACK.NAME_SERVICE.equalsIgnoreCase(backendType);
    }

    @Override
    public void connect(String region) {
        String key = regionKey(region);
        TokenCache cache = tokenByRegion.computeIfAbsent(key, k -> new TokenCache());
        synchronized (cache) {
            Instant now = clock.instant();
            if (cache.token == null || !now.isBefore(cache.expiry)) {
                log.info("Token for region='{}' expired or not found. Requesting new token...", key);
                cache.token = fetchToken(key);
                cache.expiry = now.plus(config.getTokenLifetime());
            }
        }
    }

    @Override
    public AcquireResult acquireInstance(LogicalService service, String identifier, String userId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("base_vol_id", service.getImageId());
        body.put("flavor_id", service.getFlavorId());

        String endpoint = UriComponentsBuilder.fromPath(Constants.OPENSTACK.ENDPOINT.PROVISION)
                .queryParam("identifier", identifier)
                .queryParam("user_id", userId)
                .build()
                .toUriString();

        JsonNode response = call(HttpMethod.POST, endpoint, body, service.getRegion());
        String address = text(response, "address");
        log.info("Provisioning requested for service {} (identifier {})", service.getName(), identifier);
        return address == null ? AcquireResult.pending(identifier) : AcquireResult.ready(identifier, address);
    }

    @Override
    public InstanceStatus checkInstance(LogicalService service, String reference) {
        String endpoint = UriComponentsBuilder.fromPath(Constants.OPENSTACK.ENDPOINT.TASK_STATUS)
                .buildAndExpand(reference)
                .toUriString();
        JsonNode response = call(HttpMethod.GET, endpoint, null, service.getRegion());

        String status = Optional.ofNullable(text(response, "status")).orElse("").toUpperCase();
        switch (status) {
            case "SUCCESS":
                String address = Optional.ofNullable(text(response, "address"))
                        .orElseGet(() -> text(response.path("instances").path(0), "ip"));
                return address == null ? InstanceStatus.pending() : InstanceStatus.ready(address);
            case "FAILED":
            case "ERROR":
                return InstanceStatus.failed(text(response, "error_message"));
            default:
                return InstanceStatus.pending();
        }
    }

    @Override
    public void releaseInstance(LogicalService service, String reference) {
        String endpoint = UriComponentsBuilder.fromPath(Constants.OPENSTACK.ENDPOINT.DELETE_RESOURCE)
                .queryParam("identifier", reference)
                .buildAndExpand(reference)
                .toUriString();
        call(HttpMethod.DELETE, endpoint, null, service.getRegion());
        log.info("Release requested for {} on service {}", reference, service.getName());
    }

    private JsonNode call(HttpMethod method, String endpoint, Object requestBody, String region) {
        String finalPath = withRegion(region, endpoint);
        String token = requireToken(region);
        try {
            WebClient.RequestBodySpec requestSpec = webClient
                    .method(method)
                    .uri(finalPath)
                    .headers(h -> {
                        h.setContentType(MediaType.APPLICATION_JSON);
                        h.set(Constants.OPENSTACK.TOKEN_HEADER, token);
                    });
            WebClient.RequestHeadersSpec<?> spec = requestBody == null ? requestSpec : requestSpec.bodyValue(requestBody);

            String raw = spec.retrieve()
                    .onStatus(HttpStatusCode::isError, res -> res.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(err -> {
                                log.error("API [{} {}] returned error: {}", method, finalPath, err);
                                return Mono.error(new IllegalStateException("OpenStack API error: " + res.statusCode()));
                            }))
                    .bodyToMono(String.class)
                    .block(config.getRequestTimeout());
            log.info("API [{} {}] success", method, finalPath);
            return raw == null || raw.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(raw);
        } catch (IOException e) {
            log.error("Unreadable response [{} {}]: {}", method, finalPath, e.getMessage());
            throw new AppException(ErrorCode.PROVISIONING_FAILED, e);
        } catch (RuntimeException e) {
            log.error("Call failed [{} {}]: {}", method, finalPath, e.getMessage());
            throw new AppException(ErrorCode.PROVISIONING_FAILED, e);
        }
    }

    private String requireToken(String region) {
        TokenCache cache = tokenByRegion.get(regionKey(region));
        if (cache == null || cache.token == null || !clock.instant().isBefore(cache.expiry)) {
            throw new IllegalStateException("No OpenStack session for region '" + regionKey(region) + "', call connect first");
        }
        return cache.token;
    }

    /** POST {/{region}}/v3/auth/tokens, the token comes back in a response header. */
    private String fetchToken(String region) {
        Map<String, Object> payload = Map.of("auth", Map.of(
                "identity", Map.of(
                        "methods", List.of("password"),
                        "password", Map.of("user", Map.of(
                                "name", nvl(config.getUsername()),
                                "password", nvl(config.getPassword()),
                                "domain", Map.of("name", nvl(config.getDomain()))))),
                "scope", Map.of("project", Map.of(
                        "name", nvl(config.getProject()),
                        "domain", Map.of("name", nvl(config.getDomain()))))));

        String authPath = withRegion(region, Constants.OPENSTACK.ENDPOINT.AUTHENTICATION);
        try {
            String token = webClient.post()
                    .uri(authPath)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .exchangeToMono(resp -> {
                        if (resp.statusCode().is2xxSuccessful()) {
                            return Mono.justOrEmpty(resp.headers().header(Constants.OPENSTACK.TOKEN_HEADER).stream().findFirst());
                        }
                        return resp.bodyToMono(String.class).defaultIfEmpty("").flatMap(err -> {
                            log.error("Auth failed (region='{}'): {}", region, err);
                            return Mono.error(new IllegalStateException("Auth failed: " + resp.statusCode()));
                        });
                    })
                    .block(config.getRequestTimeout());
            if (token == null) {
                throw new IllegalStateException("Auth response carried no token");
            }
            return token;
        } catch (RuntimeException e) {
            log.error("OpenStack authentication failed for region '{}': {}", region, e.getMessage());
            throw new AppException(ErrorCode.PROVISIONING_FAILED, e);
        }
    }

    private static String withRegion(String region, String endpoint) {
        String p = regionKey(region);
        String e = endpoint.startsWith("/") ? endpoint : "/" + endpoint;
        if (p.isEmpty()) return e;
        if (!p.startsWith("/")) p = "/" + p;
        return p + e;
    }

    private static String regionKey(String region) {
        return Optional.ofNullable(region).orElse("").trim();
    }

    private static String nvl(String value) {
        return value == null ? "" : value;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() || value.asText().isBlank() ? null : value.asText();
    }
}
