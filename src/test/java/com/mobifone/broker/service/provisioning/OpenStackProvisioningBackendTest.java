package com.mobifone.broker.service.provisioning;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mobifone.broker.configuration.BrokerProperties;
import com.mobifone.broker.entity.LogicalService;
import com.mobifone.broker.exception.AppException;
import com.mobifone.broker.exception.ErrorCode;
import com.mobifone.broker.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenStackProvisioningBackendTest {
    private static final String AUTH_PATH = "/r1/v3/auth/tokens";

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private final Deque<ClientResponse> responses = new ArrayDeque<>();
    private final MutableClock clock = MutableClock.startingNow();
    private HttpStatus authStatus = HttpStatus.CREATED;
    private OpenStackProvisioningBackend backend;

    private final LogicalService service = LogicalService.builder()
            .id("s-desktop1").name("desktop1")
            .backendType("OPENSTACK").region("r1")
            .imageId("img-win11").flavorId("m1.large")
            .build();

    @BeforeEach
    void setUp() {
        BrokerProperties properties = new BrokerProperties();
        properties.getProvisioning().getOpenstack().setUrl("http://openstack.test");
        properties.getProvisioning().getOpenstack().setUsername("broker");
        properties.getProvisioning().getOpenstack().setPassword("pw");
        properties.getProvisioning().getOpenstack().setProject("vdi");

        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            if (request.url().getPath().equals(AUTH_PATH)) {
                return Mono.just(ClientResponse.create(authStatus)
                        .header("x-subject-token", "tok-" + requests.size())
                        .build());
            }
            ClientResponse next = responses.poll();
            return Mono.just(next != null ? next : ClientResponse.create(HttpStatus.OK).build());
        });
        backend = new OpenStackProvisioningBackend(builder, properties, new ObjectMapper(), clock);
    }

    @Test
    void tokenIsReusedUntilItExpires() {
        backend.connect("r1");
        backend.connect("r1");
        assertEquals(1, authRequests());

        clock.advance(Duration.ofHours(2));
        backend.connect("r1");
        assertEquals(2, authRequests());
    }

    @Test
    void acquirePostsProvisionRequestWithToken() {
        respond(HttpStatus.OK, "{\"task_id\":\"task-9\"}");
        backend.connect("r1");

        AcquireResult result = backend.acquireInstance(service, "id-1", "u-alice");

        assertTrue(result.isPending());
        assertEquals("id-1", result.getReference());
        ClientRequest request = requests.get(requests.size() - 1);
        assertEquals(HttpMethod.POST, request.method());
        assertEquals("/r1/vdi/provision_infra/personal", request.url().getPath());
        assertEquals("identifier=id-1&user_id=u-alice", request.url().getQuery());
        assertEquals("tok-1", request.headers().getFirst("x-subject-token"));
    }

    @Test
    void acquireWithImmediateAddressIsReady() {
        respond(HttpStatus.OK, "{\"address\":\"10.0.0.5\"}");
        backend.connect("r1");

        AcquireResult result = backend.acquireInstance(service, "id-1", "u-alice");

        assertEquals("10.0.0.5", result.getAddress());
    }

    @Test
    void taskStatusIsTranslated() {
        respond(HttpStatus.OK, "{\"status\":\"SUCCESS\",\"instances\":[{\"ip\":\"10.0.0.6\"}]}");
        respond(HttpStatus.OK, "{\"status\":\"FAILED\",\"error_message\":\"quota exceeded\"}");
        respond(HttpStatus.OK, "{\"status\":\"RUNNING\"}");
        backend.connect("r1");

        InstanceStatus ready = backend.checkInstance(service, "id-1");
        assertEquals(InstanceStatus.State.READY, ready.getState());
        assertEquals("10.0.0.6", ready.getAddress());
        assertEquals("/r1/vdi/tasks/id-1", requests.get(requests.size() - 1).url().getPath());

        InstanceStatus failed = backend.checkInstance(service, "id-1");
        assertEquals(InstanceStatus.State.FAILED, failed.getState());
        assertEquals("quota exceeded", failed.getError());

        assertEquals(InstanceStatus.State.PENDING, backend.checkInstance(service, "id-1").getState());
    }

    @Test
    void releaseDeletesResource() {
        backend.connect("r1");

        backend.releaseInstance(service, "id-1");

        ClientRequest request = requests.get(requests.size() - 1);
        assertEquals(HttpMethod.DELETE, request.method());
        assertEquals("/r1/vdi/delete_resource/id-1", request.url().getPath());
    }

    @Test
    void backendErrorBecomesProvisioningFailure() {
        respond(HttpStatus.INTERNAL_SERVER_ERROR, "{\"detail\":\"boom\"}");
        backend.connect("r1");

        AppException e = assertThrows(AppException.class, () -> backend.acquireInstance(service, "id-1", "u-alice"));
        assertEquals(ErrorCode.PROVISIONING_FAILED, e.getErrorCode());
    }

    @Test
    void rejectedCredentialsFailConnect() {
        authStatus = HttpStatus.UNAUTHORIZED;

        AppException e = assertThrows(AppException.class, () -> backend.connect("r1"));
        assertEquals(ErrorCode.PROVISIONING_FAILED, e.getErrorCode());
    }

    @Test
    void onlyOpenStackServicesApply() {
        assertTrue(backend.isApplicable("openstack"));
        assertFalse(backend.isApplicable("FAKE"));
    }

    private void respond(HttpStatus status, String json) {
        responses.add(ClientResponse.create(status)
                .header("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                .body(json)
                .build());
    }

    private long authRequests() {
        return requests.stream()
                .filter(r -> r.url().getPath().equals(AUTH_PATH))
                .collect(Collectors.counting());
    }
}
