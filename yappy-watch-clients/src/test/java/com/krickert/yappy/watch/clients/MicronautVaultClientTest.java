package com.krickert.yappy.watch.clients;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.krickert.yappy.watch.exception.BackendResponseException;
import com.krickert.yappy.watch.exception.LeaseExpiredException;
import com.krickert.yappy.watch.vault.MountInfo;
import com.krickert.yappy.watch.vault.SecretAuth;
import com.krickert.yappy.watch.vault.VaultSecret;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.client.BlockingHttpClient;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.OngoingStubbing;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MicronautVaultClientTest {

    @Mock
    private HttpClient httpClient;
    @Mock
    private BlockingHttpClient blocking;
    @Captor
    private ArgumentCaptor<HttpRequest<?>> request;

    @BeforeEach
    void setUp() {
        lenient().when(httpClient.toBlocking()).thenReturn(blocking);
    }

    private MicronautVaultClient client(String token, String namespace) {
        return new MicronautVaultClient(httpClient, new ObjectMapper(), CreateClientInput.builder()
                .address("127.0.0.1:8200")
                .token(token)
                .namespace(namespace)
                .build());
    }

    @SuppressWarnings("unchecked")
    private void answer(String body) {
        when(blocking.exchange(any(HttpRequest.class), eq(String.class))).thenReturn(HttpResponse.ok(body));
    }

    @SuppressWarnings("unchecked")
    private void answerInOrder(String... bodies) {
        OngoingStubbing<HttpResponse<String>> stub = when(blocking.exchange(any(HttpRequest.class), eq(String.class)));
        for (String body : bodies) {
            stub = stub.thenReturn(HttpResponse.ok(body));
        }
    }

    private List<String> sentBodies(int count) {
        verify(blocking, times(count)).exchange(request.capture(), eq(String.class));
        return request.getAllValues().stream()
                .map(sent -> sent.getBody().map(Object::toString).orElse(""))
                .toList();
    }

    private static VaultSecret bareToken(String clientToken) {
        SecretAuth auth = new SecretAuth();
        auth.setClientToken(clientToken);
        auth.setRenewable(true);
        VaultSecret token = new VaultSecret();
        token.setAuth(auth);
        return token;
    }

    @SuppressWarnings("unchecked")
    private void fail(HttpResponse<?> response) {
        when(blocking.exchange(any(HttpRequest.class), eq(String.class)))
                .thenThrow(new HttpClientResponseException(response.getStatus().getReason(), response));
    }

    @Test
    void readSendsTokenAndNamespaceAndDecodesSnakeCase() {
        answer("{\"request_id\":\"r-1\",\"lease_id\":\"\",\"lease_duration\":2764800,\"renewable\":false,"
                + "\"data\":{\"password\":\"x\"},\"unknown\":1}");

        VaultSecret secret = client("s.token", "team-a").read("/secret/app", Map.of("version", List.of("2")));

        assertThat(secret.getRequestId()).isEqualTo("r-1");
        assertThat(secret.getLeaseDuration()).isEqualTo(2764800);
        assertThat(secret.getData()).containsEntry("password", "x");
        verify(blocking).exchange(request.capture(), eq(String.class));
        HttpRequest<?> sent = request.getValue();
        assertThat(sent.getUri().toString()).isEqualTo("http://127.0.0.1:8200/v1/secret/app?version=2");
        assertThat(sent.getHeaders().get(MicronautVaultClient.TOKEN_HEADER)).isEqualTo("s.token");
        assertThat(sent.getHeaders().get(MicronautVaultClient.NAMESPACE_HEADER)).isEqualTo("team-a");
    }

    @Test
    void notFoundReadIsNoSecret() {
        fail(HttpResponse.notFound());

        assertThat(client("s.token", "").read("secret/missing", Map.of())).isNull();
    }

    @Test
    void otherErrorsPropagateWithTheirStatus() {
        fail(HttpResponse.serverError("{\"errors\":[\"Vault is sealed\"]}"));

        assertThatThrownBy(() -> client("s.token", "").read("secret/app", Map.of()))
                .isInstanceOfSatisfying(BackendResponseException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(500));
    }

    @Test
    void mountInfoReadsTheUiMountsEndpoint() {
        answer("{\"data\":{\"path\":\"secret/\",\"type\":\"kv\",\"options\":{\"version\":\"2\"}}}");

        Optional<MountInfo> mount = client("s.token", "").mountInfo("secret/app");

        assertThat(mount).contains(new MountInfo("secret/", "kv", "2"));
        assertThat(mount.get().isKvV2()).isTrue();
    }

    @Test
    void renewingATokenUsesRenewSelf() {
        answer("{\"auth\":{\"client_token\":\"s.child\",\"lease_duration\":600,\"renewable\":true}}");
        SecretAuth auth = new SecretAuth();
        auth.setClientToken("s.child");
        auth.setRenewable(true);
        VaultSecret token = new VaultSecret();
        token.setAuth(auth);

        VaultSecret renewed = client("s.token", "").renew(token, 600);

        assertThat(renewed.getAuth().getLeaseDuration()).isEqualTo(600);
        verify(blocking).exchange(request.capture(), eq(String.class));
        assertThat(request.getValue().getPath()).isEqualTo("/v1/auth/token/renew-self");
        assertThat(request.getValue().getHeaders().get(MicronautVaultClient.TOKEN_HEADER)).isEqualTo("s.child");
    }

    @Test
    void renewingALeaseThatIsGoneIsLeaseExpiry() {
        fail(HttpResponse.badRequest("{\"errors\":[\"lease not found\"]}"));
        VaultSecret leased = new VaultSecret();
        leased.setLeaseId("database/creds/app/1");
        leased.setRenewable(true);

        assertThatThrownBy(() -> client("s.token", "").renew(leased, 60)).isInstanceOf(LeaseExpiredException.class);
    }

    @Test
    void leaseIsRenewedAtTwoThirdsUntilTheStoreCapsIt() {
        answerInOrder(
                "{\"lease_id\":\"database/creds/app/1\",\"lease_duration\":60,\"renewable\":true}",
                "{\"lease_id\":\"database/creds/app/1\",\"lease_duration\":60,\"renewable\":true}",
                "{\"lease_id\":\"database/creds/app/1\",\"lease_duration\":30,\"renewable\":true}");
        VaultSecret leased = new VaultSecret();
        leased.setLeaseId("database/creds/app/1");
        leased.setLeaseDuration(60);
        leased.setRenewable(true);
        MicronautVaultClient client = client("s.token", "");

        StepVerifier.withVirtualTime(() -> client.renewals(leased))
                .assertNext(renewed -> assertThat(renewed.getLeaseDuration()).isEqualTo(60))
                .expectNoEvent(Duration.ofSeconds(39))
                .thenAwait(Duration.ofSeconds(1))
                .assertNext(renewed -> assertThat(renewed.getLeaseDuration()).isEqualTo(60))
                .thenAwait(Duration.ofSeconds(40))
                .assertNext(renewed -> assertThat(renewed.getLeaseDuration()).isEqualTo(30))
                .expectNoEvent(Duration.ofSeconds(19))
                .thenAwait(Duration.ofSeconds(1))
                .verifyComplete();

        assertThat(sentBodies(3)).containsOnly("{\"lease_id\":\"database/creds/app/1\",\"increment\":60}");
        assertThat(request.getAllValues()).allSatisfy(sent ->
                assertThat(sent.getPath()).isEqualTo("/v1/sys/leases/renew"));
    }

    @Test
    void bareTokenLeavesTheIncrementToTheServer() {
        answerInOrder(
                "{\"auth\":{\"client_token\":\"s.root\",\"lease_duration\":3600,\"renewable\":true}}",
                "{\"auth\":{\"client_token\":\"s.root\",\"lease_duration\":1,\"renewable\":true}}");
        MicronautVaultClient client = client("s.root", "");

        StepVerifier.withVirtualTime(() -> client.renewals(bareToken("s.root")))
                .assertNext(renewed -> assertThat(renewed.getAuth().getLeaseDuration()).isEqualTo(3600))
                .expectNoEvent(Duration.ofSeconds(2399))
                .thenAwait(Duration.ofSeconds(1))
                .assertNext(renewed -> assertThat(renewed.getAuth().getLeaseDuration()).isEqualTo(1))
                .thenAwait(MicronautVaultClient.MIN_RENEW_DELAY)
                .verifyComplete();

        assertThat(sentBodies(2)).containsOnly("{}");
    }

    @Test
    void shortLeaseIsNotRenewedInATightLoop() {
        answerInOrder("{\"auth\":{\"client_token\":\"s.root\",\"lease_duration\":1,\"renewable\":true}}");
        MicronautVaultClient client = client("s.root", "");

        StepVerifier.withVirtualTime(() -> client.renewals(bareToken("s.root")))
                .expectNextCount(1)
                .expectNoEvent(MicronautVaultClient.MIN_RENEW_DELAY.minusMillis(1))
                .thenAwait(Duration.ofMillis(1))
                .verifyComplete();

        assertThat(sentBodies(1)).doesNotContain("{\"increment\":1}");
    }

    @Test
    void nonRenewableSecretHasNoRenewals() {
        StepVerifier.create(client("s.token", "").renewals(new VaultSecret()))
                .expectError(LeaseExpiredException.class)
                .verify();
    }

    @Test
    void setTokenNeverStoresNull() {
        MicronautVaultClient client = client("s.token", "");

        client.setToken(null);

        assertThat(client.token()).isEmpty();
    }
}
