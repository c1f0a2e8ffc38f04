package com.krickert.yappy.watch.clients;

import com.krickert.yappy.watch.consul.DiscoveryClient;
import com.krickert.yappy.watch.consul.LeaderWait;
import com.krickert.yappy.watch.exception.NoLeaderException;
import com.krickert.yappy.watch.vault.SecretAuth;
import com.krickert.yappy.watch.vault.VaultClient;
import com.krickert.yappy.watch.vault.VaultSecret;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClientSetTest {

    private static final CreateClientInput CONSUL = CreateClientInput.builder().address("127.0.0.1:8500").build();

    @Mock
    private BackendConnector connector;
    @Mock
    private LeaderWait leaderWait;
    @Mock
    private DiscoveryClient discovery;
    @Mock
    private DiscoveryClient otherDiscovery;
    @Mock
    private VaultClient vault;

    private ClientSet clientSet() {
        return new ClientSet(connector, leaderWait);
    }

    private static CreateClientInput vaultInput(String token, boolean unwrap) {
        return CreateClientInput.builder().address("127.0.0.1:8200").token(token).unwrapToken(unwrap).build();
    }

    private static VaultSecret unwrapped(String clientToken) {
        SecretAuth auth = new SecretAuth();
        auth.setClientToken(clientToken);
        VaultSecret secret = new VaultSecret();
        secret.setAuth(auth);
        return secret;
    }

    @Test
    void consulClientIsUsableOnceALeaderIsSeen() {
        when(connector.connectConsul(CONSUL)).thenReturn(discovery);
        ClientSet clients = clientSet();

        clients.createConsulClient(CONSUL);

        assertThat(clients.discovery()).isSameAs(discovery);
        verify(leaderWait).await(discovery, ClientSet.LEADER_WAIT_CEILING);
    }

    @Test
    void recreatingTheConsulClientClosesThePreviousOne() {
        when(connector.connectConsul(CONSUL)).thenReturn(discovery, otherDiscovery);
        ClientSet clients = clientSet();

        clients.createConsulClient(CONSUL);
        clients.createConsulClient(CONSUL);

        assertThat(clients.discovery()).isSameAs(otherDiscovery);
        verify(discovery).close();
        verify(otherDiscovery, never()).close();
    }

    @Test
    void connectFailureIsASetupError() {
        when(connector.connectConsul(CONSUL)).thenThrow(new IllegalArgumentException("bad address"));

        assertThatThrownBy(() -> clientSet().createConsulClient(CONSUL))
                .isInstanceOf(ClientSetupException.class)
                .hasMessage("client set: consul: bad address");
    }

    @Test
    void missingLeaderClosesTheNewClient() {
        when(connector.connectConsul(CONSUL)).thenReturn(discovery);
        doThrow(new NoLeaderException("no consul leader detected")).when(leaderWait).await(any(), any());
        ClientSet clients = clientSet();

        assertThatThrownBy(() -> clients.createConsulClient(CONSUL)).isInstanceOf(NoLeaderException.class);

        verify(discovery).close();
        assertThatThrownBy(clients::discovery)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("client set: consul client has not been created");
    }

    @Test
    void vaultTokenIsInstalled() {
        CreateClientInput input = vaultInput("s.token", false);
        when(connector.connectVault(input)).thenReturn(vault);
        ClientSet clients = clientSet();

        clients.createVaultClient(input);

        assertThat(clients.vault()).isSameAs(vault);
        verify(vault).setToken("s.token");
        verify(vault, never()).unwrap(anyString());
    }

    @Test
    void anonymousVaultClientGetsNoToken() {
        CreateClientInput input = vaultInput("", false);
        when(connector.connectVault(input)).thenReturn(vault);

        clientSet().createVaultClient(input);

        verify(vault, never()).setToken(anyString());
    }

    @Test
    void wrappedTokenIsExchangedForTheRealOne() {
        CreateClientInput input = vaultInput("s.wrapping", true);
        when(connector.connectVault(input)).thenReturn(vault);
        when(vault.unwrap("s.wrapping")).thenReturn(unwrapped("s.real"));

        clientSet().createVaultClient(input);

        InOrder order = inOrder(vault);
        order.verify(vault).setToken("s.wrapping");
        order.verify(vault).unwrap("s.wrapping");
        order.verify(vault).setToken("s.real");
    }

    @Test
    void unwrapWithoutASecretFails() {
        CreateClientInput input = vaultInput("s.wrapping", true);
        when(connector.connectVault(input)).thenReturn(vault);
        when(vault.unwrap("s.wrapping")).thenReturn(null);

        assertThatThrownBy(() -> clientSet().createVaultClient(input))
                .isInstanceOf(ClientSetupException.class)
                .hasMessage("client set: vault unwrap: no secret");
        verify(vault).close();
    }

    @Test
    void unwrapWithoutAuthFails() {
        CreateClientInput input = vaultInput("s.wrapping", true);
        when(connector.connectVault(input)).thenReturn(vault);
        when(vault.unwrap("s.wrapping")).thenReturn(new VaultSecret());

        assertThatThrownBy(() -> clientSet().createVaultClient(input))
                .hasMessage("client set: vault unwrap: no secret auth");
    }

    @Test
    void unwrapWithoutTokenFails() {
        CreateClientInput input = vaultInput("s.wrapping", true);
        when(connector.connectVault(input)).thenReturn(vault);
        when(vault.unwrap("s.wrapping")).thenReturn(unwrapped(""));

        assertThatThrownBy(() -> clientSet().createVaultClient(input))
                .hasMessage("client set: vault unwrap: no token returned");
    }

    @Test
    void unwrapTransportFailureIsASetupError() {
        CreateClientInput input = vaultInput("s.wrapping", true);
        when(connector.connectVault(input)).thenReturn(vault);
        when(vault.unwrap("s.wrapping")).thenThrow(new IllegalStateException("permission denied"));

        assertThatThrownBy(() -> clientSet().createVaultClient(input))
                .isInstanceOf(ClientSetupException.class)
                .hasMessage("client set: vault unwrap: permission denied");
    }

    @Test
    void stopClosesEverythingOnce() {
        when(connector.connectConsul(CONSUL)).thenReturn(discovery);
        CreateClientInput input = vaultInput("s.token", false);
        when(connector.connectVault(input)).thenReturn(vault);
        ClientSet clients = clientSet();
        clients.createConsulClient(CONSUL);
        clients.createVaultClient(input);

        clients.stop();
        clients.stop();

        verify(discovery, times(1)).close();
        verify(vault, times(1)).close();
        assertThatThrownBy(clients::vault).isInstanceOf(IllegalStateException.class);
    }
}
