package com.krickert.yappy.watch.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.krickert.yappy.watch.consul.KvExistsGetQuery;
import com.krickert.yappy.watch.consul.KvLookup;
import com.krickert.yappy.watch.consul.model.KeyPair;
import com.krickert.yappy.watch.dependency.FetchResult;
import com.krickert.yappy.watch.dependency.ResponseMetadata;
import com.krickert.yappy.watch.exception.ResultCodecException;
import com.krickert.yappy.watch.vault.VaultSecret;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FetchResultCodecTest {

    private final FetchResultCodec codec = new FetchResultCodec(ResultTypeRegistry.defaults());

    @Test
    void keyPairSurvivesTheCache() {
        KeyPair pair = new KeyPair("config/app", "config/app", "on", true, 3, 9, 0, 42, "");
        FetchResult<KeyPair> result = FetchResult.of(pair, new ResponseMetadata(9, Duration.ofMillis(15)));

        byte[] bytes = codec.encode(new KvExistsGetQuery(KvLookup.of("config/app")), result);
        FetchResult<KeyPair> decoded = codec.decode(bytes, "kv.exists.get");

        assertThat(decoded.value()).isEqualTo(pair);
        assertThat(decoded.metadata().lastIndex()).isEqualTo(9);
        assertThat(decoded.metadata().lastContact()).isEqualTo(Duration.ofMillis(15));
    }

    @Test
    void vaultSecretKeepsItsSnakeCaseFields() {
        VaultSecret secret = new VaultSecret();
        secret.setLeaseId("database/creds/app/1");
        secret.setLeaseDuration(60);
        secret.setRenewable(true);
        secret.setData(Map.of("username", "app"));

        byte[] bytes = codec.encode("vault.read", FetchResult.of(secret, new ResponseMetadata(1, Duration.ZERO)));
        String json = new String(bytes, StandardCharsets.UTF_8);
        VaultSecret decoded = codec.<VaultSecret>decode(bytes, "vault.read").value();

        assertThat(json).contains("\"lease_id\":\"database/creds/app/1\"");
        assertThat(decoded).isEqualTo(secret);
    }

    @Test
    void optionalValueIsUnwrappedOnTheWire() {
        byte[] bytes = codec.encode("kv.get", FetchResult.of(Optional.of("on"), new ResponseMetadata(4, Duration.ZERO)));

        assertThat(new String(bytes, StandardCharsets.UTF_8)).contains("\"value\":\"on\"");
        assertThat(codec.decode(bytes).value()).isEqualTo(Optional.of("on"));
        assertThat(codec.<Optional<String>>decode(bytes, "kv.get").value()).contains("on");
    }

    @Test
    void missingKeyComesBackAsEmptyOptional() {
        byte[] bytes = codec.encode("kv.get", FetchResult.of(Optional.empty(), new ResponseMetadata(5, Duration.ZERO)));

        FetchResult<Optional<String>> decoded = codec.decode(bytes, "kv.get");

        assertThat(decoded.value()).isEmpty();
        assertThat(decoded.metadata().lastIndex()).isEqualTo(5);
    }

    @Test
    void optionalSupportComesFromTheCodecMapper() {
        ResultTypeRegistry registry = ResultTypeRegistry.builder()
                .register("kv.get", new TypeReference<Optional<String>>() { })
                .build();
        FetchResultCodec custom = new FetchResultCodec(registry,
                new ObjectMapper().registerModule(new Jdk8Module()));
        byte[] bytes = custom.encode("kv.get", FetchResult.of(Optional.of("v1"), new ResponseMetadata(2, Duration.ZERO)));

        assertThat(custom.decode(bytes).value()).isEqualTo(Optional.of("v1"));
    }

    @Test
    void unregisteredKindIsRefusedOnEncode() {
        FetchResult<String> result = FetchResult.of("x", new ResponseMetadata(1, Duration.ZERO));

        assertThatThrownBy(() -> codec.encode("exec.command", result)).isInstanceOf(ResultCodecException.class);
    }

    @Test
    void unregisteredKindIsRefusedOnDecode() {
        byte[] forged = "{\"kind\":\"exec.command\",\"value\":\"rm -rf /\",\"lastIndex\":1,\"lastContactMillis\":0}"
                .getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> codec.decode(forged)).isInstanceOf(ResultCodecException.class);
    }

    @Test
    void kindMismatchIsRefused() {
        byte[] bytes = codec.encode("kv.keys", FetchResult.of(List.of("a"), new ResponseMetadata(1, Duration.ZERO)));

        assertThatThrownBy(() -> codec.decode(bytes, "kv.list"))
                .isInstanceOf(ResultCodecException.class)
                .hasMessage("Expected a result of kind 'kv.list' but found 'kv.keys'");
    }

    @Test
    void garbageIsACodecFailure() {
        assertThatThrownBy(() -> codec.decode("not json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(ResultCodecException.class);
    }

    @Test
    void registryRejectsDuplicateKinds() {
        ResultTypeRegistry.Builder builder = ResultTypeRegistry.builder()
                .register("file", new TypeReference<String>() { });

        assertThatThrownBy(() -> builder.register("file", new TypeReference<String>() { }))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void kindIsThePrefixBeforeTheParenthesis() {
        assertThat(ResultTypeRegistry.kindOf("kv.exists.get(config/app@dc1)")).isEqualTo("kv.exists.get");
        assertThat(ResultTypeRegistry.kindOf("catalog.datacenters")).isEqualTo("catalog.datacenters");
        assertThat(ResultTypeRegistry.defaults().kinds()).contains("health.service");
    }
}
