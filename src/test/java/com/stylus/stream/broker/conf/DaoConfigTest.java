package com.stylus.stream.broker.conf;

import com.google.common.collect.ImmutableMap;
import com.stylus.stream.broker.model.CredentialSlot;
import org.apache.commons.configuration2.MapConfiguration;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class DaoConfigTest {

    @Test
    void shouldReadCredentialSlotsOrderedById() {
        MapConfiguration configuration = new MapConfiguration(ImmutableMap.<String, Object>builder()
                .put("broker.credential.7.provider", "beta")
                .put("broker.credential.7.maxConnections", "3")
                .put("broker.credential.2.provider", "acme")
                .put("broker.credential.2.serverUrl", "http://iptv.test:8080")
                .put("broker.credential.2.username", "viewer")
                .put("broker.credential.2.password", "secret")
                .put("broker.tuner.count", "2")
                .build());

        List<CredentialSlot> slots = DaoConfig.readCredentialSlots(configuration);

        assertThat(slots)
                .extracting(CredentialSlot::getId, CredentialSlot::getProviderId, CredentialSlot::getMaxConnections)
                .containsExactly(tuple(2, "acme", 1), tuple(7, "beta", 3));
        assertThat(slots.get(0).getServerUrl()).isEqualTo("http://iptv.test:8080");
        assertThat(slots.get(0).getUsername()).isEqualTo("viewer");
        assertThat(slots.get(0).getPassword()).isEqualTo("secret");
        assertThat(slots.get(0).getActiveConnections()).isZero();
        assertThat(slots.get(1).getServerUrl()).isNull();
    }

    @Test
    void shouldSkipIncompleteCredentials() {
        MapConfiguration configuration = new MapConfiguration(ImmutableMap.<String, Object>of(
                "broker.credential.1.maxConnections", "2",
                "broker.credential.2.provider", "acme",
                "broker.credential.2.maxConnections", "0",
                "broker.credential.main.provider", "acme",
                "broker.credential.3.provider", "acme"));

        assertThat(DaoConfig.readCredentialSlots(configuration))
                .extracting(CredentialSlot::getId)
                .containsExactly(3);
    }

    @Test
    void shouldReturnNothingWithoutCredentials() {
        assertThat(DaoConfig.readCredentialSlots(new MapConfiguration(ImmutableMap.of("broker.tuner.count", "2")))).isEmpty();
    }
}
