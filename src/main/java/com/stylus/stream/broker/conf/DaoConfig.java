package com.stylus.stream.broker.conf;

import com.google.common.collect.Streams;
import com.stylus.stream.broker.dao.CredentialSlotDao;
import com.stylus.stream.broker.dao.SessionDao;
import com.stylus.stream.broker.dao.TunerDao;
import com.stylus.stream.broker.dao.WaitQueueDao;
import com.stylus.stream.broker.dao.impl.CredentialSlotDaoImpl;
import com.stylus.stream.broker.dao.impl.SessionDaoImpl;
import com.stylus.stream.broker.dao.impl.TunerDaoImpl;
import com.stylus.stream.broker.dao.impl.WaitQueueDaoImpl;
import com.stylus.stream.broker.model.CredentialSlot;
import com.stylus.stream.broker.service.impl.ConfigurationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.configuration2.ImmutableConfiguration;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The resource registry is fixed at startup: tuner count and provider logins are read once.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class DaoConfig {
    public static final Pair<String, Integer> TUNER_COUNT = Pair.of("broker.tuner.count", 0);
    public static final String CREDENTIAL_PREFIX = "broker.credential";

    private final ConfigurationService configurationService;

    @Bean
    public TunerDao tunerDao(Clock clock) {
        int count = configurationService.getInt(TUNER_COUNT);
        if (count < 0) {
            throw new IllegalStateException("negative tuner count: " + count);
        }
        log.info("{} tuners configured", count);
        return new TunerDaoImpl(count, clock.millis());
    }

    @Bean
    public CredentialSlotDao credentialSlotDao() {
        List<CredentialSlot> slots = readCredentialSlots(configurationService.get());
        log.info("{} provider credentials configured: {}", slots.size(), slots);
        return new CredentialSlotDaoImpl(slots);
    }

    @Bean
    public SessionDao sessionDao() {
        return new SessionDaoImpl();
    }

    @Bean
    public WaitQueueDao waitQueueDao() {
        return new WaitQueueDaoImpl();
    }

    /**
     * Reads {@code broker.credential.<id>.provider|maxConnections|serverUrl|username|password}.
     */
    @Nonnull
    static List<CredentialSlot> readCredentialSlots(@Nonnull ImmutableConfiguration configuration) {
        return Streams.stream(configuration.getKeys(CREDENTIAL_PREFIX))
                .map(key -> StringUtils.substringBefore(StringUtils.removeStart(key, CREDENTIAL_PREFIX + "."), "."))
                .filter(StringUtils::isNumeric)
                .distinct()
                .map(id -> toCredentialSlot(configuration, Integer.parseInt(id)))
                .filter(Objects::nonNull)
                .sorted((a, b) -> Integer.compare(a.getId(), b.getId()))
                .collect(Collectors.toList());
    }

    private static CredentialSlot toCredentialSlot(@Nonnull ImmutableConfiguration configuration, int id) {
        String prefix = String.join(".", CREDENTIAL_PREFIX, String.valueOf(id), "");
        String providerId = configuration.getString(prefix + "provider", null);
        int maxConnections = configuration.getInt(prefix + "maxConnections", 1);
        if (StringUtils.isBlank(providerId) || maxConnections <= 0) {
            log.warn("Skip credential {}: provider=[{}], maxConnections={}", id, providerId, maxConnections);
            return null;
        }
        return CredentialSlot.builder()
                .id(id)
                .providerId(providerId)
                .maxConnections(maxConnections)
                .serverUrl(configuration.getString(prefix + "serverUrl", null))
                .username(configuration.getString(prefix + "username", null))
                .password(configuration.getString(prefix + "password", null))
                .build();
    }
}
