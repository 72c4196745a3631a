package com.stylus.stream.broker.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ImmutableConfiguration;
import org.apache.commons.configuration2.MapConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.builder.ReloadingFileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.FileBasedBuilderParameters;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.convert.DefaultListDelimiterHandler;
import org.apache.commons.configuration2.reloading.PeriodicReloadingTrigger;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.EnumerablePropertySource;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.io.File;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Spring environment, overlaid by an optional periodically reloaded properties file, overlaid by runtime updates.
 * Thresholds are read on every use, so a reload takes effect on the next request or sweep.
 */
@Slf4j
@Service
public class ConfigurationService implements Supplier<ImmutableConfiguration> {
    private final Configuration mainConfiguration;
    private final Configuration updatingConfiguration;
    private volatile ImmutableConfiguration reloadedConfiguration = null;
    private volatile ImmutableConfiguration compositeConfiguration;
    @Nullable
    private final ReloadingFileBasedConfigurationBuilder<PropertiesConfiguration> configurationBuilder;
    @Nullable
    private final PeriodicReloadingTrigger trigger;
    private final AtomicInteger errorCounter = new AtomicInteger();
    private final ScheduledExecutorService executorService = Executors.newSingleThreadScheduledExecutor(new BasicThreadFactory.Builder()
            .namingPattern("broker-configuration-%d")
            .daemon(true)
            .build());
    private final long reloadPeriodMillis;

    public ConfigurationService(ConfigurableEnvironment env,
                                @Value("${reload.config.location:}") String path,
                                @Value("${reload.config.period.millis:5000}") long reloadPeriodMillis) {
        Map<String, String> propertyMap = StreamSupport.stream(env.getPropertySources().spliterator(), false)
                .filter(ps -> ps instanceof EnumerablePropertySource)
                .map(ps -> ((EnumerablePropertySource<?>) ps).getPropertyNames())
                .flatMap(Arrays::stream)
                .distinct()
                .filter(name -> env.getProperty(name) != null)
                .collect(Collectors.toMap(Function.identity(), env::getProperty));
        this.mainConfiguration = new MapConfiguration(propertyMap);
        this.updatingConfiguration = new MapConfiguration(new ConcurrentHashMap<>());
        this.compositeConfiguration = new CompositeConfiguration(mainConfiguration, Collections.singleton(updatingConfiguration));
        this.configurationBuilder = createBuilder(path);
        this.reloadPeriodMillis = reloadPeriodMillis;
        this.trigger = this.configurationBuilder != null ? new PeriodicReloadingTrigger(configurationBuilder.getReloadingController(),
                null, reloadPeriodMillis, TimeUnit.MILLISECONDS) : null;
    }

    @Nullable
    private static ReloadingFileBasedConfigurationBuilder<PropertiesConfiguration> createBuilder(@Nullable String path) {
        if (StringUtils.isBlank(path)) {
            log.info("No reloadable properties configured");
            return null;
        }
        File file = new File(path);
        if (!file.isFile()) {
            log.warn("Reloadable properties file doesn't exist, path: {}", path);
            return null;
        }
        try {
            FileBasedBuilderParameters parameters = new Parameters().fileBased()
                    .setFile(file)
                    .setListDelimiterHandler(new DefaultListDelimiterHandler(','));
            return new ReloadingFileBasedConfigurationBuilder<>(PropertiesConfiguration.class).configure(parameters);
        } catch (Exception e) {
            log.error("Can't setup reloadable properties, path: {}", path, e);
            return null;
        }
    }

    @PostConstruct
    private void init() {
        if (trigger != null) {
            trigger.start();
            executorService.scheduleWithFixedDelay(this::get, reloadPeriodMillis, reloadPeriodMillis, TimeUnit.MILLISECONDS);
            log.info("reloading trigger started");
        }
    }

    @Override
    public ImmutableConfiguration get() {
        ImmutableConfiguration compositeConfiguration = this.compositeConfiguration;
        if (configurationBuilder == null) {
            return compositeConfiguration;
        }
        PropertiesConfiguration newConfiguration;
        try {
            newConfiguration = configurationBuilder.getConfiguration();
        } catch (Exception e) {
            if (this.errorCounter.getAndIncrement() % 100 == 0) {
                log.error("Can't get reloading configuration", e);
            }
            return compositeConfiguration;
        }

        if (newConfiguration == null) {
            return compositeConfiguration;
        }

        ImmutableConfiguration lastReloaded = this.reloadedConfiguration;
        if (lastReloaded != null && lastReloaded == newConfiguration) {
            return compositeConfiguration;
        }

        // runtime updates win over the file, the file wins over the environment
        compositeConfiguration = new CompositeConfiguration(mainConfiguration, Arrays.asList(updatingConfiguration, newConfiguration));
        this.reloadedConfiguration = newConfiguration;
        this.compositeConfiguration = compositeConfiguration;

        if (lastReloaded != null) {
            Stream.concat(keys(lastReloaded), keys(newConfiguration))
                    .distinct()
                    .forEach(key -> {
                        Object oldValue = lastReloaded.getProperty(key);
                        Object newValue = newConfiguration.getProperty(key);
                        if (!Objects.equals(oldValue, newValue)) {
                            log.info("config change for key: {} from : {}, to: {}", key, oldValue, newValue);
                        }
                    });
        }
        return compositeConfiguration;
    }

    public long getLong(@Nonnull Pair<String, Long> property) {
        return get().getLong(property.getKey(), property.getValue());
    }

    public int getInt(@Nonnull Pair<String, Integer> property) {
        return get().getInt(property.getKey(), property.getValue());
    }

    public boolean getBoolean(@Nonnull Pair<String, Boolean> property) {
        return get().getBoolean(property.getKey(), property.getValue());
    }

    @Nonnull
    public String getString(@Nonnull Pair<String, String> property) {
        return get().getString(property.getKey(), property.getValue());
    }

    public void update(Consumer<Configuration> configurationConsumer) {
        configurationConsumer.accept(updatingConfiguration);
    }

    private Stream<String> keys(ImmutableConfiguration configuration) {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(configuration.getKeys(),
                Spliterator.DISTINCT | Spliterator.NONNULL | Spliterator.IMMUTABLE), false);
    }

    @PreDestroy
    private void shutdown() {
        if (trigger != null) {
            trigger.shutdown(false);
        }
        executorService.shutdownNow();
    }
}
