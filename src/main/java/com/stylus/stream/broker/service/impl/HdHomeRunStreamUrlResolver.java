package com.stylus.stream.broker.service.impl;

import com.stylus.stream.broker.exceptions.StreamResolutionException;
import com.stylus.stream.broker.model.ResourceKind;
import com.stylus.stream.broker.model.StreamTarget;
import com.stylus.stream.broker.service.StreamUrlResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.net.URI;
import java.net.URISyntaxException;

/**
 * Passthrough url of the HDHomeRun http streaming endpoint: {@code http://<device>:5004/auto/v<channel>}.
 * The device picks its own free tuner; the broker only guarantees one is free.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HdHomeRunStreamUrlResolver implements StreamUrlResolver {
    static final Pair<String, String> DEVICE_URL = Pair.of("hdhomerun.url", "");
    static final Pair<String, Integer> STREAM_PORT = Pair.of("hdhomerun.stream.port", 5004);

    private final ConfigurationService configurationService;

    @Nonnull
    @Override
    public ResourceKind resourceKind() {
        return ResourceKind.TUNER;
    }

    @Nonnull
    @Override
    public String resolve(@Nonnull StreamTarget target) throws StreamResolutionException {
        String deviceUrl = configurationService.getString(DEVICE_URL);
        if (StringUtils.isBlank(deviceUrl)) {
            throw new StreamResolutionException("HDHomeRun url is not configured");
        }
        URI device;
        try {
            device = new URI(deviceUrl.trim());
        } catch (URISyntaxException e) {
            throw new StreamResolutionException("malformed HDHomeRun url: " + deviceUrl, e);
        }
        if (device.getHost() == null) {
            throw new StreamResolutionException("HDHomeRun url has no host: " + deviceUrl);
        }
        String scheme = StringUtils.defaultIfBlank(device.getScheme(), "http");
        String url = String.format("%s://%s:%d/auto/v%s", scheme, device.getHost(), configurationService.getInt(STREAM_PORT), target.getChannelKey());
        log.debug("resolved tuner {} channel {} to {}", target.getResourceId(), target.getChannelKey(), url);
        return url;
    }
}
