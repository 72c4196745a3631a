package com.stylus.stream.broker.service.impl;

import com.stylus.stream.broker.exceptions.StreamResolutionException;
import com.stylus.stream.broker.model.CredentialSlot;
import com.stylus.stream.broker.model.ResourceKind;
import com.stylus.stream.broker.model.StreamTarget;
import com.stylus.stream.broker.service.StreamUrlResolver;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;

/**
 * Live stream url of an Xtream-Codes provider for the login the session was granted:
 * {@code <server>/live/<username>/<password>/<streamId>.m3u8}.
 */
@Service
@RequiredArgsConstructor
public class XtreamCodesStreamUrlResolver implements StreamUrlResolver {
    static final Pair<String, String> STREAM_EXTENSION = Pair.of("xtream.stream.extension", "m3u8");

    private final ConfigurationService configurationService;

    @Nonnull
    @Override
    public ResourceKind resourceKind() {
        return ResourceKind.CREDENTIAL;
    }

    @Nonnull
    @Override
    public String resolve(@Nonnull StreamTarget target) throws StreamResolutionException {
        CredentialSlot credential = target.getCredential();
        if (credential == null) {
            throw new StreamResolutionException("no credential for session " + target.getSessionId());
        }
        if (StringUtils.isAnyBlank(credential.getServerUrl(), credential.getUsername(), credential.getPassword())) {
            throw new StreamResolutionException(String.format("credential %d of provider %s is not fully configured",
                    credential.getId(), credential.getProviderId()));
        }
        return String.format("%s/live/%s/%s/%s.%s",
                StringUtils.removeEnd(credential.getServerUrl().trim(), "/"),
                credential.getUsername(),
                credential.getPassword(),
                target.getChannelKey(),
                configurationService.getString(STREAM_EXTENSION));
    }
}
