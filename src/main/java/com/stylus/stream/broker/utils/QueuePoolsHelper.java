package com.stylus.stream.broker.utils;

import com.stylus.stream.broker.model.ResourceKind;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Names of the wait queues: one for tuners, one per credential provider and one for credential requests
 * that accept any provider.
 */
public class QueuePoolsHelper {
    public static final String TUNER_POOL = "TUNER";
    public static final String ANY_PROVIDER = "*";
    private static final String CREDENTIAL_POOL_PREFIX = "CREDENTIAL:";

    @Nonnull
    public static String getPoolName(@Nonnull ResourceKind resourceKind, @Nullable String providerId) {
        if (resourceKind == ResourceKind.TUNER) {
            return TUNER_POOL;
        }
        return getCredentialPoolName(providerId);
    }

    @Nonnull
    public static String getCredentialPoolName(@Nullable String providerId) {
        return CREDENTIAL_POOL_PREFIX + StringUtils.defaultIfBlank(providerId, ANY_PROVIDER);
    }
}
