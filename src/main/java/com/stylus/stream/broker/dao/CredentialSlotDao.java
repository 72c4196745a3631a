package com.stylus.stream.broker.dao;

import com.stylus.stream.broker.model.CredentialSlot;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;

/**
 * Not thread safe: callers hold the broker lock.
 */
public interface CredentialSlotDao {

    @Nonnull
    Collection<CredentialSlot> getAll();

    @Nullable
    CredentialSlot getSlot(int credentialId);

    /**
     * @param providerId restricts the search to one provider, any provider when null
     * @return slot with the most spare connections (ties by lowest id), null when every candidate is full
     */
    @Nullable
    CredentialSlot findMostSpare(@Nullable String providerId);

    boolean hasProvider(@Nullable String providerId);

    int size();
}
