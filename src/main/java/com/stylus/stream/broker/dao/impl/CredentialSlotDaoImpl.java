package com.stylus.stream.broker.dao.impl;

import com.stylus.stream.broker.dao.CredentialSlotDao;
import com.stylus.stream.broker.model.CredentialSlot;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.TreeMap;

public class CredentialSlotDaoImpl implements CredentialSlotDao {
    private static final Comparator<CredentialSlot> MOST_SPARE_FIRST = Comparator
            .comparingInt(CredentialSlot::spareCapacity).reversed()
            .thenComparingInt(CredentialSlot::getId);

    private final TreeMap<Integer, CredentialSlot> slots = new TreeMap<>();

    public CredentialSlotDaoImpl(@Nonnull Collection<CredentialSlot> slots) {
        slots.forEach(slot -> {
            if (this.slots.putIfAbsent(slot.getId(), slot) != null) {
                throw new IllegalArgumentException("duplicated credential id: " + slot.getId());
            }
        });
    }

    @Nonnull
    @Override
    public Collection<CredentialSlot> getAll() {
        return Collections.unmodifiableCollection(slots.values());
    }

    @Nullable
    @Override
    public CredentialSlot getSlot(int credentialId) {
        return slots.get(credentialId);
    }

    @Nullable
    @Override
    public CredentialSlot findMostSpare(@Nullable String providerId) {
        return slots.values().stream()
                .filter(slot -> matches(slot, providerId))
                .filter(slot -> slot.spareCapacity() > 0)
                .min(MOST_SPARE_FIRST)
                .orElse(null);
    }

    @Override
    public boolean hasProvider(@Nullable String providerId) {
        return slots.values().stream().anyMatch(slot -> matches(slot, providerId));
    }

    @Override
    public int size() {
        return slots.size();
    }

    private static boolean matches(@Nonnull CredentialSlot slot, @Nullable String providerId) {
        return StringUtils.isBlank(providerId) || providerId.equals(slot.getProviderId());
    }
}
