package dev.flyzex.bot.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import dev.flyzex.bot.domain.model.AdminProfile;
import dev.flyzex.bot.domain.model.Application;
import dev.flyzex.bot.domain.model.ApplicationHistoryEntry;
import dev.flyzex.bot.domain.model.Cup;
import dev.flyzex.bot.domain.model.StoreState;
import dev.flyzex.bot.infrastructure.config.BotProperties;
import dev.flyzex.bot.port.outbound.StoragePersistenceException;
import dev.flyzex.bot.port.outbound.StoragePort;
import dev.flyzex.bot.security.StateCipher;
import dev.flyzex.bot.security.StateDecryptionException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Owner of the in-memory {@link StoreState} and of its encrypted snapshot on
 * disk.
 *
 * <p>
 * Every mutation runs under the write lock together with the full snapshot
 * write that follows it, so no two persists interleave and readers (which take
 * the read lock) never see a state that is not yet on disk. The lock is fair:
 * writers are served roughly in arrival order.
 *
 * <p>
 * If persisting fails the in-memory state is restored from the last committed
 * snapshot before the {@link StoragePersistenceException} propagates; memory
 * and disk never diverge.
 */
@Service
@Slf4j
public class StateStore {

    private final StoragePort storagePort;
    private final StateCipher cipher;
    private final String path;
    private final boolean backup;
    private final ObjectMapper snapshotMapper;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    private StoreState state = new StoreState();
    private byte[] committedSnapshot;

    public StateStore(StoragePort storagePort, StateCipher cipher, BotProperties properties) {
        this.storagePort = storagePort;
        this.cipher = cipher;
        this.path = properties.getStorage().getPath();
        this.backup = properties.getStorage().isBackup();
        this.snapshotMapper = new ObjectMapper();
        this.snapshotMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.snapshotMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Loads the snapshot. A missing or empty file means first run and leaves the
     * empty default state.
     *
     * @throws StateDecryptionException
     *             if the file exists but cannot be authenticated with the
     *             configured key; startup must not continue
     */
    @PostConstruct
    public void load() {
        lock.writeLock().lock();
        try {
            byte[] encrypted = join(storagePort.getObject(path));
            if (encrypted == null || encrypted.length == 0) {
                if (encrypted == null) {
                    join(storagePort.ensureParentDirectory(path));
                }
                log.info("[Storage] No state at {}, starting with empty state", path);
                state = new StoreState();
                committedSnapshot = serialize(state);
                return;
            }

            byte[] plaintext;
            try {
                plaintext = cipher.decrypt(encrypted);
            } catch (StateDecryptionException e) {
                log.error("[Storage] Failed to decrypt {}. Check the secret key.", path);
                throw e;
            }

            StoreState loaded = deserialize(plaintext);
            normalize(loaded);
            state = loaded;
            committedSnapshot = serialize(loaded);
            log.info("[Storage] Loaded state from {}: {} admins, {} pending applications, {} history entries",
                    path, loaded.getAdmins().size(), loaded.getApplications().size(),
                    loaded.getApplicationHistory().size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Writes the current state as a new snapshot.
     */
    public void save() {
        lock.writeLock().lock();
        try {
            persist();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Runs a read-only view over the state. The function must not retain or
     * return live references into the state.
     */
    public <T> T read(Function<StoreState, T> reader) {
        lock.readLock().lock();
        try {
            return reader.apply(state);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Applies a mutation and persists the snapshot if the mutation reports a
     * change, both under the write lock.
     *
     * @throws StoragePersistenceException
     *             if the snapshot could not be written; the mutation has been
     *             rolled back
     */
    public <T> T update(Function<StoreState, Mutation<T>> mutation) {
        lock.writeLock().lock();
        try {
            Mutation<T> result;
            try {
                result = mutation.apply(state);
            } catch (RuntimeException e) {
                rollback();
                throw e;
            }
            if (result.changed()) {
                try {
                    persist();
                } catch (RuntimeException e) {
                    log.error("[Storage] Failed to persist state, rolled back to last committed snapshot", e);
                    rollback();
                    throw e;
                }
            }
            return result.value();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void persist() {
        byte[] plaintext = serialize(state);
        byte[] token = cipher.encrypt(plaintext);
        join(storagePort.putObjectAtomic(path, token, backup));
        committedSnapshot = plaintext;
        log.debug("[Storage] Snapshot written to {}", path);
    }

    private void rollback() {
        if (committedSnapshot == null) {
            state = new StoreState();
            return;
        }
        StoreState restored = deserialize(committedSnapshot);
        normalize(restored);
        state = restored;
    }

    private byte[] serialize(StoreState value) {
        try {
            return snapshotMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize state", e);
        }
    }

    private StoreState deserialize(byte[] plaintext) {
        try {
            StoreState loaded = snapshotMapper.readValue(plaintext, StoreState.class);
            return loaded != null ? loaded : new StoreState();
        } catch (IOException e) {
            throw new IllegalStateException("State snapshot is not a valid document", e);
        }
    }

    private void normalize(StoreState loaded) {
        List<Long> admins = loaded.getAdmins() != null ? loaded.getAdmins() : List.of();
        loaded.setAdmins(new ArrayList<>(new LinkedHashSet<>(admins)));

        Map<Long, AdminProfile> profiles = orEmpty(loaded.getAdminProfiles());
        profiles.values().removeIf(profile -> profile == null);
        profiles.forEach((userId, profile) -> profile.setUserId(userId));
        loaded.setAdminProfiles(profiles);

        Map<Long, Application> applications = orEmpty(loaded.getApplications());
        applications.values().removeIf(application -> application == null);
        applications.forEach((userId, application) -> {
            application.setUserId(userId);
            application.setCreatedAt(TimestampSupport.normalize(application.getCreatedAt()));
            if (application.getResponses() == null) {
                application.setResponses(new ArrayList<>());
            }
        });
        loaded.setApplications(applications);

        Map<Long, ApplicationHistoryEntry> history = orEmpty(loaded.getApplicationHistory());
        history.values().removeIf(entry -> entry == null);
        history.values().forEach(entry -> entry.setUpdatedAt(TimestampSupport.normalize(entry.getUpdatedAt())));
        loaded.setApplicationHistory(history);

        Map<Long, Map<Long, Long>> xp = orEmpty(loaded.getXp());
        xp.replaceAll((chatId, scores) -> scores != null ? scores : new LinkedHashMap<>());
        loaded.setXp(xp);

        Map<Long, List<Cup>> cups = orEmpty(loaded.getCups());
        cups.replaceAll((chatId, list) -> list != null ? list : new ArrayList<>());
        cups.values().forEach(list -> {
            list.removeIf(cup -> cup == null);
            list.forEach(cup -> {
                cup.setCreatedAt(TimestampSupport.normalize(cup.getCreatedAt()));
                if (cup.getPodium() == null) {
                    cup.setPodium(new ArrayList<>());
                }
            });
        });
        loaded.setCups(cups);
    }

    private static <K, V> Map<K, V> orEmpty(Map<K, V> map) {
        return map != null ? map : new LinkedHashMap<>();
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new StoragePersistenceException("Storage operation failed", cause);
        }
    }

    /**
     * Result of a state mutation: the value returned to the caller and whether
     * anything changed (and therefore needs persisting).
     */
    public record Mutation<T>(T value, boolean changed) {

        public static <T> Mutation<T> changed(T value) {
            return new Mutation<>(value, true);
        }

        public static <T> Mutation<T> unchanged(T value) {
            return new Mutation<>(value, false);
        }
    }
}
