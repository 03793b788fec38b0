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

import dev.flyzex.bot.domain.model.AdminProfile;
import dev.flyzex.bot.domain.model.StoreState;
import dev.flyzex.bot.domain.service.StateStore.Mutation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Registry of bot admins and their optional profile metadata.
 *
 * <p>
 * Adding an existing admin merges the profile: a supplied non-blank value
 * replaces the stored one, an absent value never erases it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AdminService {

    private final StateStore stateStore;

    /**
     * Add an admin or refresh its profile.
     *
     * @return true if the admin was added or the stored profile changed
     */
    public boolean addAdmin(long userId, String username, String fullName) {
        boolean changed = stateStore.update(state -> {
            boolean added = false;
            if (!state.getAdmins().contains(userId)) {
                state.getAdmins().add(userId);
                added = true;
            }
            boolean profileChanged = mergeProfile(state, userId, clean(username), clean(fullName));
            return added || profileChanged ? Mutation.changed(true) : Mutation.unchanged(false);
        });
        if (changed) {
            log.info("[Admins] Admin {} added or updated", userId);
        }
        return changed;
    }

    /**
     * Remove an admin and its profile.
     *
     * @return false if the user was not an admin
     */
    public boolean removeAdmin(long userId) {
        boolean removed = stateStore.update(state -> {
            boolean wasAdmin = state.getAdmins().remove(Long.valueOf(userId));
            boolean hadProfile = state.getAdminProfiles().remove(userId) != null;
            return wasAdmin || hadProfile ? Mutation.changed(wasAdmin) : Mutation.unchanged(false);
        });
        if (removed) {
            log.info("[Admins] Admin {} removed", userId);
        }
        return removed;
    }

    public boolean isAdmin(long userId) {
        return stateStore.read(state -> state.getAdmins().contains(userId));
    }

    public List<Long> listAdmins() {
        return stateStore.read(state -> List.copyOf(state.getAdmins()));
    }

    /**
     * Profiles of all admins in admin-set order. Admins without stored metadata
     * get a profile carrying only the user id.
     */
    public List<AdminProfile> getAdminDetails() {
        return stateStore.read(state -> {
            List<AdminProfile> details = new ArrayList<>();
            for (Long adminId : state.getAdmins()) {
                AdminProfile profile = state.getAdminProfiles().get(adminId);
                details.add(profile != null ? profile.copy() : AdminProfile.builder().userId(adminId).build());
            }
            return details;
        });
    }

    private boolean mergeProfile(StoreState state, long userId, String username, String fullName) {
        AdminProfile existing = state.getAdminProfiles().get(userId);
        if (existing == null) {
            if (username == null && fullName == null) {
                return false;
            }
            state.getAdminProfiles().put(userId, AdminProfile.builder()
                    .userId(userId)
                    .username(username)
                    .fullName(fullName)
                    .build());
            return true;
        }

        boolean changed = false;
        if (username != null && !username.equals(existing.getUsername())) {
            existing.setUsername(username);
            changed = true;
        }
        if (fullName != null && !fullName.equals(existing.getFullName())) {
            existing.setFullName(fullName);
            changed = true;
        }
        return changed;
    }

    private static String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
