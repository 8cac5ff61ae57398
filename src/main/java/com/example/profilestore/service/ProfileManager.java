package com.example.profilestore.service;

import com.example.profilestore.config.ProfileStoreProperties;
import com.example.profilestore.profile.OwnerHandle;
import com.example.profilestore.profile.Profile;
import com.example.profilestore.profile.ProfileStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the profiles this process holds, at most one per owner id.
 * <p>
 * attach() loads (blocking on the session lock), reconciles and schedules autosave.
 * detach() cancels a pending load or releases the lock with a final save. An owner is not
 * loaded again until its previous load or release has finished.
 */
@Service
public class ProfileManager {

    private static final Logger logger = LoggerFactory.getLogger(ProfileManager.class);

    private final ProfileStore store;
    private final AutosaveScheduler autosave;
    private final boolean reconcileOnLoad;

    private final Map<String, OwnerHandle> owners = new ConcurrentHashMap<>();
    private final Map<String, Profile> profiles = new ConcurrentHashMap<>();
    // owners with a load or release in flight; guarded by this
    private final Set<String> busy = new HashSet<>();

    public ProfileManager(ProfileStore store, AutosaveScheduler autosave, ProfileStoreProperties properties) {
        this.store = store;
        this.autosave = autosave;
        this.reconcileOnLoad = properties.isReconcileOnLoad();
    }

    /**
     * @throws IllegalStateException while an earlier load or release of the same owner is still running
     */
    public Profile attach(String ownerId) {
        OwnerHandle handle = new OwnerHandle(ownerId);
        synchronized (this) {
            Profile live = profiles.get(ownerId);
            if (live != null) {
                return live;
            }
            if (!busy.add(ownerId)) {
                throw new IllegalStateException("Profile " + ownerId + " is still being loaded or released");
            }
            owners.put(ownerId, handle);
        }

        Profile profile;
        try {
            profile = store.load(handle);
            if (reconcileOnLoad) {
                profile.reconcile();
            }
        } catch (RuntimeException e) {
            synchronized (this) {
                owners.remove(ownerId, handle);
                busy.remove(ownerId);
            }
            throw e;
        }

        boolean cancelled;
        synchronized (this) {
            cancelled = owners.get(ownerId) != handle;
            if (!cancelled) {
                autosave.schedule(profile);
                profiles.put(ownerId, profile);
                busy.remove(ownerId);
            }
        }
        if (cancelled) {
            logger.info("Owner {} detached while its profile was loading; releasing", ownerId);
            releaseAndClear(ownerId, profile);
            return profile;
        }
        logger.info("Attached profile {} (state={}, new={})", ownerId, profile.getState(), profile.isNew());
        return profile;
    }

    /**
     * @return true if the owner was attached or loading
     */
    public boolean detach(String ownerId) {
        OwnerHandle handle;
        Profile profile;
        synchronized (this) {
            handle = owners.remove(ownerId);
            profile = profiles.remove(ownerId);
            if (profile != null) {
                busy.add(ownerId);
            }
        }
        if (handle != null) {
            handle.detach();
        }
        if (profile == null) {
            return handle != null;
        }
        releaseAndClear(ownerId, profile);
        logger.info("Detached profile {}", ownerId);
        return true;
    }

    public Optional<Profile> find(String ownerId) {
        return ownerId == null ? Optional.empty() : Optional.ofNullable(profiles.get(ownerId));
    }

    public Collection<Profile> liveProfiles() {
        return List.copyOf(profiles.values());
    }

    public ProfileStore getStore() {
        return store;
    }

    private void releaseAndClear(String ownerId, Profile profile) {
        try {
            store.release(profile);
        } finally {
            synchronized (this) {
                busy.remove(ownerId);
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        List<String> ids = new ArrayList<>(owners.keySet());
        if (!ids.isEmpty()) {
            logger.info("Releasing {} profile(s) on shutdown", ids.size());
        }
        for (String id : ids) {
            try {
                detach(id);
            } catch (RuntimeException e) {
                logger.error("Failed to release profile {} on shutdown", id, e);
            }
        }
    }
}
