package com.example.profilestore.profile;

import com.example.profilestore.model.ProfileMetadata;
import com.example.profilestore.model.SessionData;
import com.example.profilestore.store.RemoteStore;
import com.example.profilestore.store.StoreRetrier;
import com.example.profilestore.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads and saves profiles for one configured store.
 * <p>
 * Load protocol:
 *  1) Read the latest version id from the owner's ledger.
 *  2) No version: new profile, claim it and save immediately.
 *  3) Otherwise fetch and decode that version and inspect its session lock.
 *  4) Lock held by another live process: wait one check interval on the owner handle and
 *     start over. Free, own or abandoned: stamp our lock and save immediately.
 * Any store or decode failure, or the owner detaching first, leaves the profile DEGRADED:
 * a template document that is never written.
 * <p>
 * Save protocol (append-only):
 *  1) Write the document under a new, monotonically increasing version id.
 *  2) Append that id to the ledger. A failed append orphans the document, so the profile
 *     is degraded rather than trusting later reads.
 */
public class ProfileStore {

    private static final Logger logger = LoggerFactory.getLogger(ProfileStore.class);

    private final RemoteStore remote;
    private final ProfileOptions options;
    private final ProfileCodec codec;
    private final SaveSink sink;
    private final Clock clock;
    private final SessionLock sessionLock;
    private final StoreRetrier retrier;

    public ProfileStore(RemoteStore remote,
                        ProfileOptions options,
                        ProfileCodec codec,
                        SaveSink sink,
                        Clock clock,
                        String serverToken) {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.options = Objects.requireNonNull(options, "options");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.sink = sink == null ? SaveSink.NONE : sink;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sessionLock = new SessionLock(Objects.requireNonNull(serverToken, "serverToken"), options.getSessionLockTimeout());
        this.retrier = new StoreRetrier(options.getMaxConnectionAttempts(), options.getMaxConnectionAttemptDelay());
    }

    public ProfileOptions getOptions() {
        return options;
    }

    public String getServerToken() {
        return sessionLock.getOwnerToken();
    }

    public VersionLedger ledgerFor(String ownerId) {
        return new VersionLedger(remote, retrier, options.getStoreName(), options.getStoreVersion(), ownerId);
    }

    public Map<String, Object> newTemplate(String ownerId) {
        return DocumentPaths.copyMap(options.getTemplate().create(ownerId));
    }

    /**
     * Acquire the owner's session lock and load its document. Blocks while another process
     * holds the lock; detaching {@code owner} aborts the wait.
     */
    public Profile load(OwnerHandle owner) {
        Objects.requireNonNull(owner, "owner");
        String ownerId = owner.getOwnerId();
        long now = clock.millis();
        Profile profile = new Profile(ownerId, this, freshMetadata(ownerId, now), options.getKeysToIgnore());

        if (!options.persistenceActive()) {
            logger.info("Persistence disabled; profile {} runs from its template", ownerId);
            profile.setState(LockState.DEGRADED);
            return profile;
        }

        profile.setState(LockState.ACQUIRING);
        VersionLedger ledger = ledgerFor(ownerId);
        SessionLock.Acquisition acquisition = sessionLock.begin(clock.millis());

        while (true) {
            if (owner.isDetached()) {
                return degrade(profile, "owner detached before the lock was acquired");
            }

            Optional<Long> latest;
            ProfileMetadata existing = null;
            try {
                latest = ledger.latestVersion();
                if (latest.isPresent()) {
                    long version = latest.get();
                    existing = codec.decode(retrier.call("get " + ledger.documentsName() + "/" + version,
                            () -> remote.get(ledger.documentsName(), Long.toString(version)).orElse(null)));
                }
            } catch (StoreUnavailableException | ProfileDecodeException e) {
                return degrade(profile, e.getMessage());
            }

            if (latest.isEmpty()) {
                ProfileMetadata fresh = freshMetadata(ownerId, clock.millis());
                fresh.setSessions(1);
                profile.claim(fresh, true, 0L);
                logger.info("Profile {} is new", ownerId);
                break;
            }

            SessionLock.Verdict verdict = acquisition.inspect(existing.getSessionData(), clock.millis());
            if (verdict == SessionLock.Verdict.HELD) {
                logger.debug("Profile {} is locked by {}; checking again in {}",
                        ownerId, existing.getSessionData().getOwnerToken(), options.getSessionCheckInterval());
                if (owner.awaitDetached(options.getSessionCheckInterval())) {
                    return degrade(profile, "owner detached while waiting for the session lock");
                }
                continue;
            }
            if (verdict == SessionLock.Verdict.ABANDONED) {
                logger.warn("Profile {} lock held by {} looks abandoned; taking it over",
                        ownerId, existing.getSessionData().getOwnerToken());
            }
            existing.setSessions(existing.getSessions() + 1);
            profile.claim(existing, false, latest.get());
            break;
        }

        profile.setState(LockState.LOCKED);
        if (!save(profile, false)) {
            return degrade(profile, "could not publish the session lock");
        }
        logger.info("Acquired session lock for profile {} (sessions={})", ownerId, profile.getSessions());
        return profile;
    }

    /**
     * Write the profile as a new version. With {@code releaseSession} the written version
     * carries no lock, so the next loader can claim it without waiting out the timeout.
     * Regular saves need {@code LOCKED}; release saves need {@code RELEASING}.
     *
     * @return true if both the document and its ledger entry were written
     */
    public boolean save(Profile profile, boolean releaseSession) {
        if (!options.persistenceActive()) return false;
        synchronized (profile.saveMonitor()) {
            LockState state = profile.getState();
            boolean writable = releaseSession
                    ? state == LockState.RELEASING
                    : state == LockState.LOCKED;
            if (!writable) {
                return false;
            }
            String ownerId = profile.getOwnerId();
            long now = clock.millis();
            long version = Math.max(now, profile.lastVersion() + 1);
            SessionData lock = releaseSession ? null : sessionLock.stamp(now);

            String payload;
            try {
                payload = codec.encode(profile.snapshotForSave(lock, now));
            } catch (IllegalArgumentException e) {
                logger.error("Profile {} could not be serialized; save skipped", ownerId, e);
                return false;
            }

            VersionLedger ledger = ledgerFor(ownerId);
            try {
                retrier.run("put " + ledger.documentsName() + "/" + version,
                        () -> remote.put(ledger.documentsName(), Long.toString(version), payload));
            } catch (StoreUnavailableException e) {
                logger.warn("Save of profile {} failed; in-memory data kept: {}", ownerId, e.getMessage());
                return false;
            }

            try {
                ledger.append(version);
            } catch (StoreUnavailableException e) {
                logger.error("Profile {} version {} was written but could not be appended to {}; disabling persistence",
                        ownerId, version, ledger.ledgerName(), e);
                profile.setState(LockState.DEGRADED);
                return false;
            }

            profile.markSaved(now, version, lock);
            logger.debug("Saved profile {} as version {}{}", ownerId, version, releaseSession ? " (released)" : "");
            profile.events().fireSaved(profile.get());
            try {
                sink.forward(ownerId, version, payload);
            } catch (RuntimeException e) {
                logger.warn("Forwarding profile {} version {} failed: {}", ownerId, version, e.getMessage());
            }
            return true;
        }
    }

    /**
     * Release the session lock: final save without a lock stamp, then UNLOCKED.
     * A degraded profile only runs its teardown.
     */
    public boolean release(Profile profile) {
        profile.teardown().run();
        boolean saved;
        // No locked version may follow the release version.
        synchronized (profile.saveMonitor()) {
            if (profile.getState() != LockState.LOCKED) {
                return false;
            }
            profile.setState(LockState.RELEASING);
            saved = save(profile, true);
            if (profile.getState() == LockState.RELEASING) {
                profile.setState(LockState.UNLOCKED);
            }
        }
        if (saved) {
            logger.info("Released session lock for profile {}", profile.getOwnerId());
        } else {
            logger.warn("Release save failed for profile {}; lock will expire after {}",
                    profile.getOwnerId(), options.getSessionLockTimeout());
        }
        return saved;
    }

    private Profile degrade(Profile profile, String reason) {
        logger.warn("Profile {} degraded to an in-memory template: {}", profile.getOwnerId(), reason);
        profile.claim(freshMetadata(profile.getOwnerId(), clock.millis()), true, 0L);
        profile.setState(LockState.DEGRADED);
        return profile;
    }

    private ProfileMetadata freshMetadata(String ownerId, long now) {
        return ProfileMetadata.builder()
                .data(newTemplate(ownerId))
                .created(now)
                .lastSeen(now)
                .sessions(0)
                .build();
    }
}
