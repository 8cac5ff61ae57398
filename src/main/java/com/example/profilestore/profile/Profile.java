package com.example.profilestore.profile;

import com.example.profilestore.model.ProfileMetadata;
import com.example.profilestore.model.SessionData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One owner's document plus its session and version metadata.
 * <p>
 * Paths are dot-separated keys into nested maps ({@code "inventory.weapons"}). A final
 * {@code ++} segment appends to the list at the parent path; a final {@code --} segment
 * removes the 1-based index given as value. Every mutation returns false instead of
 * throwing when the path does not fit the document.
 * <p>
 * Mutations are serialized on the profile monitor. Reads return copies.
 */
public class Profile {

    private static final Logger logger = LoggerFactory.getLogger(Profile.class);

    private final String ownerId;
    private final ProfileStore store;
    private final ProfileEvents events;
    private final Teardown teardown = new Teardown();
    private final Set<String> keysToIgnore = ConcurrentHashMap.newKeySet();
    private final Object saveMonitor = new Object();

    private ProfileMetadata metadata;
    private volatile LockState state = LockState.UNLOCKED;
    private volatile boolean isNew = true;
    private volatile long lastSave;
    private long lastVersion;

    Profile(String ownerId, ProfileStore store, ProfileMetadata initial, Collection<String> ignored) {
        this.ownerId = ownerId;
        this.store = store;
        this.events = new ProfileEvents(ownerId);
        this.metadata = initial;
        this.keysToIgnore.addAll(ignored);
    }

    // ---- reads -------------------------------------------------------------

    public String getOwnerId() {
        return ownerId;
    }

    public synchronized Map<String, Object> get() {
        return DocumentPaths.copyMap(metadata.getData());
    }

    public synchronized Object get(String path) {
        if (path == null) return get();
        List<String> segments = DocumentPaths.split(path);
        if (segments == null) return null;
        return DocumentPaths.deepCopy(DocumentPaths.resolve(metadata.getData(), segments));
    }

    public ProfileOptions getStoreOptions() {
        return store.getOptions();
    }

    public ProfileEvents events() {
        return events;
    }

    public Teardown teardown() {
        return teardown;
    }

    public LockState getState() {
        return state;
    }

    public boolean isNew() {
        return isNew;
    }

    public boolean isPersistenceEnabled() {
        return state != LockState.DEGRADED;
    }

    public synchronized long getSessions() {
        return metadata.getSessions();
    }

    public synchronized long getCreated() {
        return metadata.getCreated();
    }

    public synchronized long getLastSeen() {
        return metadata.getLastSeen();
    }

    public synchronized SessionData getSessionData() {
        SessionData lock = metadata.getSessionData();
        return lock == null ? null : new SessionData(lock.getLastUpdate(), lock.getOwnerToken());
    }

    public long getLastSave() {
        return lastSave;
    }

    public Set<String> getKeysToIgnore() {
        return Collections.unmodifiableSet(keysToIgnore);
    }

    /**
     * Keep {@code key} in memory but exclude it from every future save.
     */
    public void ignoreKey(String key) {
        if (key != null && !key.isBlank()) {
            keysToIgnore.add(key);
        }
    }

    // ---- mutations ---------------------------------------------------------

    public boolean set(String path, Object value) {
        Map<String, Object> changed;
        synchronized (this) {
            if (!applySet(path, value)) return false;
            changed = get();
        }
        events.fireChanged(changed);
        return true;
    }

    /**
     * Apply several {@link #set} calls and fire one change event.
     *
     * @return true if every entry was applied
     */
    public boolean setMultiple(Map<String, Object> values) {
        if (values == null || values.isEmpty()) return false;
        boolean all = true;
        boolean any = false;
        Map<String, Object> changed = null;
        synchronized (this) {
            for (Map.Entry<String, Object> e : values.entrySet()) {
                boolean ok = applySet(e.getKey(), e.getValue());
                all &= ok;
                any |= ok;
            }
            if (any) changed = get();
        }
        if (changed != null) events.fireChanged(changed);
        return all;
    }

    public boolean insert(String path, Object value) {
        Map<String, Object> changed;
        synchronized (this) {
            List<Object> list = listAt(path);
            if (list == null) return false;
            list.add(DocumentPaths.deepCopy(value));
            changed = get();
        }
        events.fireChanged(changed);
        return true;
    }

    public boolean removeValue(String path, Object value) {
        return removeValues(path, List.of(value));
    }

    /**
     * Remove the first element equal to each of {@code values} and fire one change event.
     *
     * @return true if anything was removed
     */
    public boolean removeValues(String path, Collection<?> values) {
        if (values == null) return false;
        Map<String, Object> changed;
        synchronized (this) {
            List<Object> list = listAt(path);
            if (list == null) return false;
            boolean removed = false;
            for (Object v : values) {
                for (int i = 0; i < list.size(); i++) {
                    if (DocumentPaths.sameValue(list.get(i), v)) {
                        list.remove(i);
                        removed = true;
                        break;
                    }
                }
            }
            if (!removed) return false;
            changed = get();
        }
        events.fireChanged(changed);
        return true;
    }

    public boolean increment(String path, Number delta) {
        if (delta == null) return false;
        Map<String, Object> changed;
        synchronized (this) {
            List<String> segments = DocumentPaths.split(path);
            if (segments == null) return false;
            Map<String, Object> parent = parentOf(segments);
            if (parent == null) return false;
            String key = segments.get(segments.size() - 1);
            Object current = parent.get(key);
            if (!(current instanceof Number)) {
                logger.debug("increment({}) on profile {} rejected: value is {}", path, ownerId, current);
                return false;
            }
            Number sum = DocumentPaths.add((Number) current, delta);
            if (sum == null) {
                logger.debug("increment({}) on profile {} rejected: {} + {} overflows", path, ownerId, current, delta);
                return false;
            }
            parent.put(key, sum);
            changed = get();
        }
        events.fireChanged(changed);
        return true;
    }

    /**
     * Add every template key the document lacks. Existing values are kept and extra keys
     * are never removed.
     *
     * @return true if anything was added
     */
    public boolean reconcile() {
        Map<String, Object> template = store.newTemplate(ownerId);
        Map<String, Object> changed;
        synchronized (this) {
            if (!DocumentPaths.mergeMissing(metadata.getData(), template)) return false;
            changed = get();
        }
        logger.debug("Reconciled profile {} against its template", ownerId);
        events.fireChanged(changed);
        return true;
    }

    public void reset() {
        Map<String, Object> fresh = store.newTemplate(ownerId);
        Map<String, Object> changed;
        synchronized (this) {
            metadata.setData(fresh);
            changed = get();
        }
        events.fireChanged(changed);
    }

    // ---- persistence -------------------------------------------------------

    public boolean save() {
        return store.save(this, false);
    }

    public boolean isDue(long now) {
        return state == LockState.LOCKED && now - lastSave >= store.getOptions().getSaveInterval().toMillis();
    }

    Object saveMonitor() {
        return saveMonitor;
    }

    long lastVersion() {
        return lastVersion;
    }

    void setState(LockState state) {
        this.state = state;
    }

    synchronized void claim(ProfileMetadata loaded, boolean isNew, long version) {
        this.metadata = loaded;
        this.isNew = isNew;
        this.lastVersion = version;
    }

    /**
     * Metadata to persist: data minus ignored keys, stamped with {@code lock} and {@code now}.
     */
    synchronized ProfileMetadata snapshotForSave(SessionData lock, long now) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : metadata.getData().entrySet()) {
            if (!keysToIgnore.contains(e.getKey())) {
                data.put(e.getKey(), DocumentPaths.deepCopy(e.getValue()));
            }
        }
        return metadata.toBuilder()
                .data(data)
                .lastSeen(now)
                .sessionData(lock)
                .build();
    }

    synchronized void markSaved(long now, long version, SessionData lock) {
        metadata.setLastSeen(now);
        metadata.setSessionData(lock);
        lastSave = now;
        lastVersion = version;
    }

    // ---- internals ---------------------------------------------------------

    private boolean applySet(String path, Object value) {
        List<String> segments = DocumentPaths.split(path);
        if (segments == null) return false;
        String last = segments.get(segments.size() - 1);

        if (DocumentPaths.APPEND.equals(last) || DocumentPaths.REMOVE_INDEX.equals(last)) {
            List<String> listPath = segments.subList(0, segments.size() - 1);
            List<Object> list = listPath.isEmpty()
                    ? null
                    : DocumentPaths.asList(DocumentPaths.resolve(metadata.getData(), listPath));
            if (list == null || value == null) return false;
            if (DocumentPaths.APPEND.equals(last)) {
                list.add(DocumentPaths.deepCopy(value));
                return true;
            }
            Long index = value instanceof Number ? DocumentPaths.wholeNumber((Number) value) : null;
            if (index == null || index < 1 || index > list.size()) return false;
            list.remove(index.intValue() - 1);
            return true;
        }

        Map<String, Object> parent = parentOf(segments);
        if (parent == null) {
            logger.debug("set({}) on profile {} rejected: parent is not a map", path, ownerId);
            return false;
        }
        if (value == null) {
            parent.remove(last);
        } else {
            parent.put(last, DocumentPaths.deepCopy(value));
        }
        return true;
    }

    private Map<String, Object> parentOf(List<String> segments) {
        if (segments.size() == 1) return metadata.getData();
        return DocumentPaths.asMap(DocumentPaths.resolve(metadata.getData(), segments.subList(0, segments.size() - 1)));
    }

    private List<Object> listAt(String path) {
        List<String> segments = DocumentPaths.split(path);
        if (segments == null) return null;
        return DocumentPaths.asList(DocumentPaths.resolve(metadata.getData(), segments));
    }

    @Override
    public String toString() {
        return "Profile{" + ownerId + ", state=" + state + ", new=" + isNew + "}";
    }
}
