package com.example.profilestore.profile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Change and save notifications for one profile.
 * <p>
 * Listeners receive the full current document, never a diff. The document handed to
 * listeners is a copy; mutating it does not touch the profile.
 */
public class ProfileEvents {

    private static final Logger logger = LoggerFactory.getLogger(ProfileEvents.class);

    @FunctionalInterface
    public interface Listener {
        void onEvent(Map<String, Object> document);
    }

    private final String ownerId;
    private final List<Listener> changed = new CopyOnWriteArrayList<>();
    private final List<Listener> saved = new CopyOnWriteArrayList<>();

    ProfileEvents(String ownerId) {
        this.ownerId = ownerId;
    }

    public Subscription onChanged(Listener listener) {
        changed.add(listener);
        return () -> changed.remove(listener);
    }

    public Subscription onSaved(Listener listener) {
        saved.add(listener);
        return () -> saved.remove(listener);
    }

    void fireChanged(Map<String, Object> document) {
        fire("Changed", changed, document);
    }

    void fireSaved(Map<String, Object> document) {
        fire("Saved", saved, document);
    }

    private void fire(String event, List<Listener> listeners, Map<String, Object> document) {
        for (Listener l : listeners) {
            try {
                l.onEvent(document);
            } catch (RuntimeException e) {
                logger.warn("{} listener failed for profile {}", event, ownerId, e);
            }
        }
    }
}
