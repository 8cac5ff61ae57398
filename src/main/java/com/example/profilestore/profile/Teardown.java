package com.example.profilestore.profile;

import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Ordered cleanup list, disposed once in reverse registration order.
 * <p>
 * Tasks added after {@link #run()} are disposed immediately.
 */
public final class Teardown {

    private static final Logger logger = LoggerFactory.getLogger(Teardown.class);

    public interface Task {
        void dispose() throws Exception;
    }

    @Value
    public static class Callback implements Task {
        Runnable action;

        @Override
        public void dispose() {
            action.run();
        }
    }

    @Value
    public static class Unsubscribe implements Task {
        Subscription subscription;

        @Override
        public void dispose() {
            subscription.close();
        }
    }

    @Value
    public static class NestedResource implements Task {
        AutoCloseable resource;

        @Override
        public void dispose() throws Exception {
            resource.close();
        }
    }

    private final Deque<Task> tasks = new ArrayDeque<>();
    private boolean done;

    public void add(Task task) {
        synchronized (this) {
            if (!done) {
                tasks.push(task);
                return;
            }
        }
        dispose(task);
    }

    public void addCallback(Runnable action) {
        add(new Callback(action));
    }

    public void addSubscription(Subscription subscription) {
        add(new Unsubscribe(subscription));
    }

    public void addResource(AutoCloseable resource) {
        add(new NestedResource(resource));
    }

    public void run() {
        List<Task> pending;
        synchronized (this) {
            if (done) return;
            done = true;
            pending = new ArrayList<>(tasks); // push() keeps newest first
            tasks.clear();
        }
        for (Task task : pending) {
            dispose(task);
        }
    }

    public synchronized boolean isDone() {
        return done;
    }

    private static void dispose(Task task) {
        try {
            task.dispose();
        } catch (Exception e) {
            logger.warn("Teardown task {} failed", task.getClass().getSimpleName(), e);
        }
    }
}
