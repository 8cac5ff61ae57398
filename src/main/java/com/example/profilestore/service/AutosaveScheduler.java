package com.example.profilestore.service;

import com.example.profilestore.profile.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * One periodic task per profile that saves it once its save interval has elapsed.
 * The task is cancelled by the profile's teardown.
 */
@Component
public class AutosaveScheduler {

    private static final Logger logger = LoggerFactory.getLogger(AutosaveScheduler.class);
    private static final Duration MAX_CHECK_PERIOD = Duration.ofSeconds(1);

    private final TaskScheduler taskScheduler;
    private final Clock clock;

    public AutosaveScheduler(TaskScheduler taskScheduler, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    public void schedule(Profile profile) {
        if (!profile.isPersistenceEnabled()) {
            return;
        }
        Duration interval = profile.getStoreOptions().getSaveInterval();
        Duration period = interval.compareTo(MAX_CHECK_PERIOD) < 0 ? interval : MAX_CHECK_PERIOD;
        ScheduledFuture<?> task = taskScheduler.scheduleWithFixedDelay(() -> tick(profile), period);
        profile.teardown().addCallback(() -> task.cancel(false));
    }

    void tick(Profile profile) {
        try {
            if (profile.isDue(clock.millis())) {
                profile.save();
            }
        } catch (RuntimeException e) {
            logger.error("Autosave of profile {} failed", profile.getOwnerId(), e);
        }
    }
}
