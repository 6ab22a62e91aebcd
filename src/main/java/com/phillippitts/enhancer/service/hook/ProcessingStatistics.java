package com.phillippitts.enhancer.service.hook;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide counters for the status endpoint.
 *
 * <p>Initialized once at startup. Counters only grow; the activity log keeps the newest
 * {@link #MAX_ACTIVITIES} entries and evicts the oldest. Safe for concurrent workers.
 */
@Component
public class ProcessingStatistics {

    public static final int MAX_ACTIVITIES = 50;

    private final Clock clock;
    private final Instant startTime;
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final Set<String> activeUsers = ConcurrentHashMap.newKeySet();
    private final Deque<Activity> activities = new ArrayDeque<>(MAX_ACTIVITIES);

    public ProcessingStatistics() {
        this(Clock.systemUTC());
    }

    ProcessingStatistics(Clock clock) {
        this.clock = clock;
        this.startTime = clock.instant();
    }

    public void markUserActive(String requester) {
        if (requester != null && !requester.isBlank()) {
            activeUsers.add(requester);
        }
    }

    public void record(Activity activity) {
        if (activity.success()) {
            processed.incrementAndGet();
        } else {
            failed.incrementAndGet();
        }
        synchronized (activities) {
            if (activities.size() == MAX_ACTIVITIES) {
                activities.removeFirst();
            }
            activities.addLast(activity);
        }
    }

    /** @return recent activities, newest first */
    public List<Activity> recentActivities() {
        synchronized (activities) {
            List<Activity> copy = new ArrayList<>(activities.size());
            activities.descendingIterator().forEachRemaining(copy::add);
            return copy;
        }
    }

    public Snapshot snapshot() {
        Instant now = clock.instant();
        return new Snapshot(startTime, Duration.between(startTime, now), processed.get(), failed.get(),
                activeUsers.size());
    }

    /**
     * Point-in-time view of the counters.
     */
    public record Snapshot(Instant startTime, Duration uptime, long processed, long failed, int activeUsers) {
    }
}
