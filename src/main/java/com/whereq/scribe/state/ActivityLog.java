package com.whereq.scribe.state;

import com.whereq.scribe.config.OptimizerProperties;
import lombok.Value;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded global activity feed. Silent bulk runs do not write here.
 */
@Component
public class ActivityLog {

    private final Deque<Entry> entries = new ArrayDeque<>();
    private final int capacity;

    @Autowired
    public ActivityLog(OptimizerProperties properties) {
        this.capacity = properties.getLog().getActivityLogCapacity();
    }

    public synchronized void add(String message) {
        entries.addLast(new Entry(Instant.now(), message));
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    /**
     * Most recent entries, oldest first
     */
    public synchronized List<Entry> recent(int limit) {
        List<Entry> all = new ArrayList<>(entries);
        return all.subList(Math.max(0, all.size() - limit), all.size());
    }

    @Value
    public static class Entry {
        Instant timestamp;
        String message;
    }
}
