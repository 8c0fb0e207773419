package io.github.drompincen.remindclaw.runtime.reminder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Insertion-ordered table of active reminder jobs keyed by id. Every method holds the table's
 * monitor for its whole duration; {@link #snapshot()} hands out a copy.
 */
public class JobTable {

    private final Map<String, ReminderJob> jobs = new LinkedHashMap<>();

    /** @throws IllegalStateException if a job with the same id is already present */
    public synchronized void insert(ReminderJob job) {
        if (jobs.containsKey(job.id())) {
            throw new IllegalStateException("Duplicate reminder id " + job.id());
        }
        jobs.put(job.id(), job);
    }

    public synchronized Optional<ReminderJob> remove(String id) {
        return Optional.ofNullable(jobs.remove(id));
    }

    public synchronized Optional<ReminderJob> get(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    public synchronized boolean contains(String id) {
        return jobs.containsKey(id);
    }

    public synchronized List<ReminderJob> snapshot() {
        return List.copyOf(jobs.values());
    }

    /** @return the number of jobs removed */
    public synchronized int clear() {
        int count = jobs.size();
        jobs.clear();
        return count;
    }

    public synchronized int size() {
        return jobs.size();
    }

    public synchronized boolean isEmpty() {
        return jobs.isEmpty();
    }
}
