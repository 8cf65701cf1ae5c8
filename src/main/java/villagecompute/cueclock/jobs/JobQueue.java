/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.jobs;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

import villagecompute.cueclock.data.models.ScheduledJob;

/**
 * Min-heap of {@link ScheduledJob}s keyed by due time.
 *
 * <p>
 * Not thread-safe: the dispatch loop is the only owner and mutates it while holding its lock.
 *
 * <p>
 * {@link #rebuildFrom(Collection)} always replaces the heap wholesale and drops duplicate
 * {@code (event, occurrence, triggerIndex)} entries, keeping the first one seen.
 */
public final class JobQueue {

    private PriorityQueue<ScheduledJob> heap = new PriorityQueue<>();

    public void push(ScheduledJob job) {
        heap.add(job);
    }

    public void pushAll(Collection<ScheduledJob> jobs) {
        heap.addAll(jobs);
    }

    /**
     * Returns the job with the earliest due time without removing it, or {@code null} when empty.
     */
    public ScheduledJob peekMin() {
        return heap.peek();
    }

    /**
     * Removes and returns the job with the earliest due time, or {@code null} when empty.
     */
    public ScheduledJob popMin() {
        return heap.poll();
    }

    /**
     * Discards the current contents and heapifies {@code jobs} in their place.
     */
    public void rebuildFrom(Collection<ScheduledJob> jobs) {
        Map<JobKey, ScheduledJob> unique = new LinkedHashMap<>();
        for (ScheduledJob job : jobs) {
            unique.putIfAbsent(JobKey.of(job), job);
        }
        heap = new PriorityQueue<>(new ArrayList<>(unique.values()));
    }

    public boolean isEmpty() {
        return heap.isEmpty();
    }

    public int size() {
        return heap.size();
    }

    /**
     * Returns whether any queued job still belongs to the given occurrence of the given event.
     */
    public boolean hasPendingFor(long eventId, LocalDateTime occurrence) {
        for (ScheduledJob job : heap) {
            if (job.belongsTo(eventId, occurrence)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns a copy of the queued jobs sorted by due time.
     */
    public List<ScheduledJob> sorted() {
        List<ScheduledJob> copy = new ArrayList<>(heap);
        copy.sort(null);
        return copy;
    }

    private record JobKey(long eventId, LocalDateTime occurrence, int triggerIndex) {

        static JobKey of(ScheduledJob job) {
            return new JobKey(job.event().id(), job.occurrence(), job.triggerIndex());
        }
    }
}
