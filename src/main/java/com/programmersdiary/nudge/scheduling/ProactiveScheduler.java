package com.programmersdiary.nudge.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of proactive jobs. Each registered job gets its own {@link JobRunner} while the
 * scheduler is running; all runners share one {@link TaskScheduler} pool.
 *
 * <p>The job map and the ID counter are guarded by a single read/write lock, and the full
 * snapshot is written to the {@link JobStore} while the write lock is held.
 */
@Component
public class ProactiveScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ProactiveScheduler.class);

    private final JobStore jobStore;
    private final FireDispatcher fireDispatcher;
    private final TaskScheduler taskScheduler;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, JobEntry> entries = new LinkedHashMap<>();
    private int nextId = 1;
    private volatile boolean running;

    public ProactiveScheduler(JobStore jobStore, FireDispatcher fireDispatcher, TaskScheduler taskScheduler) {
        this.jobStore = jobStore;
        this.fireDispatcher = fireDispatcher;
        this.taskScheduler = taskScheduler;
    }

    /**
     * Validates and registers a job. The returned result carries the new ID even when the
     * snapshot could not be written.
     *
     * @throws InvalidScheduleException if {@code schedule} is neither an interval nor a cron expression
     */
    public JobChangeResult addJob(String schedule, String instruction, String channel, String chatId) {
        var parsed = ScheduleParser.parse(schedule);

        lock.writeLock().lock();
        try {
            var id = String.valueOf(nextId++);
            var entry = new JobEntry(new Job(id, schedule, instruction, channel, chatId));
            entries.put(id, entry);
            log.info("Added job {} with schedule '{}'", id, schedule);

            var result = persistLocked(id);
            if (running) {
                startLocked(entry, parsed);
            }
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @throws JobNotFoundException if no job has this ID
     */
    public JobChangeResult removeJob(String id) {
        lock.writeLock().lock();
        try {
            var entry = entries.remove(id);
            if (entry == null) {
                throw new JobNotFoundException(id);
            }
            entry.cancel();
            log.info("Removed job {}", id);
            return persistLocked(id);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<Job> listJobs() {
        lock.readLock().lock();
        try {
            return entries.values().stream().map(JobEntry::job).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Loads the persisted jobs and starts a runner for every registered job. Does nothing if
     * already running.
     *
     * @throws JobStoreException if the jobs file exists but is unreadable
     */
    @Override
    public void start() {
        lock.writeLock().lock();
        try {
            if (running) {
                return;
            }
            loadLocked();
            running = true;
            for (var entry : entries.values()) {
                startLocked(entry);
            }
            log.info("Scheduler started with {} job(s) from {}", entries.size(), jobStore.file());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Cancels every runner. Fires already in progress complete; no new fires begin.
     */
    @Override
    public void stop() {
        lock.writeLock().lock();
        try {
            if (!running) {
                return;
            }
            running = false;
            entries.values().forEach(JobEntry::cancel);
            log.info("Scheduler stopped");
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void loadLocked() {
        var state = jobStore.load();
        if (state.isEmpty()) {
            return;
        }
        int highestId = 0;
        for (var job : state.get().jobs()) {
            var previous = entries.put(job.id(), new JobEntry(job));
            if (previous != null) {
                previous.cancel();
            }
            highestId = Math.max(highestId, numericId(job.id()));
        }
        nextId = Math.max(nextId, Math.max(state.get().nextId(), highestId + 1));
    }

    private void startLocked(JobEntry entry) {
        Schedule schedule;
        try {
            schedule = ScheduleParser.parse(entry.job().schedule());
        } catch (InvalidScheduleException e) {
            log.warn("Job {} not started, schedule '{}' is invalid: {}",
                    entry.job().id(), entry.job().schedule(), e.getMessage());
            return;
        }
        startLocked(entry, schedule);
    }

    private void startLocked(JobEntry entry, Schedule schedule) {
        entry.cancel();
        var runner = new JobRunner(entry.job(), fireDispatcher);
        try {
            runner.start(schedule, taskScheduler);
        } catch (RuntimeException e) {
            log.warn("Job {} not started, runner could not be scheduled: {}", entry.job().id(), e.toString());
            return;
        }
        entry.runner = runner;
        log.info("Started job {} with schedule '{}'", entry.job().id(), entry.job().schedule());
    }

    private JobChangeResult persistLocked(String jobId) {
        var jobs = new ArrayList<Job>(entries.size());
        entries.values().forEach(e -> jobs.add(e.job()));
        try {
            jobStore.save(new PersistedState(jobs, nextId));
            return JobChangeResult.persisted(jobId);
        } catch (IOException e) {
            log.warn("Job {} changed in memory but could not be persisted to {}: {}",
                    jobId, jobStore.file(), e.getMessage());
            return new JobChangeResult(jobId, e);
        }
    }

    private static int numericId(String id) {
        try {
            return Integer.parseInt(id);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static final class JobEntry {

        private final Job job;
        private JobRunner runner;

        JobEntry(Job job) {
            this.job = job;
        }

        Job job() {
            return job;
        }

        void cancel() {
            if (runner != null) {
                runner.cancel();
                runner = null;
            }
        }
    }
}
