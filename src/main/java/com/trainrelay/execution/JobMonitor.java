package com.trainrelay.execution;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trainrelay.runtime.BackoffPolicy;

/**
 * Waits for a batch of jobs with a single polling loop. Every cycle inspects all
 * outstanding handles, then sleeps with bounded exponential backoff. Jobs still running
 * at the wait ceiling are left alone remotely and reported as timed out.
 */
public class JobMonitor {
    private static final Logger log = LoggerFactory.getLogger(JobMonitor.class);

    private final ExecutionService executionService;
    private final BackoffPolicy backoffPolicy;
    private final Duration noticeInterval;
    private final Sleeper sleeper;
    private final Clock clock;

    public JobMonitor(ExecutionService executionService, BackoffPolicy backoffPolicy, Duration noticeInterval) {
        this(executionService, backoffPolicy, noticeInterval, Sleeper.SYSTEM, Clock.systemUTC());
    }

    public JobMonitor(
            ExecutionService executionService,
            BackoffPolicy backoffPolicy,
            Duration noticeInterval,
            Sleeper sleeper,
            Clock clock) {
        this.executionService = executionService;
        this.backoffPolicy = backoffPolicy;
        this.noticeInterval = noticeInterval;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public MonitorResult await(List<TrainingJob> jobs) throws InterruptedException {
        if (jobs.isEmpty()) {
            return MonitorResult.empty();
        }
        Instant start = clock.instant();
        Instant lastNotice = start;
        Duration delay = backoffPolicy.initialDelay();
        List<TrainingJob> outstanding = new ArrayList<>();
        for (TrainingJob job : jobs) {
            if (!job.getStatus().isTerminal()) {
                outstanding.add(job);
            }
        }
        log.info("monitor.start jobs={} outstanding={} ceilingMs={}", jobs.size(), outstanding.size(), backoffPolicy.ceiling().toMillis());

        int cycle = 0;
        while (!outstanding.isEmpty()) {
            cycle++;
            pollOnce(outstanding);
            if (outstanding.isEmpty()) {
                break;
            }

            Instant now = clock.instant();
            Duration elapsed = Duration.between(start, now);
            if (backoffPolicy.exhausted(elapsed)) {
                for (TrainingJob job : outstanding) {
                    job.markTimedOut();
                    log.warn("monitor.timeout unit={} handle={} status={} elapsedMs={}",
                            job.getUnitId(), job.getJobHandle(), job.getStatus(), elapsed.toMillis());
                }
                break;
            }
            if (!noticeInterval.isZero() && Duration.between(lastNotice, now).compareTo(noticeInterval) >= 0) {
                log.info("monitor.still-running outstanding={} elapsedMs={} cycle={}", outstanding.size(), elapsed.toMillis(), cycle);
                lastNotice = now;
            }

            sleeper.sleep(backoffPolicy.boundedDelay(delay, elapsed));
            delay = backoffPolicy.next(delay);
        }

        List<TrainingJob> completed = new ArrayList<>();
        List<TrainingJob> failed = new ArrayList<>();
        List<TrainingJob> timedOut = new ArrayList<>();
        for (TrainingJob job : jobs) {
            if (job.getStatus() == JobStatus.COMPLETED) {
                completed.add(job);
            } else {
                failed.add(job);
                if (job.isTimedOut()) {
                    timedOut.add(job);
                }
            }
        }
        log.info("monitor.done completed={} failed={} timedOut={} cycles={}", completed.size(), failed.size(), timedOut.size(), cycle);
        return new MonitorResult(completed, failed, timedOut);
    }

    private void pollOnce(List<TrainingJob> outstanding) {
        Iterator<TrainingJob> iterator = outstanding.iterator();
        while (iterator.hasNext()) {
            TrainingJob job = iterator.next();
            try {
                JobStatus status = executionService.status(job.getJobHandle());
                if (job.updateStatus(status)) {
                    log.info("monitor.transition unit={} handle={} status={}", job.getUnitId(), job.getJobHandle(), status);
                }
                if (job.getStatus().isTerminal()) {
                    iterator.remove();
                }
            } catch (IOException e) {
                log.warn("monitor.poll.failed unit={} handle={} reason={}", job.getUnitId(), job.getJobHandle(), e.getMessage());
            }
        }
    }
}
