package com.premiergroup.ad_conversion_hub.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.premiergroup.ad_conversion_hub.dto.ConversionContext;
import com.premiergroup.ad_conversion_hub.entity.ConversionJob;
import com.premiergroup.ad_conversion_hub.enums.JobStatus;
import com.premiergroup.ad_conversion_hub.reporter.ConversionReporter;
import com.premiergroup.ad_conversion_hub.reporter.ConversionReporterRegistry;
import com.premiergroup.ad_conversion_hub.repository.ConversionJobRepository;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Persistent conversion queue. Reporters turn an attribution event into payloads, the worker
 * hands each payload back to its reporter and retries failures with exponential backoff.
 */
@Service
@Log4j2
public class ConversionQueueService {

    private final ConversionReporterRegistry registry;
    private final ConversionJobRepository jobRepository;
    private final ObjectMapper objectMapper;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final int batchSize;
    private final int maxAttempts;
    private final long backoffBaseSeconds;

    private final ReentrantLock runLock = new ReentrantLock();

    public ConversionQueueService(ConversionReporterRegistry registry,
                                  ConversionJobRepository jobRepository,
                                  ObjectMapper objectMapper,
                                  TaskScheduler taskScheduler,
                                  Clock clock,
                                  @Value("${conversion.queue.batch-size:50}") int batchSize,
                                  @Value("${conversion.queue.max-attempts:5}") int maxAttempts,
                                  @Value("${conversion.queue.backoff-base-seconds:60}") long backoffBaseSeconds) {
        this.registry = registry;
        this.jobRepository = jobRepository;
        this.objectMapper = objectMapper;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.batchSize = batchSize;
        this.maxAttempts = maxAttempts;
        this.backoffBaseSeconds = backoffBaseSeconds;
    }

    /**
     * Lets every registered reporter build its payloads and stores each one as a pending job.
     *
     * @return number of jobs queued
     */
    @Transactional
    public int enqueueConversion(Map<String, Double> attributions,
                                 Map<String, Map<String, String>> clickIds,
                                 Map<String, Map<String, String>> campaigns,
                                 ConversionContext context) {
        Instant now = clock.instant();
        int queued = 0;

        for (ConversionReporter<?> reporter : registry.all()) {
            for (Object payload : reporter.enqueue(attributions, clickIds, campaigns, context)) {
                jobRepository.save(ConversionJob.builder()
                        .reporter(reporter.provider())
                        .payload(toJson(payload))
                        .status(JobStatus.PENDING)
                        .attempts(0)
                        .createdAt(now)
                        .build());
                queued++;
            }
        }

        log.info("Queued {} conversion job(s) for {} attribution(s)", queued, attributions.size());
        return queued;
    }

    /**
     * Processes due pending jobs, oldest first, until none are left. Returns immediately when
     * another run is in progress.
     *
     * @return number of jobs handled in this run
     */
    @Scheduled(fixedDelayString = "${conversion.queue.poll-interval-ms:60000}",
            initialDelayString = "${conversion.queue.poll-interval-ms:60000}")
    public int processDueJobs() {
        if (!runLock.tryLock()) {
            log.debug("Conversion queue run already in progress, skipping");
            return 0;
        }

        int handled = 0;
        try {
            List<ConversionJob> due;
            while (!(due = jobRepository.findDue(JobStatus.PENDING, clock.instant(), PageRequest.of(0, batchSize))).isEmpty()) {
                due.forEach(this::processJob);
                handled += due.size();
            }
        } finally {
            runLock.unlock();
        }

        if (handled > 0) {
            log.info("Conversion queue run handled {} job(s)", handled);
        }
        return handled;
    }

    @EventListener
    public void onRunRequested(QueueRunRequestedEvent event) {
        log.debug("Scheduling conversion queue run ({})", event.reason());
        taskScheduler.schedule(this::processDueJobs, clock.instant());
    }

    private void processJob(ConversionJob job) {
        Optional<ConversionReporter<?>> reporter = registry.find(job.getReporter());
        if (reporter.isEmpty()) {
            log.error("No reporter registered for '{}', failing job {}", job.getReporter(), job.getId());
            job.setAttempts(job.getAttempts() + 1);
            markFailed(job, "No reporter registered for '" + job.getReporter() + "'");
            return;
        }

        String error;
        try {
            if (dispatch(reporter.get(), job.getPayload())) {
                job.setStatus(JobStatus.DONE);
                job.setErrorMessage(null);
                job.setProcessedAt(clock.instant());
                jobRepository.save(job);
                return;
            }
            error = "Reporter '" + job.getReporter() + "' could not deliver the conversion";
        } catch (JsonProcessingException e) {
            log.error("Job {} has an unreadable payload, failing without retry", job.getId());
            job.setAttempts(job.getAttempts() + 1);
            markFailed(job, "Unreadable payload: " + e.getOriginalMessage());
            return;
        } catch (RuntimeException e) {
            log.error("Reporter '{}' threw while processing job {}", job.getReporter(), job.getId(), e);
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        }

        retryOrFail(job, error);
    }

    private <P> boolean dispatch(ConversionReporter<P> reporter, String json) throws JsonProcessingException {
        P payload = objectMapper.readValue(json, reporter.payloadType());
        return reporter.process(payload);
    }

    private void retryOrFail(ConversionJob job, String error) {
        int attempts = job.getAttempts() + 1;
        job.setAttempts(attempts);

        if (attempts >= maxAttempts) {
            log.warn("Conversion job {} failed after {} attempt(s): {}", job.getId(), attempts, error);
            markFailed(job, error);
            return;
        }

        job.setStatus(JobStatus.PENDING);
        job.setErrorMessage(error);
        job.setNextAttemptAt(clock.instant().plus(backoff(attempts)));
        jobRepository.save(job);
    }

    private void markFailed(ConversionJob job, String error) {
        job.setStatus(JobStatus.FAILED);
        job.setErrorMessage(error);
        job.setNextAttemptAt(null);
        job.setProcessedAt(clock.instant());
        jobRepository.save(job);
    }

    /**
     * base, 2 x base, 4 x base, ... after the first, second, third failed attempt.
     */
    Duration backoff(int attempts) {
        int exponent = Math.min(attempts - 1, 20);
        return Duration.ofSeconds(backoffBaseSeconds * (1L << exponent));
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize conversion payload", e);
        }
    }
}
