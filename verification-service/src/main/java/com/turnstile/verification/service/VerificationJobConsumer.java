package com.turnstile.verification.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.turnstile.common.dto.VerificationJob;
import com.turnstile.common.dto.VerificationResult;
import com.turnstile.common.model.TicketRecord;
import com.turnstile.common.store.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Worker pool draining the verification job queue. Listener concurrency
 * ({@code spring.kafka.listener.concurrency}) sets the number of workers.
 *
 * Decisions are logged and published to the results topic; nothing is returned to the
 * scanning device. Store outages are retried by re-enqueueing up to {@code turnstile.jobs.max-attempts}.
 */
@Service
@Slf4j
public class VerificationJobConsumer {

    static final String STORE_UNAVAILABLE = "STORE_UNAVAILABLE";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final VerificationEngine verificationEngine;
    private final VerificationJobQueue jobQueue;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int maxAttempts;

    public VerificationJobConsumer(VerificationEngine verificationEngine,
                                   VerificationJobQueue jobQueue,
                                   ObjectMapper objectMapper,
                                   Clock clock,
                                   @Value("${turnstile.jobs.max-attempts:3}") int maxAttempts) {
        this.verificationEngine = verificationEngine;
        this.jobQueue = jobQueue;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
    }

    @KafkaListener(
        topics = "${turnstile.jobs.topic:ticket-verification-jobs}",
        groupId = "${turnstile.jobs.group-id:verification-service-jobs}",
        containerFactory = "kafkaListenerContainerFactory"
    )
    public void onVerificationJob(ConsumerRecord<String, String> record) {
        VerificationJob job;
        try {
            job = objectMapper.readValue(record.value(), VerificationJob.class);
        } catch (Exception e) {
            log.error("Skipping unreadable verification job: key={}", record.key(), e);
            return;
        }

        process(job);
    }

    void process(VerificationJob job) {
        log.info("Processing job {} attempt={}", job.getJobId(), job.getAttempt());

        try {
            TicketRecord ticket = verificationEngine.verify(job.getToken(), job.getDeviceKey(), job.getScanTime());
            log.info("Job {} done: admitted ticket={} entryCount={}",
                    job.getJobId(), ticket.getTicketId(), ticket.getEntryCount());
            publish(job, VerificationResult.builder()
                .admitted(true)
                .ticket(ticket));

        } catch (TicketVerificationException e) {
            log.info("Job {} done: rejected reason={} - {}", job.getJobId(), e.getReason(), e.getMessage());
            publish(job, VerificationResult.builder()
                .admitted(false)
                .reason(e.getReason().name())
                .message(e.getMessage()));

        } catch (StoreUnavailableException e) {
            handleStoreFailure(job, e);

        } catch (RuntimeException e) {
            // Final failure, never re-enqueued
            log.error("Job {} failed with an unexpected error", job.getJobId(), e);
            publish(job, VerificationResult.builder()
                .admitted(false)
                .reason(INTERNAL_ERROR)
                .message(e.getMessage()));
        }
    }

    private void handleStoreFailure(VerificationJob job, StoreUnavailableException e) {
        int nextAttempt = job.getAttempt() + 1;
        if (nextAttempt < maxAttempts) {
            log.warn("Job {} hit a store outage, re-enqueueing attempt={}", job.getJobId(), nextAttempt, e);
            jobQueue.enqueue(job.toBuilder().attempt(nextAttempt).build());
            return;
        }

        log.error("Job {} dropped after {} attempts", job.getJobId(), nextAttempt, e);
        publish(job, VerificationResult.builder()
            .admitted(false)
            .reason(STORE_UNAVAILABLE)
            .message(e.getMessage()));
    }

    private void publish(VerificationJob job, VerificationResult.VerificationResultBuilder result) {
        jobQueue.publishResult(result
            .jobId(job.getJobId())
            .processedAt(clock.instant())
            .build());
    }
}
