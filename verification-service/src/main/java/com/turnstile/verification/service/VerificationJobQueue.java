package com.turnstile.verification.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.turnstile.common.dto.VerificationJob;
import com.turnstile.common.dto.VerificationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka side of the verification job queue: publishes jobs for the worker pool
 * and the results they produce.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class VerificationJobQueue {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    @Value("${turnstile.jobs.topic:ticket-verification-jobs}")
    private String jobsTopic;

    @Value("${turnstile.jobs.results-topic:ticket-verification-results}")
    private String resultsTopic;

    /**
     * Queue a verification job
     *
     * @return The job id, assigned here when the caller left it out
     * @throws IllegalArgumentException if the job cannot be serialized
     */
    public String enqueue(VerificationJob job) {
        VerificationJob toSend = job.getJobId() == null || job.getJobId().isBlank()
            ? job.toBuilder().jobId(UUID.randomUUID().toString()).build()
            : job;

        String payload;
        try {
            payload = objectMapper.writeValueAsString(toSend);
        } catch (Exception e) {
            throw new IllegalArgumentException("Cannot serialize verification job " + toSend.getJobId(), e);
        }

        CompletableFuture<SendResult<String, String>> future =
            kafkaTemplate.send(jobsTopic, toSend.getJobId(), payload);

        future.whenComplete((result, throwable) -> {
            if (throwable != null) {
                log.error("Failed to enqueue verification job: {}", toSend.getJobId(), throwable);
            } else {
                log.debug("Enqueued verification job: {} attempt={} to partition: {}",
                         toSend.getJobId(), toSend.getAttempt(), result.getRecordMetadata().partition());
            }
        });

        return toSend.getJobId();
    }

    /**
     * Publish the outcome of a processed job under its job id
     */
    public void publishResult(VerificationResult verificationResult) {
        try {
            String payload = objectMapper.writeValueAsString(verificationResult);

            CompletableFuture<SendResult<String, String>> future =
                kafkaTemplate.send(resultsTopic, verificationResult.getJobId(), payload);

            future.whenComplete((result, throwable) -> {
                if (throwable != null) {
                    log.error("Failed to publish verification result: {}", verificationResult.getJobId(), throwable);
                } else {
                    log.debug("Published verification result: {}", verificationResult.getJobId());
                }
            });

        } catch (Exception e) {
            log.error("Error creating verification result event: {}", verificationResult.getJobId(), e);
        }
    }
}
