package com.turnstile.verification.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.turnstile.common.dto.VerificationJob;
import com.turnstile.common.dto.VerificationResult;
import com.turnstile.common.enums.EntryStatus;
import com.turnstile.common.enums.TicketStatus;
import com.turnstile.common.model.TicketRecord;
import com.turnstile.common.store.StoreUnavailableException;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VerificationJobConsumerTest {

    private static final Instant NOW = Instant.parse("2026-10-19T18:00:00Z");
    private static final Instant SCAN = NOW.minusSeconds(5);

    @Mock
    private VerificationEngine verificationEngine;

    @Mock
    private VerificationJobQueue jobQueue;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    private VerificationJobConsumer consumer;

    @BeforeEach
    void setUp() {
        consumer = new VerificationJobConsumer(verificationEngine, jobQueue, objectMapper,
            Clock.fixed(NOW, ZoneOffset.UTC), 3);
    }

    private VerificationJob job(int attempt) {
        return VerificationJob.builder()
            .jobId("job-1").token("jwt").deviceKey("DEV-01").scanTime(SCAN).attempt(attempt).build();
    }

    private VerificationResult publishedResult() {
        ArgumentCaptor<VerificationResult> captor = ArgumentCaptor.forClass(VerificationResult.class);
        verify(jobQueue).publishResult(captor.capture());
        return captor.getValue();
    }

    // ─── onVerificationJob ───────────────────────────────────────────────

    @Test
    void onVerificationJob_Admitted_PublishesAdmission() throws Exception {
        TicketRecord ticket = TicketRecord.builder()
            .ticketId("T1").status(TicketStatus.VALID).entryStatus(EntryStatus.IN).entryCount(1).build();
        when(verificationEngine.verify("jwt", "DEV-01", SCAN)).thenReturn(ticket);
        String payload = objectMapper.writeValueAsString(job(0));

        consumer.onVerificationJob(new ConsumerRecord<>("ticket-verification-jobs", 0, 0L, "job-1", payload));

        VerificationResult result = publishedResult();
        assertTrue(result.isAdmitted());
        assertEquals("job-1", result.getJobId());
        assertEquals(ticket, result.getTicket());
        assertEquals(NOW, result.getProcessedAt());
    }

    @Test
    void onVerificationJob_UnreadablePayload_Skipped() {
        consumer.onVerificationJob(new ConsumerRecord<>("ticket-verification-jobs", 0, 0L, "job-1", "{not json"));

        verifyNoInteractions(verificationEngine, jobQueue);
    }

    // ─── process ─────────────────────────────────────────────────────────

    @Test
    void process_Rejected_PublishesReasonWithoutRetry() {
        when(verificationEngine.verify(any(), any(), any()))
            .thenThrow(new TicketVerificationException(RejectionReason.ALREADY_INSIDE));

        consumer.process(job(0));

        VerificationResult result = publishedResult();
        assertFalse(result.isAdmitted());
        assertEquals("ALREADY_INSIDE", result.getReason());
        verify(jobQueue, never()).enqueue(any());
    }

    @Test
    void process_StoreDown_ReenqueuesNextAttempt() {
        when(verificationEngine.verify(any(), any(), any()))
            .thenThrow(new StoreUnavailableException("down", null));

        consumer.process(job(0));

        ArgumentCaptor<VerificationJob> captor = ArgumentCaptor.forClass(VerificationJob.class);
        verify(jobQueue).enqueue(captor.capture());
        assertEquals(1, captor.getValue().getAttempt());
        assertEquals("job-1", captor.getValue().getJobId());
        verify(jobQueue, never()).publishResult(any());
    }

    @Test
    void process_StoreDownOnLastAttempt_PublishesFailure() {
        when(verificationEngine.verify(any(), any(), any()))
            .thenThrow(new StoreUnavailableException("down", null));

        consumer.process(job(2));

        VerificationResult result = publishedResult();
        assertFalse(result.isAdmitted());
        assertEquals(VerificationJobConsumer.STORE_UNAVAILABLE, result.getReason());
        verify(jobQueue, never()).enqueue(any());
    }

    @Test
    void process_UnexpectedFault_PublishesInternalErrorWithoutRetry() {
        when(verificationEngine.verify(any(), any(), any()))
            .thenThrow(new IllegalStateException("Attendee counter is not a number: abc"));

        consumer.process(job(0));

        VerificationResult result = publishedResult();
        assertFalse(result.isAdmitted());
        assertEquals(VerificationJobConsumer.INTERNAL_ERROR, result.getReason());
        assertEquals("Attendee counter is not a number: abc", result.getMessage());
        assertEquals(NOW, result.getProcessedAt());
        verify(jobQueue, never()).enqueue(any());
    }
}
