package com.example.healthrag;

import com.example.healthrag.testutils.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;
import org.springframework.transaction.support.DefaultTransactionStatus;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class HealthMetricServiceCommitTest {

    private static final LocalDate DAY = LocalDate.of(2024, 5, 9);

    private HealthMetricRepository repo;
    private BruteForceVectorIndex index;
    private SwitchableTransactionManager txManager;
    private HealthMetricService service;

    @BeforeEach
    public void setUp() {
        repo = mock(HealthMetricRepository.class);
        when(repo.findById(anyString())).thenReturn(Optional.empty());
        when(repo.saveAndFlush(any(HealthMetricRecord.class))).thenAnswer(inv -> inv.getArgument(0));
        index = new BruteForceVectorIndex();
        txManager = new SwitchableTransactionManager();
        service = new HealthMetricService(repo, new EmbeddingGenerator(new SimpleEmbeddingService(8), 8), index,
                new PlaintextRecordCipher(new ObjectMapper()), new SourceFieldMapper(),
                new MutableClock(Instant.parse("2024-05-10T08:00:00Z")), txManager);
    }

    @Test
    public void committedIngestIsIndexed() {
        HealthMetricView v = service.ingest("hc-ok", DAY, "sleep", "manual", Map.of("duration_hours", 7));

        assertThat(index.size()).isEqualTo(1);
        assertThat(index.categories("hc-ok")).containsExactly("sleep");
        assertThat(v.getId()).isEqualTo("hc-ok:sleep:2024-05-09:manual");
    }

    @Test
    public void failedCommitLeavesTheIndexUntouched() {
        txManager.failCommit = true;

        assertThatThrownBy(() -> service.ingest("hc-commit", DAY, "sleep", "manual", Map.of("duration_hours", 7)))
                .isInstanceOf(StoreUnavailableException.class)
                .hasCauseInstanceOf(TransactionSystemException.class);
        assertThat(index.size()).isZero();
    }

    @Test
    public void constraintViolationOnFlushIsTranslated() {
        when(repo.saveAndFlush(any(HealthMetricRecord.class))).thenThrow(new DataIntegrityViolationException("duplicate id"));

        assertThatThrownBy(() -> service.ingest("hc-dup", DAY, "activity", "manual", Map.of("steps", 100)))
                .isInstanceOf(StoreUnavailableException.class)
                .hasCauseInstanceOf(DataIntegrityViolationException.class);
        assertThat(index.size()).isZero();
    }

    @Test
    public void failedDeleteKeepsTheIndexedRecord() {
        HealthMetricView v = service.ingest("hc-del", DAY, "sleep", "manual", Map.of("duration_hours", 7));
        HealthMetricRecord row = new HealthMetricRecord();
        row.setId(v.getId());
        row.setOwnerId("hc-del");
        when(repo.findById(v.getId())).thenReturn(Optional.of(row));
        txManager.failCommit = true;

        assertThatThrownBy(() -> service.delete("hc-del", v.getId())).isInstanceOf(StoreUnavailableException.class);
        assertThat(index.size()).isEqualTo(1);

        txManager.failCommit = false;
        assertThat(service.delete("hc-del", v.getId())).isTrue();
        assertThat(index.size()).isZero();
    }

    static class SwitchableTransactionManager extends AbstractPlatformTransactionManager {
        volatile boolean failCommit;

        @Override
        protected Object doGetTransaction() {
            return new Object();
        }

        @Override
        protected void doBegin(Object transaction, TransactionDefinition definition) {
        }

        @Override
        protected void doCommit(DefaultTransactionStatus status) {
            if (failCommit) throw new TransactionSystemException("commit failed");
        }

        @Override
        protected void doRollback(DefaultTransactionStatus status) {
        }
    }
}
