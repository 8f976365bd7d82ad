package com.lux032.genreenricher.service;

import com.lux032.genreenricher.model.BatchSummary;
import com.lux032.genreenricher.model.EnrichmentOutcome;
import com.lux032.genreenricher.model.EnrichmentResult;
import com.lux032.genreenricher.pipeline.CircuitBreaker;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BatchProcessorTest {

    private final GenreEnrichmentService enrichmentService = mock(GenreEnrichmentService.class);
    private final List<Long> sleeps = Collections.synchronizedList(new ArrayList<>());

    private static List<File> files(int count) {
        List<File> files = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            files.add(new File("track" + i + ".mp3"));
        }
        return files;
    }

    private static EnrichmentResult updated(File file) {
        return new EnrichmentResult(file, EnrichmentOutcome.UPDATED);
    }

    @Test
    void shouldProcessAllFiles() throws Exception {
        when(enrichmentService.processFile(any())).thenAnswer(inv -> updated(inv.getArgument(0)));
        CircuitBreaker breaker = new CircuitBreaker("batch", 3, Duration.ZERO);
        BatchProcessor processor = new BatchProcessor(enrichmentService, breaker, 3, 3, sleeps::add);

        BatchSummary summary = processor.processFiles(files(10));

        assertThat(summary.getTotal()).isEqualTo(10);
        assertThat(summary.getSuccess()).isEqualTo(10);
        assertThat(summary.getFailed()).isZero();
        assertThat(summary.isAborted()).isFalse();
        assertThat(sleeps).isEmpty();
        assertThat(processor.isRunning()).isFalse();
    }

    @Test
    void shouldCountMixedOutcomes() throws Exception {
        List<File> files = files(3);
        when(enrichmentService.processFile(files.get(0))).thenReturn(updated(files.get(0)));
        when(enrichmentService.processFile(files.get(1)))
            .thenReturn(new EnrichmentResult(files.get(1), EnrichmentOutcome.NO_GENRES));
        when(enrichmentService.processFile(files.get(2))).thenThrow(new IOException("bad header"));
        CircuitBreaker breaker = new CircuitBreaker("batch", 5, Duration.ZERO);

        BatchSummary summary = new BatchProcessor(enrichmentService, breaker, 1, 3, sleeps::add)
            .processFiles(files);

        assertThat(summary.getSuccess()).isEqualTo(1);
        assertThat(summary.getNoGenres()).isEqualTo(1);
        assertThat(summary.getFailed()).isEqualTo(1);
        assertThat(summary.getFailures()).containsEntry(files.get(2).getAbsolutePath(), "bad header");
        assertThat(breaker.isOpen()).isFalse();
    }

    @Test
    void shouldAbortAfterBreakerStaysOpen() throws Exception {
        when(enrichmentService.processFile(any())).thenThrow(new SourceUnavailableException("all sources down"));
        CircuitBreaker breaker = new CircuitBreaker("batch", 2, Duration.ZERO);
        BatchProcessor processor = new BatchProcessor(enrichmentService, breaker, 1, 3, sleeps::add);

        BatchSummary summary = processor.processFiles(files(5));

        assertThat(summary.getFailed()).isEqualTo(2);
        assertThat(summary.getCancelled()).isEqualTo(3);
        assertThat(summary.isAborted()).isTrue();
        assertThat(sleeps).containsExactly(5000L, 10000L, 15000L);
        verify(enrichmentService, times(2)).processFile(any());
    }

    @Test
    void shouldResumeWhenBreakerRecovers() throws Exception {
        when(enrichmentService.processFile(any()))
            .thenThrow(new SourceUnavailableException("down"))
            .thenThrow(new SourceUnavailableException("down"))
            .thenAnswer(inv -> updated(inv.getArgument(0)));
        CircuitBreaker breaker = new CircuitBreaker("batch", 2, Duration.ZERO);
        BatchProcessor processor = new BatchProcessor(enrichmentService, breaker, 1, 3, millis -> {
            sleeps.add(millis);
            breaker.recordSuccess();
        });

        BatchSummary summary = processor.processFiles(files(5));

        assertThat(summary.getFailed()).isEqualTo(2);
        assertThat(summary.getSuccess()).isEqualTo(3);
        assertThat(summary.isAborted()).isFalse();
        assertThat(sleeps).containsExactly(5000L);
    }

    @Test
    void shouldCancelRemainingFilesWhenStopped() throws Exception {
        CircuitBreaker breaker = new CircuitBreaker("batch", 5, Duration.ZERO);
        AtomicReference<BatchProcessor> ref = new AtomicReference<>();
        when(enrichmentService.processFile(any())).thenAnswer(inv -> {
            ref.get().stop();
            return updated(inv.getArgument(0));
        });
        BatchProcessor processor = new BatchProcessor(enrichmentService, breaker, 1, 3, sleeps::add);
        ref.set(processor);

        BatchSummary summary = processor.processFiles(files(4));

        assertThat(summary.getSuccess()).isEqualTo(1);
        assertThat(summary.getCancelled()).isEqualTo(3);
        assertThat(summary.isAborted()).isFalse();
    }

    @Test
    void shouldProcessDuplicateFilesOnce() throws Exception {
        when(enrichmentService.processFile(any())).thenAnswer(inv -> updated(inv.getArgument(0)));
        File file = new File("same.mp3");
        CircuitBreaker breaker = new CircuitBreaker("batch", 5, Duration.ZERO);

        BatchSummary summary = new BatchProcessor(enrichmentService, breaker, 2, 3, sleeps::add)
            .processFiles(Arrays.asList(file, file));

        assertThat(summary.getTotal()).isEqualTo(1);
        verify(enrichmentService, times(1)).processFile(file);
    }

    @Test
    void shouldCapBackoff() {
        assertThat(BatchProcessor.backoffMillis(0)).isEqualTo(5000);
        assertThat(BatchProcessor.backoffMillis(2)).isEqualTo(15000);
        assertThat(BatchProcessor.backoffMillis(5)).isEqualTo(30000);
        assertThat(BatchProcessor.backoffMillis(20)).isEqualTo(30000);
    }

    @Test
    void shouldDetectWhenBackoffEndsBeforeHalfOpenTrial() {
        assertThat(BatchProcessor.totalBackoffMillis(3)).isEqualTo(30000);

        CircuitBreaker defaultBreaker = new CircuitBreaker("batch", 5, Duration.ofSeconds(60));
        assertThat(new BatchProcessor(enrichmentService, defaultBreaker, 1, 3, sleeps::add)
            .isHalfOpenReachable()).isFalse();

        CircuitBreaker shortReset = new CircuitBreaker("batch", 5, Duration.ofSeconds(20));
        assertThat(new BatchProcessor(enrichmentService, shortReset, 1, 3, sleeps::add)
            .isHalfOpenReachable()).isTrue();

        CircuitBreaker successOnly = new CircuitBreaker("batch", 5, Duration.ZERO);
        assertThat(new BatchProcessor(enrichmentService, successOnly, 1, 3, sleeps::add)
            .isHalfOpenReachable()).isFalse();
    }
}
