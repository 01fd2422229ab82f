package fr.lapetina.forwarder.infrastructure.metrics;

import fr.lapetina.forwarder.domain.model.WorkersCacheError;
import fr.lapetina.forwarder.worker.SendTransactionStats;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("test");
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should count send errors per type")
    void shouldCountSendErrorsPerType() {
        metrics.incrementSendError(WorkersCacheError.FULL_CHANNEL);
        metrics.incrementSendError(WorkersCacheError.FULL_CHANNEL);
        metrics.incrementSendError(WorkersCacheError.SHUTDOWN);

        assertThat(metrics.getSendErrorCount(WorkersCacheError.FULL_CHANNEL)).isEqualTo(2.0);
        assertThat(metrics.getSendErrorCount(WorkersCacheError.SHUTDOWN)).isEqualTo(1.0);
        assertThat(metrics.getSendErrorCount(WorkersCacheError.RECEIVER_DROPPED)).isZero();
    }

    @Test
    @DisplayName("should expose counters in Prometheus format")
    void shouldExposePrometheusFormat() {
        SendTransactionStats stats = new SendTransactionStats();
        metrics.bindSendStats(stats);
        stats.recordSent(5);
        metrics.incrementBatchesDelivered();
        metrics.setCachedWorkers(3);
        metrics.recordDispatchLatency(Duration.ofMillis(2));

        String scrape = metrics.scrape();

        assertThat(scrape).contains("test_batches_delivered_total 1.0");
        assertThat(scrape).contains("test_transactions_sent_total 5.0");
        assertThat(scrape).contains("test_cached_workers 3.0");
        assertThat(scrape).contains("test_send_errors_total{type=\"FULL_CHANNEL\"");
    }
}
