package com.alertsentinel.core.batch;

import com.alertsentinel.core.model.AnomalyEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link BatchAggregator}.
 */
class BatchAggregatorTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private BatchAggregator batch;

    @BeforeEach
    void setUp() {
        batch = new BatchAggregator(Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("First insert opens the batch; later inserts keep the opening time")
    void firstInsertOpens() {
        assertThat(batch.state()).isEqualTo(BatchState.EMPTY);

        batch.add(event("a"), T0);
        batch.add(event("b"), T0.plusSeconds(30));

        assertThat(batch.state()).isEqualTo(BatchState.OPEN);
        assertThat(batch.openedAt()).contains(T0);
        assertThat(batch.firstEvent()).map(AnomalyEvent::getJobName).contains("a");
        assertThat(batch.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Batch is due once the window has elapsed since opening")
    void dueAfterWindow() {
        batch.add(event("a"), T0);

        assertThat(batch.isDue(T0.plusSeconds(59))).isFalse();
        assertThat(batch.isDue(T0.plusSeconds(60))).isTrue();
    }

    @Test
    @DisplayName("Empty batch is never due")
    void emptyNeverDue() {
        assertThat(batch.isDue(T0.plusSeconds(3600))).isFalse();
    }

    @Test
    @DisplayName("Drain returns events in order and resets to empty")
    void drain() {
        batch.add(event("a"), T0);
        batch.add(event("b"), T0);

        List<AnomalyEvent> drained = batch.drain();

        assertThat(drained).extracting(AnomalyEvent::getJobName).containsExactly("a", "b");
        assertThat(batch.state()).isEqualTo(BatchState.EMPTY);
        assertThat(batch.openedAt()).isEmpty();
        assertThat(batch.drain()).isEmpty();
    }

    @Test
    @DisplayName("Zero window makes every insert due immediately")
    void zeroWindow() {
        BatchAggregator immediate = new BatchAggregator(Duration.ZERO);
        immediate.add(event("a"), T0);

        assertThat(immediate.isDue(T0)).isTrue();
    }

    private static AnomalyEvent event(String job) {
        return AnomalyEvent.builder().jobName(job).build();
    }
}
