package com.labelrun.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@JdbcTest
@Import(JdbcProgressEntryRepository.class)
class JdbcProgressEntryRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    @Autowired
    JdbcProgressEntryRepository repository;
    @Autowired
    JdbcTemplate jdbcTemplate;

    @Test
    @DisplayName("upsert keeps one row per identity; last write wins")
    void upsertIsIdempotent() {
        repository.upsert(ProgressEntry.failed("w/a.csv", 7, "timeout", 4, T0));
        repository.upsert(ProgressEntry.completed("w/a.csv", 7, Label.CHRISTIAN, 1, T0.plusSeconds(5)));
        repository.upsert(ProgressEntry.completed("w/a.csv", 7, Label.CHRISTIAN, 1, T0.plusSeconds(6)));

        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM progress_entry", Integer.class);
        assertThat(rows).isEqualTo(1);
        ProgressEntry e = repository.findBySourceIdAndRecordId("w/a.csv", 7).orElseThrow();
        assertThat(e.getStatus()).isEqualTo(ProgressStatus.COMPLETED);
        assertThat(e.getLabel()).isEqualTo(Label.CHRISTIAN);
        assertThat(e.getErrorMessage()).isNull();
        assertThat(e.getUpdatedAt()).isEqualTo(T0.plusSeconds(6));
    }

    @Test
    @DisplayName("exists and counts distinguish status and source")
    void existsAndCounts() {
        repository.upsert(ProgressEntry.completed("a.csv", 0, Label.HINDU, 1, T0));
        repository.upsert(ProgressEntry.completed("a.csv", 1, Label.MUSLIM, 1, T0));
        repository.upsert(ProgressEntry.failed("a.csv", 2, "boom", 4, T0));
        repository.upsert(ProgressEntry.completed("b.csv", 0, Label.HINDU, 1, T0));

        assertThat(repository.existsBySourceIdAndRecordIdAndStatus("a.csv", 0, ProgressStatus.COMPLETED)).isTrue();
        assertThat(repository.existsBySourceIdAndRecordIdAndStatus("a.csv", 2, ProgressStatus.COMPLETED)).isFalse();
        assertThat(repository.existsBySourceIdAndRecordIdAndStatus("c.csv", 0, ProgressStatus.COMPLETED)).isFalse();
        assertThat(repository.countByStatus())
                .containsEntry(ProgressStatus.COMPLETED, 3L)
                .containsEntry(ProgressStatus.FAILED, 1L);
        assertThat(repository.countByStatusForSource("b.csv"))
                .containsEntry(ProgressStatus.COMPLETED, 1L)
                .doesNotContainKey(ProgressStatus.FAILED);
    }

    @Test
    void findBySourceAndStatusOrdersByRecordId() {
        repository.upsert(ProgressEntry.completed("a.csv", 9, Label.HINDU, 1, T0));
        repository.upsert(ProgressEntry.completed("a.csv", 2, Label.MUSLIM, 1, T0));

        List<ProgressEntry> entries = repository.findBySourceIdAndStatus("a.csv", ProgressStatus.COMPLETED);

        assertThat(entries).extracting(ProgressEntry::getRecordId).containsExactly(2L, 9L);
    }

    @Test
    @DisplayName("recent failures are newest first and limited")
    void recentFailures() {
        repository.upsert(ProgressEntry.failed("a.csv", 1, "first", 4, T0));
        repository.upsert(ProgressEntry.failed("a.csv", 2, "second", 4, T0.plusSeconds(10)));
        repository.upsert(ProgressEntry.failed("a.csv", 3, "third", 4, T0.plusSeconds(20)));

        List<ProgressEntry> recent = repository.findRecentByStatus(ProgressStatus.FAILED, 2);

        assertThat(recent).extracting(ProgressEntry::getErrorMessage).containsExactly("third", "second");
    }

    @Test
    void longErrorMessagesAreTruncated() {
        repository.upsert(ProgressEntry.failed("a.csv", 1, "x".repeat(5000), 4, T0));

        ProgressEntry e = repository.findBySourceIdAndRecordId("a.csv", 1).orElseThrow();
        assertThat(e.getErrorMessage()).hasSize(JdbcProgressEntryRepository.MAX_ERROR_MESSAGE_LENGTH);
    }
}
