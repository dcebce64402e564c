package com.billsync.billsync.stats;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class JdbcRunHistoryRepositoryTest {

    @Autowired
    private JdbcRunHistoryRepository runHistoryRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void resetTable() {
        jdbcTemplate.execute("DELETE FROM sync_run");
    }

    @Test
    void shouldReturnRecentRunsNewestFirst() {
        LocalDateTime started = LocalDateTime.of(2025, 12, 1, 8, 0, 0);
        RunStatistics surveys = new RunStatistics(1000L, "survey_units", "MASTER_ASSETS_Nov-2025.csv", started,
                started.plusSeconds(2), 20, 0, 1, 0, 0, 0, 7, 0, 0, false, null);
        RunStatistics bills = new RunStatistics(1001L, "bills", "MASTER_FINANCIALS_Nov-2025.csv", started.plusSeconds(5),
                started.plusSeconds(9), 15, 3, 2, 1, 12, 8, 5, 1, 0, true, "Run aborted on request");

        runHistoryRepository.record(surveys);
        runHistoryRepository.record(bills);

        List<RunStatistics> recent = runHistoryRepository.recentRuns(10);
        assertEquals(List.of(bills, surveys), recent);
        assertTrue(recent.get(0).aborted());
        assertNull(recent.get(1).abortReason());
        assertEquals(1, runHistoryRepository.recentRuns(1).size());
    }
}
