package com.billsync.billsync.sync;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SyncSchedulerTest {

    @Test
    void shouldRunInboxPass() {
        SyncService syncService = mock(SyncService.class);
        when(syncService.syncInbox()).thenReturn(new InboxRunResult(List.of(), 0, 0, false));

        new SyncScheduler(syncService).scheduledInbox();

        verify(syncService, times(1)).syncInbox();
    }

    @Test
    void shouldLogFatalFailureInsteadOfPropagating() {
        SyncService syncService = mock(SyncService.class);
        when(syncService.syncInbox()).thenThrow(new SyncRunAbortedException(SyncConstants.MSG_DATABASE_UNAVAILABLE,
                new DataAccessResourceFailureException("Connection refused")));

        assertDoesNotThrow(() -> new SyncScheduler(syncService).scheduledInbox());
    }
}
