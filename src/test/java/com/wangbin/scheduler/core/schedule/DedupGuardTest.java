package com.wangbin.scheduler.core.schedule;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DedupGuardTest {

    @Test
    void markAndRollback() {
        DedupGuard guard = new DedupGuard();
        assertTrue(guard.shouldRun("2026-W43"));

        guard.markCompleted("2026-W43");
        assertFalse(guard.shouldRun("2026-W43"));
        assertTrue(guard.shouldRun("2026-W44"));

        guard.rollback();
        assertNull(guard.getLastCompletedPeriodKey());
        assertTrue(guard.shouldRun("2026-W43"));
    }
}
