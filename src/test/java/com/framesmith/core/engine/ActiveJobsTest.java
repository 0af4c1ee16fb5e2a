package com.framesmith.core.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ActiveJobsTest {

    private final ActiveJobs activeJobs = new ActiveJobs();

    @Test
    @DisplayName("Opened jobs get their own registry and can be looked up")
    void openAndLookup() {
        JobContext a = activeJobs.open("J-1");
        JobContext b = activeJobs.open("J-2");

        assertSame(a, activeJobs.require("J-1"));
        assertNotSame(a.registry(), b.registry());
        assertEquals(Set.of("J-1", "J-2"), activeJobs.activeJobIds());
    }

    @Test
    @DisplayName("Opening a running job id twice is an error")
    void duplicateOpen() {
        activeJobs.open("J-1");
        assertThrows(IllegalStateException.class, () -> activeJobs.open("J-1"));
    }

    @Test
    @DisplayName("Cancel flips the flag once and reports unknown jobs")
    void cancel() {
        JobContext context = activeJobs.open("J-1");

        assertTrue(activeJobs.cancel("J-1"));
        assertTrue(context.isCancelled());
        assertTrue(activeJobs.cancel("J-1"));
        assertFalse(context.cancel());
        assertFalse(activeJobs.cancel("J-404"));
    }

    @Test
    @DisplayName("Released jobs are gone")
    void release() {
        activeJobs.open("J-1");
        activeJobs.release("J-1");

        assertTrue(activeJobs.get("J-1").isEmpty());
        assertThrows(IllegalStateException.class, () -> activeJobs.require("J-1"));
        assertFalse(activeJobs.cancel("J-1"));
    }
}
