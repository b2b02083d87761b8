package com.marketdesk.jobs.service;

import com.marketdesk.jobs.domain.JobDefinition;
import com.marketdesk.jobs.exception.JobConfigurationException;
import com.marketdesk.jobs.exception.JobNotFoundException;
import com.marketdesk.jobs.infrastructure.JobStatusStore;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JobRegistryTest {

    private static JobDefinition job(String name, LocalTime... times) {
        JobDefinition.JobDefinitionBuilder builder = JobDefinition.builder().name(name).function(context -> { });
        for (LocalTime time : times) {
            builder.at(time);
        }
        return builder.build();
    }

    @Test
    void testRegister_ListsSortedByName() {
        // Arrange
        JobRegistry registry = new JobRegistry();

        // Act
        registry.register(job("Zeta", LocalTime.of(9, 0)));
        registry.register(job("Alpha", LocalTime.of(21, 0)));

        // Assert
        assertThat(registry.list()).extracting(JobDefinition::getName).containsExactly("Alpha", "Zeta");
        assertEquals(2, registry.size());
    }

    @Test
    void testRegister_DuplicateNameRejected() {
        // Arrange
        JobRegistry registry = new JobRegistry();
        registry.register(job("Same", LocalTime.of(9, 0)));

        // Act & Assert
        assertThrows(JobConfigurationException.class, () -> registry.register(job("Same", LocalTime.of(10, 0))));
    }

    @Test
    void testGetRequired_UnknownJobThrows() {
        JobRegistry registry = new JobRegistry();
        assertThrows(JobNotFoundException.class, () -> registry.getRequired("Missing"));
        assertTrue(registry.find("Missing").isEmpty());
    }

    @Test
    void testJobDefinition_RejectsEmptySchedule() {
        assertThrows(JobConfigurationException.class, () -> job("NoTimes"));
    }

    @Test
    void testJobDefinition_SortsAndDedupsSchedule() {
        // Act
        JobDefinition job = job("Twice", LocalTime.of(20, 30), LocalTime.of(8, 0), LocalTime.of(20, 30));

        // Assert
        assertThat(job.getSchedule()).containsExactly(LocalTime.of(8, 0), LocalTime.of(20, 30));
    }

    @Test
    void testLoadStatus_CopiesPersistedTimestamps() {
        // Arrange
        JobRegistry registry = new JobRegistry();
        registry.register(job("Daily", LocalTime.of(21, 0)));
        JobStatusStore statusStore = mock(JobStatusStore.class);
        Instant lastRun = Instant.parse("2024-03-01T02:00:00Z");
        when(statusStore.findLastRun(anyString())).thenReturn(Optional.of(lastRun));
        when(statusStore.findLastCompletion(anyString())).thenReturn(Optional.empty());

        // Act
        registry.loadStatus(statusStore);

        // Assert
        assertEquals(lastRun, registry.getRequired("Daily").getLastRun());
        assertNull(registry.getRequired("Daily").getLastCompletion());
    }
}
