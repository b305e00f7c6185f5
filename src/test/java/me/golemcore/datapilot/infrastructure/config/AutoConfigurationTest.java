package me.golemcore.datapilot.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.datapilot.domain.registry.DataScienceToolCatalog;
import me.golemcore.datapilot.domain.registry.ToolRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AutoConfigurationTest {

    @Test
    void shouldWriteInstantsAsIsoText() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        String json = mapper.writeValueAsString(Map.of("at", Instant.parse("2026-03-01T10:00:00Z")));

        assertEquals("{\"at\":\"2026-03-01T10:00:00Z\"}", json);
    }

    @Test
    void shouldIgnoreUnknownFieldsInObjectMapper() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        DataPilotProperties.LoopProperties loop = mapper.readValue(
                "{\"maxModelCalls\":5,\"futureSetting\":true}", DataPilotProperties.LoopProperties.class);

        assertEquals(5, loop.getMaxModelCalls());
    }

    @Test
    void shouldRunProjectsOnNamedDaemonThreads() throws Exception {
        DataPilotProperties properties = new DataPilotProperties();
        properties.getLoop().setMaxConcurrentProjects(2);
        AutoConfiguration configuration = new AutoConfiguration(properties, registry());

        ExecutorService executor = configuration.projectRunExecutor();
        try {
            Thread thread = executor.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);
            assertTrue(thread.isDaemon());
            assertTrue(thread.getName().startsWith("project-run-"));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldLogConfigurationOnInit() {
        AutoConfiguration configuration = new AutoConfiguration(new DataPilotProperties(), registry());

        assertDoesNotThrow(configuration::init);
    }

    private static ToolRegistry registry() {
        return ToolRegistry.fromCatalogs(List.of(new DataScienceToolCatalog()));
    }
}
