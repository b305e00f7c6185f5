package me.golemcore.datapilot.adapter.outbound.provider;

import me.golemcore.datapilot.domain.model.ToolCall;
import me.golemcore.datapilot.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolArgumentsJsonTest {

    private final ToolArgumentsJson json = new ToolArgumentsJson(AutoConfiguration.objectMapper());

    @Test
    void shouldWriteArgumentsInOrder() {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("dataset", "dataset@2");
        arguments.put("columns", List.of("age", "income"));

        assertEquals("{\"dataset\":\"dataset@2\",\"columns\":[\"age\",\"income\"]}", json.write(arguments));
    }

    @Test
    void shouldWriteEmptyArgumentsAsEmptyObject() {
        assertEquals("{}", json.write(null));
        assertEquals("{}", json.write(Map.of()));
    }

    @Test
    void shouldParseArgumentsIntoCall() {
        ToolCall call = json.toCall("c1", "AutoPromptClassification",
                "{\"target_column\":\"churned\",\"time_budget_minutes\":15}");

        assertEquals("c1", call.getId());
        assertEquals("AutoPromptClassification", call.getName());
        assertEquals("churned", call.getArguments().get("target_column"));
        assertEquals(15, call.getArguments().get("time_budget_minutes"));
        assertFalse(call.hasArgumentsError());
    }

    @Test
    void shouldTreatMissingArgumentTextAsEmptyObject() {
        assertTrue(json.toCall("c1", "DatasetProfile", "").getArguments().isEmpty());
        assertFalse(json.toCall("c1", "DatasetProfile", null).hasArgumentsError());
    }

    @Test
    void shouldReportTruncatedArgumentsInsteadOfDroppingThem() {
        ToolCall call = json.toCall("c1", "HyperImputeImputation", "{\"dataset\": \"v1\", \"method\": \"mea");

        assertTrue(call.getArguments().isEmpty());
        assertTrue(call.hasArgumentsError());
        assertNotNull(call.getArgumentsError());
    }

    @Test
    void shouldReportNonObjectArguments() {
        assertTrue(json.toCall("c1", "DatasetProfile", "[\"v1\"]").hasArgumentsError());
    }

    @Test
    void shouldGenerateIdWhenProviderSendsNone() {
        assertTrue(json.toCall(null, "DatasetProfile", "{}").getId().startsWith("call_"));
    }
}
