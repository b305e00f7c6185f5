package me.golemcore.datapilot.adapter.outbound.provider;

import me.golemcore.datapilot.domain.model.ModelResponse;
import me.golemcore.datapilot.domain.model.ProviderRequest;
import me.golemcore.datapilot.infrastructure.config.DataPilotProperties.ProviderKind;
import me.golemcore.datapilot.infrastructure.config.DataPilotProperties.ProviderProfileProperties;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class NoOpProviderAdapterTest {

    @Test
    void shouldAnswerWithConfigurationNotice() {
        NoOpProviderAdapter adapter = new NoOpProviderAdapter();

        ModelResponse response = adapter.complete(new ResolvedProfile("none", new ProviderProfileProperties(), null),
                ProviderRequest.builder().projectId("p1").build(), List.of());

        assertEquals(Set.of(ProviderKind.NONE), adapter.kinds());
        assertFalse(response.hasToolCalls());
        assertEquals(NoOpProviderAdapter.NOTICE, response.getText());
        assertEquals("none", response.getModel());
    }
}
