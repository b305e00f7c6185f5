package me.golemcore.datapilot.adapter.outbound.provider;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import me.golemcore.datapilot.domain.model.ModelResponse;
import me.golemcore.datapilot.domain.model.ProviderRequest;
import me.golemcore.datapilot.domain.model.ToolCall;
import me.golemcore.datapilot.domain.model.ToolDescriptor;
import me.golemcore.datapilot.domain.model.Turn;
import me.golemcore.datapilot.domain.model.TurnRole;
import me.golemcore.datapilot.domain.registry.DataScienceToolCatalog;
import me.golemcore.datapilot.infrastructure.config.AutoConfiguration;
import me.golemcore.datapilot.infrastructure.config.DataPilotProperties.ProviderKind;
import me.golemcore.datapilot.infrastructure.config.DataPilotProperties.ProviderProfileProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jProviderAdapterTest {

    private ChatModel chatModel;
    private AtomicInteger modelsCreated;
    private Langchain4jProviderAdapter adapter;
    private ResolvedProfile profile;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        modelsCreated = new AtomicInteger();
        adapter = new Langchain4jProviderAdapter(AutoConfiguration.objectMapper(), resolved -> {
            modelsCreated.incrementAndGet();
            return chatModel;
        });
        ProviderProfileProperties settings = new ProviderProfileProperties();
        settings.setKind(ProviderKind.OPENAI);
        settings.setModel("gpt-4o");
        profile = new ResolvedProfile("openai", settings, "sk-test");
    }

    @Test
    void shouldServeOpenAiAndAnthropic() {
        assertEquals(2, adapter.kinds().size());
        assertTrue(adapter.kinds().contains(ProviderKind.ANTHROPIC));
    }

    @Test
    void shouldConvertToolCallsFromResponse() {
        ToolExecutionRequest call = ToolExecutionRequest.builder()
                .id("call_1")
                .name("HyperImputeImputation")
                .arguments("{\"dataset\":\"dataset@1\",\"method\":\"mean\"}")
                .build();
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from(call))
                .tokenUsage(new TokenUsage(120, 30))
                .build());

        ModelResponse response = adapter.complete(profile, request(), new DataScienceToolCatalog().descriptors());

        assertTrue(response.hasToolCalls());
        ToolCall toolCall = response.getToolCalls().get(0);
        assertEquals("call_1", toolCall.getId());
        assertEquals("HyperImputeImputation", toolCall.getName());
        assertEquals(Map.of("dataset", "dataset@1", "method", "mean"), toolCall.getArguments());
        assertEquals(150, response.getUsage().totalTokens());
        assertEquals("gpt-4o", response.getModel());
    }

    @Test
    void shouldGenerateIdForCallWithoutOne() {
        ToolExecutionRequest call = ToolExecutionRequest.builder()
                .name("DatasetProfile")
                .arguments("not json")
                .build();
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from(call))
                .build());

        ModelResponse response = adapter.complete(profile, request(), List.of());

        ToolCall toolCall = response.getToolCalls().get(0);
        assertTrue(toolCall.getId().startsWith("call_"));
        assertTrue(toolCall.getArguments().isEmpty());
    }

    @Test
    void shouldReturnPlainTextAndReuseModel() {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("Upload a CSV file to begin."))
                .build());

        adapter.complete(profile, request(), List.of());
        ModelResponse response = adapter.complete(profile, request(), List.of());

        assertFalse(response.hasToolCalls());
        assertEquals("Upload a CSV file to begin.", response.getText());
        assertEquals(1, modelsCreated.get());
    }

    @Test
    void shouldSendToolSpecificationsWhenCatalogGiven() {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("ok"))
                .build());

        adapter.complete(profile, request(), new DataScienceToolCatalog().descriptors());

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        assertEquals(12, captor.getValue().toolSpecifications().size());
        assertInstanceOf(SystemMessage.class, captor.getValue().messages().get(0));
    }

    @Test
    void shouldKeepToolProtocolWhenConvertingMessages() {
        ProviderRequest request = ProviderRequest.builder()
                .systemPrompt("system")
                .turn(Turn.builder().role(TurnRole.USER).content("impute").build())
                .turn(Turn.builder()
                        .role(TurnRole.ASSISTANT)
                        .toolCalls(List.of(ToolCall.builder()
                                .id("call_1")
                                .name("HyperImputeImputation")
                                .arguments(Map.of("method", "mean"))
                                .build()))
                        .build())
                .turn(Turn.builder()
                        .role(TurnRole.TOOL)
                        .toolCallId("call_1")
                        .toolName("HyperImputeImputation")
                        .content("Tool HyperImputeImputation succeeded.")
                        .build())
                .turn(Turn.builder().role(TurnRole.ASSISTANT).content("Done.").build())
                .build();

        List<ChatMessage> messages = adapter.convertMessages(request);

        assertEquals(5, messages.size());
        assertInstanceOf(UserMessage.class, messages.get(1));
        AiMessage calls = assertInstanceOf(AiMessage.class, messages.get(2));
        assertTrue(calls.hasToolExecutionRequests());
        assertEquals("{\"method\":\"mean\"}", calls.toolExecutionRequests().get(0).arguments());
        ToolExecutionResultMessage result = assertInstanceOf(ToolExecutionResultMessage.class, messages.get(3));
        assertEquals("call_1", result.id());
        assertEquals("Done.", assertInstanceOf(AiMessage.class, messages.get(4)).text());
    }

    @Test
    void shouldMapParameterTypesWhenConvertingTools() {
        ToolDescriptor selection = new DataScienceToolCatalog().descriptors().stream()
                .filter(descriptor -> descriptor.getName().equals("FeatureSelection"))
                .findFirst()
                .orElseThrow();

        List<ToolSpecification> specifications = adapter.convertTools(List.of(selection));

        JsonObjectSchema parameters = specifications.get(0).parameters();
        assertNotNull(parameters);
        assertInstanceOf(JsonIntegerSchema.class, parameters.properties().get("max_features"));
        assertTrue(adapter.convertTools(null).isEmpty());
    }

    @Test
    void shouldUseEnumSchemaForAllowedValues() {
        ToolDescriptor impute = new DataScienceToolCatalog().descriptors().stream()
                .filter(descriptor -> descriptor.getName().equals("HyperImputeImputation"))
                .findFirst()
                .orElseThrow();

        JsonObjectSchema parameters = adapter.convertTools(List.of(impute)).get(0).parameters();

        JsonEnumSchema method = assertInstanceOf(JsonEnumSchema.class, parameters.properties().get("method"));
        assertTrue(method.enumValues().contains("missforest"));
    }

    private static ProviderRequest request() {
        return ProviderRequest.builder()
                .projectId("p1")
                .systemPrompt("You are DataPilot")
                .turn(Turn.builder().role(TurnRole.USER).content("impute missing values").build())
                .build();
    }
}
