package me.golemcore.datapilot.domain.loop;

import me.golemcore.datapilot.domain.model.Artifact;
import me.golemcore.datapilot.domain.model.FailureKind;
import me.golemcore.datapilot.domain.model.InvocationStatus;
import me.golemcore.datapilot.domain.model.PipelineStage;
import me.golemcore.datapilot.domain.model.PrivacyMode;
import me.golemcore.datapilot.domain.model.Project;
import me.golemcore.datapilot.domain.model.ToolCall;
import me.golemcore.datapilot.domain.model.ToolDescriptor;
import me.golemcore.datapilot.domain.model.ToolInvocation;
import me.golemcore.datapilot.domain.model.Turn;
import me.golemcore.datapilot.domain.model.TurnKind;
import me.golemcore.datapilot.domain.model.TurnRole;
import me.golemcore.datapilot.domain.model.TurnVisibility;
import me.golemcore.datapilot.domain.registry.DataScienceToolCatalog;
import me.golemcore.datapilot.infrastructure.config.DataPilotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultConversationViewBuilderTest {

    private static final List<ToolDescriptor> CATALOG = new DataScienceToolCatalog().descriptors();

    private DataPilotProperties.LoopProperties settings;
    private DefaultConversationViewBuilder builder;

    @BeforeEach
    void setUp() {
        settings = new DataPilotProperties.LoopProperties();
        builder = new DefaultConversationViewBuilder(settings);
    }

    @Test
    void shouldDescribeStageAndArtifactsInSystemPrompt() {
        Map<String, Integer> index = new LinkedHashMap<>();
        index.put("dataset", 2);
        index.put("model", 1);
        Project project = project(List.of(user(1, "hi")));
        project.setStage(PipelineStage.MODEL);
        project.setArtifactIndex(index);

        ConversationView view = builder.buildView(project, CATALOG);

        assertTrue(view.systemPrompt().contains("Current stage: model."));
        assertTrue(view.systemPrompt().contains("Artifacts (latest versions): dataset@2, model@1."));
        assertTrue(view.systemPrompt().contains("ingest, explore, engineer, model, explain."));
        assertTrue(view.systemPrompt().contains("Available tools: " + CATALOG.size() + "."));
        assertFalse(view.systemPrompt().contains("Privacy:"));
        assertEquals(1, view.turns().size());
        assertTrue(view.diagnostics().isEmpty());
    }

    @Test
    void shouldAskForUploadWhenNoArtifacts() {
        ConversationView view = builder.buildView(project(List.of(user(1, "hi"))), CATALOG);

        assertTrue(view.systemPrompt().contains("Artifacts: none yet."));
    }

    @Test
    void shouldAddPrivacyRulesInGuardrailMode() {
        Project project = project(List.of(user(1, "hi")));
        project.setPrivacyMode(PrivacyMode.GUARDRAIL);

        ConversationView view = builder.buildView(project, CATALOG);

        assertTrue(view.systemPrompt().contains("Privacy: never request, print or reconstruct individual rows"));
    }

    @Test
    void shouldHideUserOnlyTurnsFromModel() {
        Turn summary = Turn.builder()
                .sequence(2L)
                .role(TurnRole.ASSISTANT)
                .kind(TurnKind.SUMMARY)
                .visibility(TurnVisibility.USER_ONLY)
                .content("Ran DatasetProfile.")
                .build();
        Turn correction = Turn.builder()
                .sequence(3L)
                .role(TurnRole.TOOL)
                .kind(TurnKind.CORRECTION)
                .toolCallId("c1")
                .visibility(TurnVisibility.MODEL_ONLY)
                .content("Rejected call")
                .build();

        ConversationView view = builder.buildView(project(List.of(user(1, "hi"), summary, correction)), CATALOG);

        assertEquals(List.of(1L, 3L), view.turns().stream().map(Turn::getSequence).toList());
    }

    @Test
    void shouldSummarizeTurnsOutsideWindow() {
        settings.setContextWindowTurns(2);
        List<Turn> turns = new ArrayList<>();
        turns.add(user(1, "impute   the\nmissing values"));
        turns.add(calls(2, "c1", "HyperImputeImputation"));
        turns.add(result(3, "c1", "HyperImputeImputation", InvocationStatus.SUCCEEDED, null,
                List.of(artifact("dataset", 2))));
        turns.add(calls(4, "c2", "AutoPromptClassification"));
        turns.add(result(5, "c2", "AutoPromptClassification", InvocationStatus.FAILED, FailureKind.TIMEOUT,
                List.of()));
        turns.add(user(6, "why did it fail?"));

        ConversationView view = builder.buildView(project(turns), CATALOG);

        assertEquals(List.of(6L), view.turns().stream().map(Turn::getSequence).toList());
        String prompt = view.systemPrompt();
        assertTrue(prompt.contains("Earlier in this project:"));
        assertTrue(prompt.contains("- User: impute the missing values"));
        assertTrue(prompt.contains("- Tool HyperImputeImputation succeeded, produced dataset@2"));
        assertTrue(prompt.contains("- Tool AutoPromptClassification failed (TIMEOUT)"));
        assertTrue(view.diagnostics().contains("dropped 1 tool result(s) whose call is outside the window"));
        assertTrue(view.diagnostics().contains("summarized 5 older turn(s)"));
    }

    @Test
    void shouldNeverStartWindowWithToolResult() {
        settings.setContextWindowTurns(3);
        List<Turn> turns = List.of(
                user(1, "profile"),
                calls(2, "c1", "DatasetProfile"),
                result(3, "c1", "DatasetProfile", InvocationStatus.SUCCEEDED, null, List.of()),
                user(4, "thanks"));

        ConversationView view = builder.buildView(project(turns), CATALOG);

        assertEquals(TurnRole.ASSISTANT, view.turns().get(0).getRole());
        assertEquals(3, view.turns().size());
        assertTrue(view.diagnostics().contains("summarized 1 older turn(s)"));
    }

    @Test
    void shouldDropToolCallsLeftWithoutResults() {
        Turn pair = Turn.builder()
                .sequence(2L)
                .role(TurnRole.ASSISTANT)
                .kind(TurnKind.TOOL_CALLS)
                .toolCalls(List.of(ToolCall.builder().id("c1").name("DatasetProfile").build(),
                        ToolCall.builder().id("c2").name("DescriptiveStatistics").build()))
                .build();
        List<Turn> turns = List.of(
                user(1, "profile and describe"),
                pair,
                result(3, "c1", "DatasetProfile", InvocationStatus.SUCCEEDED, null, List.of()),
                user(4, "are you there?"));

        ConversationView view = builder.buildView(project(turns), CATALOG);

        assertEquals(List.of(1L, 4L), view.turns().stream().map(Turn::getSequence).toList());
        assertTrue(view.diagnostics().contains("dropped 2 turn(s) of tool calls left without results"));
    }

    @Test
    void shouldExposeImmutableViewTurns() {
        ConversationView view = builder.buildView(project(List.of(user(1, "hi"))), CATALOG);

        assertThrows(UnsupportedOperationException.class, () -> view.turns().add(user(2, "more")));
    }

    private static Project project(List<Turn> turns) {
        return Project.builder()
                .id("p1")
                .name("Churn")
                .turns(new ArrayList<>(turns))
                .build();
    }

    private static Turn user(long sequence, String text) {
        return Turn.builder().sequence(sequence).role(TurnRole.USER).content(text).build();
    }

    private static Turn calls(long sequence, String callId, String tool) {
        return Turn.builder()
                .sequence(sequence)
                .role(TurnRole.ASSISTANT)
                .kind(TurnKind.TOOL_CALLS)
                .toolCalls(List.of(ToolCall.builder().id(callId).name(tool).build()))
                .build();
    }

    private static Turn result(long sequence, String callId, String tool, InvocationStatus status,
            FailureKind failureKind, List<Artifact> artifacts) {
        ToolInvocation invocation = ToolInvocation.builder()
                .id("inv-" + sequence)
                .toolName(tool)
                .status(status)
                .failureKind(failureKind)
                .build();
        return Turn.builder()
                .sequence(sequence)
                .role(TurnRole.TOOL)
                .kind(TurnKind.TOOL_RESULT)
                .toolCallId(callId)
                .toolName(tool)
                .invocation(invocation)
                .artifacts(new ArrayList<>(artifacts))
                .content("Tool " + tool + " " + status)
                .build();
    }

    private static Artifact artifact(String name, int version) {
        return Artifact.builder().projectId("p1").name(name).version(version).build();
    }
}
