package me.golemcore.datapilot.adapter.inbound.web.controller;

import me.golemcore.datapilot.adapter.inbound.web.dto.ArtifactDto;
import me.golemcore.datapilot.adapter.inbound.web.dto.CreateProjectRequest;
import me.golemcore.datapilot.adapter.inbound.web.dto.ProjectDetailDto;
import me.golemcore.datapilot.adapter.inbound.web.dto.ProjectSummaryDto;
import me.golemcore.datapilot.adapter.inbound.web.dto.RenameProjectRequest;
import me.golemcore.datapilot.adapter.inbound.web.dto.TurnOutcomeDto;
import me.golemcore.datapilot.adapter.inbound.web.dto.UserTurnRequest;
import me.golemcore.datapilot.domain.exception.ConcurrentModificationException;
import me.golemcore.datapilot.domain.exception.ProjectNotFoundException;
import me.golemcore.datapilot.domain.loop.LoopStateTracker;
import me.golemcore.datapilot.domain.model.Artifact;
import me.golemcore.datapilot.domain.model.ArtifactKind;
import me.golemcore.datapilot.domain.model.LoopState;
import me.golemcore.datapilot.domain.model.PipelineStage;
import me.golemcore.datapilot.domain.model.PrivacyMode;
import me.golemcore.datapilot.domain.model.Project;
import me.golemcore.datapilot.domain.model.ProviderUsage;
import me.golemcore.datapilot.domain.model.ToolCall;
import me.golemcore.datapilot.domain.model.Turn;
import me.golemcore.datapilot.domain.model.TurnKind;
import me.golemcore.datapilot.domain.model.TurnOutcome;
import me.golemcore.datapilot.domain.model.TurnRole;
import me.golemcore.datapilot.domain.model.TurnVisibility;
import me.golemcore.datapilot.domain.service.ProjectRunCoordinator;
import me.golemcore.datapilot.port.outbound.ArtifactStorePort;
import me.golemcore.datapilot.port.outbound.ProjectPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProjectsControllerTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T10:00:00Z");

    private ProjectPort projectPort;
    private ArtifactStorePort artifactStore;
    private ProjectRunCoordinator runCoordinator;
    private LoopStateTracker stateTracker;
    private ProjectsController controller;

    @BeforeEach
    void setUp() {
        projectPort = mock(ProjectPort.class);
        artifactStore = mock(ArtifactStorePort.class);
        runCoordinator = mock(ProjectRunCoordinator.class);
        stateTracker = new LoopStateTracker();
        controller = new ProjectsController(projectPort, artifactStore, runCoordinator, stateTracker);
        when(runCoordinator.runExclusive(anyString(), any()))
                .thenAnswer(invocation -> invocation.<Supplier<?>>getArgument(1).get());
    }

    @Test
    void shouldListProjects() {
        when(projectPort.list()).thenReturn(List.of(project("p1", List.of())));

        StepVerifier.create(controller.listProjects())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    List<ProjectSummaryDto> body = response.getBody();
                    assertNotNull(body);
                    assertEquals(1, body.size());
                    assertEquals("p1", body.get(0).getId());
                    assertEquals("ingest", body.get(0).getStage());
                    assertEquals("AWAITING_USER", body.get(0).getLoopState());
                    assertEquals(1, body.get(0).getArtifactCount());
                    assertEquals(CREATED.toString(), body.get(0).getCreatedAt());
                })
                .verifyComplete();
    }

    @Test
    void shouldCreateProjectWithPrivacyMode() {
        Project project = project("p1", List.of());
        project.setPrivacyMode(PrivacyMode.GUARDRAIL);
        when(projectPort.create("Churn", "openai", PrivacyMode.GUARDRAIL)).thenReturn(project);

        CreateProjectRequest request = CreateProjectRequest.builder()
                .name("Churn")
                .profile("openai")
                .privacyMode("guardrail")
                .build();

        StepVerifier.create(controller.createProject(request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    assertEquals("GUARDRAIL", response.getBody().getPrivacyMode());
                })
                .verifyComplete();
    }

    @Test
    void shouldCreateProjectWithoutBody() {
        when(projectPort.create(null, null, null)).thenReturn(project("p1", List.of()));

        StepVerifier.create(controller.createProject(null))
                .assertNext(response -> assertEquals(HttpStatus.CREATED, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldRejectUnknownPrivacyMode() {
        CreateProjectRequest request = CreateProjectRequest.builder().privacyMode("paranoid").build();

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.createProject(request));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        verify(projectPort, never()).create(any(), any(), any());
    }

    @Test
    void shouldHideModelOnlyTurnsInDetail() {
        Turn user = Turn.builder().sequence(1L).role(TurnRole.USER).content("train").build();
        Turn calls = Turn.builder()
                .sequence(2L)
                .role(TurnRole.ASSISTANT)
                .kind(TurnKind.TOOL_CALLS)
                .toolCalls(List.of(ToolCall.builder().id("c1").name("AutoPromptClassification").build()))
                .build();
        Turn correction = Turn.builder()
                .sequence(3L)
                .role(TurnRole.TOOL)
                .kind(TurnKind.CORRECTION)
                .visibility(TurnVisibility.MODEL_ONLY)
                .content("Rejected call")
                .build();
        Project project = project("p1", List.of(user, calls, correction));
        project.setTokenUsage(new ProviderUsage(500, 40));
        when(projectPort.snapshot("p1")).thenReturn(project);

        StepVerifier.create(controller.getProject("p1"))
                .assertNext(response -> {
                    ProjectDetailDto body = response.getBody();
                    assertEquals(2, body.getTurns().size());
                    assertEquals("TOOL_CALLS", body.getTurns().get(1).getKind());
                    assertEquals("AutoPromptClassification",
                            body.getTurns().get(1).getToolCalls().get(0).getName());
                    assertNull(body.getTurns().get(0).getToolCalls());
                    assertEquals(Map.of("dataset", 1), body.getArtifacts());
                    assertEquals(500, body.getTokenUsage().getInputTokens());
                    assertEquals(540, body.getTokenUsage().getTotalTokens());
                })
                .verifyComplete();
    }

    @Test
    void shouldPropagateMissingProject() {
        when(projectPort.snapshot("missing")).thenThrow(new ProjectNotFoundException("missing"));

        assertThrows(ProjectNotFoundException.class, () -> controller.getProject("missing"));
    }

    @Test
    void shouldRenameProject() {
        Project renamed = project("p1", List.of());
        renamed.setName("Churn v2");
        when(projectPort.rename("p1", "Churn v2")).thenReturn(renamed);

        StepVerifier.create(controller.renameProject("p1", new RenameProjectRequest("Churn v2")))
                .assertNext(response -> assertEquals("Churn v2", response.getBody().getName()))
                .verifyComplete();
    }

    @Test
    void shouldPostTurnAndReturnOutcome() {
        Turn summary = Turn.builder()
                .sequence(5L)
                .role(TurnRole.ASSISTANT)
                .kind(TurnKind.SUMMARY)
                .visibility(TurnVisibility.USER_ONLY)
                .content("Ran HyperImputeImputation: produced dataset@2.")
                .build();
        TurnOutcome outcome = new TurnOutcome("p1", true, List.of(summary), PipelineStage.ENGINEER, 1, 1,
                new ProviderUsage(1200, 80));
        when(runCoordinator.submit("p1", "impute")).thenReturn(CompletableFuture.completedFuture(outcome));

        StepVerifier.create(controller.postTurn("p1", new UserTurnRequest("impute")))
                .assertNext(response -> {
                    TurnOutcomeDto body = response.getBody();
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("engineer", body.getStage());
                    assertEquals(1, body.getToolExecutions());
                    assertEquals(1280, body.getTokenUsage().getTotalTokens());
                    assertEquals("SUMMARY", body.getTurns().get(0).getKind());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectBlankTurn() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.postTurn("p1", new UserTurnRequest(" ")));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        verify(runCoordinator, never()).submit(anyString(), anyString());
    }

    @Test
    void shouldConflictOnCancelWithoutRunningTurn() {
        when(projectPort.snapshot("p1")).thenReturn(project("p1", List.of()));
        when(runCoordinator.cancel("p1")).thenReturn(false);

        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> controller.cancelTurn("p1"));
        assertEquals(HttpStatus.CONFLICT, ex.getStatusCode());
    }

    @Test
    void shouldAcceptCancel() {
        when(projectPort.snapshot("p1")).thenReturn(project("p1", List.of()));
        when(runCoordinator.cancel("p1")).thenReturn(true);

        StepVerifier.create(controller.cancelTurn("p1"))
                .assertNext(response -> assertEquals(HttpStatus.ACCEPTED, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldRegisterDatasetOnUpload() {
        byte[] content = "a,b\n1,2\n".getBytes(StandardCharsets.UTF_8);
        when(projectPort.registerUpload("p1", "data.csv", content)).thenReturn(artifact(2));

        StepVerifier.create(controller.upload("p1", "data.csv", content))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    ArtifactDto body = response.getBody();
                    assertEquals("dataset@2", body.getReference());
                    assertEquals("DATASET", body.getKind());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectWritesWhileTurnRuns() {
        doThrow(new ConcurrentModificationException("p1", "Project p1 is processing a turn"))
                .when(runCoordinator).runExclusive(eq("p1"), any());
        byte[] content = new byte[] { 1 };

        assertThrows(ConcurrentModificationException.class, () -> controller.upload("p1", "data.csv", content));
        assertThrows(ConcurrentModificationException.class, () -> controller.deleteProject("p1"));
        assertThrows(ConcurrentModificationException.class, () -> controller.restoreProject("p1"));
        assertThrows(ConcurrentModificationException.class,
                () -> controller.renameProject("p1", new RenameProjectRequest("Churn v2")));
        verify(projectPort, never()).registerUpload(anyString(), anyString(), any());
        verify(projectPort, never()).delete(anyString());
        verify(projectPort, never()).restore(anyString());
        verify(projectPort, never()).rename(anyString(), anyString());
    }

    @Test
    void shouldRejectEmptyUpload() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.upload("p1", "data.csv", new byte[0]));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }

    @Test
    void shouldDeleteIdleProject() {
        StepVerifier.create(controller.deleteProject("p1"))
                .assertNext(response -> assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode()))
                .verifyComplete();
        verify(projectPort).delete("p1");
    }

    @Test
    void shouldListEveryArtifactVersion() {
        when(projectPort.snapshot("p1")).thenReturn(project("p1", List.of()));
        when(projectPort.artifacts("p1", "dataset")).thenReturn(List.of(artifact(1), artifact(2)));

        StepVerifier.create(controller.listArtifacts("p1"))
                .assertNext(response -> assertEquals(List.of("dataset@1", "dataset@2"),
                        response.getBody().stream().map(ArtifactDto::getReference).toList()))
                .verifyComplete();
    }

    @Test
    void shouldCarryReferenceAndHashHeadersOnDownload() {
        Artifact artifact = artifact(2);
        byte[] content = "a,b\n".getBytes(StandardCharsets.UTF_8);
        when(projectPort.artifact(eq("p1"), eq("dataset"), isNull())).thenReturn(artifact);
        when(artifactStore.read(artifact)).thenReturn(content);

        StepVerifier.create(controller.downloadArtifact("p1", "dataset", null))
                .assertNext(response -> {
                    assertArrayEquals(content, response.getBody());
                    HttpHeaders headers = response.getHeaders();
                    assertEquals("dataset@2", headers.getFirst("X-Artifact-Reference"));
                    assertEquals("abc123", headers.getFirst("X-Content-SHA256"));
                    assertEquals("attachment; filename=\"data.csv\"",
                            headers.getFirst(HttpHeaders.CONTENT_DISPOSITION));
                })
                .verifyComplete();
    }

    @Test
    void shouldReflectActiveTurnInLoopState() {
        stateTracker.enter("p1");
        stateTracker.transition("p1", LoopState.TOOL_DISPATCH);
        when(projectPort.snapshot("p1")).thenReturn(project("p1", List.of()));

        StepVerifier.create(controller.getProject("p1"))
                .assertNext(response -> assertEquals("TOOL_DISPATCH", response.getBody().getLoopState()))
                .verifyComplete();
    }

    private static Project project(String id, List<Turn> turns) {
        Map<String, Integer> index = new LinkedHashMap<>();
        index.put("dataset", 1);
        return Project.builder()
                .id(id)
                .name("Churn")
                .profile("none")
                .createdAt(CREATED)
                .updatedAt(CREATED)
                .turns(new ArrayList<>(turns))
                .artifactIndex(index)
                .build();
    }

    private static Artifact artifact(int version) {
        return Artifact.builder()
                .projectId("p1")
                .name("dataset")
                .version(version)
                .kind(ArtifactKind.DATASET)
                .fileName("data.csv")
                .contentHash("abc123")
                .createdAt(CREATED)
                .build();
    }
}
