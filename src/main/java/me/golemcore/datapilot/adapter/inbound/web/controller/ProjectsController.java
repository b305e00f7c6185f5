package me.golemcore.datapilot.adapter.inbound.web.controller;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.datapilot.adapter.inbound.web.dto.ArtifactDto;
import me.golemcore.datapilot.adapter.inbound.web.dto.CreateProjectRequest;
import me.golemcore.datapilot.adapter.inbound.web.dto.ProjectDetailDto;
import me.golemcore.datapilot.adapter.inbound.web.dto.ProjectSummaryDto;
import me.golemcore.datapilot.adapter.inbound.web.dto.RenameProjectRequest;
import me.golemcore.datapilot.adapter.inbound.web.dto.TokenUsageDto;
import me.golemcore.datapilot.adapter.inbound.web.dto.TurnDto;
import me.golemcore.datapilot.adapter.inbound.web.dto.TurnOutcomeDto;
import me.golemcore.datapilot.adapter.inbound.web.dto.UserTurnRequest;
import me.golemcore.datapilot.domain.loop.LoopStateTracker;
import me.golemcore.datapilot.domain.model.Artifact;
import me.golemcore.datapilot.domain.model.PrivacyMode;
import me.golemcore.datapilot.domain.model.Project;
import me.golemcore.datapilot.domain.model.ProviderUsage;
import me.golemcore.datapilot.domain.model.Turn;
import me.golemcore.datapilot.domain.model.TurnOutcome;
import me.golemcore.datapilot.domain.service.ProjectRunCoordinator;
import me.golemcore.datapilot.port.outbound.ArtifactStorePort;
import me.golemcore.datapilot.port.outbound.ProjectPort;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Project endpoints: lifecycle, user turns, uploads and artifacts.
 */
@RestController
@RequestMapping("/api/projects")
@RequiredArgsConstructor
@Slf4j
public class ProjectsController {

    private final ProjectPort projectPort;
    private final ArtifactStorePort artifactStore;
    private final ProjectRunCoordinator runCoordinator;
    private final LoopStateTracker stateTracker;

    @GetMapping
    public Mono<ResponseEntity<List<ProjectSummaryDto>>> listProjects() {
        List<ProjectSummaryDto> dtos = projectPort.list().stream()
                .map(this::toSummary)
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @PostMapping
    public Mono<ResponseEntity<ProjectSummaryDto>> createProject(
            @RequestBody(required = false) CreateProjectRequest request) {
        CreateProjectRequest normalized = request != null ? request : CreateProjectRequest.builder().build();
        Project project = projectPort.create(normalized.getName(), normalized.getProfile(),
                parsePrivacyMode(normalized.getPrivacyMode()));
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(toSummary(project)));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<ProjectDetailDto>> getProject(@PathVariable String id) {
        return Mono.just(ResponseEntity.ok(toDetail(projectPort.snapshot(id))));
    }

    @PostMapping("/{id}/rename")
    public Mono<ResponseEntity<ProjectSummaryDto>> renameProject(@PathVariable String id,
            @RequestBody RenameProjectRequest request) {
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "name is required");
        }
        Project renamed = runCoordinator.runExclusive(id, () -> projectPort.rename(id, request.getName()));
        return Mono.just(ResponseEntity.ok(toSummary(renamed)));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteProject(@PathVariable String id) {
        runCoordinator.runExclusive(id, () -> {
            projectPort.delete(id);
            return null;
        });
        return Mono.just(ResponseEntity.noContent().build());
    }

    @PostMapping("/{id}/restore")
    public Mono<ResponseEntity<ProjectDetailDto>> restoreProject(@PathVariable String id) {
        Project restored = runCoordinator.runExclusive(id, () -> projectPort.restore(id));
        return Mono.just(ResponseEntity.ok(toDetail(restored)));
    }

    @PostMapping("/{id}/turns")
    public Mono<ResponseEntity<TurnOutcomeDto>> postTurn(@PathVariable String id,
            @RequestBody UserTurnRequest request) {
        if (request == null || request.getText() == null || request.getText().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "text is required");
        }
        return Mono.fromFuture(runCoordinator.submit(id, request.getText()))
                .map(outcome -> ResponseEntity.ok(toOutcome(outcome)));
    }

    @PostMapping("/{id}/cancel")
    public Mono<ResponseEntity<Void>> cancelTurn(@PathVariable String id) {
        projectPort.snapshot(id);
        if (!runCoordinator.cancel(id)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Project " + id + " has no turn in progress");
        }
        return Mono.just(ResponseEntity.accepted().build());
    }

    @PostMapping("/{id}/uploads")
    public Mono<ResponseEntity<ArtifactDto>> upload(@PathVariable String id,
            @RequestParam String fileName,
            @RequestBody byte[] content) {
        if (content == null || content.length == 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Upload is empty");
        }
        Artifact artifact = runCoordinator.runExclusive(id, () -> projectPort.registerUpload(id, fileName, content));
        log.info("[API] Uploaded {} to project {} as {}", fileName, id, artifact.reference());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(toArtifact(artifact)));
    }

    @GetMapping("/{id}/artifacts")
    public Mono<ResponseEntity<List<ArtifactDto>>> listArtifacts(@PathVariable String id) {
        Project project = projectPort.snapshot(id);
        List<ArtifactDto> dtos = new ArrayList<>();
        for (String name : project.getArtifactIndex().keySet()) {
            projectPort.artifacts(id, name).stream()
                    .map(this::toArtifact)
                    .forEach(dtos::add);
        }
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @GetMapping("/{id}/artifacts/{name}")
    public Mono<ResponseEntity<List<ArtifactDto>>> listVersions(@PathVariable String id, @PathVariable String name) {
        List<ArtifactDto> dtos = projectPort.artifacts(id, name).stream()
                .map(this::toArtifact)
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @GetMapping("/{id}/artifacts/{name}/content")
    public Mono<ResponseEntity<byte[]>> downloadArtifact(@PathVariable String id, @PathVariable String name,
            @RequestParam(required = false) Integer version) {
        Artifact artifact = projectPort.artifact(id, name, version);
        byte[] content = artifactStore.read(artifact);
        return Mono.just(ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + artifact.getFileName() + "\"")
                .header("X-Artifact-Reference", artifact.reference())
                .header("X-Content-SHA256", artifact.getContentHash())
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .body(content));
    }

    private static PrivacyMode parsePrivacyMode(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return PrivacyMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown privacy mode: " + value);
        }
    }

    private ProjectSummaryDto toSummary(Project project) {
        return ProjectSummaryDto.builder()
                .id(project.getId())
                .name(project.getName())
                .profile(project.getProfile())
                .stage(project.getStage().displayName())
                .privacyMode(project.getPrivacyMode().name())
                .loopState(stateTracker.current(project.getId()).name())
                .turnCount(project.getTurns().size())
                .artifactCount(project.getArtifactIndex().size())
                .createdAt(format(project.getCreatedAt()))
                .updatedAt(format(project.getUpdatedAt()))
                .build();
    }

    private ProjectDetailDto toDetail(Project project) {
        return ProjectDetailDto.builder()
                .id(project.getId())
                .name(project.getName())
                .profile(project.getProfile())
                .stage(project.getStage().displayName())
                .privacyMode(project.getPrivacyMode().name())
                .loopState(stateTracker.current(project.getId()).name())
                .artifacts(project.getArtifactIndex())
                .tokenUsage(toUsage(project.getTokenUsage()))
                .turns(toTurns(project.getTurns()))
                .createdAt(format(project.getCreatedAt()))
                .updatedAt(format(project.getUpdatedAt()))
                .build();
    }

    private TurnOutcomeDto toOutcome(TurnOutcome outcome) {
        return TurnOutcomeDto.builder()
                .projectId(outcome.projectId())
                .completed(outcome.completed())
                .stage(outcome.stage() != null ? outcome.stage().displayName() : null)
                .modelCalls(outcome.modelCalls())
                .toolExecutions(outcome.toolExecutions())
                .tokenUsage(toUsage(outcome.usage()))
                .turns(toTurns(outcome.turns()))
                .build();
    }

    private static List<TurnDto> toTurns(List<Turn> turns) {
        return turns.stream()
                .filter(Turn::isVisibleToUser)
                .map(ProjectsController::toTurn)
                .toList();
    }

    private static TurnDto toTurn(Turn turn) {
        return TurnDto.builder()
                .sequence(turn.getSequence() != null ? turn.getSequence() : 0)
                .role(turn.getRole().name())
                .kind(turn.getKind().name())
                .content(turn.getContent())
                .toolCalls(turn.hasToolCalls()
                        ? turn.getToolCalls().stream()
                                .map(call -> TurnDto.ToolCallDto.builder()
                                        .id(call.getId())
                                        .name(call.getName())
                                        .arguments(call.getArguments())
                                        .build())
                                .toList()
                        : null)
                .toolName(turn.getToolName())
                .invocationStatus(turn.getInvocation() != null ? turn.getInvocation().getStatus().name() : null)
                .failureKind(turn.getInvocation() != null && turn.getInvocation().getFailureKind() != null
                        ? turn.getInvocation().getFailureKind().name()
                        : null)
                .artifacts(turn.getArtifacts() != null
                        ? turn.getArtifacts().stream().map(Artifact::reference).toList()
                        : List.of())
                .timestamp(format(turn.getTimestamp()))
                .build();
    }

    private ArtifactDto toArtifact(Artifact artifact) {
        return ArtifactDto.builder()
                .name(artifact.getName())
                .version(artifact.getVersion())
                .reference(artifact.reference())
                .kind(artifact.getKind() != null ? artifact.getKind().name() : null)
                .fileName(artifact.getFileName())
                .contentHash(artifact.getContentHash())
                .size(artifact.getSize())
                .producedBy(artifact.getProducedBy())
                .createdAt(format(artifact.getCreatedAt()))
                .build();
    }

    private static TokenUsageDto toUsage(ProviderUsage usage) {
        ProviderUsage value = usage != null ? usage : ProviderUsage.NONE;
        return new TokenUsageDto(value.inputTokens(), value.outputTokens(), value.totalTokens());
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
