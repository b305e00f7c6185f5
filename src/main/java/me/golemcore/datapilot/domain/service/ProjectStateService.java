package me.golemcore.datapilot.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.datapilot.domain.exception.ArtifactNotFoundException;
import me.golemcore.datapilot.domain.exception.ConcurrentModificationException;
import me.golemcore.datapilot.domain.exception.PersistenceException;
import me.golemcore.datapilot.domain.exception.ProjectNotFoundException;
import me.golemcore.datapilot.domain.model.Artifact;
import me.golemcore.datapilot.domain.model.ArtifactKind;
import me.golemcore.datapilot.domain.model.ArtifactReference;
import me.golemcore.datapilot.domain.model.PipelineStage;
import me.golemcore.datapilot.domain.model.PrivacyMode;
import me.golemcore.datapilot.domain.model.Project;
import me.golemcore.datapilot.domain.model.ProviderUsage;
import me.golemcore.datapilot.domain.model.Turn;
import me.golemcore.datapilot.domain.model.TurnKind;
import me.golemcore.datapilot.domain.model.TurnRole;
import me.golemcore.datapilot.domain.model.TurnVisibility;
import me.golemcore.datapilot.infrastructure.config.DataPilotProperties;
import me.golemcore.datapilot.port.outbound.ArtifactStorePort;
import me.golemcore.datapilot.port.outbound.ProjectPort;
import me.golemcore.datapilot.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Session state manager. Keeps each project in memory and writes it through to
 * storage on every change.
 *
 * <p>
 * Changes are copy-on-write: a working copy is modified and persisted, and
 * only published once the atomic write succeeded, so a failed write leaves the
 * previous state in place. Writes to one project never overlap; a write that
 * arrives while another is in progress is rejected rather than queued.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectStateService implements ProjectPort {

    private static final String PROJECTS_DIR = "projects";
    private static final String JSON_EXTENSION = ".json";
    private static final String BACKUP_EXTENSION = ".bak";
    private static final String DATASET = "dataset";
    private static final String UPLOAD = "upload";

    private final StoragePort storagePort;
    private final ArtifactStorePort artifactStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final DataPilotProperties properties;

    private final Map<String, ProjectSlot> slots = new ConcurrentHashMap<>();

    @Override
    public Project create(String name, String profile, PrivacyMode privacyMode) {
        Instant now = clock.instant();
        Project project = Project.builder()
                .id(UUID.randomUUID().toString())
                .name(name != null && !name.isBlank() ? name.trim() : "Untitled project")
                .profile(profile != null && !profile.isBlank() ? profile : properties.getDefaultProfile())
                .privacyMode(privacyMode != null ? privacyMode : PrivacyMode.DEFAULT)
                .createdAt(now)
                .updatedAt(now)
                .build();
        persist(project);
        slots.put(project.getId(), new ProjectSlot(project));
        log.info("[State] Created project {} ({})", project.getId(), project.getName());
        return copy(project);
    }

    @Override
    public Turn append(String projectId, Turn turn) {
        return mutate(projectId, project -> copy(appendTurn(project, turn)));
    }

    @Override
    public Turn recordToolOutcome(String projectId, Turn turn, List<Artifact> artifacts, PipelineStage stage) {
        return mutate(projectId, project -> {
            Turn incoming = copy(turn);
            if (artifacts != null && !artifacts.isEmpty()) {
                incoming.setArtifacts(new ArrayList<>(artifacts));
            }
            Turn stored = appendTurn(project, incoming);
            for (Artifact artifact : stored.getArtifacts()) {
                project.getArtifactIndex().merge(artifact.getName(), artifact.getVersion(), Math::max);
            }
            PipelineStage next = PipelineStage.latest(project.getStage(), stage);
            if (next != project.getStage()) {
                log.info("[State] Project {} advanced {} -> {}", projectId, project.getStage(), next);
                project.setStage(next);
            }
            return copy(stored);
        });
    }

    @Override
    public PipelineStage currentStage(String projectId) {
        return slot(projectId).project.getStage();
    }

    @Override
    public List<Artifact> artifacts(String projectId, String name) {
        slot(projectId);
        return artifactStore.versions(projectId, name);
    }

    @Override
    public Artifact artifact(String projectId, String name, Integer version) {
        slot(projectId);
        ArtifactReference reference = ArtifactReference.of(name, version);
        if (!ArtifactReference.isValidName(name)) {
            throw new ArtifactNotFoundException(projectId, reference.format());
        }
        return artifactStore.resolve(projectId, reference);
    }

    @Override
    public Project snapshot(String projectId) {
        return copy(slot(projectId).project);
    }

    @Override
    public Project restore(String projectId) {
        ProjectSlot slot = slots.get(projectId);
        if (slot == null) {
            return snapshot(projectId);
        }
        lockForWrite(projectId, slot);
        try {
            Project reloaded = load(projectId).orElseThrow(() -> new ProjectNotFoundException(projectId));
            slot.project = reloaded;
            log.info("[State] Restored project {} from storage ({} turns)", projectId, reloaded.getTurns().size());
            return copy(reloaded);
        } finally {
            slot.writer.unlock();
        }
    }

    @Override
    public List<Project> list() {
        List<String> files;
        try {
            files = storagePort.listObjects(PROJECTS_DIR, "").join();
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to list projects", e.getCause());
        }
        List<Project> projects = new ArrayList<>();
        for (String file : files) {
            if (!file.endsWith(JSON_EXTENSION) || file.contains("/")) {
                continue;
            }
            String projectId = file.substring(0, file.length() - JSON_EXTENSION.length());
            try {
                projects.add(snapshot(projectId));
            } catch (ProjectNotFoundException | PersistenceException e) {
                log.warn("[State] Skipping unreadable project {}: {}", projectId, e.getMessage());
            }
        }
        projects.sort(Comparator.comparing(Project::getUpdatedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return projects;
    }

    @Override
    public Project rename(String projectId, String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Project name must not be blank");
        }
        return mutate(projectId, project -> {
            project.setName(name.trim());
            return copy(project);
        });
    }

    @Override
    public void delete(String projectId) {
        ProjectSlot slot = slot(projectId);
        lockForWrite(projectId, slot);
        try {
            slot.deleted = true;
            slots.remove(projectId);
            storagePort.deleteObject(PROJECTS_DIR, projectId + JSON_EXTENSION).join();
            storagePort.deleteObject(PROJECTS_DIR, projectId + JSON_EXTENSION + BACKUP_EXTENSION).join();
            artifactStore.deleteProject(projectId);
            log.info("[State] Deleted project {}", projectId);
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to delete project " + projectId, e.getCause());
        } finally {
            slot.writer.unlock();
        }
    }

    @Override
    public Artifact registerUpload(String projectId, String fileName, byte[] content) {
        slot(projectId);
        Artifact artifact = artifactStore.create(projectId, DATASET, ArtifactKind.DATASET, fileName, content, UPLOAD);
        Turn turn = Turn.builder()
                .role(TurnRole.USER)
                .kind(TurnKind.MESSAGE)
                .content("Uploaded data file '" + artifact.getFileName() + "' as " + artifact.reference()
                        + " (" + artifact.getSize() + " bytes).")
                .build();
        recordToolOutcome(projectId, turn, List.of(artifact), PipelineStage.INGEST);
        return artifact;
    }

    private Turn appendTurn(Project project, Turn turn) {
        long expected = project.getNextSequence();
        if (turn.getSequence() != null && turn.getSequence() != expected) {
            throw new ConcurrentModificationException(project.getId(),
                    "Turn sequence " + turn.getSequence() + " conflicts with next sequence " + expected
                            + " of project " + project.getId());
        }
        Turn stored = copy(turn);
        stored.setSequence(expected);
        stored.setProjectId(project.getId());
        if (stored.getTimestamp() == null) {
            stored.setTimestamp(clock.instant());
        }
        if (stored.getKind() == null) {
            stored.setKind(TurnKind.MESSAGE);
        }
        if (stored.getVisibility() == null) {
            stored.setVisibility(TurnVisibility.ALL);
        }
        project.getTurns().add(stored);
        project.setNextSequence(expected + 1);
        if (stored.getUsage() != null) {
            ProviderUsage total = project.getTokenUsage() != null ? project.getTokenUsage() : ProviderUsage.NONE;
            project.setTokenUsage(total.plus(stored.getUsage()));
        }
        log.debug("[State] Project {} turn #{} {} {}", project.getId(), expected, stored.getRole(), stored.getKind());
        return stored;
    }

    private <T> T mutate(String projectId, Function<Project, T> change) {
        ProjectSlot slot = slot(projectId);
        lockForWrite(projectId, slot);
        try {
            if (slot.deleted) {
                throw new ProjectNotFoundException(projectId);
            }
            Project working = copy(slot.project);
            T result = change.apply(working);
            working.setUpdatedAt(clock.instant());
            persist(working);
            slot.project = working;
            return result;
        } finally {
            slot.writer.unlock();
        }
    }

    private static void lockForWrite(String projectId, ProjectSlot slot) {
        if (!slot.writer.tryLock()) {
            throw new ConcurrentModificationException(projectId,
                    "Another write to project " + projectId + " is in progress");
        }
    }

    private ProjectSlot slot(String projectId) {
        ProjectSlot slot = slots.get(projectId);
        if (slot != null) {
            return slot;
        }
        Project loaded = load(projectId).orElseThrow(() -> new ProjectNotFoundException(projectId));
        return slots.computeIfAbsent(projectId, id -> new ProjectSlot(loaded));
    }

    private void persist(Project project) {
        try {
            String json = objectMapper.writeValueAsString(project);
            storagePort.putTextAtomic(PROJECTS_DIR, project.getId() + JSON_EXTENSION, json, true).join();
        } catch (JsonProcessingException | UncheckedIOException e) {
            throw new PersistenceException("Failed to persist project " + project.getId(), e);
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to persist project " + project.getId(), e.getCause());
        }
    }

    private Optional<Project> load(String projectId) {
        if (projectId == null || projectId.isBlank() || projectId.contains("/") || projectId.contains("..")) {
            return Optional.empty();
        }
        Optional<Project> primary = read(projectId + JSON_EXTENSION);
        if (primary.isPresent()) {
            return primary;
        }
        Optional<Project> backup = read(projectId + JSON_EXTENSION + BACKUP_EXTENSION);
        backup.ifPresent(project -> log.warn("[State] Project {} recovered from backup", projectId));
        return backup;
    }

    private Optional<Project> read(String file) {
        String json;
        try {
            json = storagePort.getText(PROJECTS_DIR, file).join();
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to read " + file, e.getCause());
        }
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, Project.class));
        } catch (JsonProcessingException e) {
            log.warn("[State] Corrupt project file {}: {}", file, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private Project copy(Project project) {
        return objectMapper.convertValue(project, Project.class);
    }

    private Turn copy(Turn turn) {
        return objectMapper.convertValue(turn, Turn.class);
    }

    private static final class ProjectSlot {

        private final ReentrantLock writer = new ReentrantLock();
        // Replaced wholesale on every committed write, never mutated in place.
        private volatile Project project;
        private volatile boolean deleted;

        private ProjectSlot(Project project) {
            this.project = project;
        }
    }
}
