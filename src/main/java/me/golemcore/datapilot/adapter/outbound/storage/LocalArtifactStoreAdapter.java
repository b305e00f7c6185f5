package me.golemcore.datapilot.adapter.outbound.storage;

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
import me.golemcore.datapilot.domain.exception.PersistenceException;
import me.golemcore.datapilot.domain.model.Artifact;
import me.golemcore.datapilot.domain.model.ArtifactKind;
import me.golemcore.datapilot.domain.model.ArtifactReference;
import me.golemcore.datapilot.port.outbound.ArtifactStorePort;
import me.golemcore.datapilot.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Artifact store on top of {@link StoragePort}.
 *
 * <p>
 * Layout under {@code artifacts/}:
 *
 * <pre>
 * {projectId}/{name}/v{version}/{fileName}   content
 * {projectId}/{name}/v{version}.json         metadata
 * </pre>
 *
 * The metadata file is written last, so a version exists only once its
 * content is durable.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalArtifactStoreAdapter implements ArtifactStorePort {

    private static final String ARTIFACTS_DIR = "artifacts";
    private static final Pattern METADATA = Pattern.compile("([^/]+)/([^/]+)/v(\\d+)\\.json");
    private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^A-Za-z0-9._-]");

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, ReentrantLock> nameLocks = new ConcurrentHashMap<>();

    @Override
    public Artifact create(String projectId, String name, ArtifactKind kind, String fileName, byte[] content,
            String producedBy) {
        if (!ArtifactReference.isValidName(name)) {
            throw new IllegalArgumentException("Invalid artifact name: " + name);
        }
        String safeFileName = sanitizeFileName(fileName);
        String contentHash = sha256(content);

        ReentrantLock lock = nameLocks.computeIfAbsent(projectId + "/" + name, key -> new ReentrantLock());
        lock.lock();
        try {
            int version = versionNumbers(projectId, name).stream().max(Integer::compare).orElse(0) + 1;
            String contentPath = contentPath(projectId, name, version, safeFileName);
            Artifact artifact = Artifact.builder()
                    .projectId(projectId)
                    .name(name)
                    .version(version)
                    .kind(kind != null ? kind : ArtifactKind.fromFileName(safeFileName))
                    .fileName(safeFileName)
                    .location(storagePort.locate(ARTIFACTS_DIR, contentPath))
                    .contentHash(contentHash)
                    .size(content.length)
                    .producedBy(producedBy)
                    .createdAt(clock.instant())
                    .build();

            storagePort.putObjectAtomic(ARTIFACTS_DIR, contentPath, content, false).join();
            storagePort.putTextAtomic(ARTIFACTS_DIR, metadataPath(projectId, name, version),
                    objectMapper.writeValueAsString(artifact), false).join();

            log.info("[Artifacts] Stored {}/{} ({} bytes, sha256 {})", projectId, artifact.reference(),
                    content.length, contentHash.substring(0, 12));
            return artifact;
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize artifact metadata for " + name, e);
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to store artifact " + projectId + "/" + name, e.getCause());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Artifact> latest(String projectId, String name) {
        return versionNumbers(projectId, name).stream()
                .max(Integer::compare)
                .flatMap(version -> get(projectId, name, version));
    }

    @Override
    public Optional<Artifact> get(String projectId, String name, int version) {
        if (!ArtifactReference.isValidName(name) || version < 1) {
            return Optional.empty();
        }
        String json = join(storagePort.getText(ARTIFACTS_DIR, metadataPath(projectId, name, version)));
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, Artifact.class));
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt artifact metadata: " + projectId + "/" + name + "@" + version, e);
        }
    }

    @Override
    public Artifact resolve(String projectId, ArtifactReference reference) {
        Optional<Artifact> artifact = reference.isLatest()
                ? latest(projectId, reference.name())
                : get(projectId, reference.name(), reference.version());
        return artifact.orElseThrow(() -> new ArtifactNotFoundException(projectId, reference.format()));
    }

    @Override
    public List<Artifact> versions(String projectId, String name) {
        List<Artifact> result = new ArrayList<>();
        for (Integer version : versionNumbers(projectId, name)) {
            get(projectId, name, version).ifPresent(result::add);
        }
        result.sort(Comparator.comparingInt(Artifact::getVersion));
        return result;
    }

    @Override
    public List<String> names(String projectId) {
        TreeSet<String> names = new TreeSet<>();
        for (String path : join(storagePort.listObjects(ARTIFACTS_DIR, projectId))) {
            Matcher matcher = METADATA.matcher(path);
            if (matcher.matches() && matcher.group(1).equals(projectId)) {
                names.add(matcher.group(2));
            }
        }
        return List.copyOf(names);
    }

    @Override
    public byte[] read(Artifact artifact) {
        byte[] content = join(storagePort.getObject(ARTIFACTS_DIR,
                contentPath(artifact.getProjectId(), artifact.getName(), artifact.getVersion(),
                        artifact.getFileName())));
        if (content == null) {
            throw new ArtifactNotFoundException(artifact.getProjectId(), artifact.reference());
        }
        return content;
    }

    @Override
    public boolean verify(Artifact artifact) {
        return sha256(read(artifact)).equals(artifact.getContentHash());
    }

    @Override
    public void deleteProject(String projectId) {
        join(storagePort.deleteTree(ARTIFACTS_DIR, projectId));
        nameLocks.keySet().removeIf(key -> key.startsWith(projectId + "/"));
        log.info("[Artifacts] Deleted all artifacts of project {}", projectId);
    }

    private List<Integer> versionNumbers(String projectId, String name) {
        if (!ArtifactReference.isValidName(name)) {
            return List.of();
        }
        List<Integer> versions = new ArrayList<>();
        for (String path : join(storagePort.listObjects(ARTIFACTS_DIR, projectId + "/" + name))) {
            Matcher matcher = METADATA.matcher(path);
            if (matcher.matches() && matcher.group(1).equals(projectId) && matcher.group(2).equals(name)) {
                versions.add(Integer.parseInt(matcher.group(3)));
            }
        }
        return versions;
    }

    static String sha256(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String sanitizeFileName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return "content.bin";
        }
        Path last = Path.of(fileName.replace('\\', '/')).getFileName();
        String base = last != null ? last.toString() : fileName;
        String safe = UNSAFE_FILE_CHARS.matcher(base).replaceAll("_");
        if (safe.isEmpty() || safe.chars().allMatch(c -> c == '.')) {
            return "content.bin";
        }
        return safe;
    }

    private static String contentPath(String projectId, String name, int version, String fileName) {
        return projectId + "/" + name + "/v" + version + "/" + fileName;
    }

    private static String metadataPath(String projectId, String name, int version) {
        return projectId + "/" + name + "/v" + version + ".json";
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw new PersistenceException("Artifact storage failure", e.getCause());
        }
    }
}
