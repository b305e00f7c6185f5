package me.golemcore.datapilot.port.outbound;

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

import me.golemcore.datapilot.domain.exception.ArtifactNotFoundException;
import me.golemcore.datapilot.domain.model.Artifact;
import me.golemcore.datapilot.domain.model.ArtifactKind;
import me.golemcore.datapilot.domain.model.ArtifactReference;

import java.util.List;
import java.util.Optional;

/**
 * Port for versioned, content-addressed project artifacts.
 *
 * <p>
 * Artifacts are immutable. Creating an artifact under an existing name
 * allocates the next version; versions of a name start at 1 and are allocated
 * atomically even when several invocations write the same name concurrently.
 */
public interface ArtifactStorePort {

    /**
     * Stores a new version of {@code name}.
     *
     * @param producedBy
     *            id of the producing invocation, or {@code upload}
     * @return metadata of the stored version, including its SHA-256 hash
     */
    Artifact create(String projectId, String name, ArtifactKind kind, String fileName, byte[] content,
            String producedBy);

    Optional<Artifact> latest(String projectId, String name);

    Optional<Artifact> get(String projectId, String name, int version);

    /**
     * Resolves a reference, treating a missing version as latest.
     *
     * @throws ArtifactNotFoundException
     *             if nothing matches
     */
    Artifact resolve(String projectId, ArtifactReference reference);

    /**
     * All versions of a name, oldest first.
     */
    List<Artifact> versions(String projectId, String name);

    /**
     * Names with at least one version, sorted.
     */
    List<String> names(String projectId);

    byte[] read(Artifact artifact);

    /**
     * Recomputes the content hash and compares it with the recorded one.
     */
    boolean verify(Artifact artifact);

    void deleteProject(String projectId);
}
