package me.golemcore.datapilot.adapter.outbound.sandbox;

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
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.datapilot.domain.exception.DataPilotException;
import me.golemcore.datapilot.domain.model.Artifact;
import me.golemcore.datapilot.domain.model.ArtifactKind;
import me.golemcore.datapilot.domain.model.ArtifactReference;
import me.golemcore.datapilot.domain.model.ExecutionResult;
import me.golemcore.datapilot.domain.model.FailureKind;
import me.golemcore.datapilot.domain.model.SandboxRequest;
import me.golemcore.datapilot.domain.model.ToolDescriptor;
import me.golemcore.datapilot.domain.model.ToolInvocation;
import me.golemcore.datapilot.infrastructure.config.DataPilotProperties;
import me.golemcore.datapilot.port.outbound.ArtifactStorePort;
import me.golemcore.datapilot.port.outbound.SandboxPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Execution sandbox that runs each tool invocation in a separate runner
 * process.
 *
 * <p>
 * The runner is started from the configured command (typically a Python
 * interpreter with the analysis dependencies) and exchanges data with the
 * orchestrator only through files in a fresh per-invocation workspace:
 * <ul>
 * <li>{@code request.json} - tool, entry point, arguments and staged
 * inputs</li>
 * <li>{@code inputs/} - copies of the input artifact versions</li>
 * <li>{@code outputs/} - files produced by the tool</li>
 * <li>{@code response.json} - status, text output, error report and the list
 * of produced outputs</li>
 * </ul>
 *
 * <p>
 * Isolation:
 * <ul>
 * <li>Sanitized environment (allow-list), {@code HOME} set to the
 * workspace</li>
 * <li>Network disabled unless the tool declares it needs it (optional
 * isolation command prefix)</li>
 * <li>Per-invocation timeout, after which the whole process tree is
 * killed</li>
 * <li>The workspace is deleted on every exit path</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProcessSandboxAdapter implements SandboxPort {

    static final String REQUEST_FILE = "request.json";
    static final String RESPONSE_FILE = "response.json";
    static final String INPUT_DIR = "inputs";
    static final String OUTPUT_DIR = "outputs";
    private static final String STDOUT_FILE = "stdout.log";
    private static final String STDERR_FILE = "stderr.log";
    private static final String INSTALL_LOG_FILE = "install.log";
    private static final String PACKAGE_PLACEHOLDER = "{package}";
    private static final int ERROR_DETAIL_CHARS = 4000;
    private static final long DESTROY_WAIT_SECONDS = 5;
    private static final Pattern PACKAGE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,99}");
    private static final Pattern UNSAFE_NAME_CHARS = Pattern.compile("[^A-Za-z0-9._-]");

    private final DataPilotProperties properties;
    private final ArtifactStorePort artifactStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final FailureClassifier classifier = new FailureClassifier();
    private final Map<String, RunningInvocation> running = new ConcurrentHashMap<>();

    private Path workspaceRoot;

    @PostConstruct
    public void init() {
        String configured = properties.getSandbox().getWorkspacePath();
        this.workspaceRoot = Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        try {
            Files.createDirectories(workspaceRoot);
        } catch (IOException e) {
            throw new DataPilotException("Failed to create sandbox workspace " + workspaceRoot, e);
        }
        log.info("[Sandbox] Workspace root: {}, runner: {}", workspaceRoot, properties.getSandbox().getCommand());
    }

    @PreDestroy
    public void shutdown() {
        running.values().forEach(RunningInvocation::cancel);
    }

    @Override
    public ExecutionResult execute(SandboxRequest request) {
        ToolInvocation invocation = request.getInvocation();
        Instant started = clock.instant();
        invocation.markRunning(started);
        RunningInvocation handle = new RunningInvocation();
        running.put(invocation.getId(), handle);
        Path workDir = workspaceRoot.resolve(invocation.getId()).normalize();

        log.info("[Sandbox] Running {} ({}) for project {}", invocation.getToolName(), invocation.getId(),
                request.getProjectId());
        ExecutionResult result = null;
        try {
            result = run(request, workDir, handle);
        } catch (IOException | RuntimeException e) {
            log.error("[Sandbox] Invocation {} could not run: {}", invocation.getId(), e.getMessage(), e);
            result = ExecutionResult.failed(invocation.getId(), FailureKind.RUNTIME_ERROR,
                    "Sandbox could not run " + invocation.getToolName() + ": " + e.getMessage(), null);
        } finally {
            running.remove(invocation.getId());
            boolean keep = properties.getSandbox().isKeepWorkspaceOnFailure()
                    && (result == null || !result.isSuccess());
            if (keep) {
                log.info("[Sandbox] Keeping workspace of failed invocation: {}", workDir);
            } else {
                deleteWorkspace(workDir);
            }
        }

        Instant finished = clock.instant();
        result.setDuration(Duration.between(started, finished));
        if (result.isSuccess()) {
            invocation.markSucceeded(finished);
            log.info("[Sandbox] {} succeeded in {} ms, {} artifacts", invocation.getToolName(),
                    result.getDuration().toMillis(), result.getArtifacts().size());
        } else {
            invocation.markFailed(result.getFailureKind(), finished);
            log.warn("[Sandbox] {} failed ({}): {}", invocation.getToolName(), result.getFailureKind(),
                    result.getFailureSummary());
        }
        return result;
    }

    @Override
    public boolean cancel(String invocationId) {
        RunningInvocation handle = invocationId != null ? running.get(invocationId) : null;
        if (handle == null) {
            return false;
        }
        log.info("[Sandbox] Cancelling invocation {}", invocationId);
        handle.cancel();
        return true;
    }

    int activeInvocations() {
        return running.size();
    }

    Path getWorkspaceRoot() {
        return workspaceRoot;
    }

    private ExecutionResult run(SandboxRequest request, Path workDir, RunningInvocation handle) throws IOException {
        String invocationId = request.getInvocation().getId();
        Files.createDirectories(workDir.resolve(INPUT_DIR));
        Files.createDirectories(workDir.resolve(OUTPUT_DIR));
        RunnerMessages.RunnerRequest wire = stageInputs(request, workDir);
        Files.writeString(workDir.resolve(REQUEST_FILE), objectMapper.writeValueAsString(wire),
                StandardCharsets.UTF_8);

        Duration timeout = effectiveTimeout(request.getDescriptor());
        RunnerAttempt attempt = runOnce(request, workDir, timeout, handle);

        boolean remediated = false;
        if (attempt.failureKind() == FailureKind.DEPENDENCY_MISSING
                && properties.getSandbox().isAutoInstall()
                && attempt.missingPackage() != null
                && !handle.isCancelled()) {
            if (installPackage(attempt.missingPackage(), request, workDir, handle)) {
                resetOutputs(workDir);
                attempt = runOnce(request, workDir, timeout, handle);
                remediated = true;
            } else if (handle.isCancelled()) {
                attempt = cancelledAttempt(attempt.stdout(), attempt.stderr());
            }
        }

        ExecutionResult result = attempt.succeeded()
                ? collectOutputs(request, workDir, attempt)
                : ExecutionResult.failed(invocationId, attempt.failureKind(), attempt.summary(),
                        tail(attempt.detail(), ERROR_DETAIL_CHARS));
        result.setRemediated(remediated);
        storeExecutionLog(request, attempt, result);
        return result;
    }

    private RunnerAttempt runOnce(SandboxRequest request, Path workDir, Duration timeout, RunningInvocation handle)
            throws IOException {
        Files.deleteIfExists(workDir.resolve(RESPONSE_FILE));
        ToolDescriptor descriptor = request.getDescriptor();
        boolean network = requiresNetwork(descriptor);

        List<String> command = new ArrayList<>();
        if (!network) {
            command.addAll(properties.getSandbox().getNetworkIsolationPrefix());
        }
        command.addAll(properties.getSandbox().getCommand());

        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectOutput(workDir.resolve(STDOUT_FILE).toFile())
                .redirectError(workDir.resolve(STDERR_FILE).toFile());
        configureEnvironment(pb.environment(), descriptor, workDir, network);

        Process process = pb.start();
        handle.attach(process);
        try {
            boolean completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!completed) {
                destroyTree(process);
                if (handle.isCancelled()) {
                    return cancelledAttempt(readCapped(workDir, STDOUT_FILE), readCapped(workDir, STDERR_FILE));
                }
                String stderr = readCapped(workDir, STDERR_FILE);
                return RunnerAttempt.failure(FailureKind.TIMEOUT,
                        "Timed out after " + describe(timeout) + " and was terminated", stderr,
                        readCapped(workDir, STDOUT_FILE), stderr);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.cancel();
            return cancelledAttempt(readCapped(workDir, STDOUT_FILE), readCapped(workDir, STDERR_FILE));
        } finally {
            handle.detach();
        }

        String stdout = readCapped(workDir, STDOUT_FILE);
        String stderr = readCapped(workDir, STDERR_FILE);
        if (handle.isCancelled()) {
            return cancelledAttempt(stdout, stderr);
        }
        return classifier.classify(process.exitValue(), readResponse(workDir), stdout, stderr);
    }

    private boolean installPackage(String packageName, SandboxRequest request, Path workDir,
            RunningInvocation handle) {
        if (!PACKAGE_NAME.matcher(packageName).matches()) {
            log.warn("[Sandbox] Refusing to install suspicious package name '{}'", packageName);
            return false;
        }
        List<String> command = properties.getSandbox().getInstallCommand().stream()
                .map(part -> part.replace(PACKAGE_PLACEHOLDER, packageName))
                .toList();
        log.info("[Sandbox] Installing missing dependency '{}' for {}", packageName,
                request.getInvocation().getToolName());

        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true)
                .redirectOutput(workDir.resolve(INSTALL_LOG_FILE).toFile());
        configureEnvironment(pb.environment(), request.getDescriptor(), workDir, true);
        try {
            Process process = pb.start();
            handle.attach(process);
            try {
                boolean completed = process.waitFor(properties.getSandbox().getInstallTimeoutMs(),
                        TimeUnit.MILLISECONDS);
                if (!completed) {
                    destroyTree(process);
                    log.warn("[Sandbox] Installing '{}' timed out", packageName);
                    return false;
                }
            } finally {
                handle.detach();
            }
            boolean installed = process.exitValue() == 0 && !handle.isCancelled();
            if (!installed) {
                log.warn("[Sandbox] Installing '{}' failed: {}", packageName,
                        tail(readCapped(workDir, INSTALL_LOG_FILE), 500));
            }
            return installed;
        } catch (IOException e) {
            log.warn("[Sandbox] Could not start install command: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.cancel();
            return false;
        }
    }

    private RunnerMessages.RunnerRequest stageInputs(SandboxRequest request, Path workDir) throws IOException {
        ToolInvocation invocation = request.getInvocation();
        ToolDescriptor descriptor = request.getDescriptor();
        Map<String, RunnerMessages.RunnerInput> inputs = new LinkedHashMap<>();
        for (Map.Entry<String, Artifact> entry : request.getInputs().entrySet()) {
            Artifact artifact = entry.getValue();
            String localName = artifact.getName() + "-v" + artifact.getVersion() + "-" + artifact.getFileName();
            Files.write(workDir.resolve(INPUT_DIR).resolve(localName), artifactStore.read(artifact));
            inputs.put(entry.getKey(), RunnerMessages.RunnerInput.builder()
                    .name(artifact.getName())
                    .version(artifact.getVersion())
                    .kind(artifact.getKind() != null ? artifact.getKind().name() : null)
                    .file(INPUT_DIR + "/" + localName)
                    .contentHash(artifact.getContentHash())
                    .build());
        }
        return RunnerMessages.RunnerRequest.builder()
                .invocationId(invocation.getId())
                .projectId(request.getProjectId())
                .tool(invocation.getToolName())
                .entryPoint(descriptor.getEntryPoint())
                .arguments(new LinkedHashMap<>(invocation.getArguments()))
                .inputs(inputs)
                .outputDir(OUTPUT_DIR)
                .declaredOutputs(new ArrayList<>(declaredWrites(descriptor)))
                .network(requiresNetwork(descriptor))
                .build();
    }

    private ExecutionResult collectOutputs(SandboxRequest request, Path workDir, RunnerAttempt attempt)
            throws IOException {
        String invocationId = request.getInvocation().getId();
        Path outputDir = workDir.resolve(OUTPUT_DIR).normalize();
        RunnerMessages.RunnerResponse response = attempt.response();
        Map<String, RunnerMessages.RunnerOutput> reported = new LinkedHashMap<>();
        for (RunnerMessages.RunnerOutput output : response.getOutputs()) {
            if (output.getName() != null) {
                reported.putIfAbsent(output.getName(), output);
            }
        }

        List<String> missing = new ArrayList<>();
        Map<String, Path> declaredFiles = new LinkedHashMap<>();
        for (String name : declaredWrites(request.getDescriptor())) {
            RunnerMessages.RunnerOutput output = reported.get(name);
            Path file = output != null ? resolveOutput(outputDir, output.getFile()) : null;
            if (file == null || !Files.isRegularFile(file)) {
                missing.add(name);
            } else {
                declaredFiles.put(name, file);
            }
        }
        if (!missing.isEmpty()) {
            return ExecutionResult.failed(invocationId, FailureKind.RUNTIME_ERROR,
                    "Tool finished without producing declared output(s): " + String.join(", ", missing),
                    tail(attempt.stderr(), ERROR_DETAIL_CHARS));
        }

        List<Artifact> artifacts = new ArrayList<>();
        Set<Path> consumed = new HashSet<>();
        for (Map.Entry<String, Path> entry : declaredFiles.entrySet()) {
            RunnerMessages.RunnerOutput output = reported.get(entry.getKey());
            artifacts.add(store(request, entry.getKey(), output.getKind(), entry.getValue()));
            consumed.add(entry.getValue());
        }
        for (RunnerMessages.RunnerOutput output : response.getOutputs()) {
            Path file = resolveOutput(outputDir, output.getFile());
            if (file == null || !Files.isRegularFile(file) || consumed.contains(file)) {
                continue;
            }
            String name = ArtifactReference.isValidName(output.getName()) ? output.getName() : nameFor(file);
            artifacts.add(store(request, undeclaredName(name, declaredFiles.keySet()), output.getKind(), file));
            consumed.add(file);
        }
        try (Stream<Path> files = Files.walk(outputDir)) {
            for (Path file : files.filter(Files::isRegularFile).sorted(Comparator.naturalOrder()).toList()) {
                if (consumed.add(file.normalize())) {
                    artifacts.add(store(request, undeclaredName(nameFor(file), declaredFiles.keySet()), null, file));
                }
            }
        }

        String output = response.getOutput() != null && !response.getOutput().isBlank()
                ? response.getOutput()
                : attempt.stdout();
        return ExecutionResult.succeeded(invocationId, output, artifacts);
    }

    private Artifact store(SandboxRequest request, String name, String reportedKind, Path file) throws IOException {
        ArtifactKind kind = ArtifactKind.parse(reportedKind);
        if (kind == null) {
            kind = switch (name) {
            case "dataset" -> ArtifactKind.DATASET;
            case "model" -> ArtifactKind.MODEL;
            default -> ArtifactKind.fromFileName(file.getFileName().toString());
            };
        }
        return artifactStore.create(request.getProjectId(), name, kind, file.getFileName().toString(),
                Files.readAllBytes(file), request.getInvocation().getId());
    }

    private void storeExecutionLog(SandboxRequest request, RunnerAttempt attempt, ExecutionResult result) {
        String stdout = attempt.stdout() != null ? attempt.stdout() : "";
        String stderr = attempt.stderr() != null ? attempt.stderr() : "";
        if (stdout.isBlank() && stderr.isBlank()) {
            return;
        }
        String content = "== stdout ==\n" + stdout + "\n== stderr ==\n" + stderr;
        String name = request.getInvocation().getToolName() + "_log";
        try {
            Artifact logArtifact = artifactStore.create(request.getProjectId(), name, ArtifactKind.LOG,
                    "execution.log", content.getBytes(StandardCharsets.UTF_8), request.getInvocation().getId());
            result.getArtifacts().add(logArtifact);
        } catch (DataPilotException | IllegalArgumentException e) {
            log.warn("[Sandbox] Could not store execution log of {}: {}", request.getInvocation().getId(),
                    e.getMessage());
        }
    }

    private void configureEnvironment(Map<String, String> env, ToolDescriptor descriptor, Path workDir,
            boolean network) {
        env.keySet().retainAll(Set.copyOf(properties.getSandbox().getAllowedEnvironment()));
        env.put("HOME", workDir.toString());
        env.put("PWD", workDir.toString());
        env.put("DATAPILOT_REQUEST", workDir.resolve(REQUEST_FILE).toString());
        env.put("DATAPILOT_RESPONSE", workDir.resolve(RESPONSE_FILE).toString());
        env.put("DATAPILOT_INPUT_DIR", workDir.resolve(INPUT_DIR).toString());
        env.put("DATAPILOT_OUTPUT_DIR", workDir.resolve(OUTPUT_DIR).toString());
        env.put("DATAPILOT_ENTRY_POINT", descriptor.getEntryPoint() != null ? descriptor.getEntryPoint() : "");
        env.put("DATAPILOT_NETWORK", network ? "enabled" : "disabled");
    }

    private RunnerMessages.RunnerResponse readResponse(Path workDir) {
        Path responseFile = workDir.resolve(RESPONSE_FILE);
        if (!Files.isRegularFile(responseFile)) {
            return null;
        }
        try {
            return objectMapper.readValue(responseFile.toFile(), RunnerMessages.RunnerResponse.class);
        } catch (JsonProcessingException e) {
            log.warn("[Sandbox] Unreadable runner response: {}", e.getOriginalMessage());
            return null;
        } catch (IOException e) {
            log.warn("[Sandbox] Failed to read runner response: {}", e.getMessage());
            return null;
        }
    }

    private String readCapped(Path workDir, String fileName) {
        Path file = workDir.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            return "";
        }
        int max = properties.getSandbox().getMaxOutputChars();
        try (InputStream in = Files.newInputStream(file)) {
            byte[] bytes = in.readNBytes(max * 4);
            String text = new String(bytes, StandardCharsets.UTF_8);
            if (text.length() > max) {
                return text.substring(0, max) + "\n[Output truncated...]";
            }
            return text;
        } catch (IOException e) {
            log.warn("[Sandbox] Failed to read {}: {}", file, e.getMessage());
            return "";
        }
    }

    private void resetOutputs(Path workDir) throws IOException {
        Path outputDir = workDir.resolve(OUTPUT_DIR);
        deleteRecursively(outputDir);
        Files.createDirectories(outputDir);
    }

    private void deleteWorkspace(Path workDir) {
        try {
            deleteRecursively(workDir);
        } catch (IOException e) {
            log.warn("[Sandbox] Failed to delete workspace {}: {}", workDir, e.getMessage());
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private Duration effectiveTimeout(ToolDescriptor descriptor) {
        DataPilotProperties.SandboxProperties sandbox = properties.getSandbox();
        Duration timeout = descriptor.getTimeout() != null
                ? descriptor.getTimeout()
                : Duration.ofMillis(sandbox.getDefaultTimeoutMs());
        Duration max = Duration.ofMillis(sandbox.getMaxTimeoutMs());
        return timeout.compareTo(max) > 0 ? max : timeout;
    }

    private static Path resolveOutput(Path outputDir, String file) {
        if (file == null || file.isBlank()) {
            return null;
        }
        String relative = file.startsWith(OUTPUT_DIR + "/") ? file.substring(OUTPUT_DIR.length() + 1) : file;
        Path resolved = outputDir.resolve(relative).normalize();
        if (!resolved.startsWith(outputDir)) {
            log.warn("[Sandbox] Ignoring output outside the output directory: {}", file);
            return null;
        }
        return resolved;
    }

    private static String nameFor(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String name = UNSAFE_NAME_CHARS.matcher(stem).replaceAll("_");
        return ArtifactReference.isValidName(name) ? name : "output";
    }

    // Extra files never add versions to a declared output name.
    private static String undeclaredName(String name, Set<String> declared) {
        return declared.contains(name) ? name + "_extra" : name;
    }

    private static List<String> declaredWrites(ToolDescriptor descriptor) {
        return descriptor.getSideEffects() != null ? descriptor.getSideEffects().getWrites() : List.of();
    }

    private static boolean requiresNetwork(ToolDescriptor descriptor) {
        return descriptor.getSideEffects() != null && descriptor.getSideEffects().isRequiresNetwork();
    }

    private static RunnerAttempt cancelledAttempt(String stdout, String stderr) {
        return RunnerAttempt.failure(FailureKind.CANCELLED, "Invocation was cancelled", null, stdout, stderr);
    }

    private static String describe(Duration timeout) {
        long millis = timeout.toMillis();
        return millis % 1000 == 0 ? (millis / 1000) + " s" : millis + " ms";
    }

    private static String tail(String text, int maxChars) {
        if (text == null || text.length() <= maxChars) {
            return text;
        }
        return "..." + text.substring(text.length() - maxChars);
    }

    static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(DESTROY_WAIT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class RunningInvocation {

        private final AtomicBoolean cancelled = new AtomicBoolean();
        private volatile Process process;

        void attach(Process started) {
            this.process = started;
            if (cancelled.get()) {
                destroyTree(started);
            }
        }

        void detach() {
            this.process = null;
        }

        void cancel() {
            cancelled.set(true);
            Process current = process;
            if (current != null) {
                destroyTree(current);
            }
        }

        boolean isCancelled() {
            return cancelled.get();
        }
    }
}
