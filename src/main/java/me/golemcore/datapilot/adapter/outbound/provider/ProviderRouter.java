package me.golemcore.datapilot.adapter.outbound.provider;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.datapilot.domain.exception.ProviderException;
import me.golemcore.datapilot.domain.model.ModelResponse;
import me.golemcore.datapilot.domain.model.ProviderRequest;
import me.golemcore.datapilot.domain.model.ToolDescriptor;
import me.golemcore.datapilot.infrastructure.config.DataPilotProperties;
import me.golemcore.datapilot.infrastructure.config.DataPilotProperties.ProviderKind;
import me.golemcore.datapilot.infrastructure.config.DataPilotProperties.ProviderProfileProperties;
import me.golemcore.datapilot.port.outbound.ProviderPort;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Routes each completion to the adapter of the project's provider profile and
 * applies the retry policy.
 *
 * <p>
 * Profile selection: the request's profile when it is configured, otherwise
 * {@code datapilot.default-profile}. Each attempt runs on a dedicated thread
 * and the caller waits interruptibly, so cancelling a project turn releases
 * the caller even while the HTTP call is still in flight.
 *
 * <p>
 * Transient failures (rate limits, timeouts, 5xx, I/O) are retried with
 * bounded exponential backoff. Anything else, or a transient failure after the
 * last retry, surfaces as a {@link ProviderException}.
 */
@Component
@Slf4j
public class ProviderRouter implements ProviderPort {

    private final DataPilotProperties properties;
    private final List<ProviderAdapter> adapters;
    private final CredentialResolver credentialResolver;
    private final Map<ProviderKind, ProviderAdapter> adaptersByKind = new EnumMap<>(ProviderKind.class);
    private final ExecutorService callExecutor;
    private RetryPolicy.Sleeper sleeper = Thread::sleep;

    public ProviderRouter(DataPilotProperties properties, List<ProviderAdapter> adapters,
            CredentialResolver credentialResolver) {
        this.properties = properties;
        this.adapters = adapters;
        this.credentialResolver = credentialResolver;
        AtomicInteger counter = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "provider-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    public void init() {
        for (ProviderAdapter adapter : adapters) {
            for (ProviderKind kind : adapter.kinds()) {
                ProviderAdapter previous = adaptersByKind.putIfAbsent(kind, adapter);
                if (previous != null) {
                    throw new IllegalStateException("Two provider adapters for kind " + kind + ": "
                            + previous.getClass().getSimpleName() + ", " + adapter.getClass().getSimpleName());
                }
            }
        }
        log.info("[Provider] Adapters registered for {}", adaptersByKind.keySet());
    }

    @PreDestroy
    public void shutdown() {
        callExecutor.shutdownNow();
    }

    @Override
    public ModelResponse complete(ProviderRequest request, List<ToolDescriptor> catalog) {
        ResolvedProfile profile = resolveProfile(request.getProfile());
        ProviderAdapter adapter = adaptersByKind.get(profile.settings().getKind());
        if (adapter == null) {
            throw new ProviderException(profile.name(),
                    "No adapter for provider kind " + profile.settings().getKind(), 0, null);
        }

        RetryPolicy retryPolicy = new RetryPolicy(properties.getRetry());
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                ModelResponse response = invoke(adapter, profile, request, catalog, attempt);
                log.debug("[Provider] {} answered with {} (attempt {})", profile.name(),
                        response.getKind(), attempt);
                return response;
            } catch (ProviderException e) {
                throw e;
            } catch (Exception e) {
                int retriesSoFar = attempt - 1;
                if (!TransientErrorClassifier.isTransient(e) || !retryPolicy.canRetry(retriesSoFar)) {
                    log.error("[Provider] {} failed after {} attempt(s): {}", profile.name(), attempt,
                            e.getMessage());
                    throw new ProviderException(profile.name(),
                            "Provider '" + profile.name() + "' failed after " + attempt + " attempt(s): "
                                    + e.getMessage(),
                            attempt, e);
                }
                long resetSeconds = TransientErrorClassifier.resetHintSeconds(e);
                long backoffMs = retryPolicy.backoffMs(retriesSoFar, resetSeconds);
                log.warn("[Provider] Transient failure from {} (attempt {}/{}), retrying in {}ms{}: {}",
                        profile.name(), attempt, retryPolicy.getMaxRetries() + 1, backoffMs,
                        resetSeconds > 0 ? " (server requested " + resetSeconds + "s)" : "", e.getMessage());
                try {
                    sleeper.sleep(backoffMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw ProviderException.cancelled(profile.name(), attempt, ie);
                }
            }
        }
    }

    ResolvedProfile resolveProfile(String requested) {
        Map<String, ProviderProfileProperties> profiles = properties.getProviders();
        String name = requested;
        if (name == null || !profiles.containsKey(name)) {
            if (name != null) {
                log.warn("[Provider] Profile '{}' is not configured, using default '{}'", name,
                        properties.getDefaultProfile());
            }
            name = properties.getDefaultProfile();
        }
        ProviderProfileProperties settings = name != null ? profiles.get(name) : null;
        if (settings == null) {
            throw new ProviderException(name, "Provider profile '" + name + "' is not configured", 0, null);
        }

        String apiKey = credentialResolver.resolve(settings.getApiKeyRef());
        if (apiKey == null && settings.getApiKeyRef() != null && settings.getKind() != ProviderKind.NONE) {
            throw new ProviderException(name,
                    "Credential reference '" + settings.getApiKeyRef() + "' of profile '" + name + "' is not set",
                    0, null);
        }
        return new ResolvedProfile(name, settings, apiKey);
    }

    private ModelResponse invoke(ProviderAdapter adapter, ResolvedProfile profile, ProviderRequest request,
            List<ToolDescriptor> catalog, int attempt) throws Exception {
        Future<ModelResponse> future = callExecutor.submit(() -> adapter.complete(profile, request, catalog));
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.info("[Provider] Call to {} cancelled", profile.name());
            throw ProviderException.cancelled(profile.name(), attempt, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(cause);
        }
    }
}
