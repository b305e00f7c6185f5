package me.golemcore.datapilot.domain.registry;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.datapilot.domain.exception.DuplicateToolException;
import me.golemcore.datapilot.domain.exception.SchemaValidationException;
import me.golemcore.datapilot.domain.exception.UnknownToolException;
import me.golemcore.datapilot.domain.model.ToolDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed catalog of the tools the model may call.
 *
 * <p>
 * Populated during startup, then frozen. After {@link #freeze()} the catalog
 * is an immutable map published through a volatile field, so lookups need no
 * locking.
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolDescriptor> pending = new LinkedHashMap<>();
    private final ArgumentValidator validator = new ArgumentValidator();
    private volatile Map<String, ToolDescriptor> frozen;

    /**
     * Adds a tool.
     *
     * @throws DuplicateToolException
     *             if the name is taken
     * @throws IllegalStateException
     *             if the registry is already frozen
     */
    public synchronized void register(ToolDescriptor descriptor) {
        if (frozen != null) {
            throw new IllegalStateException("Tool registry is frozen, cannot register " + descriptor.getName());
        }
        if (descriptor.getName() == null || descriptor.getName().isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        if (pending.containsKey(descriptor.getName())) {
            throw new DuplicateToolException(descriptor.getName());
        }
        pending.put(descriptor.getName(), descriptor);
        log.debug("[Registry] Registered tool: {}", descriptor.getName());
    }

    public synchronized void freeze() {
        if (frozen == null) {
            frozen = Collections.unmodifiableMap(new LinkedHashMap<>(pending));
            pending.clear();
            log.info("[Registry] Frozen with {} tools", frozen.size());
        }
    }

    public boolean isFrozen() {
        return frozen != null;
    }

    public ToolDescriptor resolve(String name) {
        ToolDescriptor descriptor = tools().get(name);
        if (descriptor == null) {
            throw new UnknownToolException(name);
        }
        return descriptor;
    }

    public boolean contains(String name) {
        return name != null && tools().containsKey(name);
    }

    /**
     * Checks and coerces arguments against the tool's schema.
     *
     * @return coerced arguments in declaration order, defaults filled in
     * @throws UnknownToolException
     *             if the tool does not exist
     * @throws SchemaValidationException
     *             with every violation found
     */
    public Map<String, Object> validate(String name, Map<String, Object> arguments) {
        return validator.validate(resolve(name), arguments);
    }

    public List<ToolDescriptor> catalog() {
        return List.copyOf(tools().values());
    }

    private Map<String, ToolDescriptor> tools() {
        Map<String, ToolDescriptor> snapshot = frozen;
        if (snapshot != null) {
            return snapshot;
        }
        synchronized (this) {
            return frozen != null ? frozen : new LinkedHashMap<>(pending);
        }
    }

    /**
     * Builds a frozen registry from catalogs, in catalog order.
     */
    public static ToolRegistry fromCatalogs(List<? extends ToolCatalog> catalogs) {
        ToolRegistry registry = new ToolRegistry();
        List<ToolDescriptor> all = new ArrayList<>();
        catalogs.forEach(catalog -> all.addAll(catalog.descriptors()));
        all.forEach(registry::register);
        registry.freeze();
        return registry;
    }
}
