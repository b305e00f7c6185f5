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

import me.golemcore.datapilot.domain.model.ModelResponse;
import me.golemcore.datapilot.domain.model.ProviderRequest;
import me.golemcore.datapilot.domain.model.ToolDescriptor;
import me.golemcore.datapilot.infrastructure.config.DataPilotProperties.ProviderKind;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Profile kind {@code none}: answers every turn with a fixed notice so that
 * projects can be created and inspected without a configured model.
 */
@Component
public class NoOpProviderAdapter implements ProviderAdapter {

    static final String NOTICE = "No model provider is configured for this project. "
            + "Set datapilot.default-profile or choose a configured profile.";

    @Override
    public Set<ProviderKind> kinds() {
        return Set.of(ProviderKind.NONE);
    }

    @Override
    public ModelResponse complete(ResolvedProfile profile, ProviderRequest request, List<ToolDescriptor> catalog) {
        ModelResponse response = ModelResponse.plainText(NOTICE);
        response.setModel("none");
        return response;
    }
}
