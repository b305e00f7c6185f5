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

import me.golemcore.datapilot.domain.model.ModelResponse;
import me.golemcore.datapilot.domain.model.ProviderRequest;
import me.golemcore.datapilot.domain.model.ToolDescriptor;

import java.util.List;

/**
 * Port for model providers. Implementations translate the bounded
 * conversation and the tool catalog into one completion call and normalize
 * the reply.
 *
 * <p>
 * Transient backend failures are retried inside the implementation; when the
 * retry budget is spent a
 * {@link me.golemcore.datapilot.domain.exception.ProviderException} is thrown.
 */
public interface ProviderPort {

    ModelResponse complete(ProviderRequest request, List<ToolDescriptor> catalog);
}
