package me.golemcore.datapilot.domain.loop;

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

import me.golemcore.datapilot.domain.model.Turn;

import java.util.List;

/**
 * What the model sees for one completion: the system prompt and a bounded,
 * protocol-consistent window of turns. Diagnostics describe what was left out.
 */
public record ConversationView(String systemPrompt, List<Turn> turns, List<String> diagnostics) {

    public ConversationView {
        turns = List.copyOf(turns);
        diagnostics = List.copyOf(diagnostics);
    }
}
