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

package me.golemcore.browser.port.outbound;

import me.golemcore.browser.domain.model.AgentRunRequest;
import me.golemcore.browser.domain.model.AgentRunResult;
import me.golemcore.browser.domain.service.BrowserSessionHandle;

/**
 * Port for the autonomous agent. Drives the given session handle for up to
 * {@code maxSteps} steps and returns the outcome. May block for a long time;
 * it is always invoked on a background thread.
 */
public interface AgentExecutionPort {

    AgentRunResult run(AgentRunRequest request, BrowserSessionHandle handle);

    boolean isAvailable();
}
