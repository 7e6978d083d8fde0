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
package me.golemcore.bedrock.domain.model;

/**
 * Final answer synthesized by the loop guard instead of calling the model.
 *
 * @param text
 *            rendered answer
 * @param searchCount
 *            search turns seen in the inspected window
 * @param planningCount
 *            planning turns seen in the inspected window
 * @param usageEstimate
 *            word count of {@code text}
 */
public record TerminalResponse(String text, int searchCount, int planningCount, int usageEstimate) {
}
