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
 * Result of {@code generate}: either an interpreted model answer (phase
 * {@link InvocationPhase#DONE}) or a terminal response substituted by the loop
 * guard (phase {@link InvocationPhase#TERMINATED_BY_GUARD}).
 */
public record GenerationOutcome(InvocationPhase phase, InterpretedResult result, TerminalResponse terminalResponse) {

    public static GenerationOutcome completed(InterpretedResult result) {
        return new GenerationOutcome(InvocationPhase.DONE, result, null);
    }

    public static GenerationOutcome terminated(TerminalResponse terminalResponse) {
        return new GenerationOutcome(InvocationPhase.TERMINATED_BY_GUARD, null, terminalResponse);
    }

    public boolean isTerminatedByGuard() {
        return phase == InvocationPhase.TERMINATED_BY_GUARD;
    }

    /**
     * Text the caller should show, whichever path produced it.
     */
    public String text() {
        return isTerminatedByGuard() ? terminalResponse.text() : result.text();
    }
}
