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
 * Generation ended in {@link InvocationPhase#FAILED}. The phase that failed is
 * kept so callers can tell bad input from an exhausted retry budget.
 */
public class GenerationFailedException extends RuntimeException {

    private final InvocationPhase failedPhase;

    public GenerationFailedException(InvocationPhase failedPhase, String message, Throwable cause) {
        super(message, cause);
        this.failedPhase = failedPhase;
    }

    public InvocationPhase getFailedPhase() {
        return failedPhase;
    }
}
