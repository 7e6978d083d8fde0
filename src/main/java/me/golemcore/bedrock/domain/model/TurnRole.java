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

import java.util.Locale;

/**
 * Role of a single conversation turn.
 */
public enum TurnRole {

    SYSTEM("system"),
    USER("user"),
    ASSISTANT("assistant");

    private final String wireName;

    TurnRole(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Role name as sent to the provider ("system", "user", "assistant").
     */
    public String wireName() {
        return wireName;
    }

    public static TurnRole fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Turn role must not be null");
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
        case "system" -> SYSTEM;
        case "user" -> USER;
        case "assistant" -> ASSISTANT;
        default -> throw new IllegalArgumentException("Unknown turn role: " + value);
        };
    }
}
