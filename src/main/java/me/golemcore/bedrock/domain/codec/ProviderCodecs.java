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

package me.golemcore.bedrock.domain.codec;

import me.golemcore.bedrock.domain.model.ProviderFamily;

/**
 * Codec lookup by provider family.
 */
public final class ProviderCodecs {

    private static final ProviderCodec STRUCTURED_CONTENT = new StructuredContentCodec();
    private static final ProviderCodec FLAT_TEXT = new FlatTextCodec();

    private ProviderCodecs() {
    }

    public static ProviderCodec forFamily(ProviderFamily family) {
        return switch (family) {
        case STRUCTURED_CONTENT -> STRUCTURED_CONTENT;
        case FLAT_TEXT -> FLAT_TEXT;
        };
    }
}
