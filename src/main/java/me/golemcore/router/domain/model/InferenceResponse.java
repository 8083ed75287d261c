package me.golemcore.router.domain.model;

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

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InferenceResponse {

    String model;
    String text;
    boolean success;
    String error;
    int tokenCount;

    public static InferenceResponse success(String model, String text, int tokenCount) {
        return InferenceResponse.builder()
                .model(model)
                .text(text)
                .success(true)
                .tokenCount(tokenCount)
                .build();
    }

    public static InferenceResponse failure(String model, String error) {
        return InferenceResponse.builder()
                .model(model)
                .text("")
                .success(false)
                .error(error)
                .build();
    }

    /**
     * Whether the response carries usable text.
     */
    public boolean hasText() {
        return success && text != null && !text.isBlank();
    }
}
