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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

/**
 * Learned routing state of one model: its static strength vector plus the
 * dynamic weight, win rate, average score and selection count updated from
 * feedback.
 *
 * <p>
 * Instances held by the optimizer are mutable; everything handed out to
 * callers is a {@link #copy()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelProfile {

    private String name;

    @Builder.Default
    private Map<Capability, Double> strengths = new EnumMap<>(Capability.class);

    @Builder.Default
    private double weight = 1.0;

    @Builder.Default
    private double winRate = 0.5;

    @Builder.Default
    private double avgScore = 0.5;

    private long selectionCount;

    public double strength(Capability capability) {
        return strengths.getOrDefault(capability, 0.5);
    }

    public ModelProfile copy() {
        Map<Capability, Double> strengthsCopy = new EnumMap<>(Capability.class);
        strengthsCopy.putAll(strengths);
        return ModelProfile.builder()
                .name(name)
                .strengths(strengthsCopy)
                .weight(weight)
                .winRate(winRate)
                .avgScore(avgScore)
                .selectionCount(selectionCount)
                .build();
    }
}
