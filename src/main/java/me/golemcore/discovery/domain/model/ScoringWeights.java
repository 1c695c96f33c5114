package me.golemcore.discovery.domain.model;

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

/**
 * Immutable weight partition used to combine the six sub-scores. Weights must be
 * non-negative and sum to 1.0.
 */
public record ScoringWeights(
        double capability,
        double domain,
        double keyword,
        double performance,
        double availability,
        double load) {

    private static final double SUM_TOLERANCE = 1e-6;

    public static final ScoringWeights DEFAULT = new ScoringWeights(0.35, 0.25, 0.20, 0.10, 0.05, 0.05);

    public ScoringWeights {
        if (capability < 0 || domain < 0 || keyword < 0 || performance < 0 || availability < 0 || load < 0) {
            throw new IllegalStateException("Scoring weights must be non-negative");
        }
        double sum = capability + domain + keyword + performance + availability + load;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalStateException(String.format("Scoring weights must sum to 1.0, got %.6f", sum));
        }
    }

    public double sum() {
        return capability + domain + keyword + performance + availability + load;
    }
}
