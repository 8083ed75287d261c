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

import java.util.OptionalDouble;

/**
 * User rating attached to a feedback record. A rating is either a single
 * value, a range the user was unsure within, or absent. All values are
 * clamped to [0, 1].
 */
public interface FeedbackScore {

    /**
     * Point value used for learning: the scalar itself, the midpoint of a
     * range, or empty when absent.
     */
    OptionalDouble value();

    static FeedbackScore of(Double value) {
        return value == null ? absent() : new Scalar(value);
    }

    static FeedbackScore range(double low, double high) {
        return new Range(low, high);
    }

    static FeedbackScore absent() {
        return Absent.INSTANCE;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    /** A single rating. */
    record Scalar(double score) implements FeedbackScore {

        public Scalar {
            score = clamp(score);
        }

        @Override
        public OptionalDouble value() {
            return OptionalDouble.of(score);
        }
    }

    /** A rating range; bounds are swapped if given in reverse order. */
    record Range(double low, double high) implements FeedbackScore {

        public Range {
            double a = clamp(low);
            double b = clamp(high);
            low = Math.min(a, b);
            high = Math.max(a, b);
        }

        @Override
        public OptionalDouble value() {
            return OptionalDouble.of((low + high) / 2.0);
        }
    }

    /** No rating was given. */
    final class Absent implements FeedbackScore {

        static final Absent INSTANCE = new Absent();

        private Absent() {
        }

        @Override
        public OptionalDouble value() {
            return OptionalDouble.empty();
        }

        @Override
        public String toString() {
            return "Absent";
        }
    }
}
