package me.golemcore.router.adapter.outbound.storage;

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

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Fixed-width UTC timestamp strings with microsecond precision, so that
 * lexicographic order in the database equals chronological order.
 */
final class StoreTimestamps {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'")
            .withZone(ZoneOffset.UTC);

    private StoreTimestamps() {
    }

    static String format(Instant instant) {
        Instant value = instant != null ? instant : Instant.EPOCH;
        return FORMAT.format(value.truncatedTo(ChronoUnit.MICROS));
    }

    /**
     * Parses a stored value. Blank or unparseable values (rows filled in by a
     * schema repair) map to the epoch.
     */
    static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            return Instant.EPOCH;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            return Instant.EPOCH;
        }
    }
}
