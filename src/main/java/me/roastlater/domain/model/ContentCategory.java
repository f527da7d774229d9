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

package me.roastlater.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Categories known to the current build. Records keep their category as a raw
 * tag so snapshots from newer builds with extra categories still import.
 */
public enum ContentCategory {

    DEADLINES("deadlines"),

    MEETINGS("meetings"),

    KPIS("kpis"),

    CODE_REVIEWS("code_reviews"),

    WORKLOAD("workload"),

    COLLEAGUES("colleagues"),

    MANAGEMENT("management"),

    GENERAL("general");

    private final String value;

    ContentCategory(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<ContentCategory> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(category -> category.value.equals(value))
                .findFirst();
    }

    public static boolean isKnown(String value) {
        return fromValue(value).isPresent();
    }
}
