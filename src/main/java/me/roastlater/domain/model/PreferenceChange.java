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

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A preference key whose incoming value differs from the local one.
 */
public record PreferenceChange(String key, Object oldValue, Object newValue) {

    private static final String ABSENT = "∅";

    /**
     * Renders the change as {@code key: old → new}.
     */
    public String description() {
        return key + ": " + render(oldValue) + " → " + render(newValue);
    }

    private static String render(Object value) {
        if (value == null) {
            return ABSENT;
        }
        if (value instanceof List<?> list) {
            return list.stream().map(Objects::toString).collect(Collectors.joining(", ", "[", "]"));
        }
        return String.valueOf(value);
    }
}
