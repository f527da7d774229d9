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

import java.util.Set;

/**
 * Well-known preference keys of the flat preference map.
 */
public final class PreferenceKeys {

    public static final String LANGUAGE = "language";
    public static final String NOTIFICATIONS_ENABLED = "notifications.enabled";
    public static final String NOTIFICATION_FREQUENCY = "notifications.frequency";
    public static final String PREFERRED_CATEGORIES = "categories.preferred";
    public static final String DEFAULT_CATEGORY = "categories.default";
    public static final String DEFAULT_INTENSITY = "intensity.default";
    public static final String SAFETY_FILTERS_ENABLED = "safety-filters.enabled";

    public static final String API_KEY = "api.key";
    public static final String API_BASE_URL = "api.base-url";
    public static final String API_MODEL = "api.model";

    /** Keys holding credentials or endpoint configuration. */
    public static final Set<String> CREDENTIAL_KEYS = Set.of(API_KEY, API_BASE_URL, API_MODEL);

    private PreferenceKeys() {
    }

    public static boolean isCredential(String key) {
        return CREDENTIAL_KEYS.contains(key);
    }
}
