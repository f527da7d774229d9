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

/**
 * What an export will contain: the categories that are always included, the
 * optional ones the user selected, and general recommendations.
 */
public record PrivacyNotice(
        List<DataCategory> includedCategories,
        List<DataCategory> optionalCategories,
        List<String> recommendationKeys) {

    public PrivacyNotice {
        includedCategories = List.copyOf(includedCategories);
        optionalCategories = List.copyOf(optionalCategories);
        recommendationKeys = List.copyOf(recommendationKeys);
    }
}
