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
 * A terminal failure paired with its context and a ranked recovery menu in
 * which exactly one option is recommended.
 */
public record ErrorReport(
        ErrorClassification classification,
        OperationContext context,
        List<RecoveryOption> options) {

    public ErrorReport {
        options = List.copyOf(options);
    }

    public RecoveryOption recommendedOption() {
        return options.stream()
                .filter(RecoveryOption::recommended)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No recommended recovery option"));
    }
}
