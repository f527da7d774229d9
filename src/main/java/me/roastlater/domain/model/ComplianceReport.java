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
 * Result of analysing export options before the export starts.
 */
public record ComplianceReport(PrivacyNotice notice, List<ComplianceIssue> issues) {

    public ComplianceReport {
        issues = List.copyOf(issues);
    }

    /**
     * Whether the caller must obtain explicit user acknowledgement before
     * exporting.
     */
    public boolean requiresAcknowledgement() {
        return issues.stream().anyMatch(issue -> issue.severity() == Severity.HIGH);
    }
}
