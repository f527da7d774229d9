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

package me.roastlater.domain.service;

import me.roastlater.domain.model.ComplianceIssue;
import me.roastlater.domain.model.ComplianceIssueType;
import me.roastlater.domain.model.ComplianceReport;
import me.roastlater.domain.model.DataCategory;
import me.roastlater.domain.model.ExportOptions;
import me.roastlater.domain.model.PrivacyNotice;
import me.roastlater.domain.model.Severity;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Evaluates export options before an export starts. Pure: no I/O, same options
 * always give the same report.
 *
 * <p>
 * A report with a {@link Severity#HIGH} issue must be acknowledged by the user
 * before the export may run.
 */
@Service
public class ComplianceAnalyzer {

    private static final List<DataCategory> ALWAYS_INCLUDED = List.of(
            DataCategory.CONTENT_RECORDS,
            DataCategory.FAVORITES,
            DataCategory.PREFERENCES,
            DataCategory.EXPORT_METADATA);

    private static final String ISSUE_PREFIX = "transfer.compliance.issue.";
    private static final String RECOMMENDATION_PREFIX = "transfer.compliance.recommendation.";

    public ComplianceReport analyze(ExportOptions options) {
        return new ComplianceReport(buildNotice(options), findIssues(options));
    }

    private PrivacyNotice buildNotice(ExportOptions options) {
        List<DataCategory> optional = new ArrayList<>();
        if (options.includeCredentials()) {
            optional.add(DataCategory.CREDENTIALS);
        }
        if (options.includeDeviceInfo()) {
            optional.add(DataCategory.DEVICE_INFO);
        }
        if (options.includeUsageStatistics()) {
            optional.add(DataCategory.USAGE_STATISTICS);
        }

        List<String> recommendations = new ArrayList<>();
        recommendations.add(RECOMMENDATION_PREFIX + "store_securely");
        recommendations.add(RECOMMENDATION_PREFIX + "delete_after_transfer");
        if (options.includeCredentials()) {
            recommendations.add(RECOMMENDATION_PREFIX + "exclude_credentials");
        }
        if (!options.anonymize()) {
            recommendations.add(RECOMMENDATION_PREFIX + "consider_anonymization");
        }
        return new PrivacyNotice(ALWAYS_INCLUDED, optional, recommendations);
    }

    private List<ComplianceIssue> findIssues(ExportOptions options) {
        List<ComplianceIssue> issues = new ArrayList<>();
        if (options.includeCredentials()) {
            issues.add(issue(ComplianceIssueType.SENSITIVE_DATA_INCLUDED, Severity.HIGH));
        }
        if (options.anonymize()) {
            issues.add(issue(ComplianceIssueType.ANONYMIZATION_HEURISTIC, Severity.MEDIUM));
        }
        if (options.includeDeviceInfo()) {
            issues.add(issue(ComplianceIssueType.DEVICE_INFO_INCLUDED, Severity.LOW));
        }
        return issues;
    }

    private static ComplianceIssue issue(ComplianceIssueType type, Severity severity) {
        String name = type.name().toLowerCase(Locale.ROOT);
        return new ComplianceIssue(type, severity, ISSUE_PREFIX + name, RECOMMENDATION_PREFIX + name);
    }
}
