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

package me.roastlater.adapter.inbound.web;

import lombok.RequiredArgsConstructor;
import me.roastlater.adapter.inbound.web.dto.ApiErrorResponse;
import me.roastlater.adapter.inbound.web.dto.ComplianceReportResponse;
import me.roastlater.adapter.inbound.web.dto.ErrorReportDto;
import me.roastlater.adapter.inbound.web.dto.ImportPreviewResponse;
import me.roastlater.adapter.inbound.web.dto.ImportWarningDto;
import me.roastlater.adapter.inbound.web.dto.ProgressEventDto;
import me.roastlater.adapter.inbound.web.dto.RecoveryOptionDto;
import me.roastlater.domain.model.ComplianceIssue;
import me.roastlater.domain.model.ComplianceReport;
import me.roastlater.domain.model.DataCategory;
import me.roastlater.domain.model.ErrorClassification;
import me.roastlater.domain.model.ErrorReport;
import me.roastlater.domain.model.ExportResult;
import me.roastlater.domain.model.ImportPreview;
import me.roastlater.domain.model.ImportWarning;
import me.roastlater.domain.model.OperationProgress;
import me.roastlater.domain.model.RecoveryOption;
import me.roastlater.infrastructure.i18n.MessageService;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the structured values produced by the transfer core into localized
 * dashboard DTOs.
 */
@Component
@RequiredArgsConstructor
public class TransferViewRenderer {

    private final MessageService messageService;

    public ComplianceReportResponse compliance(ComplianceReport report, String lang) {
        return ComplianceReportResponse.builder()
                .requiresAcknowledgement(report.requiresAcknowledgement())
                .includedCategories(categories(report.notice().includedCategories(), lang))
                .optionalCategories(categories(report.notice().optionalCategories(), lang))
                .recommendations(report.notice().recommendationKeys().stream()
                        .map(key -> messageService.getMessage(key, lang))
                        .toList())
                .issues(report.issues().stream().map(issue -> issue(issue, lang)).toList())
                .build();
    }

    public ProgressEventDto progress(OperationProgress<?> progress, String lang) {
        ProgressEventDto.ProgressEventDtoBuilder builder = ProgressEventDto.builder()
                .operation(progress.operation().name())
                .phase(progress.phase().name())
                .progress(progress.progress())
                .itemsProcessed(progress.itemsProcessed())
                .totalItems(progress.totalItems());
        if (progress.failure() != null) {
            ApiErrorResponse error = error(progress.failure(), 0, lang);
            return builder.message(error.getMessage()).error(error).build();
        }
        builder.message(messageService.getMessage(progress.messageKey(), lang));
        if (progress.result() instanceof ExportResult exportResult) {
            builder.result(exportSummary(exportResult));
        } else {
            builder.result(progress.result());
        }
        return builder.build();
    }

    public ImportPreviewResponse preview(ImportPreview preview, String lang) {
        return ImportPreviewResponse.builder()
                .previewId(preview.previewId())
                .source(preview.source())
                .compatible(preview.compatible())
                .summary(preview.summary())
                .warnings(warnings(preview.warnings(), lang))
                .preferenceChanges(preview.preferenceChanges().stream()
                        .map(change -> ImportPreviewResponse.PreferenceChangeDto.builder()
                                .key(change.key())
                                .description(change.description())
                                .build())
                        .toList())
                .build();
    }

    public List<ImportWarningDto> warnings(List<ImportWarning> warnings, String lang) {
        return warnings.stream()
                .map(warning -> ImportWarningDto.builder()
                        .type(warning.type().name())
                        .itemId(warning.itemId())
                        .message(messageService.getMessage(warning.type().messageKey(), lang,
                                String.valueOf(warning.itemId()), String.valueOf(warning.detail())))
                        .build())
                .toList();
    }

    public ApiErrorResponse error(ErrorReport report, int status, String lang) {
        ErrorClassification classification = report.classification();
        return ApiErrorResponse.builder()
                .status(status)
                .kind(classification.kind().name())
                .message(messageService.getMessage(classification.messageKey(), lang, classification.arguments()))
                .suggestion(messageService.getMessage(classification.recoverySuggestionKey(), lang))
                .recoveryOptions(options(report.options(), lang))
                .build();
    }

    public ErrorReportDto errorReport(ErrorReport report, String lang) {
        ErrorClassification classification = report.classification();
        ErrorReportDto.ErrorReportDtoBuilder builder = ErrorReportDto.builder()
                .kind(classification.kind().name())
                .message(messageService.getMessage(classification.messageKey(), lang, classification.arguments()))
                .suggestion(messageService.getMessage(classification.recoverySuggestionKey(), lang))
                .recoveryOptions(options(report.options(), lang));
        if (report.context() != null) {
            builder.operation(report.context().operation().name())
                    .phase(report.context().phase().name())
                    .itemsProcessed(report.context().itemsProcessed())
                    .totalItems(report.context().totalItems())
                    .timestamp(report.context().timestamp());
        }
        return builder.build();
    }

    public List<RecoveryOptionDto> options(List<RecoveryOption> options, String lang) {
        return options.stream()
                .map(option -> RecoveryOptionDto.builder()
                        .strategy(option.strategy().name())
                        .title(messageService.getMessage(option.titleKey(), lang))
                        .description(messageService.getMessage(option.descriptionKey(), lang))
                        .recommended(option.recommended())
                        .build())
                .toList();
    }

    private Map<String, Object> exportSummary(ExportResult result) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("fileName", result.fileName());
        summary.put("sizeBytes", result.sizeBytes());
        summary.put("checksum", result.checksum());
        summary.put("records", result.snapshot().getContentRecords().size());
        summary.put("favorites", result.snapshot().getFavoriteIds().size());
        return summary;
    }

    private List<ComplianceReportResponse.CategoryDto> categories(List<DataCategory> categories, String lang) {
        return categories.stream()
                .map(category -> ComplianceReportResponse.CategoryDto.builder()
                        .category(category.name())
                        .label(messageService.getMessage(category.messageKey(), lang))
                        .sensitivity(category.getSensitivity().name())
                        .build())
                .toList();
    }

    private ComplianceReportResponse.IssueDto issue(ComplianceIssue issue, String lang) {
        return ComplianceReportResponse.IssueDto.builder()
                .type(issue.type().name())
                .severity(issue.severity().name())
                .description(messageService.getMessage(issue.descriptionKey(), lang))
                .recommendation(messageService.getMessage(issue.recommendationKey(), lang))
                .build();
    }
}
