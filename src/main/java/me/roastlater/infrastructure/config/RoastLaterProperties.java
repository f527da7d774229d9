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

package me.roastlater.infrastructure.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties of the data interchange subsystem, bound from
 * application.properties under the {@code roastlater.*} prefix.
 *
 * <ul>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link TransferProperties} - export and import limits</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "roastlater")
@Data
public class RoastLaterProperties {

    /** Written into every exported snapshot. */
    private String appVersion = "dev";

    private StorageProperties storage = new StorageProperties();
    private TransferProperties transfer = new TransferProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private String storeDirectory = "store";
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.roastlater/workspace";
    }

    @Data
    public static class TransferProperties {
        private String exportDirectory = "exports";
        private long maxFileSizeBytes = 100L * 1024 * 1024;
        private int storageSafetyFactor = 2;
        private int progressBatchSize = 25;
        private Duration likelyDuplicateWindow = Duration.ofMinutes(5);
        private Duration futureTimestampTolerance = Duration.ofDays(1);
        private int defaultMaxErrorsAllowed = 10;
        private int recentErrorCapacity = 100;
        private List<AnonymizationRule> anonymizationRules = new ArrayList<>(List.of(
                new AnonymizationRule("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}", "[EMAIL]"),
                new AnonymizationRule("\\+?\\d[\\d\\s().-]{7,}\\d", "[PHONE]"),
                new AnonymizationRule("(?<![\\w@])@\\w+", "[HANDLE]"),
                new AnonymizationRule("(?<!\\[)\\b[A-Z]{2,}\\b(?!\\])", "[COMPANY]")));
    }

    /**
     * Regular expression and the token that replaces its matches. Rules apply
     * in declaration order.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AnonymizationRule {
        private String pattern;
        private String replacement;
    }
}
