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

import java.util.Objects;

/**
 * User choices for applying a previewed snapshot.
 *
 * <p>
 * {@code skipDuplicates}, {@code preserveExistingFavorites} and the error
 * budget ({@code allowPartialImport}, {@code maxErrorsAllowed}) only affect the
 * {@link ImportStrategy#MERGE} strategy; replace is all-or-nothing.
 */
public record ImportOptions(
        ImportStrategy strategy,
        boolean skipDuplicates,
        boolean preserveExistingFavorites,
        boolean allowPartialImport,
        int maxErrorsAllowed) {

    public ImportOptions {
        Objects.requireNonNull(strategy, "strategy must not be null");
        if (maxErrorsAllowed < 0) {
            throw new IllegalArgumentException("maxErrorsAllowed must be >= 0, got " + maxErrorsAllowed);
        }
    }

    public static ImportOptions merge(int maxErrorsAllowed) {
        return new ImportOptions(ImportStrategy.MERGE, true, true, true, maxErrorsAllowed);
    }

    public static ImportOptions replace() {
        return new ImportOptions(ImportStrategy.REPLACE, false, false, false, 0);
    }

    public boolean isReplace() {
        return strategy == ImportStrategy.REPLACE;
    }
}
