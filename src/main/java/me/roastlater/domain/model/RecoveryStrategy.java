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

import java.util.Locale;

/**
 * What the caller can do after a terminal failure. The caller executes the
 * strategy by re-invoking the relevant operation.
 */
public enum RecoveryStrategy {

    RETRY,

    SKIP_AND_CONTINUE,

    FREE_STORAGE_AND_RETRY,

    ABORT;

    public String titleKey() {
        return "transfer.recovery." + name().toLowerCase(Locale.ROOT) + ".title";
    }

    public String descriptionKey() {
        return "transfer.recovery." + name().toLowerCase(Locale.ROOT) + ".description";
    }
}
