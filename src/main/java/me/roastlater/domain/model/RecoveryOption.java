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

/**
 * One entry of the recovery menu offered for a failure.
 */
public record RecoveryOption(
        RecoveryStrategy strategy,
        String titleKey,
        String descriptionKey,
        boolean recommended) {

    public static RecoveryOption of(RecoveryStrategy strategy, boolean recommended) {
        return new RecoveryOption(strategy, strategy.titleKey(), strategy.descriptionKey(), recommended);
    }
}
