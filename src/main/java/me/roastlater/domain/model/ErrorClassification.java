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
 * Kind and message keys for a failure.
 *
 * @param kind
 *            taxonomy entry
 * @param messageKey
 *            key of the failure message
 * @param recoverySuggestionKey
 *            key of the one-line recovery hint
 * @param arguments
 *            message format arguments, in order
 */
public record ErrorClassification(
        ErrorKind kind,
        String messageKey,
        String recoverySuggestionKey,
        List<Object> arguments) {

    public ErrorClassification {
        arguments = arguments != null ? List.copyOf(arguments) : List.of();
    }

    public static ErrorClassification of(ErrorKind kind, Object... arguments) {
        return new ErrorClassification(kind, kind.messageKey(), kind.suggestionKey(), List.of(arguments));
    }
}
