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

package me.roastlater.domain.exception;

import me.roastlater.domain.model.ErrorKind;

import java.util.List;

public class PreviewNotFoundException extends DataTransferException {

    private static final long serialVersionUID = 1L;

    private final String previewId;

    public PreviewNotFoundException(String previewId) {
        super(ErrorKind.PREVIEW_NOT_FOUND, "No pending import preview: " + previewId);
        this.previewId = previewId;
    }

    public String getPreviewId() {
        return previewId;
    }

    @Override
    public List<Object> getMessageArguments() {
        return List.of(String.valueOf(previewId));
    }
}
