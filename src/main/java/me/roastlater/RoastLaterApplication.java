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

package me.roastlater;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the RoastLater data interchange service.
 *
 * <p>
 * Exports the application's local state (content records, favorites,
 * preferences, usage statistics) as a versioned snapshot file and imports such
 * files back with a preview, a merge or replace strategy and an error budget.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → DataTransferController (dashboard, SSE progress)
 * Domain Layer       → export pipeline, parser, preview, merge/replace engine
 * Infrastructure     → local filesystem storage, JSON local store
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code roastlater.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RoastLaterApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoastLaterApplication.class, args);
    }

}
