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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Shared infrastructure beans: clock, JSON mapper and the single-threaded
 * scheduler every export and import runs on.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class TransferConfiguration {

    public static final String TRANSFER_THREAD_NAME = "data-transfer";

    private final RoastLaterProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService transferExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, TRANSFER_THREAD_NAME);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Serializes all store-touching work: at most one export or import runs at a
     * time and later requests queue behind it.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler transferScheduler(ExecutorService transferExecutor) {
        return Schedulers.fromExecutorService(transferExecutor, TRANSFER_THREAD_NAME);
    }

    @PostConstruct
    public void init() {
        RoastLaterProperties.TransferProperties transfer = properties.getTransfer();
        log.info("RoastLater Data v{} starting...", properties.getAppVersion());
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
        log.info("[Transfer] Export directory: {}, max file size: {} bytes, batch size: {}",
                transfer.getExportDirectory(), transfer.getMaxFileSizeBytes(), transfer.getProgressBatchSize());
    }
}
