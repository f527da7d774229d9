package me.roastlater.testsupport;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.roastlater.domain.model.ContentRecord;
import me.roastlater.domain.model.Snapshot;
import me.roastlater.domain.service.SnapshotCodec;
import me.roastlater.infrastructure.config.RoastLaterProperties;
import me.roastlater.infrastructure.config.TransferConfiguration;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class TransferFixtures {

    public static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private TransferFixtures() {
    }

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public static ObjectMapper objectMapper() {
        return TransferConfiguration.objectMapper();
    }

    public static RoastLaterProperties properties() {
        RoastLaterProperties properties = new RoastLaterProperties();
        properties.setAppVersion("1.2.0");
        properties.getTransfer().setProgressBatchSize(5);
        return properties;
    }

    public static ContentRecord record(String id, String content, String category, int intensity) {
        return ContentRecord.builder()
                .id(id)
                .content(content)
                .category(category)
                .intensity(intensity)
                .language("en")
                .createdAt(NOW.minusSeconds(3600))
                .build();
    }

    public static ContentRecord record(String id) {
        return record(id, "Roast number " + id, "deadlines", 3);
    }

    public static List<ContentRecord> records(String prefix, int count) {
        List<ContentRecord> result = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            result.add(record(prefix + i, "Content " + prefix + i, "meetings", (i % 5) + 1));
        }
        return result;
    }

    public static Snapshot snapshot(List<ContentRecord> records, Set<String> favorites,
            Map<String, Object> preferences) {
        List<ContentRecord> flagged = new ArrayList<>();
        for (ContentRecord contentRecord : records) {
            flagged.add(contentRecord.toBuilder().favorite(favorites.contains(contentRecord.getId())).build());
        }
        return Snapshot.builder()
                .schemaVersion(SnapshotCodec.CURRENT_SCHEMA_VERSION)
                .appVersion("1.2.0")
                .exportTimestamp(NOW.minusSeconds(60))
                .contentRecords(flagged)
                .favoriteIds(new LinkedHashSet<>(favorites))
                .preferences(new LinkedHashMap<>(preferences))
                .build();
    }

    public static Snapshot snapshot(List<ContentRecord> records, String... favorites) {
        return snapshot(records, new LinkedHashSet<>(List.of(favorites)), Map.of());
    }
}
