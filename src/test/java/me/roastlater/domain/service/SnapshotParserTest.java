package me.roastlater.domain.service;

import me.roastlater.domain.exception.CorruptedDataException;
import me.roastlater.domain.exception.VersionMismatchException;
import me.roastlater.domain.model.ImportWarningType;
import me.roastlater.domain.model.ParsedSnapshot;
import me.roastlater.infrastructure.config.RoastLaterProperties;
import me.roastlater.testsupport.TransferFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotParserTest {

    private SnapshotCodec codec;
    private RoastLaterProperties properties;
    private SnapshotParser parser;

    @BeforeEach
    void setUp() {
        codec = new SnapshotCodec(TransferFixtures.objectMapper(), new SnapshotMigrationService(),
                TransferFixtures.fixedClock());
        properties = TransferFixtures.properties();
        parser = new SnapshotParser(codec, properties);
    }

    @Test
    void shouldParseValidSnapshot() {
        byte[] payload = codec.serialize(TransferFixtures.snapshot(TransferFixtures.records("r", 3), "r1"));

        ParsedSnapshot parsed = parser.parse(payload);

        assertTrue(parsed.compatible());
        assertEquals(3, parsed.snapshot().getContentRecords().size());
        assertTrue(parsed.warnings().isEmpty());
    }

    @Test
    void shouldRejectEmptyPayload() {
        CorruptedDataException ex = assertThrows(CorruptedDataException.class, () -> parser.parse(new byte[0]));
        assertEquals("$", ex.getField());
        assertThrows(CorruptedDataException.class, () -> parser.parse(null));
    }

    @Test
    void shouldRejectOversizePayload() {
        byte[] payload = codec.serialize(TransferFixtures.snapshot(TransferFixtures.records("r", 3)));
        properties.getTransfer().setMaxFileSizeBytes(payload.length - 1L);

        CorruptedDataException ex = assertThrows(CorruptedDataException.class, () -> parser.parse(payload));
        assertEquals("$", ex.getField());
    }

    @Test
    void shouldAcceptPayloadAtExactSizeLimit() {
        byte[] payload = codec.serialize(TransferFixtures.snapshot(TransferFixtures.records("r", 3)));
        properties.getTransfer().setMaxFileSizeBytes(payload.length);

        assertNotNull(parser.parse(payload));
    }

    @Test
    void shouldRejectDuplicateRecordIds() {
        byte[] payload = codec.serialize(TransferFixtures.snapshot(List.of(
                TransferFixtures.record("same"), TransferFixtures.record("other"), TransferFixtures.record("same"))));

        CorruptedDataException ex = assertThrows(CorruptedDataException.class, () -> parser.parse(payload));
        assertEquals("contentRecords.id", ex.getField());
    }

    @Test
    void shouldPropagateVersionMismatch() {
        byte[] payload = "{\"schemaVersion\":99}".getBytes(StandardCharsets.UTF_8);

        assertThrows(VersionMismatchException.class, () -> parser.parse(payload));
    }

    @Test
    void shouldFlagMigratedSnapshotFirst() {
        String json = """
                {"schemaVersion":1,"appVersion":"0.9","exportTimestamp":"2025-12-01T00:00:00Z",
                 "preferences":{},"favoriteIds":[],
                 "contentRecords":[{"id":"r1","content":"x","category":"general","spiceLevel":2,"createdAt":"bad"}]}
                """;

        ParsedSnapshot parsed = parser.parse(json.getBytes(StandardCharsets.UTF_8));

        assertFalse(parsed.compatible());
        assertEquals(2, parsed.warnings().size());
        assertEquals(ImportWarningType.SCHEMA_VERSION_MISMATCH, parsed.warnings().get(0).type());
        assertEquals("1->2", parsed.warnings().get(0).detail());
        assertEquals(ImportWarningType.MALFORMED_TIMESTAMP, parsed.warnings().get(1).type());
    }
}
