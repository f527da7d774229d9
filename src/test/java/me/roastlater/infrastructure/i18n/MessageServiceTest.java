package me.roastlater.infrastructure.i18n;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class MessageServiceTest {

    private static final String KEY_RETRY = "transfer.recovery.retry.title";

    private MessageService messageService;

    @BeforeEach
    void setUp() {
        messageService = new MessageService();
    }

    // --- getMessage (current language) ---

    @Test
    void shouldReturnEnglishMessageByDefault() {
        assertEquals("Retry", messageService.getMessage(KEY_RETRY));
    }

    @Test
    void shouldReturnVietnameseMessageWhenLanguageSetToVi() {
        messageService.setLanguage("vi");

        assertEquals("Thử lại", messageService.getMessage(KEY_RETRY));
    }

    @Test
    void shouldReturnKeyWhenMessageNotFound() {
        assertEquals("transfer.nonexistent.key", messageService.getMessage("transfer.nonexistent.key"));
    }

    // --- getMessage (explicit language) ---

    @Test
    void shouldFormatMessageWithParameters() {
        String result = messageService.getMessage("transfer.error.corrupted_data", "en", "checksum", "mismatch");

        assertEquals("The file is corrupted or invalid (checksum: mismatch).", result);
    }

    @Test
    void shouldFormatMessageWithListArguments() {
        String result = messageService.getMessage("transfer.error.insufficient_storage", "en", List.of(512, 128));

        assertEquals("Not enough storage: 512 bytes required, 128 bytes available.", result);
    }

    @Test
    void shouldFormatVietnameseMessageWithParameters() {
        String result = messageService.getMessage("transfer.error.preview_not_found", "vi", "abc");

        assertEquals("Không tìm thấy phiên nhập đang chờ (abc).", result);
    }

    @Test
    void shouldFallBackToEnglishForUnknownLanguage() {
        assertEquals("Retry", messageService.getMessage(KEY_RETRY, "fr"));
    }

    @Test
    void shouldTranslateEveryPhase() {
        assertNotEquals("transfer.export.phase.writing",
                messageService.getMessage("transfer.export.phase.writing", "vi"));
        assertNotEquals("transfer.import.phase.saving",
                messageService.getMessage("transfer.import.phase.saving", "en"));
    }

    // --- language management ---

    @Test
    void shouldFallBackToDefaultForUnsupportedLanguage() {
        messageService.setLanguage("vi");
        messageService.setLanguage("de");

        assertEquals(MessageService.DEFAULT_LANG, messageService.getLanguage());
    }

    @Test
    void shouldResolveRequestLanguage() {
        messageService.setLanguage("vi");

        assertEquals("en", messageService.resolveLanguage("en"));
        assertEquals("vi", messageService.resolveLanguage(null));
        assertEquals("vi", messageService.resolveLanguage("xx"));
    }

    @Test
    void shouldListSupportedLanguages() {
        assertEquals(Set.of("en", "vi"), messageService.getSupportedLanguages());
        assertEquals("Tiếng Việt", messageService.getLanguageDisplayName("vi"));
        assertEquals("English", messageService.getLanguageDisplayName("en"));
        assertEquals("xx", messageService.getLanguageDisplayName("xx"));
    }
}
