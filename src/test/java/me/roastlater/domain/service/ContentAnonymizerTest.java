package me.roastlater.domain.service;

import me.roastlater.infrastructure.config.RoastLaterProperties;
import me.roastlater.testsupport.TransferFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContentAnonymizerTest {

    private ContentAnonymizer anonymizer;

    @BeforeEach
    void setUp() {
        anonymizer = new ContentAnonymizer(TransferFixtures.properties());
    }

    @Test
    void shouldRedactEmailAddress() {
        assertEquals("Ask [EMAIL] about it", anonymizer.anonymize("Ask john.doe@example.com about it"));
    }

    @Test
    void shouldRedactPhoneNumber() {
        assertEquals("Call me at [PHONE] later", anonymizer.anonymize("Call me at +1 (555) 123-4567 later"));
    }

    @Test
    void shouldRedactHandle() {
        assertEquals("Thanks [HANDLE] for the sync", anonymizer.anonymize("Thanks @bob for the sync"));
    }

    @Test
    void shouldRedactAllCapsCompanyName() {
        assertEquals("Another reorg at [COMPANY]", anonymizer.anonymize("Another reorg at ACME"));
    }

    @Test
    void shouldNotRedactInsertedTokens() {
        String result = anonymizer.anonymize("Mail bob@corp.io now");

        assertEquals("Mail [EMAIL] now", result);
    }

    @Test
    void shouldLeavePlainTextAlone() {
        assertEquals("Another meeting that could be an email",
                anonymizer.anonymize("Another meeting that could be an email"));
        assertNull(anonymizer.anonymize(null));
        assertEquals("", anonymizer.anonymize(""));
    }

    @Test
    void shouldApplyConfiguredRulesLiterally() {
        RoastLaterProperties properties = new RoastLaterProperties();
        properties.getTransfer().setAnonymizationRules(List.of(
                new RoastLaterProperties.AnonymizationRule("secret", "$1-redacted")));

        ContentAnonymizer custom = new ContentAnonymizer(properties);

        assertEquals("my $1-redacted plan", custom.anonymize("my secret plan"));
    }

    @Test
    void shouldFailOnInvalidPattern() {
        RoastLaterProperties properties = new RoastLaterProperties();
        properties.getTransfer().setAnonymizationRules(List.of(
                new RoastLaterProperties.AnonymizationRule("([unclosed", "x")));

        assertThrows(IllegalStateException.class, () -> new ContentAnonymizer(properties));
    }
}
