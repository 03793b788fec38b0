package dev.flyzex.bot.infrastructure.i18n;

import dev.flyzex.bot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageServiceTest {

    private MessageService messageService;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.setLanguage("fa");
        messageService = new MessageService(properties);
    }

    @Test
    void shouldUseConfiguredDefaultLanguage() {
        assertEquals("fa", messageService.getDefaultLanguage());
        assertEquals("در انتظار بررسی", messageService.getMessage("status.pending"));
    }

    @Test
    void shouldFallBackToEnglishForUnsupportedDefault() {
        BotProperties properties = new BotProperties();
        properties.setLanguage("de");

        MessageService service = new MessageService(properties);

        assertEquals("en", service.getDefaultLanguage());
        assertEquals("pending", service.getMessage("status.pending"));
    }

    @Test
    void shouldFormatArgumentsPerLanguage() {
        assertEquals("<b>Question 2/3</b>\nWhy?",
                messageService.getMessage("apply.question.step", "en", "2", "3", "Why?"));
        assertEquals("<b>پرسش 2 از 3</b>\nWhy?",
                messageService.getMessage("apply.question.step", "fa", "2", "3", "Why?"));
    }

    @Test
    void shouldResolveClientLanguageCodes() {
        assertEquals("fa", messageService.resolveLanguage("fa-IR"));
        assertEquals("en", messageService.resolveLanguage("EN_us"));
        assertEquals("fa", messageService.resolveLanguage("ru"));
        assertEquals("fa", messageService.resolveLanguage(null));
        assertEquals("fa", messageService.resolveLanguage(" "));
    }

    @Test
    void shouldReturnKeyWhenMessageIsMissing() {
        assertEquals("no.such.key", messageService.getMessage("no.such.key", "en"));
    }

    @Test
    void shouldReportSupportedLanguages() {
        assertTrue(messageService.isSupported("en"));
        assertTrue(messageService.isSupported("fa"));
        assertFalse(messageService.isSupported("ru"));
        assertFalse(messageService.isSupported(null));
    }
}
