package dev.flyzex.bot.infrastructure.config;

import dev.flyzex.bot.security.StateCipher;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StateCipherConfigTest {

    private final StateCipherConfig config = new StateCipherConfig();

    @Test
    void shouldBuildCipherFromConfiguredVariable() {
        BotProperties properties = new BotProperties();
        properties.getSecurity().setSecretKeyEnv("FLYZEX_TEST_KEY");
        String key = StateCipher.generateKey();
        MockEnvironment environment = new MockEnvironment().withProperty("FLYZEX_TEST_KEY", " " + key + "\n");

        StateCipher cipher = config.stateCipher(properties, environment);

        StateCipher reference = new StateCipher(key);
        byte[] token = reference.encrypt("state".getBytes(StandardCharsets.UTF_8));
        assertEquals("state", new String(cipher.decrypt(token), StandardCharsets.UTF_8));
    }

    @Test
    void shouldFailWhenKeyIsMissing() {
        BotProperties properties = new BotProperties();
        MockEnvironment environment = new MockEnvironment();

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> config.stateCipher(properties, environment));

        assertTrue(error.getMessage().contains("BOT_SECRET_KEY"));
    }

    @Test
    void shouldFailWhenKeyIsBlank() {
        BotProperties properties = new BotProperties();
        MockEnvironment environment = new MockEnvironment().withProperty("BOT_SECRET_KEY", "   ");

        assertThrows(IllegalStateException.class, () -> config.stateCipher(properties, environment));
    }

    @Test
    void shouldRejectMalformedKey() {
        BotProperties properties = new BotProperties();
        MockEnvironment environment = new MockEnvironment().withProperty("BOT_SECRET_KEY", "not-a-fernet-key");

        assertThrows(IllegalArgumentException.class, () -> config.stateCipher(properties, environment));
    }
}
