package gitclone.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Properties;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public class ClientConfigTest {

    @AfterEach
    void clearOverrides() {
        System.clearProperty(ClientConfig.REQUEST_TIMEOUT);
        System.clearProperty(ClientConfig.VERIFY_CHECKSUM);
    }

    @Test
    void testBundledProperties() {
        ClientConfig config = ClientConfig.load();

        assertEquals("git-clone/1.0", config.getUserAgent());
        assertEquals(Duration.ofSeconds(30), config.getConnectTimeout());
        assertEquals(Duration.ofSeconds(300), config.getRequestTimeout());
        assertTrue(config.isVerifyPackChecksum());
    }

    @Test
    void testMissingKeysFallBackToDefaults() {
        ClientConfig config = ClientConfig.fromProperties(new Properties());

        assertEquals(ClientConfig.defaults().getRequestTimeout(), config.getRequestTimeout());
        assertTrue(config.isVerifyPackChecksum());
    }

    @Test
    void testSystemPropertyWins() {
        Properties props = new Properties();
        props.setProperty(ClientConfig.REQUEST_TIMEOUT, "10");
        System.setProperty(ClientConfig.REQUEST_TIMEOUT, "42");
        System.setProperty(ClientConfig.VERIFY_CHECKSUM, "false");

        ClientConfig config = ClientConfig.fromProperties(props);

        assertEquals(Duration.ofSeconds(42), config.getRequestTimeout());
        assertFalse(config.isVerifyPackChecksum());
    }

    @Test
    void testInvalidNumbersRejected() {
        Properties props = new Properties();
        props.setProperty(ClientConfig.CONNECT_TIMEOUT, "soon");
        assertThrows(IllegalArgumentException.class, () -> ClientConfig.fromProperties(props));

        props.setProperty(ClientConfig.CONNECT_TIMEOUT, "0");
        assertThrows(IllegalArgumentException.class, () -> ClientConfig.fromProperties(props));
    }

    @Test
    void testOverridesReturnCopies() {
        ClientConfig base = ClientConfig.defaults();
        ClientConfig changed = base.withRequestTimeout(Duration.ofSeconds(5)).withVerifyPackChecksum(false);

        assertEquals(Duration.ofMinutes(5), base.getRequestTimeout());
        assertTrue(base.isVerifyPackChecksum());
        assertEquals(Duration.ofSeconds(5), changed.getRequestTimeout());
        assertFalse(changed.isVerifyPackChecksum());
    }
}
