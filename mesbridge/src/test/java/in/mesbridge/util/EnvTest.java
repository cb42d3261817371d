package in.mesbridge.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EnvTest {

    @AfterEach
    void tearDown() {
        System.clearProperty("MESBRIDGE_TEST_VALUE");
    }

    @Test
    void testFallsBackToSystemPropertyThenDefault() {
        assertEquals("fallback", Env.get("MESBRIDGE_TEST_VALUE", "fallback"));

        System.setProperty("MESBRIDGE_TEST_VALUE", "from-property");
        assertEquals("from-property", Env.get("MESBRIDGE_TEST_VALUE", "fallback"));
    }

    @Test
    void testTypedLookups() {
        System.setProperty("MESBRIDGE_TEST_VALUE", "1500");
        assertEquals(1500, Env.getInt("MESBRIDGE_TEST_VALUE", 0));
        assertEquals(Duration.ofMillis(1500), Env.getMillis("MESBRIDGE_TEST_VALUE", Duration.ZERO));

        System.setProperty("MESBRIDGE_TEST_VALUE", "abc");
        assertEquals(7, Env.getInt("MESBRIDGE_TEST_VALUE", 7), "Unparseable value falls back to default");
    }

    @Test
    void testListLookup() {
        System.setProperty("MESBRIDGE_TEST_VALUE", "quotes, trades,,depth ");
        assertEquals(List.of("quotes", "trades", "depth"), Env.getList("MESBRIDGE_TEST_VALUE", List.of()));

        System.setProperty("MESBRIDGE_TEST_VALUE", " , ");
        assertEquals(List.of("quotes"), Env.getList("MESBRIDGE_TEST_VALUE", List.of("quotes")));
    }
}
