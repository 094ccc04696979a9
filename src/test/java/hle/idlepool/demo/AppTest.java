package hle.idlepool.demo;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the command line front end.
 */
class AppTest {

    @Test
    void shouldParseOptions() {
        Map<String, String> options = App.parseArgs(new String[]{
                "--threads", "4", "--mode=get-close", "--idle-timeout-ms", "-1", "-h"});

        assertEquals("4", options.get("threads"));
        assertEquals("get-close", options.get("mode"));
        assertEquals("-1", options.get("idle-timeout-ms"));
        assertEquals("true", options.get("help"));
        assertEquals(4, App.intOption(options, "threads", 1));
        assertEquals(-1, App.intOption(options, "idle-timeout-ms", 0));
        assertEquals(7, App.intOption(options, "cycles", 7));
    }

    @Test
    void shouldRejectUnknownOptions() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> App.parseArgs(new String[]{"--thread", "4"}));
        assertEquals("Unknown option: --thread", e.getMessage());

        assertThrows(IllegalArgumentException.class, () -> App.parseArgs(new String[]{"--max-idle=5"}));
    }

    @Test
    void shouldRejectMalformedOptions() {
        assertThrows(IllegalArgumentException.class, () -> App.parseArgs(new String[]{"threads"}));
        assertThrows(IllegalArgumentException.class, () -> App.parseArgs(new String[]{"--threads"}));
        assertThrows(IllegalArgumentException.class, () -> App.parseArgs(new String[]{"--threads", "--cycles", "5"}));
        assertThrows(IllegalArgumentException.class,
                () -> App.parseArgs(new String[]{"--cycles", "5", "--cycles=6"}));
        assertThrows(IllegalArgumentException.class,
                () -> App.intOption(Map.of("threads", "many"), "threads", 1));
    }

    @Test
    void shouldParseModes() {
        assertEquals(CycleRunner.Mode.GET_PUT, App.parseMode("get-put"));
        assertEquals(CycleRunner.Mode.GET_CLOSE, App.parseMode("GET-CLOSE"));
        assertThrows(IllegalArgumentException.class, () -> App.parseMode("get-remove"));
    }

    @Test
    void shouldRejectCycleCountsThatOverflow() {
        assertTrue(App.validateOptions(16, 10_000, 0, 0));
        assertFalse(App.validateOptions(2, 1 << 30, 0, 0));
        assertFalse(App.validateOptions(0, 10, 0, 0));
        assertFalse(App.validateOptions(2, 10, -1, 0));
    }

    @Test
    @Timeout(30)
    void shouldRunSmallSimulation() {
        assertDoesNotThrow(() -> App.main(new String[]{
                "--threads", "2", "--cycles", "50", "--max-capacity", "2", "--idle-timeout-ms=1000"}));
    }
}
