package io.surfworks.vectorforge.cli;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OptionsTest {

    @Test
    void testDefaults() throws UsageException {
        Options options = Options.parse(new String[] {"--example"}, 1);

        assertEquals(List.of(), options.positional());
        assertNull(options.name());
        assertFalse(options.littleEndian());
        assertNull(options.inputSplits());
        assertEquals(Options.DEFAULT_COUNT, options.count());
        assertEquals(0, options.seed());
        assertNull(options.out());
        assertFalse(options.verbose());
    }

    @Test
    void testAllOptions() throws UsageException {
        Options options = Options.parse(new String[] {
                "--render", "forte", "in.json",
                "--name", "adder", "--little-endian",
                "--input-splits", "1, 4", "--output-splits", "8",
                "--count", "3", "--seed", "-9",
                "--out", "out.txt", "--config", "cfg.json", "-v"}, 1);

        assertEquals(List.of("forte", "in.json"), options.positional());
        assertEquals("adder", options.name());
        assertTrue(options.littleEndian());
        assertEquals(List.of(1, 4), options.inputSplits());
        assertEquals(List.of(8), options.outputSplits());
        assertEquals(3, options.count());
        assertEquals(-9, options.seed());
        assertEquals(Path.of("out.txt"), options.out());
        assertEquals(Path.of("cfg.json"), options.config());
        assertTrue(options.verbose());
    }

    @Test
    void testEmptySplitsMeanNoTokens() throws UsageException {
        Options options = Options.parse(new String[] {"--output-splits", ""}, 0);
        assertEquals(List.of(), options.outputSplits());
    }

    @Test
    void testLaterEndiannessWins() throws UsageException {
        assertFalse(Options.parse(new String[] {"--little-endian", "--big-endian"}, 0).littleEndian());
    }

    @Test
    void testErrors() {
        assertThrows(UsageException.class, () -> Options.parse(new String[] {"--bogus"}, 0));
        assertThrows(UsageException.class, () -> Options.parse(new String[] {"--name"}, 0));
        assertThrows(UsageException.class, () -> Options.parse(new String[] {"--count", "-1"}, 0));
        assertThrows(UsageException.class, () -> Options.parse(new String[] {"--count", "many"}, 0));
        assertThrows(UsageException.class, () -> Options.parse(new String[] {"--count", "99999999999"}, 0));
        assertThrows(UsageException.class, () -> Options.parse(new String[] {"--input-splits", "1,0"}, 0));
        assertThrows(UsageException.class, () -> Options.parse(new String[] {"--input-splits", "1,,2"}, 0));
    }
}
