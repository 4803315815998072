package io.surfworks.vectorforge.config;

import io.surfworks.vectorforge.sample.SamplerConfig;
import io.surfworks.vectorforge.value.Dialect;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class VectorForgeConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        VectorForgeConfig config = VectorForgeConfig.defaults();

        assertFalse(config.sampler().isBounded());
        assertEquals(Dialect.FUNCTIONAL, config.defaultDialect());
        assertEquals("", config.defaultName());
    }

    @Test
    void testWithMethods() {
        VectorForgeConfig config = VectorForgeConfig.defaults()
                .withSampler(new SamplerConfig(100))
                .withDefaultDialect(Dialect.BIT_VECTOR)
                .withDefaultName("adder");

        assertEquals(100, config.sampler().maxAttemptsPerSample());
        assertEquals(Dialect.BIT_VECTOR, config.defaultDialect());
        assertEquals("adder", config.defaultName());
    }

    @Test
    void testNullsRejected() {
        assertThrows(NullPointerException.class,
                () -> new VectorForgeConfig(null, Dialect.FUNCTIONAL, ""));
        assertThrows(NullPointerException.class,
                () -> VectorForgeConfig.defaults().withDefaultDialect(null));
    }

    @Test
    void testConfigFileLocation() {
        assertTrue(VectorForgeConfig.configFile().endsWith(Path.of(".config", "vectorforge", "vectorforge.json")));
    }

    @Test
    void testLoadMissingFileGivesDefaults() {
        assertEquals(VectorForgeConfig.defaults(),
                VectorForgeConfigLoader.load(tempDir.resolve("absent.json")));
    }

    @Test
    void testLoadPartialFile() throws IOException {
        Path file = tempDir.resolve("vectorforge.json");
        Files.writeString(file, "{\"defaultDialect\": \"c\"}");

        VectorForgeConfig config = VectorForgeConfigLoader.load(file);

        assertEquals(Dialect.STRUCT_ARRAY, config.defaultDialect());
        assertEquals(SamplerConfig.defaults(), config.sampler());
    }

    @Test
    void testSaveThenLoad() throws IOException {
        Path file = tempDir.resolve("sub/vectorforge.json");
        VectorForgeConfig config = VectorForgeConfig.defaults()
                .withSampler(new SamplerConfig(5000))
                .withDefaultDialect(Dialect.STRUCT_ARRAY)
                .withDefaultName("tv");

        VectorForgeConfigLoader.save(config, file);

        assertEquals(config, VectorForgeConfigLoader.load(file));
    }

    @Test
    void testInvalidFilesAreReported() throws IOException {
        Path garbage = tempDir.resolve("garbage.json");
        Files.writeString(garbage, "{not json");
        assertThrows(IllegalArgumentException.class, () -> VectorForgeConfigLoader.load(garbage));

        Path negative = tempDir.resolve("negative.json");
        Files.writeString(negative, "{\"sampler\": {\"maxAttemptsPerSample\": -1}}");
        assertThrows(IllegalArgumentException.class, () -> VectorForgeConfigLoader.load(negative));

        Path dialect = tempDir.resolve("dialect.json");
        Files.writeString(dialect, "{\"defaultDialect\": \"verilog\"}");
        assertThrows(IllegalArgumentException.class, () -> VectorForgeConfigLoader.load(dialect));
    }
}
