package io.surfworks.vectorforge.config;

import io.surfworks.vectorforge.sample.SamplerConfig;
import io.surfworks.vectorforge.value.Dialect;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration for VectorForge.
 *
 * <p>Configuration is loaded in order of precedence:
 * <ol>
 *   <li>CLI arguments (highest priority)</li>
 *   <li>Config file ({@code ~/.config/vectorforge/vectorforge.json})</li>
 *   <li>Defaults (lowest priority)</li>
 * </ol>
 *
 * @param sampler        rejection sampler settings
 * @param defaultDialect dialect used when the CLI is not told one
 * @param defaultName    name given to rendered vectors when none is supplied (may be empty)
 */
public record VectorForgeConfig(
        SamplerConfig sampler,
        Dialect defaultDialect,
        String defaultName
) {

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "vectorforge"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "vectorforge.json";

    public VectorForgeConfig {
        Objects.requireNonNull(sampler, "sampler cannot be null");
        Objects.requireNonNull(defaultDialect, "defaultDialect cannot be null");
        Objects.requireNonNull(defaultName, "defaultName cannot be null");
    }

    public static VectorForgeConfig defaults() {
        return new VectorForgeConfig(SamplerConfig.defaults(), Dialect.FUNCTIONAL, "");
    }

    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    public VectorForgeConfig withSampler(SamplerConfig samplerConfig) {
        return new VectorForgeConfig(samplerConfig, defaultDialect, defaultName);
    }

    public VectorForgeConfig withDefaultDialect(Dialect dialect) {
        return new VectorForgeConfig(sampler, dialect, defaultName);
    }

    public VectorForgeConfig withDefaultName(String name) {
        return new VectorForgeConfig(sampler, defaultDialect, name);
    }
}
