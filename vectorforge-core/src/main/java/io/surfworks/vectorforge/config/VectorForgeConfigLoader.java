package io.surfworks.vectorforge.config;

import io.surfworks.vectorforge.sample.SamplerConfig;
import io.surfworks.vectorforge.value.Dialect;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Loads and saves {@link VectorForgeConfig} as JSON.
 *
 * <p>A missing file yields the defaults. Keys absent from the file keep their
 * default values.
 */
public final class VectorForgeConfigLoader {

    private static final Logger LOG = Logger.getLogger(VectorForgeConfigLoader.class.getName());

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    private VectorForgeConfigLoader() {
    }

    public static VectorForgeConfig load() {
        return load(VectorForgeConfig.configFile());
    }

    /**
     * Loads configuration from a specific file.
     *
     * @param configFile path to the config file
     * @return the loaded configuration, or defaults if the file does not exist
     * @throws IllegalArgumentException if the file exists but cannot be read or parsed
     */
    public static VectorForgeConfig load(Path configFile) {
        VectorForgeConfig config = VectorForgeConfig.defaults();
        if (!Files.exists(configFile)) {
            LOG.fine("No config file at " + configFile + ", using defaults");
            return config;
        }

        try {
            String json = Files.readString(configFile, StandardCharsets.UTF_8);
            JsonObject root = GSON.fromJson(json, JsonObject.class);
            if (root == null) {
                return config;
            }

            if (root.has("sampler")) {
                JsonObject sampler = root.getAsJsonObject("sampler");
                if (sampler.has("maxAttemptsPerSample")) {
                    config = config.withSampler(
                            new SamplerConfig(sampler.get("maxAttemptsPerSample").getAsLong()));
                }
            }
            if (root.has("defaultDialect")) {
                config = config.withDefaultDialect(Dialect.fromName(root.get("defaultDialect").getAsString()));
            }
            if (root.has("defaultName")) {
                config = config.withDefaultName(root.get("defaultName").getAsString());
            }
            LOG.fine("Loaded config from " + configFile);
            return config;
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read config file " + configFile + ": " + e.getMessage(), e);
        } catch (JsonParseException | IllegalStateException | ClassCastException | NumberFormatException e) {
            throw new IllegalArgumentException("Invalid config file " + configFile + ": " + e.getMessage(), e);
        }
    }

    public static void save(VectorForgeConfig config, Path configFile) throws IOException {
        JsonObject sampler = new JsonObject();
        sampler.addProperty("maxAttemptsPerSample", config.sampler().maxAttemptsPerSample());

        JsonObject root = new JsonObject();
        root.add("sampler", sampler);
        root.addProperty("defaultDialect", config.defaultDialect().cliName());
        root.addProperty("defaultName", config.defaultName());

        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(configFile, GSON.toJson(root), StandardCharsets.UTF_8);
    }
}
