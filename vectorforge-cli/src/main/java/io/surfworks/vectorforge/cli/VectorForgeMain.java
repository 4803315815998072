package io.surfworks.vectorforge.cli;

import io.surfworks.vectorforge.config.VectorForgeConfig;
import io.surfworks.vectorforge.config.VectorForgeConfigLoader;
import io.surfworks.vectorforge.render.BitBlaster;
import io.surfworks.vectorforge.render.Endianness;
import io.surfworks.vectorforge.render.RenderException;
import io.surfworks.vectorforge.render.RenderStyle;
import io.surfworks.vectorforge.render.SplitSpec;
import io.surfworks.vectorforge.render.TestVectorRenderers;
import io.surfworks.vectorforge.sample.RejectionSampler;
import io.surfworks.vectorforge.sample.SamplingException;
import io.surfworks.vectorforge.value.ConcreteValue;
import io.surfworks.vectorforge.value.Dialect;
import io.surfworks.vectorforge.vector.TestVector;
import io.surfworks.vectorforge.vector.TestVectorJson;
import io.surfworks.vectorforge.vector.TestVectorSet;

import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class VectorForgeMain {

    private static final Logger LOG = Logger.getLogger(VectorForgeMain.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final PrintStream out;
    private final PrintStream err;

    VectorForgeMain(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new VectorForgeMain(System.out, System.err).run(args);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    int run(String[] args) {
        if (args.length == 0) {
            printUsage();
            return EXIT_OK;
        }

        String command = args[0];
        try {
            return switch (command) {
                case "--help", "-h" -> {
                    printUsage();
                    yield EXIT_OK;
                }
                case "--render" -> runRender(Options.parse(args, 1));
                case "--example" -> runExample(Options.parse(args, 1));
                default -> {
                    err.println("Unknown command: " + command);
                    printUsage();
                    yield EXIT_USAGE;
                }
            };
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    private void printUsage() {
        out.println("VectorForge - constrained test vector generation");
        out.println();
        out.println("Usage: vectorforge <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  --render DIALECT FILE     Render a JSON test vector file");
        out.println("  --example [DIALECT]       Sample the built-in x < y example and render it");
        out.println("  --help, -h                Print this help message");
        out.println();
        out.println("Dialects: functional, c, forte");
        out.println();
        out.println("Options:");
        out.println("  --name NAME               Name of the generated value");
        out.println("  --little-endian           Reverse bit order before splitting (forte)");
        out.println("  --input-splits W,W,...    Input bit splits (forte, default: one per value)");
        out.println("  --output-splits W,W,...   Output bit splits (forte, default: one per value)");
        out.println("  --count N                 Number of vectors to sample (example, default 10)");
        out.println("  --seed S                  Random seed (example, default 0)");
        out.println("  --out PATH                Write output to PATH instead of stdout");
        out.println("  --config PATH             Config file (default ~/.config/vectorforge/vectorforge.json)");
        out.println("  --verbose                 Log sampling and rendering details");
    }

    private int runRender(Options options) throws UsageException {
        if (options.positional().size() != 2) {
            throw new UsageException("--render requires DIALECT and FILE arguments");
        }
        Dialect dialect = parseDialect(options.positional().get(0));
        Path inputPath = Path.of(options.positional().get(1));
        if (!Files.exists(inputPath)) {
            err.println("Error: File not found: " + inputPath);
            return EXIT_FAILURE;
        }

        VectorForgeConfig config = loadConfig(options);
        if (config == null) {
            return EXIT_FAILURE;
        }
        TestVectorSet set;
        try {
            set = TestVectorJson.read(inputPath);
        } catch (IOException e) {
            err.println("Error reading file: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (JsonParseException e) {
            err.println("Error parsing " + inputPath + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
        return renderAndWrite(dialect, config, options, set);
    }

    private int runExample(Options options) throws UsageException {
        VectorForgeConfig config = loadConfig(options);
        if (config == null) {
            return EXIT_FAILURE;
        }
        if (options.positional().size() > 1) {
            throw new UsageException("--example takes at most one DIALECT argument");
        }
        Dialect dialect = options.positional().isEmpty()
                ? config.defaultDialect()
                : parseDialect(options.positional().get(0));

        TestVectorSet set;
        try {
            RejectionSampler sampler = new RejectionSampler(config.sampler());
            set = sampler.generate(options.count(), ExamplePrograms.orderedSum(options.seed()));
        } catch (SamplingException e) {
            err.println("Sampling failed: " + e.getMessage());
            return EXIT_FAILURE;
        }
        return renderAndWrite(dialect, config, options, set);
    }

    private int renderAndWrite(Dialect dialect, VectorForgeConfig config, Options options, TestVectorSet set) {
        String name = options.name() != null ? options.name() : config.defaultName();
        String text;
        try {
            text = TestVectorRenderers.render(style(dialect, name, options, set), set);
        } catch (RenderException e) {
            err.println("Render failed: " + e.getMessage());
            return EXIT_FAILURE;
        }

        if (options.out() == null) {
            out.println(text);
            return EXIT_OK;
        }
        try {
            Files.writeString(options.out(), text + "\n", StandardCharsets.UTF_8);
            LOG.info("Wrote " + set.size() + " vectors to " + options.out());
            return EXIT_OK;
        } catch (IOException e) {
            err.println("Error writing " + options.out() + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static RenderStyle style(Dialect dialect, String name, Options options, TestVectorSet set)
            throws RenderException {
        return switch (dialect) {
            case FUNCTIONAL -> new RenderStyle.Functional(name);
            case STRUCT_ARRAY -> new RenderStyle.StructArray(name);
            case BIT_VECTOR -> new RenderStyle.BitVector(
                    name,
                    options.littleEndian() ? Endianness.LITTLE_ENDIAN : Endianness.BIG_ENDIAN,
                    new SplitSpec(
                            options.inputSplits() != null ? options.inputSplits() : naturalSplits(set, true),
                            options.outputSplits() != null ? options.outputSplits() : naturalSplits(set, false)));
        };
    }

    /**
     * One split per value of the first vector, each as wide as that value.
     */
    private static List<Integer> naturalSplits(TestVectorSet set, boolean inputs) throws RenderException {
        List<Integer> splits = new ArrayList<>();
        if (set.isEmpty()) {
            return splits;
        }
        TestVector first = set.get(0);
        for (ConcreteValue value : inputs ? first.inputs() : first.outputs()) {
            splits.add(BitBlaster.blast(value).length());
        }
        return splits;
    }

    private VectorForgeConfig loadConfig(Options options) {
        if (options.verbose()) {
            enableVerboseLogging();
        }
        try {
            return options.config() != null
                    ? VectorForgeConfigLoader.load(options.config())
                    : VectorForgeConfigLoader.load();
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return null;
        }
    }

    private static Dialect parseDialect(String name) throws UsageException {
        try {
            return Dialect.fromName(name);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage() + " (expected functional, c or forte)");
        }
    }

    private static void enableVerboseLogging() {
        Logger.getLogger("io.surfworks.vectorforge").setLevel(Level.FINE);
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            handler.setLevel(Level.FINE);
        }
    }
}
