package com.jsunparser.tool;

import com.jsunparser.ast.Program;
import com.jsunparser.json.AstJsonDeserializer;
import com.jsunparser.json.AstJsonException;
import com.jsunparser.json.AstJsonProvider;
import com.jsunparser.render.RenderException;
import com.jsunparser.render.RenderOptions;
import com.jsunparser.render.Unparser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders JSON syntax trees back to source text.
 *
 * Usage:
 *   java -cp ... com.jsunparser.tool.Unparse [options] <tree.json...>
 *
 * Options:
 *   --indent=N        Spaces per nesting level (default: 2)
 *   --compact         Single-line output without optional whitespace
 *   --output=PATH     Write to PATH instead of stdout
 *
 * Exit codes: 0 on success, 1 when a file cannot be read or rendered, 2 on bad usage.
 */
public class Unparse {

    private static final Logger log = LoggerFactory.getLogger(Unparse.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final PrintStream out;
    private final PrintStream err;

    public Unparse(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new Unparse(System.out, System.err).run(args));
    }

    public int run(String... args) {
        Config config = Config.parse(args, err);
        if (config == null) {
            printUsage();
            return EXIT_USAGE;
        }
        if (config.help) {
            printUsage();
            return EXIT_OK;
        }

        Unparser unparser = config.compact
            ? Unparser.compact()
            : Unparser.standard().withOptions(RenderOptions.defaults().withIndentStep(config.indent));
        AstJsonDeserializer deserializer = AstJsonProvider.getProvider().getDeserializer();

        List<String> rendered = new ArrayList<>();
        for (Path file : config.files) {
            String json;
            try {
                json = Files.readString(file);
            } catch (IOException e) {
                err.println("Error: cannot read " + file + ": " + e.getMessage());
                return EXIT_FAILURE;
            }
            try {
                Program program = deserializer.deserializeProgram(json);
                String text = unparser.renderProgram(program);
                log.info("Rendered {} ({} statements, {} characters)", file, program.children().size(), text.length());
                rendered.add(text);
            } catch (AstJsonException e) {
                err.println("Error: " + file + " is not a valid tree: " + e.getMessage());
                return EXIT_FAILURE;
            } catch (RenderException e) {
                err.println("Error: cannot render " + file + ": " + e.getMessage());
                return EXIT_FAILURE;
            }
        }

        String output = String.join("\n\n", rendered) + "\n";
        if (config.output == null) {
            out.print(output);
            out.flush();
            return EXIT_OK;
        }
        try {
            Files.writeString(config.output, output);
        } catch (IOException e) {
            err.println("Error: cannot write " + config.output + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    private void printUsage() {
        err.println("Usage: Unparse [options] <tree.json...>");
        err.println();
        err.println("Options:");
        err.println("  --indent=N        Spaces per nesting level (default: 2)");
        err.println("  --compact         Single-line output without optional whitespace");
        err.println("  --output=PATH     Write to PATH instead of stdout");
        err.println("  --help, -h        Show this message");
    }

    static class Config {
        int indent = RenderOptions.DEFAULT_INDENT_STEP;
        boolean compact = false;
        boolean help = false;
        Path output;
        List<Path> files = new ArrayList<>();

        /**
         * Returns null after reporting the problem when the arguments are unusable.
         */
        static Config parse(String[] args, PrintStream err) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    config.help = true;
                    return config;
                } else if (arg.startsWith("--indent=")) {
                    try {
                        config.indent = Integer.parseInt(arg.substring(9));
                    } catch (NumberFormatException e) {
                        err.println("Invalid indent: " + arg.substring(9));
                        return null;
                    }
                    if (config.indent < 0) {
                        err.println("Invalid indent: " + config.indent);
                        return null;
                    }
                } else if (arg.equals("--compact")) {
                    config.compact = true;
                } else if (arg.startsWith("--output=")) {
                    config.output = Path.of(arg.substring(9));
                } else if (!arg.startsWith("-")) {
                    config.files.add(Path.of(arg));
                } else {
                    err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (config.files.isEmpty()) {
                err.println("Error: No tree files specified");
                return null;
            }

            return config;
        }
    }
}
