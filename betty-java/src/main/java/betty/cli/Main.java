package betty.cli;

import betty.config.FormatterConfig;
import betty.format.BettyFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final String VERSION = "betty-fmt 0.1.0";

    private boolean inPlace;
    private boolean check;
    private boolean diff;
    private boolean tokenStream;
    private Path output;
    private final List<Path> files = new ArrayList<>();

    private final PrintStream out;
    private final PrintStream err;

    private Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Runs the tool and returns the process exit code. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        return new Main(out, err).execute(args);
    }

    private int execute(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-h", "--help" -> {
                    usage(out);
                    return 0;
                }
                case "-v", "--version" -> {
                    out.println(VERSION);
                    out.println("A Betty-compliant C code formatter");
                    return 0;
                }
                case "-i", "--in-place" -> inPlace = true;
                case "-c", "--check" -> check = true;
                case "-d", "--diff" -> diff = true;
                case "--token-stream" -> tokenStream = true;
                case "-o", "--output" -> {
                    if (i + 1 >= args.length) {
                        err.println("Option " + arg + " requires a file name");
                        return 1;
                    }
                    output = Path.of(args[++i]);
                }
                default -> {
                    if (arg.startsWith("-") && arg.length() > 1) {
                        err.println("Unknown option: " + arg);
                        usage(err);
                        return 1;
                    }
                    files.add(Path.of(arg));
                }
            }
        }
        if (files.isEmpty()) {
            usage(err);
            return 1;
        }

        FormatterConfig config;
        try {
            config = FormatterConfig.load(Path.of(""));
        } catch (IOException e) {
            err.println("Error reading " + FormatterConfig.FILE_NAME + ": " + e.getMessage());
            return 1;
        }
        BettyFormat formatter = new BettyFormat(config);

        int status = 0;
        StringBuilder collected = new StringBuilder();
        for (Path file : files) {
            status |= process(formatter, file, collected);
        }

        if (output != null) {
            try {
                Files.writeString(output, collected.toString(), StandardCharsets.UTF_8);
            } catch (IOException | UncheckedIOException e) {
                LOG.debug("Write failed for {}", output, e);
                err.println("Error writing " + output);
                status = 1;
            }
        }
        return status;
    }

    private int process(BettyFormat formatter, Path file, StringBuilder collected) {
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException | UncheckedIOException e) {
            LOG.debug("Read failed for {}", file, e);
            err.println("Error reading " + file);
            return 1;
        }

        String formatted;
        if (tokenStream) {
            formatted = formatter.formatTokens(source);
        } else {
            BettyFormat.Result result = formatter.run(source);
            if (!result.fullyModeled()) {
                LOG.info("{}: {} lexical errors, {} regions kept verbatim",
                        file, result.lexErrors(), result.parseErrors());
            }
            formatted = result.text();
        }
        boolean changed = !source.equals(formatted);

        if (check) {
            if (changed) {
                out.println(file + " needs formatting");
                return 1;
            }
            return 0;
        }
        if (diff) {
            if (changed) out.print(UnifiedDiff.diff(file.toString(), source, formatted));
            return 0;
        }
        if (inPlace) {
            if (!changed) return 0;
            try {
                Files.writeString(file, formatted, StandardCharsets.UTF_8);
            } catch (IOException | UncheckedIOException e) {
                LOG.debug("Write failed for {}", file, e);
                err.println("Error writing " + file);
                return 1;
            }
            out.println("Formatted " + file);
            return 0;
        }
        if (output != null) {
            collected.append(formatted);
            return 0;
        }
        out.print(formatted);
        return 0;
    }

    private static void usage(PrintStream to) {
        to.println("Usage: betty-fmt [options] <files...>");
        to.println();
        to.println("Options:");
        to.println("  -i, --in-place      Modify files in place");
        to.println("  -o, --output FILE   Write to FILE instead of stdout");
        to.println("  -c, --check         Check if files are formatted (exit 1 if not)");
        to.println("  -d, --diff          Show diff of changes");
        to.println("      --token-stream  Re-space tokens only, without parsing");
        to.println("  -h, --help          Show this help message");
        to.println("  -v, --version       Show version");
        to.println();
        to.println("Examples:");
        to.println("  betty-fmt main.c          Print formatted to stdout");
        to.println("  betty-fmt -i *.c          Format all .c files in place");
        to.println("  betty-fmt -c src/*.c      Check if files need formatting");
    }
}
