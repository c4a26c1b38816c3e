package betty.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Formatter settings, read from a properties file. Missing keys fall back to defaults.
 */
public final class FormatterConfig {

    public static final String FILE_NAME = "betty-fmt.properties";

    public static final String EXTRA_TYPEDEFS = "parser.extra_typedefs";
    public static final String CONVERT_LINE_COMMENTS = "format.convert_line_comments";

    private final List<String> extraTypedefs;
    private final boolean convertLineComments;

    public FormatterConfig(Properties props) {
        this.extraTypedefs = splitNames(props.getProperty(EXTRA_TYPEDEFS, ""));
        this.convertLineComments = Boolean.parseBoolean(props.getProperty(CONVERT_LINE_COMMENTS, "true").trim());
    }

    public static FormatterConfig defaults() {
        return new FormatterConfig(new Properties());
    }

    /** Loads {@link #FILE_NAME} from {@code dir} if present, otherwise the bundled default. */
    public static FormatterConfig load(Path dir) throws IOException {
        Properties props = new Properties();
        Path local = dir.resolve(FILE_NAME);
        if (Files.isRegularFile(local)) {
            try (Reader r = Files.newBufferedReader(local, StandardCharsets.UTF_8)) {
                props.load(r);
            }
        } else {
            try (InputStream in = FormatterConfig.class.getResourceAsStream("/" + FILE_NAME)) {
                if (in != null) props.load(in);
            }
        }
        return new FormatterConfig(props);
    }

    /** Names to register as typedefs on top of the standard library ones. */
    public List<String> extraTypedefs() {
        return extraTypedefs;
    }

    /** Whether {@code //} comments are rewritten as block comments. */
    public boolean convertLineComments() {
        return convertLineComments;
    }

    private static List<String> splitNames(String value) {
        List<String> out = new ArrayList<>();
        for (String part : value.split(",")) {
            String name = part.trim();
            if (!name.isEmpty()) out.add(name);
        }
        return List.copyOf(out);
    }
}
