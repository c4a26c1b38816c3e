package betty.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class FormatterConfigTest {

    @Test
    void defaults_when_keys_are_missing() {
        var config = FormatterConfig.defaults();
        assertTrue(config.extraTypedefs().isEmpty());
        assertTrue(config.convertLineComments());
    }

    @Test
    void typedef_list_is_trimmed_and_split() {
        var props = new Properties();
        props.setProperty(FormatterConfig.EXTRA_TYPEDEFS, " foo_t , bar_t,, ");
        assertEquals(List.of("foo_t", "bar_t"), new FormatterConfig(props).extraTypedefs());
    }

    @Test
    void load_prefers_file_in_directory(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve(FormatterConfig.FILE_NAME),
                "format.convert_line_comments = false\nparser.extra_typedefs = node_t\n");
        var config = FormatterConfig.load(dir);
        assertFalse(config.convertLineComments());
        assertEquals(List.of("node_t"), config.extraTypedefs());
    }

    @Test
    void load_falls_back_to_bundled_defaults(@TempDir Path dir) throws IOException {
        var config = FormatterConfig.load(dir);
        assertTrue(config.convertLineComments());
        assertTrue(config.extraTypedefs().isEmpty());
    }
}
