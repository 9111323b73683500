package org.pragmatica.fsfmt.format;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormatterConfigTest {

    @Test
    void defaultConfig_usesDocumentedDefaults() {
        var config = FormatterConfig.defaultConfig();

        assertThat(config.indentSize()).isEqualTo(4);
        assertThat(config.maxLineLength()).isEqualTo(120);
        assertThat(config.maxArrayOrListWidth()).isEqualTo(40);
        assertThat(config.spaceBeforeColon()).isFalse();
        assertThat(config.spaceAroundDelimiter()).isTrue();
        assertThat(config.insertFinalNewline()).isTrue();
    }

    @Test
    void withers_changeSingleSetting() {
        var config = FormatterConfig.defaultConfig()
                                    .withIndentSize(2)
                                    .withSpaceBeforeColon(true);

        assertThat(config.indentSize()).isEqualTo(2);
        assertThat(config.spaceBeforeColon()).isTrue();
        assertThat(config.maxLineLength()).isEqualTo(120);
    }

    @Test
    void constructor_rejectsNonPositiveIndent() {
        assertThatThrownBy(() -> FormatterConfig.defaultConfig()
                                                .withIndentSize(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromProperties_readsKebabCaseKeys() {
        var properties = new Properties();
        properties.setProperty("indent-size", "2");
        properties.setProperty("max-line-length", " 100 ");
        properties.setProperty("insert-final-newline", "false");

        var config = FormatterConfig.fromProperties(properties);

        assertThat(config.indentSize()).isEqualTo(2);
        assertThat(config.maxLineLength()).isEqualTo(100);
        assertThat(config.insertFinalNewline()).isFalse();
        assertThat(config.maxRecordWidth()).isEqualTo(FormatterConfig.defaultConfig()
                                                                     .maxRecordWidth());
    }

    @Test
    void load_readsPropertiesFile(@TempDir Path directory) throws IOException {
        var file = directory.resolve("fsfmt.properties");
        Files.writeString(file, "max-array-or-list-width=20\nspace-before-colon=true\n");

        var config = FormatterConfig.load(file)
                                    .unwrap();

        assertThat(config.maxArrayOrListWidth()).isEqualTo(20);
        assertThat(config.spaceBeforeColon()).isTrue();
    }

    @Test
    void load_fails_onInvalidValue(@TempDir Path directory) throws IOException {
        var file = directory.resolve("fsfmt.properties");
        Files.writeString(file, "indent-size=wide\n");

        var result = FormatterConfig.load(file);

        assertThat(result.isFailure()).isTrue();
        result.onFailure(error -> assertThat(error.message()).contains("indent-size must be an integer"));
    }

    @Test
    void load_fails_onMissingFile(@TempDir Path directory) {
        var result = FormatterConfig.load(directory.resolve("absent.properties"));

        assertThat(result.isFailure()).isTrue();
        result.onFailure(error -> assertThat(error).isInstanceOf(FormattingError.InputParseError.class));
    }
}
