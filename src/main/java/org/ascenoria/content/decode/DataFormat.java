package org.ascenoria.content.decode;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.MapperBuilder;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * The supported content file encodings, in order of preference.
 * <p>
 * Both mappers are configured identically and strictly: no scalar coercion, no
 * floats for integers and no unknown properties.
 */
public enum DataFormat {
    TOML(".toml", strict(TomlMapper.builder())),
    JSON(".json", strict(JsonMapper.builder()));

    private final String extension;
    private final ObjectMapper mapper;

    DataFormat(String extension, ObjectMapper mapper) {
        this.extension = extension;
        this.mapper = mapper;
    }

    private static ObjectMapper strict(MapperBuilder<?, ?> builder) {
        return builder
                .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .build();
    }

    public String extension() {
        return extension;
    }

    ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Lists every existing encoding of a file, preferred encoding first.
     *
     * @param directory The directory to look in.
     * @param baseName  The file name without extension.
     * @return Existing regular files, possibly empty.
     */
    public static List<Path> candidates(Path directory, String baseName) {
        final List<Path> found = new ArrayList<>();
        for (DataFormat format : values()) {
            final Path file = directory.resolve(baseName + format.extension);
            if (Files.isRegularFile(file)) {
                found.add(file);
            }
        }
        return found;
    }

    /**
     * @param file A content file.
     * @return The format matching the file's extension.
     * @throws IllegalArgumentException if the extension is not supported.
     */
    public static DataFormat of(Path file) {
        final String name = file.getFileName().toString();
        for (DataFormat format : values()) {
            if (name.endsWith(format.extension)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported content file: " + file);
    }

    public static boolean isContentFile(Path file) {
        final String name = file.getFileName().toString();
        for (DataFormat format : values()) {
            if (name.endsWith(format.extension)) {
                return true;
            }
        }
        return false;
    }
}
