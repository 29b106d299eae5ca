package io.cifxform.core.dictionary;

import io.cifxform.core.error.DictionaryNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Where dictionary text comes from. Reading happens on first use, so a parser can be built before
 * the file exists and fail only when queried.
 */
public abstract class DictionarySource {

    /** Identifier for log and error messages (a path or resource name). */
    public abstract String name();

    /**
     * Reads the full dictionary text.
     *
     * @throws DictionaryNotFoundException if the file or resource does not exist or cannot be read
     */
    public abstract String read();

    /** A dictionary file on disk, read as UTF-8. */
    public static DictionarySource fromPath(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        return new DictionarySource() {
            @Override
            public String name() {
                return path.toString();
            }

            @Override
            public String read() {
                try {
                    return Files.readString(path, StandardCharsets.UTF_8);
                } catch (NoSuchFileException e) {
                    throw new DictionaryNotFoundException("Dictionary file not found: " + path, e, name());
                } catch (IOException e) {
                    throw new DictionaryNotFoundException(
                            "Cannot read dictionary file " + path + ": " + e.getMessage(), e, name());
                }
            }
        };
    }

    /** A dictionary bundled on the classpath, resolved through {@code loader}. */
    public static DictionarySource fromClasspath(String resource, ClassLoader loader) {
        Objects.requireNonNull(resource, "resource must not be null");
        Objects.requireNonNull(loader, "loader must not be null");
        return new DictionarySource() {
            @Override
            public String name() {
                return "classpath:" + resource;
            }

            @Override
            public String read() {
                try (InputStream in = loader.getResourceAsStream(resource)) {
                    if (in == null) {
                        throw new DictionaryNotFoundException("Dictionary resource not found: " + resource, name());
                    }
                    return new String(in.readAllBytes(), StandardCharsets.UTF_8);
                } catch (IOException e) {
                    throw new DictionaryNotFoundException(
                            "Cannot read dictionary resource " + resource + ": " + e.getMessage(), e, name());
                }
            }
        };
    }

    /** Dictionary text already in memory. */
    public static DictionarySource ofText(String name, String text) {
        Objects.requireNonNull(text, "text must not be null");
        String label = name != null ? name : "<inline>";
        return new DictionarySource() {
            @Override
            public String name() {
                return label;
            }

            @Override
            public String read() {
                return text;
            }
        };
    }
}
