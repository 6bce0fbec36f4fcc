package com.relationship.scoring.judgment;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads the judgment instructions from the classpath.
 */
public final class SystemPrompt {

    public static final String DEFAULT_RESOURCE = "prompts/relationship-judge.txt";

    private SystemPrompt() {
        // Utility class
    }

    public static String load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * @throws IllegalStateException if the resource is missing
     * @throws UncheckedIOException  if the resource cannot be read
     */
    public static String load(String resource) {
        ClassLoader loader = SystemPrompt.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("System prompt resource not found: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read system prompt " + resource, e);
        }
    }
}
