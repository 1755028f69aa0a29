package com.fractionax.propertyEngine.support;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads JSON fixtures from the test classpath (src/test/resources/fixtures).
 */
public final class JsonFixtures {

    private JsonFixtures() {}

    /**
     * Loads a fixture as a String.
     *
     * @param name Path below "fixtures/", e.g. "corelogic/avm.json"
     */
    public static String load(String name) {
        String resourcePath = "fixtures/" + name;
        try (InputStream inputStream = JsonFixtures.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resourcePath, e);
        }
    }
}
