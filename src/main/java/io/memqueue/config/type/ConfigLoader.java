package io.memqueue.config.type;

import io.memqueue.config.impl.AckLoopConfig;

import java.io.IOException;
import java.io.InputStream;

public final class ConfigLoader {

    /** Classpath resource holding the bundled defaults. */
    public static final String DEFAULT_RESOURCE = "memqueue-ack.yaml";

    private ConfigLoader() {
    }

    /**
     * Loads ack loop configuration from a YAML file by delegating to {@link AckLoopConfig#load(String)}.
     *
     * @param path the path to the YAML configuration file
     * @return a populated {@link AckLoopConfig} instance
     * @throws IOException if the file cannot be read
     */
    public static AckLoopConfig load(final String path) throws IOException {
        return AckLoopConfig.load(path);
    }

    /**
     * Loads ack loop configuration from a classpath resource.
     *
     * @throws IOException if the resource does not exist or cannot be read
     */
    public static AckLoopConfig loadResource(final String resource) throws IOException {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("config resource not found: " + resource);
            }
            return AckLoopConfig.load(in);
        }
    }

    /**
     * Loads the bundled {@value #DEFAULT_RESOURCE}.
     */
    public static AckLoopConfig loadDefault() throws IOException {
        return loadResource(DEFAULT_RESOURCE);
    }
}
