package com.e2eq.docmap.config;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

/**
 * Settings read from MicroProfile Config:
 * <ul>
 *   <li>{@code docmap.validation.strict}: {@code save} throws instead of collecting violations (default false)</li>
 *   <li>{@code docmap.mongo.connection-string}: default {@code mongodb://localhost:27017}</li>
 *   <li>{@code docmap.mongo.database}: default {@code docmap}</li>
 * </ul>
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class DocMapConfig {

    public static final String STRICT_VALIDATION = "docmap.validation.strict";
    public static final String CONNECTION_STRING = "docmap.mongo.connection-string";
    public static final String DATABASE = "docmap.mongo.database";

    static final String DEFAULT_CONNECTION_STRING = "mongodb://localhost:27017";
    static final String DEFAULT_DATABASE = "docmap";

    private final boolean strictValidation;
    @Builder.Default
    private final String connectionString = DEFAULT_CONNECTION_STRING;
    @Builder.Default
    private final String database = DEFAULT_DATABASE;

    public static DocMapConfig defaults() {
        return DocMapConfig.builder().build();
    }

    /**
     * Reads the settings from the application's config sources.
     */
    public static DocMapConfig load() {
        return fromConfig(ConfigProvider.getConfig());
    }

    public static DocMapConfig fromConfig(Config config) {
        return DocMapConfig.builder()
                .strictValidation(config.getOptionalValue(STRICT_VALIDATION, Boolean.class).orElse(false))
                .connectionString(config.getOptionalValue(CONNECTION_STRING, String.class).orElse(DEFAULT_CONNECTION_STRING))
                .database(config.getOptionalValue(DATABASE, String.class).orElse(DEFAULT_DATABASE))
                .build();
    }
}
