package com.e2eq.docmap.config;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DocMapConfigTest {

    private static SmallRyeConfig configOf(Map<String, String> properties) {
        return new SmallRyeConfigBuilder()
                .withSources(new PropertiesConfigSource(properties, "test", 500))
                .build();
    }

    @Test
    void testDefaultsWhenNothingIsConfigured() {
        DocMapConfig config = DocMapConfig.fromConfig(configOf(Map.of()));
        assertFalse(config.isStrictValidation());
        assertEquals("mongodb://localhost:27017", config.getConnectionString());
        assertEquals("docmap", config.getDatabase());
        assertEquals(DocMapConfig.defaults().getDatabase(), config.getDatabase());
    }

    @Test
    void testConfiguredValues() {
        DocMapConfig config = DocMapConfig.fromConfig(configOf(Map.of(
                DocMapConfig.STRICT_VALIDATION, "true",
                DocMapConfig.CONNECTION_STRING, "mongodb://db:27017",
                DocMapConfig.DATABASE, "movies")));
        assertTrue(config.isStrictValidation());
        assertEquals("mongodb://db:27017", config.getConnectionString());
        assertEquals("movies", config.getDatabase());
    }

    @Test
    void testLoadReadsTheApplicationConfig() {
        assertNotNull(DocMapConfig.load().getDatabase());
    }
}
