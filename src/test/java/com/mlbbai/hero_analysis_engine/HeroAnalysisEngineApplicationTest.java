package com.mlbbai.hero_analysis_engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class HeroAnalysisEngineApplicationTest {

    private static final String KEY = "HERO_ENGINE_DOTENV_TEST_KEY";

    @AfterEach
    void clearProperty() {
        System.clearProperty(KEY);
    }

    @Test
    void dotEnvEntriesBecomeSystemProperties(@TempDir Path dir) throws Exception {
        Path envFile = dir.resolve(".env");
        Files.writeString(envFile, "# local overrides\n" + KEY + "=from-dotenv\n");

        HeroAnalysisEngineApplication.loadDotEnvFile(envFile);

        assertThat(System.getProperty(KEY)).isEqualTo("from-dotenv");
    }

    @Test
    void existingSystemPropertyWins(@TempDir Path dir) throws Exception {
        System.setProperty(KEY, "explicit");
        Path envFile = dir.resolve(".env");
        Files.writeString(envFile, KEY + "=from-dotenv\n");

        HeroAnalysisEngineApplication.loadDotEnvFile(envFile);

        assertThat(System.getProperty(KEY)).isEqualTo("explicit");
    }

    @Test
    void missingFileIsIgnored(@TempDir Path dir) {
        HeroAnalysisEngineApplication.loadDotEnvFile(dir.resolve("absent.env"));

        assertThat(System.getProperty(KEY)).isNull();
    }
}
