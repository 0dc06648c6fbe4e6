/**
 * Main application class for the hero analysis engine
 *
 * @author William Callahan
 *
 * Features:
 * - Loads a local .env file before Spring reads its environment
 * - Enables scheduling for hourly refreshes and rate-limit sweeps
 * - Entry point for Spring Boot application
 */

package com.mlbbai.hero_analysis_engine;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class HeroAnalysisEngineApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        // Load .env file first
        loadDotEnvFile(Paths.get(".env"));
        SpringApplication.run(HeroAnalysisEngineApplication.class, args);
    }

    /**
     * Copies entries of a .env file into system properties unless the
     * environment already defines them.
     */
    static void loadDotEnvFile(Path envFile) {
        if (!Files.exists(envFile)) {
            return;
        }
        try {
            Properties props = new Properties();
            try (InputStream is = Files.newInputStream(envFile)) {
                props.load(is);
            }
            for (String key : props.stringPropertyNames()) {
                if (System.getenv(key) == null && System.getProperty(key) == null) {
                    System.setProperty(key, props.getProperty(key));
                }
            }
        } catch (IOException | SecurityException e) {
            // Logging is not initialized yet
            System.err.println("[ENV] Failed to load " + envFile + ": " + e.getMessage());
        }
    }
}
