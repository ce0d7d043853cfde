/**
 * Main application class for the Series Sync Engine
 *
 * @author William Callahan
 *
 * Features:
 * - Hosts the discovery, canonicalization, chapter sync and notification workers
 * - Enables scheduling for the master sync tick and worker heartbeat
 * - Disables automatic schema.sql execution; the schema is applied out of band
 * - Entry point for Spring Boot application
 */

package com.williamcallahan.series_sync_engine;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(exclude = {
    // Disable SQL initialization to prevent automatic schema.sql execution
    SqlInitializationAutoConfiguration.class
})
@EnableScheduling
public class SeriesSyncEngineApplication {

    private static final Logger log = LoggerFactory.getLogger(SeriesSyncEngineApplication.class);

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        loadDotEnvFile();
        SpringApplication.run(SeriesSyncEngineApplication.class, args);
    }

    private static void loadDotEnvFile() {
        Path envFile = Paths.get(".env");
        if (!Files.exists(envFile)) {
            return;
        }
        try (InputStream is = Files.newInputStream(envFile)) {
            Properties props = new Properties();
            props.load(is);
            // Real environment variables win over .env entries
            for (String key : props.stringPropertyNames()) {
                if (System.getenv(key) == null) {
                    System.setProperty(key, props.getProperty(key));
                }
            }
        } catch (IOException | SecurityException e) {
            log.warn("Could not load .env file: {}", e.getMessage());
        }
    }
}
