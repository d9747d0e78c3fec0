package dev.archivist;

import dev.archivist.run.RunProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point for the Archivist document indexing pipeline.
 *
 * <p>Without {@code archivist.run.schedule} the application performs one run and exits with a
 * code reflecting its status; with a schedule it keeps running and indexes on every trigger.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ArchivistApplication {
    public static void main(String[] args) {
        ConfigurableApplicationContext context =
                SpringApplication.run(ArchivistApplication.class, args);
        if (context.getBean(RunProperties.class).schedule() == null) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
