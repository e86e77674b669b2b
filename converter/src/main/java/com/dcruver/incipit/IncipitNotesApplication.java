package com.dcruver.incipit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Incipit Notes converter.
 *
 * Rewrites a document's endnotes into a single consolidated "Notes" section.
 * Each note is labelled with the opening words of the sentence that referenced
 * it and its citation is reduced to Chicago-style full, short or "Ibid." form.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class IncipitNotesApplication {

    public static void main(String[] args) {
        log.info("Starting Incipit Notes converter...");
        SpringApplication.run(IncipitNotesApplication.class, args);
    }
}
