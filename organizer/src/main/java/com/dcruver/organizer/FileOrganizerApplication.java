package com.dcruver.organizer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the File Organizer.
 *
 * Organizes a messy directory tree in three reviewable steps: scan into a
 * classified manifest, plan the moves, then execute them with a rollback
 * that can undo every completed move. Project folders are never split up
 * and no file is ever deleted or overwritten.
 */
@SpringBootApplication
@Slf4j
public class FileOrganizerApplication {

    public static void main(String[] args) {
        log.info("Starting File Organizer...");
        SpringApplication.run(FileOrganizerApplication.class, args);
    }
}
