package com.maxsort.organizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FileOrganizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FileOrganizerApplication.class, args);
    }
}
