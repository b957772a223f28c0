package com.maxsort.organizer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "organizer.executor")
public class TransactionConfig {

    // Relative paths resolve against the source file's directory
    private String backupDirectory = ".maxsort-backups";

    // Back up renames and moves too when the operation does not say otherwise
    private boolean backupBeforeRename = false;

    // Finished transactions older than this are dropped from memory
    private int finishedRetentionMinutes = 60;
}
