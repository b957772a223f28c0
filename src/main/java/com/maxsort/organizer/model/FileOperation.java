package com.maxsort.organizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FileOperation {
    // Assigned when the operation joins a transaction
    private String id;

    private OperationType type;
    private String source;

    // Required for everything but DELETE
    private String target;

    // Allow overwriting an existing target
    private boolean force;

    // Null means "default for the type": deletes back up, others do not
    private Boolean createBackup;

    // Set once a backup copy exists
    private String backupPath;

    private boolean completed;
    private String error;

    public static FileOperation rename(String source, String target) {
        return FileOperation.builder().type(OperationType.RENAME).source(source).target(target).build();
    }

    public static FileOperation move(String source, String target) {
        return FileOperation.builder().type(OperationType.MOVE).source(source).target(target).build();
    }

    public static FileOperation copy(String source, String target) {
        return FileOperation.builder().type(OperationType.COPY).source(source).target(target).build();
    }

    public static FileOperation delete(String source) {
        return FileOperation.builder().type(OperationType.DELETE).source(source).build();
    }
}
