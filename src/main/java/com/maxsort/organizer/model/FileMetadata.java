package com.maxsort.organizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileMetadata {
    private long fileId;
    private String originalPath;
    private String targetPath;
    private String fileType;
    private long size;
    @Builder.Default
    private OperationType operationType = OperationType.RENAME;
}
