package com.maxsort.organizer.engine;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * What the scorer knows about the file the suggestions were made for.
 */
@Data
@Builder
public class ScoringContext {
    // Current file name, with extension
    private String originalFilename;

    // Extension including the leading dot, e.g. ".pdf"; empty when the file has none
    private String extension;

    private long size;

    // Full path of the file
    private String path;

    // Path of the containing directory
    private String parentDirectory;

    public static ScoringContext forPath(String path, long size) {
        Path p = Path.of(path);
        String filename = p.getFileName() != null ? p.getFileName().toString() : path;
        int dot = filename.lastIndexOf('.');
        String extension = dot > 0 ? filename.substring(dot) : "";
        return ScoringContext.builder()
                .originalFilename(filename)
                .extension(extension)
                .size(size)
                .path(path)
                .parentDirectory(p.getParent() != null ? p.getParent().toString() : "")
                .build();
    }
}
