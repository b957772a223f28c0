package com.maxsort.organizer.service;

import com.maxsort.organizer.model.BatchOperation;
import com.maxsort.organizer.model.OperationType;
import com.maxsort.organizer.model.Severity;
import com.maxsort.organizer.model.ValidationIssue;
import com.maxsort.organizer.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pre-flight checks for scheduled file operations. Operates on the filesystem read-only:
 * existence, permissions, protected locations, portable naming, and conflicts between
 * operations of the same batch.
 */
@Component
public class OperationValidator {

    private static final Logger log = LoggerFactory.getLogger(OperationValidator.class);

    static final int MAX_PATH_LENGTH = 260;
    static final int MAX_FILENAME_LENGTH = 255;

    private static final List<Pattern> SYSTEM_FILE_PATTERNS = List.of(
            Pattern.compile("^/System/"),
            Pattern.compile("^/Library/System"),
            Pattern.compile("^/usr/bin"),
            Pattern.compile("^/usr/sbin"),
            Pattern.compile("^/bin"),
            Pattern.compile("^/sbin"),
            Pattern.compile("\\.app/Contents"),
            Pattern.compile("/node_modules/"),
            Pattern.compile("\\.git/"),
            Pattern.compile("\\.DS_Store$"),
            Pattern.compile("Thumbs\\.db$"),
            Pattern.compile("desktop\\.ini$")
    );

    private static final List<Pattern> DANGEROUS_DIRECTORIES = List.of(
            Pattern.compile("^/System"),
            Pattern.compile("^/Library/System"),
            Pattern.compile("^/usr"),
            Pattern.compile("^/bin"),
            Pattern.compile("^/sbin"),
            Pattern.compile("^/etc"),
            Pattern.compile("^/var/system"),
            Pattern.compile("^/Applications"),
            Pattern.compile("/\\.Trash"),
            Pattern.compile("/\\.Spotlight-V100"),
            Pattern.compile("/\\.DocumentRevisions-V100"),
            Pattern.compile("/\\.fseventsd")
    );

    private static final Set<String> RESERVED_NAMES = Set.of(
            "CON", "PRN", "AUX", "NUL",
            "COM1", "COM2", "COM3", "COM4", "COM5", "COM6", "COM7", "COM8", "COM9",
            "LPT1", "LPT2", "LPT3", "LPT4", "LPT5", "LPT6", "LPT7", "LPT8", "LPT9"
    );

    private static final Pattern INVALID_CHARACTERS = Pattern.compile("[<>:\"|?*\\x00-\\x1f]");

    /**
     * Validate each operation on its own, then the set as a whole.
     */
    public ValidationResult validateBatch(List<BatchOperation> operations) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (BatchOperation op : operations) {
            issues.addAll(validateOperation(op).issues());
        }
        checkConflicts(operations, issues);

        ValidationResult result = new ValidationResult(List.copyOf(issues));
        log.debug("Batch validation finished: operations={}, errors={}, warnings={}",
                operations.size(), result.errors().size(), result.warnings().size());
        return result;
    }

    public ValidationResult validateOperation(BatchOperation op) {
        List<ValidationIssue> issues = new ArrayList<>();
        String id = op.getId();

        if (op.getType() == null) {
            issues.add(error(id, "UNKNOWN_OPERATION_TYPE", "Operation type is missing"));
            return new ValidationResult(issues);
        }
        if (op.getOriginalPath() == null || op.getOriginalPath().isBlank()) {
            issues.add(error(id, "SOURCE_MISSING", "Source path is required"));
            return new ValidationResult(issues);
        }
        boolean hasTarget = op.getTargetPath() != null && !op.getTargetPath().isBlank();
        if (op.getType().requiresTarget() && !hasTarget) {
            issues.add(error(id, "TARGET_MISSING",
                    "Target path required for " + op.getType().name().toLowerCase(Locale.ROOT) + " operation"));
            return new ValidationResult(issues);
        }

        Path source;
        Path target = null;
        try {
            source = Paths.get(op.getOriginalPath());
            if (hasTarget) {
                target = Paths.get(op.getTargetPath());
            }
        } catch (InvalidPathException e) {
            issues.add(error(id, "INVALID_PATH", "Invalid path: " + e.getMessage()));
            return new ValidationResult(issues);
        }

        checkSource(id, source, issues);
        if (target != null) {
            checkTarget(id, source, target, issues);
        }

        checkProtectedLocation(id, op.getOriginalPath(), "source", issues);
        if (target != null) {
            checkProtectedLocation(id, op.getTargetPath(), "target", issues);
        }

        if (isHidden(source)) {
            issues.add(warning(id, "HIDDEN_FILE_SOURCE", "Operating on hidden file"));
        }
        if (target != null && op.getType() != OperationType.DELETE) {
            if (isHidden(target)) {
                issues.add(warning(id, "HIDDEN_FILE_TARGET", "Creating hidden file"));
            }
            checkTargetName(id, op.getTargetPath(), target, issues);
        }
        return new ValidationResult(issues);
    }

    private void checkSource(String id, Path source, List<ValidationIssue> issues) {
        if (!Files.exists(source)) {
            issues.add(error(id, "SOURCE_NOT_FOUND", "Source file does not exist: " + source));
            return;
        }
        if (!Files.isRegularFile(source)) {
            issues.add(error(id, "SOURCE_NOT_FILE", "Source path is not a file: " + source));
        }
        if (!Files.isReadable(source)) {
            issues.add(error(id, "SOURCE_NO_READ_PERMISSION", "No read permission for source file: " + source));
        }
        Path sourceDir = parentOf(source);
        if (!Files.isWritable(sourceDir)) {
            issues.add(error(id, "SOURCE_DIR_NO_WRITE_PERMISSION",
                    "No write permission for source directory: " + sourceDir));
        }
    }

    private void checkTarget(String id, Path source, Path target, List<ValidationIssue> issues) {
        Path targetDir = parentOf(target);
        if (!Files.exists(targetDir)) {
            issues.add(error(id, "TARGET_DIR_NOT_FOUND", "Target directory does not exist: " + targetDir));
        } else if (!Files.isDirectory(targetDir)) {
            issues.add(error(id, "TARGET_DIR_NOT_DIRECTORY", "Target directory is not a directory: " + targetDir));
        } else if (!Files.isWritable(targetDir)) {
            issues.add(error(id, "TARGET_DIR_NO_WRITE_PERMISSION",
                    "No write permission for target directory: " + targetDir));
        }

        if (Files.exists(target)) {
            issues.add(warning(id, "TARGET_EXISTS", "Target file already exists: " + target));
        }
        if (source.equals(target)) {
            issues.add(warning(id, "SAME_SOURCE_TARGET", "Source and target paths are identical"));
        }
    }

    private void checkProtectedLocation(String id, String path, String role, List<ValidationIssue> issues) {
        for (Pattern pattern : SYSTEM_FILE_PATTERNS) {
            if (pattern.matcher(path).find()) {
                issues.add(new ValidationIssue(id, Severity.CRITICAL, "SYSTEM_FILE_OPERATION",
                        "Operation on system file detected (" + role + ": " + path + ")"));
                return;
            }
        }
        String dir = parentString(path);
        for (Pattern pattern : DANGEROUS_DIRECTORIES) {
            if (pattern.matcher(dir).find()) {
                issues.add(warning(id, "DANGEROUS_DIRECTORY",
                        "Operation in potentially dangerous directory (" + role + ": " + dir + ")"));
                return;
            }
        }
    }

    private void checkTargetName(String id, String rawTarget, Path target, List<ValidationIssue> issues) {
        String name = target.getFileName() != null ? target.getFileName().toString() : rawTarget;
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;

        if (RESERVED_NAMES.contains(stem.toUpperCase(Locale.ROOT))) {
            issues.add(error(id, "RESERVED_FILENAME", "Target filename \"" + stem + "\" is a reserved system name"));
        }
        if (INVALID_CHARACTERS.matcher(name).find()) {
            issues.add(error(id, "INVALID_CHARACTERS", "Target filename contains invalid characters"));
        }
        if (name.startsWith(" ") || name.endsWith(" ") || name.endsWith(".")) {
            issues.add(warning(id, "PROBLEMATIC_CHARACTERS", "Target filename has leading/trailing spaces or dots"));
        }
        if (rawTarget.length() > MAX_PATH_LENGTH) {
            issues.add(error(id, "PATH_TOO_LONG", String.format(
                    "Target path exceeds maximum length (%d > %d)", rawTarget.length(), MAX_PATH_LENGTH)));
        }
        if (name.length() > MAX_FILENAME_LENGTH) {
            issues.add(error(id, "FILENAME_TOO_LONG", String.format(
                    "Target filename exceeds maximum length (%d > %d)", name.length(), MAX_FILENAME_LENGTH)));
        }
    }

    private void checkConflicts(List<BatchOperation> operations, List<ValidationIssue> issues) {
        Map<Path, List<BatchOperation>> byTarget = new LinkedHashMap<>();
        for (BatchOperation op : operations) {
            Path target = normalized(op.getTargetPath());
            if (target != null && op.getType() != OperationType.DELETE) {
                byTarget.computeIfAbsent(target, k -> new ArrayList<>()).add(op);
            }
        }

        byTarget.forEach((target, ops) -> {
            if (ops.size() > 1) {
                issues.add(error(ops.get(1).getId(), "TARGET_CONFLICT",
                        "Multiple operations target the same file: " + target));
            }
        });

        for (BatchOperation op : operations) {
            Path source = normalized(op.getOriginalPath());
            if (source != null && byTarget.containsKey(source)) {
                issues.add(warning(op.getId(), "SOURCE_TARGET_CHAIN",
                        "Operation source becomes target of another operation: " + source));
            }
        }
    }

    private static boolean isHidden(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().startsWith(".");
    }

    private static Path parentOf(Path path) {
        Path absolute = path.toAbsolutePath();
        Path parent = absolute.getParent();
        return parent != null ? parent : absolute;
    }

    private static String parentString(String path) {
        int slash = path.lastIndexOf('/');
        return slash > 0 ? path.substring(0, slash) : "/";
    }

    private static Path normalized(String path) {
        if (path == null || path.isBlank()) return null;
        try {
            return Paths.get(path).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            return null;
        }
    }

    private static ValidationIssue error(String id, String code, String message) {
        return new ValidationIssue(id, Severity.ERROR, code, message);
    }

    private static ValidationIssue warning(String id, String code, String message) {
        return new ValidationIssue(id, Severity.WARNING, code, message);
    }
}
