package com.deepagent.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Backend that reads and writes files directly under a host directory.
 * It offers no command execution.
 *
 * <p>Paths handed to and returned by this backend are virtual: {@code /} is the root
 * directory, so {@code /src/App.java} lives at {@code <root>/src/App.java}.
 */
public class FilesystemBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(FilesystemBackend.class);

    /** Files larger than this are skipped by {@code grep}. */
    static final long MAX_GREP_FILE_BYTES = 10L * 1024 * 1024;

    protected final Path root;

    public FilesystemBackend(Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create backend root: " + this.root, e);
        }
    }

    public Path root() {
        return root;
    }

    @Override
    public String id() {
        return "fs:" + root;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.FILESYSTEM;
    }

    protected Path resolve(String path) {
        return BackendPaths.resolve(root, path);
    }

    protected String virtual(Path resolved) {
        return BackendPaths.toVirtual(root, resolved);
    }

    @Override
    public List<FileInfo> ls(String path) {
        Path dir;
        try {
            dir = resolve(path);
        } catch (PathOutsideRootException e) {
            log.warn("ls rejected: {}", e.getMessage());
            return List.of();
        }
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(dir)) {
            return children
                    .filter(p -> !p.equals(dir))
                    .sorted()
                    .map(this::toFileInfo)
                    .toList();
        } catch (IOException e) {
            log.debug("ls failed for {}: {}", dir, e.getMessage());
            return List.of();
        }
    }

    @Override
    public ReadResult read(String path, int offset, int limit) {
        Path file;
        try {
            file = resolve(path);
        } catch (PathOutsideRootException e) {
            return ReadResult.error(e.getMessage());
        }
        if (!Files.isRegularFile(file)) {
            return ReadResult.error("File not found: " + path);
        }
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return TextEdits.window(content, offset, limit);
        } catch (CharacterCodingException e) {
            return ReadResult.error("Cannot read binary file: " + path);
        } catch (IOException e) {
            return ReadResult.error("Error reading file " + path + ": " + e.getMessage());
        }
    }

    @Override
    public WriteResult write(String path, String content) {
        Path file;
        try {
            file = resolve(path);
        } catch (PathOutsideRootException e) {
            return WriteResult.error(e.getMessage());
        }
        if (Files.isDirectory(file)) {
            return WriteResult.error("Cannot write to " + path + ": it is a directory");
        }
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, content, StandardCharsets.UTF_8);
            log.debug("Wrote {} chars to {}", content.length(), file);
            return WriteResult.ok(virtual(file));
        } catch (IOException e) {
            return WriteResult.error("Write failed for " + path + ": " + e.getMessage());
        }
    }

    @Override
    public EditResult edit(String path, String oldString, String newString, boolean replaceAll) {
        Path file;
        try {
            file = resolve(path);
        } catch (PathOutsideRootException e) {
            return EditResult.error(e.getMessage(), null);
        }
        if (!Files.isRegularFile(file)) {
            return EditResult.error("File not found: " + path, null);
        }
        String current;
        try {
            current = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return EditResult.error("Error reading file " + path + ": " + e.getMessage(), virtual(file));
        }
        int count = TextEdits.countOccurrences(current, oldString);
        if (count == 0) {
            return EditResult.error("String not found in " + path, virtual(file));
        }
        String updated = TextEdits.replace(current, oldString, newString, replaceAll);
        try {
            Files.writeString(file, updated, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return EditResult.error("Write failed for " + path + ": " + e.getMessage(), virtual(file));
        }
        return EditResult.ok(virtual(file), replaceAll ? count : 1);
    }

    @Override
    public List<FileInfo> glob(String pattern, String path) {
        Path dir;
        try {
            dir = resolve(path);
        } catch (PathOutsideRootException e) {
            log.warn("glob rejected: {}", e.getMessage());
            return List.of();
        }
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        GlobFilter filter = GlobFilter.of(pattern);
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk
                    .filter(p -> !p.equals(dir))
                    .filter(p -> filter.matches(dir.relativize(p).toString().replace('\\', '/')))
                    .sorted()
                    .map(this::toFileInfo)
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            log.debug("glob failed under {}: {}", dir, e.getMessage());
            return List.of();
        }
    }

    @Override
    public List<GrepMatch> grep(String pattern, String path, String glob) {
        if (pattern == null || pattern.isEmpty()) {
            return List.of();
        }
        Path base;
        try {
            base = resolve(path);
        } catch (PathOutsideRootException e) {
            log.warn("grep rejected: {}", e.getMessage());
            return List.of();
        }
        if (!Files.exists(base)) {
            return List.of();
        }
        GlobFilter include = glob == null || glob.isBlank() ? null : GlobFilter.of(glob);
        List<Path> files;
        try (Stream<Path> walk = Files.walk(base)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(p -> include == null || include.matches(p.getFileName().toString()))
                    .sorted(Comparator.naturalOrder())
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            log.debug("grep walk failed under {}: {}", base, e.getMessage());
            return List.of();
        }

        var matches = new ArrayList<GrepMatch>();
        for (Path file : files) {
            try {
                if (Files.size(file) > MAX_GREP_FILE_BYTES) {
                    continue;
                }
                List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
                for (int i = 0; i < lines.size(); i++) {
                    if (lines.get(i).contains(pattern)) {
                        matches.add(new GrepMatch(virtual(file), i + 1, lines.get(i)));
                    }
                }
            } catch (IOException e) {
                // binary or unreadable files are not searchable
                log.trace("grep skipped {}: {}", file, e.getMessage());
            }
        }
        return matches;
    }

    @Override
    public List<FileTransferResult> upload(List<FileUpload> files) {
        var results = new ArrayList<FileTransferResult>();
        for (FileUpload upload : files) {
            try {
                Path file = resolve(upload.path());
                Path parent = file.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.write(file, upload.content());
                results.add(FileTransferResult.ok(upload.path(), null));
            } catch (PathOutsideRootException e) {
                results.add(FileTransferResult.failed(upload.path(), "invalid_path"));
            } catch (AccessDeniedException e) {
                results.add(FileTransferResult.failed(upload.path(), "permission_denied"));
            } catch (IOException e) {
                log.debug("upload failed for {}: {}", upload.path(), e.getMessage());
                results.add(FileTransferResult.failed(upload.path(), "invalid_path"));
            }
        }
        return results;
    }

    @Override
    public List<FileTransferResult> download(List<String> paths) {
        var results = new ArrayList<FileTransferResult>();
        for (String path : paths) {
            try {
                Path file = resolve(path);
                if (Files.isDirectory(file)) {
                    results.add(FileTransferResult.failed(path, "is_directory"));
                } else if (!Files.exists(file)) {
                    results.add(FileTransferResult.failed(path, "file_not_found"));
                } else {
                    results.add(FileTransferResult.ok(path, Files.readAllBytes(file)));
                }
            } catch (PathOutsideRootException e) {
                results.add(FileTransferResult.failed(path, "invalid_path"));
            } catch (AccessDeniedException e) {
                results.add(FileTransferResult.failed(path, "permission_denied"));
            } catch (IOException e) {
                log.debug("download failed for {}: {}", path, e.getMessage());
                results.add(FileTransferResult.failed(path, "file_not_found"));
            }
        }
        return results;
    }

    private FileInfo toFileInfo(Path p) {
        boolean dir = Files.isDirectory(p);
        long size = 0;
        if (!dir) {
            try {
                size = Files.size(p);
            } catch (IOException e) {
                log.trace("size unavailable for {}", p);
            }
        }
        return new FileInfo(virtual(p), dir, size);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{root=" + root + "}";
    }
}
