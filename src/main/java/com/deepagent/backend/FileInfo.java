package com.deepagent.backend;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * An entry produced by {@code ls} or {@code glob}.
 *
 * @param path      backend path of the entry (virtual for host backends, container path for the sandbox)
 * @param directory whether the entry is a directory
 * @param sizeBytes file size in bytes (0 for directories)
 */
public record FileInfo(
    String path,
    @JsonProperty("is_dir") boolean directory,
    @JsonProperty("size") long sizeBytes
) {
    public FileInfo {
        Objects.requireNonNull(path, "path cannot be null");
    }
}
