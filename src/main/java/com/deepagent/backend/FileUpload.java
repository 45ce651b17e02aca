package com.deepagent.backend;

/**
 * A file to place into a backend via {@code upload}.
 */
public record FileUpload(String path, byte[] content) {}
