package com.kaspaaio.core.store;

/**
 * @param file         name inside the backup directory
 * @param size         bytes captured
 * @param originalPath path relative to the installation root
 */
public record SnapshotFile(String file, long size, String originalPath) {}
