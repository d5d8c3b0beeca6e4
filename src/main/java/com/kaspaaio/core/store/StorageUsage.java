package com.kaspaaio.core.store;

public record StorageUsage(long totalBytes, long fileCount, int backupCount) {}
