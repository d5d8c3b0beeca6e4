package com.kaspaaio.core.store;

import java.util.List;

/**
 * @param restoredFiles      files written back from the backup
 * @param removedFiles       files deleted because they did not exist when the backup was taken
 * @param preRestoreBackupId backup of the state before the restore, or {@code null} if none was taken
 * @param requiresRestart    whether running services must be re-applied to match the restored files
 */
public record RestoreResult(
    String backupId,
    List<String> restoredFiles,
    List<String> removedFiles,
    String preRestoreBackupId,
    boolean requiresRestart
) {}
