package org.normharvest.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;

/**
 * Where records are written.
 *
 * @param saveDir       root of the document tree
 * @param errorDir      root of the error tree, {@code saveDir/errors} when unset
 * @param maxPathLength longest absolute path a record file may have
 */
public record StorageConfig(
        @Nullable String saveDir,
        @Nullable String errorDir,
        int maxPathLength) {

    public static final int DEFAULT_MAX_PATH_LENGTH = 245;

    @JsonCreator
    public StorageConfig {
        if (maxPathLength <= 0) maxPathLength = DEFAULT_MAX_PATH_LENGTH;
    }

    public StorageConfig() {
        this(null, null, 0);
    }

    public @Nullable Path savePath() {
        return saveDir == null || saveDir.isBlank() ? null : Path.of(saveDir);
    }

    public @Nullable Path errorPath() {
        if (errorDir != null && !errorDir.isBlank()) return Path.of(errorDir);
        Path save = savePath();
        return save == null ? null : save.resolve("errors");
    }
}
