package me.golemcore.coder.tools;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Path resolution shared by the file tools. Paths are resolved against the
 * working directory and must stay inside it, symlinks included.
 */
@Slf4j
final class WorkspaceFileSupport {

    static final long MAX_FILE_SIZE = 10L * 1024 * 1024;

    private WorkspaceFileSupport() {
    }

    /**
     * Returns the resolved path, or {@code null} when it escapes the working
     * directory or is not a valid path.
     */
    static Path resolveSafePath(Path workingDirectory, String pathStr) {
        try {
            Path root = workingDirectory.toAbsolutePath().normalize();
            Path resolved = root.resolve(pathStr).normalize();
            if (!resolved.startsWith(root)) {
                return null;
            }
            if (Files.exists(resolved)) {
                Path realPath = resolved.toRealPath();
                if (!realPath.startsWith(root.toRealPath())) {
                    log.warn("[Files] Symlink escape blocked: {} -> {}", resolved, realPath);
                    return null;
                }
            }
            return resolved;
        } catch (InvalidPathException e) {
            return null;
        } catch (IOException e) {
            log.warn("[Files] Failed to resolve real path: {}", pathStr);
            return null;
        }
    }

    static String relativePath(Path workingDirectory, Path path) {
        Path root = workingDirectory.toAbsolutePath().normalize();
        String relative = root.relativize(path).toString().replace('\\', '/');
        return relative.isEmpty() ? "." : relative;
    }

    static String formatSize(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        if (bytes < 1024 * 1024) {
            return String.format(java.util.Locale.ROOT, "%.1f KB", bytes / 1024.0);
        }
        return String.format(java.util.Locale.ROOT, "%.1f MB", bytes / (1024.0 * 1024));
    }
}
