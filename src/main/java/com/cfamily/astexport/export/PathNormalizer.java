package com.cfamily.astexport.export;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Maps a source file name to the form written into the document.
 */
@FunctionalInterface
public interface PathNormalizer {

    String normalize(String file);

    static PathNormalizer identity() {
        return file -> file;
    }

    /**
     * Files under {@code base} become relative to it, with {@code /} separators; other
     * files are left unchanged.
     */
    static PathNormalizer relativeTo(Path base) {
        Path root = base.toAbsolutePath().normalize();
        return file -> {
            Path path;
            try {
                path = Path.of(file);
            } catch (InvalidPathException e) {
                return file;
            }
            if (!path.isAbsolute()) {
                return file;
            }
            Path normalized = path.normalize();
            if (!normalized.startsWith(root)) {
                return file;
            }
            return root.relativize(normalized).toString().replace('\\', '/');
        };
    }
}
