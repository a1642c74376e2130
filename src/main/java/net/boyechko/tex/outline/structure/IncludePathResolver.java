/*
 * TeX-Outline - Document outline construction for LaTeX sources
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.tex.outline.structure;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Resolves the path argument of an inclusion directive against a list of directories. */
public final class IncludePathResolver {
    private static final String DEFAULT_SUFFIX = ".tex";

    private IncludePathResolver() {}

    /**
     * Returns the first existing file among {@code dir/input} for each directory in order. An
     * absolute {@code input} is tried as is first. A name without extension gets {@code .tex}
     * appended; a name that does not exist as given is retried with {@code .tex}.
     */
    public static Optional<Path> resolve(List<Path> dirs, String input) {
        if (input == null || input.isBlank()) {
            return Optional.empty();
        }
        Path inputPath;
        try {
            inputPath = Path.of(input.trim());
        } catch (InvalidPathException e) {
            return Optional.empty();
        }

        List<Path> candidates = new ArrayList<>();
        if (inputPath.isAbsolute()) {
            candidates.add(inputPath);
        }
        for (Path dir : dirs) {
            if (dir != null) {
                candidates.add(dir.resolve(inputPath));
            }
        }

        for (Path candidate : candidates) {
            Path file = withDefaultSuffix(candidate.toAbsolutePath().normalize());
            if (Files.isRegularFile(file)) {
                return Optional.of(file);
            }
        }
        return Optional.empty();
    }

    /** Directories for {@code \input}-like directives: current file, root file, search dirs. */
    public static List<Path> inputDirs(Path currentFile, Path rootFile, List<Path> searchDirs) {
        List<Path> dirs = new ArrayList<>();
        dirs.add(parentOf(currentFile));
        if (rootFile != null) {
            dirs.add(parentOf(rootFile));
        }
        dirs.addAll(searchDirs);
        return dirs.stream().filter(Objects::nonNull).toList();
    }

    static Path parentOf(Path file) {
        return file.toAbsolutePath().getParent();
    }

    private static Path withDefaultSuffix(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return file;
        }
        String name = fileName.toString();
        if (name.lastIndexOf('.') <= 0) {
            return file.resolveSibling(name + DEFAULT_SUFFIX);
        }
        if (!Files.exists(file)) {
            Path suffixed = file.resolveSibling(name + DEFAULT_SUFFIX);
            if (Files.exists(suffixed)) {
                return suffixed;
            }
        }
        return file;
    }
}
