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
package net.boyechko.tex.outline.document;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Flat element forests keyed by absolute file path, private to one construction run.
 *
 * <p>A file is registered as soon as its extraction begins, so an inclusion cycle that leads back
 * to a file still being extracted sees it as present and does not recurse again. A file whose
 * source was unavailable is stored with an empty forest.
 */
public final class FileStructureCache {
    private final Map<Path, List<OutlineElement>> forests = new LinkedHashMap<>();
    private final Set<Path> visited = new HashSet<>();

    /** True if extraction of {@code file} was started in this run, whatever its outcome. */
    public boolean contains(Path file) {
        return visited.contains(normalize(file));
    }

    public void begin(Path file) {
        visited.add(normalize(file));
    }

    public void put(Path file, List<OutlineElement> forest) {
        Path key = normalize(file);
        visited.add(key);
        forests.put(key, forest);
    }

    /** Returns the forest of a completely extracted file. */
    public Optional<List<OutlineElement>> get(Path file) {
        return Optional.ofNullable(forests.get(normalize(file)));
    }

    /**
     * Looks up the file a sub-file label refers to. Labels that are not valid paths, or name a
     * file that was never extracted, resolve to nothing.
     */
    public Optional<Path> resolveLabel(String label) {
        try {
            Path key = normalize(Path.of(label));
            return forests.containsKey(key) ? Optional.of(key) : Optional.empty();
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }

    /** Files with an extracted forest, in extraction completion order. */
    public Set<Path> files() {
        return forests.keySet();
    }

    public int size() {
        return forests.size();
    }

    private static Path normalize(Path file) {
        return file.toAbsolutePath().normalize();
    }
}
