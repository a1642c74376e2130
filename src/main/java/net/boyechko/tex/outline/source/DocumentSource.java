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
package net.boyechko.tex.outline.source;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/** Supplies the text and parsed tree of a file. Implementations own any caching. */
public interface DocumentSource {

    /** Returns the current entry for {@code file}, or empty if none has been produced. */
    Optional<SourceEntry> get(Path file);

    /** True while an entry for {@code file} is being produced. */
    boolean hasPending(Path file);

    /** Completes once pending work for {@code file} is done; already complete if there is none. */
    CompletableFuture<Void> pending(Path file);

    /** Re-reads and re-parses {@code file}, completing when the new entry is available. */
    CompletableFuture<Void> forceRefresh(Path file);

    /**
     * Hints that {@code file} is about to be needed. Sources driven from outside (for example by a
     * file watcher) may ignore it.
     */
    default void request(Path file) {}
}
