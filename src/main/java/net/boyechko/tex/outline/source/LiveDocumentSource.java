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
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import net.boyechko.tex.outline.ast.ParsedDocument;
import net.boyechko.tex.outline.parse.LatexParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Overlays unsaved editor buffers on another source. A path marked dirty is answered from the
 * supplied text instead of the delegate until it is marked clean again.
 */
public class LiveDocumentSource implements DocumentSource {
    private static final Logger logger = LoggerFactory.getLogger(LiveDocumentSource.class);

    private final DocumentSource delegate;
    private final LatexParser parser;
    private final Map<Path, SourceEntry> dirty = new ConcurrentHashMap<>();

    public LiveDocumentSource(DocumentSource delegate, LatexParser parser) {
        this.delegate = delegate;
        this.parser = parser;
    }

    /** Registers unsaved text for {@code file}, parsing it now. */
    public void markDirty(Path file, String text) {
        markDirty(file, text, parser.parse(text));
    }

    /** Registers unsaved text for {@code file} together with an already parsed tree. */
    public void markDirty(Path file, String text, ParsedDocument ast) {
        dirty.put(key(file), new SourceEntry(text, ast));
        logger.debug("Using live buffer for {}", file);
    }

    public void markClean(Path file) {
        dirty.remove(key(file));
    }

    public boolean isDirty(Path file) {
        return dirty.containsKey(key(file));
    }

    @Override
    public Optional<SourceEntry> get(Path file) {
        SourceEntry live = dirty.get(key(file));
        return live != null ? Optional.of(live) : delegate.get(file);
    }

    @Override
    public boolean hasPending(Path file) {
        return !isDirty(file) && delegate.hasPending(file);
    }

    @Override
    public CompletableFuture<Void> pending(Path file) {
        return isDirty(file) ? CompletableFuture.completedFuture(null) : delegate.pending(file);
    }

    @Override
    public CompletableFuture<Void> forceRefresh(Path file) {
        return isDirty(file)
                ? CompletableFuture.completedFuture(null)
                : delegate.forceRefresh(file);
    }

    @Override
    public void request(Path file) {
        if (!isDirty(file)) {
            delegate.request(file);
        }
    }

    private static Path key(Path file) {
        return file.toAbsolutePath().normalize();
    }
}
