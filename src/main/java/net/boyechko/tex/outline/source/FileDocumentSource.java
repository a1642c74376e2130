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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import net.boyechko.tex.outline.ast.ParsedDocument;
import net.boyechko.tex.outline.parse.LatexParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads files from disk as UTF-8 and parses them on an executor, caching the result per path.
 * Bytes that are not valid UTF-8 are replaced rather than rejected.
 */
public class FileDocumentSource implements DocumentSource {
    private static final Logger logger = LoggerFactory.getLogger(FileDocumentSource.class);

    private final LatexParser parser;
    private final Executor executor;
    private final Map<Path, SourceEntry> entries = new ConcurrentHashMap<>();
    private final Map<Path, CompletableFuture<Void>> inflight = new ConcurrentHashMap<>();

    public FileDocumentSource(LatexParser parser) {
        this(parser, ForkJoinPool.commonPool());
    }

    public FileDocumentSource(LatexParser parser, Executor executor) {
        this.parser = parser;
        this.executor = executor;
    }

    @Override
    public Optional<SourceEntry> get(Path file) {
        return Optional.ofNullable(entries.get(key(file)));
    }

    @Override
    public boolean hasPending(Path file) {
        CompletableFuture<Void> future = inflight.get(key(file));
        return future != null && !future.isDone();
    }

    @Override
    public CompletableFuture<Void> pending(Path file) {
        return inflight.getOrDefault(key(file), CompletableFuture.completedFuture(null));
    }

    @Override
    public CompletableFuture<Void> forceRefresh(Path file) {
        Path key = key(file);
        CompletableFuture<Void> future =
                inflight.computeIfAbsent(
                        key, k -> CompletableFuture.runAsync(() -> load(k), executor));
        future.whenComplete((ignored, error) -> inflight.remove(key, future));
        return future;
    }

    /** Starts loading {@code file} unless it is cached or already loading. */
    @Override
    public void request(Path file) {
        Path key = key(file);
        if (!entries.containsKey(key) && !inflight.containsKey(key)) {
            forceRefresh(key);
        }
    }

    /** Drops the cached entry so the next request reads the file again. */
    public void invalidate(Path file) {
        entries.remove(key(file));
    }

    private void load(Path file) {
        if (!Files.isRegularFile(file)) {
            logger.warn("Cannot read {}: not a regular file", file);
            entries.remove(file);
            return;
        }
        try {
            // Malformed bytes decode to U+FFFD instead of failing the whole file.
            String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            ParsedDocument ast = parser.parse(content);
            entries.put(file, new SourceEntry(content, ast));
            logger.debug("Cached {} ({} top-level nodes)", file, ast.content().size());
        } catch (IOException e) {
            logger.warn("Failed to read {}: {}", file, e.getMessage());
            entries.remove(file);
        }
    }

    private static Path key(Path file) {
        return file.toAbsolutePath().normalize();
    }
}
