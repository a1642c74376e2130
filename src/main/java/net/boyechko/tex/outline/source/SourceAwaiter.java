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
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Waits for a {@link DocumentSource} to produce a file's entry. While the file is neither cached
 * nor pending it polls with a fixed delay; after the last attempt it forces a refresh. Whatever is
 * available afterwards is returned.
 */
public class SourceAwaiter {
    private static final Logger logger = LoggerFactory.getLogger(SourceAwaiter.class);

    public static final Duration DEFAULT_DELAY = Duration.ofMillis(100);
    public static final int DEFAULT_MAX_ATTEMPTS = 20;

    private final DocumentSource source;
    private final Duration delay;
    private final int maxAttempts;

    public SourceAwaiter(DocumentSource source) {
        this(source, DEFAULT_DELAY, DEFAULT_MAX_ATTEMPTS);
    }

    public SourceAwaiter(DocumentSource source, Duration delay, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        this.source = source;
        this.delay = delay;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Returns the entry for {@code file} once the source has produced it.
     *
     * @return the entry, or empty if the source still has nothing after the forced refresh
     */
    public Optional<SourceEntry> await(Path file) {
        source.request(file);
        int attempts = 0;
        while (!source.hasPending(file) && source.get(file).isEmpty()) {
            pause();
            attempts++;
            if (attempts >= maxAttempts) {
                logger.warn(
                        "Source for {} not ready after {} attempts; forcing refresh",
                        file,
                        attempts);
                join(source.forceRefresh(file), file);
                break;
            }
        }
        join(source.pending(file), file);
        return source.get(file);
    }

    private void pause() {
        CompletableFuture.runAsync(
                        () -> {},
                        CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS))
                .join();
    }

    private static void join(CompletableFuture<Void> future, Path file) {
        try {
            future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.warn("Loading {} failed: {}", file, cause.getMessage());
        }
    }
}
