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

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import net.boyechko.tex.outline.ast.ParsedDocument;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

public class SourceAwaiterTest {
    private static final Path FILE = Path.of("/virtual/main.tex");
    private static final SourceEntry ENTRY = new SourceEntry("x", new ParsedDocument(List.of()));

    private final Logger awaiterLogger = (Logger) LoggerFactory.getLogger(SourceAwaiter.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attachAppender() {
        appender.start();
        awaiterLogger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        awaiterLogger.detachAppender(appender);
    }

    /** Source that produces its entry after a number of lookups, or on a forced refresh. */
    private static class ScriptedSource implements DocumentSource {
        private final int readyAfterLookups;
        private final boolean refreshProduces;
        private final boolean pendingFirst;
        int lookups;
        int refreshes;
        int requests;
        private boolean ready;

        ScriptedSource(int readyAfterLookups, boolean refreshProduces, boolean pendingFirst) {
            this.readyAfterLookups = readyAfterLookups;
            this.refreshProduces = refreshProduces;
            this.pendingFirst = pendingFirst;
        }

        @Override
        public Optional<SourceEntry> get(Path file) {
            lookups++;
            if (readyAfterLookups >= 0 && lookups > readyAfterLookups) {
                ready = true;
            }
            return ready ? Optional.of(ENTRY) : Optional.empty();
        }

        @Override
        public boolean hasPending(Path file) {
            return pendingFirst && !ready;
        }

        @Override
        public CompletableFuture<Void> pending(Path file) {
            if (pendingFirst) {
                ready = true;
            }
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletableFuture<Void> forceRefresh(Path file) {
            refreshes++;
            ready = refreshProduces;
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void request(Path file) {
            requests++;
        }
    }

    @Test
    void pollsUntilEntryAppears() {
        ScriptedSource source = new ScriptedSource(3, false, false);

        Optional<SourceEntry> entry =
                new SourceAwaiter(source, Duration.ofMillis(1), 20).await(FILE);

        assertEquals(Optional.of(ENTRY), entry);
        assertEquals(1, source.requests);
        assertEquals(0, source.refreshes);
    }

    @Test
    void pendingWorkIsAwaitedWithoutPolling() {
        ScriptedSource source = new ScriptedSource(-1, false, true);

        Optional<SourceEntry> entry =
                new SourceAwaiter(source, Duration.ofMillis(1), 20).await(FILE);

        assertEquals(Optional.of(ENTRY), entry);
        assertEquals(1, source.lookups);
        assertEquals(0, source.refreshes);
    }

    @Test
    void forcesRefreshAfterLastAttempt() {
        ScriptedSource source = new ScriptedSource(-1, true, false);

        Optional<SourceEntry> entry =
                new SourceAwaiter(source, Duration.ofMillis(1), 3).await(FILE);

        assertEquals(Optional.of(ENTRY), entry);
        assertEquals(1, source.refreshes);
        assertTrue(
                appender.list.stream()
                        .anyMatch(
                                e ->
                                        e.getLevel() == Level.WARN
                                                && e.getFormattedMessage()
                                                        .contains("not ready after 3 attempts")));
    }

    @Test
    void givesUpWhenRefreshProducesNothing() {
        ScriptedSource source = new ScriptedSource(-1, false, false);

        assertTrue(new SourceAwaiter(source, Duration.ofMillis(1), 2).await(FILE).isEmpty());
        assertEquals(1, source.refreshes);
    }

    @Test
    void failedLoadIsLoggedNotThrown() {
        DocumentSource failing =
                new ScriptedSource(-1, false, false) {
                    @Override
                    public CompletableFuture<Void> forceRefresh(Path file) {
                        return CompletableFuture.failedFuture(new IllegalStateException("boom"));
                    }
                };

        assertTrue(new SourceAwaiter(failing, Duration.ofMillis(1), 1).await(FILE).isEmpty());
        assertTrue(
                appender.list.stream().anyMatch(e -> e.getFormattedMessage().contains("boom")));
    }

    @Test
    void attemptsMustBePositive() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new SourceAwaiter(new ScriptedSource(0, false, false), Duration.ZERO, 0));
    }
}
