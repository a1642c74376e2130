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
package net.boyechko.tex.outline.ui;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingListenerTest {
    private final Logger logger = (Logger) LoggerFactory.getLogger(LoggingListener.LOGGER_NAME);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private Level previousLevel;

    @BeforeEach
    void attach() {
        previousLevel = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
        logger.setLevel(previousLevel);
    }

    @Test
    void reportsRunLifecycle() {
        LoggingListener listener = new LoggingListener();
        Path root = Path.of("/work/thesis.tex");

        listener.onConstructionStart(root, false);
        listener.onFileExtracted(root, 4);
        listener.onConstructionComplete(root, 1, 3);

        assertEquals(3, appender.list.size());
        assertEquals(Level.INFO, appender.list.get(0).getLevel());
        assertEquals(
                "START " + root + " (sub-files unmerged)",
                appender.list.get(0).getFormattedMessage());
        assertEquals(Level.DEBUG, appender.list.get(1).getLevel());
        assertEquals("FILE " + root + " elements=4", appender.list.get(1).getFormattedMessage());
        assertEquals(
                "DONE " + root + " files=1 top-level=3",
                appender.list.get(2).getFormattedMessage());
    }

    @Test
    void unavailableFileIsWarning() {
        Path file = Path.of("/work/missing.tex");

        new LoggingListener().onFileUnavailable(file, "content");

        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.WARN, event.getLevel());
        assertTrue(event.getFormattedMessage().startsWith("UNAVAILABLE " + file + ": no content"));
    }
}
