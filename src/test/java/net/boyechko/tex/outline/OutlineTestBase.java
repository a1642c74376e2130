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
package net.boyechko.tex.outline;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.tex.outline.core.OutlineSettings;
import net.boyechko.tex.outline.document.ElementKind;
import net.boyechko.tex.outline.document.OutlineElement;
import net.boyechko.tex.outline.parse.LatexParser;
import net.boyechko.tex.outline.source.FileDocumentSource;
import net.boyechko.tex.outline.source.SourceAwaiter;
import org.junit.jupiter.api.io.TempDir;

/** Base for tests that build outlines from LaTeX files written to a temporary directory. */
public abstract class OutlineTestBase {

    @TempDir protected Path tempDir;

    // ── Source files ────────────────────────────────────────────────

    /** Writes {@code content} to {@code relativePath} under the temporary directory. */
    protected final Path writeFile(String relativePath, String content) {
        Path file = tempDir.resolve(relativePath);
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, content);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write test file: " + file, e);
        }
        return file.toAbsolutePath().normalize();
    }

    // ── Settings and sources ────────────────────────────────────────

    /** Settings with the given section ranks and everything else at its default. */
    protected static OutlineSettings settings(String... sections) {
        OutlineSettings settings = new OutlineSettings();
        settings.sections = new ArrayList<>(List.of(sections));
        return settings;
    }

    /** Awaiter over a file source that gives up quickly on missing files. */
    protected static SourceAwaiter fastAwaiter(LatexParser parser) {
        return new SourceAwaiter(
                new FileDocumentSource(parser, Runnable::run), Duration.ofMillis(1), 2);
    }

    // ── Element helpers ─────────────────────────────────────────────

    protected static OutlineElement element(ElementKind kind, String name, String label, int line) {
        return new OutlineElement(kind, name, label, 0, line, line, null);
    }

    protected static OutlineElement section(String name, String label, int line) {
        return element(ElementKind.SECTION, name, label, line);
    }

    protected static OutlineElement figure(String label, int line) {
        return element(ElementKind.ENVIRONMENT, "figure", label, line);
    }

    protected static List<String> labels(List<OutlineElement> elements) {
        return elements.stream().map(OutlineElement::label).toList();
    }
}
