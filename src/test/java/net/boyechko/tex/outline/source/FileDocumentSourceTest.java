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

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import net.boyechko.tex.outline.OutlineTestBase;
import net.boyechko.tex.outline.ast.TexNode;
import net.boyechko.tex.outline.parse.LatexParser;
import org.junit.jupiter.api.Test;

public class FileDocumentSourceTest extends OutlineTestBase {

    @Test
    void refreshReadsAndParsesFile() {
        Path file = writeFile("main.tex", "\\section{A}");
        FileDocumentSource source = new FileDocumentSource(new LatexParser(), Runnable::run);

        source.forceRefresh(file).join();

        SourceEntry entry = source.get(file).orElseThrow();
        assertEquals("\\section{A}", entry.content());
        assertInstanceOf(TexNode.Macro.class, entry.ast().content().get(0));
        assertFalse(source.hasPending(file));
    }

    @Test
    void invalidUtf8BytesAreReplaced() throws Exception {
        Path file = tempDir.resolve("latin1.tex");
        Files.write(file, "\\section{Caf\u00e9}".getBytes(StandardCharsets.ISO_8859_1));
        FileDocumentSource source = new FileDocumentSource(new LatexParser(), Runnable::run);

        source.forceRefresh(file).join();

        assertEquals("\\section{Caf\uFFFD}", source.get(file).orElseThrow().content());
    }

    @Test
    void missingFileHasNoEntry() {
        FileDocumentSource source = new FileDocumentSource(new LatexParser(), Runnable::run);
        Path missing = tempDir.resolve("missing.tex");

        source.forceRefresh(missing).join();

        assertTrue(source.get(missing).isEmpty());
    }

    @Test
    void refreshPicksUpChangedContent() throws Exception {
        Path file = writeFile("main.tex", "old");
        FileDocumentSource source = new FileDocumentSource(new LatexParser(), Runnable::run);
        source.request(file);

        Files.writeString(file, "new");
        source.request(file);
        assertEquals("old", source.get(file).orElseThrow().content(), "Cached entry is kept");

        source.forceRefresh(file).join();
        assertEquals("new", source.get(file).orElseThrow().content());
    }

    @Test
    void invalidatedFileIsReadAgainOnRequest() throws Exception {
        Path file = writeFile("main.tex", "old");
        FileDocumentSource source = new FileDocumentSource(new LatexParser(), Runnable::run);
        source.request(file);

        Files.writeString(file, "new");
        source.invalidate(file);
        assertTrue(source.get(file).isEmpty());

        source.request(file);
        assertEquals("new", source.get(file).orElseThrow().content());
    }

    @Test
    void pendingCompletesAfterAsynchronousLoad() {
        Path file = writeFile("main.tex", "text");
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            FileDocumentSource source = new FileDocumentSource(new LatexParser(), executor);

            source.request(file);
            source.pending(file).join();

            assertEquals("text", source.get(file).orElseThrow().content());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void pathsAreNormalized() {
        Path file = writeFile("dir/main.tex", "x");
        FileDocumentSource source = new FileDocumentSource(new LatexParser(), Runnable::run);

        source.forceRefresh(tempDir.resolve("dir/../dir/main.tex")).join();

        assertTrue(source.get(file).isPresent());
    }
}
