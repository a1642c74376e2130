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

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import net.boyechko.tex.outline.OutlineTestBase;
import org.junit.jupiter.api.Test;

public class IncludePathResolverTest extends OutlineTestBase {

    @Test
    void appendsTexSuffixToNameWithoutExtension() {
        Path chapter = writeFile("chap.tex", "");

        assertEquals(Optional.of(chapter), IncludePathResolver.resolve(List.of(tempDir), "chap"));
        assertEquals(
                Optional.of(chapter), IncludePathResolver.resolve(List.of(tempDir), "chap.tex"));
    }

    @Test
    void retriesWithTexSuffixWhenDottedNameDoesNotExist() {
        Path file = writeFile("part.one.tex", "");
        assertEquals(Optional.of(file), IncludePathResolver.resolve(List.of(tempDir), "part.one"));
    }

    @Test
    void directoriesAreSearchedInOrder() {
        Path first = writeFile("a/chap.tex", "");
        writeFile("b/chap.tex", "");

        assertEquals(
                Optional.of(first),
                IncludePathResolver.resolve(
                        List.of(
                                tempDir.resolve("missing"),
                                tempDir.resolve("a"),
                                tempDir.resolve("b")),
                        "chap"));
    }

    @Test
    void absoluteInputIsUsedAsIs() {
        Path file = writeFile("elsewhere/x.tex", "");
        assertEquals(
                Optional.of(file),
                IncludePathResolver.resolve(List.of(tempDir.resolve("a")), file.toString()));
    }

    @Test
    void unresolvableInputGivesNothing() {
        assertTrue(IncludePathResolver.resolve(List.of(tempDir), "nowhere").isEmpty());
        assertTrue(IncludePathResolver.resolve(List.of(tempDir), "  ").isEmpty());
        assertTrue(IncludePathResolver.resolve(List.of(), "chap").isEmpty());
    }

    @Test
    void inputDirsAreCurrentThenRootThenSearchDirs() {
        Path current = tempDir.resolve("sub/current.tex");
        Path root = tempDir.resolve("main.tex");
        Path extra = tempDir.resolve("styles");

        assertEquals(
                List.of(tempDir.resolve("sub"), tempDir, extra),
                IncludePathResolver.inputDirs(current, root, List.of(extra)));
    }
}
