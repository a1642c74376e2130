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
import net.boyechko.tex.outline.OutlineTestBase;
import net.boyechko.tex.outline.structure.ChildDirectiveScanner.ChildDirective;
import org.junit.jupiter.api.Test;

public class ChildDirectiveScannerTest extends OutlineTestBase {

    @Test
    void findsChildChunkHeaders() {
        Path child = writeFile("part.Rnw", "");
        String content = "line0\n<<echo=FALSE, child='part.Rnw'>>=\n@\n";

        List<ChildDirective> found = ChildDirectiveScanner.scan(content, List.of(tempDir));

        assertEquals(List.of(new ChildDirective(child, "part.Rnw", 1, 6)), found);
    }

    @Test
    void acceptsChildAsOnlyOrFirstOption() {
        writeFile("a.Rnw", "");
        writeFile("b.Rnw", "");
        String content = "<<child='a.Rnw'>>=\n@\n\n<<child = 'b.Rnw', eval=TRUE>>=\n@\n";

        List<ChildDirective> found = ChildDirectiveScanner.scan(content, List.of(tempDir));

        assertEquals(
                List.of("a.Rnw", "b.Rnw"), found.stream().map(ChildDirective::rawPath).toList());
        assertEquals(List.of(0, 3), found.stream().map(ChildDirective::line).toList());
    }

    @Test
    void skipsUnresolvableChildren() {
        writeFile("present.Rnw", "");
        String content = "<<child='absent.Rnw'>>=\n@\n<<child='present.Rnw'>>=\n@\n";

        List<ChildDirective> found = ChildDirectiveScanner.scan(content, List.of(tempDir));

        assertEquals(1, found.size());
        assertEquals(2, found.get(0).line());
    }

    @Test
    void ordinaryChunksAreIgnored() {
        String chunk = "<<setup, echo=FALSE>>=\nx <- 1\n@\n";
        assertTrue(ChildDirectiveScanner.scan(chunk, List.of(tempDir)).isEmpty());
    }
}
