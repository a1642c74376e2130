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
package net.boyechko.tex.outline.document;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class OutlineElementTest {

    private static OutlineElement section(String label) {
        return new OutlineElement(ElementKind.SECTION, "section", label, 4, 1, 3, null);
    }

    @Test
    void endBeforeStartIsRejected() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new OutlineElement(ElementKind.COMMAND, "label", "#label", 0, 5, 4, null));
    }

    @Test
    void deepCopyIsIndependent() {
        OutlineElement original = section("Intro");
        OutlineElement child = section("Scope");
        original.children().add(child);

        OutlineElement copy = original.deepCopy();
        copy.setLabel("1 Intro");
        copy.children().get(0).setLabel("1.1 Scope");
        copy.children().add(section("Extra"));

        assertEquals("Intro", original.label());
        assertEquals("Scope", child.label());
        assertEquals(1, original.children().size());
        assertEquals(4, copy.sourceOffset());
        assertEquals(3, copy.lineEnd());
    }

    @Test
    void withChildrenSharesDescendantsButNotTheList() {
        OutlineElement original = section("Intro");
        OutlineElement child = section("Scope");

        OutlineElement copy = original.withChildren(List.of(child));

        assertTrue(original.children().isEmpty());
        assertSame(child, copy.children().get(0));
    }

    @Test
    void onlySectionKindsBearSections() {
        assertTrue(ElementKind.SECTION.isSectionBearing());
        assertTrue(ElementKind.SECTION_STARRED.isSectionBearing());
        assertFalse(ElementKind.SUB_FILE.isSectionBearing());
        assertFalse(ElementKind.ENVIRONMENT.isSectionBearing());
        assertFalse(ElementKind.COMMAND.isSectionBearing());
    }
}
