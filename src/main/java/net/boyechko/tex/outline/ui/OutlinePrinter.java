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

import java.util.List;
import net.boyechko.tex.outline.document.OutlineElement;

/** Plain-text rendering of an outline. */
public final class OutlinePrinter {

    private OutlinePrinter() {}

    /** One element label per line, indented two spaces per depth. */
    public static String toIndentedTreeString(List<OutlineElement> outline) {
        return toIndentedTreeString(outline, false);
    }

    /**
     * Like {@link #toIndentedTreeString(List)}, optionally followed by the 1-based source line
     * range of each element.
     */
    public static String toIndentedTreeString(List<OutlineElement> outline, boolean withLines) {
        StringBuilder sb = new StringBuilder();
        for (OutlineElement element : outline) {
            appendIndentedTree(sb, element, 0, withLines);
        }
        return sb.toString();
    }

    private static void appendIndentedTree(
            StringBuilder sb, OutlineElement element, int depth, boolean withLines) {
        sb.append("  ".repeat(depth));
        sb.append(element.label());
        if (withLines) {
            sb.append("  [").append(element.lineStart() + 1);
            if (element.lineEnd() != element.lineStart()) {
                sb.append('-').append(element.lineEnd() + 1);
            }
            sb.append(']');
        }
        sb.append('\n');
        for (OutlineElement child : element.children()) {
            appendIndentedTree(sb, child, depth + 1, withLines);
        }
    }
}
