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
package net.boyechko.tex.outline.ast;

/**
 * Span of a node in its source text.
 *
 * @param startOffset offset of the first character (0-based)
 * @param startLine line of the first character (1-based)
 * @param endOffset offset just past the last character (0-based)
 * @param endLine line of the last character (1-based)
 */
public record SourcePosition(int startOffset, int startLine, int endOffset, int endLine) {

    public SourcePosition {
        if (endLine < startLine) {
            throw new IllegalArgumentException(
                    "End line " + endLine + " precedes start line " + startLine);
        }
    }

    /** Position used for synthesized nodes that have no source text. */
    public static SourcePosition none() {
        return new SourcePosition(0, 1, 0, 1);
    }
}
