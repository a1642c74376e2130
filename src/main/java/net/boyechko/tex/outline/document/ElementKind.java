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

/** Kind of an outline element. */
public enum ElementKind {
    /** A sectioning command titled by its mandatory argument. */
    SECTION,

    /** A starred sectioning command such as {@code \section*}; shown unnumbered. */
    SECTION_STARRED,

    ENVIRONMENT,

    COMMAND,

    /** A file-inclusion marker, replaced by the included file's elements when merging. */
    SUB_FILE;

    /** True for the kinds that take part in rank-based nesting and numbering. */
    public boolean isSectionBearing() {
        return this == SECTION || this == SECTION_STARRED;
    }
}
