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

import java.util.List;

/**
 * An argument of a macro or environment. A slot declared by the signature but not present in the
 * source is kept as an argument with empty marks and no content, so argument indices stay stable.
 */
public record Argument(String openMark, String closeMark, List<TexNode> content) {

    public Argument {
        content = List.copyOf(content);
    }

    public static Argument absent() {
        return new Argument("", "", List.of());
    }

    public boolean isEmpty() {
        return content.isEmpty();
    }
}
