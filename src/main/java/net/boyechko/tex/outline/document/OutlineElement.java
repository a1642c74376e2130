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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A node of the document outline. Created during extraction with no children; the assembly passes
 * fill in children and the numbering passes rewrite the label.
 */
public final class OutlineElement {
    private final ElementKind kind;
    private final String name;
    private String label;
    private final int sourceOffset;
    private final int lineStart;
    private final int lineEnd;
    private final Path filePath;
    private final List<OutlineElement> children;

    public OutlineElement(
            ElementKind kind,
            String name,
            String label,
            int sourceOffset,
            int lineStart,
            int lineEnd,
            Path filePath) {
        this(kind, name, label, sourceOffset, lineStart, lineEnd, filePath, List.of());
    }

    private OutlineElement(
            ElementKind kind,
            String name,
            String label,
            int sourceOffset,
            int lineStart,
            int lineEnd,
            Path filePath,
            List<OutlineElement> children) {
        if (lineEnd < lineStart) {
            throw new IllegalArgumentException(
                    "Element '" + name + "' ends at line " + lineEnd + " before " + lineStart);
        }
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = Objects.requireNonNull(name, "name");
        this.label = Objects.requireNonNull(label, "label");
        this.sourceOffset = sourceOffset;
        this.lineStart = lineStart;
        this.lineEnd = lineEnd;
        this.filePath = filePath;
        this.children = new ArrayList<>(children);
    }

    public ElementKind kind() {
        return kind;
    }

    public String name() {
        return name;
    }

    public String label() {
        return label;
    }

    public void setLabel(String label) {
        this.label = Objects.requireNonNull(label, "label");
    }

    public int sourceOffset() {
        return sourceOffset;
    }

    /** First line of the originating node (0-based). */
    public int lineStart() {
        return lineStart;
    }

    /** Last line of the originating node (0-based). */
    public int lineEnd() {
        return lineEnd;
    }

    public Path filePath() {
        return filePath;
    }

    /** Live, ordered list of children. */
    public List<OutlineElement> children() {
        return children;
    }

    public boolean isSectionBearing() {
        return kind.isSectionBearing();
    }

    /** Returns a shallow copy of this element whose children are {@code newChildren}. */
    public OutlineElement withChildren(List<OutlineElement> newChildren) {
        return new OutlineElement(
                kind, name, label, sourceOffset, lineStart, lineEnd, filePath, newChildren);
    }

    /** Returns a copy of this element and all of its descendants. */
    public OutlineElement deepCopy() {
        List<OutlineElement> copied = new ArrayList<>(children.size());
        for (OutlineElement child : children) {
            copied.add(child.deepCopy());
        }
        return withChildren(copied);
    }

    @Override
    public String toString() {
        return kind + "(" + name + ": " + label + ") @" + lineStart + "-" + lineEnd;
    }
}
