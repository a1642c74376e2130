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

import java.util.List;
import net.boyechko.tex.outline.ast.Argument;
import net.boyechko.tex.outline.ast.TexNode;

/**
 * Renders inline content nodes into a single display string for outline labels. Nested
 * environments render as a placeholder rather than their body.
 */
public final class NodeRenderer implements TexNode.Visitor<String> {

    /** Macro whose second argument is a plain-text stand-in for its first. */
    static final String ALTERNATE_TEXT_MACRO = "texorpdfstring";

    public String render(List<TexNode> nodes) {
        StringBuilder sb = new StringBuilder();
        for (TexNode node : nodes) {
            sb.append(node.accept(this));
        }
        return sb.toString();
    }

    public String render(Argument argument) {
        return render(argument.content());
    }

    @Override
    public String visitString(TexNode.Str node) {
        return node.content();
    }

    @Override
    public String visitWhitespace(TexNode.Whitespace node) {
        return " ";
    }

    @Override
    public String visitParbreak(TexNode.Parbreak node) {
        return " ";
    }

    @Override
    public String visitComment(TexNode.Comment node) {
        return " ";
    }

    @Override
    public String visitMacro(TexNode.Macro node) {
        if (ALTERNATE_TEXT_MACRO.equals(node.name())) {
            return render(node.arg(1));
        }
        StringBuilder sb = new StringBuilder("\\").append(node.name());
        for (Argument arg : node.args()) {
            sb.append(arg.openMark()).append(render(arg)).append(arg.closeMark());
        }
        return sb.toString();
    }

    @Override
    public String visitEnvironment(TexNode.Environment node) {
        return placeholder(node.env());
    }

    @Override
    public String visitMathEnvironment(TexNode.MathEnvironment node) {
        return placeholder(node.env());
    }

    @Override
    public String visitVerbatimEnvironment(TexNode.VerbatimEnvironment node) {
        return placeholder(node.env());
    }

    @Override
    public String visitInlineMath(TexNode.InlineMath node) {
        return "$" + render(node.body()) + "$";
    }

    @Override
    public String visitDisplayMath(TexNode.DisplayMath node) {
        return "\\[" + render(node.body()) + "\\]";
    }

    @Override
    public String visitGroup(TexNode.Group node) {
        return render(node.body());
    }

    @Override
    public String visitVerb(TexNode.Verb node) {
        return node.text();
    }

    private static String placeholder(String env) {
        return "\\environment{" + env + "}";
    }
}
