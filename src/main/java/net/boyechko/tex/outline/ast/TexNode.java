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
 * A node of the parsed LaTeX tree. The variants form a closed set; consumers dispatch through
 * {@link Visitor}, so a new variant forces every consumer to handle it.
 */
public sealed interface TexNode {

    SourcePosition position();

    /** Nested nodes that belong to this node's body (not its arguments). Empty for leaves. */
    default List<TexNode> body() {
        return List.of();
    }

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitString(Str node);

        R visitWhitespace(Whitespace node);

        R visitParbreak(Parbreak node);

        R visitComment(Comment node);

        R visitMacro(Macro node);

        R visitEnvironment(Environment node);

        R visitMathEnvironment(MathEnvironment node);

        R visitVerbatimEnvironment(VerbatimEnvironment node);

        R visitInlineMath(InlineMath node);

        R visitDisplayMath(DisplayMath node);

        R visitGroup(Group node);

        R visitVerb(Verb node);
    }

    record Str(String content, SourcePosition position) implements TexNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    record Whitespace(SourcePosition position) implements TexNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhitespace(this);
        }
    }

    record Parbreak(SourcePosition position) implements TexNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitParbreak(this);
        }
    }

    /** A {@code %} comment; content excludes the percent sign and the line break. */
    record Comment(String content, SourcePosition position) implements TexNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitComment(this);
        }
    }

    record Macro(String name, List<Argument> args, SourcePosition position) implements TexNode {
        public Macro {
            args = List.copyOf(args);
        }

        /** Returns the argument at {@code index}, or an absent argument past the end. */
        public Argument arg(int index) {
            return index < args.size() ? args.get(index) : Argument.absent();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMacro(this);
        }
    }

    record Environment(String env, List<Argument> args, List<TexNode> body, SourcePosition position)
            implements TexNode {
        public Environment {
            args = List.copyOf(args);
            body = List.copyOf(body);
        }

        public Argument arg(int index) {
            return index < args.size() ? args.get(index) : Argument.absent();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEnvironment(this);
        }
    }

    record MathEnvironment(
            String env, List<Argument> args, List<TexNode> body, SourcePosition position)
            implements TexNode {
        public MathEnvironment {
            args = List.copyOf(args);
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMathEnvironment(this);
        }
    }

    /** An environment whose body is kept as raw text (verbatim, lstlisting, ...). */
    record VerbatimEnvironment(String env, String text, SourcePosition position)
            implements TexNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVerbatimEnvironment(this);
        }
    }

    record InlineMath(List<TexNode> body, SourcePosition position) implements TexNode {
        public InlineMath {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInlineMath(this);
        }
    }

    record DisplayMath(List<TexNode> body, SourcePosition position) implements TexNode {
        public DisplayMath {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDisplayMath(this);
        }
    }

    record Group(List<TexNode> body, SourcePosition position) implements TexNode {
        public Group {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGroup(this);
        }
    }

    /** Inline verbatim ({@code \verb|...|}); text excludes the delimiters. */
    record Verb(String text, SourcePosition position) implements TexNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVerb(this);
        }
    }
}
