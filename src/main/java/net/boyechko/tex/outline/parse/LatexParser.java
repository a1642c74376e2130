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
package net.boyechko.tex.outline.parse;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BooleanSupplier;
import net.boyechko.tex.outline.ast.Argument;
import net.boyechko.tex.outline.ast.ParsedDocument;
import net.boyechko.tex.outline.ast.SourcePosition;
import net.boyechko.tex.outline.ast.TexNode;
import net.boyechko.tex.outline.parse.MacroSignatures.ArgSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lenient recursive-descent parser for LaTeX source. It never rejects input: unbalanced groups,
 * math and environments simply end at the end of the text.
 */
public final class LatexParser {
    private static final Logger logger = LoggerFactory.getLogger(LatexParser.class);

    private final MacroSignatures signatures;

    public LatexParser() {
        this(MacroSignatures.defaults());
    }

    public LatexParser(MacroSignatures signatures) {
        this.signatures = signatures;
    }

    public ParsedDocument parse(String text) {
        Cursor cursor = new Cursor(text);
        List<TexNode> nodes = cursor.parseUntil(() -> false);
        logger.debug("Parsed {} top-level nodes from {} characters", nodes.size(), text.length());
        return new ParsedDocument(nodes);
    }

    private final class Cursor {
        private final String text;
        private final int[] lineStarts;
        private int pos;

        Cursor(String text) {
            this.text = text;
            this.lineStarts = computeLineStarts(text);
        }

        List<TexNode> parseUntil(BooleanSupplier stop) {
            List<TexNode> nodes = new ArrayList<>();
            while (pos < text.length() && !stop.getAsBoolean()) {
                nodes.add(parseNode());
            }
            return nodes;
        }

        private TexNode parseNode() {
            char c = text.charAt(pos);
            return switch (c) {
                case '%' -> parseComment();
                case '{' -> parseGroup();
                case '$' -> parseDollarMath();
                case '\\' -> parseBackslash();
                default -> isWhitespace(c) ? parseWhitespace() : parseText();
            };
        }

        private TexNode parseComment() {
            int start = pos;
            int end = text.indexOf('\n', pos);
            if (end < 0) {
                end = text.length();
            }
            pos = end;
            return new TexNode.Comment(text.substring(start + 1, end), span(start, end));
        }

        private TexNode parseWhitespace() {
            int start = pos;
            int newlines = 0;
            while (pos < text.length() && isWhitespace(text.charAt(pos))) {
                if (text.charAt(pos) == '\n') {
                    newlines++;
                }
                pos++;
            }
            SourcePosition position = span(start, pos);
            return newlines >= 2
                    ? new TexNode.Parbreak(position)
                    : new TexNode.Whitespace(position);
        }

        private TexNode parseGroup() {
            int start = pos;
            List<TexNode> body = parseBraced();
            return new TexNode.Group(body, span(start, pos));
        }

        /** Parses {@code {...}} starting at an opening brace and returns its content. */
        private List<TexNode> parseBraced() {
            pos++;
            List<TexNode> body = parseUntil(() -> peek('}'));
            if (peek('}')) {
                pos++;
            }
            return body;
        }

        private TexNode parseDollarMath() {
            int start = pos;
            if (lookingAt("$$")) {
                pos += 2;
                List<TexNode> body = parseUntil(() -> lookingAt("$$"));
                if (lookingAt("$$")) {
                    pos += 2;
                }
                return new TexNode.DisplayMath(body, span(start, pos));
            }
            pos++;
            List<TexNode> body = parseUntil(() -> peek('$'));
            if (peek('$')) {
                pos++;
            }
            return new TexNode.InlineMath(body, span(start, pos));
        }

        private TexNode parseBackslash() {
            int start = pos;
            if (pos + 1 >= text.length()) {
                pos++;
                return new TexNode.Str("\\", span(start, pos));
            }
            char next = text.charAt(pos + 1);
            if (next == '(' || next == '[') {
                String close = next == '(' ? "\\)" : "\\]";
                pos += 2;
                List<TexNode> body = parseUntil(() -> lookingAt(close));
                if (lookingAt(close)) {
                    pos += 2;
                }
                return next == '('
                        ? new TexNode.InlineMath(body, span(start, pos))
                        : new TexNode.DisplayMath(body, span(start, pos));
            }
            if (!isNameChar(next)) {
                pos += 2;
                return new TexNode.Macro(String.valueOf(next), List.of(), span(start, pos));
            }

            pos++;
            int nameStart = pos;
            while (pos < text.length() && isNameChar(text.charAt(pos))) {
                pos++;
            }
            String name = text.substring(nameStart, pos);
            if (name.equals("begin")) {
                return parseEnvironment(start);
            }
            if (name.equals("verb")) {
                return parseVerb(start);
            }
            List<Argument> args = parseArgs(signatures.forMacro(name));
            return new TexNode.Macro(name, args, span(start, pos));
        }

        private TexNode parseEnvironment(int start) {
            int close = peek('{') ? text.indexOf('}', pos) : -1;
            if (close < 0) {
                return new TexNode.Macro("begin", List.of(), span(start, pos));
            }
            String env = text.substring(pos + 1, close).trim();
            pos = close + 1;
            String endTag = "\\end{" + env + "}";

            if (signatures.isVerbatimEnvironment(env)) {
                int end = text.indexOf(endTag, pos);
                int bodyEnd = end < 0 ? text.length() : end;
                String raw = text.substring(pos, bodyEnd);
                pos = end < 0 ? text.length() : end + endTag.length();
                return new TexNode.VerbatimEnvironment(env, raw, span(start, pos));
            }

            List<Argument> args = parseArgs(signatures.forEnvironment(env));
            List<TexNode> body = parseUntil(() -> lookingAt(endTag));
            if (lookingAt(endTag)) {
                pos += endTag.length();
            } else {
                logger.debug("Environment '{}' opened at offset {} is never closed", env, start);
            }
            if (signatures.isMathEnvironment(env)) {
                return new TexNode.MathEnvironment(env, args, body, span(start, pos));
            }
            return new TexNode.Environment(env, args, body, span(start, pos));
        }

        private TexNode parseVerb(int start) {
            if (peek('*')) {
                pos++;
            }
            if (pos >= text.length()) {
                return new TexNode.Macro("verb", List.of(), span(start, pos));
            }
            char delimiter = text.charAt(pos);
            pos++;
            int end = text.indexOf(delimiter, pos);
            if (end < 0) {
                end = text.length();
            }
            String content = text.substring(pos, end);
            pos = Math.min(text.length(), end + 1);
            return new TexNode.Verb(content, span(start, pos));
        }

        private List<Argument> parseArgs(List<ArgSpec> specs) {
            List<Argument> args = new ArrayList<>(specs.size());
            for (ArgSpec spec : specs) {
                int save = pos;
                if (spec != ArgSpec.STAR) {
                    skipArgumentSpace();
                }
                Argument arg =
                        switch (spec) {
                            case STAR -> parseStar();
                            case OPTIONAL -> parseBracketed();
                            case OPTIONAL_ANGLE -> parseAngled();
                            case OPTIONAL_BRACE -> peek('{')
                                    ? new Argument("{", "}", parseBraced())
                                    : null;
                            case MANDATORY -> parseMandatory();
                        };
                if (arg == null) {
                    pos = save;
                    args.add(Argument.absent());
                } else {
                    args.add(arg);
                }
            }
            return args;
        }

        private Argument parseStar() {
            if (!peek('*')) {
                return null;
            }
            int start = pos;
            pos++;
            return new Argument("", "", List.of(new TexNode.Str("*", span(start, pos))));
        }

        private Argument parseBracketed() {
            if (!peek('[')) {
                return null;
            }
            pos++;
            List<TexNode> content = parseUntil(() -> peek(']'));
            if (peek(']')) {
                pos++;
            }
            return new Argument("[", "]", content);
        }

        private Argument parseAngled() {
            if (!peek('<')) {
                return null;
            }
            int close = text.indexOf('>', pos);
            if (close < 0) {
                return null;
            }
            int start = pos + 1;
            pos = close + 1;
            List<TexNode> content = List.of();
            if (close > start) {
                content = List.of(new TexNode.Str(text.substring(start, close), span(start, close)));
            }
            return new Argument("<", ">", content);
        }

        private Argument parseMandatory() {
            if (peek('{')) {
                return new Argument("{", "}", parseBraced());
            }
            if (pos >= text.length()
                    || peek('}')
                    || peek(']')
                    || isWhitespace(text.charAt(pos))) {
                return null;
            }
            return new Argument("", "", List.of(parseNode()));
        }

        private TexNode parseText() {
            int start = pos;
            while (pos < text.length() && !isTextBoundary(text.charAt(pos))) {
                pos++;
            }
            if (pos == start) {
                pos++;
            }
            return new TexNode.Str(text.substring(start, pos), span(start, pos));
        }

        /** Skips spaces between arguments, but never across a paragraph break. */
        private void skipArgumentSpace() {
            boolean sawNewline = false;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == '\n') {
                    if (sawNewline) {
                        return;
                    }
                    sawNewline = true;
                } else if (c != ' ' && c != '\t' && c != '\r') {
                    return;
                }
                pos++;
            }
        }

        private boolean peek(char c) {
            return pos < text.length() && text.charAt(pos) == c;
        }

        private boolean lookingAt(String s) {
            return text.startsWith(s, pos);
        }

        private SourcePosition span(int start, int end) {
            return new SourcePosition(start, lineAt(start), end, lineAt(Math.max(start, end - 1)));
        }

        private int lineAt(int offset) {
            int idx = Arrays.binarySearch(lineStarts, offset);
            return idx >= 0 ? idx + 1 : -(idx + 1);
        }
    }

    private static int[] computeLineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    private static boolean isNameChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '@';
    }

    private static boolean isTextBoundary(char c) {
        return switch (c) {
            case '\\', '{', '}', '$', '%', '[', ']' -> true;
            default -> isWhitespace(c);
        };
    }
}
