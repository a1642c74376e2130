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
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Argument signatures for macros and environments, written in a compact notation:
 *
 * <ul>
 *   <li>{@code s} - optional star
 *   <li>{@code o} - optional {@code [...]} argument
 *   <li>{@code m} - mandatory argument
 *   <li>{@code d<>} - optional {@code <...>} argument
 *   <li>{@code d{}} - optional brace group
 * </ul>
 *
 * <p>A macro without a signature takes no arguments; any following groups stay in the body.
 */
public final class MacroSignatures {

    public enum ArgSpec {
        STAR,
        OPTIONAL,
        MANDATORY,
        OPTIONAL_ANGLE,
        OPTIONAL_BRACE
    }

    /** Signature given to configured command names that are not section names. */
    public static final String COMMAND_SIGNATURE = "o m";

    /** Signature of the built-in sectioning macros, also given to configured section names. */
    public static final String SECTION_SIGNATURE = "s o m";

    private static final Set<String> VERBATIM_ENVIRONMENTS =
            Set.of("verbatim", "verbatim*", "lstlisting", "minted", "comment", "Verbatim");

    private static final Set<String> MATH_ENVIRONMENTS =
            Set.of(
                    "equation",
                    "equation*",
                    "align",
                    "align*",
                    "gather",
                    "gather*",
                    "multline",
                    "multline*",
                    "flalign",
                    "flalign*",
                    "displaymath",
                    "math");

    private final Map<String, List<ArgSpec>> macros;
    private final Map<String, List<ArgSpec>> environments;

    private MacroSignatures(
            Map<String, List<ArgSpec>> macros, Map<String, List<ArgSpec>> environments) {
        this.macros = macros;
        this.environments = environments;
    }

    public static MacroSignatures defaults() {
        Map<String, List<ArgSpec>> macros = new HashMap<>();
        for (String sectioning :
                List.of(
                        "part",
                        "chapter",
                        "section",
                        "subsection",
                        "subsubsection",
                        "paragraph",
                        "subparagraph",
                        "addchap",
                        "addsec")) {
            macros.put(sectioning, parse(SECTION_SIGNATURE));
        }
        for (String input :
                List.of(
                        "input",
                        "include",
                        "subfile",
                        "SweaveInput",
                        "loadglsentries",
                        "markdownInput")) {
            macros.put(input, parse("m"));
        }
        macros.put("InputIfFileExists", parse("m m m"));
        for (String importLike :
                List.of(
                        "import",
                        "inputfrom",
                        "includefrom",
                        "subimport",
                        "subinputfrom",
                        "subincludefrom")) {
            macros.put(importLike, parse("m m"));
        }
        for (String textStyle :
                List.of(
                        "textbf",
                        "textit",
                        "textsl",
                        "emph",
                        "texttt",
                        "textsc",
                        "textrm",
                        "textsf",
                        "textup",
                        "textmd",
                        "underline",
                        "mbox",
                        "label",
                        "ref",
                        "eqref",
                        "pageref",
                        "url",
                        "end")) {
            macros.put(textStyle, parse("m"));
        }
        macros.put("caption", parse("o m"));
        macros.put("footnote", parse("o m"));
        macros.put("frametitle", parse("d<> o m"));
        macros.put("framesubtitle", parse("d<> o m"));
        macros.put("texorpdfstring", parse("m m"));
        macros.put("href", parse("o m m"));
        macros.put("cite", parse("o o m"));
        macros.put("documentclass", parse("o m"));
        macros.put("usepackage", parse("o m"));

        Map<String, List<ArgSpec>> environments = new HashMap<>();
        environments.put("frame", parse("d<> o o d{} d{}"));
        for (String flt : List.of("figure", "figure*", "table", "table*")) {
            environments.put(flt, parse("o"));
        }
        return new MacroSignatures(macros, environments);
    }

    /** Returns a copy in which every name in {@code names} has {@code signature}. */
    public MacroSignatures withSignature(Collection<String> names, String signature) {
        Map<String, List<ArgSpec>> extended = new HashMap<>(macros);
        List<ArgSpec> specs = parse(signature);
        for (String name : names) {
            extended.put(name, specs);
        }
        return new MacroSignatures(extended, environments);
    }

    public boolean hasMacro(String name) {
        return macros.containsKey(name);
    }

    public List<ArgSpec> forMacro(String name) {
        return macros.getOrDefault(name, List.of());
    }

    public List<ArgSpec> forEnvironment(String env) {
        return environments.getOrDefault(env, List.of());
    }

    public boolean isVerbatimEnvironment(String env) {
        return VERBATIM_ENVIRONMENTS.contains(env);
    }

    public boolean isMathEnvironment(String env) {
        return MATH_ENVIRONMENTS.contains(env);
    }

    /** Parses a whitespace-separated signature such as {@code "s o m"}. */
    static List<ArgSpec> parse(String signature) {
        List<ArgSpec> specs = new ArrayList<>();
        for (String token : signature.trim().split("\\s+")) {
            if (token.isEmpty()) {
                continue;
            }
            specs.add(
                    switch (token) {
                        case "s" -> ArgSpec.STAR;
                        case "o" -> ArgSpec.OPTIONAL;
                        case "m" -> ArgSpec.MANDATORY;
                        case "d<>" -> ArgSpec.OPTIONAL_ANGLE;
                        case "d{}" -> ArgSpec.OPTIONAL_BRACE;
                        default -> throw new IllegalArgumentException(
                                "Unknown argument spec '" + token + "' in '" + signature + "'");
                    });
        }
        return List.copyOf(specs);
    }
}
