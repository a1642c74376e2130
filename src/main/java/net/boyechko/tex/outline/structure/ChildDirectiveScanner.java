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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds Sweave/knitr child-document chunk headers ({@code <<..., child='file.Rnw'>>=}) by a text
 * scan. These are not macros, so the tree walk never sees them.
 */
public final class ChildDirectiveScanner {
    private static final Pattern CHILD_CHUNK =
            Pattern.compile("<<(?:[^,\\n]*,)*\\s*child\\s*=\\s*'([^']*)'\\s*(?:,[^>\\n]*)?>>=");

    /**
     * A child directive found in the text.
     *
     * @param subFile resolved absolute path of the child file
     * @param rawPath path as written in the directive
     * @param line 0-based line of the directive
     * @param offset offset of the directive in the text
     */
    public record ChildDirective(Path subFile, String rawPath, int line, int offset) {}

    private ChildDirectiveScanner() {}

    /**
     * Returns the resolvable child directives in {@code content}, ordered by line. Directives whose
     * file cannot be found are left out.
     */
    public static List<ChildDirective> scan(String content, List<Path> dirs) {
        List<ChildDirective> children = new ArrayList<>();
        Matcher matcher = CHILD_CHUNK.matcher(content);
        int line = 0;
        int lineCountedTo = 0;
        while (matcher.find()) {
            line += countNewlines(content, lineCountedTo, matcher.start());
            lineCountedTo = matcher.start();

            String rawPath = matcher.group(1);
            Optional<Path> resolved = IncludePathResolver.resolve(dirs, rawPath);
            if (resolved.isPresent()) {
                children.add(new ChildDirective(resolved.get(), rawPath, line, matcher.start()));
            }
        }
        return children;
    }

    private static int countNewlines(String content, int from, int to) {
        int count = 0;
        for (int i = from; i < to; i++) {
            if (content.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }
}
