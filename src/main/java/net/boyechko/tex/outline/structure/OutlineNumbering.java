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

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.tex.outline.core.StructureConfig;
import net.boyechko.tex.outline.document.ElementKind;
import net.boyechko.tex.outline.document.OutlineElement;

/** Label numbering passes over an assembled outline. Both passes rewrite labels in place. */
public final class OutlineNumbering {

    private OutlineNumbering() {}

    /**
     * Numbers environment elements with one counter per environment name across the whole tree,
     * in depth-first document order. The number goes before the first colon of the label.
     */
    public static void addFloatNumbers(List<OutlineElement> outline) {
        addFloatNumbers(outline, new HashMap<>());
    }

    private static void addFloatNumbers(
            List<OutlineElement> elements, Map<String, Integer> counters) {
        for (OutlineElement element : elements) {
            if (element.kind() == ElementKind.ENVIRONMENT
                    && !FileExtractor.DOC_ENVIRONMENTS.contains(element.name())) {
                int number = counters.merge(element.name(), 1, Integer::sum);
                element.setLabel(insertNumber(element.label(), number));
            }
            addFloatNumbers(element.children(), counters);
        }
    }

    static String insertNumber(String label, int number) {
        int colon = label.indexOf(':');
        if (colon < 0) {
            return label + " " + number;
        }
        return label.substring(0, colon) + " " + number + label.substring(colon);
    }

    /**
     * Prefixes section labels with hierarchical numbers such as {@code 2.1}. A rank skipped
     * between a section and its parent shows as a {@code 0.} segment. Starred sections show
     * {@code *} and do not advance their counter.
     */
    public static void addSectionNumbers(List<OutlineElement> outline, StructureConfig config) {
        Integer lowest = null;
        for (OutlineElement element : outline) {
            Integer rank = TreeAssembler.rankOf(element, config);
            if (rank != null && (lowest == null || rank < lowest)) {
                lowest = rank;
            }
        }
        if (lowest != null) {
            numberScope(outline, "", lowest, config);
        }
    }

    private static void numberScope(
            List<OutlineElement> elements, String prefix, int lowest, StructureConfig config) {
        Map<Integer, Integer> counters = new HashMap<>();
        for (OutlineElement element : elements) {
            Integer rank = TreeAssembler.rankOf(element, config);
            if (rank == null) {
                continue;
            }
            String padding = "0.".repeat(Math.max(0, rank - lowest));
            String number;
            if (element.kind() == ElementKind.SECTION) {
                int count = counters.merge(rank, 1, Integer::sum);
                number = prefix + padding + count;
                element.setLabel(number + " " + element.label());
            } else {
                number = prefix + padding + counters.getOrDefault(rank, 0);
                element.setLabel("* " + element.label());
            }
            numberScope(element.children(), number + ".", rank + 1, config);
        }
    }
}
