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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import net.boyechko.tex.outline.core.StructureConfig;
import net.boyechko.tex.outline.document.ElementKind;
import net.boyechko.tex.outline.document.FileStructureCache;
import net.boyechko.tex.outline.document.OutlineElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the per-file flat forests into one outline tree. The three passes run in order: splice
 * sub-files, nest non-section elements, nest sections by rank.
 */
public final class TreeAssembler {
    private static final Logger logger = LoggerFactory.getLogger(TreeAssembler.class);

    private TreeAssembler() {}

    // ── Sub-file splicing ──────────────────────────────────────────

    /**
     * Returns the root file's forest with each resolvable sub-file marker replaced by the spliced
     * forest of that file. A file is expanded at its first marker only; later markers for it,
     * cyclic ones included, stay leaves.
     */
    public static List<OutlineElement> spliceSubFiles(FileStructureCache cache, Path rootFile) {
        Path root = rootFile.toAbsolutePath().normalize();
        Optional<List<OutlineElement>> forest = cache.get(root);
        if (forest.isEmpty()) {
            return new ArrayList<>();
        }
        Set<Path> expanded = new HashSet<>();
        expanded.add(root);
        return splice(forest.get(), cache, expanded);
    }

    private static List<OutlineElement> splice(
            List<OutlineElement> elements, FileStructureCache cache, Set<Path> expanded) {
        List<OutlineElement> result = new ArrayList<>();
        for (OutlineElement element : elements) {
            if (element.kind() == ElementKind.SUB_FILE) {
                Optional<Path> target = cache.resolveLabel(element.label());
                if (target.isPresent() && expanded.add(target.get())) {
                    result.addAll(splice(cache.get(target.get()).orElseThrow(), cache, expanded));
                    continue;
                }
                if (target.isPresent()) {
                    logger.debug("{} already expanded; keeping it as a leaf", target.get());
                }
            }
            result.add(element.withChildren(splice(element.children(), cache, expanded)));
        }
        return result;
    }

    // ── Non-section nesting ────────────────────────────────────────

    /** Sibling-level state: the section that absorbs following non-section siblings. */
    private record Accumulator(List<OutlineElement> result, OutlineElement currentSection) {
        Accumulator accept(OutlineElement element) {
            if (element.isSectionBearing()) {
                result.add(element);
                return new Accumulator(result, element);
            }
            if (currentSection != null) {
                currentSection.children().add(element);
            } else {
                result.add(element);
            }
            return this;
        }
    }

    /**
     * Moves every non-section element under the nearest preceding section among its siblings.
     * Elements before the first section stay where they are. Returns new lists at every level.
     */
    public static List<OutlineElement> nestNonSections(List<OutlineElement> elements) {
        Accumulator acc = new Accumulator(new ArrayList<>(), null);
        for (OutlineElement element : elements) {
            acc = acc.accept(element.withChildren(nestNonSections(element.children())));
        }
        return acc.result();
    }

    // ── Section nesting ────────────────────────────────────────────

    /**
     * Nests top-level sections by rank: a section becomes a child of the nearest open section of
     * lower rank. Sub-file markers take part with no rank, which makes every comparison against
     * them false.
     */
    public static List<OutlineElement> nestSections(
            List<OutlineElement> elements, StructureConfig config) {
        List<OutlineElement> result = new ArrayList<>();
        Deque<OutlineElement> open = new ArrayDeque<>();
        for (OutlineElement element : elements) {
            if (!element.isSectionBearing() && element.kind() != ElementKind.SUB_FILE) {
                result.add(element);
                continue;
            }
            Integer rank = rankOf(element, config);
            if (open.isEmpty()) {
                open.push(element);
                result.add(element);
            } else if (atMost(rank, rankOf(open.peekLast(), config))) {
                open.clear();
                open.push(element);
                result.add(element);
            } else if (greater(rank, rankOf(open.peek(), config))) {
                open.peek().children().add(element);
                open.push(element);
            } else {
                while (open.size() > 1 && atLeast(rankOf(open.peek(), config), rank)) {
                    open.pop();
                }
                open.peek().children().add(element);
                open.push(element);
            }
        }
        return result;
    }

    static Integer rankOf(OutlineElement element, StructureConfig config) {
        return element.isSectionBearing() ? config.rankOf(element.name()) : null;
    }

    private static boolean atMost(Integer a, Integer b) {
        return a != null && b != null && a <= b;
    }

    private static boolean atLeast(Integer a, Integer b) {
        return a != null && b != null && a >= b;
    }

    private static boolean greater(Integer a, Integer b) {
        return a != null && b != null && a > b;
    }
}
