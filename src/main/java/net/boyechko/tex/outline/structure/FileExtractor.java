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

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import net.boyechko.tex.outline.ast.Argument;
import net.boyechko.tex.outline.ast.SourcePosition;
import net.boyechko.tex.outline.ast.TexNode;
import net.boyechko.tex.outline.core.ConstructionListener;
import net.boyechko.tex.outline.core.StructureConfig;
import net.boyechko.tex.outline.document.ElementKind;
import net.boyechko.tex.outline.document.FileStructureCache;
import net.boyechko.tex.outline.document.OutlineElement;
import net.boyechko.tex.outline.source.SourceAwaiter;
import net.boyechko.tex.outline.source.SourceEntry;
import net.boyechko.tex.outline.structure.ChildDirectiveScanner.ChildDirective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts the flat element forest of one file and, when sub-files are merged, of every file it
 * includes. Elements only nest where the parsed tree nests (an environment's body, for example);
 * sections are not yet related to each other.
 */
public class FileExtractor {
    private static final Logger logger = LoggerFactory.getLogger(FileExtractor.class);

    static final Set<String> INPUT_MACROS =
            Set.of(
                    "input",
                    "InputIfFileExists",
                    "include",
                    "SweaveInput",
                    "subfile",
                    "loadglsentries",
                    "markdownInput");
    static final Set<String> IMPORT_MACROS = Set.of("import", "inputfrom", "includefrom");
    static final Set<String> SUBIMPORT_MACROS =
            Set.of("subimport", "subinputfrom", "subincludefrom");

    /** Documentation blocks, labelled by the macro or environment they document. */
    static final Set<String> DOC_ENVIRONMENTS = Set.of("macro", "environment");

    static final Set<String> FLOAT_ENVIRONMENTS = Set.of("figure", "figure*", "table", "table*");

    static final String CHILD_DIRECTIVE_NAME = "RnwChild";

    private final SourceAwaiter awaiter;
    private final ConstructionListener listener;
    private final NodeRenderer renderer = new NodeRenderer();

    public FileExtractor(SourceAwaiter awaiter, ConstructionListener listener) {
        this.awaiter = awaiter;
        this.listener = listener;
    }

    /**
     * Extracts {@code file} into {@code cache}. Does nothing if the cache already has the file,
     * which also stops inclusion cycles.
     */
    public void extract(Path file, StructureConfig config, FileStructureCache cache) {
        Path filePath = file.toAbsolutePath().normalize();
        if (cache.contains(filePath)) {
            return;
        }
        cache.begin(filePath);

        Optional<SourceEntry> entry = awaiter.await(filePath);
        if (entry.isEmpty()) {
            logger.debug("No content available for {}", filePath);
            listener.onFileUnavailable(filePath, "content");
            cache.put(filePath, new ArrayList<>());
            return;
        }

        SourceEntry source = entry.get();
        List<ChildDirective> directives =
                ChildDirectiveScanner.scan(
                        source.content(),
                        IncludePathResolver.inputDirs(
                                filePath, config.rootFile(), config.searchDirs()));

        FileWalk walk = new FileWalk(filePath, config, cache, directives);
        List<OutlineElement> roots = new ArrayList<>();
        for (TexNode node : source.ast().content()) {
            walk.visit(node, roots);
        }
        walk.flushDirectives(roots);

        cache.put(filePath, roots);
        logger.debug("Extracted {} top-level elements from {}", roots.size(), filePath);
        listener.onFileExtracted(filePath, roots.size());
    }

    /** State of the walk over one file. */
    private final class FileWalk implements TexNode.Visitor<OutlineElement> {
        private final Path filePath;
        private final StructureConfig config;
        private final FileStructureCache cache;
        private final Deque<ChildDirective> pendingDirectives;

        FileWalk(
                Path filePath,
                StructureConfig config,
                FileStructureCache cache,
                List<ChildDirective> directives) {
            this.filePath = filePath;
            this.config = config;
            this.cache = cache;
            this.pendingDirectives = new ArrayDeque<>(directives);
        }

        void visit(TexNode node, List<OutlineElement> siblings) {
            OutlineElement element = node.accept(this);
            emitDirectivesBefore(node.position().startLine() - 1, siblings);

            List<OutlineElement> target = siblings;
            if (element != null) {
                siblings.add(element);
                target = element.children();
            }
            for (TexNode child : node.body()) {
                visit(child, target);
            }
        }

        private void emitDirectivesBefore(int line, List<OutlineElement> siblings) {
            while (!pendingDirectives.isEmpty() && pendingDirectives.peekFirst().line() <= line) {
                siblings.add(childElement(pendingDirectives.pollFirst()));
            }
        }

        void flushDirectives(List<OutlineElement> roots) {
            while (!pendingDirectives.isEmpty()) {
                roots.add(childElement(pendingDirectives.pollFirst()));
            }
        }

        private OutlineElement childElement(ChildDirective directive) {
            OutlineElement element =
                    new OutlineElement(
                            ElementKind.SUB_FILE,
                            CHILD_DIRECTIVE_NAME,
                            config.mergeSubFiles()
                                    ? directive.subFile().toString()
                                    : directive.rawPath(),
                            directive.offset(),
                            directive.line(),
                            directive.line(),
                            filePath);
            if (config.mergeSubFiles()) {
                extract(directive.subFile(), config, cache);
            }
            return element;
        }

        // ── Classification ─────────────────────────────────────────

        @Override
        public OutlineElement visitMacro(TexNode.Macro node) {
            String name = node.name();
            if (config.isSectionCommand(name)) {
                boolean starred = !node.arg(0).isEmpty();
                Argument title = node.arg(1).isEmpty() ? node.arg(2) : node.arg(1);
                return element(
                        starred ? ElementKind.SECTION_STARRED : ElementKind.SECTION,
                        name,
                        renderer.render(title),
                        node.position());
            }
            if (config.commandNames().contains(name)) {
                String argument = renderer.render(node.arg(1));
                return element(
                        ElementKind.COMMAND,
                        name,
                        "#" + name + (argument.isEmpty() ? "" : ": " + argument),
                        node.position());
            }
            if (INPUT_MACROS.contains(name)) {
                String input = renderer.render(node.arg(0));
                return subFile(
                        node,
                        input,
                        IncludePathResolver.resolve(
                                IncludePathResolver.inputDirs(
                                        filePath, config.rootFile(), config.searchDirs()),
                                input));
            }
            if (IMPORT_MACROS.contains(name)) {
                String dir = renderer.render(node.arg(0));
                String input = renderer.render(node.arg(1));
                return subFile(node, input, IncludePathResolver.resolve(importDirs(dir), input));
            }
            if (SUBIMPORT_MACROS.contains(name)) {
                String dir = renderer.render(node.arg(0));
                String input = renderer.render(node.arg(1));
                List<Path> fileDir = List.of(IncludePathResolver.parentOf(filePath));
                return subFile(
                        node, input, IncludePathResolver.resolve(fileDir, dir + "/" + input));
            }
            return null;
        }

        @Override
        public OutlineElement visitEnvironment(TexNode.Environment node) {
            String env = node.env();
            if (env.equals("frame")) {
                String caption = renderer.render(node.arg(3));
                if (caption.isEmpty()) {
                    caption =
                            findMacro(node.body(), "frametitle")
                                    .map(title -> renderer.render(title.arg(2)))
                                    .orElse("");
                }
                return element(
                        ElementKind.ENVIRONMENT, env, captioned(env, caption), node.position());
            }
            if (isFloat(env)) {
                if (!config.floatsEnabled()) {
                    return null;
                }
                String name = env.endsWith("*") ? env.substring(0, env.length() - 1) : env;
                String caption =
                        findMacro(node.body(), "caption")
                                .map(macro -> renderer.render(macro.arg(1)))
                                .orElse("");
                return element(
                        ElementKind.ENVIRONMENT, name, captioned(name, caption), node.position());
            }
            if (DOC_ENVIRONMENTS.contains(env)) {
                String documented =
                        node.body().stream()
                                .filter(n -> !(n instanceof TexNode.Whitespace))
                                .findFirst()
                                .filter(TexNode.Group.class::isInstance)
                                .map(group -> renderer.render(group.body()))
                                .orElse("");
                return element(
                        ElementKind.ENVIRONMENT, env, captioned(env, documented), node.position());
            }
            if (config.environmentNames().contains(env)) {
                return element(ElementKind.ENVIRONMENT, env, capitalize(env), node.position());
            }
            return null;
        }

        @Override
        public OutlineElement visitMathEnvironment(TexNode.MathEnvironment node) {
            if (config.environmentNames().contains(node.env())) {
                String env = node.env();
                return element(ElementKind.ENVIRONMENT, env, capitalize(env), node.position());
            }
            return null;
        }

        @Override
        public OutlineElement visitString(TexNode.Str node) {
            return null;
        }

        @Override
        public OutlineElement visitWhitespace(TexNode.Whitespace node) {
            return null;
        }

        @Override
        public OutlineElement visitParbreak(TexNode.Parbreak node) {
            return null;
        }

        @Override
        public OutlineElement visitComment(TexNode.Comment node) {
            return null;
        }

        @Override
        public OutlineElement visitVerbatimEnvironment(TexNode.VerbatimEnvironment node) {
            return null;
        }

        @Override
        public OutlineElement visitInlineMath(TexNode.InlineMath node) {
            return null;
        }

        @Override
        public OutlineElement visitDisplayMath(TexNode.DisplayMath node) {
            return null;
        }

        @Override
        public OutlineElement visitGroup(TexNode.Group node) {
            return null;
        }

        @Override
        public OutlineElement visitVerb(TexNode.Verb node) {
            return null;
        }

        // ── Helpers ────────────────────────────────────────────────

        private OutlineElement subFile(TexNode.Macro node, String input, Optional<Path> resolved) {
            if (resolved.isEmpty()) {
                return null;
            }
            Path subFile = resolved.get();
            OutlineElement element =
                    element(
                            ElementKind.SUB_FILE,
                            node.name(),
                            config.mergeSubFiles() ? subFile.toString() : input,
                            node.position());
            if (config.mergeSubFiles()) {
                extract(subFile, config, cache);
            }
            return element;
        }

        /** {@code \import{dir}{file}}: dir as given, then dir under the root file's directory. */
        private List<Path> importDirs(String dir) {
            List<Path> dirs = new ArrayList<>();
            Path root = config.rootDir();
            try {
                Path given = Path.of(dir);
                dirs.add(
                        given.isAbsolute()
                                ? given
                                : IncludePathResolver.parentOf(filePath).resolve(given));
                if (root != null) {
                    dirs.add(root.resolve(given));
                }
            } catch (InvalidPathException e) {
                logger.debug("Ignoring invalid import directory '{}' in {}", dir, filePath);
            }
            return dirs;
        }


        private String captioned(String name, String caption) {
            String label = capitalize(name);
            return config.captionsEnabled() && !caption.isEmpty() ? label + ": " + caption : label;
        }

        private OutlineElement element(
                ElementKind kind, String name, String label, SourcePosition position) {
            return new OutlineElement(
                    kind,
                    name,
                    label,
                    position.startOffset(),
                    position.startLine() - 1,
                    position.endLine() - 1,
                    filePath);
        }
    }

    /** Finds the first direct child macro named {@code name}. */
    private static Optional<TexNode.Macro> findMacro(List<TexNode> nodes, String name) {
        return nodes.stream()
                .filter(TexNode.Macro.class::isInstance)
                .map(TexNode.Macro.class::cast)
                .filter(macro -> macro.name().equals(name))
                .findFirst();
    }

    static boolean isFloat(String env) {
        return FLOAT_ENVIRONMENTS.contains(env);
    }

    static String capitalize(String name) {
        if (name.isEmpty()) {
            return name;
        }
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
