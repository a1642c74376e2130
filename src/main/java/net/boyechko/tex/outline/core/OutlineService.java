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
package net.boyechko.tex.outline.core;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.boyechko.tex.outline.document.FileStructureCache;
import net.boyechko.tex.outline.document.OutlineElement;
import net.boyechko.tex.outline.parse.LatexParser;
import net.boyechko.tex.outline.parse.MacroSignatures;
import net.boyechko.tex.outline.source.DocumentSource;
import net.boyechko.tex.outline.source.FileDocumentSource;
import net.boyechko.tex.outline.source.SourceAwaiter;
import net.boyechko.tex.outline.structure.FileExtractor;
import net.boyechko.tex.outline.structure.InclusionResolver;
import net.boyechko.tex.outline.structure.OutlineNumbering;
import net.boyechko.tex.outline.structure.TreeAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds the outline of a LaTeX document and the files it includes. */
public class OutlineService {
    private static final Logger logger = LoggerFactory.getLogger(OutlineService.class);

    private final DocumentSource source;
    private final LatexParser parser;
    private final OutlineSettings settings;
    private final ConstructionListener listener;
    private final Path rootFile;
    private final Duration waitDelay;
    private final int waitAttempts;

    public static class OutlineServiceBuilder {
        private DocumentSource source;
        private OutlineSettings settings;
        private ConstructionListener listener;
        private Path rootFile;
        private Duration waitDelay = SourceAwaiter.DEFAULT_DELAY;
        private int waitAttempts = SourceAwaiter.DEFAULT_MAX_ATTEMPTS;

        /** Source shared by every run. Without one, each run reads the files from disk afresh. */
        public OutlineServiceBuilder withSource(DocumentSource source) {
            this.source = source;
            return this;
        }

        public OutlineServiceBuilder withSettings(OutlineSettings settings) {
            this.settings = settings;
            return this;
        }

        public OutlineServiceBuilder withListener(ConstructionListener listener) {
            this.listener = listener;
            return this;
        }

        /** Root file used when {@link #construct()} is called without one. */
        public OutlineServiceBuilder withRootFile(Path rootFile) {
            this.rootFile = rootFile;
            return this;
        }

        public OutlineServiceBuilder withWait(Duration delay, int attempts) {
            if (attempts < 1) {
                throw new IllegalArgumentException("Wait attempts must be positive: " + attempts);
            }
            this.waitDelay = delay;
            this.waitAttempts = attempts;
            return this;
        }

        public OutlineService build() {
            return new OutlineService(this);
        }
    }

    private OutlineService(OutlineServiceBuilder builder) {
        this.settings = builder.settings != null ? builder.settings : OutlineSettings.loadDefault();
        this.source = builder.source;
        this.parser = new LatexParser(signaturesFor(settings));
        this.listener = new GuardedListener(builder.listener);
        this.rootFile = builder.rootFile;
        this.waitDelay = builder.waitDelay;
        this.waitAttempts = builder.waitAttempts;
    }

    /**
     * Parser signatures for the configured names. Section names without a built-in signature take
     * {@code *[short]{title}}; command names that are not section names take
     * {@code [optional]{argument}}.
     */
    public static MacroSignatures signaturesFor(OutlineSettings settings) {
        MacroSignatures defaults = MacroSignatures.defaults();
        Set<String> sectionNames = new HashSet<>();
        settings.sectionGroups().forEach(sectionNames::addAll);
        List<String> unknownSections =
                sectionNames.stream().filter(name -> !defaults.hasMacro(name)).toList();
        List<String> commands =
                settings.commandNames().stream()
                        .filter(name -> !sectionNames.contains(name))
                        .toList();
        return defaults.withSignature(unknownSections, MacroSignatures.SECTION_SIGNATURE)
                .withSignature(commands, MacroSignatures.COMMAND_SIGNATURE);
    }

    public List<OutlineElement> construct() {
        return construct(null, true);
    }

    public List<OutlineElement> construct(Path rootFile) {
        return construct(rootFile, true);
    }

    /**
     * Builds the outline of {@code rootFile}, or of the configured root file when it is null.
     *
     * @param includeSubFiles whether included files are extracted, spliced in and numbered; when
     *     false, inclusion directives stay as leaves labelled with their raw argument
     * @return the top-level outline elements, empty when there is no root file
     */
    public List<OutlineElement> construct(Path rootFile, boolean includeSubFiles) {
        Path root = rootFile != null ? rootFile : this.rootFile;
        if (root == null) {
            logger.debug("No root file; returning an empty outline");
            return new ArrayList<>();
        }
        root = root.toAbsolutePath().normalize();
        listener.onConstructionStart(root, includeSubFiles);

        StructureConfig config = StructureConfig.from(settings, includeSubFiles, root);
        DocumentSource runSource = source != null ? source : new FileDocumentSource(parser);
        SourceAwaiter awaiter = new SourceAwaiter(runSource, waitDelay, waitAttempts);
        FileStructureCache cache =
                new InclusionResolver(new FileExtractor(awaiter, listener)).resolve(root, config);

        List<OutlineElement> outline;
        if (includeSubFiles) {
            outline = TreeAssembler.spliceSubFiles(cache, root);
        } else {
            outline = new ArrayList<>();
            for (OutlineElement element : cache.get(root).orElse(List.of())) {
                outline.add(element.deepCopy());
            }
        }
        outline = TreeAssembler.nestNonSections(outline);
        outline = TreeAssembler.nestSections(outline, config);

        if (includeSubFiles && settings.floatNumbersEnabled()) {
            OutlineNumbering.addFloatNumbers(outline);
        }
        if (includeSubFiles && settings.sectionNumbersEnabled()) {
            OutlineNumbering.addSectionNumbers(outline, config);
        }

        listener.onConstructionComplete(root, cache.size(), outline.size());
        return outline;
    }

    /** Forwards to the configured listener; a failing listener is logged, never rethrown. */
    private static final class GuardedListener implements ConstructionListener {
        private final ConstructionListener delegate;

        GuardedListener(ConstructionListener delegate) {
            this.delegate = delegate != null ? delegate : new ConstructionListener() {};
        }

        @Override
        public void onConstructionStart(Path rootFile, boolean mergeSubFiles) {
            guard(() -> delegate.onConstructionStart(rootFile, mergeSubFiles));
        }

        @Override
        public void onFileExtracted(Path file, int elementCount) {
            guard(() -> delegate.onFileExtracted(file, elementCount));
        }

        @Override
        public void onFileUnavailable(Path file, String missing) {
            guard(() -> delegate.onFileUnavailable(file, missing));
        }

        @Override
        public void onConstructionComplete(Path rootFile, int fileCount, int topLevelCount) {
            guard(() -> delegate.onConstructionComplete(rootFile, fileCount, topLevelCount));
        }

        private static void guard(Runnable call) {
            try {
                call.run();
            } catch (RuntimeException e) {
                logger.warn("Construction listener failed: {}", e.getMessage(), e);
            }
        }
    }
}
