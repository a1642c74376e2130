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
package net.boyechko.tex.outline.ui.cli;

import ch.qos.logback.classic.Level;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import net.boyechko.tex.outline.core.OutlineService;
import net.boyechko.tex.outline.core.OutlineSettings;
import net.boyechko.tex.outline.core.VerbosityLevel;
import net.boyechko.tex.outline.document.OutlineElement;
import net.boyechko.tex.outline.ui.LoggingListener;
import net.boyechko.tex.outline.ui.OutlinePrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TexOutlineCLI {
    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Path rootFile,
            Path configPath,
            boolean includeSubFiles,
            boolean showLines,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (rootFile == null) {
                throw new IllegalArgumentException("Root file is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    public static void main(String[] args) {
        try {
            if (isHelpRequested(args)) {
                System.out.println(usageMessage());
                return;
            }
            CLIConfig config = parseArguments(args);
            configureLogging(config.verbosity());
            logger().info(
                            "Building outline of {} with verbosity level {}",
                            config.rootFile(),
                            config.verbosity());
            printOutline(config, System.out);
        } catch (CLIException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No root file specified\n" + usageMessage());
        }

        Path rootFile = null;
        Path configPath = null;
        boolean includeSubFiles = true;
        boolean showLines = false;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--config=")) {
                configPath = Paths.get(args[i].substring("--config=".length()));
            } else {
                switch (args[i]) {
                    case "-c", "--config" -> {
                        if (i + 1 < args.length) {
                            configPath = Paths.get(args[++i]);
                        } else {
                            throw new CLIException("Configuration file not specified after -c");
                        }
                    }
                    case "-q", "--quiet" -> verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> verbosity = VerbosityLevel.DEBUG;
                    case "--no-subfiles" -> includeSubFiles = false;
                    case "-l", "--lines" -> showLines = true;
                    default -> {
                        if (args[i].startsWith("-")) {
                            throw new CLIException("Unknown option: " + args[i]);
                        } else if (rootFile == null) {
                            rootFile = Paths.get(args[i]);
                        } else {
                            throw new CLIException("Multiple root files specified");
                        }
                    }
                }
            }
        }

        if (rootFile == null) {
            throw new CLIException("No root file specified");
        }
        if (!Files.isRegularFile(rootFile)) {
            throw new CLIException("File not found: " + rootFile);
        }
        if (configPath != null && !Files.isRegularFile(configPath)) {
            throw new CLIException("Configuration file not found: " + configPath);
        }
        return new CLIConfig(rootFile, configPath, includeSubFiles, showLines, verbosity);
    }

    private static void configureLogging(VerbosityLevel verbosity) {
        ch.qos.logback.classic.Logger root =
                (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.toLevel(verbosity.logLevel(), Level.WARN));
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(TexOutlineCLI.class);
        }
        return logger;
    }

    /** Builds the outline described by {@code config} and prints it to {@code out}. */
    static void printOutline(CLIConfig config, PrintStream out) throws CLIException {
        OutlineSettings settings;
        try {
            settings =
                    config.configPath() != null
                            ? OutlineSettings.fromFile(config.configPath())
                            : OutlineSettings.loadDefault();
        } catch (RuntimeException e) {
            throw new CLIException("Cannot load configuration: " + e.getMessage());
        }

        OutlineService service =
                new OutlineService.OutlineServiceBuilder()
                        .withSettings(settings)
                        .withListener(new LoggingListener())
                        .build();
        List<OutlineElement> outline =
                service.construct(config.rootFile(), config.includeSubFiles());
        if (outline.isEmpty()) {
            logger().info("No outline elements found in {}", config.rootFile());
        }
        out.print(OutlinePrinter.toIndentedTreeString(outline, config.showLines()));
        out.flush();
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    static String usageMessage() {
        return "Usage: java TexOutlineCLI [-q|-v|-vv] [--no-subfiles] [--config=<file>] [--lines]"
                + " <root.tex>\n"
                + "  -h, --help        Show this help message\n"
                + "  -q, --quiet       Only show errors\n"
                + "  -v, --verbose     Show construction progress\n"
                + "  -vv, --debug      Show all debug information\n"
                + "  --no-subfiles     Do not follow inclusion directives\n"
                + "  -c, --config      YAML settings file (also --config=<file>)\n"
                + "  -l, --lines       Show the source lines of each element\n"
                + "Examples:\n"
                + "  java TexOutlineCLI thesis.tex\n"
                + "  java TexOutlineCLI --no-subfiles --lines chapter1.tex\n"
                + "  java TexOutlineCLI --config=outline.yaml -v thesis.tex";
    }
}
