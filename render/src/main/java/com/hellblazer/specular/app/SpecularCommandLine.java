/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of Specular.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.specular.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line front end.
 *
 * <p>Modes:
 * <ul>
 *   <li>RENDER - load a JSON scene, ray trace it and write a PNG</li>
 *   <li>INSPECT - load a JSON scene and print a summary</li>
 *   <li>HELP - print usage</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public class SpecularCommandLine {
    private static final Logger log = LoggerFactory.getLogger(SpecularCommandLine.class);

    /**
     * Available operation modes.
     */
    public enum Mode {
        RENDER("render", "Ray trace a scene file to a PNG image"),
        INSPECT("inspect", "Load a scene file and print a summary"),
        HELP("help", "Show help information");

        private final String command;
        private final String description;

        Mode(String command, String description) {
            this.command = command;
            this.description = description;
        }

        public String getCommand() {
            return command;
        }

        public String getDescription() {
            return description;
        }

        public static Mode fromString(String s) {
            for (var mode : values()) {
                if (mode.command.equalsIgnoreCase(s)) {
                    return mode;
                }
            }
            return null;
        }
    }

    /**
     * Configuration holder for all command-line options. Unset numeric overrides keep the values from the render
     * settings resource.
     */
    public static class Config {
        public Mode mode = Mode.HELP;

        public String inputFile;
        public String outputFile;

        public Integer threads;
        public Integer maxBounces;
        public Double  shadowEpsilon;
        public Double  reflectionEpsilon;

        public boolean quiet = false;

        public List<String> getValidationErrors() {
            var errors = new ArrayList<String>();
            if (mode == Mode.HELP) {
                return errors;
            }
            if (inputFile == null) {
                errors.add(mode.getCommand() + " mode requires --input file");
            } else if (!Files.exists(Path.of(inputFile))) {
                errors.add("Input file does not exist: " + inputFile);
            }
            if (mode == Mode.RENDER && outputFile == null) {
                errors.add("Render mode requires --output file");
            }
            if (threads != null && threads < 1) {
                errors.add("Threads must be at least 1");
            }
            if (maxBounces != null && maxBounces < 0) {
                errors.add("Max bounces must be non-negative");
            }
            if (shadowEpsilon != null && !(shadowEpsilon >= 0.0)) {
                errors.add("Shadow epsilon must be non-negative");
            }
            if (reflectionEpsilon != null && !(reflectionEpsilon >= 0.0)) {
                errors.add("Reflection epsilon must be non-negative");
            }
            return errors;
        }

        public boolean isValid() {
            return getValidationErrors().isEmpty();
        }

        @Override
        public String toString() {
            return String.format("Config{mode=%s, input=%s, output=%s, threads=%s, bounces=%s}", mode, inputFile,
                                 outputFile, threads, maxBounces);
        }
    }

    /**
     * Parse command-line arguments into configuration.
     *
     * @throws NumberFormatException if a numeric option has a malformed value
     */
    public static Config parse(String[] args) {
        var config = new Config();

        if (args.length == 0) {
            return config;
        }

        config.mode = Mode.fromString(args[0]);
        if (config.mode == null) {
            if (!args[0].startsWith("-")) {
                log.warn("Unknown mode: {}. Use 'help' for available modes.", args[0]);
            }
            config.mode = Mode.HELP;
            return config;
        }

        for (int i = 1; i < args.length; i++) {
            var arg = args[i];

            switch (arg) {
                case "-i", "--input" -> {
                    if (i + 1 < args.length) {
                        config.inputFile = args[++i];
                    }
                }
                case "-o", "--output" -> {
                    if (i + 1 < args.length) {
                        config.outputFile = args[++i];
                    }
                }
                case "-t", "--threads" -> {
                    if (i + 1 < args.length) {
                        config.threads = Integer.parseInt(args[++i]);
                    }
                }
                case "-b", "--max-bounces" -> {
                    if (i + 1 < args.length) {
                        config.maxBounces = Integer.parseInt(args[++i]);
                    }
                }
                case "--shadow-epsilon" -> {
                    if (i + 1 < args.length) {
                        config.shadowEpsilon = Double.parseDouble(args[++i]);
                    }
                }
                case "--reflection-epsilon" -> {
                    if (i + 1 < args.length) {
                        config.reflectionEpsilon = Double.parseDouble(args[++i]);
                    }
                }
                case "-q", "--quiet" -> config.quiet = true;
                case "--help" -> config.mode = Mode.HELP;
                default -> {
                    if (arg.startsWith("-")) {
                        log.warn("Unknown option: {}", arg);
                    }
                }
            }
        }

        return config;
    }

    /**
     * Print usage information.
     */
    public static void printUsage(PrintStream out) {
        out.println("Specular - recursive ray tracer");
        out.println();
        out.println("Usage: specular <mode> [options]");
        out.println();
        out.println("Modes:");
        for (var mode : Mode.values()) {
            out.printf("  %-10s  %s%n", mode.getCommand(), mode.getDescription());
        }
        out.println();
        out.println("Options:");
        out.println("  -i, --input <file>           Scene file (JSON)");
        out.println("  -o, --output <file>          Output image (PNG, render mode)");
        out.println("  -t, --threads <n>            Worker threads (default: CPU cores)");
        out.println("  -b, --max-bounces <n>        Reflection bounce ceiling (default: 10)");
        out.println("  --shadow-epsilon <f>         Shadow ray minimum distance (default: 0.1)");
        out.println("  --reflection-epsilon <f>     Reflection ray minimum distance (default: 1e-4)");
        out.println("  -q, --quiet                  Suppress non-essential output");
        out.println("  --help                       Show this help message");
        out.println();
        out.println("Examples:");
        out.println("  specular render -i scene.json -o output.png");
        out.println("  specular render -i scene.json -o mirrors.png -b 4 -t 8");
        out.println("  specular inspect -i scene.json");
    }

    /**
     * Validate configuration and print any errors.
     */
    public static boolean validate(Config config, PrintStream out) {
        var errors = config.getValidationErrors();
        if (!errors.isEmpty()) {
            out.println("Configuration errors:");
            for (var error : errors) {
                out.println("  - " + error);
            }
            out.println();
            out.println("Use 'specular help' for usage information.");
            return false;
        }
        return true;
    }

    /**
     * Run the configured mode.
     *
     * @return process exit code
     */
    public static int run(Config config, PrintStream out, PrintStream err) {
        if (config.mode == Mode.HELP) {
            printUsage(out);
            return 0;
        }
        if (!validate(config, err)) {
            return 1;
        }
        if (!config.quiet) {
            log.info("Specular mode: {}", config.mode);
            log.info("Configuration: {}", config);
        }
        try {
            return switch (config.mode) {
                case RENDER -> new RenderMode(config, out).execute();
                case INSPECT -> new InspectMode(config, out).execute();
                case HELP -> {
                    printUsage(out);
                    yield 0;
                }
            };
        } catch (Exception e) {
            log.error("Error executing {}: {}", config.mode, e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Main entry point for CLI.
     */
    public static void main(String[] args) {
        Config config;
        try {
            config = parse(args);
        } catch (NumberFormatException e) {
            System.err.println("Error: invalid numeric option: " + e.getMessage());
            printUsage(System.err);
            System.exit(1);
            return;
        }
        System.exit(run(config, System.out, System.err));
    }
}
