package com.viewsync.generator;

import com.viewsync.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Entry point of the view binding generator: reads template outlines and writes view classes
 * with typed handles to their nodes, leaving hand-written members in place.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        CommandLine commandLine = new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setUsageHelpAutoWidth(true);
        System.exit(commandLine.execute(args));
    }
}
