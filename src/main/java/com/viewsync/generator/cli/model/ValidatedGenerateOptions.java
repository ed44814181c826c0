package com.viewsync.generator.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.viewsync.generator.codegen.config.GenerationSettings;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Options after validation: absolute output root, outline files that exist, and the
 * generation settings built from the flags.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    Path normalizedOutputDir;
    List<Path> outlineFiles;
    GenerationSettings settings;
}
