package com.viewsync.generator.cli.output;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.viewsync.generator.attach.AssignmentStats;
import com.viewsync.generator.attach.AttachState;
import com.viewsync.generator.cli.model.GenerateOptions;
import com.viewsync.generator.cli.model.ValidatedGenerateOptions;
import com.viewsync.generator.codegen.GeneratorResult;
import com.viewsync.generator.codegen.config.GenerationSettings;
import com.viewsync.generator.model.BindingDescriptor;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution, no prompting.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        GenerationSettings s = v.getSettings();
        log.info("=================================================");
        log.info("View Binding Generator");
        log.info("=================================================");
        log.info("Outline Files: {}", v.getOutlineFiles());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("Namespace: {}", s.hasNamespace() ? s.getNamespace() : "None");
        log.info("Base Type: {}", s.hasBaseType() ? s.getBaseType() : "None");
        log.info("Binding Mode: {}", s.getBindingMode());
        log.info("Auto-include: common={}, extended={}", s.isAutoIncludeCommonControls(),
                s.isAutoIncludeExtendedControls());
        log.info("Properties: {}", s.isGenerateProperties());
        if (o.isDryRun()) {
            log.info("Dry run: no files are written");
        }
        log.info("=================================================");
    }

    public void printOutlineErrors(List<String> errors) {
        log.error("Template outline has {} error(s):", errors.size());
        for (String error : errors) {
            log.error("  {}", error);
        }
    }

    public void printFields(String rootName, List<BindingDescriptor> fields) {
        log.info("{} ({} field(s))", rootName, fields.size());
        for (BindingDescriptor f : fields) {
            log.info("  {} {} <- {}{}", f.getTypeName(), f.getFieldName(),
                    f.isRoot() ? "<root>" : f.getPathString(),
                    f.isCapabilityReference() ? " #" + f.getCapabilityIndex() : "");
        }
    }

    public void printResults(List<GeneratorResult> results, boolean dryRun) {
        log.info("");
        log.info("=================================================");
        log.info(dryRun ? "DRY RUN SUMMARY" : "GENERATION SUMMARY");
        log.info("=================================================");
        for (GeneratorResult result : results) {
            if (result.isSuccess()) {
                printSuccess(result, dryRun);
            } else {
                printFailure(result);
            }
        }
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        log.info("");
        log.info("Roots: {}, failed: {}", results.size(), failed);
        log.info("=================================================");
    }

    private void printSuccess(GeneratorResult result, boolean dryRun) {
        String status;
        if (!result.isArtifactChanged()) {
            status = "unchanged";
        } else if (result.isArtifactCreated()) {
            status = dryRun ? "would be created" : "created";
        } else {
            status = dryRun ? "would be updated" : "updated";
        }
        log.info("{}: {} ({} field(s)) -> {}", result.getClassName(), status, result.getFieldCount(),
                result.getArtifactPath());
        if (!result.getRecoveredRegions().isEmpty()) {
            log.info("  Re-inserted regions: {}", result.getRecoveredRegions());
        }
        if (result.getAttachState() == AttachState.QUEUED) {
            log.info("  Attach queued: the view is attached once its compiled class can be loaded");
        }
        AssignmentStats stats = result.getAssignmentStats();
        if (stats != null) {
            log.info("  References: {}/{} assigned, {} missing path, {} missing capability", stats.getSuccess(),
                    stats.getTotal(), stats.getMissingPath(), stats.getMissingCapability());
        }
    }

    public void printFailure(GeneratorResult result) {
        log.error("{}: {} - {}", result.getClassName(), result.getErrorKind(), result.getErrorMessage());
    }
}
