package com.viewsync.generator.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.viewsync.generator.attach.AssignmentStatsStore;
import com.viewsync.generator.attach.DeferredAttachService;
import com.viewsync.generator.attach.PendingAttachQueue;
import com.viewsync.generator.attach.ReferenceAssigner;
import com.viewsync.generator.attach.host.InMemorySessionStore;
import com.viewsync.generator.attach.host.InMemoryTemplateRepository;
import com.viewsync.generator.attach.host.ManualReloadSignal;
import com.viewsync.generator.attach.host.ReflectiveTypeRegistry;
import com.viewsync.generator.cli.exception.OptionsValidationException;
import com.viewsync.generator.cli.model.GenerateOptions;
import com.viewsync.generator.cli.model.ValidatedGenerateOptions;
import com.viewsync.generator.cli.output.GenerateResultsPrinter;
import com.viewsync.generator.cli.validation.GenerateOptionsValidator;
import com.viewsync.generator.codegen.GeneratorResult;
import com.viewsync.generator.codegen.ViewGenerator;
import com.viewsync.generator.codegen.ViewSynchronizer;
import com.viewsync.generator.codegen.config.GenerationSettings;
import com.viewsync.generator.model.ObjectNode;
import com.viewsync.generator.template.TemplateDocument;
import com.viewsync.generator.template.TemplateOutlineParser;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that generates or refreshes the view classes of template outlines.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "view-binding-generator 1.0.0",
        description = "Generates view classes with typed handles to the nodes of template outlines, keeping hand-written code intact."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedGenerateOptions validated = validator.validate(options);
            printer.printBanner(options, validated);
            GenerationSettings settings = validated.getSettings();

            InMemoryTemplateRepository templates = new InMemoryTemplateRepository();
            List<ObjectNode> roots = loadRoots(validated.getOutlineFiles(), templates);
            if (roots == null) {
                return 1;
            }
            if (roots.isEmpty()) {
                log.error("No template roots to generate");
                return 1;
            }

            ViewGenerator generator = new ViewGenerator();
            if (options.isListFields()) {
                for (ObjectNode root : roots) {
                    printer.printFields(root.getName(), generator.collectFields(root, settings));
                }
                return 0;
            }

            ViewSynchronizer synchronizer = createSynchronizer(generator, settings, validated.getNormalizedOutputDir(),
                    templates);
            List<GeneratorResult> results = options.isDryRun()
                    ? synchronizer.preview(roots)
                    : synchronizer.synchronize(roots);
            printer.printResults(results, options.isDryRun());

            return results.stream().allMatch(GeneratorResult::isSuccess) ? 0 : 1;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return 1;
        }
    }

    /**
     * @return the selected roots, or null if an outline could not be parsed
     */
    private List<ObjectNode> loadRoots(List<Path> outlineFiles, InMemoryTemplateRepository templates)
            throws IOException {
        TemplateOutlineParser parser = new TemplateOutlineParser();
        List<ObjectNode> roots = new ArrayList<>();
        for (Path file : outlineFiles) {
            TemplateDocument doc = parser.parse(file);
            if (doc.hasErrors()) {
                log.error("Cannot use {}", file);
                printer.printOutlineErrors(doc.getErrors());
                return null;
            }
            for (ObjectNode root : doc.getRoots()) {
                if (options.getRoots().isEmpty() || options.getRoots().contains(root.getName())) {
                    templates.register(file.toAbsolutePath().normalize() + "#" + root.getName(), root);
                    roots.add(root);
                }
            }
        }
        return roots;
    }

    private ViewSynchronizer createSynchronizer(ViewGenerator generator, GenerationSettings settings, Path outputDir,
                                                InMemoryTemplateRepository templates) {
        if (!settings.isAttachAfterGenerate()) {
            return new ViewSynchronizer(generator, settings, outputDir);
        }
        List<String> searchPackages = settings.hasNamespace() ? List.of(settings.getNamespace().trim()) : List.of();
        ReflectiveTypeRegistry types = new ReflectiveTypeRegistry(Thread.currentThread().getContextClassLoader(),
                searchPackages);
        DeferredAttachService attachService = new DeferredAttachService(types, templates,
                new PendingAttachQueue(new InMemorySessionStore()), new ManualReloadSignal());
        ReferenceAssigner assigner = new ReferenceAssigner(templates, types, new AssignmentStatsStore(), settings);
        return new ViewSynchronizer(generator, settings, outputDir, attachService, assigner, templates);
    }
}
