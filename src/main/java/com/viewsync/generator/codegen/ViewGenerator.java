package com.viewsync.generator.codegen;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.viewsync.generator.codegen.config.GenerationSettings;
import com.viewsync.generator.codegen.discovery.BindingDiscoveryService;
import com.viewsync.generator.codegen.merge.ArtifactMergeEngine;
import com.viewsync.generator.codegen.merge.MergeOutcome;
import com.viewsync.generator.codegen.naming.FieldNamingService;
import com.viewsync.generator.codegen.util.NamingUtil;
import com.viewsync.generator.model.BindingDescriptor;
import com.viewsync.generator.model.ObjectNode;

/**
 * Turns a template root into the source of its view class. Works on strings only; reading
 * and writing the artifact is up to the caller.
 */
public class ViewGenerator {
    private static final Logger log = LoggerFactory.getLogger(ViewGenerator.class);

    private final BindingDiscoveryService discoveryService;
    private final FieldNamingService namingService;
    private final ArtifactMergeEngine mergeEngine;

    public ViewGenerator() {
        this(new BindingDiscoveryService(), new FieldNamingService());
    }

    public ViewGenerator(BindingDiscoveryService discoveryService, FieldNamingService namingService) {
        this(discoveryService, namingService, new ArtifactMergeEngine(namingService));
    }

    public ViewGenerator(BindingDiscoveryService discoveryService, FieldNamingService namingService,
                         ArtifactMergeEngine mergeEngine) {
        this.discoveryService = discoveryService;
        this.namingService = namingService;
        this.mergeEngine = mergeEngine;
    }

    /**
     * The final field list of a root, without generating anything.
     */
    public List<BindingDescriptor> collectFields(ObjectNode root, GenerationSettings settings) {
        List<BindingDescriptor> descriptors = discoveryService.discover(root, settings);
        return namingService.rename(descriptors, settings);
    }

    public boolean isValidClassName(ObjectNode root, GenerationSettings settings) {
        return NamingUtil.isValidClassName(root.getName(), settings.isRequireUppercaseClassName());
    }

    /**
     * @param existingText current artifact content, null if there is none yet
     */
    public GeneratorResult generate(ObjectNode root, String existingText, GenerationSettings settings) {
        String className = root.getName();
        if (!isValidClassName(root, settings)) {
            log.warn("Skipping root '{}': not a valid class name", className);
            return GeneratorResult.invalidName(className, settings.isRequireUppercaseClassName());
        }

        List<BindingDescriptor> fields = collectFields(root, settings);
        log.debug("{}: {} field(s) discovered", className, fields.size());

        MergeOutcome outcome = mergeEngine.merge(existingText, className, fields, settings);
        if (!outcome.isClassFound()) {
            return GeneratorResult.failure(ErrorKind.MISSING_CLASS_DECLARATION, className,
                    "Existing artifact for " + className + " has no class declaration to update");
        }

        return GeneratorResult.builder()
                .success(true)
                .className(className)
                .generatedText(outcome.getText())
                .artifactChanged(outcome.isChanged())
                .artifactCreated(outcome.isCreated())
                .fields(fields)
                .recoveredRegions(outcome.getRecoveredRegions())
                .build();
    }
}
