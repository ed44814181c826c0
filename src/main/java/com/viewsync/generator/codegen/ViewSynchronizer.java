package com.viewsync.generator.codegen;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.viewsync.generator.attach.AssignmentStats;
import com.viewsync.generator.attach.AttachListener;
import com.viewsync.generator.attach.AttachRequest;
import com.viewsync.generator.attach.AttachState;
import com.viewsync.generator.attach.DeferredAttachService;
import com.viewsync.generator.attach.ReferenceAssigner;
import com.viewsync.generator.attach.TemplateRepository;
import com.viewsync.generator.codegen.config.BindingMode;
import com.viewsync.generator.codegen.config.GenerationSettings;
import com.viewsync.generator.codegen.util.FileWriteUtil;
import com.viewsync.generator.model.BindingDescriptor;
import com.viewsync.generator.model.ObjectNode;

/**
 * Generates, writes and attaches the views of a batch of roots.
 *
 * Each root is handled on its own: a failure is reported in that root's result and the batch
 * goes on. Artifacts are written to {@code outputDir/<package dirs>/<ClassName>.java} and only
 * when their content changed.
 */
public class ViewSynchronizer implements AttachListener {
    private static final Logger log = LoggerFactory.getLogger(ViewSynchronizer.class);

    private final ViewGenerator generator;
    private final GenerationSettings settings;
    private final Path outputDir;

    // Null when views are generated without attaching them
    private final DeferredAttachService attachService;
    private final ReferenceAssigner referenceAssigner;
    private final TemplateRepository templateRepository;

    public ViewSynchronizer(ViewGenerator generator, GenerationSettings settings, Path outputDir) {
        this(generator, settings, outputDir, null, null, null);
    }

    public ViewSynchronizer(ViewGenerator generator, GenerationSettings settings, Path outputDir,
                            DeferredAttachService attachService, ReferenceAssigner referenceAssigner,
                            TemplateRepository templateRepository) {
        this.generator = generator;
        this.settings = settings;
        this.outputDir = outputDir;
        this.attachService = attachService;
        this.referenceAssigner = referenceAssigner;
        this.templateRepository = templateRepository;
        if (attachService != null) {
            attachService.addListener(this);
        }
    }

    public List<GeneratorResult> synchronize(List<ObjectNode> roots) {
        return run(roots, true);
    }

    /**
     * Same as {@link #synchronize(List)} without writing or attaching anything.
     */
    public List<GeneratorResult> preview(List<ObjectNode> roots) {
        return run(roots, false);
    }

    private List<GeneratorResult> run(List<ObjectNode> roots, boolean write) {
        List<GeneratorResult> results = new ArrayList<>();
        for (ObjectNode root : roots) {
            try {
                results.add(synchronizeRoot(root, write));
            } catch (IOException e) {
                log.error("I/O failure while generating view for {}", root.getName(), e);
                results.add(GeneratorResult.failure(ErrorKind.IO_FAILURE, root.getName(), e.getMessage()));
            } catch (RuntimeException e) {
                log.error("Generation failed for {}", root.getName(), e);
                results.add(GeneratorResult.failure(ErrorKind.INTERNAL_ERROR, root.getName(), e.toString()));
            }
        }
        return results;
    }

    private GeneratorResult synchronizeRoot(ObjectNode root, boolean write) throws IOException {
        if (!generator.isValidClassName(root, settings)) {
            log.warn("Skipping root '{}': not a valid class name", root.getName());
            return GeneratorResult.invalidName(root.getName(), settings.isRequireUppercaseClassName());
        }

        Path artifactPath = artifactPathFor(root.getName());
        String existing = FileWriteUtil.readIfExists(artifactPath);
        GeneratorResult result = generator.generate(root, existing, settings);
        result.setArtifactPath(artifactPath);
        if (!result.isSuccess()) {
            return result;
        }

        if (!write) {
            return result;
        }

        boolean written = FileWriteUtil.writeIfChanged(artifactPath, result.getGeneratedText());
        result.setArtifactChanged(written);
        if (written) {
            log.info("{} {}", result.isArtifactCreated() ? "Created" : "Updated", artifactPath);
        } else {
            log.info("Unchanged {}", artifactPath);
        }

        if (settings.isAttachAfterGenerate() && attachService != null) {
            String typeName = settings.qualify(result.getClassName());
            AttachState state = attachService.requestAttach(root, typeName, artifactPath.toString());
            result.setAttachState(state);
            if (state == AttachState.APPLIED) {
                assignReferences(root, typeName, result.getFields()).ifPresent(result::setAssignmentStats);
            }
        }
        return result;
    }

    /**
     * A queued view became loadable on reload: assign its references now.
     */
    @Override
    public void onAttached(AttachRequest request) {
        if (templateRepository == null) {
            return;
        }
        Optional<ObjectNode> root = templateRepository.open(request.getRootIdentity());
        if (root.isEmpty()) {
            log.warn("Attached root {} can no longer be opened", request.getRootIdentity());
            return;
        }
        List<BindingDescriptor> fields = generator.collectFields(root.get(), settings);
        assignReferences(root.get(), request.getTypeName(), fields);
    }

    private Optional<AssignmentStats> assignReferences(ObjectNode root, String typeName,
                                                       List<BindingDescriptor> fields) {
        if (settings.getBindingMode() != BindingMode.DECLARATIVE_REFERENCE || referenceAssigner == null) {
            return Optional.empty();
        }
        return Optional.of(referenceAssigner.assign(root, typeName, fields));
    }

    public Path artifactPathFor(String className) {
        Path dir = outputDir;
        if (settings.hasNamespace()) {
            for (String segment : settings.getNamespace().trim().split("\\.")) {
                dir = dir.resolve(segment);
            }
        }
        return dir.resolve(className + ".java");
    }
}
