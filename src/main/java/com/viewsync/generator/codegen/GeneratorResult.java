package com.viewsync.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import com.viewsync.generator.attach.AssignmentStats;
import com.viewsync.generator.attach.AttachState;
import com.viewsync.generator.codegen.merge.Region;
import com.viewsync.generator.model.BindingDescriptor;

import lombok.Builder;
import lombok.Data;

/**
 * Result of generating the view of one root.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private ErrorKind errorKind;
    private String errorMessage;

    private String className;
    private Path artifactPath;
    private String generatedText;
    private boolean artifactChanged;
    private boolean artifactCreated;

    @Builder.Default
    private List<BindingDescriptor> fields = List.of();
    @Builder.Default
    private List<Region> recoveredRegions = List.of();

    // Only set when an attach was requested
    private AttachState attachState;
    // Only set in declarative reference mode once the view is attached
    private AssignmentStats assignmentStats;

    public int getFieldCount() {
        return fields.size();
    }

    public static GeneratorResult failure(ErrorKind errorKind, String className, String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorKind(errorKind)
                .className(className)
                .errorMessage(errorMessage)
                .build();
    }

    public static GeneratorResult invalidName(String className, boolean requireUppercase) {
        return failure(ErrorKind.INVALID_NAME, className,
                "Root name '" + className + "' is not a valid class name: it must start with a letter"
                        + " or underscore and contain only letters, digits and underscores"
                        + (requireUppercase ? ", with an uppercase first letter" : ""));
    }
}
