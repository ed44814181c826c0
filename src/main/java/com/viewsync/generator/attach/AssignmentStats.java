package com.viewsync.generator.attach;

import lombok.Data;

/**
 * Outcome of one reference assignment pass. Reporting only.
 */
@Data
public class AssignmentStats {
    private int total;
    private int success;
    private int missingPath;
    private int missingCapability;
}
