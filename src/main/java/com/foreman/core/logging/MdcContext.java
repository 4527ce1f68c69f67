package com.foreman.core.logging;

import com.foreman.core.model.PartitionKey;
import org.slf4j.MDC;

/**
 * Utility for managing Foreman-specific MDC keys for structured logging.
 */
public final class MdcContext {

    static final String MAIN_BRANCH = "__main__";

    private MdcContext() {}

    public static void setPartition(PartitionKey key) {
        MDC.put("projectPath", key.projectPath());
        MDC.put("branchName", key.branchName() != null ? key.branchName() : MAIN_BRANCH);
    }

    public static void setFeature(String projectPath, String branchName, String featureId) {
        MDC.put("projectPath", projectPath);
        MDC.put("branchName", branchName != null ? branchName : MAIN_BRANCH);
        MDC.put("featureId", featureId);
    }

    public static void clearFeature() {
        MDC.remove("featureId");
    }

    public static void clear() {
        MDC.remove("projectPath");
        MDC.remove("branchName");
        MDC.remove("featureId");
    }
}
