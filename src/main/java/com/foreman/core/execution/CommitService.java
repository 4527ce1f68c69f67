package com.foreman.core.execution;

import java.nio.file.Path;

@FunctionalInterface
public interface CommitService {

    /**
     * Commits all changes in {@code workDir}.
     *
     * @return true if a commit was created, false when there was nothing to commit
     */
    boolean commit(Path workDir, String message);
}
