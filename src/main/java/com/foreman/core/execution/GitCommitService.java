package com.foreman.core.execution;

import com.foreman.core.worktree.GitCli;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * {@link CommitService} that stages everything and commits with the git CLI.
 */
public class GitCommitService implements CommitService {

    private static final Logger log = LoggerFactory.getLogger(GitCommitService.class);

    private final GitCli git;

    public GitCommitService(GitCli git) {
        this.git = git;
    }

    @Override
    public boolean commit(Path workDir, String message) {
        var status = git.runGitOutput(workDir, "status", "--porcelain");
        if (!status.succeeded()) {
            throw new IllegalStateException("git status failed in " + workDir);
        }
        if (status.output().isBlank()) {
            log.info("No changes to commit in {}", workDir);
            return false;
        }
        if (git.runGit(workDir, "add", "-A") != 0) {
            throw new IllegalStateException("git add failed in " + workDir);
        }
        if (git.runGit(workDir, "commit", "-m", message) != 0) {
            throw new IllegalStateException("git commit failed in " + workDir);
        }
        log.info("Committed changes in {}", workDir);
        return true;
    }
}
