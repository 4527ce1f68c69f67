package com.foreman.core.worktree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link WorktreeResolver} backed by the git CLI.
 * <p>
 * The primary branch is cached per project for a short time because the scheduler
 * asks for it on every capacity check.
 */
public class GitWorktreeResolver implements WorktreeResolver {

    private static final Logger log = LoggerFactory.getLogger(GitWorktreeResolver.class);

    private static final Duration PRIMARY_BRANCH_TTL = Duration.ofSeconds(30);
    private static final String WORKTREE_PREFIX = "worktree ";
    private static final String BRANCH_PREFIX = "branch refs/heads/";

    private record CachedBranch(String branch, Instant resolvedAt) {}

    private final GitCli git;
    private final ConcurrentHashMap<String, CachedBranch> primaryBranches = new ConcurrentHashMap<>();

    public GitWorktreeResolver(GitCli git) {
        this.git = git;
    }

    @Override
    public String getPrimaryBranch(String projectPath) {
        CachedBranch cached = primaryBranches.get(projectPath);
        if (cached != null && cached.resolvedAt().plus(PRIMARY_BRANCH_TTL).isAfter(Instant.now())) {
            return cached.branch();
        }
        String branch = resolvePrimaryBranch(projectPath);
        primaryBranches.put(projectPath, new CachedBranch(branch, Instant.now()));
        return branch;
    }

    private String resolvePrimaryBranch(String projectPath) {
        Path dir = Path.of(projectPath);
        if (!Files.isDirectory(dir)) {
            return null;
        }
        try {
            var result = git.runGitOutput(dir, "rev-parse", "--abbrev-ref", "HEAD");
            String branch = result.output().trim();
            if (!result.succeeded() || branch.isEmpty() || "HEAD".equals(branch)) {
                return null;
            }
            return branch;
        } catch (IllegalStateException e) {
            log.warn("Could not resolve primary branch of {}: {}", projectPath, e.getMessage());
            return null;
        }
    }

    @Override
    public Optional<Path> findWorktreePath(String projectPath, String branchName) {
        if (branchName == null) {
            return Optional.of(Path.of(projectPath));
        }
        var result = git.runGitOutput(Path.of(projectPath), "worktree", "list", "--porcelain");
        if (!result.succeeded()) {
            return Optional.empty();
        }
        return parseWorktreePath(result.output(), branchName);
    }

    static Optional<Path> parseWorktreePath(String porcelain, String branchName) {
        String currentPath = null;
        for (String line : porcelain.split("\n")) {
            if (line.startsWith(WORKTREE_PREFIX)) {
                currentPath = line.substring(WORKTREE_PREFIX.length()).trim();
            } else if (line.startsWith(BRANCH_PREFIX) && currentPath != null) {
                String branch = line.substring(BRANCH_PREFIX.length()).trim();
                if (branch.equals(branchName)) {
                    return Optional.of(Path.of(currentPath));
                }
            } else if (line.isBlank()) {
                currentPath = null;
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean branchExists(String projectPath, String branchName) {
        var result = git.runGitOutput(Path.of(projectPath),
                "rev-parse", "--verify", "--quiet", "refs/heads/" + branchName);
        return result.succeeded();
    }
}
