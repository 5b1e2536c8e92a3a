package com.impact.apidiff.service;

import com.impact.apidiff.exception.ContentUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.errors.RevisionSyntaxException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectLoader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.eclipse.jgit.util.io.DisabledOutputStream;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads changed files and file contents straight from the object database of a local Git repository;
 * the working tree is never touched.
 */
@Slf4j
public class JGitRevisionContentProvider implements RevisionContentProvider {

    private static final Set<DiffEntry.ChangeType> ANALYZED_CHANGES = Set.of(
            DiffEntry.ChangeType.ADD,
            DiffEntry.ChangeType.MODIFY,
            DiffEntry.ChangeType.RENAME,
            DiffEntry.ChangeType.COPY);

    private final Git git;
    private final Repository repository;
    private final String baseRef;
    private final String headRef;
    private final FileSelection selection;

    // Revision string -> root tree id
    private final Map<String, ObjectId> trees = new ConcurrentHashMap<>();

    private JGitRevisionContentProvider(Git git, String baseRef, String headRef, FileSelection selection) {
        this.git = git;
        this.repository = git.getRepository();
        this.baseRef = baseRef;
        this.headRef = headRef;
        this.selection = selection;
    }

    /**
     * Opens the repository and verifies that both revisions resolve to commits.
     *
     * @throws ContentUnavailableException when the path is not a repository or a revision is unknown
     */
    public static JGitRevisionContentProvider open(Path repositoryPath,
                                                   String baseRef,
                                                   String headRef,
                                                   FileSelection selection) throws ContentUnavailableException {
        Git git;
        try {
            git = Git.open(repositoryPath.toFile());
        } catch (IOException e) {
            throw new ContentUnavailableException(
                    "Not a readable Git repository: " + repositoryPath.toAbsolutePath(), baseRef, e);
        }

        JGitRevisionContentProvider provider = new JGitRevisionContentProvider(git, baseRef, headRef, selection);
        try {
            provider.treeOf(baseRef);
            provider.treeOf(headRef);
        } catch (ContentUnavailableException e) {
            provider.close();
            throw e;
        }
        log.info("Opened repository {} comparing {}..{}", repositoryPath.toAbsolutePath(), baseRef, headRef);
        return provider;
    }

    @Override
    public List<String> changedFiles() throws ContentUnavailableException {
        ObjectId baseTree = treeOf(baseRef);
        ObjectId headTree = treeOf(headRef);

        List<String> changed = new ArrayList<>();
        try (DiffFormatter formatter = new DiffFormatter(DisabledOutputStream.INSTANCE)) {
            formatter.setRepository(repository);
            formatter.setDetectRenames(true);
            for (DiffEntry entry : formatter.scan(baseTree, headTree)) {
                String path = entry.getNewPath();
                if (!ANALYZED_CHANGES.contains(entry.getChangeType())) {
                    log.debug("Ignoring {} of {}", entry.getChangeType(), entry.getOldPath());
                } else if (isPythonSource(path) && selection.isSelected(path)) {
                    changed.add(path);
                    log.debug("Included changed file: {}", path);
                } else {
                    log.debug("Excluded changed file: {}", path);
                }
            }
        } catch (IOException e) {
            throw new ContentUnavailableException("Failed to diff " + baseRef + ".." + headRef, headRef, e);
        }

        log.info("Found {} changed Python file(s).", changed.size());
        return changed;
    }

    @Override
    public String contentAt(String filePath, String revision) throws ContentUnavailableException {
        ObjectId tree = treeOf(revision);
        try (TreeWalk walk = TreeWalk.forPath(repository, filePath, tree)) {
            if (walk == null) {
                log.trace("{} does not exist at {}", filePath, revision);
                return "";
            }
            ObjectLoader loader = repository.open(walk.getObjectId(0), Constants.OBJ_BLOB);
            return new String(loader.getBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ContentUnavailableException("Failed to read " + filePath + " at " + revision, revision, e);
        }
    }

    @Override
    public String baseRevision() {
        return baseRef;
    }

    @Override
    public String headRevision() {
        return headRef;
    }

    @Override
    public void close() {
        git.close();
    }

    private ObjectId treeOf(String revision) throws ContentUnavailableException {
        ObjectId cached = trees.get(revision);
        if (cached != null) {
            return cached;
        }
        try {
            ObjectId commitId = repository.resolve(revision + "^{commit}");
            if (commitId == null) {
                throw new ContentUnavailableException("Unknown revision: " + revision, revision);
            }
            try (RevWalk walk = new RevWalk(repository)) {
                RevCommit commit = walk.parseCommit(commitId);
                ObjectId tree = commit.getTree().getId();
                trees.put(revision, tree);
                return tree;
            }
        } catch (IOException | RevisionSyntaxException e) {
            throw new ContentUnavailableException("Cannot resolve revision: " + revision, revision, e);
        }
    }

    private static boolean isPythonSource(String path) {
        return path.endsWith(".py") || path.endsWith(".pyi");
    }
}
