package com.arenasync.fetch;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arenasync.source.GitReference;
import com.arenasync.source.SourceType;
import com.arenasync.source.VersionControlSource;

/**
 * Fetches a git repository through the git command line. The upstream revision is resolved with
 * {@code ls-remote}; content is a shallow fetch of that commit copied out without {@code .git}.
 */
public class GitFetcher implements Fetcher {
    private static final Logger log = LoggerFactory.getLogger(GitFetcher.class);

    private static final int SHORT_SHA_LENGTH = 12;
    private static final Set<String> EXCLUDED = Set.of(".git");

    private final VersionControlSource source;
    private final String namespace;
    private final FetchOptions options;
    private final CredentialLoader credentialLoader;
    private final GitCommandRunner gitCommandRunner;

    public GitFetcher(
            VersionControlSource source,
            String namespace,
            FetchOptions options,
            CredentialLoader credentialLoader,
            GitCommandRunner gitCommandRunner) {
        this.source = source;
        this.namespace = namespace;
        this.options = options;
        this.credentialLoader = credentialLoader;
        this.gitCommandRunner = gitCommandRunner;
    }

    @Override
    public SourceType type() {
        return SourceType.VERSION_CONTROL;
    }

    @Override
    public String latestRevision(FetchContext context) throws FetchException {
        context.checkCanceled();
        GitReference ref = reference();
        if (!ref.commit().isEmpty()) {
            return ref.commit();
        }
        String refName = remoteRefName(ref);
        try (GitSession session = openSession()) {
            List<String> args = new ArrayList<>(List.of("ls-remote", source.url(), refName));
            if (!ref.tag().isEmpty()) {
                args.add(refName + "^{}");
            }
            String output = runGit(context, session, null, args);
            String resolved = null;
            for (String line : output.split("\\R")) {
                String[] parts = line.strip().split("\\s+");
                if (parts.length < 2) {
                    continue;
                }
                if (parts[1].endsWith("^{}")) {
                    resolved = parts[0];
                    break;
                }
                if (resolved == null) {
                    resolved = parts[0];
                }
            }
            if (resolved == null) {
                throw new FetchException("ref " + refName + " not found in " + source.url());
            }
            return resolved;
        }
    }

    @Override
    public Artifact fetch(FetchContext context, String revision) throws FetchException {
        context.checkCanceled();
        if (revision == null || revision.isBlank()) {
            throw new FetchException("git fetch requires a commit revision");
        }
        Path checkoutRoot = createTempDirectory("git-fetch-");
        try (GitSession session = openSession()) {
            Path repo = checkoutRoot.resolve("repo");
            runGit(context, session, null, List.of("init", "-q", repo.toString()));
            runGit(context, session, repo, List.of("remote", "add", "origin", source.url()));
            fetchRevision(context, session, repo, revision);
            runGit(context, session, repo, List.of("checkout", "-q", "--detach", revision));
            Instant committedAt = commitTime(context, session, repo);

            Path sourceDir = sourceDirectory(repo);
            Path output = createTempDirectory("artifact-");
            try {
                FileTrees.copyTree(sourceDir, output, EXCLUDED);
                context.checkCanceled();
                String checksum = "sha256:" + DirectoryHasher.hash(output);
                long size = FileTrees.size(output);
                log.info("git.fetch.complete url={} revision={} checksum={} size={}", source.url(), revision, checksum, size);
                return new Artifact(output, checksum, formatRevision(reference(), revision), size, committedAt);
            } catch (IOException e) {
                deleteQuietly(output, e);
                throw new FetchException("failed to prepare artifact from " + source.url() + ": " + e.getMessage(), e);
            } catch (FetchException | RuntimeException e) {
                deleteQuietly(output, e);
                throw e;
            }
        } finally {
            try {
                FileTrees.deleteRecursively(checkoutRoot);
            } catch (IOException e) {
                log.warn("git.fetch.cleanup.failed path={} reason={}", checkoutRoot, e.getMessage());
            }
        }
    }

    @Override
    public String revisionLabel(String revision) {
        return formatRevision(reference(), revision);
    }

    static String formatRevision(GitReference ref, String commitSha) {
        String shortSha = commitSha.length() > SHORT_SHA_LENGTH ? commitSha.substring(0, SHORT_SHA_LENGTH) : commitSha;
        if (!ref.branch().isEmpty()) {
            return ref.branch() + "@sha1:" + shortSha;
        }
        if (!ref.tag().isEmpty()) {
            return ref.tag() + "@sha1:" + shortSha;
        }
        return "sha1:" + shortSha;
    }

    private void fetchRevision(FetchContext context, GitSession session, Path repo, String revision) throws FetchException {
        GitCommandResult shallow = execute(context, session, repo, List.of("fetch", "-q", "--depth", "1", "origin", revision));
        if (shallow.isSuccess()) {
            return;
        }
        log.debug("git.fetch.shallow.unavailable url={} revision={} stderr={}", source.url(), revision, shallow.stderr());
        runGit(context, session, repo, List.of("fetch", "-q", "--tags", "origin"));
    }

    private Instant commitTime(FetchContext context, GitSession session, Path repo) throws FetchException {
        String output = runGit(context, session, repo, List.of("log", "-1", "--format=%ct"));
        try {
            return Instant.ofEpochSecond(Long.parseLong(output.strip()));
        } catch (NumberFormatException e) {
            return Instant.EPOCH;
        }
    }

    private Path sourceDirectory(Path repo) throws FetchException {
        String subPath = source.path() == null ? "" : source.path().strip();
        if (subPath.isEmpty() || subPath.equals(".") || subPath.equals("/")) {
            return repo;
        }
        Path resolved = repo.resolve(subPath).normalize();
        if (!resolved.startsWith(repo) || !Files.isDirectory(resolved)) {
            throw new FetchException("path " + subPath + " does not exist in repository");
        }
        return resolved;
    }

    private String runGit(FetchContext context, GitSession session, Path workingDirectory, List<String> args) throws FetchException {
        GitCommandResult result = execute(context, session, workingDirectory, args);
        if (!result.isSuccess()) {
            log.error("git command failed command='git {}' exitCode={} timedOut={} stderr={}",
                    args.get(0), result.exitCode(), result.timedOut(), result.stderr());
            throw new FetchException(result.describeFailure(args.get(0)) + " (" + source.url() + ")");
        }
        return result.stdout();
    }

    private GitCommandResult execute(FetchContext context, GitSession session, Path workingDirectory, List<String> args)
            throws FetchException {
        context.checkCanceled();
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(session.configArgs());
        command.addAll(args);
        GitCommandResult result = gitCommandRunner.run(workingDirectory, session.environment(), command);
        if (result.interrupted()) {
            throw new FetchException("fetch canceled: git " + args.get(0) + " interrupted");
        }
        context.checkCanceled();
        return result;
    }

    private GitSession openSession() throws FetchException {
        GitCredentials credentials = credentialLoader.loadGitCredentials(namespace, source.secretRef());
        GitSession session = new GitSession();
        try {
            if (credentials.hasSshKey()) {
                session.configureSsh(credentials, options.workDir());
            } else if (credentials.hasBasicAuth()) {
                String token = Base64.getEncoder().encodeToString(
                        (credentials.username() + ":" + credentials.password()).getBytes(StandardCharsets.UTF_8));
                session.configArgs.add("-c");
                session.configArgs.add("http.extraHeader=Authorization: Basic " + token);
            }
        } catch (IOException e) {
            session.close();
            throw new FetchException("failed to prepare git credentials: " + e.getMessage(), e);
        }
        return session;
    }

    private GitReference reference() {
        return source.ref() == null ? GitReference.none() : source.ref();
    }

    private static String remoteRefName(GitReference ref) {
        if (!ref.branch().isEmpty()) {
            return "refs/heads/" + ref.branch();
        }
        if (!ref.tag().isEmpty()) {
            return "refs/tags/" + ref.tag();
        }
        return "HEAD";
    }

    private Path createTempDirectory(String prefix) throws FetchException {
        try {
            Files.createDirectories(options.workDir());
            return Files.createTempDirectory(options.workDir(), prefix);
        } catch (IOException e) {
            throw new FetchException("failed to create temp dir: " + e.getMessage(), e);
        }
    }

    private static void deleteQuietly(Path path, Exception primary) {
        try {
            FileTrees.deleteRecursively(path);
        } catch (IOException cleanup) {
            primary.addSuppressed(cleanup);
        }
    }

    /**
     * Per-operation git configuration and the temporary credential files it references.
     */
    static final class GitSession implements AutoCloseable {
        private final List<String> configArgs = new ArrayList<>();
        private final Map<String, String> environment = new HashMap<>();
        private final List<Path> tempFiles = new ArrayList<>();

        List<String> configArgs() {
            return configArgs;
        }

        Map<String, String> environment() {
            return environment;
        }

        void configureSsh(GitCredentials credentials, Path workDir) throws IOException {
            Files.createDirectories(workDir);
            Path keyFile = privateFile(workDir, "ssh-key-", credentials.privateKey(), "rw-------");
            StringBuilder sshCommand = new StringBuilder("ssh -i ").append(keyFile).append(" -o IdentitiesOnly=yes");
            if (credentials.knownHosts().length > 0) {
                Path knownHosts = privateFile(workDir, "known-hosts-", credentials.knownHosts(), "rw-------");
                sshCommand.append(" -o StrictHostKeyChecking=yes -o UserKnownHostsFile=").append(knownHosts);
            } else {
                sshCommand.append(" -o StrictHostKeyChecking=no -o UserKnownHostsFile=/dev/null");
            }
            environment.put("GIT_SSH_COMMAND", sshCommand.toString());
            if (!credentials.privateKeyPassword().isEmpty()) {
                byte[] script = "#!/bin/sh\nprintf '%s\\n' \"$ARENA_SSH_KEY_PASSPHRASE\"\n".getBytes(StandardCharsets.UTF_8);
                Path askPass = privateFile(workDir, "ssh-askpass-", script, "rwx------");
                environment.put("SSH_ASKPASS", askPass.toString());
                environment.put("SSH_ASKPASS_REQUIRE", "force");
                environment.put("ARENA_SSH_KEY_PASSPHRASE", credentials.privateKeyPassword());
            }
        }

        private Path privateFile(Path workDir, String prefix, byte[] content, String permissions) throws IOException {
            Path file = Files.createTempFile(workDir, prefix, "");
            tempFiles.add(file);
            try {
                Files.setPosixFilePermissions(file, PosixFilePermissions.fromString(permissions));
            } catch (UnsupportedOperationException e) {
                log.debug("git.credentials.permissions.unsupported path={}", file);
            }
            Files.write(file, content);
            return file;
        }

        @Override
        public void close() {
            for (Path file : tempFiles) {
                try {
                    Files.deleteIfExists(file);
                } catch (IOException e) {
                    log.warn("git.credentials.cleanup.failed path={} reason={}", file, e.getMessage());
                }
            }
            tempFiles.clear();
        }
    }
}
