package com.arenasync.fetch;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Base64;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arenasync.source.RegistrySource;
import com.arenasync.source.SourceType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.Call;
import okhttp3.Credentials;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Pulls content published as an OCI artifact through the registry distribution API.
 */
public class RegistryFetcher implements Fetcher {
    private static final Logger log = LoggerFactory.getLogger(RegistryFetcher.class);

    static final String OCI_MANIFEST = "application/vnd.oci.image.manifest.v1+json";
    static final String OCI_INDEX = "application/vnd.oci.image.index.v1+json";
    static final String DOCKER_MANIFEST = "application/vnd.docker.distribution.manifest.v2+json";
    static final String DOCKER_MANIFEST_LIST = "application/vnd.docker.distribution.manifest.list.v2+json";
    static final String TITLE_ANNOTATION = "org.opencontainers.image.title";
    private static final String MANIFEST_ACCEPT = String.join(", ", OCI_MANIFEST, OCI_INDEX, DOCKER_MANIFEST, DOCKER_MANIFEST_LIST);
    private static final String DIGEST_HEADER = "Docker-Content-Digest";
    private static final Pattern CHALLENGE_PARAM = Pattern.compile("(\\w+)=\"([^\"]*)\"");

    private final RegistrySource source;
    private final String namespace;
    private final FetchOptions options;
    private final CredentialLoader credentialLoader;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock;

    public RegistryFetcher(
            RegistrySource source,
            String namespace,
            FetchOptions options,
            CredentialLoader credentialLoader,
            OkHttpClient httpClient) {
        this(source, namespace, options, credentialLoader, httpClient, Clock.systemUTC());
    }

    RegistryFetcher(
            RegistrySource source,
            String namespace,
            FetchOptions options,
            CredentialLoader credentialLoader,
            OkHttpClient httpClient,
            Clock clock) {
        this.source = source;
        this.namespace = namespace;
        this.options = options;
        this.credentialLoader = credentialLoader;
        this.httpClient = httpClient;
        this.clock = clock;
    }

    @Override
    public SourceType type() {
        return SourceType.REGISTRY;
    }

    @Override
    public String latestRevision(FetchContext context) throws FetchException {
        context.checkCanceled();
        RegistryReference ref = RegistryReference.parse(source.url());
        if (ref.pinnedByDigest()) {
            return ref.digest();
        }
        RegistrySession session = openSession(context, ref);
        try (Response response = session.execute(manifestRequest(ref, ref.tag()).head().build())) {
            String digest = response.header(DIGEST_HEADER);
            if (response.isSuccessful() && digest != null && !digest.isBlank()) {
                return digest.strip();
            }
            log.debug("registry.head.fallback registry={} repository={} status={}", ref.registry(), ref.repository(), response.code());
        }
        try (Response response = session.execute(manifestRequest(ref, ref.tag()).get().build())) {
            byte[] body = successfulBody(response, "failed to get image manifest");
            String digest = response.header(DIGEST_HEADER);
            return digest != null && !digest.isBlank() ? digest.strip() : "sha256:" + sha256Hex(body);
        }
    }

    @Override
    public Artifact fetch(FetchContext context, String revision) throws FetchException {
        context.checkCanceled();
        RegistryReference ref = RegistryReference.parse(source.url());
        String reference = revision != null && revision.startsWith("sha256:") ? revision : ref.reference();
        RegistrySession session = openSession(context, ref);

        Manifest manifest = loadManifest(session, ref, reference);
        String digest = reference.startsWith("sha256:") ? reference : manifest.digest();
        if (manifest.body().has("manifests")) {
            JsonNode first = manifest.body().path("manifests").path(0);
            if (first.isMissingNode() || first.path("digest").asText("").isEmpty()) {
                throw new FetchException("image index for " + source.url() + " lists no manifests");
            }
            manifest = loadManifest(session, ref, first.path("digest").asText());
        }
        JsonNode layers = manifest.body().path("layers");
        if (!layers.isArray() || layers.isEmpty()) {
            throw new FetchException("manifest for " + source.url() + " has no layers");
        }

        Path output = createTempDirectory("artifact-");
        try {
            for (JsonNode layer : layers) {
                context.checkCanceled();
                extractLayer(session, ref, layer, output);
            }
            String checksum = "sha256:" + DirectoryHasher.hash(output);
            long size = FileTrees.size(output);
            String label = revisionLabel(ref, digest);
            log.info("registry.fetch.complete url={} revision={} layers={} size={}", source.url(), label, layers.size(), size);
            return new Artifact(output, checksum, label, size, clock.instant());
        } catch (IOException e) {
            deleteQuietly(output, e);
            throw new FetchException("failed to extract OCI artifact " + source.url() + ": " + e.getMessage(), e);
        } catch (FetchException | RuntimeException e) {
            deleteQuietly(output, e);
            throw e;
        }
    }

    @Override
    public String revisionLabel(String revision) {
        try {
            return revisionLabel(RegistryReference.parse(source.url()), revision);
        } catch (FetchException e) {
            return revision;
        }
    }

    private static String revisionLabel(RegistryReference ref, String digest) {
        return ref.pinnedByDigest() ? digest : ref.tag() + "@" + digest;
    }

    private Manifest loadManifest(RegistrySession session, RegistryReference ref, String reference) throws FetchException {
        try (Response response = session.execute(manifestRequest(ref, reference).get().build())) {
            byte[] body = successfulBody(response, "failed to pull image manifest");
            JsonNode node = mapper.readTree(body);
            if (!node.isObject()) {
                throw new FetchException("manifest for " + source.url() + " is not a JSON object");
            }
            String digest = response.header(DIGEST_HEADER);
            return new Manifest(node, digest != null && !digest.isBlank() ? digest.strip() : "sha256:" + sha256Hex(body));
        } catch (IOException e) {
            throw new FetchException("failed to parse image manifest for " + source.url() + ": " + e.getMessage(), e);
        }
    }

    private void extractLayer(RegistrySession session, RegistryReference ref, JsonNode layer, Path output)
            throws IOException, FetchException {
        String digest = layer.path("digest").asText("");
        String mediaType = layer.path("mediaType").asText("");
        String title = layer.path("annotations").path(TITLE_ANNOTATION).asText("");
        Path blob = Files.createTempFile(options.workDir(), "oci-layer-", ".blob");
        try {
            download(session, ref, digest, blob);
            if (!mediaType.contains("tar") && !title.isEmpty()) {
                Path target = safeResolve(output, title);
                Files.createDirectories(target.getParent());
                Files.copy(blob, target, StandardCopyOption.REPLACE_EXISTING);
            } else {
                extractTar(blob, output);
            }
        } finally {
            Files.deleteIfExists(blob);
        }
    }

    private void download(RegistrySession session, RegistryReference ref, String digest, Path target)
            throws IOException, FetchException {
        if (digest.isEmpty()) {
            throw new FetchException("layer without digest in " + source.url());
        }
        HttpUrl url = baseUrl(ref).newBuilder()
                .addPathSegments("v2/" + ref.repository() + "/blobs/" + digest)
                .build();
        try (Response response = session.execute(new Request.Builder().url(url).get().build())) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new FetchException("failed to download layer " + digest + ": HTTP " + response.code());
            }
            MessageDigest sha = DirectoryHasher.sha256();
            try (InputStream in = new DigestInputStream(body.byteStream(), sha)) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            }
            String actual = "sha256:" + HexFormat.of().formatHex(sha.digest());
            if (digest.startsWith("sha256:") && !digest.equalsIgnoreCase(actual)) {
                throw new FetchException("layer digest mismatch: expected " + digest + " got " + actual);
            }
        }
    }

    static void extractTar(Path archive, Path output) throws IOException, FetchException {
        try (InputStream raw = new BufferedInputStream(Files.newInputStream(archive));
             InputStream in = isGzip(raw) ? new GzipCompressorInputStream(raw) : raw;
             TarArchiveInputStream tar = new TarArchiveInputStream(in)) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                String name = entry.getName();
                String baseName = name.endsWith("/") ? "" : name.substring(name.lastIndexOf('/') + 1);
                if (baseName.startsWith("._") || baseName.startsWith(".wh.")) {
                    continue;
                }
                Path target = safeResolve(output, name);
                if (target.equals(output)) {
                    continue;
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else if (entry.isSymbolicLink()) {
                    Path resolved = target.getParent().resolve(entry.getLinkName()).normalize();
                    if (!resolved.startsWith(output)) {
                        throw new FetchException("symlink escape attempt: " + name + " -> " + entry.getLinkName());
                    }
                    Files.createDirectories(target.getParent());
                    Files.deleteIfExists(target);
                    Files.createSymbolicLink(target, Path.of(entry.getLinkName()));
                } else if (entry.isFile()) {
                    Files.createDirectories(target.getParent());
                    Files.copy(tar, target, StandardCopyOption.REPLACE_EXISTING);
                    applyMode(target, entry.getMode());
                }
            }
        }
    }

    private static Path safeResolve(Path root, String name) throws FetchException {
        Path target = root.resolve(name.replace('\\', '/')).normalize();
        if (!target.startsWith(root)) {
            throw new FetchException("invalid tar path \"" + name + "\": escapes the artifact directory");
        }
        return target;
    }

    private static boolean isGzip(InputStream in) throws IOException {
        in.mark(2);
        int first = in.read();
        int second = in.read();
        in.reset();
        return first == 0x1f && second == 0x8b;
    }

    private static void applyMode(Path target, int mode) throws IOException {
        if (!Files.getFileStore(target).supportsFileAttributeView("posix")) {
            return;
        }
        Set<PosixFilePermission> permissions = EnumSet.noneOf(PosixFilePermission.class);
        PosixFilePermission[] bits = {
                PosixFilePermission.OTHERS_EXECUTE, PosixFilePermission.OTHERS_WRITE, PosixFilePermission.OTHERS_READ,
                PosixFilePermission.GROUP_EXECUTE, PosixFilePermission.GROUP_WRITE, PosixFilePermission.GROUP_READ,
                PosixFilePermission.OWNER_EXECUTE, PosixFilePermission.OWNER_WRITE, PosixFilePermission.OWNER_READ
        };
        for (int i = 0; i < bits.length; i++) {
            if ((mode & (1 << i)) != 0) {
                permissions.add(bits[i]);
            }
        }
        permissions.add(PosixFilePermission.OWNER_READ);
        permissions.add(PosixFilePermission.OWNER_WRITE);
        Files.setPosixFilePermissions(target, permissions);
    }

    private Request.Builder manifestRequest(RegistryReference ref, String reference) {
        HttpUrl url = baseUrl(ref).newBuilder()
                .addPathSegments("v2/" + ref.repository() + "/manifests/" + reference)
                .build();
        return new Request.Builder().url(url).header("Accept", MANIFEST_ACCEPT);
    }

    private HttpUrl baseUrl(RegistryReference ref) {
        return HttpUrl.get((source.insecure() ? "http://" : "https://") + ref.registry() + "/");
    }

    private byte[] successfulBody(Response response, String message) throws FetchException {
        ResponseBody body = response.body();
        if (!response.isSuccessful() || body == null) {
            throw new FetchException(message + " " + source.url() + ": HTTP " + response.code());
        }
        try {
            return body.bytes();
        } catch (IOException e) {
            throw new FetchException(message + " " + source.url() + ": " + e.getMessage(), e);
        }
    }

    private RegistrySession openSession(FetchContext context, RegistryReference ref) throws FetchException {
        RegistryCredentials credentials = credentialLoader.loadRegistryCredentials(namespace, source.secretRef());
        return new RegistrySession(context, ref, basicAuthorization(credentials, ref));
    }

    String basicAuthorization(RegistryCredentials credentials, RegistryReference ref) throws FetchException {
        if (credentials.hasBasicAuth()) {
            return Credentials.basic(credentials.username(), credentials.password(), StandardCharsets.UTF_8);
        }
        if (credentials.dockerConfig().length == 0) {
            return null;
        }
        JsonNode auths;
        try {
            auths = mapper.readTree(credentials.dockerConfig()).path("auths");
        } catch (IOException e) {
            throw new FetchException("invalid .dockerconfigjson: " + e.getMessage(), e);
        }
        for (String host : ref.credentialHosts()) {
            JsonNode entry = auths.path(host);
            if (entry.isMissingNode()) {
                continue;
            }
            String auth = entry.path("auth").asText("");
            if (!auth.isEmpty()) {
                String decoded = new String(Base64.getDecoder().decode(auth), StandardCharsets.UTF_8);
                int colon = decoded.indexOf(':');
                if (colon > 0) {
                    return Credentials.basic(decoded.substring(0, colon), decoded.substring(colon + 1), StandardCharsets.UTF_8);
                }
            }
            String username = entry.path("username").asText("");
            if (!username.isEmpty()) {
                return Credentials.basic(username, entry.path("password").asText(""), StandardCharsets.UTF_8);
            }
        }
        log.debug("registry.dockerconfig.nomatch registry={}", ref.registry());
        return null;
    }

    private Path createTempDirectory(String prefix) throws FetchException {
        try {
            Files.createDirectories(options.workDir());
            return Files.createTempDirectory(options.workDir(), prefix);
        } catch (IOException e) {
            throw new FetchException("failed to create output directory: " + e.getMessage(), e);
        }
    }

    private static void deleteQuietly(Path path, Exception primary) {
        try {
            FileTrees.deleteRecursively(path);
        } catch (IOException cleanup) {
            primary.addSuppressed(cleanup);
        }
    }

    private static String sha256Hex(byte[] body) {
        return HexFormat.of().formatHex(DirectoryHasher.sha256().digest(body));
    }

    private record Manifest(JsonNode body, String digest) {
    }

    /**
     * Authorization state for one fetch. A bearer token obtained from a challenge is reused for
     * every later request of the same operation.
     */
    final class RegistrySession {
        private final FetchContext context;
        private final RegistryReference ref;
        private final String basicAuthorization;
        private String bearerToken;

        RegistrySession(FetchContext context, RegistryReference ref, String basicAuthorization) {
            this.context = context;
            this.ref = ref;
            this.basicAuthorization = basicAuthorization;
        }

        Response execute(Request request) throws FetchException {
            Response response = call(authorize(request));
            if (response.code() != 401 || bearerToken != null) {
                return response;
            }
            String challenge = response.header("WWW-Authenticate");
            response.close();
            if (challenge == null || !challenge.regionMatches(true, 0, "Bearer", 0, "Bearer".length())) {
                throw new FetchException("registry " + ref.registry() + " rejected credentials: HTTP 401");
            }
            bearerToken = requestToken(challenge);
            return call(authorize(request));
        }

        private Request authorize(Request request) {
            if (bearerToken != null) {
                return request.newBuilder().header("Authorization", "Bearer " + bearerToken).build();
            }
            if (basicAuthorization != null) {
                return request.newBuilder().header("Authorization", basicAuthorization).build();
            }
            return request;
        }

        private String requestToken(String challenge) throws FetchException {
            String realm = null;
            String service = null;
            String scope = null;
            Matcher matcher = CHALLENGE_PARAM.matcher(challenge);
            while (matcher.find()) {
                String key = matcher.group(1).toLowerCase(Locale.ROOT);
                if (key.equals("realm")) {
                    realm = matcher.group(2);
                } else if (key.equals("service")) {
                    service = matcher.group(2);
                } else if (key.equals("scope")) {
                    scope = matcher.group(2);
                }
            }
            HttpUrl realmUrl = realm == null ? null : HttpUrl.parse(realm);
            if (realmUrl == null) {
                throw new FetchException("registry " + ref.registry() + " sent an unusable auth challenge: " + challenge);
            }
            HttpUrl.Builder tokenUrl = realmUrl.newBuilder();
            if (service != null) {
                tokenUrl.addQueryParameter("service", service);
            }
            tokenUrl.addQueryParameter("scope", scope != null ? scope : "repository:" + ref.repository() + ":pull");
            Request.Builder builder = new Request.Builder().url(tokenUrl.build()).get();
            if (basicAuthorization != null) {
                builder.header("Authorization", basicAuthorization);
            }
            try (Response response = call(builder.build())) {
                JsonNode token = mapper.readTree(successfulBody(response, "failed to obtain registry token for"));
                String value = token.path("token").asText(token.path("access_token").asText(""));
                if (value.isEmpty()) {
                    throw new FetchException("registry token response for " + ref.registry() + " carried no token");
                }
                return value;
            } catch (IOException e) {
                throw new FetchException("failed to parse registry token response: " + e.getMessage(), e);
            }
        }

        private Response call(Request request) throws FetchException {
            context.checkCanceled();
            Call call = httpClient.newCall(request);
            long remainingMs = context.remaining().toMillis();
            if (remainingMs > 0) {
                call.timeout().timeout(remainingMs, TimeUnit.MILLISECONDS);
            }
            try {
                return call.execute();
            } catch (IOException e) {
                context.checkCanceled();
                throw new FetchException("request to " + request.url().host() + " failed: " + e.getMessage(), e);
            }
        }
    }
}
