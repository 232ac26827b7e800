package com.arenasync.fetch;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.arenasync.source.SecretReference;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CredentialLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadBasicAuthFromStringData() throws Exception {
        writeSecret("team", "git-https", """
                stringData:
                  username: deploy
                  password: s3cret
                """);

        GitCredentials credentials = loader().loadGitCredentials("team", new SecretReference("git-https"));

        assertTrue(credentials.hasBasicAuth());
        assertFalse(credentials.hasSshKey());
        assertEquals("deploy", credentials.username());
        assertEquals("s3cret", credentials.password());
        assertFalse(credentials.toString().contains("s3cret"));
    }

    @Test
    void shouldDecodeBase64DataAndFallBackToIdentityKey() throws Exception {
        String key = Base64.getEncoder().encodeToString("-----BEGIN KEY-----".getBytes(StandardCharsets.UTF_8));
        String hosts = Base64.getEncoder().encodeToString("github.com ssh-ed25519 AAAA".getBytes(StandardCharsets.UTF_8));
        writeSecret("team", "git-ssh", """
                data:
                  identity: %s
                  known_hosts: %s
                stringData:
                  ssh-privatekey-password: phrase
                """.formatted(key, hosts));

        GitCredentials credentials = loader().loadGitCredentials("team", new SecretReference("git-ssh"));

        assertTrue(credentials.hasSshKey());
        assertArrayEquals("-----BEGIN KEY-----".getBytes(StandardCharsets.UTF_8), credentials.privateKey());
        assertEquals("github.com ssh-ed25519 AAAA", new String(credentials.knownHosts(), StandardCharsets.UTF_8));
        assertEquals("phrase", credentials.privateKeyPassword());
        assertEquals("", credentials.username());
    }

    @Test
    void shouldLoadRegistryDockerConfig() throws Exception {
        writeSecret("team", "registry", """
                stringData:
                  .dockerconfigjson: '{"auths":{"ghcr.io":{"auth":"dXNlcjpwYXNz"}}}'
                """);

        RegistryCredentials credentials = loader().loadRegistryCredentials("team", new SecretReference("registry"));

        assertFalse(credentials.hasBasicAuth());
        assertTrue(new String(credentials.dockerConfig(), StandardCharsets.UTF_8).contains("ghcr.io"));
    }

    @Test
    void shouldReturnEmptyCredentialsWithoutReference() throws Exception {
        GitCredentials credentials = loader().loadGitCredentials("team", null);

        assertFalse(credentials.hasBasicAuth());
        assertFalse(credentials.hasSshKey());
        assertEquals(0, loader().loadRegistryCredentials("team", new SecretReference(" ")).dockerConfig().length);
    }

    @Test
    void shouldFailWhenSecretIsMissing() {
        FetchException error = assertThrows(FetchException.class,
                () -> loader().loadGitCredentials("team", new SecretReference("absent")));

        assertEquals("secret team/absent not found", error.getMessage());
    }

    private CredentialLoader loader() {
        return new CredentialLoader(new YamlSecretStore(tempDir));
    }

    private void writeSecret(String namespace, String name, String content) throws Exception {
        Path file = tempDir.resolve(namespace).resolve(name + ".yaml");
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
