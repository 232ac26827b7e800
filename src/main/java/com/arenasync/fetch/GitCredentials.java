package com.arenasync.fetch;

public record GitCredentials(
        String username,
        String password,
        byte[] privateKey,
        String privateKeyPassword,
        byte[] knownHosts) {
    public GitCredentials {
        username = username == null ? "" : username;
        password = password == null ? "" : password;
        privateKey = privateKey == null ? new byte[0] : privateKey;
        privateKeyPassword = privateKeyPassword == null ? "" : privateKeyPassword;
        knownHosts = knownHosts == null ? new byte[0] : knownHosts;
    }

    public static GitCredentials none() {
        return new GitCredentials(null, null, null, null, null);
    }

    public boolean hasSshKey() {
        return privateKey.length > 0;
    }

    public boolean hasBasicAuth() {
        return !username.isEmpty() || !password.isEmpty();
    }

    @Override
    public String toString() {
        return "GitCredentials{username=" + username + ", sshKey=" + hasSshKey() + "}";
    }
}
