package com.arenasync.fetch;

public record RegistryCredentials(String username, String password, byte[] dockerConfig) {
    public RegistryCredentials {
        username = username == null ? "" : username;
        password = password == null ? "" : password;
        dockerConfig = dockerConfig == null ? new byte[0] : dockerConfig;
    }

    public static RegistryCredentials none() {
        return new RegistryCredentials(null, null, null);
    }

    public boolean hasBasicAuth() {
        return !username.isEmpty() || !password.isEmpty();
    }

    @Override
    public String toString() {
        return "RegistryCredentials{username=" + username + ", dockerConfig=" + (dockerConfig.length > 0) + "}";
    }
}
