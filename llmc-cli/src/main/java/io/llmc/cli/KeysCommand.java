package io.llmc.cli;

import io.llmc.core.auth.AuthCredential;
import io.llmc.core.auth.CredentialStore;
import io.llmc.core.auth.FileCredentialStore;
import io.llmc.core.config.ConfigPaths;
import io.llmc.core.config.model.LlmcConfig;
import io.llmc.core.error.ConfigException;
import io.llmc.core.runtime.LlmcRuntime;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(name = "keys", description = "Manage provider credentials")
public final class KeysCommand implements Runnable {
    private final CliContext context;

    @Spec
    CommandSpec spec;

    public KeysCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "set", description = "Store an API key sent as a bearer token")
    int set(
        @Parameters(index = "0", paramLabel = "PROVIDER") String provider,
        @Parameters(index = "1", paramLabel = "KEY") String key
    ) {
        return store("set", provider, new AuthCredential.ApiKeyBearer(key));
    }

    @Command(name = "header", description = "Store a key sent in a custom header, e.g. x-api-key")
    int header(
        @Parameters(index = "0", paramLabel = "PROVIDER") String provider,
        @Parameters(index = "1", paramLabel = "HEADER") String header,
        @Parameters(index = "2", paramLabel = "VALUE") String value
    ) {
        return store("header", provider, new AuthCredential.CustomHeader(header, value));
    }

    @Command(name = "oauth", description = "Store an OAuth bearer token")
    int oauth(
        @Parameters(index = "0", paramLabel = "PROVIDER") String provider,
        @Parameters(index = "1", paramLabel = "TOKEN") String token,
        @Option(names = "--expires-at", description = "Expiry as an ISO-8601 instant") Instant expiresAt
    ) {
        return store("oauth", provider, new AuthCredential.OAuthToken(token, expiresAt));
    }

    @Command(name = "service-account", description = "Store a service account JSON key file")
    int serviceAccount(
        @Parameters(index = "0", paramLabel = "PROVIDER") String provider,
        @Parameters(index = "1", paramLabel = "FILE") Path file
    ) {
        try {
            LlmcConfig config = context.loadConfig();
            try (LlmcRuntime runtime = context.openRuntime(config)) {
                runtime.registry().require(provider);
                AuthCredential.ServiceAccount account =
                    runtime.auth().parseServiceAccountJson(provider, Files.readString(file));
                runtime.credentials().put(provider, account);
                System.out.println("Stored service account " + account.clientEmail() + " for " + provider);
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Keys service-account failed: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "remove", description = "Remove the credential of a provider")
    int remove(@Parameters(index = "0", paramLabel = "PROVIDER") String provider) {
        try {
            if (!credentials().remove(provider)) {
                System.err.println("Keys remove failed: no credential stored for " + provider);
                return 1;
            }
            System.out.println("Removed credential for " + provider);
            return 0;
        } catch (Exception e) {
            System.err.println("Keys remove failed: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "list", description = "List stored credentials (masked)")
    int list() {
        try {
            Map<String, AuthCredential> all = credentials().all();
            if (all.isEmpty()) {
                System.out.println("No credentials stored.");
                return 0;
            }
            all.forEach((provider, credential) -> System.out.println(provider + "  " + describe(credential)));
            return 0;
        } catch (Exception e) {
            System.err.println("Keys list failed: " + e.getMessage());
            return 1;
        }
    }

    private int store(String action, String provider, AuthCredential credential) {
        try {
            LlmcConfig config = context.loadConfig();
            if (!config.providers().containsKey(provider)) {
                throw ConfigException.unknownProvider(provider);
            }
            credentials().put(provider, credential);
            System.out.println("Stored credential for " + provider);
            return 0;
        } catch (Exception e) {
            System.err.println("Keys " + action + " failed: " + e.getMessage());
            return 1;
        }
    }

    private CredentialStore credentials() {
        return new FileCredentialStore(ConfigPaths.credentialsPath(context.configPath()));
    }

    static String describe(AuthCredential credential) {
        if (credential instanceof AuthCredential.ApiKeyBearer apiKey) {
            return "api key " + mask(apiKey.secret());
        }
        if (credential instanceof AuthCredential.CustomHeader custom) {
            return "header " + custom.name() + ": " + mask(custom.value());
        }
        if (credential instanceof AuthCredential.OAuthToken oauth) {
            return "oauth token " + mask(oauth.token()) + (oauth.expiresAt() == null ? "" : " (expires " + oauth.expiresAt() + ")");
        }
        if (credential instanceof AuthCredential.ServiceAccount account) {
            return "service account " + account.clientEmail();
        }
        return credential.getClass().getSimpleName();
    }

    static String mask(String secret) {
        if (secret == null || secret.length() <= 8) {
            return "****";
        }
        return secret.substring(0, 4) + "..." + secret.substring(secret.length() - 4);
    }
}
