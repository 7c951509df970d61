package io.llmc.core.auth;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

public interface CredentialStore {
    Optional<AuthCredential> find(String provider) throws IOException;

    Map<String, AuthCredential> all() throws IOException;

    void put(String provider, AuthCredential credential) throws IOException;

    boolean remove(String provider) throws IOException;
}
