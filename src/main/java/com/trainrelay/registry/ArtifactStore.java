package com.trainrelay.registry;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface ArtifactStore {
    String environment();

    Artifact createVersion(String name, Map<String, String> payload, Map<String, String> tags) throws IOException;

    List<Artifact> list(String name, Map<String, String> tagFilter) throws IOException;

    Optional<Artifact> get(String name, int version) throws IOException;

    boolean isEmpty() throws IOException;

    default Optional<Artifact> latest(String name, Map<String, String> tagFilter) throws IOException {
        List<Artifact> versions = list(name, tagFilter);
        return versions.isEmpty() ? Optional.empty() : Optional.of(versions.get(versions.size() - 1));
    }
}
