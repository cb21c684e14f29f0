package com.trainrelay.registry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.trainrelay.runtime.JsonFiles;

public class JsonFileArtifactStore implements ArtifactStore {
    private final String environment;
    private final Path registryPath;
    private final Clock clock;
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    public JsonFileArtifactStore(String environment, Path registryPath) {
        this(environment, registryPath, Clock.systemUTC());
    }

    public JsonFileArtifactStore(String environment, Path registryPath, Clock clock) {
        this.environment = environment;
        this.registryPath = registryPath;
        this.clock = clock;
    }

    public static JsonFileArtifactStore inDirectory(Path registryDir, String environment) {
        return new JsonFileArtifactStore(environment, registryDir.resolve(environment + "-registry.json"));
    }

    @Override
    public String environment() {
        return environment;
    }

    @Override
    public synchronized Artifact createVersion(String name, Map<String, String> payload, Map<String, String> tags) throws IOException {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("artifact name must not be blank");
        }
        RegistryDocument document = load();
        List<Artifact> versions = document.models().computeIfAbsent(name, ignored -> new ArrayList<>());
        int next = versions.stream().mapToInt(Artifact::version).max().orElse(0) + 1;
        Artifact artifact = new Artifact(name, next, tags, payload, clock.instant());
        versions.add(artifact);
        save(document);
        return artifact;
    }

    @Override
    public synchronized List<Artifact> list(String name, Map<String, String> tagFilter) throws IOException {
        List<Artifact> versions = load().models().getOrDefault(name, List.of());
        return versions.stream()
                .filter(artifact -> artifact.matches(tagFilter))
                .sorted(Comparator.comparingInt(Artifact::version))
                .toList();
    }

    @Override
    public synchronized Optional<Artifact> get(String name, int version) throws IOException {
        return load().models().getOrDefault(name, List.of()).stream()
                .filter(artifact -> artifact.version() == version)
                .findFirst();
    }

    @Override
    public synchronized boolean isEmpty() throws IOException {
        return load().models().values().stream().allMatch(List::isEmpty);
    }

    @Override
    public String toString() {
        return "JsonFileArtifactStore{" +
                "environment=" + environment +
                ", registryPath=" + registryPath +
                '}';
    }

    private RegistryDocument load() throws IOException {
        if (!Files.exists(registryPath) || Files.size(registryPath) == 0L) {
            return new RegistryDocument(new TreeMap<>());
        }
        RegistryDocument document = objectMapper.readValue(registryPath.toFile(), RegistryDocument.class);
        Map<String, List<Artifact>> mutable = new TreeMap<>();
        if (document.models() != null) {
            document.models().forEach((name, versions) -> mutable.put(name, new ArrayList<>(versions)));
        }
        return new RegistryDocument(mutable);
    }

    private void save(RegistryDocument document) throws IOException {
        JsonFiles.writeAtomically(objectMapper, registryPath, document);
    }

    record RegistryDocument(Map<String, List<Artifact>> models) {
    }
}
