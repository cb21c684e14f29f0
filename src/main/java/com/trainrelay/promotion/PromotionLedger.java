package com.trainrelay.promotion;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.trainrelay.runtime.JsonFiles;

public class PromotionLedger {
    private final Path ledgerPath;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    public PromotionLedger(Path ledgerPath) {
        this.ledgerPath = ledgerPath;
    }

    public synchronized void put(PromotionRequest request) throws IOException {
        Map<String, PromotionRequest> requests = load();
        requests.put(request.requestId(), request);
        save(requests);
    }

    public synchronized Optional<PromotionRequest> get(String requestId) throws IOException {
        return Optional.ofNullable(load().get(requestId));
    }

    public synchronized List<PromotionRequest> all() throws IOException {
        return List.copyOf(load().values());
    }

    public synchronized List<PromotionRequest> unresolved() throws IOException {
        return load().values().stream().filter(request -> !request.isResolved()).toList();
    }

    private Map<String, PromotionRequest> load() throws IOException {
        if (!Files.exists(ledgerPath) || Files.size(ledgerPath) == 0L) {
            return new TreeMap<>();
        }
        return mapper.readValue(ledgerPath.toFile(), new TypeReference<TreeMap<String, PromotionRequest>>() {
        });
    }

    private void save(Map<String, PromotionRequest> requests) throws IOException {
        JsonFiles.writeAtomically(mapper, ledgerPath, requests);
    }
}
