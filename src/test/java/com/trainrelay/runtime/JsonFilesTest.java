package com.trainrelay.runtime;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JsonFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReplaceTheDocumentWithoutLeavingTempFiles() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        Path target = tempDir.resolve("state").resolve("ledger.json");

        JsonFiles.writeAtomically(mapper, target, Map.of("version", 1));
        JsonFiles.writeAtomically(mapper, target, Map.of("version", 2));

        assertEquals(2, mapper.readTree(target.toFile()).get("version").asInt());
        try (Stream<Path> files = Files.list(target.getParent())) {
            assertEquals(List.of("ledger.json"), files.map(file -> file.getFileName().toString()).toList());
        }
    }
}
