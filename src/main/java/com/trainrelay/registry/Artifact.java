package com.trainrelay.registry;

import java.time.Instant;
import java.util.Map;

public record Artifact(
        String name,
        int version,
        Map<String, String> tags,
        Map<String, String> payload,
        Instant createdAt) {
    public static final String TAG_UNIT_ID = "unit_id";
    public static final String TAG_MODEL_NAME = "model_name";
    public static final String TAG_LINEAGE_HASH = "lineage_hash";
    public static final String TAG_TRAINING_JOB = "training_job";
    public static final String TAG_RETRY_ATTEMPT = "retry_attempt";
    public static final String TAG_PROMOTED_FROM = "promoted_from";
    public static final String TAG_SOURCE_VERSION = "source_version";

    public Artifact {
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public String tag(String key) {
        return tags.get(key);
    }

    public String lineageHash() {
        return tags.get(TAG_LINEAGE_HASH);
    }

    public String unitId() {
        return tags.get(TAG_UNIT_ID);
    }

    public boolean matches(Map<String, String> tagFilter) {
        if (tagFilter == null) {
            return true;
        }
        for (Map.Entry<String, String> entry : tagFilter.entrySet()) {
            if (!entry.getValue().equals(tags.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    public String reference() {
        return name + ":v" + version;
    }
}
