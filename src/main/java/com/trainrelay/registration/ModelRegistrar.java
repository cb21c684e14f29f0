package com.trainrelay.registration;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trainrelay.execution.JobStatus;
import com.trainrelay.execution.TrainingJob;
import com.trainrelay.registry.Artifact;
import com.trainrelay.registry.ArtifactStore;

public class ModelRegistrar {
    private static final Logger log = LoggerFactory.getLogger(ModelRegistrar.class);

    private final ArtifactStore trainingStore;
    private final double minSuccessFraction;

    public ModelRegistrar(ArtifactStore trainingStore, double minSuccessFraction) {
        if (minSuccessFraction < 0.0 || minSuccessFraction > 1.0) {
            throw new IllegalArgumentException("minSuccessFraction must be within [0, 1], got " + minSuccessFraction);
        }
        this.trainingStore = trainingStore;
        this.minSuccessFraction = minSuccessFraction;
    }

    public RegistrationResult register(List<TrainingJob> completedJobs) {
        List<Artifact> registered = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (TrainingJob job : completedJobs) {
            try {
                Artifact artifact = registerOne(job);
                registered.add(artifact);
                log.info("registration.created unit={} artifact={} hash={} job={}",
                        job.getUnitId(), artifact.reference(), job.getLineageHash(), job.getJobHandle());
            } catch (IOException | IllegalStateException | IllegalArgumentException e) {
                failures.put(job.getUnitId(), e.getMessage());
                log.error("registration.failed unit={} job={} reason={}", job.getUnitId(), job.getJobHandle(), e.getMessage());
            }
        }

        RegistrationResult result = new RegistrationResult(registered, failures);
        if (result.attempted() > 0 && result.successFraction() < minSuccessFraction) {
            throw new RegistrationThresholdException(result, minSuccessFraction);
        }
        return result;
    }

    private Artifact registerOne(TrainingJob job) throws IOException {
        if (job.getStatus() != JobStatus.COMPLETED) {
            throw new IllegalStateException("Job " + job.getJobHandle() + " is not completed: " + job.getStatus());
        }
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put(Artifact.TAG_UNIT_ID, job.getUnitId());
        tags.put(Artifact.TAG_MODEL_NAME, job.getModelName());
        tags.put(Artifact.TAG_LINEAGE_HASH, job.getLineageHash());
        tags.put(Artifact.TAG_TRAINING_JOB, job.getJobHandle());
        if (job.isRetry()) {
            tags.put(Artifact.TAG_RETRY_ATTEMPT, Integer.toString(job.getAttempt()));
        }

        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("origin_job", job.getJobHandle());
        payload.put("model_path", "jobs/" + job.getJobHandle() + "/outputs/model");
        return trainingStore.createVersion(job.getModelName(), payload, tags);
    }
}
