package com.trainrelay.execution;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public class HttpExecutionService implements ExecutionService {
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final HttpUrl baseUrl;
    private final String apiToken;

    public HttpExecutionService(OkHttpClient httpClient, String baseUrl, String apiToken) {
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid execution service URL: " + baseUrl);
        }
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.baseUrl = parsed;
        this.apiToken = apiToken;
    }

    @Override
    public String submit(String jobName, Map<String, Object> parameters, Map<String, String> tags) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", jobName);
        body.put("parameters", parameters);
        body.put("tags", tags);
        Request request = authorized(new Request.Builder()
                .url(baseUrl.newBuilder().addPathSegment("jobs").build())
                .post(RequestBody.create(mapper.writeValueAsString(body), JSON)));

        JsonNode root = execute(request, "submit " + jobName);
        String handle = root.path("handle").asText(root.path("id").asText(""));
        if (handle.isBlank()) {
            throw new IOException("Execution service returned no job handle for " + jobName);
        }
        return handle;
    }

    @Override
    public JobStatus status(String handle) throws IOException {
        Request request = authorized(new Request.Builder()
                .url(baseUrl.newBuilder().addPathSegment("jobs").addPathSegment(handle).build())
                .get());
        JsonNode root = execute(request, "status " + handle);
        String status = root.path("status").asText("");
        if (status.isBlank()) {
            throw new IOException("Execution service returned no status for " + handle);
        }
        return JobStatus.fromRemote(status);
    }

    @Override
    public void cancel(String handle) throws IOException {
        Request request = authorized(new Request.Builder()
                .url(baseUrl.newBuilder().addPathSegment("jobs").addPathSegment(handle).addPathSegment("cancel").build())
                .post(RequestBody.create("{}", JSON)));
        execute(request, "cancel " + handle);
    }

    private Request authorized(Request.Builder builder) {
        if (apiToken != null && !apiToken.isBlank()) {
            builder.header("Authorization", "Bearer " + apiToken);
        }
        return builder.build();
    }

    private JsonNode execute(Request request, String operation) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                throw new IOException("Execution service " + operation + " failed: status=" + response.code() + " body=" + body);
            }
            return body.isBlank() ? mapper.createObjectNode() : mapper.readTree(body);
        }
    }

    @Override
    public String toString() {
        return "HttpExecutionService{" +
                "baseUrl=" + baseUrl +
                ", authenticated=" + (apiToken != null && !apiToken.isBlank()) +
                '}';
    }
}
