package io.reviewdeck.halo.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

public final class HaloHttpClient {
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public HaloHttpClient(OkHttpClient client, ObjectMapper mapper) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public HaloResponse get(
        String baseUrl,
        String path,
        Map<String, String> query,
        Map<String, String> headers
    ) throws IOException {
        Request.Builder requestBuilder = new Request.Builder().url(url(baseUrl, path, query)).get();
        headers.forEach(requestBuilder::addHeader);
        return execute(requestBuilder.build());
    }

    public HaloResponse postForm(
        String baseUrl,
        String path,
        Map<String, String> headers,
        Map<String, String> formFields
    ) throws IOException {
        FormBody.Builder formBody = new FormBody.Builder();
        formFields.forEach(formBody::add);

        Request.Builder requestBuilder = new Request.Builder().url(url(baseUrl, path, Map.of()));
        headers.forEach(requestBuilder::addHeader);
        return execute(requestBuilder.post(formBody.build()).build());
    }

    private HttpUrl url(String baseUrl, String path, Map<String, String> query) {
        HttpUrl parsed = HttpUrl.parse(baseUrl + path);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid HaloPSA URL: " + baseUrl + path);
        }
        HttpUrl.Builder urlBuilder = parsed.newBuilder();
        query.forEach(urlBuilder::addQueryParameter);
        return urlBuilder.build();
    }

    private HaloResponse execute(Request request) throws IOException {
        try (Response response = client.newCall(request).execute()) {
            String raw = response.body() == null ? "" : response.body().string();
            return new HaloResponse(response.code(), parseJsonBody(raw), raw);
        }
    }

    private JsonNode parseJsonBody(String raw) {
        if (raw == null || raw.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return MissingNode.getInstance();
        }
    }
}
