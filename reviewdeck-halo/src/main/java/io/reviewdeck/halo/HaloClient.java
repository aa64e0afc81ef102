package io.reviewdeck.halo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.reviewdeck.core.ticket.ClientSummary;
import io.reviewdeck.core.ticket.TicketQuery;
import io.reviewdeck.core.ticket.TicketRecord;
import io.reviewdeck.core.ticket.TicketRecords;
import io.reviewdeck.core.ticket.TicketSource;
import io.reviewdeck.halo.http.HaloHttpClient;
import io.reviewdeck.halo.http.HaloResponse;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HaloClient implements TicketSource {
    private static final Logger LOG = LoggerFactory.getLogger(HaloClient.class);
    private static final String TOKEN_PATH = "/auth/token";
    private static final String API_PATH = "/api/";

    private final HaloConnection connection;
    private final HaloHttpClient httpClient;
    private volatile String accessToken;

    public HaloClient(HaloConnection connection, HaloHttpClient httpClient) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    }

    public static HaloClient create(HaloConnection connection, ObjectMapper mapper) {
        OkHttpClient client = new OkHttpClient.Builder()
            .connectTimeout(connection.timeout())
            .readTimeout(connection.timeout())
            .writeTimeout(connection.timeout())
            .build();
        return new HaloClient(connection, new HaloHttpClient(client, mapper));
    }

    @Override
    public String name() {
        return "halopsa";
    }

    public synchronized String authenticate() {
        if (!connection.configured()) {
            throw new HaloApiException(
                "HaloPSA is not configured. Set halo.host, halo.clientId and halo.clientSecret or HALO_HOST, CLIENT_ID, CLIENT_SECRET",
                0
            );
        }
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "client_credentials");
        form.put("client_id", connection.clientId());
        form.put("client_secret", connection.clientSecret());
        form.put("scope", connection.scope());

        HaloResponse response;
        try {
            response = httpClient.postForm(connection.host(), TOKEN_PATH, Map.of("Accept", "application/json"), form);
        } catch (IOException e) {
            throw new HaloApiException("Authentication request to " + connection.host() + " failed: " + e.getMessage(), e);
        }
        if (!response.ok()) {
            throw new HaloApiException("Authentication failed with HTTP " + response.status(), response.status());
        }
        String token = response.body().path("access_token").asText("");
        if (token.isBlank()) {
            throw new HaloApiException("Authentication response did not contain an access_token", response.status());
        }
        accessToken = token;
        LOG.info("Authenticated against {}", connection.host());
        return token;
    }

    @Override
    public List<TicketRecord> fetchTickets(TicketQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        Map<String, String> params = new LinkedHashMap<>();
        params.put("page_size", String.valueOf(query.pageSize()));
        params.put("order", "id desc");
        if (!query.clientId().isBlank()) {
            params.put("client_id", query.clientId());
        }
        if (query.startDate() != null) {
            params.put("startdate", query.startDate().toString());
        }
        if (query.endDate() != null) {
            params.put("enddate", query.endDate().toString());
        }

        HaloResponse response = getOrNull("Tickets", params);
        if (response == null) {
            return List.of();
        }
        List<TicketRecord> tickets = TicketRecords.fromBody(response.body());
        LOG.info("Fetched {} tickets for client {}", tickets.size(), query.clientId());
        return tickets;
    }

    @Override
    public List<ClientSummary> listClients() {
        HaloResponse response = getOrNull("Client", Map.of());
        if (response == null) {
            throw new HaloApiException("Listing clients failed", 0);
        }
        JsonNode body = response.body();
        JsonNode rows = body.isObject() ? body.path("clients") : body;
        List<ClientSummary> clients = new ArrayList<>();
        for (JsonNode row : rows) {
            if (row.isObject() && row.hasNonNull("id")) {
                clients.add(new ClientSummary(row.get("id").asText(), row.path("name").asText("")));
            }
        }
        return clients;
    }

    private HaloResponse getOrNull(String endpoint, Map<String, String> params) {
        try {
            HaloResponse response = httpClient.get(connection.host(), API_PATH + endpoint, params, authorizationHeaders());
            if (!response.ok()) {
                LOG.warn("Request to {} failed with HTTP {}: {}", endpoint, response.status(), response.raw());
                return null;
            }
            return response;
        } catch (IOException e) {
            LOG.warn("Request to {} failed: {}", endpoint, e.getMessage());
            return null;
        }
    }

    private Map<String, String> authorizationHeaders() {
        String token = accessToken;
        if (token == null) {
            token = authenticate();
        }
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + token);
        headers.put("Accept", "application/json");
        return headers;
    }
}
