package io.reviewdeck.halo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.reviewdeck.core.ticket.ClientSummary;
import io.reviewdeck.core.ticket.TicketQuery;
import io.reviewdeck.core.ticket.TicketRecord;
import io.reviewdeck.halo.http.HaloHttpClient;
import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HaloClientTest {
    private static final TicketQuery QUERY = new TicketQuery(
        "42", LocalDate.of(2026, 1, 1), LocalDate.of(2026, 3, 31), 250
    );

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldAuthenticateWithClientCredentialsForm() throws Exception {
        server.enqueue(token("tok-1"));

        String token = client().authenticate();

        assertThat(token).isEqualTo("tok-1");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/auth/token");
        assertThat(request.getHeader("Content-Type")).startsWith("application/x-www-form-urlencoded");
        assertThat(request.getBody().readUtf8())
            .contains("grant_type=client_credentials")
            .contains("client_id=cid")
            .contains("client_secret=secret")
            .contains("scope=all");
    }

    @Test
    void shouldFetchWrappedTicketsWithQueryParametersAndBearerToken() throws Exception {
        server.enqueue(token("tok-1"));
        server.enqueue(json("""
            {"record_count": 2, "tickets": [
              {"id": 2, "tickettype_id": 30, "priority_id": 3, "hasbeenclosed": true, "summary": "Patch cycle"},
              {"id": 1, "tickettype_id": 1, "priority_id": 1, "hasbeenclosed": false}
            ]}
            """));

        List<TicketRecord> tickets = client().fetchTickets(QUERY);

        assertThat(tickets).extracting(TicketRecord::id).containsExactly("2", "1");
        assertThat(tickets.get(0).summary()).isEqualTo("Patch cycle");

        server.takeRequest();
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/api/Tickets");
        assertThat(request.getRequestUrl().queryParameter("page_size")).isEqualTo("250");
        assertThat(request.getRequestUrl().queryParameter("order")).isEqualTo("id desc");
        assertThat(request.getRequestUrl().queryParameter("client_id")).isEqualTo("42");
        assertThat(request.getRequestUrl().queryParameter("startdate")).isEqualTo("2026-01-01");
        assertThat(request.getRequestUrl().queryParameter("enddate")).isEqualTo("2026-03-31");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer tok-1");
    }

    @Test
    void shouldAcceptBareArrayAndReuseToken() throws Exception {
        server.enqueue(token("tok-1"));
        server.enqueue(json("[{\"id\": 7}]"));
        server.enqueue(json("[]"));
        HaloClient client = client();

        assertThat(client.fetchTickets(QUERY)).hasSize(1);
        assertThat(client.fetchTickets(QUERY)).isEmpty();

        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void shouldReturnEmptyListWhenTicketRequestFails() {
        server.enqueue(token("tok-1"));
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        assertThat(client().fetchTickets(QUERY)).isEmpty();
    }

    @Test
    void shouldRaiseOnRejectedCredentials() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"invalid_client\"}"));

        assertThatThrownBy(() -> client().fetchTickets(QUERY))
            .isInstanceOf(HaloApiException.class)
            .satisfies(e -> assertThat(((HaloApiException) e).status()).isEqualTo(401));
    }

    @Test
    void shouldRaiseWhenNotConfigured() {
        HaloClient client = new HaloClient(
            new HaloConnection("", "", "", null, 0, null),
            new HaloHttpClient(new OkHttpClient(), new ObjectMapper())
        );

        assertThatThrownBy(client::authenticate)
            .isInstanceOf(HaloApiException.class)
            .hasMessageContaining("not configured");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldListClients() throws Exception {
        server.enqueue(token("tok-1"));
        server.enqueue(json("""
            {"clients": [{"id": 42, "name": "Acme Corp"}, {"id": 43, "name": "Globex"}, {"name": "no id"}]}
            """));

        List<ClientSummary> clients = client().listClients();

        assertThat(clients).containsExactly(new ClientSummary("42", "Acme Corp"), new ClientSummary("43", "Globex"));
        server.takeRequest();
        assertThat(server.takeRequest().getPath()).isEqualTo("/api/Client");
    }

    @Test
    void shouldStripTrailingSlashFromHost() {
        HaloConnection connection = new HaloConnection("https://acme.halopsa.com//", "id", "secret", " ", 500, null);

        assertThat(connection.host()).isEqualTo("https://acme.halopsa.com");
        assertThat(connection.scope()).isEqualTo("all");
        assertThat(connection.configured()).isTrue();
    }

    private HaloClient client() {
        String host = server.url("/").toString();
        return new HaloClient(
            new HaloConnection(host, "cid", "secret", "all", 500, null),
            new HaloHttpClient(new OkHttpClient(), new ObjectMapper())
        );
    }

    private static MockResponse token(String value) {
        return json("{\"access_token\": \"" + value + "\", \"token_type\": \"Bearer\", \"expires_in\": 3600}");
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
