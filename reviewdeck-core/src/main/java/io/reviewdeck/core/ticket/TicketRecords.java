package io.reviewdeck.core.ticket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class TicketRecords {
    private static final Logger LOG = LoggerFactory.getLogger(TicketRecords.class);

    private TicketRecords() {
    }

    public static List<TicketRecord> fromBody(JsonNode body) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            return List.of();
        }
        JsonNode rows = body.isObject() ? body.path("tickets") : body;
        if (!rows.isArray()) {
            return List.of();
        }
        List<TicketRecord> tickets = new ArrayList<>();
        for (JsonNode row : rows) {
            if (!row.isObject()) {
                LOG.warn("Skipping non-object ticket entry: {}", row.getNodeType());
                continue;
            }
            tickets.add(fromJson(row));
        }
        return tickets;
    }

    public static TicketRecord fromJson(JsonNode node) {
        Objects.requireNonNull(node, "node must not be null");
        return new TicketRecord(
            text(node.get("id")),
            integral(node.get("tickettype_id")),
            integral(node.get("priority_id")),
            strictBoolean(node.get("hasbeenclosed")),
            text(node.get("dateoccurred")),
            text(node.get("responsedate")),
            text(node.get("dateclosed")),
            number(node.get("ticketage")),
            text(node.get("summary")),
            text(node.get("client_id"))
        );
    }

    public static List<TicketRecord> readFile(Path path, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        return fromBody(mapper.readTree(Files.readString(path)));
    }

    private static String text(JsonNode value) {
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private static Integer integral(JsonNode value) {
        if (value == null || !value.isIntegralNumber() || !value.canConvertToInt()) {
            return null;
        }
        return value.intValue();
    }

    private static Boolean strictBoolean(JsonNode value) {
        if (value == null || !value.isBoolean()) {
            return null;
        }
        return value.booleanValue();
    }

    private static Double number(JsonNode value) {
        if (value == null || !value.isNumber()) {
            return null;
        }
        return value.doubleValue();
    }
}
