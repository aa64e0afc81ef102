package io.reviewdeck.cli;

import io.reviewdeck.core.ticket.ClientSummary;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "clients", description = "List clients known to the ticket source")
public final class ClientsCommand implements Callable<Integer> {
    private final CliContext context;

    public ClientsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<ClientSummary> clients = context.ticketSources().create(context.loadConfig()).listClients();
            if (clients.isEmpty()) {
                System.out.println("No clients found");
                return 0;
            }
            for (ClientSummary client : clients) {
                System.out.println(client.id() + "\t" + client.name());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Clients command failed: " + e.getMessage());
            return 1;
        }
    }
}
