package com.example.seer.collaborator;

import com.example.seer.config.SeerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class HttpTicketCreator implements TicketCreator {

    static final String NAME = "ticket";

    private final HttpCollaboratorClient client;
    private final SeerProperties properties;

    @Override
    public TicketResult create(TicketRequest request) {
        return client.post(NAME, properties.getCollaborators().getTicketUrl(), request, TicketResult.class);
    }
}
