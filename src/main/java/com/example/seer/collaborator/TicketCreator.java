package com.example.seer.collaborator;

/**
 * Files a follow-up ticket in the team's tracker.
 */
public interface TicketCreator {

    TicketResult create(TicketRequest request);
}
