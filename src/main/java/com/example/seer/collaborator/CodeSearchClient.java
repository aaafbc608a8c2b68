package com.example.seer.collaborator;

import java.util.List;

/**
 * Finds source files related to a failing service.
 */
public interface CodeSearchClient {

    /**
     * @return matching files, best match first; empty when nothing matches
     * @throws com.example.seer.exception.CollaboratorException when the search backend fails
     */
    List<CodeFile> search(String service, String query, int limit);
}
