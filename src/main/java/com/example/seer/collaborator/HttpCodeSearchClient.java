package com.example.seer.collaborator;

import com.example.seer.config.SeerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Code search over HTTP. With no endpoint configured every search comes
 * back empty, which makes the downstream pipeline steps skip.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpCodeSearchClient implements CodeSearchClient {

    static final String NAME = "code-search";

    private final HttpCollaboratorClient client;
    private final SeerProperties properties;

    @Override
    public List<CodeFile> search(String service, String query, int limit) {
        String url = properties.getCollaborators().getCodeSearchUrl();
        if (url == null || url.isBlank()) {
            log.debug("Code search not configured, no files for {}", service);
            return List.of();
        }
        SearchResponse response = client.post(NAME, url, new SearchRequest(service, query, limit), SearchResponse.class);
        if (response.files() == null) {
            return List.of();
        }
        return response.files().stream().limit(limit).toList();
    }

    record SearchRequest(String service, String query, int limit) {
    }

    record SearchResponse(List<CodeFile> files) {
    }
}
