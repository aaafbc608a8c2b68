package com.example.seer.collaborator;

import com.example.seer.config.SeerProperties;
import com.example.seer.exception.CollaboratorException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class HttpPullRequestCreator implements PullRequestCreator {

    static final String NAME = "pull-request";

    private final HttpCollaboratorClient client;
    private final SeerProperties properties;

    @Override
    public PullRequestResult create(PullRequestRequest request) {
        PullRequestResult result = client.post(NAME, properties.getCollaborators().getPullRequestUrl(),
                request, PullRequestResult.class);
        if (result.prUrl() == null || result.prUrl().isBlank()) {
            throw new CollaboratorException(NAME, "no pull request URL returned for " + request.incidentId());
        }
        return result;
    }
}
