package com.example.seer.collaborator;

/**
 * Opens a pull request carrying the generated fix.
 */
public interface PullRequestCreator {

    PullRequestResult create(PullRequestRequest request);
}
