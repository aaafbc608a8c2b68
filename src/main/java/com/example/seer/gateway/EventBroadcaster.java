package com.example.seer.gateway;

/**
 * Pushes workflow events (anomalies, approvals, pipeline progress) to
 * connected dashboards.
 */
public interface EventBroadcaster {

    void broadcast(String method, Object params);
}
