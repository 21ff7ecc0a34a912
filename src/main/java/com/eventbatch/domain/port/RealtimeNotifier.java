package com.eventbatch.domain.port;

import java.util.Map;

/**
 * Pub/sub channel used for realtime dashboards.
 */
public interface RealtimeNotifier {

    void broadcast(String channel, Map<String, Object> message);
}
