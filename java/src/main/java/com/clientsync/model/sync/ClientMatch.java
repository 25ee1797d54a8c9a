package com.clientsync.model.sync;

import com.clientsync.model.entity.Client;
import lombok.Value;

/**
 * An existing registry row selected by the matcher, with the strategy that found it.
 */
@Value
public class ClientMatch {
    Client client;
    MatchStrategy strategy;
    double score;

    public static ClientMatch exact(Client client, MatchStrategy strategy) {
        return new ClientMatch(client, strategy, 1.0);
    }
}
