package com.hagglehub.dispatch;

import com.hagglehub.shared.model.ResolvedMessage;

/** One call shape for handing a resolved message to the downstream store. */
public interface DownstreamSink {
    String id();

    /** Throws {@link DownstreamException} on any failed delivery. */
    void deliver(ResolvedMessage message);
}
