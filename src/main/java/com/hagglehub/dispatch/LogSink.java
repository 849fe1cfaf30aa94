package com.hagglehub.dispatch;

import com.hagglehub.shared.model.ResolvedMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Local-run sink: logs the resolved message instead of calling a store. */
public class LogSink implements DownstreamSink {

    private static final Logger log = LoggerFactory.getLogger(LogSink.class);

    @Override
    public String id() { return "log"; }

    @Override
    public void deliver(ResolvedMessage resolved) {
        log.info("[log sink] {} -> {}", resolved.idempotencyKey(), resolved.disposition());
    }
}
