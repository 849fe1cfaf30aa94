package com.hagglehub.dispatch;

import com.hagglehub.shared.model.ResolvedMessage;
import com.hagglehub.store.StoreHttpClient;

import java.util.LinkedHashMap;
import java.util.Map;

/** Creates a Message entity directly; matching is already final. */
public class EntityCreateSink extends HttpSinkSupport {

    public EntityCreateSink(StoreHttpClient http) {
        super(http);
    }

    @Override
    public String id() { return "entity"; }

    @Override
    public void deliver(ResolvedMessage resolved) {
        post("/entities/Message", toEntity(resolved), resolved.idempotencyKey());
    }

    static Map<String, Object> toEntity(ResolvedMessage resolved) {
        var msg = resolved.message();
        var disposition = resolved.disposition();
        var data = new LinkedHashMap<String, Object>();
        data.put("channel", "email");
        data.put("direction", "in");
        data.put("externalId", resolved.idempotencyKey());
        data.put("sender", msg.sender());
        data.put("recipient", msg.recipient());
        data.put("subject", msg.subject());
        data.put("body", msg.text());
        if (!msg.html().isEmpty()) data.put("bodyHtml", msg.html());
        data.put("receivedAt", msg.receivedAt().toString());
        data.put("status", disposition.isAttached() ? "attached" : "unmatched");
        data.put("dealId", disposition.isAttached() ? disposition.dealId() : null);
        if (!disposition.dealerId().isEmpty()) data.put("dealerId", disposition.dealerId());
        if (!disposition.userId().isEmpty()) data.put("userId", disposition.userId());
        if (!disposition.isAttached()) data.put("inboxToken", disposition.inboxToken());
        data.put("resolution", disposition.reason());
        var signals = resolved.signals();
        if (signals.hasVin()) data.put("vin", signals.vin());
        if (signals.hasCounterpartyName()) data.put("counterpartyName", signals.counterpartyName());
        if (signals.hasUrl()) data.put("url", signals.url());
        return data;
    }
}
