package com.hagglehub.dispatch;

import com.hagglehub.shared.model.ResolvedMessage;
import com.hagglehub.store.StoreHttpClient;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Invokes a store-side function with the whole resolution, so the store can run its own
 * last-mile matching on top of ours.
 */
public class FunctionInvokeSink extends HttpSinkSupport {

    private final String functionName;

    public FunctionInvokeSink(StoreHttpClient http, String functionName) {
        super(http);
        this.functionName = functionName;
    }

    @Override
    public String id() { return "function:" + functionName; }

    @Override
    public void deliver(ResolvedMessage resolved) {
        post("/functions/" + functionName, toEnvelope(resolved), resolved.idempotencyKey());
    }

    static Map<String, Object> toEnvelope(ResolvedMessage resolved) {
        var msg = resolved.message();
        var body = new LinkedHashMap<String, Object>();
        body.put("messageId", resolved.idempotencyKey());
        body.put("sender", msg.sender());
        body.put("recipient", msg.recipient());
        body.put("routingToken", resolved.identity().token());
        body.put("subject", msg.subject());
        body.put("text", msg.text());
        body.put("html", msg.html());
        body.put("receivedAt", msg.receivedAt().toString());

        var signals = new LinkedHashMap<String, Object>();
        signals.put("vin", resolved.signals().vin());
        signals.put("counterpartyName", resolved.signals().counterpartyName());
        signals.put("url", resolved.signals().url());
        body.put("signals", signals);

        var d = resolved.disposition();
        var resolution = new LinkedHashMap<String, Object>();
        resolution.put("kind", d.kind().name());
        resolution.put("dealId", d.dealId());
        resolution.put("dealerId", d.dealerId());
        resolution.put("userId", d.userId());
        resolution.put("inboxToken", d.inboxToken());
        resolution.put("reason", d.reason());
        body.put("resolution", resolution);
        return body;
    }
}
