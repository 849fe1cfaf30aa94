package com.hagglehub.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * {@link EntityStore} over the store's REST entity API:
 * {@code GET /entities/{Entity}?q={json filter}} and {@code POST /entities/{Entity}}.
 */
public class HttpEntityStore implements EntityStore {

    private final StoreHttpClient http;

    public HttpEntityStore(StoreHttpClient http) {
        this.http = http;
    }

    @Override
    public List<UserRecord> findUsersByAlias(String alias) {
        return query("User", Map.of("alias", alias), HttpEntityStore::toUser);
    }

    @Override
    public List<DealRecord> findDeals(String field, String value, String userId) {
        var filter = new LinkedHashMap<String, Object>();
        filter.put(field, value);
        if (userId != null) filter.put("userId", userId);
        return query("Deal", filter, HttpEntityStore::toDeal);
    }

    @Override
    public List<DealRecord> listDeals(String userId) {
        return query("Deal", userId == null ? Map.of() : Map.of("userId", userId), HttpEntityStore::toDeal);
    }

    @Override
    public List<DealerRecord> findDealers(String field, String value) {
        return query("Dealer", Map.of(field, value), HttpEntityStore::toDealer);
    }

    @Override
    public DealRecord findDeal(String dealId) {
        var found = query("Deal", Map.of("id", dealId), HttpEntityStore::toDeal);
        return found.isEmpty() ? null : found.get(0);
    }

    @Override
    public DealerRecord createDealer(String name, String emailDomain) {
        var data = new LinkedHashMap<String, Object>();
        data.put("name", name);
        data.put("emailDomain", emailDomain);
        return toDealer(create("Dealer", data));
    }

    @Override
    public DealRecord createDeal(String userId, String dealerId, String title) {
        var data = new LinkedHashMap<String, Object>();
        data.put("userId", userId);
        data.put("dealerId", dealerId);
        data.put("status", DealRecord.STATUS_OPEN);
        data.put("title", title);
        return toDeal(create("Deal", data));
    }

    private <T> List<T> query(String entity, Map<String, ?> filter, Function<JsonNode, T> mapper) {
        var path = "/entities/" + entity;
        try {
            var query = filter.isEmpty() ? Map.<String, String>of()
                    : Map.of("q", http.mapper().writeValueAsString(filter));
            var resp = http.get(path, query);
            if (resp.statusCode() >= 300) {
                throw new StoreException("GET " + path + " failed with HTTP " + resp.statusCode(), resp.statusCode());
            }
            var root = readJson(resp.body(), path);
            var items = root.isArray() ? root : root.path("items");
            var out = new ArrayList<T>();
            for (var item : items) {
                out.add(mapper.apply(item));
            }
            return out;
        } catch (IOException e) {
            throw new StoreException("GET " + path + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("GET " + path + " interrupted", e);
        }
    }

    private JsonNode create(String entity, Map<String, Object> data) {
        var path = "/entities/" + entity;
        try {
            var resp = http.post(path, data, null);
            if (resp.statusCode() >= 300) {
                throw new StoreException("POST " + path + " failed with HTTP " + resp.statusCode(), resp.statusCode());
            }
            return readJson(resp.body(), path);
        } catch (IOException e) {
            throw new StoreException("POST " + path + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("POST " + path + " interrupted", e);
        }
    }

    private JsonNode readJson(String body, String path) {
        try {
            return http.mapper().readTree(body == null || body.isBlank() ? "[]" : body);
        } catch (JsonProcessingException e) {
            throw new StoreException("Malformed response from " + path, e);
        }
    }

    static UserRecord toUser(JsonNode n) {
        return new UserRecord(
                n.path("id").asText(""),
                n.path("alias").asText(""),
                n.path("email").asText(""),
                n.path("fallbackDealId").asText(""));
    }

    static DealerRecord toDealer(JsonNode n) {
        return new DealerRecord(
                n.path("id").asText(""),
                n.path("name").asText(""),
                n.path("emailDomain").asText(""));
    }

    static DealRecord toDeal(JsonNode n) {
        return new DealRecord(
                n.path("id").asText(""),
                n.path("userId").asText(""),
                n.path("dealerId").asText(""),
                n.path("alias").asText(""),
                n.path("vin").asText(""),
                n.path("url").asText(""),
                n.path("status").asText(""),
                n.path("title").asText(""));
    }
}
