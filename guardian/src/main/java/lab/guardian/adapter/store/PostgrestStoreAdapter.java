package lab.guardian.adapter.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * {@link StoreAdapter} over a PostgREST endpoint ({@code <base>/rest/v1/<table>}) using the service key.
 * Filters are sent verbatim as query parameters, so a conditioned PATCH is a single SQL update.
 */
@Slf4j
public class PostgrestStoreAdapter implements StoreAdapter {

    private static final MediaType JSON = MediaType.get("application/json");
    private static final String RETURN_REPRESENTATION = "return=representation";

    private final OkHttpClient client;
    private final HttpUrl restUrl;
    private final String serviceKey;
    private final ObjectMapper objectMapper;

    public PostgrestStoreAdapter(OkHttpClient client, String baseUrl, String serviceKey, ObjectMapper objectMapper) {
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("invalid store url: " + baseUrl);
        }
        this.client = client;
        this.restUrl = parsed.newBuilder().addPathSegments("rest/v1").build();
        this.serviceKey = serviceKey;
        this.objectMapper = objectMapper;
    }

    @Override
    public <T> List<T> insert(String table, Object row, Class<T> type) {
        Request request = baseRequest(tableUrl(table).build(), RETURN_REPRESENTATION)
                .post(jsonBody(row))
                .build();
        return execute("insert", table, request, type);
    }

    @Override
    public <T> List<T> select(String table, Filter filter, SelectOptions options, Class<T> type) {
        HttpUrl.Builder url = tableUrl(table);
        if (options.orderBy() != null) {
            url.addQueryParameter("order", options.orderBy());
        }
        if (options.limit() != null) {
            url.addQueryParameter("limit", String.valueOf(options.limit()));
        }
        if (options.offset() != null) {
            url.addQueryParameter("offset", String.valueOf(options.offset()));
        }
        applyFilter(url, filter);
        Request request = baseRequest(url.build(), RETURN_REPRESENTATION).get().build();
        return execute("select", table, request, type);
    }

    @Override
    public <T> List<T> update(String table, Filter filter, Map<String, Object> patch, Class<T> type) {
        HttpUrl.Builder url = tableUrl(table);
        applyFilter(url, filter);
        Request request = baseRequest(url.build(), RETURN_REPRESENTATION)
                .patch(jsonBody(patch))
                .build();
        return execute("update", table, request, type);
    }

    @Override
    public <T> List<T> delete(String table, Filter filter, Class<T> type) {
        HttpUrl.Builder url = tableUrl(table);
        applyFilter(url, filter);
        Request request = baseRequest(url.build(), RETURN_REPRESENTATION).delete().build();
        return execute("delete", table, request, type);
    }

    @Override
    public <T> List<T> upsert(String table, Object row, List<String> onConflict, Class<T> type) {
        HttpUrl.Builder url = tableUrl(table);
        if (onConflict != null && !onConflict.isEmpty()) {
            url.addQueryParameter("on_conflict", String.join(",", onConflict));
        }
        Request request = baseRequest(url.build(), RETURN_REPRESENTATION + ",resolution=merge-duplicates")
                .post(jsonBody(row))
                .build();
        return execute("upsert", table, request, type);
    }

    private HttpUrl.Builder tableUrl(String table) {
        return restUrl.newBuilder().addPathSegment(table);
    }

    private void applyFilter(HttpUrl.Builder url, Filter filter) {
        for (Filter.Condition condition : filter.conditions()) {
            url.addQueryParameter(condition.column(), condition.operator().token() + "." + condition.operand());
        }
    }

    private Request.Builder baseRequest(HttpUrl url, String prefer) {
        return new Request.Builder()
                .url(url)
                .header("apikey", serviceKey)
                .header("Authorization", "Bearer " + serviceKey)
                .header("Content-Type", "application/json")
                .header("Prefer", prefer);
    }

    private RequestBody jsonBody(Object value) {
        try {
            return RequestBody.create(objectMapper.writeValueAsBytes(value), JSON);
        } catch (JsonProcessingException e) {
            throw new StoreException("failed to serialize store payload", e);
        }
    }

    private <T> List<T> execute(String operation, String table, Request request, Class<T> type) {
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                String message = "Store " + response.code() + ": " + errorMessage(text, response.message());
                log.warn("event=store.rest.error operation={} table={} status={}", operation, table, response.code());
                throw new StoreException(message, response.code());
            }
            if (text.isBlank()) {
                return List.of();
            }
            JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, type);
            return objectMapper.readValue(text, listType);
        } catch (IOException e) {
            log.warn("event=store.rest.io_error operation={} table={} error={}", operation, table, e.getMessage());
            throw new StoreException("store " + operation + " on " + table + " failed: " + e.getMessage(), e);
        }
    }

    private String errorMessage(String body, String fallback) {
        if (body != null && !body.isBlank()) {
            try {
                JsonNode node = objectMapper.readTree(body);
                if (node.hasNonNull("message")) {
                    return node.get("message").asText();
                }
            } catch (JsonProcessingException e) {
                return body;
            }
        }
        return fallback;
    }
}
