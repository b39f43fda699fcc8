package com.dcv.ultradns;

import com.dcv.api.ApiException;
import com.dcv.api.AuthenticationException;
import com.dcv.config.UltraDnsConfig;
import com.dcv.domain.DnsRecord;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * UltraDNS REST API client.
 *
 * <p>Authenticates with the password grant and sends the bearer token on every subsequent call.
 * <p>The token is owned by this instance; create one instance per run and share it.
 */
public class UltraDnsClient implements DnsProviderClient {
    private static final Logger log = LogManager.getLogger(UltraDnsClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String SUCCESSFUL = "Successful";
    private static final int DEFAULT_TIMEOUT = 30;

    private final HttpUrl baseUrl;
    private final String username;
    private final String password;
    private final OkHttpClient httpClient;
    private final Gson gson;

    private volatile String accessToken;

    /**
     * Constructs a new UltraDnsClient instance.
     *
     * @param builder Builder instance with configuration.
     */
    private UltraDnsClient(Builder builder) {
        this.baseUrl = HttpUrl.get(builder.baseUrl);
        this.username = builder.username;
        this.password = builder.password;
        this.gson = new Gson();
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(builder.connectTimeout, TimeUnit.SECONDS)
                .readTimeout(builder.readTimeout, TimeUnit.SECONDS)
                .writeTimeout(builder.readTimeout, TimeUnit.SECONDS)
                .build();
    }

    /**
     * Constructs a client from configuration.
     *
     * @param config UltraDnsConfig instance.
     * @return UltraDnsClient.
     */
    public static UltraDnsClient fromConfig(UltraDnsConfig config) {
        return new Builder()
                .withBaseUrl(config.getBaseUrl())
                .withUsername(config.getUsername())
                .withPassword(config.getPassword())
                .withConnectTimeout(config.getConnectTimeout())
                .withReadTimeout(config.getReadTimeout())
                .build();
    }

    @Override
    public void authenticate() throws AuthenticationException {
        RequestBody form = new FormBody.Builder()
                .add("grant_type", "password")
                .add("username", username)
                .add("password", password)
                .build();
        Request request = new Request.Builder()
                .url(url("authorization", "token").build())
                .post(form)
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new AuthenticationException("UltraDNS login failed: HTTP " + response.code(), response.code());
            }

            String body = response.body() != null ? response.body().string() : "";
            JsonObject json = gson.fromJson(body, JsonObject.class);
            JsonElement token = json != null ? json.get("access_token") : null;
            if (token == null || token.isJsonNull() || token.getAsString().isBlank()) {
                throw new AuthenticationException("UltraDNS login returned no access_token");
            }

            accessToken = token.getAsString();
            log.info("Logged in to UltraDNS as {}", username);
        } catch (IOException e) {
            throw new AuthenticationException("UltraDNS login failed: " + e.getMessage(), e);
        } catch (JsonParseException | IllegalStateException e) {
            throw new AuthenticationException("UltraDNS login returned a malformed response", e);
        }
    }

    /**
     * Checks if a session token is held.
     *
     * @return Boolean.
     */
    public boolean isAuthenticated() {
        return accessToken != null;
    }

    @Override
    public boolean zoneExists(String zone) throws ApiException {
        Request request = newRequest(url("zones", zone).build()).get().build();

        try {
            execute(request, "get zone " + zone);
            return true;
        } catch (ApiException e) {
            if (e.getKind() == ApiException.Kind.NOT_FOUND) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public void createCname(String zone, String label, String target) throws ApiException {
        String payload = gson.toJson(Map.of("rdata", List.of(DnsRecord.absolute(target))));
        Request request = newRequest(rrsetUrl(zone, label))
                .post(RequestBody.create(payload, JSON))
                .build();

        String action = "create CNAME record " + label + "." + zone;
        JsonObject json = execute(request, action);
        JsonElement message = json.get("message");
        if (message == null || message.isJsonNull() || !SUCCESSFUL.equals(message.getAsString())) {
            throw new ApiException(ApiException.Kind.DATA, "Failed to " + action + ": response was not " + SUCCESSFUL);
        }
    }

    @Override
    public void deleteCname(String zone, String label) throws ApiException {
        Request request = newRequest(rrsetUrl(zone, label)).delete().build();
        execute(request, "delete CNAME record " + label + "." + zone, 204);
    }

    private HttpUrl rrsetUrl(String zone, String label) {
        return url("zones", DnsRecord.absolute(zone), "rrsets", "cname", label).build();
    }

    private HttpUrl.Builder url(String... segments) {
        HttpUrl.Builder builder = baseUrl.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder;
    }

    private Request.Builder newRequest(HttpUrl url) {
        if (accessToken == null) {
            throw new IllegalStateException("UltraDNS client is not authenticated");
        }
        return new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + accessToken);
    }

    private JsonObject execute(Request request, String action) throws ApiException {
        return execute(request, action, -1);
    }

    /**
     * Executes request and parses the JSON body.
     *
     * @param request        Request instance.
     * @param action         Action description for error messages.
     * @param expectedStatus Required status code or -1 for any 2xx.
     * @return JsonObject, empty if no body.
     * @throws ApiException On transport, status or parse failure.
     */
    private JsonObject execute(Request request, String action, int expectedStatus) throws ApiException {
        log.debug("UltraDNS request: {} {}", request.method(), request.url().encodedPath());

        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() == 404) {
                throw new ApiException(ApiException.Kind.NOT_FOUND, "Failed to " + action + ": not found", 404);
            }
            if (!response.isSuccessful() || (expectedStatus > 0 && response.code() != expectedStatus)) {
                throw new ApiException(ApiException.Kind.STATUS, "Failed to " + action + ": HTTP " + response.code(), response.code());
            }

            String body = response.body() != null ? response.body().string() : "";
            if (body.isBlank()) {
                return new JsonObject();
            }
            return gson.fromJson(body, JsonObject.class);
        } catch (IOException e) {
            throw new ApiException(ApiException.Kind.TRANSPORT, "Failed to " + action + ": " + e.getMessage(), e);
        } catch (JsonParseException | IllegalStateException e) {
            throw new ApiException(ApiException.Kind.DATA, "Failed to " + action + ": malformed response", e);
        }
    }

    /**
     * Builder for UltraDnsClient.
     */
    public static class Builder {
        private String baseUrl = "https://api.ultradns.com";
        private String username;
        private String password;
        private int connectTimeout = DEFAULT_TIMEOUT;
        private int readTimeout = DEFAULT_TIMEOUT;

        public Builder withBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder withUsername(String username) {
            this.username = username;
            return this;
        }

        public Builder withPassword(String password) {
            this.password = password;
            return this;
        }

        public Builder withConnectTimeout(int timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        public Builder withReadTimeout(int timeout) {
            this.readTimeout = timeout;
            return this;
        }

        /**
         * Builds the UltraDnsClient instance.
         *
         * @return UltraDnsClient instance.
         * @throws NullPointerException if credentials are missing.
         */
        public UltraDnsClient build() {
            Objects.requireNonNull(baseUrl, "baseUrl must not be null");
            Objects.requireNonNull(username, "username must not be null");
            Objects.requireNonNull(password, "password must not be null");
            return new UltraDnsClient(this);
        }
    }
}
