package com.dcv.digicert;

import com.dcv.api.ApiException;
import com.dcv.config.DigiCertConfig;
import com.dcv.domain.DcvExpiration;
import com.dcv.domain.DcvMethod;
import com.dcv.domain.Domain;
import com.dcv.domain.DomainDetail;
import com.dcv.domain.ValidationStatus;
import com.dcv.domain.ValidationToken;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * DigiCert Services API v2 client.
 *
 * <p>Implements the certificate authority capability over HTTPS with the account API key
 * sent in the <i>X-DC-DEVKEY</i> header.
 * <p>One instance holds one OkHttp connection pool and is shared by all workflows of a run.
 *
 * <p>Example usage:
 * <pre>
 * DigiCertClient client = new DigiCertClient.Builder()
 *     .withKey("abc123")
 *     .build();
 *
 * List&lt;Domain&gt; domains = client.listDomains();
 * </pre>
 */
public class DigiCertClient implements CertificateAuthorityClient {
    private static final Logger log = LogManager.getLogger(DigiCertClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String KEY_HEADER = "X-DC-DEVKEY";
    private static final int DEFAULT_TIMEOUT = 30;

    private final HttpUrl baseUrl;
    private final String key;
    private final OkHttpClient httpClient;
    private final Gson gson;

    /**
     * Constructs a new DigiCertClient instance.
     *
     * @param builder Builder instance with configuration.
     */
    private DigiCertClient(Builder builder) {
        this.baseUrl = HttpUrl.get(builder.baseUrl);
        this.key = builder.key;
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
     * @param config DigiCertConfig instance.
     * @return DigiCertClient.
     */
    public static DigiCertClient fromConfig(DigiCertConfig config) {
        return new Builder()
                .withBaseUrl(config.getBaseUrl())
                .withKey(config.getKey())
                .withConnectTimeout(config.getConnectTimeout())
                .withReadTimeout(config.getReadTimeout())
                .build();
    }

    @Override
    public List<Domain> listDomains() throws ApiException {
        return parseDomains(execute(newRequest(url("domain").build()).get().build(), "list domains"));
    }

    @Override
    public List<Domain> listDomains(int limit) throws ApiException {
        HttpUrl url = url("domain")
                .addQueryParameter("limit", String.valueOf(limit))
                .build();
        return parseDomains(execute(newRequest(url).get().build(), "list domains"));
    }

    @Override
    public List<Domain> findDomains(String name) throws ApiException {
        Objects.requireNonNull(name, "name must not be null");
        HttpUrl url = url("domain")
                .addQueryParameter("filters[search]", name)
                .build();

        // Search matches substrings.
        List<Domain> matches = new ArrayList<>();
        for (Domain domain : parseDomains(execute(newRequest(url).get().build(), "search domain " + name))) {
            if (domain.getName().equalsIgnoreCase(name)) {
                matches.add(domain);
            }
        }
        return matches;
    }

    @Override
    public DomainDetail getDomainDetail(String id) throws ApiException {
        HttpUrl url = url("domain", id)
                .addQueryParameter("include_dcv", "true")
                .build();
        JsonObject json = execute(newRequest(url).get().build(), "get domain " + id);

        return new DomainDetail(parseDomain(json), parseValidations(json));
    }

    @Override
    public ValidationToken changeValidationMethod(String id, DcvMethod method) throws ApiException {
        String payload = gson.toJson(Map.of("dcv_method", method.getValue()));
        Request request = newRequest(url("domain", id, "dcv", "method").build())
                .put(RequestBody.create(payload, JSON))
                .build();

        return parseToken(execute(request, "change DCV method on domain " + id));
    }

    @Override
    public ValidationToken submitForValidation(String id) throws ApiException {
        String payload = gson.toJson(Map.of(
                "validations", List.of(Map.of("type", ValidationStatus.OV), Map.of("type", ValidationStatus.EV)),
                "dcv_method", DcvMethod.DNS_CNAME_TOKEN.getValue()));
        Request request = newRequest(url("domain", id, "validation").build())
                .post(RequestBody.create(payload, JSON))
                .build();

        return parseToken(execute(request, "submit domain " + id + " for validation", 201));
    }

    @Override
    public List<ValidationStatus> checkValidationStatus(String id) throws ApiException {
        JsonObject json = execute(newRequest(url("domain", id, "validation").build()).get().build(),
                "check validation of domain " + id);

        List<ValidationStatus> validations = parseValidations(json);
        if (validations == null) {
            throw new ApiException(ApiException.Kind.DATA, "No validations returned for domain " + id);
        }
        return validations;
    }

    /**
     * Builds URL under the API base.
     *
     * @param segments Path segments.
     * @return HttpUrl.Builder.
     */
    private HttpUrl.Builder url(String... segments) {
        HttpUrl.Builder builder = baseUrl.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder;
    }

    /**
     * Gets request builder with authentication header.
     *
     * @param url Request URL.
     * @return Request.Builder.
     */
    private Request.Builder newRequest(HttpUrl url) {
        return new Request.Builder()
                .url(url)
                .header(KEY_HEADER, key)
                .header("Content-Type", "application/json");
    }

    /**
     * Executes request accepting any successful status.
     */
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
        log.debug("DigiCert request: {} {}", request.method(), request.url().encodedPath());

        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";

            if (!response.isSuccessful()) {
                ApiException.Kind kind = response.code() == 404 ? ApiException.Kind.NOT_FOUND : ApiException.Kind.STATUS;
                throw new ApiException(kind, "Failed to " + action + ": HTTP " + response.code() + errorText(body), response.code());
            }
            if (expectedStatus > 0 && response.code() != expectedStatus) {
                throw new ApiException(ApiException.Kind.STATUS, "Failed to " + action + ": unexpected HTTP " + response.code(), response.code());
            }

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
     * Extracts error messages from a DigiCert error body.
     *
     * @param body Response body.
     * @return Error text prefixed with separator, or empty string.
     */
    private String errorText(String body) {
        try {
            JsonObject json = gson.fromJson(body, JsonObject.class);
            if (json != null && json.has("errors") && json.get("errors").isJsonArray()) {
                List<String> messages = new ArrayList<>();
                for (JsonElement error : json.getAsJsonArray("errors")) {
                    if (error.isJsonObject() && error.getAsJsonObject().has("message")) {
                        messages.add(error.getAsJsonObject().get("message").getAsString());
                    }
                }
                if (!messages.isEmpty()) {
                    return ", " + String.join("; ", messages);
                }
            }
        } catch (JsonParseException | IllegalStateException e) {
            log.debug("Unparseable DigiCert error body: {}", e.getMessage());
        }
        return "";
    }

    private List<Domain> parseDomains(JsonObject json) throws ApiException {
        if (!json.has("domains") || !json.get("domains").isJsonArray()) {
            return new ArrayList<>();
        }

        List<Domain> domains = new ArrayList<>();
        for (JsonElement element : json.getAsJsonArray("domains")) {
            domains.add(parseDomain(element.getAsJsonObject()));
        }
        return domains;
    }

    private Domain parseDomain(JsonObject json) throws ApiException {
        String id = string(json, "id");
        String name = string(json, "name");
        if (id == null || name == null) {
            throw new ApiException(ApiException.Kind.DATA, "Domain record without id or name");
        }

        DcvExpiration expiration = null;
        if (json.has("dcv_expiration") && json.get("dcv_expiration").isJsonObject()) {
            JsonObject dates = json.getAsJsonObject("dcv_expiration");
            expiration = new DcvExpiration(date(dates, "ov"), date(dates, "ev"));
        }

        return new Domain(id, name, DcvMethod.fromValue(string(json, "dcv_method")), expiration);
    }

    private List<ValidationStatus> parseValidations(JsonObject json) {
        if (!json.has("validations") || !json.get("validations").isJsonArray()) {
            return null;
        }

        JsonArray array = json.getAsJsonArray("validations");
        if (array.isEmpty()) {
            return null;
        }

        List<ValidationStatus> validations = new ArrayList<>();
        for (JsonElement element : array) {
            JsonObject validation = element.getAsJsonObject();
            validations.add(new ValidationStatus(
                    string(validation, "type"),
                    string(validation, "status"),
                    string(validation, "dcv_status")));
        }
        return validations;
    }

    private ValidationToken parseToken(JsonObject json) throws ApiException {
        if (!json.has("dcv_token") || !json.get("dcv_token").isJsonObject()) {
            throw new ApiException(ApiException.Kind.DATA, "Response has no dcv_token");
        }

        JsonObject token = json.getAsJsonObject("dcv_token");
        String value = string(token, "token");
        String verification = string(token, "verification_value");
        if (value == null || verification == null) {
            throw new ApiException(ApiException.Kind.DATA, "Incomplete dcv_token in response");
        }
        return new ValidationToken(value, verification);
    }

    private static String string(JsonObject json, String name) {
        JsonElement element = json.get(name);
        return element != null && !element.isJsonNull() ? element.getAsString() : null;
    }

    private static LocalDate date(JsonObject json, String name) throws ApiException {
        String value = string(json, name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new ApiException(ApiException.Kind.DATA, "Invalid " + name + " expiration date: " + value, e);
        }
    }

    /**
     * Builder for DigiCertClient.
     */
    public static class Builder {
        private String baseUrl = "https://www.digicert.com/services/v2";
        private String key;
        private int connectTimeout = DEFAULT_TIMEOUT;
        private int readTimeout = DEFAULT_TIMEOUT;

        /**
         * Sets the API base URL.
         *
         * @param baseUrl Base URL (e.g., "https://www.digicert.com/services/v2").
         * @return Builder instance.
         */
        public Builder withBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        /**
         * Sets the API key.
         *
         * @param key DigiCert API key.
         * @return Builder instance.
         */
        public Builder withKey(String key) {
            this.key = key;
            return this;
        }

        /**
         * Sets connection timeout.
         *
         * @param timeout Timeout in seconds.
         * @return Builder instance.
         */
        public Builder withConnectTimeout(int timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        /**
         * Sets read and write timeout.
         *
         * @param timeout Timeout in seconds.
         * @return Builder instance.
         */
        public Builder withReadTimeout(int timeout) {
            this.readTimeout = timeout;
            return this;
        }

        /**
         * Builds the DigiCertClient instance.
         *
         * @return DigiCertClient instance.
         * @throws NullPointerException if the key is missing.
         */
        public DigiCertClient build() {
            Objects.requireNonNull(baseUrl, "baseUrl must not be null");
            Objects.requireNonNull(key, "key must not be null");
            return new DigiCertClient(this);
        }
    }
}
