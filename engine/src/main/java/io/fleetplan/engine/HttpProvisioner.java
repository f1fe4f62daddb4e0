// file: engine/src/main/java/io/fleetplan/engine/HttpProvisioner.java
package io.fleetplan.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * HTTP-based Provisioner.
 *
 * Talks to a provisioning API:
 *
 *   POST   /instances               {"service": "...", "params": {"server_uuid"?, "shard"?, "image_uuid"}}
 *                                   -> {"uuid": "..."}
 *   DELETE /instances/{id}
 *   PUT    /instances/{id}/upgrade  {"image_uuid": "..."}
 *
 * Paths are relative to the base URI, so a base such as
 * {@code http://prov:8080/api/v1} addresses {@code /api/v1/instances}.
 *
 * Any non-2xx status, transport failure or unreadable response becomes a
 * {@link ProvisioningException}. No retries.
 */
public final class HttpProvisioner implements Provisioner {
    private static final Logger log = Logger.getLogger(HttpProvisioner.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final URI baseUri;
    private final HttpClient client;
    private final Duration timeout; // may be null: no per-request timeout

    public HttpProvisioner(URI baseUri) {
        this(baseUri, null);
    }

    public HttpProvisioner(URI baseUri, Duration timeout) {
        this.baseUri = asDirectory(Objects.requireNonNull(baseUri, "baseUri"));
        this.timeout = timeout;
        HttpClient.Builder builder = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1);
        if (timeout != null) {
            builder.connectTimeout(timeout);
        }
        this.client = builder.build();
    }

    @Override
    public String deploy(DeployOptions options, String service) {
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(service, "service");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", service);
        body.put("params", options.params());

        String what = "deploying " + service;
        HttpResponse<String> resp = send(
                request("instances").POST(HttpRequest.BodyPublishers.ofString(toJson(body))), what);

        DeployResponseDto dto;
        try {
            dto = MAPPER.readValue(resp.body(), DeployResponseDto.class);
        } catch (JsonProcessingException e) {
            throw new ProvisioningException(what + ": unreadable response", resp.statusCode(), e);
        }
        if (dto.uuid() == null || dto.uuid().isBlank()) {
            throw new ProvisioningException(what + ": response has no instance uuid", resp.statusCode(), null);
        }
        return dto.uuid();
    }

    @Override
    public void undeploy(String instanceId) {
        Objects.requireNonNull(instanceId, "instanceId");
        send(request("instances/" + encode(instanceId)).DELETE(), "removing " + instanceId);
    }

    @Override
    public void reprovision(String instanceId, String imageId) {
        Objects.requireNonNull(instanceId, "instanceId");
        Objects.requireNonNull(imageId, "imageId");
        String json = toJson(Map.of("image_uuid", imageId));
        send(request("instances/" + encode(instanceId) + "/upgrade")
                .PUT(HttpRequest.BodyPublishers.ofString(json)), "reprovisioning " + instanceId);
    }

    private HttpRequest.Builder request(String path) {
        HttpRequest.Builder b = HttpRequest.newBuilder(baseUri.resolve(path))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json");
        if (timeout != null) {
            b.timeout(timeout);
        }
        return b;
    }

    private HttpResponse<String> send(HttpRequest.Builder builder, String what) {
        HttpRequest req = builder.build();
        HttpResponse<String> resp;
        try {
            resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ProvisioningException(what + ": " + req.method() + " " + req.uri() + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProvisioningException(what + ": interrupted", e);
        }

        int status = resp.statusCode();
        log.fine(() -> "HTTP " + req.method() + " " + req.uri() + " -> " + status);
        if (status < 200 || status >= 300) {
            throw new ProvisioningException(
                    what + ": " + req.method() + " " + req.uri() + " returned HTTP " + status
                            + (resp.body() == null || resp.body().isBlank() ? "" : ": " + resp.body()),
                    status, null);
        }
        return resp;
    }

    private static String toJson(Object body) {
        try {
            return MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ProvisioningException("encoding request body", e);
        }
    }

    /** Base URI with a path ending in '/', so relative paths resolve beneath it. */
    static URI asDirectory(URI base) {
        String path = base.getRawPath();
        if (path != null && path.endsWith("/")) {
            return base;
        }
        String s = base.toString();
        int cut = s.length();
        if (base.getRawFragment() != null) {
            cut = s.indexOf('#');
        }
        if (base.getRawQuery() != null) {
            cut = Math.min(cut, s.indexOf('?'));
        }
        return URI.create(s.substring(0, cut) + "/");
    }

    /** Percent-encode one path segment (URLEncoder alone would turn spaces into '+'). */
    static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    // ---------- JSON DTOs ----------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class DeployResponseDto {
        private final String uuid;

        @JsonCreator
        public DeployResponseDto(@JsonProperty("uuid") String uuid) {
            this.uuid = uuid;
        }

        public String uuid() {
            return uuid;
        }
    }
}
