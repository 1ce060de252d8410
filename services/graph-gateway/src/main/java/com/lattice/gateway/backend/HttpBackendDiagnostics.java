package com.lattice.gateway.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lattice.tenancy.capability.BackendDiagnostics;
import com.lattice.tenancy.capability.HealthReport;
import com.lattice.tenancy.capability.LicenseReport;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;

/**
 * {@link BackendDiagnostics} over the backend's HTTP endpoints: {@code /health}, {@code /state}
 * and {@code /admin/schema?namespace=}.
 *
 * <p>4xx answers are data (an OSS backend rejects what it does not support); 5xx answers and
 * connection failures throw. Only an error-free 2xx answer confirms namespace-scoped operations.
 */
public class HttpBackendDiagnostics implements BackendDiagnostics {

    private static final Logger log = LoggerFactory.getLogger(HttpBackendDiagnostics.class);

    private final RestClient client;
    private final ObjectMapper mapper = new ObjectMapper();

    public HttpBackendDiagnostics(RestClient client) {
        this.client = client;
    }

    @Override
    public HealthReport health() {
        Answer answer = get("/health");
        if (!answer.status().is2xxSuccessful()) {
            return new HealthReport(null, List.of(), false);
        }
        JsonNode node = answer.json();
        if (node.isArray()) {
            node = node.isEmpty() ? mapper.createObjectNode() : node.get(0);
        }
        List<String> features = new ArrayList<>();
        node.path("ee_features").forEach(feature -> features.add(feature.asText()));
        boolean flag = node.path("enterprise").asBoolean(false) || node.hasNonNull("license");
        return new HealthReport(node.path("version").asText(null), features, flag);
    }

    @Override
    public LicenseReport license() {
        Answer answer = get("/state");
        JsonNode license = answer.json().path("license");
        if (!answer.status().is2xxSuccessful() || license.isMissingNode() || license.isNull()) {
            return LicenseReport.absent();
        }
        Instant expiry = null;
        JsonNode expiryTs = license.path("expiryTs");
        if (!expiryTs.isMissingNode() && !expiryTs.isNull() && !expiryTs.asText().isBlank()) {
            expiry = Instant.ofEpochSecond(Long.parseLong(expiryTs.asText().trim()));
        }
        return new LicenseReport(true, license.path("enabled").asBoolean(false),
                license.path("user").asText(""), expiry);
    }

    @Override
    public boolean namespaceScopedOperationsWork(String namespace) {
        Answer answer = get("/admin/schema?namespace=" + namespace);
        boolean confirmed = answer.status().is2xxSuccessful() && !answer.json().has("errors");
        if (!confirmed) {
            log.debug("Namespace-scoped schema read on {} rejected with {}: {}",
                    namespace, answer.status().value(), abbreviate(answer.body()));
        }
        return confirmed;
    }

    private Answer get(String path) {
        return client.get()
                .uri(path)
                .exchange((request, response) -> {
                    HttpStatusCode status = response.getStatusCode();
                    String body = new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    if (status.is5xxServerError()) {
                        throw new BackendUnavailableException(
                                "GET " + path + " answered " + status.value());
                    }
                    return new Answer(status, body, parse(body));
                });
    }

    private static String abbreviate(String body) {
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }

    private JsonNode parse(String body) {
        if (body.isBlank()) {
            return mapper.missingNode();
        }
        try {
            return mapper.readTree(body);
        } catch (IOException e) {
            // plain-text answers carry no JSON
            return mapper.missingNode();
        }
    }

    private record Answer(HttpStatusCode status, String body, JsonNode json) {}
}
