package com.lattice.gateway.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lattice.tenancy.GraphQueryException;
import com.lattice.tenancy.GraphTransport;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

/**
 * {@link GraphTransport} that POSTs GraphQL to {@code /graphql}, adding {@code ?namespace=} when
 * bound to a non-default namespace.
 */
public class HttpGraphTransport implements GraphTransport {

    private final RestClient client;
    private final ObjectMapper mapper;

    public HttpGraphTransport(RestClient client, ObjectMapper mapper) {
        this.client = client;
        this.mapper = mapper;
    }

    @Override
    public JsonNode execute(String namespace, String query, Map<String, Object> variables) {
        ObjectNode body = mapper.createObjectNode();
        body.put("query", query);
        body.set("variables", mapper.valueToTree(variables == null ? Map.of() : variables));

        JsonNode response = client.post()
                .uri(uri -> uri.path("/graphql")
                        .queryParamIfPresent("namespace", Optional.ofNullable(namespace))
                        .build())
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(JsonNode.class);
        if (response == null) {
            throw new GraphQueryException(List.of("empty response"));
        }

        JsonNode errors = response.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            List<String> messages = new ArrayList<>();
            errors.forEach(error -> messages.add(error.path("message").asText(error.toString())));
            throw new GraphQueryException(messages);
        }
        return response.path("data");
    }
}
