package tech.yump.audit.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.audit.adapter.InvalidLogDataException;
import tech.yump.audit.adapter.UnsupportedMethodException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON form of a {@link Query}: {@code {"method":"equal","attribute":"userId","values":["u1"]}}.
 * The attribute key is left out when empty.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueryCodec {

    private final ObjectMapper objectMapper;

    public String toJson(Query query) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("method", query.method().wireName());
        if (!query.attribute().isEmpty()) {
            json.put("attribute", query.attribute());
        }
        json.put("values", query.values());
        try {
            return objectMapper.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new InvalidLogDataException("Query is not JSON serializable: " + e.getOriginalMessage(), e);
        }
    }

    public Query parse(String json) {
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new UnsupportedMethodException("Invalid query: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new UnsupportedMethodException("Invalid query. Must be an object, got " + describe(node));
        }

        JsonNode method = node.path("method");
        JsonNode attribute = node.path("attribute");
        JsonNode values = node.path("values");

        if (!method.isTextual()) {
            throw new UnsupportedMethodException("Invalid query method. Must be a string, got " + describe(method));
        }
        if (!attribute.isMissingNode() && !attribute.isTextual()) {
            throw new UnsupportedMethodException("Invalid query attribute. Must be a string, got " + describe(attribute));
        }
        if (!values.isMissingNode() && !values.isArray()) {
            throw new UnsupportedMethodException("Invalid query values. Must be an array, got " + describe(values));
        }

        QueryMethod queryMethod = QueryMethod.fromWireName(method.asText())
                .orElseThrow(() -> new UnsupportedMethodException("Unsupported query method: " + method.asText()));

        List<Object> operands = new ArrayList<>();
        values.forEach(value -> operands.add(objectMapper.convertValue(value, Object.class)));

        return new Query(queryMethod, attribute.isMissingNode() ? "" : attribute.asText(), operands);
    }

    public List<Query> parseAll(List<String> queries) {
        if (queries == null) {
            return List.of();
        }
        log.debug("Parsing {} JSON queries", queries.size());
        return queries.stream().map(this::parse).toList();
    }

    private String describe(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "nothing";
        }
        return node.getNodeType().name().toLowerCase();
    }
}
