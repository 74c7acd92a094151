package io.github.hongjungwan.auditlog.api.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * 마스킹된 요청 상세 (params, query, headers, body).
 *
 * <p>JSON 트리는 생성 시 복사되고, getter는 복사본을 반환한다.</p>
 */
public final class RequestDetails {

    private final JsonNode params;
    private final JsonNode query;
    private final JsonNode headers;
    private final JsonNode body;

    @JsonCreator
    public RequestDetails(
            @JsonProperty("params") JsonNode params,
            @JsonProperty("query") JsonNode query,
            @JsonProperty("headers") JsonNode headers,
            @JsonProperty("body") JsonNode body) {
        this.params = copyOrEmpty(params);
        this.query = copyOrEmpty(query);
        this.headers = copyOrEmpty(headers);
        this.body = copyOrEmpty(body);
    }

    public static RequestDetails empty() {
        return new RequestDetails(null, null, null, null);
    }

    public JsonNode getParams() {
        return params.deepCopy();
    }

    public JsonNode getQuery() {
        return query.deepCopy();
    }

    public JsonNode getHeaders() {
        return headers.deepCopy();
    }

    public JsonNode getBody() {
        return body.deepCopy();
    }

    static JsonNode copyOrEmpty(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return JsonNodeFactory.instance.objectNode();
        }
        return node.deepCopy();
    }

    @Override
    public String toString() {
        return "RequestDetails{params=" + params + ", query=" + query
                + ", headers=" + headers + ", body=" + body + "}";
    }
}
