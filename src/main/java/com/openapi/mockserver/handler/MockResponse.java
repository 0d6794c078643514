package com.openapi.mockserver.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.mockserver.openapi.ApiOperation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The response being built for a mock request.
 *
 * <p>When the operation's success response has an example, the body starts out as that
 * example. Handlers still update the data store but leave an existing body untouched.</p>
 */
public class MockResponse {
    private int status;
    private JsonNode body;
    private Instant lastModified;
    private final boolean collection;
    private final boolean empty;
    private final Map<String, String> headers = new LinkedHashMap<>();

    public MockResponse(int status, boolean collection, boolean empty) {
        this.status = status;
        this.collection = collection;
        this.empty = empty;
    }

    /**
     * Creates a response shaped by the operation's primary success response, with the
     * response example (if any) as its body.
     */
    public static MockResponse forOperation(ApiOperation operation) {
        MockResponse response = new MockResponse(operation.getSuccessStatus(), operation.isCollectionResponse(),
                operation.isEmptyResponse());
        if (operation.getExample() != null) {
            response.setBody(operation.getExample().deepCopy());
        }
        return response;
    }

    public int getStatus() {
        return status;
    }

    public void setStatus(int status) {
        this.status = status;
    }

    /**
     * The response body, or null if none has been set.
     */
    public JsonNode getBody() {
        return body;
    }

    public void setBody(JsonNode body) {
        this.body = body == null || body.isMissingNode() ? null : body;
    }

    public boolean hasBody() {
        return body != null;
    }

    public Instant getLastModified() {
        return lastModified;
    }

    public void setLastModified(Instant lastModified) {
        this.lastModified = lastModified;
    }

    /**
     * True if the operation responds with an array of resources.
     */
    public boolean isCollection() {
        return collection;
    }

    /**
     * True if the operation responds without a body.
     */
    public boolean isEmpty() {
        return empty;
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    public void setHeader(String name, String value) {
        headers.put(name, value);
    }
}
