package com.openapi.mockserver.openapi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * A request resolved against an OpenAPI document: the matched path template, its
 * path parameters and, when the document defines the request's method, the operation.
 */
public class OpenApiRequest {
    private final OpenApiDocument document;
    private final String method;
    private final String requestPath;
    private final String pathTemplate;
    private final Map<String, String> pathParams;
    private final ApiOperation operation;

    public OpenApiRequest(OpenApiDocument document, String method, String requestPath,
                          String pathTemplate, Map<String, String> pathParams) {
        this.document = document;
        this.method = method.toUpperCase(Locale.ROOT);
        this.requestPath = requestPath;
        this.pathTemplate = pathTemplate;
        this.pathParams = pathParams == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(pathParams));
        this.operation = document.getOperations(pathTemplate).get(this.method);
    }

    public OpenApiDocument getDocument() {
        return document;
    }

    public String getMethod() {
        return method;
    }

    /**
     * The full request path, including the document's base path.
     */
    public String getRequestPath() {
        return requestPath;
    }

    public String getPathTemplate() {
        return pathTemplate;
    }

    public Map<String, String> getPathParams() {
        return pathParams;
    }

    /**
     * The matched operation, or null if the path does not define the request's method.
     */
    public ApiOperation getOperation() {
        return operation;
    }

    /**
     * True if both the path and the method are defined by the document.
     */
    public boolean hasOperation() {
        return operation != null;
    }

    /**
     * Upper-case methods the matched path template defines, in document order.
     */
    public Set<String> getAllowedMethods() {
        return document.getOperations(pathTemplate).keySet();
    }

    /**
     * Security requirements that apply to this request: the operation's own, or the
     * document's global requirements when the operation declares none.
     */
    public List<SecurityRequirement> effectiveSecurity() {
        if (operation == null) {
            return List.of();
        }
        return operation.getSecurity() != null ? operation.getSecurity() : document.getSecurity();
    }

    /**
     * True if the path template addresses a collection, i.e. it does not end in a path parameter.
     * {@code /pets} is a collection path, {@code /pets/{petId}} is a resource path.
     */
    public boolean isCollectionPath() {
        String template = pathTemplate.endsWith("/") && pathTemplate.length() > 1
                ? pathTemplate.substring(0, pathTemplate.length() - 1)
                : pathTemplate;
        String lastSegment = template.substring(template.lastIndexOf('/') + 1);
        return !(lastSegment.startsWith("{") && lastSegment.endsWith("}"));
    }

    @Override
    public String toString() {
        return method + " " + requestPath + " -> " + pathTemplate;
    }
}
