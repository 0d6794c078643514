package com.openapi.mockserver.openapi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.parser.OpenAPIParser;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.examples.Example;
import io.swagger.v3.oas.models.media.ArraySchema;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.responses.ApiResponses;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import io.swagger.v3.parser.util.RefUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Reads Swagger 2.0 and OpenAPI 3.x documents, in JSON or YAML, into an {@link OpenApiDocument}.
 *
 * <p>Parsing is done by swagger-parser, which converts Swagger 2.0 documents to OpenAPI 3
 * and pulls references to other files into the document's components.</p>
 */
public class OpenApiParser {
    private static final Logger log = LoggerFactory.getLogger(OpenApiParser.class);

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Parses a document file. Relative references are resolved against the file's directory.
     */
    public OpenApiDocument parse(Path file) {
        if (!Files.isReadable(file)) {
            throw new OpenApiParseException("Unable to read OpenAPI document: " + file);
        }
        String location = file.toAbsolutePath().toString();
        OpenApiDocument document = toDocument(read(parser -> parser.readLocation(location, null, options()), location));
        log.info("openapi.loaded file={} paths={} operations={}",
                file, document.getPaths().size(), document.operationCount());
        return document;
    }

    public OpenApiDocument parse(InputStream in) {
        try {
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new OpenApiParseException("Unable to read OpenAPI document: " + e.getMessage(), e);
        }
    }

    public OpenApiDocument parse(String content) {
        return toDocument(read(parser -> parser.readContents(content, null, options()), "<inline>"));
    }

    private static ParseOptions options() {
        ParseOptions options = new ParseOptions();
        options.setResolve(true);
        options.setResolveFully(false);
        return options;
    }

    private static OpenAPI read(Function<OpenAPIParser, SwaggerParseResult> reader, String source) {
        SwaggerParseResult result;
        try {
            result = reader.apply(new OpenAPIParser());
        } catch (RuntimeException e) {
            throw new OpenApiParseException("Invalid OpenAPI document " + source + ": " + e.getMessage(), e);
        }

        List<String> messages = result == null || result.getMessages() == null ? List.of() : result.getMessages();
        if (result == null || result.getOpenAPI() == null) {
            throw new OpenApiParseException("Invalid OpenAPI document " + source + ": "
                    + (messages.isEmpty() ? "not a Swagger 2.0 or OpenAPI 3 document" : String.join("; ", messages)));
        }
        for (String message : messages) {
            log.warn("openapi.parseWarning source={} message={}", source, message);
        }
        return result.getOpenAPI();
    }

    private OpenApiDocument toDocument(OpenAPI openApi) {
        Components components = openApi.getComponents();
        OpenApiDocument.Builder builder = OpenApiDocument.builder()
                .title(openApi.getInfo() != null ? openApi.getInfo().getTitle() : null)
                .basePath(basePath(openApi.getServers()))
                .security(security(openApi.getSecurity()));

        if (components != null && components.getSecuritySchemes() != null) {
            components.getSecuritySchemes().forEach((id, scheme) -> builder.securityScheme(securityScheme(id, scheme)));
        }

        if (openApi.getPaths() == null) {
            return builder.build();
        }
        for (Map.Entry<String, PathItem> entry : openApi.getPaths().entrySet()) {
            String template = entry.getKey();
            if (!template.startsWith("/")) {
                log.warn("openapi.skipped reason=invalid_path path={}", template);
                continue;
            }
            builder.path(template);
            if (entry.getValue() == null) {
                continue;
            }
            entry.getValue().readOperationsMap().forEach((method, operation) ->
                    builder.operation(operation(components, template, method, operation)));
        }
        return builder.build();
    }

    private ApiOperation operation(Components components, String template,
                                   PathItem.HttpMethod method, Operation operation) {
        ApiOperation.Builder builder = ApiOperation.builder()
                .method(method.name())
                .pathTemplate(template)
                .operationId(operation.getOperationId());

        if (operation.getSecurity() != null) {
            builder.security(security(operation.getSecurity()));
        }

        ApiResponses responses = operation.getResponses();
        String successCode = successResponseCode(responses);
        builder.successStatus(successCode == null || "default".equals(successCode)
                ? 200 : Integer.parseInt(successCode));

        MediaType content = null;
        if (successCode != null) {
            ApiResponse response = response(components, responses.get(successCode), method + " " + template);
            content = firstContentWithSchema(response);
        }

        if (content == null) {
            builder.emptyResponse(true);
            return builder.build();
        }
        Schema<?> schema = schema(components, content.getSchema());
        return builder
                .collectionResponse(isArray(schema))
                .example(example(components, content, schema))
                .build();
    }

    /**
     * Lowest 2xx code, else {@code default}, else null.
     */
    private static String successResponseCode(ApiResponses responses) {
        if (responses == null) {
            return null;
        }
        String best = null;
        int bestCode = Integer.MAX_VALUE;
        for (String code : responses.keySet()) {
            if (code.length() == 3 && code.startsWith("2") && Character.isDigit(code.charAt(1))
                    && Character.isDigit(code.charAt(2))) {
                int value = Integer.parseInt(code);
                if (value < bestCode) {
                    bestCode = value;
                    best = code;
                }
            }
        }
        if (best == null && responses.containsKey("default")) {
            return "default";
        }
        return best;
    }

    private static MediaType firstContentWithSchema(ApiResponse response) {
        if (response.getContent() == null) {
            return null;
        }
        for (MediaType mediaType : response.getContent().values()) {
            if (mediaType != null && mediaType.getSchema() != null) {
                return mediaType;
            }
        }
        return null;
    }

    private static ApiResponse response(Components components, ApiResponse response, String operation) {
        if (response == null) {
            throw new OpenApiParseException("Missing success response for " + operation);
        }
        return component(response, ApiResponse::get$ref,
                components != null ? components.getResponses() : null);
    }

    @SuppressWarnings("rawtypes")
    private static Schema<?> schema(Components components, Schema<?> schema) {
        Map<String, Schema> schemas = components != null ? components.getSchemas() : null;
        return component((Schema) schema, Schema::get$ref, schemas);
    }

    /**
     * Follows a {@code #/components/...} reference to the named component.
     */
    private static <T> T component(T value, Function<T, String> refOf, Map<String, T> registry) {
        T current = value;
        Set<String> seen = new HashSet<>();
        while (current != null && refOf.apply(current) != null) {
            String ref = refOf.apply(current);
            if (!seen.add(ref)) {
                throw new OpenApiParseException("Circular $ref: " + ref);
            }
            T target = registry != null ? registry.get(RefUtils.computeDefinitionName(ref)) : null;
            if (target == null) {
                throw new OpenApiParseException("Unresolvable $ref: " + ref);
            }
            current = target;
        }
        return current;
    }

    private static boolean isArray(Schema<?> schema) {
        if (schema instanceof ArraySchema || "array".equals(schema.getType())) {
            return true;
        }
        // OpenAPI 3.1 keeps the type in a set
        return schema.getTypes() != null && schema.getTypes().contains("array");
    }

    private JsonNode example(Components components, MediaType content, Schema<?> schema) {
        Object example = content.getExample();
        if (example == null && content.getExamples() != null && !content.getExamples().isEmpty()) {
            Example first = component(content.getExamples().values().iterator().next(), Example::get$ref,
                    components != null ? components.getExamples() : null);
            example = first.getValue();
        }
        if (example == null) {
            example = schema.getExample();
        }
        return example == null ? null : mapper.valueToTree(example);
    }

    private static List<SecurityRequirement> security(
            List<io.swagger.v3.oas.models.security.SecurityRequirement> security) {
        List<SecurityRequirement> requirements = new ArrayList<>();
        if (security == null) {
            return requirements;
        }
        for (io.swagger.v3.oas.models.security.SecurityRequirement requirement : security) {
            Map<String, List<String>> schemes = new LinkedHashMap<>();
            requirement.forEach((id, scopes) -> schemes.put(id, scopes != null ? scopes : List.of()));
            requirements.add(new SecurityRequirement(schemes));
        }
        return requirements;
    }

    private static SecurityScheme securityScheme(String id, io.swagger.v3.oas.models.security.SecurityScheme scheme) {
        return new SecurityScheme(
                id,
                scheme.getType() != null ? SecuritySchemeType.fromValue(scheme.getType().toString())
                        : SecuritySchemeType.UNKNOWN,
                scheme.getName(),
                scheme.getIn() != null ? scheme.getIn().toString() : null,
                scheme.getScheme());
    }

    /**
     * Path of the first server URL; relative, scheme-relative and absolute URLs are accepted.
     */
    private static String basePath(List<Server> servers) {
        if (servers == null || servers.isEmpty() || servers.get(0).getUrl() == null) {
            return null;
        }
        String url = servers.get(0).getUrl();
        if (url.isEmpty() || url.contains("{")) {
            return null;
        }
        try {
            return URI.create(url).getPath();
        } catch (IllegalArgumentException e) {
            log.warn("openapi.skipped reason=invalid_server_url url={}", url);
            return null;
        }
    }
}
