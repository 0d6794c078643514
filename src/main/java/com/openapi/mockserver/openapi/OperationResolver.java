package com.openapi.mockserver.openapi;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.openapi.mockserver.core.model.RoutingOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches request paths against the path templates of an {@link OpenApiDocument}.
 *
 * <p>The document's base path is stripped first. Templates with more literal segments
 * win over templates with more parameters ({@code /pets/mine} beats {@code /pets/{id}});
 * ties go to the template declared first. Literal comparison honours
 * {@link RoutingOptions}.</p>
 *
 * <p>Path matches are cached per request path in a Caffeine cache; the method is applied
 * after the cache lookup.</p>
 */
public class OperationResolver {
    private static final Logger log = LoggerFactory.getLogger(OperationResolver.class);
    private static final Pattern PARAM = Pattern.compile("\\{([^}/]+)}");

    private final OpenApiDocument document;
    private final RoutingOptions routing;
    private final List<CompiledTemplate> templates;
    private final Cache<String, Optional<PathMatch>> cache;

    public OperationResolver(OpenApiDocument document) {
        this(document, RoutingOptions.defaults(), ResolverConfig.defaults());
    }

    public OperationResolver(OpenApiDocument document, RoutingOptions routing, ResolverConfig config) {
        this.document = document;
        this.routing = routing != null ? routing : RoutingOptions.defaults();
        this.templates = compile(document, this.routing);
        ResolverConfig cfg = config != null ? config : ResolverConfig.defaults();
        this.cache = cfg.cacheEnabled()
                ? Caffeine.newBuilder()
                        .maximumSize(cfg.maxSize())
                        .expireAfterWrite(cfg.ttl())
                        .build()
                : null;
        log.info("OperationResolver initialized: templates={} basePath='{}' cache={}",
                templates.size(), document.getBasePath(), cfg.cacheEnabled());
    }

    public OpenApiDocument getDocument() {
        return document;
    }

    public RoutingOptions getRouting() {
        return routing;
    }

    /**
     * Resolves a request against the document.
     *
     * @param method      the HTTP method
     * @param requestPath the full request path, including the base path
     * @return the resolved request, or empty if no path template matches
     */
    public Optional<OpenApiRequest> resolve(String method, String requestPath) {
        String path = requestPath == null || requestPath.isEmpty() ? "/"
                : (requestPath.startsWith("/") ? requestPath : "/" + requestPath);

        String relative = stripBasePath(path);
        if (relative == null) {
            log.debug("resolve.miss reason=outside_base_path path={}", path);
            return Optional.empty();
        }

        Optional<PathMatch> match = cache != null
                ? cache.get(relative, this::match)
                : match(relative);

        return match.map(m -> new OpenApiRequest(document, method, path, m.template(), m.params()));
    }

    /**
     * Number of request paths currently cached.
     */
    public long cachedPathCount() {
        if (cache == null) {
            return 0;
        }
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private String stripBasePath(String path) {
        String basePath = document.getBasePath();
        if (basePath.isEmpty()) {
            return path;
        }
        boolean prefixed = routing.caseSensitive()
                ? path.startsWith(basePath)
                : path.regionMatches(true, 0, basePath, 0, basePath.length());
        if (!prefixed) {
            return null;
        }
        String relative = path.substring(basePath.length());
        if (relative.isEmpty()) {
            return "/";
        }
        return relative.startsWith("/") ? relative : null;
    }

    private Optional<PathMatch> match(String relativePath) {
        for (CompiledTemplate template : templates) {
            Matcher matcher = template.pattern().matcher(relativePath);
            if (matcher.matches()) {
                Map<String, String> params = new LinkedHashMap<>();
                for (int i = 0; i < template.paramNames().size(); i++) {
                    params.put(template.paramNames().get(i), matcher.group(i + 1));
                }
                return Optional.of(new PathMatch(template.template(), params));
            }
        }
        return Optional.empty();
    }

    private static List<CompiledTemplate> compile(OpenApiDocument document, RoutingOptions routing) {
        List<CompiledTemplate> compiled = new ArrayList<>();
        int order = 0;
        for (String template : document.getPaths().keySet()) {
            compiled.add(compileTemplate(template, routing, order++));
        }
        compiled.sort(Comparator.comparingInt(CompiledTemplate::literalSegments).reversed()
                .thenComparingInt(CompiledTemplate::order));
        return List.copyOf(compiled);
    }

    static CompiledTemplate compileTemplate(String template, RoutingOptions routing, int order) {
        String body = template;
        if (!routing.strict() && body.length() > 1 && body.endsWith("/")) {
            body = body.substring(0, body.length() - 1);
        }

        StringBuilder regex = new StringBuilder();
        List<String> paramNames = new ArrayList<>();
        Matcher matcher = PARAM.matcher(body);
        int last = 0;
        while (matcher.find()) {
            regex.append(Pattern.quote(body.substring(last, matcher.start())));
            regex.append("([^/]+)");
            paramNames.add(matcher.group(1));
            last = matcher.end();
        }
        regex.append(Pattern.quote(body.substring(last)));
        if (!routing.strict() && !body.equals("/")) {
            regex.append("/?");
        }

        int literalSegments = 0;
        for (String segment : body.split("/")) {
            if (!segment.isEmpty() && !segment.contains("{")) {
                literalSegments++;
            }
        }

        int flags = routing.caseSensitive() ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        return new CompiledTemplate(template, Pattern.compile(regex.toString(), flags),
                List.copyOf(paramNames), literalSegments, order);
    }

    record CompiledTemplate(String template, Pattern pattern, List<String> paramNames,
                            int literalSegments, int order) {
    }

    record PathMatch(String template, Map<String, String> params) {
    }
}
