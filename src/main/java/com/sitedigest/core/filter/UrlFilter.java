package com.sitedigest.core.filter;

import com.sitedigest.core.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides whether a discovered link is worth retrieving.
 * <p>
 * A link is eligible when it parses as an absolute or origin-relative URL,
 * uses http(s), lives on the same host as the origin, and matches none of the
 * configured {@link ExclusionRule}s. Rules are evaluated in order and the
 * first match rejects. All methods are free of side effects.
 */
@Component
public class UrlFilter {

    private static final Logger log = LoggerFactory.getLogger(UrlFilter.class);

    private final List<ExclusionRule> rules;

    @Autowired
    public UrlFilter(PipelineProperties properties) {
        this(ExclusionRule.fromProperties(properties.getExcludedPatterns()));
    }

    public UrlFilter(List<ExclusionRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<ExclusionRule> rules() {
        return rules;
    }

    /**
     * Returns true if {@code candidateUrl} should be retrieved for a crawl
     * seeded at {@code originUrl}.
     */
    public boolean isEligible(String candidateUrl, String originUrl) {
        return rejectionReason(candidateUrl, originUrl).isEmpty();
    }

    /**
     * Explains why a link is rejected; empty when it is eligible.
     */
    public Optional<String> rejectionReason(String candidateUrl, String originUrl) {
        Optional<URI> origin = resolve(originUrl, null);
        if (origin.isEmpty()) {
            return Optional.of("origin is not an absolute http(s) URL");
        }
        if (candidateUrl == null || candidateUrl.isBlank()) {
            return Optional.of("blank");
        }
        if (candidateUrl.trim().startsWith("#")) {
            return Optional.of("fragment-only");
        }
        Optional<URI> resolved = resolve(candidateUrl, origin.get());
        if (resolved.isEmpty()) {
            return Optional.of("malformed or non-http scheme");
        }
        URI uri = resolved.get();
        if (!origin.get().getHost().equalsIgnoreCase(uri.getHost())) {
            return Optional.of("different host " + uri.getHost());
        }
        String target = pathAndQuery(uri);
        for (var rule : rules) {
            if (rule.matches(target)) {
                return Optional.of("excluded category " + rule.category());
            }
        }
        return Optional.empty();
    }

    /**
     * Filters {@code candidates} in order, keeping eligible links and dropping
     * later links whose normalized form was already kept. Returned entries are
     * the absolute forms of the accepted candidates, without any fragment.
     */
    public List<String> select(Iterable<String> candidates, String originUrl) {
        var origin = resolve(originUrl, null);
        var accepted = new ArrayList<String>();
        if (origin.isEmpty()) {
            log.warn("Origin {} is not an absolute http(s) URL; no links are eligible", originUrl);
            return accepted;
        }
        var seen = new HashSet<String>();
        for (String candidate : candidates) {
            var reason = rejectionReason(candidate, originUrl);
            if (reason.isPresent()) {
                log.debug("Rejected {}: {}", candidate, reason.get());
                continue;
            }
            String absolute = withoutFragment(resolve(candidate, origin.get()).orElseThrow());
            if (seen.add(normalize(absolute))) {
                accepted.add(absolute);
            } else {
                log.debug("Rejected {}: duplicate", candidate);
            }
        }
        return accepted;
    }

    /**
     * Absolute form of {@code candidate}, resolving origin-relative paths
     * ("/about") against {@code origin}. Empty for unparseable links, relative
     * links that are not origin-relative, and non-http(s) schemes.
     */
    public static Optional<URI> resolve(String candidate, URI origin) {
        if (candidate == null || candidate.isBlank()) {
            return Optional.empty();
        }
        URI uri;
        try {
            uri = new URI(candidate.trim());
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
        if (!uri.isAbsolute()) {
            if (origin == null || uri.getRawPath() == null || !uri.getRawPath().startsWith("/")) {
                return Optional.empty();
            }
            uri = origin.resolve(uri);
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            return Optional.empty();
        }
        if (uri.getHost() == null) {
            return Optional.empty();
        }
        return Optional.of(uri);
    }

    /**
     * Canonical dedup key: lower-cased scheme and host, fragment stripped,
     * trailing slash removed from the path.
     */
    public static String normalize(String url) {
        Optional<URI> parsed = resolve(url, null);
        if (parsed.isEmpty()) {
            return url == null ? "" : url.trim();
        }
        URI uri = parsed.get();
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        var sb = new StringBuilder()
                .append(uri.getScheme().toLowerCase(Locale.ROOT))
                .append("://")
                .append(uri.getHost().toLowerCase(Locale.ROOT));
        if (uri.getPort() != -1) {
            sb.append(':').append(uri.getPort());
        }
        sb.append(path);
        if (uri.getRawQuery() != null) {
            sb.append('?').append(uri.getRawQuery());
        }
        return sb.toString();
    }

    static String withoutFragment(URI uri) {
        String raw = uri.toString();
        int hash = raw.indexOf('#');
        return hash < 0 ? raw : raw.substring(0, hash);
    }

    private static String pathAndQuery(URI uri) {
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        String query = uri.getRawQuery() == null ? "" : "?" + uri.getRawQuery();
        return (path + query).toLowerCase(Locale.ROOT);
    }
}
