package client;

import client.CkanExceptions.*;
import util.LoggingUtil;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Read-only client for a CKAN instance's v3 Action API: dataset search and resource download.
 * This class is final and designed to be thread-safe after construction.
 */
public final class CkanHandler implements ICatalog {

    private static final Logger logger = LoggingUtil.getLogger(CkanHandler.class);
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(90);
    private static final Duration DOWNLOAD_TIMEOUT = Duration.ofMinutes(30);
    static final String DEFAULT_USER_AGENT = "LocationExploration";
    static final int DEFAULT_PAGE_SIZE = 1000;
    private static final String FALLBACK_FILE_NAME = "resource";

    private static final String ACTION_PACKAGE_SEARCH = "package_search";

    private final String ckanApiUrlBase;
    private final String apiKey;
    private final String userAgent;
    private final int pageSize;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public CkanHandler(String ckanUrl, String apiKey) {
        this(ckanUrl, apiKey, DEFAULT_USER_AGENT, DEFAULT_PAGE_SIZE);
    }

    public CkanHandler(String ckanUrl, String apiKey, String userAgent, int pageSize) {
        Objects.requireNonNull(ckanUrl, "CKAN URL cannot be null");
        if (ckanUrl.trim().isEmpty()) { throw new IllegalArgumentException("CKAN URL cannot be empty."); }
        if (!ckanUrl.trim().toLowerCase(Locale.ROOT).startsWith("http")) { throw new IllegalArgumentException("CKAN URL must start with http:// or https://"); }
        if (pageSize < 1) { throw new IllegalArgumentException("Page size must be positive, got " + pageSize); }
        String baseUrl = ckanUrl.trim();
        this.ckanApiUrlBase = (baseUrl.endsWith("/api/3/action/") ? baseUrl :
                (baseUrl.endsWith("/") ? baseUrl : baseUrl + "/") + "api/3/action/");

        this.apiKey = (apiKey != null) ? apiKey.trim() : "";
        if (this.apiKey.isEmpty()) {
            logger.info("No CKAN API key configured; only public datasets will be visible.");
        }
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? DEFAULT_USER_AGENT : userAgent.trim();
        this.pageSize = pageSize;

        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(DEFAULT_REQUEST_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        logger.info("CKAN Handler initialized. API Base: {}", this.ckanApiUrlBase);
    }

    // --- Public CKAN Interaction Methods ---

    /**
     * Collects every dataset matching {@code filter} through {@code package_search}, one page
     * of {@code rows} at a time.
     */
    @Override
    public List<IDatasetHandle> searchDatasets(String filter) throws CkanException, IOException {
        List<IDatasetHandle> datasets = new ArrayList<>();
        int start = 0;
        while (true) {
            Map<String, Object> params = new LinkedHashMap<>();
            if (filter != null && !filter.isBlank()) {
                params.put("fq", filter);
            }
            params.put("rows", pageSize);
            params.put("start", start);
            Map<String, Object> page = sendRequest(ACTION_PACKAGE_SEARCH, params, new TypeReference<>() {});

            List<?> results = (page.get("results") instanceof List<?>) ? (List<?>) page.get("results") : List.of();
            for (Object result : results) {
                if (result instanceof Map<?, ?>) {
                    @SuppressWarnings("unchecked")
                    Map<String, Object> dictionary = (Map<String, Object>) result;
                    datasets.add(new CkanDataset(dictionary, this));
                }
            }
            long count = (page.get("count") instanceof Number) ? ((Number) page.get("count")).longValue() : datasets.size();
            logger.debug("package_search page at {} returned {} dataset(s) of {}", start, results.size(), count);
            start += results.size();
            if (results.isEmpty() || start >= count) {
                break;
            }
        }
        logger.info("Search '{}' matched {} dataset(s)", filter, datasets.size());
        return datasets;
    }

    /**
     * Streams {@code url} into {@code folder}, naming the file after the URL's last path segment.
     *
     * @return the downloaded file
     */
    public Path download(String url, Path folder) throws CkanException, IOException {
        Objects.requireNonNull(url, "URL cannot be null");
        Objects.requireNonNull(folder, "Target folder cannot be null");
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new CkanException("Invalid resource URL: " + url, e);
        }
        Files.createDirectories(folder);
        Path target = folder.resolve(fileNameFor(uri));

        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder(uri)
                .timeout(DOWNLOAD_TIMEOUT)
                .header("User-Agent", userAgent)
                .GET();
        if (!apiKey.isEmpty()) {
            requestBuilder.header("Authorization", apiKey);
        }

        long requestStartTime = System.nanoTime();
        HttpResponse<Path> response;
        try {
            response = httpClient.send(requestBuilder.build(), HttpResponse.BodyHandlers.ofFile(target));
        } catch (IOException e) {
            logger.error("Connection or I/O error downloading {}: {}", uri, e.getMessage());
            throw new CkanConnectionException("Communication error downloading " + uri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Download thread interrupted for {}", uri);
            throw new CkanConnectionException("Download interrupted for " + uri, e);
        }
        long durationMillis = Duration.ofNanos(System.nanoTime() - requestStartTime).toMillis();
        int statusCode = response.statusCode();
        if (statusCode == 404) {
            throw new CkanNotFoundException(String.format("Resource file not found (404): %s", uri));
        } else if (statusCode == 401 || statusCode == 403) {
            throw new CkanAuthorizationException(String.format("Not authorized to download (%d): %s", statusCode, uri));
        } else if (statusCode < 200 || statusCode >= 300) {
            throw new CkanConnectionException(String.format("Download of %s failed with status %d", uri, statusCode), null);
        }
        logger.info("Downloaded {} ({} bytes) in {} ms", target.getFileName(), Files.size(target), durationMillis);
        return target;
    }

    static String fileNameFor(URI uri) {
        String path = uri.getRawPath();
        if (path == null || path.isEmpty() || path.endsWith("/")) {
            return FALLBACK_FILE_NAME;
        }
        String segment = URLDecoder.decode(path.substring(path.lastIndexOf('/') + 1), StandardCharsets.UTF_8);
        try {
            Path name = Path.of(segment).getFileName();
            if (name == null || segment.contains("/") || segment.contains("\\") || segment.equals("..")) {
                return FALLBACK_FILE_NAME;
            }
            return name.toString();
        } catch (InvalidPathException e) {
            return FALLBACK_FILE_NAME;
        }
    }

    // --- Internal Request Sending Logic ---

    private <T> T sendRequest(String action, Map<String, Object> data, TypeReference<T> responseTypeRef) throws CkanException, IOException {
        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .timeout(DEFAULT_REQUEST_TIMEOUT)
                .header("User-Agent", userAgent);

        if (!this.apiKey.isEmpty()) {
            requestBuilder.header("Authorization", this.apiKey);
        } else {
            logger.debug("Sending request to {} without Authorization header (API key not provided).", action);
        }

        long requestStartTime = System.nanoTime();
        try {
            URI baseUri = URI.create(ckanApiUrlBase + action);
            URIBuilder uriBuilder = new URIBuilder(baseUri);
            if (data != null && !data.isEmpty()) {
                data.forEach((key, value) -> {
                    if (value != null) {
                        uriBuilder.addParameter(key, String.valueOf(value));
                    }
                });
            }
            URI uri;
            try {
                uri = uriBuilder.build();
            } catch (URISyntaxException e) {
                throw new CkanException("Internal error: Failed to build GET URI for " + action, e);
            }
            logger.debug("GET Request to: {}", uri);
            HttpRequest request = requestBuilder.uri(uri).GET().build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            long durationMillis = Duration.ofNanos(System.nanoTime() - requestStartTime).toMillis();
            logger.info("CKAN call '{}' completed with status {} in {} ms", action, response.statusCode(), durationMillis);

            return handleResponse(response.statusCode(), response.body(), action, responseTypeRef);

        } catch (CkanException e) {
            throw e;
        } catch (IOException e) {
            logger.error("Connection or I/O error during CKAN request for action {}: {}", action, e.getMessage(), e);
            throw new CkanConnectionException("Communication error with CKAN for action " + action + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("CKAN request thread interrupted for action: {}", action);
            throw new CkanConnectionException("CKAN request interrupted for action " + action, e);
        }
    }

    private static class URIBuilder {
        private final URI baseUri;
        private final List<Map.Entry<String, String>> params = new ArrayList<>();

        URIBuilder(URI baseUri) { this.baseUri = baseUri; }

        URIBuilder addParameter(String key, String value) {
            params.add(Map.entry(key, value));
            return this;
        }

        URI build() throws URISyntaxException {
            if (params.isEmpty()) return baseUri;
            String q = baseUri.getRawQuery();
            StringBuilder s = new StringBuilder(q == null ? "" : q);
            if (s.length() > 0) s.append('&');
            s.append(params.stream()
                    .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                    .collect(Collectors.joining("&")));
            // the query is already encoded, so the URI is assembled from its raw parts
            return new URI(baseUri.getScheme() + "://" + baseUri.getRawAuthority() + baseUri.getRawPath() + "?" + s);
        }
    }

    /**
     * Unwraps CKAN's {@code {"success": .., "result": ..}} envelope, mapping failures onto
     * the {@link CkanExceptions} taxonomy.
     */
    @SuppressWarnings("unchecked") // For casting Object to Map
    <T> T handleResponse(int statusCode, String responseBody, String action, TypeReference<T> responseTypeRef) throws CkanException {
        if (logger.isTraceEnabled()) {
            logger.trace("Response from action '{}' ({}) Body: {}", action, statusCode, responseBody);
        }

        Map<String, Object> ckanResponse;
        try {
            if (responseBody == null || responseBody.isBlank()) {
                throw new CkanException(String.format(
                        "CKAN action '%s' returned an empty response body (Status %d).", action, statusCode));
            }
            ckanResponse = objectMapper.readValue(responseBody, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            logger.error("Failed to parse JSON response from action '{}'. Status: {}", action, statusCode, e);
            String errorMsg = String.format("Invalid JSON response from CKAN action '%s' (Status %d). Body: %s",
                    action, statusCode, responseBody.length() > 500 ? responseBody.substring(0, 500) + "..." : responseBody);
            if (statusCode >= 500) {
                throw new CkanConnectionException(errorMsg, e);
            } else {
                throw new CkanException(errorMsg, e);
            }
        }

        Object successObj = ckanResponse.get("success");
        boolean success = Boolean.TRUE.equals(successObj) || "true".equalsIgnoreCase(String.valueOf(successObj));

        if (success) {
            Object result = ckanResponse.get("result");
            if (result == null) {
                throw new CkanUnexpectedNullResultException(String.format(
                        "CKAN action '%s' succeeded but returned null 'result' when expecting type %s.",
                        action, responseTypeRef.getType()));
            }
            try {
                return objectMapper.convertValue(result, responseTypeRef);
            } catch (IllegalArgumentException e) {
                throw new CkanException("Internal error: Mismatched result structure from CKAN action '" + action +
                        "'. Expected " + responseTypeRef.getType(), e);
            }
        }

        Map<String, Object> errorDetails = null;
        Object errorObj = ckanResponse.get("error");
        if (errorObj instanceof Map) {
            errorDetails = (Map<String, Object>) errorObj;
        }

        String errorMessage = "Unknown CKAN Error";
        String errorType = "UnknownError";
        Map<String, Object> validationDetails = null;

        if (errorDetails != null) {
            errorMessage = String.valueOf(errorDetails.getOrDefault("message", errorMessage));
            errorType = String.valueOf(errorDetails.getOrDefault("__type", errorType));
            if ("Validation Error".equalsIgnoreCase(errorType) || containsValidationKeys(errorDetails)) {
                validationDetails = errorDetails;
                errorType = "Validation Error";
            }
            logger.error("CKAN API Error for action '{}' - Type: {}, Message: {}, Details: {}",
                    action, errorType, errorMessage, errorDetails);
        } else {
            logger.error("CKAN API Error for action '{}' - Success flag was false, but no 'error' object found in response", action);
            errorMessage = String.format("CKAN reported failure for action '%s' but did not provide error details (Status: %d)", action, statusCode);
        }

        if (statusCode == 404 || "Not Found Error".equalsIgnoreCase(errorType)) {
            throw new CkanNotFoundException(String.format("CKAN resource not found for action '%s': %s", action, errorMessage));
        } else if (statusCode == 403 || statusCode == 401 || "Authorization Error".equalsIgnoreCase(errorType)) {
            throw new CkanAuthorizationException(String.format("CKAN authorization failed for action '%s': %s", action, errorMessage));
        } else if ((statusCode == 409 || statusCode == 400) && "Validation Error".equalsIgnoreCase(errorType)) {
            throw new CkanValidationException(String.format("CKAN rejected the parameters of action '%s'", action), validationDetails);
        } else if (statusCode >= 500) {
            throw new CkanConnectionException(String.format("CKAN Server Error (Status %d) for action '%s': %s",
                    statusCode, action, errorMessage), null);
        } else {
            throw new CkanException(String.format("CKAN API error (Type: %s, Status: %d) for action '%s': %s",
                    errorType, statusCode, action, errorMessage));
        }
    }

    // Anything beyond __type and message is treated as per-field validation detail
    private boolean containsValidationKeys(Map<String, Object> map) {
        if (map == null) return false;
        return map.keySet().stream().anyMatch(key -> !key.equals("__type") && !key.equals("message"));
    }
}
