package de.htwsaar.assetserver.server.web;

import de.htwsaar.assetserver.core.AssetServer;
import de.htwsaar.assetserver.core.domain.CacheDecision;
import de.htwsaar.assetserver.core.domain.FileInfo;
import de.htwsaar.assetserver.core.domain.ResolvedAsset;
import de.htwsaar.assetserver.core.service.AssetException;
import de.htwsaar.assetserver.core.tag.TagCodec;
import de.htwsaar.assetserver.core.tag.TaggedName;
import de.htwsaar.assetserver.server.AssetMetricsService;
import de.htwsaar.assetserver.server.config.AssetServerConfig;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.util.UriUtils;

/**
 * HTTP-Adapter für Asset-Zugriffe.
 *
 * <p>Ablauf pro Request: Methode prüfen, Pfad kanonisieren, Tag abtrennen, auflösen, Tag
 * vergleichen, ggf. Slash-Redirect, Header setzen. Conditional GET (304) und Byte-Ranges (206)
 * übernimmt Spring anhand von ETag, Last-Modified und der {@link AssetResource}.</p>
 */
@RestController
public class AssetController {

    private static final Logger log = LoggerFactory.getLogger(AssetController.class);

    static final String ALLOWED_METHODS = "GET,HEAD";
    static final String NOT_FOUND_BODY = "404 Not Found";
    static final String METHOD_NOT_ALLOWED_BODY = "405 Method Not Allowed";
    static final String INTERNAL_ERROR_BODY = "500 Internal Server Error";

    private static final String CLOSE_CALLBACK = AssetController.class.getName() + ".close";

    private final AssetServer assetServer;
    private final CachePolicy cachePolicy;
    private final AssetMetricsService metricsService;
    private final String mountPath;

    /**
     * Constructor Injection.
     *
     * @param assetServer    Asset-Server über den konfigurierten Dateibaum
     * @param cachePolicy    Cache-Control-Auswahl
     * @param metricsService Metriken-Service
     * @param config         Startkonfiguration (Mount-Pfad)
     */
    public AssetController(
            AssetServer assetServer,
            CachePolicy cachePolicy,
            AssetMetricsService metricsService,
            AssetServerConfig config) {
        this.assetServer = assetServer;
        this.cachePolicy = cachePolicy;
        this.metricsService = metricsService;
        this.mountPath = config.mountPath();
    }

    /**
     * Liefert eine Datei aus dem Dateibaum.
     *
     * @param request  aktueller Request (roher Pfad und Query)
     * @param response aktuelle Response (vom Aufrufer gesetzter Content-Type)
     * @return Datei, Redirect oder Fehlerantwort
     */
    @RequestMapping("/**")
    public ResponseEntity<?> serve(HttpServletRequest request, HttpServletResponse response) {
        String method = request.getMethod();
        if (!"GET".equals(method) && !"HEAD".equals(method)) {
            metricsService.recordMethodNotAllowed();
            return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                    .header(HttpHeaders.ALLOW, ALLOWED_METHODS)
                    .contentType(MediaType.TEXT_PLAIN)
                    .body(METHOD_NOT_ALLOWED_BODY);
        }

        String canonical = RequestPaths.canonicalize(requestPath(request));
        if (canonical == null || "/".equals(canonical)) {
            return notFound();
        }
        boolean trailingSlash = canonical.endsWith("/");
        String name = canonical.substring(1, trailingSlash ? canonical.length() - 1 : canonical.length());
        TaggedName tagged = TagCodec.extractTag(name);

        ResolvedAsset asset;
        try {
            asset = assetServer.resolve(tagged.name());
        } catch (AssetException ex) {
            return failure(ex);
        }

        FileInfo info = asset.info();
        if (tagged.tagged() && !tagged.tag().equals(info.tag())) {
            log.debug("Stale tag {} for '{}', current is {}", tagged.tag(), tagged.name(), info.tag());
            close(asset);
            return notFound();
        }
        metricsService.recordResolved(asset.cache());

        if (trailingSlash) {
            close(asset);
            return ResponseEntity.status(HttpStatus.PERMANENT_REDIRECT)
                    .header(HttpHeaders.LOCATION, RequestPaths.redirectLocation(canonical, request.getQueryString()))
                    .build();
        }

        closeAtRequestEnd(asset);
        return ResponseEntity.ok()
                .headers(buildHeaders(asset, tagged.tagged(), response))
                .body(new AssetResource(asset, baseName(tagged.name())));
    }

    private HttpHeaders buildHeaders(ResolvedAsset asset, boolean tagged, HttpServletResponse response) {
        FileInfo info = asset.info();
        HttpHeaders h = new HttpHeaders();
        h.setCacheControl(cachePolicy.select(tagged));
        h.setETag("\"" + info.tag() + "\"");
        // ohne belastbare Änderungszeit kein Last-Modified, sonst bestätigt If-Modified-Since alte Bytes
        if (asset.cache() != CacheDecision.UNSTABLE) {
            h.setLastModified(info.modTime());
        }
        // vom Aufrufer (z. B. einem Filter) gesetzten Content-Type nie überschreiben
        if (response.getContentType() == null) {
            String ct = info.contentType();
            if (ct != null && !ct.isBlank()) {
                h.set(HttpHeaders.CONTENT_TYPE, ct);
            } else {
                h.setContentType(MediaType.APPLICATION_OCTET_STREAM);
                h.set("X-Content-Type-Options", "nosniff");
            }
        }
        return h;
    }

    /**
     * Pfad relativ zu Context- und Mount-Pfad, dekodiert. {@code null}, wenn der Request nicht
     * unter dem Mount-Pfad liegt oder nicht dekodierbar ist.
     */
    private String requestPath(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            uri = uri.substring(contextPath.length());
        }
        if (!mountPath.isEmpty()) {
            if (!uri.startsWith(mountPath + "/")) {
                return null;
            }
            uri = uri.substring(mountPath.length());
        }
        try {
            return UriUtils.decode(uri, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            log.debug("Undecodable request path '{}'", uri, ex);
            return null;
        }
    }

    private ResponseEntity<String> failure(AssetException ex) {
        if (ex.getStatusCode() == HttpStatus.NOT_FOUND.value()) {
            log.debug("{}", ex.getMessage());
            return notFound();
        }
        metricsService.recordInternalError();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(MediaType.TEXT_PLAIN)
                .body(INTERNAL_ERROR_BODY);
    }

    private ResponseEntity<String> notFound() {
        metricsService.recordNotFound();
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .contentType(MediaType.TEXT_PLAIN)
                .body(NOT_FOUND_BODY);
    }

    /** Das Handle wird erst nach dem Schreiben des Bodys geschlossen. */
    private static void closeAtRequestEnd(ResolvedAsset asset) {
        RequestContextHolder.currentRequestAttributes()
                .registerDestructionCallback(CLOSE_CALLBACK, () -> close(asset), RequestAttributes.SCOPE_REQUEST);
    }

    private static void close(ResolvedAsset asset) {
        try {
            asset.close();
        } catch (IOException ex) {
            log.warn("Failed to close asset '{}'", asset.path(), ex);
        }
    }

    private static String baseName(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
