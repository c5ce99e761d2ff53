package com.izapolsky.platmaps;

import com.google.common.base.Preconditions;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.http.HttpEntity;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.MalformedURLException;
import java.net.URISyntaxException;
import java.net.URL;
import java.time.Instant;
import java.util.Properties;

/**
 * Fetcher downloading maps from a URL template, {@code {id}} being replaced with canonical map id
 */
public class MapFetcherImpl implements MapFetcher, Closeable {

    private static final Logger log = LoggerFactory.getLogger(MapFetcherImpl.class);

    public static final String ID_PLACEHOLDER = "{id}";
    public static final int DEFAULT_TIMEOUT_MS = 30_000;

    static final String PROP_SOURCE_URL = "source-url";
    static final String PROP_SHA256 = "sha256";
    static final String PROP_FETCHED = "fetched";

    private final MapStore store;
    private final String urlTemplate;
    private final CloseableHttpClient chc;

    public MapFetcherImpl(MapStore store, String urlTemplate) {
        this(store, urlTemplate, DEFAULT_TIMEOUT_MS);
    }

    public MapFetcherImpl(MapStore store, String urlTemplate, int timeoutMs) {
        this(store, urlTemplate, HttpClients.custom()
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setConnectTimeout(timeoutMs)
                        .setConnectionRequestTimeout(timeoutMs)
                        .setSocketTimeout(timeoutMs)
                        .build())
                .build());
    }

    public MapFetcherImpl(MapStore store, String urlTemplate, CloseableHttpClient chc) {
        Preconditions.checkArgument(urlTemplate.contains(ID_PLACEHOLDER), "URL template %s has no %s placeholder", urlTemplate, ID_PLACEHOLDER);
        this.store = store;
        this.urlTemplate = urlTemplate;
        this.chc = chc;
    }

    @Override
    public FetchResult fetch(MapId id) {
        if (store.contains(id)) {
            log.info("Skipping {} - already exists", id);
            return FetchResult.stored();
        }

        URL url = urlFor(id);
        log.info("Downloading {} from {}", id, url);
        Properties metadata = new Properties();
        metadata.setProperty(PROP_SOURCE_URL, url.toString());
        try {
            if (isLocal(url)) {
                try (InputStream is = url.openStream()) {
                    store.write(id, is);
                }
            } else {
                HttpGet mapGet = new HttpGet(url.toURI());
                try (CloseableHttpResponse response = chc.execute(mapGet)) {
                    int statusCode = response.getStatusLine().getStatusCode();
                    HttpEntity entity = response.getEntity();
                    if (statusCode != HttpStatus.SC_OK) {
                        EntityUtils.consumeQuietly(entity);
                        log.error("Failed to download {}: HTTP {}", id, statusCode);
                        return FetchResult.failed(String.valueOf(statusCode));
                    }
                    if (entity == null) {
                        throw new IOException(String.format("Empty response for %1$s", url));
                    }
                    if (response.containsHeader(HttpHeaders.ETAG)) {
                        metadata.setProperty(HttpHeaders.ETAG, response.getFirstHeader(HttpHeaders.ETAG).getValue());
                    }
                    try (InputStream is = entity.getContent()) {
                        store.write(id, is);
                    }
                }
            }
        } catch (IOException e) {
            log.error("Failed to download {}: {}", id, e.toString());
            return FetchResult.failed(SC_IO_ERROR);
        } catch (URISyntaxException e) {
            throw new RuntimeException(String.format("Failed to parse URI %1$s", url), e);
        }

        describe(id, metadata);
        log.info("Successfully downloaded {}", id);
        return FetchResult.downloaded();
    }

    /**
     * Records digest and fetch time of a stored map. Sidecar is informational only, so failing to write it
     * doesn't fail the download.
     *
     * @param id
     * @param metadata
     */
    protected void describe(MapId id, Properties metadata) {
        try (InputStream is = new FileInputStream(store.locate(id))) {
            metadata.setProperty(PROP_SHA256, DigestUtils.sha256Hex(is));
            metadata.setProperty(PROP_FETCHED, Instant.now().toString());
            store.writeMetadata(id, metadata);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to record metadata of {}", id, e);
        }
    }

    protected URL urlFor(MapId id) {
        String url = urlTemplate.replace(ID_PLACEHOLDER, id.format());
        try {
            return new URL(url);
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException(String.format("Failed to parse url: %1$s", url), e);
        }
    }

    /**
     * Checks if given url is from "local" filesystem
     *
     * @param url
     * @return
     */
    protected boolean isLocal(URL url) {
        return "file".equals(url.getProtocol());
    }

    @Override
    public void close() throws IOException {
        chc.close();
    }
}
