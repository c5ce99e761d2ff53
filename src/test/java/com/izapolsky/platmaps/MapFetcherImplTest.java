package com.izapolsky.platmaps;

import com.sun.net.httpserver.HttpServer;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.io.FileUtils;
import org.apache.http.HttpHeaders;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class MapFetcherImplTest {

    private static final byte[] MAP = "%PDF-1.4 plat map".getBytes(StandardCharsets.US_ASCII);

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private File origin;
    private FileSystemMapStore store;
    private MapFetcherImpl toTest;
    private HttpServer server;
    private final List<String> served = new ArrayList<>();

    @Before
    public void setUp() throws IOException {
        origin = folder.newFolder("origin");
        FileUtils.writeByteArrayToFile(new File(origin, "001-01.pdf"), MAP);
        store = new FileSystemMapStore(folder.newFolder("maps"));
        toTest = new MapFetcherImpl(store, origin.toURI() + "{id}.pdf");
    }

    @After
    public void tearDown() throws IOException {
        toTest.close();
        if (server != null) {
            server.stop(0);
        }
    }

    private String startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/Platmaps/", exchange -> {
            served.add(exchange.getRequestURI().getPath());
            if (exchange.getRequestURI().getPath().endsWith("/002-01.pdf")) {
                exchange.getResponseHeaders().add(HttpHeaders.ETAG, "\"abc\"");
                exchange.sendResponseHeaders(200, MAP.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(MAP);
                }
            } else {
                exchange.sendResponseHeaders(404, -1);
                exchange.close();
            }
        });
        server.start();
        return String.format("http://%1$s:%2$s/Platmaps/{id}.pdf", server.getAddress().getHostString(), server.getAddress().getPort());
    }

    @Test
    public void testLocalDownload() throws IOException {
        MapId id = MapId.parse("001-01");

        FetchResult result = toTest.fetch(id);

        assertTrue(result.isSuccess());
        assertFalse(result.isFromStore());
        assertEquals("200", result.getStatus());
        assertArrayEquals(MAP, FileUtils.readFileToByteArray(store.locate(id)));
        Properties metadata = store.readMetadata(id);
        assertEquals(DigestUtils.sha256Hex(MAP), metadata.getProperty(MapFetcherImpl.PROP_SHA256));
        assertEquals(new File(origin, "001-01.pdf").toURI().toURL().toString(), metadata.getProperty(MapFetcherImpl.PROP_SOURCE_URL));
        assertTrue(metadata.containsKey(MapFetcherImpl.PROP_FETCHED));
    }

    @Test
    public void testLocalMissing() {
        MapId id = MapId.parse("001-02");

        FetchResult result = toTest.fetch(id);

        assertFalse(result.isSuccess());
        assertEquals(MapFetcher.SC_IO_ERROR, result.getStatus());
        assertFalse(store.contains(id));
        assertEquals(0, store.getDirectory().list().length);
    }

    @Test
    public void testStoredMapIsNotFetched() throws IOException {
        MapId id = MapId.parse("001-01");
        toTest.fetch(id);
        FileUtils.forceDelete(new File(origin, "001-01.pdf"));

        FetchResult result = toTest.fetch(id);

        assertTrue(result.isSuccess());
        assertTrue(result.isFromStore());
        assertEquals(MapFetcher.SC_ALREADY_STORED, result.getStatus());
    }

    @Test
    public void testHttpDownload() throws IOException {
        toTest = new MapFetcherImpl(store, startServer(), 5_000);
        MapId id = MapId.parse("002-01");

        FetchResult result = toTest.fetch(id);

        assertTrue(result.isSuccess());
        assertArrayEquals(MAP, FileUtils.readFileToByteArray(store.locate(id)));
        assertEquals("\"abc\"", store.readMetadata(id).getProperty(HttpHeaders.ETAG));
        assertEquals(1, served.size());

        assertTrue(toTest.fetch(id).isFromStore());
        assertEquals(1, served.size());
    }

    @Test
    public void testHttpNotFound() throws IOException {
        toTest = new MapFetcherImpl(store, startServer(), 5_000);
        MapId id = MapId.parse("002-02");

        FetchResult result = toTest.fetch(id);

        assertFalse(result.isSuccess());
        assertEquals("404", result.getStatus());
        assertFalse(store.contains(id));
        assertEquals(1, served.size());
    }

    @Test
    public void testUnreachableOrigin() throws IOException {
        HttpServer closed = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        int port = closed.getAddress().getPort();
        closed.stop(0);
        toTest = new MapFetcherImpl(store, "http://127.0.0.1:" + port + "/{id}.pdf", 2_000);

        FetchResult result = toTest.fetch(MapId.parse("003-01"));

        assertFalse(result.isSuccess());
        assertEquals(MapFetcher.SC_IO_ERROR, result.getStatus());
    }

    @Test
    public void testUrlOfMap() throws IOException {
        try (MapFetcherImpl fetcher = new MapFetcherImpl(store, Main.DEFAULT_URL_TEMPLATE)) {
            assertEquals("https://esmeraldanv.devnetwedge.com/PropertyImages/Platmaps/007-05.pdf", fetcher.urlFor(MapId.parse("007-5")).toString());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTemplateNeedsPlaceholder() {
        new MapFetcherImpl(store, "http://example.com/maps/001-01.pdf");
    }
}
