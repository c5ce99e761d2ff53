package com.izapolsky.platmaps;

import com.beust.jcommander.ParameterException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static com.izapolsky.platmaps.FakeMapFetcher.ids;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class MainTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static Main.Args argsFromExecute;

    static class Tmp extends Main {
        Tmp(Args parsedArgs) {
            super(parsedArgs);
        }

        @Override
        protected void execute(Args parsedArgs) {
            argsFromExecute = parsedArgs;
        }
    }

    private static Main.Args parse(String... args) {
        Main.Args result = new Main.Args();
        Main.commander(result).parse(args);
        return result;
    }

    @Test
    public void testMainInvocationUsage() {
        argsFromExecute = null;
        Tmp.main("-h");
        assertNull("execute should not be called", argsFromExecute);
    }

    @Test
    public void testDefaults() {
        Main.Args args = parse();

        assertEquals(new File(Main.DEFAULT_OUTPUT_DIR), args.outputDir);
        assertEquals(Main.DEFAULT_URL_TEMPLATE, args.urlTemplate);
        assertEquals(SleepingThrottle.DEFAULT_DELAY_MS, args.delayMs);
        assertEquals(SequentialProberImpl.DEFAULT_MAX_ATTEMPTS, args.maxAttempts);
        assertEquals(SequentialProberImpl.DEFAULT_FAILURE_CUTOFF, args.failureCutoff);
        assertEquals(MapFetcherImpl.DEFAULT_TIMEOUT_MS, args.timeoutMs);
        assertEquals(CountyCrawler.DEFAULT_SEEDS, args.getSeeds());
        assertFalse(args.debug);
    }

    @Test
    public void testParsesOptions() throws Exception {
        File out = folder.newFolder("out");
        Main.Args args = parse("-v", "-o", out.getPath(), "-u", "http://localhost/maps/{id}.pdf",
                "-d", "0", "--max-attempts", "7", "--failure-cutoff", "2", "--timeout-ms", "500",
                "-s", "004-01", "-s", "001-03");

        assertTrue(args.debug);
        assertEquals(out, args.outputDir);
        assertEquals("http://localhost/maps/{id}.pdf", args.urlTemplate);
        assertEquals(0, args.delayMs);
        assertEquals(7, args.maxAttempts);
        assertEquals(2, args.failureCutoff);
        assertEquals(500, args.timeoutMs);
        assertEquals(ids("004-01", "001-03"), args.getSeeds());
    }

    @Test(expected = ParameterException.class)
    public void testRejectsMalformedSeed() {
        parse("-s", "1-2-3");
    }

    @Test(expected = ParameterException.class)
    public void testRejectsTemplateWithoutPlaceholder() {
        parse("-u", "http://localhost/maps/map.pdf");
    }

    @Test(expected = ParameterException.class)
    public void testRejectsZeroAttempts() {
        parse("--max-attempts", "0");
    }

    @Test(expected = ParameterException.class)
    public void testFailsIfOutputIsFile() throws Exception {
        Main.main("--keep-going", "-o", folder.newFile("taken").getPath());
    }

    @Test(expected = StoreInitializationException.class)
    public void testFailsIfOutputCantBeCreated() throws Exception {
        File blocker = folder.newFile("blocker");
        Main.main("--keep-going", "-o", new File(blocker, "maps").getPath(), "-s", "001-01");
    }

    @Test
    public void testCrawlsLocalOrigin() throws Exception {
        File origin = folder.newFolder("origin");
        TestPdfs.write(new File(origin, "001-01.pdf"), "SEE MAP 001-02");
        TestPdfs.write(new File(origin, "001-02.pdf"), "SEE MAP 001-01");
        File out = new File(folder.getRoot(), "maps");

        Main main = new Main(parse("-o", out.getPath(), "-u", origin.toURI().toString() + "{id}.pdf",
                "-d", "0", "--max-attempts", "5", "--failure-cutoff", "2", "-s", "001-01"));

        CrawlSummary summary = main.getSummary();
        assertFalse(summary.isCancelled());
        assertEquals(1, summary.getReports().size());
        assertEquals(2, summary.getTotalStored());
        assertEquals(Integer.valueOf(2), summary.getStoredByCommunity().get("001"));
        assertTrue(new File(out, "001-01.pdf").isFile());
        assertTrue(new File(out, "001-02.pdf").isFile());
        assertTrue(new File(out, "001-01.pdf.properties").isFile());
    }

    @Test
    public void testPrintsSummary() {
        CrawlSummary summary = new CrawlSummary(
                ImmutableList.of(new CommunityReport("001", 3, 1, 2, 4, 1, 0), new CommunityReport("002", 1, 0, 0, 2, 0, 1)),
                ImmutableMultiset.<String>builder().addCopies("001", 6).addCopies("002", 1).build(),
                false);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        Main.printSummary(summary, new File("plat_maps"), new PrintStream(bytes, true));

        String printed = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
        assertTrue(printed, printed.contains("Crawl completed!"));
        assertTrue(printed, printed.contains("Total maps downloaded: 7"));
        assertTrue(printed, printed.contains("Total failures: 2"));
        assertTrue(printed, printed.contains("  001-XX: 6 maps"));
        assertTrue(printed, printed.contains("  002-XX: 1 maps"));
        assertTrue(printed, printed.contains("Check the 'plat_maps' directory for downloaded plat maps."));
    }

    @Test
    public void testPrintsCancelledSummary() {
        CrawlSummary summary = new CrawlSummary(ImmutableList.of(), ImmutableMultiset.of(), true);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        Main.printSummary(summary, new File("plat_maps"), new PrintStream(bytes, true));

        assertTrue(new String(bytes.toByteArray(), StandardCharsets.UTF_8).contains("Crawl cancelled!"));
    }
}
