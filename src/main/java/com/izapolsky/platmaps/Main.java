package com.izapolsky.platmaps;

import ch.qos.logback.classic.Level;
import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.IValueValidator;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for the plat map crawler
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static final String DEFAULT_URL_TEMPLATE = "https://esmeraldanv.devnetwedge.com/PropertyImages/Platmaps/{id}.pdf";
    public static final String DEFAULT_OUTPUT_DIR = "plat_maps";
    static final long SHUTDOWN_WAIT_SECONDS = 10;

    public static class OutputDirValidator implements IValueValidator<File> {
        @Override
        public void validate(String name, File value) throws ParameterException {
            if (value.exists() && (!value.isDirectory() || !value.canWrite())) {
                throw new ParameterException(String.format("Parameter %1$s (%2$s) has to be writeable directory", name, value.getAbsolutePath()));
            }
        }
    }

    public static class UrlTemplateValidator implements IParameterValidator {
        @Override
        public void validate(String name, String value) throws ParameterException {
            if (!value.contains(MapFetcherImpl.ID_PLACEHOLDER)) {
                throw new ParameterException(String.format("Parameter %1$s (%2$s) has to contain %3$s", name, value, MapFetcherImpl.ID_PLACEHOLDER));
            }
        }
    }

    public static class PositiveValidator implements IValueValidator<Integer> {
        @Override
        public void validate(String name, Integer value) throws ParameterException {
            if (value < 1) {
                throw new ParameterException(String.format("Parameter %1$s has to be positive, was %2$s", name, value));
            }
        }
    }

    public static class NonNegativeValidator implements IValueValidator<Long> {
        @Override
        public void validate(String name, Long value) throws ParameterException {
            if (value < 0) {
                throw new ParameterException(String.format("Parameter %1$s can't be negative, was %2$s", name, value));
            }
        }
    }

    public static class MapIdConverter implements IStringConverter<MapId> {
        @Override
        public MapId convert(String value) {
            try {
                return MapId.parse(value.trim());
            } catch (IllegalArgumentException e) {
                throw new ParameterException(String.format("Failed to parse map id: %1$s (%2$s)", value, e.getMessage()));
            }
        }
    }

    public static class Args {
        @Parameter(names = {"-v", "--debug"}, description = "Verbose mode")
        public boolean debug;

        @Parameter(names = {"-o", "--output-dir"}, description = "Output directory, created if missing", validateValueWith = OutputDirValidator.class)
        public File outputDir = new File(DEFAULT_OUTPUT_DIR);

        @Parameter(names = {"-u", "--url-template"}, description = "Map URL, {id} is replaced with map id", validateWith = UrlTemplateValidator.class)
        public String urlTemplate = DEFAULT_URL_TEMPLATE;

        @Parameter(names = {"-d", "--delay-ms"}, description = "Pause after each request to the map server", validateValueWith = NonNegativeValidator.class)
        public long delayMs = SleepingThrottle.DEFAULT_DELAY_MS;

        @Parameter(names = "--max-attempts", description = "Sequence numbers tried by systematic discovery", validateValueWith = PositiveValidator.class)
        public int maxAttempts = SequentialProberImpl.DEFAULT_MAX_ATTEMPTS;

        @Parameter(names = "--failure-cutoff", description = "Consecutive misses ending systematic discovery", validateValueWith = PositiveValidator.class)
        public int failureCutoff = SequentialProberImpl.DEFAULT_FAILURE_CUTOFF;

        @Parameter(names = "--timeout-ms", description = "HTTP connect and read timeout", validateValueWith = PositiveValidator.class)
        public int timeoutMs = MapFetcherImpl.DEFAULT_TIMEOUT_MS;

        @Parameter(names = {"-s", "--seed"}, description = "Starting map of a community, repeatable, defaults to all known communities", converter = MapIdConverter.class)
        public List<MapId> seeds = new ArrayList<>();

        @Parameter(names = {"-h", "--help"}, help = true, description = "Displays help")
        public boolean showHelp;

        @Parameter(names = "--keep-going", description = "Do not kill JVM on exit", hidden = true)
        public boolean keepGoing = false;

        public List<MapId> getSeeds() {
            return seeds.isEmpty() ? CountyCrawler.DEFAULT_SEEDS : seeds;
        }
    }

    public static void main(String... args) {
        Args parsedCmdLine = new Args();
        JCommander jc = commander(parsedCmdLine);
        jc.parse(args);

        if (parsedCmdLine.showHelp) {
            jc.usage();
            return;
        }

        try {
            new Main(parsedCmdLine);
        } catch (StoreInitializationException e) {
            if (parsedCmdLine.keepGoing) {
                throw e;
            }
            log.error("Can't crawl: {}", e.getMessage(), e);
            System.exit(1);
        }

        if (!parsedCmdLine.keepGoing) {
            System.exit(0);
        }
    }

    static JCommander commander(Args args) {
        return JCommander.newBuilder()
                .addObject(args)
                .programName(Main.class.getName())
                .build();
    }

    private CrawlSummary summary;

    public Main(Args parsedArgs) {
        execute(parsedArgs);
    }

    protected void execute(Args parsedArgs) {
        if (parsedArgs.debug) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Main.class.getPackage().getName())).setLevel(Level.DEBUG);
        }
        log.info("Starting plat map retrieval of {} communities", parsedArgs.getSeeds().size());

        MapStore store = new FileSystemMapStore(parsedArgs.outputDir);
        CancellationToken cancellation = new CancellationToken();
        CrawlListener listener = new LoggingCrawlListener();
        Throttle throttle = new SleepingThrottle(parsedArgs.delayMs);

        try (MapFetcherImpl fetcher = new MapFetcherImpl(store, parsedArgs.urlTemplate, parsedArgs.timeoutMs)) {
            ReferenceScanner scanner = new ReferenceScanner(store, new PdfPageTextReader(), new ReferenceExtractorImpl(), listener);
            ReferenceCrawler crawler = new ReferenceCrawlerImpl(fetcher, scanner, throttle, listener, cancellation);
            SequentialProber prober = new SequentialProberImpl(store, fetcher, throttle, listener, cancellation,
                    parsedArgs.maxAttempts, parsedArgs.failureCutoff);
            HybridCrawler hybridCrawler = new HybridCrawler(store, crawler, prober, scanner, fetcher, throttle, listener, cancellation);
            CountyCrawler countyCrawler = new CountyCrawler(store, hybridCrawler, cancellation);

            CountDownLatch finished = new CountDownLatch(1);
            Thread shutdownHook = new Thread(() -> {
                cancellation.cancel();
                try {
                    finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "crawl-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
            try {
                summary = countyCrawler.crawlAll(parsedArgs.getSeeds());
                printSummary(summary, parsedArgs.outputDir, System.out);
            } finally {
                finished.countDown();
                removeShutdownHook(shutdownHook);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to release http client", e);
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM is shutting down, hook stays registered");
        }
    }

    /**
     * Summary of the last run, null if it didn't finish
     */
    public CrawlSummary getSummary() {
        return summary;
    }

    static void printSummary(CrawlSummary summary, File outputDir, PrintStream out) {
        out.println();
        out.println(summary.isCancelled() ? "Crawl cancelled!" : "Crawl completed!");
        out.println(String.format("Total maps downloaded: %1$s", summary.getTotalFound()));
        out.println(String.format("Total failures: %1$s", summary.getTotalFailed()));
        out.println();
        out.println("By community:");
        for (Map.Entry<String, Integer> entry : summary.getStoredByCommunity().entrySet()) {
            out.println(String.format("  %1$s-XX: %2$s maps", entry.getKey(), entry.getValue()));
        }
        out.println();
        out.println(String.format("Check the '%1$s' directory for downloaded plat maps.", outputDir.getPath()));
    }
}
