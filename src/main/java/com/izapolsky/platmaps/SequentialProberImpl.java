package com.izapolsky.platmaps;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Tries sequence numbers 1..maxAttempts in order. Maps of a community are numbered densely, so a run of
 * consecutive failures is taken for the end of the sequence and the sweep stops there.
 */
public class SequentialProberImpl implements SequentialProber {

    private static final Logger log = LoggerFactory.getLogger(SequentialProberImpl.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 100;
    public static final int DEFAULT_FAILURE_CUTOFF = 10;

    private final MapStore store;
    private final ThrottledFetcher fetcher;
    private final CancellationToken cancellation;
    private final int maxAttempts;
    private final int failureCutoff;

    public SequentialProberImpl(MapStore store, MapFetcher fetcher, Throttle throttle, CrawlListener listener,
                                CancellationToken cancellation, int maxAttempts, int failureCutoff) {
        Preconditions.checkArgument(maxAttempts >= 0, "Negative max attempts %s", maxAttempts);
        Preconditions.checkArgument(failureCutoff >= 1, "Failure cutoff has to be positive: %s", failureCutoff);
        this.store = store;
        this.fetcher = new ThrottledFetcher(fetcher, throttle, listener);
        this.cancellation = cancellation;
        this.maxAttempts = maxAttempts;
        this.failureCutoff = failureCutoff;
    }

    @Override
    public ProbeResult probe(String community) {
        SortedSet<MapId> discovered = new TreeSet<>();
        int attempts = 0;
        int misses = 0;
        int consecutiveFailures = 0;
        boolean stoppedEarly = false;
        log.info("Starting systematic discovery for community {}", community);

        for (int sequence = 1; sequence <= maxAttempts; sequence++) {
            cancellation.throwIfCancelled(String.format("systematic discovery of %1$s", community));
            MapId id = MapId.of(community, sequence);

            if (store.contains(id)) {
                log.debug("Skipping {} - already exists", id);
                discovered.add(id);
                consecutiveFailures = 0;
                continue;
            }

            log.info("Trying systematic discovery: {}", id);
            attempts++;
            if (fetcher.fetch(id).isSuccess()) {
                discovered.add(id);
                consecutiveFailures = 0;
                log.info("Discovered {} via systematic search", id);
            } else {
                misses++;
                consecutiveFailures++;
                log.debug("{} not found ({} consecutive failures)", id, consecutiveFailures);
                if (consecutiveFailures >= failureCutoff) {
                    log.info("Stopping systematic discovery for {} after {} consecutive failures", community, consecutiveFailures);
                    stoppedEarly = true;
                    break;
                }
            }
        }

        log.info("Systematic discovery for {} complete: found {} maps", community, discovered.size());
        return new ProbeResult(community, discovered, attempts, misses, stoppedEarly);
    }
}
