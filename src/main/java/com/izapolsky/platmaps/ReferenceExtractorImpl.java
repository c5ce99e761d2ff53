package com.izapolsky.platmaps;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic extractor working on noisy text of scanned plat maps.
 * <p>
 * Candidates come from three passes: full {@code 0XX-YY} ids, bare sheet numerals (circled
 * annotations on the map only carry the short form) and, when the text yields almost nothing,
 * neighbour guesses around the map's own sequence number.
 */
public class ReferenceExtractorImpl implements ReferenceExtractor {

    private static final Logger log = LoggerFactory.getLogger(ReferenceExtractorImpl.class);

    static final Pattern FULL_FORM = Pattern.compile("\\b(0\\d{2})-(\\d{2})\\b");
    //two digits, optionally zero padded to three
    static final Pattern SHORT_NUMERAL = Pattern.compile("\\b0?\\d{2}\\b");

    private static final Joiner PAGE_JOINER = Joiner.on(' ').skipNulls();

    private final HeuristicSettings settings;

    public ReferenceExtractorImpl() {
        this(HeuristicSettings.defaults());
    }

    public ReferenceExtractorImpl(HeuristicSettings settings) {
        this.settings = settings;
    }

    @Override
    public List<MapId> extractReferences(List<String> pageTexts, MapId selfId) {
        String text = PAGE_JOINER.join(pageTexts);
        Set<MapId> candidates = new TreeSet<>();
        //offsets of the sequence half of full ids, those are not bare numerals
        Set<Integer> claimed = new HashSet<>();

        Matcher full = FULL_FORM.matcher(text);
        while (full.find()) {
            claimed.add(full.start(2));
            try {
                candidates.add(MapId.parse(full.group()));
            } catch (IllegalArgumentException e) {
                log.debug("Dropping candidate {}: {}", full.group(), e.getMessage());
            }
        }

        Matcher numeral = SHORT_NUMERAL.matcher(text);
        while (numeral.find()) {
            if (claimed.contains(numeral.start())) {
                continue;
            }
            int value = Integer.parseInt(numeral.group());
            if (value < settings.getMinNumeral() || value > settings.getMaxNumeral()) {
                continue;
            }
            candidates.add(selfId.withSequence(value));
        }
        candidates.remove(selfId);

        if (candidates.size() < settings.getFallbackThreshold()) {
            List<MapId> guesses = neighbours(selfId);
            log.debug("Only {} candidates in {}, adding neighbours {}", candidates.size(), selfId, guesses);
            candidates.addAll(guesses);
        }

        List<MapId> result = candidates.stream()
                .filter(selfId::sameCommunity)
                .collect(ImmutableList.toImmutableList());
        log.debug("References of {}: {}", selfId, result);
        return result;
    }

    protected List<MapId> neighbours(MapId selfId) {
        ImmutableList.Builder<MapId> result = ImmutableList.builder();
        for (int offset : settings.getFallbackOffsets()) {
            int sequence = selfId.getSequence() + offset;
            if (offset != 0 && sequence >= settings.getMinFallbackSequence() && sequence <= settings.getMaxFallbackSequence()) {
                result.add(selfId.withSequence(sequence));
            }
        }
        return result.build();
    }
}
