package com.stlmonitor.core.geo;

import com.stlmonitor.core.bus.EventBus;
import com.stlmonitor.core.events.GeocodeRejected;
import com.stlmonitor.core.events.LocationGeocoded;
import com.stlmonitor.core.model.ConfidenceLevel;
import com.stlmonitor.core.model.GazetteerEntry;
import com.stlmonitor.core.model.GeoPoint;
import com.stlmonitor.core.model.GeocodeResult;
import com.stlmonitor.core.model.PlaceType;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.logging.Logger;

/**
 * Lexical geocoder over the {@link Gazetteer}.
 *
 * <p>Every gazetteer name and alias is tested as a case-insensitive substring of the text. Each matching entry is
 * scored by place specificity plus a bonus for matching on word boundaries, optionally boosted when the text names
 * the county the entry lies in. The best candidate is mapped to a confidence tier, jittered by up to
 * {@value #JITTER_DEGREES}&deg; so unrelated incidents do not stack, and must then pass the {@link GeoFence}.
 * Text that cannot be placed yields an empty result, never an exception.
 */
public class TextGeocoder {
    public static final double JITTER_DEGREES = 0.002;
    public static final int HIGH_CONFIDENCE_SCORE = 15;
    public static final int MEDIUM_CONFIDENCE_SCORE = 10;

    static final int NAME_BOUNDARY_BONUS = 15;
    static final int NAME_SUBSTRING_BONUS = 10;
    static final int ALIAS_BOUNDARY_BONUS = 10;
    static final int ALIAS_SUBSTRING_BONUS = 5;

    private static final Logger LOGGER = Logger.getLogger(TextGeocoder.class.getName());

    private final List<PlaceMatcher> index;
    private final GeoFence fence;
    private final CountyRule countyRule;
    private final DoubleSupplier random;
    private final EventBus eventBus;
    private final Clock clock;

    public TextGeocoder(Gazetteer gazetteer, GeoFence fence) {
        this(gazetteer, fence, CountyRule.JEFFERSON_COUNTY, () -> ThreadLocalRandom.current().nextDouble(),
                new EventBus(), Clock.systemUTC());
    }

    public TextGeocoder(
            Gazetteer gazetteer,
            GeoFence fence,
            CountyRule countyRule,
            DoubleSupplier random,
            EventBus eventBus,
            Clock clock
    ) {
        Objects.requireNonNull(gazetteer, "gazetteer is required");
        this.fence = Objects.requireNonNull(fence, "fence is required");
        this.countyRule = Objects.requireNonNull(countyRule, "countyRule is required");
        this.random = Objects.requireNonNull(random, "random is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.index = gazetteer.matchers();
    }

    public Optional<GeocodeResult> geocodeText(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lowerText = text.toLowerCase(Locale.ROOT);
        boolean countyMentioned = countyRule.isMentionedIn(text);

        List<Candidate> candidates = new ArrayList<>();
        for (PlaceMatcher indexed : index) {
            int matchScore = indexed.matchScore(lowerText, text);
            if (matchScore < 0) {
                continue;
            }
            int score = PlaceType.scoreOf(indexed.entry().type()) + matchScore;
            if (countyMentioned) {
                score += countyRule.boostFor(indexed.entry());
            }
            candidates.add(new Candidate(indexed.entry(), score));
        }

        if (candidates.isEmpty()) {
            eventBus.publish(new GeocodeRejected(clock.instant(), GeocodeRejected.NO_MATCH, null, 0));
            return Optional.empty();
        }

        candidates.sort(Comparator.comparingInt(Candidate::score).reversed());
        Candidate best = candidates.get(0);
        boolean countyPreferred = false;
        if (countyMentioned && !countyRule.contains(best.entry().location())) {
            Optional<Candidate> inCounty = candidates.stream()
                    .filter(candidate -> countyRule.contains(candidate.entry().location()))
                    .findFirst();
            if (inCounty.isPresent() && inCounty.get().score() >= CountyRule.MIN_PREFERRED_SCORE) {
                best = inCounty.get();
                countyPreferred = true;
            }
        }
        return place(best, countyPreferred);
    }

    /**
     * Maps a score to a confidence tier. Both the 15-19 and the 20+ bands are high; there is no third tier.
     */
    public static Optional<ConfidenceLevel> confidenceFor(int score) {
        if (score >= HIGH_CONFIDENCE_SCORE) {
            return Optional.of(ConfidenceLevel.HIGH);
        }
        if (score >= MEDIUM_CONFIDENCE_SCORE) {
            return Optional.of(ConfidenceLevel.MEDIUM);
        }
        return Optional.empty();
    }

    private Optional<GeocodeResult> place(Candidate candidate, boolean countyPreferred) {
        GazetteerEntry entry = candidate.entry();
        Optional<ConfidenceLevel> confidence = confidenceFor(candidate.score());
        if (confidence.isEmpty()) {
            eventBus.publish(new GeocodeRejected(
                    clock.instant(), GeocodeRejected.LOW_SCORE, entry.name(), candidate.score()));
            return Optional.empty();
        }

        GeoPoint jittered = new GeoPoint(
                entry.location().lat() + (random.getAsDouble() - 0.5) * JITTER_DEGREES,
                entry.location().lng() + (random.getAsDouble() - 0.5) * JITTER_DEGREES
        );
        if (!fence.isValidLocation(jittered, fence.region().defaultMaxDistanceMiles())) {
            LOGGER.warning(String.format(Locale.ROOT,
                    "Location %s (%.4f, %.4f) failed geographic fence check, rejecting",
                    entry.name(), jittered.lat(), jittered.lng()));
            eventBus.publish(new GeocodeRejected(
                    clock.instant(), GeocodeRejected.FENCE_REJECTED, entry.name(), candidate.score()));
            return Optional.empty();
        }

        GeoPoint location = countyRule.keepSouthOfRiver(entry, jittered);
        if (!location.equals(jittered)) {
            LOGGER.warning(String.format(Locale.ROOT,
                    "%s location %s placed north of the river (%.4f), moved to %.4f",
                    countyRule.name(), entry.name(), jittered.lat(), location.lat()));
        }

        eventBus.publish(new LocationGeocoded(
                clock.instant(),
                entry.name(),
                entry.type(),
                candidate.score(),
                confidence.get(),
                location.lat(),
                location.lng(),
                countyPreferred
        ));
        return Optional.of(new GeocodeResult(location, confidence.get(), entry.name()));
    }

    List<PlaceMatcher> index() {
        return index;
    }

    private record Candidate(GazetteerEntry entry, int score) {
    }
}
