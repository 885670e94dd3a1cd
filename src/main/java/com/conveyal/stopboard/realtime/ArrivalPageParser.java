package com.conveyal.stopboard.realtime;

import com.conveyal.stopboard.error.ValueParseException;
import com.conveyal.stopboard.model.LiveArrival;
import com.conveyal.stopboard.util.GtfsTime;
import com.google.common.collect.ImmutableSet;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Extracts arrival predictions from the operator's per-stop arrivals page.
 *
 * Each list item holds a route label and a time text. The time is either relative ("5 Λεπτά", five minutes) or an
 * absolute wall-clock time ("19:30"). Absolute times earlier than now are taken to be after midnight, on the next day.
 */
public abstract class ArrivalPageParser {

    private static final Logger LOG = LoggerFactory.getLogger(ArrivalPageParser.class);

    static final String ITEM_SELECTOR = ".arrivalTimes__list__item";
    static final String ROUTE_SELECTOR = ".line__item__text";
    static final String TIME_SELECTOR = ".arrivalTimes__list__item__link__text2";

    /** The route label is followed by this word ("route") and a description, which are dropped. */
    static final String ROUTE_SUFFIX = "Διαδρομή";

    /** Unit word of relative predictions ("minutes"). */
    static final String MINUTES_UNIT = "Λεπτά";

    /**
     * Shown instead of a time when there is no live estimate ("scheduled time"). The page carries a misspelled
     * variant, and the correctly spelled one is matched too in case the page gets fixed.
     */
    static final Set<String> NO_ESTIMATE_PLACEHOLDERS = ImmutableSet.of(
        "Προβλεπόενη ώρα σύμφων με το χρονοδιάγραμμα",
        "Προβλεπόμενη ώρα σύμφωνα με το χρονοδιάγραμμα"
    );

    public static List<LiveArrival> parse (String html, OffsetDateTime now) {
        return parse(Jsoup.parse(html), now);
    }

    /**
     * @param now the current time, which relative predictions are added to and absolute ones compared against
     * @return predictions in page order, without entries lacking a route or time, placeholders, unparseable times
     *         and negative waits
     */
    public static List<LiveArrival> parse (Document document, OffsetDateTime now) {
        List<LiveArrival> arrivals = new ArrayList<>();
        for (Element item : document.select(ITEM_SELECTOR)) {
            Element routeElement = item.selectFirst(ROUTE_SELECTOR);
            Element timeElement = item.selectFirst(TIME_SELECTOR);
            if (routeElement == null || timeElement == null) continue;
            LiveArrival arrival = parseEntry(routeElement.text(), timeElement.text(), now);
            if (arrival != null) arrivals.add(arrival);
        }
        return arrivals;
    }

    /**
     * Convert one route label and time text into a prediction.
     * @return the prediction, or null if the entry should be skipped
     */
    static LiveArrival parseEntry (String routeText, String timeText, OffsetDateTime now) {
        String route = routeText.split(ROUTE_SUFFIX, 2)[0].trim();
        String time = timeText.trim();
        if (route.isEmpty() || time.isEmpty() || NO_ESTIMATE_PLACEHOLDERS.contains(time)) return null;
        LiveArrival arrival;
        if (time.contains(MINUTES_UNIT)) {
            int minutes;
            try {
                minutes = Integer.parseInt(time.replace(MINUTES_UNIT, "").trim());
            } catch (NumberFormatException e) {
                LOG.debug("Unreadable relative arrival time '{}'", time);
                return null;
            }
            arrival = new LiveArrival(route, GtfsTime.formatGtfsTime(now.plusMinutes(minutes)), minutes);
        } else {
            OffsetDateTime arrivalTime;
            try {
                arrivalTime = GtfsTime.parseGtfsTime(time + ":00", now);
                // Predictions crossing local midnight show the next day's wall-clock time.
                if (arrivalTime.isBefore(now)) {
                    arrivalTime = GtfsTime.parseGtfsTime(time + ":00", now.plusDays(1));
                }
            } catch (ValueParseException e) {
                LOG.debug("Unreadable arrival time '{}': {}", time, e.getMessage());
                return null;
            }
            long seconds = Duration.between(now, arrivalTime).getSeconds();
            arrival = new LiveArrival(route, time, (int) Math.round(seconds / 60.0));
        }
        if (arrival.time_left < 0) {
            LOG.debug("Discarding arrival in the past: {}", arrival);
            return null;
        }
        return arrival;
    }

}
