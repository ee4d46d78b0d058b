package com.workplan.planner.weather;

import com.workplan.core.model.BuildingSummary;
import com.workplan.core.model.ScheduleEntry;
import com.workplan.core.model.Task;
import com.workplan.core.model.TaskCategory;
import com.workplan.core.model.WeatherHour;
import com.workplan.core.model.WeatherSnapshot;
import com.workplan.planner.config.WeatherSettings;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

public final class WeatherSuggestionEngine {
    private static final int NO_DUE_TIME_SCORE = 48;
    private static final int MAX_SUGGESTIONS = 3;
    private static final int UPCOMING_DEDUP_DEPTH = 2;
    private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("HH:mm", Locale.ROOT);

    private final WeatherSettings settings;
    private final ZoneId zone;

    public WeatherSuggestionEngine(WeatherSettings settings, ZoneId zone) {
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.zone = Objects.requireNonNull(zone, "zone is required");
    }

    public boolean shouldDeferOutdoorWork(WeatherSnapshot weather) {
        return deferralReason(weather).isPresent();
    }

    public Optional<String> deferralReason(WeatherSnapshot weather) {
        if (weather == null) {
            return Optional.empty();
        }
        for (WeatherHour hour : weather.lookahead(settings.lookaheadHours())) {
            if (hour.precipProb() >= settings.precipThreshold()) {
                return Optional.of("Rain likely (" + Math.round(hour.precipProb() * 100) + "%)");
            }
            if (hour.tempF() <= settings.coldThresholdF()) {
                return Optional.of("Cold (" + Math.round(hour.tempF()) + "°F)");
            }
            if (hour.windMph() >= settings.windThresholdMph()) {
                return Optional.of("High wind (" + Math.round(hour.windMph()) + " mph)");
            }
        }
        return Optional.empty();
    }

    public boolean isOutdoor(Task task) {
        String title = task.title().toLowerCase(Locale.ROOT);
        for (String term : settings.outdoorVocabulary()) {
            if (title.contains(term)) {
                return true;
            }
        }
        return false;
    }

    public ScoredTask score(Task task, WeatherSnapshot weather) {
        boolean lexicalOutdoor = isOutdoor(task);
        TaskCategory category = task.taskCategory();
        WeatherProfile profile = WeatherProfile.forCategory(category);
        if (lexicalOutdoor && !profile.outdoor()) {
            profile = WeatherProfile.lexicalOutdoor();
        }

        int penalty = 0;
        WeatherChip chip = null;
        String advice = null;
        if (weather != null && profile.outdoor()) {
            Instant at = task.dueTime() != null ? task.dueTime() : weather.referenceTime();
            WeatherHour block = nearestHour(weather, at);
            if (profile.sensitiveToPrecip() && profile.idealPrecipProbMax() != null) {
                if (block.precipProb() >= 0.6) {
                    penalty += 3;
                    chip = WeatherChip.HEAVY_RAIN;
                    advice = "Do indoor tasks; rain likely.";
                } else if (block.precipProb() >= profile.idealPrecipProbMax()) {
                    penalty += 1;
                    chip = WeatherChip.WET;
                    advice = "Wet window likely; consider reslotting.";
                }
            }
            if (profile.sensitiveToWind() && profile.idealWindMax() != null && block.windMph() > profile.idealWindMax()) {
                penalty += 1;
                chip = chip == null ? WeatherChip.WINDY : chip;
                advice = advice == null ? "High wind; bag and tie securely." : advice;
            }
            if (block.tempF() <= 25) {
                penalty += 1;
                chip = chip == null ? WeatherChip.COLD : chip;
                advice = advice == null ? "Very cold; reduce outdoor exposure." : advice;
            } else if (block.tempF() >= 95) {
                penalty += 1;
                chip = chip == null ? WeatherChip.HOT : chip;
                advice = advice == null ? "Heat; hydrate and pace work." : advice;
            }
            if (chip == null && block.precipProb() < 0.2 && block.windMph() < 20) {
                chip = WeatherChip.GOOD_WINDOW;
                penalty -= 1;
            }
        }

        Instant reference = weather == null ? null : weather.referenceTime();
        int score = timeScore(task, reference) + categoryBonus(category) + urgencyAdjustment(task) + penalty;
        return new ScoredTask(task, score, chip, advice, lexicalOutdoor);
    }

    public List<ScoredTask> scoreAndOrder(List<Task> tasks, WeatherSnapshot weather) {
        List<Ranked> ranked = new ArrayList<>();
        int index = 0;
        for (Task task : tasks) {
            if (!task.completed()) {
                ranked.add(new Ranked(score(task, weather), index));
            }
            index++;
        }
        ranked.sort(Comparator.comparingInt((Ranked r) -> r.scored().score())
                .thenComparing(r -> r.scored().task().dueTime(), Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparingInt(Ranked::index));
        return ranked.stream().map(Ranked::scored).toList();
    }

    public WeatherOrdering planImmediate(List<Task> tasks, WeatherSnapshot weather) {
        List<ScoredTask> ordered = scoreAndOrder(tasks, weather);
        Optional<String> reason = deferralReason(weather);
        if (reason.isEmpty()) {
            return new WeatherOrdering(ordered, List.of(), false, List.of());
        }
        List<ScoredTask> now = new ArrayList<>();
        List<ScoredTask> deferred = new ArrayList<>();
        List<WeatherSuggestion> substitutes = new ArrayList<>();
        for (ScoredTask scored : ordered) {
            if (scored.outdoor()) {
                deferred.add(scored);
                substitutes.add(indoorSubstitute(scored.task(), weather, reason.get()));
            } else {
                now.add(scored);
            }
        }
        return new WeatherOrdering(now, deferred, true, substitutes);
    }

    public List<WeatherSuggestion> suggestions(
            BuildingSummary building,
            WeatherSnapshot weather,
            LocalDate date,
            ScheduleEntry collectionEntry,
            List<String> upcomingTitles
    ) {
        Objects.requireNonNull(building, "building is required");
        if (weather == null) {
            return List.of();
        }
        String rationale = weather.current().condition();
        String place = shortName(building.name());
        String suffix = building.id() + "-" + date;

        List<WeatherHour> next24 = weather.lookahead(24);
        List<WeatherHour> next12 = weather.lookahead(12);
        double maxPrecip = next24.stream().mapToDouble(WeatherHour::precipProb).max().orElse(0.0);
        double maxTemp = next12.stream().mapToDouble(WeatherHour::tempF).max().orElse(weather.current().tempF());
        double maxWind = next12.stream().mapToDouble(WeatherHour::windMph).max().orElse(0.0);

        boolean snowLikely = rationale.toLowerCase(Locale.ROOT).contains("snow")
                && next12.stream().anyMatch(hour -> hour.precipProb() >= 0.5);

        List<WeatherSuggestion> out = new ArrayList<>();
        // hosing is moot when it will snow
        if (maxPrecip >= 0.25 && !snowLikely) {
            out.add(suggestion("skip-hosing-" + suffix, SuggestionKind.RAIN, "Skip sidewalk hosing",
                    "Rain expected; spot clean to prevent pooling and slippery walkways", rationale, building, null));
        }
        if (maxPrecip >= 0.4) {
            out.add(suggestion("clear-drains-" + suffix, SuggestionKind.RAIN, "Clear roof & curb drains",
                    "Check scuppers and drains before precipitation at " + place, rationale, building, null));
        }
        if (maxPrecip >= 0.3) {
            out.add(suggestion("rain-mats-" + suffix, SuggestionKind.RAIN, "Deploy / clean rain mats",
                    "Reduce slip risk at the lobby entrance", rationale, building, null));
        }
        if (maxTemp >= 78 && maxPrecip < 0.3) {
            out.add(suggestion("hot-day-" + suffix, SuggestionKind.HEAT, "Warm today (" + Math.round(maxTemp) + "°)",
                    "Hose and squeegee sidewalks at " + place, rationale, building, null));
        }
        if (maxWind >= 15) {
            out.add(suggestion("wind-secure-" + suffix, SuggestionKind.WIND, "Windy conditions (" + Math.round(maxWind) + " mph)",
                    "Secure trash lids and tie bags to prevent litter", rationale, building, null));
        }
        if (collectionEntry != null) {
            String at = CLOCK.format(collectionEntry.startTime().atZone(zone));
            out.add(suggestion("collection-setout-" + suffix, SuggestionKind.COLLECTION, "Collection set-out tonight",
                    "Set out bins at " + at + " @ " + place, rationale, building,
                    collectionEntry.startTime().minus(Duration.ofMinutes(10))));
        }
        if (snowLikely) {
            out.add(suggestion("snow-entrances-" + suffix, SuggestionKind.SNOW, "Snow expected",
                    "Salt entrances within 4h after snow", rationale, building, null));
        }
        if (out.isEmpty()) {
            out.add(suggestion("general-maintenance-" + suffix, SuggestionKind.GENERIC, "Good weather for outdoor tasks",
                    "Complete exterior sweep at " + place, rationale, building, null));
        }

        Set<String> shown = new HashSet<>();
        if (upcomingTitles != null) {
            upcomingTitles.stream()
                    .limit(UPCOMING_DEDUP_DEPTH)
                    .map(title -> title.trim().toLowerCase(Locale.ROOT))
                    .forEach(shown::add);
        }
        return out.stream()
                .filter(s -> !shown.contains(s.title().toLowerCase(Locale.ROOT)))
                .sorted(Comparator.comparingInt((WeatherSuggestion s) -> s.kind().rank()).thenComparing(WeatherSuggestion::title))
                .limit(MAX_SUGGESTIONS)
                .toList();
    }

    private WeatherSuggestion indoorSubstitute(Task task, WeatherSnapshot weather, String reason) {
        return new WeatherSuggestion(
                "indoor-" + task.id(),
                SuggestionKind.INDOOR,
                "Indoor work instead of " + task.title(),
                reason + "; outdoor work deferred",
                weather.current().condition(),
                SuggestionKind.INDOOR.checklist(),
                task.buildingId(),
                null
        );
    }

    private static WeatherSuggestion suggestion(
            String id,
            SuggestionKind kind,
            String title,
            String subtitle,
            String rationale,
            BuildingSummary building,
            Instant dueBy
    ) {
        return new WeatherSuggestion(id, kind, title, subtitle, rationale, kind.checklist(), building.id(), dueBy);
    }

    private static WeatherHour nearestHour(WeatherSnapshot weather, Instant at) {
        if (weather.hourly().isEmpty()) {
            return weather.current();
        }
        WeatherHour best = weather.hourly().get(0);
        long bestGap = Math.abs(Duration.between(best.timestamp(), at).toSeconds());
        for (WeatherHour hour : weather.hourly()) {
            long gap = Math.abs(Duration.between(hour.timestamp(), at).toSeconds());
            if (gap < bestGap) {
                best = hour;
                bestGap = gap;
            }
        }
        return best;
    }

    private static int timeScore(Task task, Instant reference) {
        if (task.dueTime() == null || reference == null) {
            return NO_DUE_TIME_SCORE;
        }
        long minutes = Duration.between(reference, task.dueTime()).toMinutes();
        return (int) Math.max(0, minutes / 30);
    }

    private static int categoryBonus(TaskCategory category) {
        return switch (category) {
            case SANITATION -> -2;
            case MAINTENANCE -> -1;
            case INSPECTION -> 1;
            default -> 0;
        };
    }

    // LOW +1 down to EMERGENCY -4
    private static int urgencyAdjustment(Task task) {
        return 1 - task.urgency().ordinal();
    }

    private static String shortName(String name) {
        String[] parts = name.trim().split("\\s+");
        if (parts.length >= 2) {
            return parts[parts.length - 2] + " " + parts[parts.length - 1];
        }
        return name;
    }

    private record Ranked(ScoredTask scored, int index) {
    }
}
