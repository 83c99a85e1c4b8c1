package com.gamedrops.dispatcher.window;

import com.gamedrops.core.model.JobGroup;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Set;

public final class DefaultSchedule {
    public static final String SCRAPERS = "scrapers";
    public static final String NEW_GAME_ALERT = "new_game_alert";
    public static final String WEEKLY_DIGEST = "weekly_digest";
    public static final String CLEANUP = "cleanup";

    private static final Set<Integer> SCRAPE_HOURS = Set.of(9, 21);

    private DefaultSchedule() {
    }

    public static Schedule create() {
        return new Schedule(groups(), rules());
    }

    public static List<JobGroup> groups() {
        return List.of(
                JobGroup.of(SCRAPERS, "crawler", "epic", "steam", "gog_free", "gog_giveaway"),
                JobGroup.of(NEW_GAME_ALERT, "newsletter_new_games"),
                JobGroup.of(WEEKLY_DIGEST, "newsletter"),
                JobGroup.of(CLEANUP, "cleanup")
        );
    }

    public static List<WindowRule> rules() {
        return List.of(
                WindowRule.of("scrapers", TimeWindow.daily(SCRAPE_HOURS, 0), SCRAPERS),
                WindowRule.of("new-game-alert", TimeWindow.daily(SCRAPE_HOURS, 30), NEW_GAME_ALERT),
                WindowRule.of("weekly-digest", TimeWindow.weekly(DayOfWeek.FRIDAY, 19, 0), WEEKLY_DIGEST),
                WindowRule.of("cleanup", TimeWindow.daily(Set.of(0), 1), CLEANUP)
        );
    }
}
