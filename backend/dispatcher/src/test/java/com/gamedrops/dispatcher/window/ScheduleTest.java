package com.gamedrops.dispatcher.window;

import com.gamedrops.core.model.JobGroup;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleTest {
    @Test
    void defaultScheduleDefinesTheFourGroups() {
        Schedule schedule = DefaultSchedule.create();

        assertEquals(
                List.of("crawler", "epic", "steam", "gog_free", "gog_giveaway"),
                schedule.group(DefaultSchedule.SCRAPERS).jobs()
        );
        assertEquals(List.of("newsletter_new_games"), schedule.group(DefaultSchedule.NEW_GAME_ALERT).jobs());
        assertEquals(List.of("newsletter"), schedule.group(DefaultSchedule.WEEKLY_DIGEST).jobs());
        assertEquals(List.of("cleanup"), schedule.group(DefaultSchedule.CLEANUP).jobs());
        assertEquals(4, schedule.rules().size());
    }

    @Test
    void rejectsRuleWithUnknownGroup() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> new Schedule(
                List.of(JobGroup.of("cleanup", "cleanup")),
                List.of(WindowRule.of("typo", TimeWindow.daily(Set.of(0), 1), "clenaup"))
        ));
        assertTrue(ex.getMessage().contains("clenaup"));
    }

    @Test
    void rejectsDuplicateGroups() {
        assertThrows(IllegalArgumentException.class, () -> new Schedule(
                List.of(JobGroup.of("cleanup", "cleanup"), JobGroup.of("cleanup", "other")),
                List.of()
        ));
    }

    @Test
    void unknownGroupLookupFails() {
        assertThrows(IllegalArgumentException.class, () -> DefaultSchedule.create().group("missing"));
    }

    @Test
    void describeRendersWindowOrCustomPredicate() {
        assertEquals(
                "cleanup -> cleanup (hours=[0] minutes=[1] weekdays=any)",
                DefaultSchedule.rules().get(3).describe()
        );
        assertEquals("x -> g (custom predicate)", new WindowRule("x", sample -> true, "g").describe());
    }
}
