package org.pragmatica.cliffs.examples;

import org.junit.jupiter.api.Test;
import org.pragmatica.cliffs.call.CallMatch;
import org.pragmatica.cliffs.dispatch.CommandDispatcher;
import org.pragmatica.cliffs.dispatch.UnknownCommandException;
import org.pragmatica.cliffs.error.MatchFailure;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * A small alarm clock driven by typed commands.
 */
class AlarmClockExampleTest {

    private static final class AlarmClock {
        private final List<String> alarms = new ArrayList<>();
        private final CommandDispatcher<String> commands = new CommandDispatcher<>();

        private AlarmClock() {
            commands.command("set [loud]:volume alarm at <hour: int> [<minute: int>] (am|pm):half",
                             "Set an alarm for the given time.",
                             this::setAlarm);
            commands.command("{list alarms}", "Show all alarms.", match -> String.join(", ", alarms));
            commands.command("clear [all] alarms", "Remove every alarm.", match -> {
                alarms.clear();
                return "cleared";
            });
            commands.command("(exit~|quit~)", "Stop the clock.", match -> "bye");
        }

        private String setAlarm(CallMatch match) {
            var hour = match.param("hour", Integer.class) % 12 + (match.variant("half") == 1 ? 12 : 0);
            var minute = (Integer) match.findParam("minute").orElse(0);
            var alarm = LocalTime.of(hour, minute) + (match.optional("volume") ? " (loud)" : "");
            alarms.add(alarm);
            return "alarm set for " + alarm;
        }
    }

    @Test
    void alarmClock_handlesSession() throws MatchFailure {
        var clock = new AlarmClock();

        assertEquals("alarm set for 07:00", clock.commands.dispatch("set alarm at 7 am"));
        assertEquals("alarm set for 19:30 (loud)", clock.commands.dispatch("set loud alarm at 7 30 pm"));
        assertEquals("07:00, 19:30 (loud)", clock.commands.dispatch("alarms list"));
        assertEquals("cleared", clock.commands.dispatch("clear all alarms"));
        assertEquals("", clock.commands.dispatch("list alarms"));
        assertEquals("bye", clock.commands.dispatch("quti"));
    }

    @Test
    void alarmClock_reportsProblems() {
        var clock = new AlarmClock();

        assertThrows(MatchFailure.MismatchedParameterType.class, () -> clock.commands.dispatch("set alarm at noon am"));
        assertThrows(MatchFailure.SuggestedLiteral.class, () -> clock.commands.dispatch("clear al alarms"));
        assertThrows(UnknownCommandException.class, () -> clock.commands.dispatch("brew coffee"));
    }

    @Test
    void alarmClock_printsUsage() {
        var clock = new AlarmClock();

        assertThat(clock.commands.usageLines("---")).containsExactly(
            "set [loud]:volume alarm at <hour: int> [<minute: int>] (am|pm):half",
            "    Set an alarm for the given time.",
            "---",
            "{list alarms}",
            "    Show all alarms.",
            "---",
            "clear [all] alarms",
            "    Remove every alarm.",
            "---",
            "exit~|quit~",
            "    Stop the clock.");
    }
}
