package me.golemcore.autotest.domain.system.toolloop;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.autotest.domain.model.AgentRunContext;
import me.golemcore.autotest.domain.model.StepCompletionMarker;

/**
 * Decides whether a reply without tool calls ends the run.
 *
 * <p>
 * The step total is the larger of the input-derived total and any total the
 * model states, so it never decreases. With no total the run ends on the first
 * reply. A missing {@code completed_steps} marker is answered with a reminder,
 * at most {@code maxMarkerReminders} times; an incomplete count is answered
 * with a request to resume from the next step. A count above the total is
 * clamped to the total.
 */
@Slf4j
public class CompletionEnforcer {

    private final int maxMarkerReminders;

    public CompletionEnforcer(int maxMarkerReminders) {
        this.maxMarkerReminders = maxMarkerReminders;
    }

    public record Decision(boolean done, String correctiveMessage) {

        static Decision finish() {
            return new Decision(true, null);
        }

        static Decision correct(String message) {
            return new Decision(false, message);
        }
    }

    public Decision evaluate(AgentRunContext context, String replyText) {
        StepCompletionMarker marker = StepCompletionMarker.parse(replyText);
        Integer total = max(context.getTotalSteps(), marker.totalSteps());
        context.setTotalSteps(total);

        if (total == null || total <= 0) {
            if (marker.hasCompletedSteps()) {
                context.setCompletedSteps(marker.completedSteps());
            }
            return Decision.finish();
        }

        if (!marker.hasCompletedSteps()) {
            int reminders = context.getMarkerReminders() + 1;
            context.setMarkerReminders(reminders);
            if (reminders <= maxMarkerReminders) {
                log.info("[AgentLoop] Reply lacks progress marker, reminder {}/{}", reminders, maxMarkerReminders);
                return Decision.correct(missingMarkerMessage(total));
            }
            log.warn("[AgentLoop] Progress marker still missing after {} reminders, finishing",
                    maxMarkerReminders);
            return Decision.finish();
        }

        int completed = marker.completedSteps();
        if (completed < total) {
            context.setCompletedSteps(completed);
            log.info("[AgentLoop] Model reported {}/{} steps, pushing it to continue", completed, total);
            return Decision.correct(incompleteMessage(completed, total));
        }

        if (completed > total) {
            log.warn("[AgentLoop] Model reported {} completed of {} steps, clamping", completed, total);
        }
        context.setCompletedSteps(total);
        return Decision.finish();
    }

    static String missingMarkerMessage(int total) {
        return "You must include progress markers. Reply with: DONE (completed_steps=X total_steps=" + total
                + "). If not done, continue executing remaining steps.";
    }

    static String incompleteMessage(int completed, int total) {
        int nextStep = Math.min(total, Math.max(1, completed + 1));
        return "You reported only " + completed + "/" + total + " steps completed. Continue executing from step "
                + nextStep + " until you reach DONE (completed_steps=" + total + " total_steps=" + total + ").";
    }

    private static Integer max(Integer a, Integer b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return Math.max(a, b);
    }
}
