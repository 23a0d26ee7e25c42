package me.golemcore.autotest.domain.system.toolloop;

import me.golemcore.autotest.domain.model.AgentRunContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompletionEnforcerTest {

    private CompletionEnforcer enforcer;

    @BeforeEach
    void setUp() {
        enforcer = new CompletionEnforcer(2);
    }

    private static AgentRunContext contextWithTotal(Integer total) {
        return AgentRunContext.builder().totalSteps(total).build();
    }

    @Test
    void shouldFinishOnFullMarker() {
        AgentRunContext context = contextWithTotal(3);

        CompletionEnforcer.Decision decision = enforcer.evaluate(context,
                "DONE (completed_steps=3 total_steps=3)");

        assertTrue(decision.done());
        assertNull(decision.correctiveMessage());
        assertEquals(3, context.getCompletedSteps());
    }

    @Test
    void shouldAskToResumeFromNextStep() {
        AgentRunContext context = contextWithTotal(4);

        CompletionEnforcer.Decision decision = enforcer.evaluate(context,
                "DONE (completed_steps=2 total_steps=4)");

        assertFalse(decision.done());
        assertEquals("You reported only 2/4 steps completed. Continue executing from step 3 until you reach "
                + "DONE (completed_steps=4 total_steps=4).", decision.correctiveMessage());
        assertEquals(2, context.getCompletedSteps());
    }

    @Test
    void shouldRemindAtMostTwiceThenFinish() {
        AgentRunContext context = contextWithTotal(2);

        CompletionEnforcer.Decision first = enforcer.evaluate(context, "All good.");
        CompletionEnforcer.Decision second = enforcer.evaluate(context, "Finished.");
        CompletionEnforcer.Decision third = enforcer.evaluate(context, "Really finished.");

        assertEquals("You must include progress markers. Reply with: DONE (completed_steps=X total_steps=2). "
                + "If not done, continue executing remaining steps.", first.correctiveMessage());
        assertFalse(second.done());
        assertTrue(third.done());
        assertNull(context.getCompletedSteps());
        assertEquals(3, context.getMarkerReminders());
    }

    @Test
    void shouldNeverLowerTotal() {
        AgentRunContext context = contextWithTotal(5);

        CompletionEnforcer.Decision decision = enforcer.evaluate(context,
                "DONE (completed_steps=2 total_steps=2)");

        assertFalse(decision.done());
        assertEquals(5, context.getTotalSteps());
    }

    @Test
    void shouldAdoptLargerModelTotal() {
        AgentRunContext context = contextWithTotal(2);

        enforcer.evaluate(context, "DONE (completed_steps=2 total_steps=3)");

        assertEquals(3, context.getTotalSteps());
    }

    @Test
    void shouldClampCompletedAboveTotal() {
        AgentRunContext context = contextWithTotal(3);

        CompletionEnforcer.Decision decision = enforcer.evaluate(context, "DONE (completed_steps=7)");

        assertTrue(decision.done());
        assertEquals(3, context.getCompletedSteps());
    }

    @Test
    void shouldFinishFreeFormRunOnFirstReply() {
        AgentRunContext context = contextWithTotal(null);

        CompletionEnforcer.Decision decision = enforcer.evaluate(context, "The login page works.");

        assertTrue(decision.done());
        assertNull(context.getTotalSteps());
        assertNull(context.getCompletedSteps());
    }
}
