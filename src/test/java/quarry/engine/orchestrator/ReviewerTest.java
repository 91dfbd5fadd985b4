package quarry.engine.orchestrator;

import quarry.engine.model.ErrorKind;
import quarry.engine.model.JobExecutionException;
import quarry.engine.support.Fakes;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReviewerTest {

    private final Fakes.Llm llm = new Fakes.Llm();
    private final Reviewer reviewer = new Reviewer(llm);

    @Test
    void parsesVerdictWithRecoveryActions() throws Exception {
        llm.review("""
                {"goal_achieved": false, "confidence": 0.4, "summary": "half way",
                 "missing_data": ["pricing"], "recovery_actions": ["search pricing page"]}
                """);

        ReviewResult result = reviewer.review("compare plans",
                List.of(Map.of("tool", "search", "status", "COMPLETED")));

        assertFalse(result.goalAchieved());
        assertEquals(0.4, result.confidence(), 1e-9);
        assertEquals(List.of("pricing"), result.missingData());
        assertTrue(result.needsRecovery());

        ChatRequest request = llm.requests().get(0);
        assertFalse(request.toolUseRequired());
        assertNotNull(request.outputSchema(), "review asks for structured output");
        assertTrue(request.user().contains("compare plans"));
    }

    @Test
    void achievedGoalNeedsNoRecovery() throws Exception {
        ReviewResult result = reviewer.review("anything", List.of());

        assertTrue(result.goalAchieved());
        assertFalse(result.needsRecovery());
        assertEquals(List.of(), result.recoveryActions());
    }

    @Test
    void malformedAnswerIsTerminal() {
        llm.review("sure, looks fine to me");

        JobExecutionException e = assertThrows(JobExecutionException.class,
                () -> reviewer.review("anything", List.of()));
        assertEquals(ErrorKind.VALIDATION, e.kind());
        assertTrue(e.getMessage().startsWith("Malformed review"));
    }

    @Test
    void transientModelErrorIsRetryable() {
        llm.failNext(1);

        JobExecutionException e = assertThrows(JobExecutionException.class,
                () -> reviewer.review("anything", List.of()));
        assertTrue(e.isRetryable());
    }
}
