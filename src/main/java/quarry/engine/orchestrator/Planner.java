package quarry.engine.orchestrator;

import quarry.engine.model.JobExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Asks the model for a plan of tool calls.
 */
public class Planner {

    private static final Logger log = LoggerFactory.getLogger(Planner.class);

    /** Reserved tool argument listing the call ids a call waits for */
    public static final String DEPENDS_ON = "depends_on";

    static final String SYSTEM_PROMPT = """
            You plan work for an automated research engine.
            Break the goal into calls of the provided tools. Call every tool you need in one answer.
            A call that needs the output of earlier calls lists their call ids in the "depends_on" argument.
            """;

    private final LlmClient llm;
    private final ToolRegistry tools;

    public Planner(LlmClient llm, ToolRegistry tools) {
        this.llm = llm;
        this.tools = tools;
    }

    /**
     * @param goal     what the run should achieve
     * @param allowed  tool allow-list; empty means all tools
     * @param recovery recovery actions from a previous review, empty on the first round
     * @return the planned calls in model order
     * @throws JobExecutionException retryable on transient model errors; terminal when
     *                               the plan is empty or names an unknown tool
     */
    public List<PlannedCall> plan(String goal, List<String> allowed, List<String> recovery)
            throws JobExecutionException {
        StringBuilder user = new StringBuilder("Goal: ").append(goal);
        if (!recovery.isEmpty()) {
            user.append("\n\nA previous attempt fell short. Address these points:");
            recovery.forEach(action -> user.append("\n- ").append(action));
        }

        ChatResponse response;
        try {
            response = llm.chat(new ChatRequest(SYSTEM_PROMPT, user.toString(), tools.specs(allowed), true, null));
        } catch (LlmException e) {
            if (e.isRetryable()) {
                throw JobExecutionException.retryable("Planning call failed: " + e.getMessage(), e);
            }
            throw JobExecutionException.fatal("Planning call failed: " + e.getMessage(), e);
        }

        if (response.toolCalls().isEmpty()) {
            throw JobExecutionException.invalid("no actionable plan");
        }

        List<PlannedCall> calls = new ArrayList<>();
        int index = 0;
        for (ToolCall call : response.toolCalls()) {
            index++;
            if (tools.find(call.name()).isEmpty()) {
                throw JobExecutionException.invalid("Plan uses unknown tool: " + call.name());
            }
            if (!allowed.isEmpty() && !allowed.contains(call.name())) {
                throw JobExecutionException.invalid("Plan uses tool outside the allowed set: " + call.name());
            }
            Map<String, Object> params = new LinkedHashMap<>(call.arguments());
            Object depends = params.remove(DEPENDS_ON);
            String callId = call.id() != null && !call.id().isBlank() ? call.id() : "call-" + index;
            calls.add(new PlannedCall(callId, call.name(), params, dependencies(depends)));
        }
        log.debug("Planned {} calls for goal '{}'", calls.size(), goal);
        return calls;
    }

    private static List<String> dependencies(Object value) {
        List<String> ids = new ArrayList<>();
        if (value instanceof List<?> list) {
            list.stream().filter(v -> v != null).forEach(v -> ids.add(v.toString()));
        } else if (value instanceof String s && !s.isBlank()) {
            ids.add(s);
        }
        return ids;
    }
}
