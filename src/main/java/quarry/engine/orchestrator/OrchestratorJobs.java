package quarry.engine.orchestrator;

import quarry.engine.model.Job;
import quarry.engine.model.JobTypes;
import quarry.engine.util.JobIds;
import quarry.engine.worker.JobSpawner;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ids and config keys of the jobs an orchestrator step spawns. All of them are
 * children of the step; ids are derived from the step id and the round so a
 * re-run handler finds the jobs it already created.
 */
final class OrchestratorJobs {

    static final String GOAL = "goal";
    static final String ROUND = "round";
    static final String MAX_ROUNDS = "max_rounds";
    static final String TOOLS = "tools";
    static final String RECOVERY = "recovery";
    static final String TOOL = "tool";
    static final String PARAMS = "params";
    static final String CALL_ID = "call_id";
    static final String DEPENDS_ON = "depends_on";
    static final String TOOL_JOBS = "tool_jobs";

    private OrchestratorJobs() {
    }

    static String planningId(String stepId, int round) {
        return JobIds.child(stepId, "planning-" + round);
    }

    static String waitId(String stepId, int round) {
        return JobIds.child(stepId, "wait-" + round);
    }

    static String reviewId(String stepId, int round) {
        return JobIds.child(stepId, "review-" + round);
    }

    static String toolId(String stepId, int round, String callId) {
        return JobIds.child(stepId, "tool-" + round + "-" + callId);
    }

    /** Settings every phase of a round carries forward */
    static Map<String, Object> roundConfig(Job source, int round) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put(GOAL, source.configString(GOAL));
        config.put(ROUND, round);
        config.put(MAX_ROUNDS, source.configInt(MAX_ROUNDS, 1));
        config.put(TOOLS, strings(source.config().get(TOOLS)));
        return config;
    }

    static Job spawnPlanning(JobSpawner spawner, Job step, Map<String, Object> config, List<String> recovery) {
        int round = (Integer) config.get(ROUND);
        Map<String, Object> planning = new LinkedHashMap<>(config);
        planning.put(RECOVERY, recovery);
        return spawner.spawn(step, planningId(step.id(), round), JobTypes.PLANNING, "Planning round " + round, planning);
    }

    static List<String> strings(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        }
        return result;
    }

    static Map<String, Object> map(Object value) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> m) {
            m.forEach((key, item) -> result.put(String.valueOf(key), item));
        }
        return result;
    }
}
