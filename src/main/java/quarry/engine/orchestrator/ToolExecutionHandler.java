package quarry.engine.orchestrator;

import quarry.engine.model.Job;
import quarry.engine.model.JobExecutionException;
import quarry.engine.model.JobTypes;
import quarry.engine.service.JobService;
import quarry.engine.util.Json;
import quarry.engine.worker.HandlerResult;
import quarry.engine.worker.JobContext;
import quarry.engine.worker.JobHandler;

import java.io.IOException;

/**
 * Runs one planned tool call and stores its result on the job.
 */
public class ToolExecutionHandler implements JobHandler {

    private final JobService jobService;
    private final ToolRegistry tools;

    public ToolExecutionHandler(JobService jobService, ToolRegistry tools) {
        this.jobService = jobService;
        this.tools = tools;
    }

    @Override
    public String type() {
        return JobTypes.TOOL_EXECUTION;
    }

    @Override
    public HandlerResult handle(JobContext context) throws JobExecutionException {
        Job job = context.job();
        String name = job.configString(OrchestratorJobs.TOOL);
        Tool tool = tools.find(name)
                .orElseThrow(() -> JobExecutionException.invalid("Unknown tool: " + name));

        context.throwIfCancelled();
        Object result;
        try {
            result = tool.execute(OrchestratorJobs.map(job.config().get(OrchestratorJobs.PARAMS)));
        } catch (IOException e) {
            throw JobExecutionException.retryable("Tool " + name + " failed: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw JobExecutionException.invalid("Tool " + name + " rejected its arguments: " + e.getMessage());
        }

        jobService.recordResult(job.id(), Json.write(result), 1);
        context.info(String.format("Tool %s executed successfully", name));
        return HandlerResult.complete();
    }
}
