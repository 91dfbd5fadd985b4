package quarry.engine.orchestrator;

/**
 * Structured chat with a language model.
 */
public interface LlmClient {

    /**
     * @throws LlmException when the call fails; {@link LlmException#isRetryable()} tells whether to retry
     */
    ChatResponse chat(ChatRequest request) throws LlmException;
}
