package io.ontomesh.queue;

public interface WorkTask {
    String id();

    String name();

    /**
     * Tasks calling the reasoning collaborator share the queue's LLM permits.
     */
    default boolean requiresLlm() {
        return false;
    }

    void execute(RunContext context) throws Exception;
}
