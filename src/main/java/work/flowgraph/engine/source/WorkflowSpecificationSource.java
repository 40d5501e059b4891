package work.flowgraph.engine.source;

import java.util.Map;

/**
 * Provides stored workflow specifications by workspace and workflow id.
 */
public interface WorkflowSpecificationSource {
    /**
     * Specification document ready for {@code SpecificationLoader.fromMap}.
     */
    Map<String, Object> fetch(String workspaceId, String workflowId);
}
