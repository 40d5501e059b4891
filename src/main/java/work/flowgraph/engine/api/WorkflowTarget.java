package work.flowgraph.engine.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Which workflow to run: a local specification file or a workflow stored under a workspace.
 */
public record WorkflowTarget(Optional<Path> specificationPath, Optional<String> workspaceId, Optional<String> workflowId) {
    public WorkflowTarget {
        Objects.requireNonNull(specificationPath, "specificationPath");
        Objects.requireNonNull(workspaceId, "workspaceId");
        Objects.requireNonNull(workflowId, "workflowId");
        if (specificationPath.isEmpty() && (workspaceId.isEmpty() || workflowId.isEmpty())) {
            throw new IllegalArgumentException("Either a specification path or a workspace and workflow id must be present.");
        }
    }

    public static WorkflowTarget forFile(Path path) {
        return new WorkflowTarget(Optional.of(path), Optional.empty(), Optional.empty());
    }

    public static WorkflowTarget forStored(String workspaceId, String workflowId) {
        return new WorkflowTarget(Optional.empty(), Optional.of(workspaceId), Optional.of(workflowId));
    }

    public boolean isStored() {
        return specificationPath.isEmpty();
    }

    public String display() {
        return specificationPath.map(Path::toString)
            .orElseGet(() -> workspaceId.orElse("?") + "/" + workflowId.orElse("?"));
    }
}
