package work.flowgraph.engine.error;

import java.util.Set;
import work.flowgraph.engine.kind.Kind;

/**
 * Producer and consumer sockets of an edge share no kind.
 */
public final class KindMismatchException extends WorkflowCompilationException {
    private final String producer;
    private final Set<Kind> producedKinds;
    private final String consumer;
    private final Set<Kind> acceptedKinds;

    public KindMismatchException(String producer, Set<Kind> producedKinds, String consumer, Set<Kind> acceptedKinds) {
        super(
            "kind_mismatch",
            "Kind mismatch: " + producer + " produces " + Kind.names(producedKinds)
                + " but " + consumer + " accepts " + Kind.names(acceptedKinds)
        );
        this.producer = producer;
        this.producedKinds = Set.copyOf(producedKinds);
        this.consumer = consumer;
        this.acceptedKinds = Set.copyOf(acceptedKinds);
    }

    public String producer() {
        return producer;
    }

    public Set<Kind> producedKinds() {
        return producedKinds;
    }

    public String consumer() {
        return consumer;
    }

    public Set<Kind> acceptedKinds() {
        return acceptedKinds;
    }
}
