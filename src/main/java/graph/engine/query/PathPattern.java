package graph.engine.query;

import java.util.List;

/** A start node followed by zero or more (relationship, node) hops. */
public record PathPattern(NodePattern start, List<Segment> segments) {
    public PathPattern {
        if (start == null) throw new IllegalArgumentException("start node required");
        segments = List.copyOf(segments);
    }

    public static PathPattern node(NodePattern node) {
        return new PathPattern(node, List.of());
    }

    public record Segment(RelationshipPattern relationship, NodePattern end) {}
}
