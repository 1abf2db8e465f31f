package ai.porting.lst.builder;

import ai.porting.lst.tree.Node;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the start-sorted candidate list into a forest by body containment.
 *
 * <p>Candidates are first reduced to a laminar set: walking in {@link ConstructExtractor#CANDIDATE_ORDER},
 * a candidate is kept only if it lies inside the body of every kept candidate it overlaps. Each kept node
 * then becomes a child of the enclosing body with the smallest width, or a root when no body encloses it.
 */
public class Nester {

    private static final Logger LOGGER = LoggerFactory.getLogger(Nester.class);
    private static final Comparator<Node> BY_START = Comparator.comparingInt(node -> node.span().startByte());

    public List<Node> nest(List<Node> candidates) {
        List<Node> kept = resolveOverlaps(candidates);
        int[] parents = assignParents(kept);

        List<List<Integer>> childIndexes = new ArrayList<>(kept.size());
        for (int i = 0; i < kept.size(); i++) {
            childIndexes.add(new ArrayList<>());
        }
        List<Integer> rootIndexes = new ArrayList<>();
        for (int i = 0; i < kept.size(); i++) {
            if (parents[i] < 0) {
                rootIndexes.add(i);
            } else {
                childIndexes.get(parents[i]).add(i);
            }
        }

        List<Node> roots = new ArrayList<>(rootIndexes.size());
        for (int index : rootIndexes) {
            roots.add(assemble(index, kept, childIndexes));
        }
        roots.sort(BY_START);
        return roots;
    }

    List<Node> resolveOverlaps(List<Node> candidates) {
        List<Node> sorted = new ArrayList<>(candidates);
        sorted.sort(ConstructExtractor.CANDIDATE_ORDER);
        List<Node> kept = new ArrayList<>(sorted.size());
        for (Node candidate : sorted) {
            Node conflict = firstConflict(kept, candidate);
            if (conflict == null) {
                kept.add(candidate);
            } else {
                LOGGER.debug("Discarding {} {} at line {}: overlaps {} {} at line {}",
                        candidate.kind().wireName(), candidate.name(), candidate.span().startLine(),
                        conflict.kind().wireName(), conflict.name(), conflict.span().startLine());
            }
        }
        return kept;
    }

    private Node firstConflict(List<Node> kept, Node candidate) {
        for (Node existing : kept) {
            if (!existing.span().overlaps(candidate.span())) {
                continue;
            }
            if (existing.hasBody() && existing.bodySpan().encloses(candidate.span())) {
                continue;
            }
            return existing;
        }
        return null;
    }

    private int[] assignParents(List<Node> nodes) {
        int[] parents = new int[nodes.size()];
        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            int best = -1;
            for (int j = 0; j < nodes.size(); j++) {
                if (j == i) {
                    continue;
                }
                Node container = nodes.get(j);
                if (!container.hasBody() || !container.bodySpan().encloses(node.span())) {
                    continue;
                }
                if (best < 0 || container.bodySpan().width() < nodes.get(best).bodySpan().width()) {
                    best = j;
                }
            }
            parents[i] = best;
        }
        return parents;
    }

    private Node assemble(int index, List<Node> nodes, List<List<Integer>> childIndexes) {
        List<Node> children = new ArrayList<>();
        for (int child : childIndexes.get(index)) {
            children.add(assemble(child, nodes, childIndexes));
        }
        children.sort(BY_START);
        return nodes.get(index).withChildren(children);
    }
}
