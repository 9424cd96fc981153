package pl.marcinmilkowski.ldsi.graph;

import pl.marcinmilkowski.ldsi.exception.InvalidInputException;

import java.util.List;

/**
 * Builds a {@link CooccurrenceGraph} from an ordered token sequence.
 *
 * <p>The token at position i is linked to each token at positions i+1..i+W,
 * where W = min({@value #MAX_WINDOW}, tokens remaining). A pair at distance d
 * contributes 1/(d+1), so adjacent tokens weigh 0.5 and the far end of the
 * window weighs 1/16. Repeated pairs accumulate.</p>
 */
public final class CooccurrenceGraphBuilder {

    public static final int MAX_WINDOW = 15;

    private CooccurrenceGraphBuilder() {
    }

    public static CooccurrenceGraph build(List<String> tokens) {
        if (tokens == null) {
            throw InvalidInputException.missing("token list");
        }

        CooccurrenceGraph graph = new CooccurrenceGraph();
        int[] ids = new int[tokens.size()];
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (token == null) {
                throw InvalidInputException.missing("token at position " + i);
            }
            ids[i] = graph.addNode(token);
        }

        for (int i = 0; i < ids.length; i++) {
            int window = Math.min(MAX_WINDOW, ids.length - 1 - i);
            for (int d = 1; d <= window; d++) {
                graph.accumulateEdge(ids[i], ids[i + d], 1.0 / (d + 1));
            }
        }
        return graph;
    }
}
