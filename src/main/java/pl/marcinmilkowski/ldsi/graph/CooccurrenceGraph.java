package pl.marcinmilkowski.ldsi.graph;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Weighted co-occurrence graph of one token sequence.
 *
 * <p>Nodes are the distinct tokens, numbered in order of first occurrence.
 * Edges are directed (earlier token to later token) and carry the summed
 * inverse-distance weight of every window position that produced them. An
 * undirected adjacency view is maintained alongside for connectivity,
 * clustering and path metrics: u and v are neighbours when either u→v or v→u
 * exists.</p>
 */
public final class CooccurrenceGraph {

    private final List<String> labels = new ArrayList<>();
    private final Map<String, Integer> index = new LinkedHashMap<>();
    private final List<Map<Integer, Double>> outgoing = new ArrayList<>();
    private final List<Set<Integer>> neighbours = new ArrayList<>();
    private int edgeCount;

    CooccurrenceGraph() {
    }

    int addNode(String label) {
        Integer existing = index.get(label);
        if (existing != null) {
            return existing;
        }
        int id = labels.size();
        labels.add(label);
        index.put(label, id);
        outgoing.add(new LinkedHashMap<>());
        neighbours.add(new TreeSet<>());
        return id;
    }

    /**
     * Adds {@code weight} to the directed edge from → to. Self-loops are ignored.
     */
    void accumulateEdge(int from, int to, double weight) {
        if (from == to) {
            return;
        }
        Map<Integer, Double> targets = outgoing.get(from);
        if (!targets.containsKey(to)) {
            edgeCount++;
        }
        targets.merge(to, weight, Double::sum);
        neighbours.get(from).add(to);
        neighbours.get(to).add(from);
    }

    public int nodeCount() {
        return labels.size();
    }

    /**
     * Number of distinct directed edges.
     */
    public int edgeCount() {
        return edgeCount;
    }

    public String label(int node) {
        return labels.get(node);
    }

    public List<String> labels() {
        return Collections.unmodifiableList(labels);
    }

    public int indexOf(String label) {
        Integer id = index.get(label);
        return id != null ? id : -1;
    }

    /**
     * Accumulated weight of from → to, or 0 if there is no such edge.
     */
    public double weight(int from, int to) {
        return outgoing.get(from).getOrDefault(to, 0.0);
    }

    public double weight(String from, String to) {
        int f = indexOf(from);
        int t = indexOf(to);
        if (f < 0 || t < 0) {
            return 0.0;
        }
        return weight(f, t);
    }

    public boolean hasEdge(int from, int to) {
        return outgoing.get(from).containsKey(to);
    }

    /**
     * Neighbours of a node in the undirected view, ascending.
     */
    public Set<Integer> neighbours(int node) {
        return Collections.unmodifiableSet(neighbours.get(node));
    }

    public int degree(int node) {
        return neighbours.get(node).size();
    }

    /**
     * All directed edges, grouped by source in node order.
     */
    public List<Edge> edges() {
        List<Edge> edges = new ArrayList<>(edgeCount);
        for (int from = 0; from < outgoing.size(); from++) {
            for (Map.Entry<Integer, Double> e : outgoing.get(from).entrySet()) {
                edges.add(new Edge(labels.get(from), labels.get(e.getKey()), e.getValue()));
            }
        }
        return edges;
    }

    /**
     * Nodes and edges for visualisation clients.
     */
    public JSONObject toJson() {
        JSONArray nodes = new JSONArray();
        for (int i = 0; i < labels.size(); i++) {
            JSONObject node = new JSONObject();
            node.put("id", labels.get(i));
            node.put("degree", degree(i));
            nodes.add(node);
        }
        JSONArray links = new JSONArray();
        for (Edge edge : edges()) {
            links.add(edge.toJson());
        }
        JSONObject root = new JSONObject();
        root.put("nodes", nodes);
        root.put("edges", links);
        return root;
    }

    @Override
    public String toString() {
        return String.format("CooccurrenceGraph[%d nodes, %d edges]", nodeCount(), edgeCount);
    }

    /**
     * Directed weighted edge.
     */
    public record Edge(String source, String target, double weight) {

        public JSONObject toJson() {
            JSONObject obj = new JSONObject();
            obj.put("source", source);
            obj.put("target", target);
            obj.put("weight", weight);
            return obj;
        }

        @Override
        public String toString() {
            return String.format("%s --(%.3f)--> %s", source, weight, target);
        }
    }
}
