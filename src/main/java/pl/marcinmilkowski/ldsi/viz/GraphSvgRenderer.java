package pl.marcinmilkowski.ldsi.viz;

import pl.marcinmilkowski.ldsi.graph.CooccurrenceGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Force-directed layout of a co-occurrence graph, exported as SVG.
 * The layout is seeded, so the same graph always yields the same drawing.
 */
public class GraphSvgRenderer {

    private static final int PADDING = 50;
    private static final long SEED = 42L;

    private static class Node {
        final String label;
        final int degree;
        double x, y;
        double vx, vy;

        Node(String label, int degree, double x, double y) {
            this.label = label;
            this.degree = degree;
            this.x = x;
            this.y = y;
        }
    }

    private record Link(int source, int target, double weight) {
    }

    private final List<Node> nodes = new ArrayList<>();
    private final List<Link> links = new ArrayList<>();
    private final int width;
    private final int height;

    public GraphSvgRenderer(CooccurrenceGraph graph, int width, int height) {
        if (width <= 2 * PADDING || height <= 2 * PADDING) {
            throw new IllegalArgumentException("Canvas must be larger than " + 2 * PADDING + "px each way");
        }
        this.width = width;
        this.height = height;

        Random rand = new Random(SEED);
        for (int i = 0; i < graph.nodeCount(); i++) {
            nodes.add(new Node(graph.label(i), graph.degree(i),
                PADDING + rand.nextDouble() * (width - 2 * PADDING),
                PADDING + rand.nextDouble() * (height - 2 * PADDING)));
        }

        // one line per unordered pair, carrying the weight of both directions
        for (int i = 0; i < graph.nodeCount(); i++) {
            for (int j : graph.neighbours(i)) {
                if (j > i) {
                    links.add(new Link(i, j, graph.weight(i, j) + graph.weight(j, i)));
                }
            }
        }
    }

    /**
     * Run the force-directed layout (Fruchterman-Reingold with linear cooling).
     */
    public GraphSvgRenderer compute(int iterations) {
        if (nodes.isEmpty()) {
            return this;
        }
        double k = Math.sqrt((double) (width * height) / nodes.size());

        for (int iter = 0; iter < iterations; iter++) {
            double temp = (1.0 - iter / (double) iterations) * 100;

            for (Node n1 : nodes) {
                n1.vx = 0;
                n1.vy = 0;
                for (Node n2 : nodes) {
                    if (n1 == n2) continue;
                    double dx = n1.x - n2.x;
                    double dy = n1.y - n2.y;
                    double dist = Math.max(0.01, Math.sqrt(dx * dx + dy * dy));
                    double force = k * k / dist;
                    n1.vx += (dx / dist) * force;
                    n1.vy += (dy / dist) * force;
                }
            }

            for (Link link : links) {
                Node source = nodes.get(link.source());
                Node target = nodes.get(link.target());
                double dx = target.x - source.x;
                double dy = target.y - source.y;
                double dist = Math.max(0.01, Math.sqrt(dx * dx + dy * dy));
                double force = (dist * dist) / k;
                double fx = (dx / dist) * force;
                double fy = (dy / dist) * force;
                source.vx += fx;
                source.vy += fy;
                target.vx -= fx;
                target.vy -= fy;
            }

            for (Node n : nodes) {
                double len = Math.sqrt(n.vx * n.vx + n.vy * n.vy);
                if (len > temp) {
                    n.vx = (n.vx / len) * temp;
                    n.vy = (n.vy / len) * temp;
                }
                n.x = Math.max(PADDING, Math.min(width - PADDING, n.x + n.vx));
                n.y = Math.max(PADDING, Math.min(height - PADDING, n.y + n.vy));
            }
        }
        return this;
    }

    public String toSvg() {
        StringBuilder svg = new StringBuilder();

        svg.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        svg.append(String.format(Locale.ROOT,
            "<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"%d\" height=\"%d\" viewBox=\"0 0 %d %d\">\n",
            width, height, width, height));

        svg.append("  <defs>\n");
        svg.append("    <style>\n");
        svg.append("      .edge { stroke: #999; stroke-opacity: 0.6; fill: none; }\n");
        svg.append("      .node { fill: #4A90E2; stroke: white; stroke-width: 1.5; }\n");
        svg.append("      .node.isolated { fill: #bbb; }\n");
        svg.append("      .label { font-family: sans-serif; font-size: 10px; fill: #333; }\n");
        svg.append("    </style>\n");
        svg.append("  </defs>\n\n");

        svg.append(String.format(Locale.ROOT, "  <rect width=\"%d\" height=\"%d\" fill=\"#fafafa\"/>\n\n", width, height));

        svg.append("  <g id=\"edges\">\n");
        for (Link link : links) {
            Node source = nodes.get(link.source());
            Node target = nodes.get(link.target());
            svg.append(String.format(Locale.ROOT,
                "    <line class=\"edge\" x1=\"%.2f\" y1=\"%.2f\" x2=\"%.2f\" y2=\"%.2f\" stroke-width=\"%.2f\"/>\n",
                source.x, source.y, target.x, target.y, 0.5 + Math.sqrt(link.weight())));
        }
        svg.append("  </g>\n\n");

        svg.append("  <g id=\"nodes\">\n");
        for (Node n : nodes) {
            String cls = n.degree == 0 ? "node isolated" : "node";
            svg.append(String.format(Locale.ROOT, "    <circle class=\"%s\" cx=\"%.2f\" cy=\"%.2f\" r=\"%.1f\"/>\n",
                cls, n.x, n.y, 4 + Math.sqrt(n.degree)));
        }
        svg.append("  </g>\n\n");

        svg.append("  <g id=\"labels\">\n");
        for (Node n : nodes) {
            svg.append(String.format(Locale.ROOT,
                "    <text class=\"label\" x=\"%.2f\" y=\"%.2f\" text-anchor=\"middle\">%s</text>\n",
                n.x, n.y - 10, escapeXml(n.label)));
        }
        svg.append("  </g>\n");

        svg.append("</svg>");
        return svg.toString();
    }

    /** Layout with the default iteration count, rendered. */
    public static String render(CooccurrenceGraph graph, int width, int height) {
        return new GraphSvgRenderer(graph, width, height).compute(200).toSvg();
    }

    static String escapeXml(String s) {
        return s.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&apos;");
    }
}
