package pl.marcinmilkowski.ldsi.graph;

/**
 * Turns the topology of the reference and test texts into the structural
 * signal weighted by gamma.
 */
public interface StructuralScoringStrategy {

    /**
     * Version tag written next to the signal in serialized results.
     */
    String version();

    double signal(TopologyMetrics reference, TopologyMetrics test);
}
