package apex4j.workers.memory;

import java.util.List;

/**
 * Result of a prioritized draw: the transitions, their buffer indices and their
 * importance-sampling weights (normalised so the largest possible weight is 1).
 */
public class PrioritizedSample {
    private final List<Transition> transitions;
    private final int[] indices;
    private final double[] weights;

    public PrioritizedSample(List<Transition> transitions, int[] indices, double[] weights) {
        this.transitions = transitions;
        this.indices = indices;
        this.weights = weights;
    }

    public List<Transition> getTransitions() {
        return transitions;
    }

    public int[] getIndices() {
        return indices;
    }

    public double[] getWeights() {
        return weights;
    }

    public TransitionBatch toBatch(){
        return new TransitionBatch(transitions);
    }

    public int size(){
        return indices.length;
    }
}
