package apex4j.workers.policy;

import apex4j.workers.env.ActionSpace;
import apex4j.workers.env.DiscreteActionSpace;
import apex4j.workers.network.PolicyNetwork;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.api.rng.Random;

/**
 * epsilon-greedy policy with linear per-step epsilon decay.
 * After every selection, explore or exploit:
 * epsilon = max(epsilon - (maxEpsilon - minEpsilon) * epsilonDecay, minEpsilon).
 */
public class EpsilonGreedy implements Policy {
    private final Random rnd;
    private final ActionSpace actionSpace;
    private final PolicyNetwork network;
    private final double maxEpsilon;
    private final double minEpsilon;
    private final double epsilonDecay;
    private double epsilon;

    public EpsilonGreedy(
            double maxEpsilon,
            double minEpsilon,
            double epsilonDecay,
            Random rnd,
            ActionSpace actionSpace,
            PolicyNetwork network) {
        if(minEpsilon < 0D || minEpsilon > maxEpsilon || maxEpsilon > 1D)
            throw new IllegalArgumentException(String.format(
                    "Expected 0 <= minEpsilon <= maxEpsilon <= 1, got min=%s, max=%s", minEpsilon, maxEpsilon));
        if(epsilonDecay < 0D)
            throw new IllegalArgumentException("epsilonDecay must be >= 0, got " + epsilonDecay);
        this.maxEpsilon = maxEpsilon;
        this.minEpsilon = minEpsilon;
        this.epsilonDecay = epsilonDecay;
        this.epsilon = maxEpsilon;
        this.rnd = rnd;
        this.actionSpace = actionSpace;
        this.network = network;
    }

    @Override
    public synchronized INDArray chooseAction(INDArray state) {
        INDArray action;
        if(rnd.nextDouble() < epsilon){
            // Explore
            action = actionSpace.sample();
        }else{
            // Exploit
            action = DiscreteActionSpace.action(network.greedyAction(state));
        }
        decay();
        return action;
    }

    private void decay(){
        epsilon = Math.max(epsilon - (maxEpsilon - minEpsilon) * epsilonDecay, minEpsilon);
    }

    public synchronized double getEpsilon() {
        return epsilon;
    }

    public double getMinEpsilon() {
        return minEpsilon;
    }

    public double getMaxEpsilon() {
        return maxEpsilon;
    }

    public double getEpsilonDecay() {
        return epsilonDecay;
    }
}
