package apex4j.workers.env;

import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.api.rng.Random;
import org.nd4j.linalg.factory.Nd4j;

/**
 * Uniform sampler over the actions {0, ..., n-1}. Actions are length 1 integer vectors.
 */
public class DiscreteActionSpace implements ActionSpace {
    private final int n;
    private Random rnd;

    public DiscreteActionSpace(int n) {
        this(n, 0L);
    }

    public DiscreteActionSpace(int n, long seed) {
        if(n < 1)
            throw new IllegalArgumentException("Action space must contain at least one action, got " + n);
        this.n = n;
        this.rnd = Nd4j.getRandomFactory().getNewRandomInstance(seed);
    }

    public static INDArray action(int idx) {
        return Nd4j.createFromArray(new int[]{idx});
    }

    @Override
    public synchronized INDArray sample() {
        return action(rnd.nextInt(n));
    }

    @Override
    public synchronized void seed(long seed) {
        this.rnd = Nd4j.getRandomFactory().getNewRandomInstance(seed);
    }

    @Override
    public int size() {
        return n;
    }
}
