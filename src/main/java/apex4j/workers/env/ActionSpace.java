package apex4j.workers.env;

import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Seedable action space sampler.
 */
public interface ActionSpace {
    public INDArray sample();
    public void seed(long seed);
    public int size();
}
