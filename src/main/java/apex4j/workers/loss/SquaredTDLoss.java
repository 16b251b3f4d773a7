package apex4j.workers.loss;

import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.ops.transforms.Transforms;

/**
 * Element-wise squared double DQN TD error.
 */
public class SquaredTDLoss extends TDLoss {

    @Override
    protected INDArray loss(INDArray tdError) {
        return Transforms.pow(tdError, 2, true);
    }
}
