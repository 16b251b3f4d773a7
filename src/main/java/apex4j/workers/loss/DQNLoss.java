package apex4j.workers.loss;

import apex4j.workers.utils.AgentUtils;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.ops.transforms.Transforms;

/**
 * Element-wise Huber (smooth L1) loss of the double DQN TD error.
 */
public class DQNLoss extends TDLoss {

    @Override
    protected INDArray loss(INDArray tdError) {
        INDArray abs = Transforms.abs(tdError, true);
        // quadratic part for |x| <= 1, linear beyond
        INDArray quad = AgentUtils.clamp(abs.dup(), 0D, 1D);
        return quad.mul(quad).muli(0.5D).addi(abs.sub(quad));
    }
}
