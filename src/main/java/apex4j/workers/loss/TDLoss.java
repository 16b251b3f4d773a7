package apex4j.workers.loss;

import apex4j.workers.memory.TransitionBatch;
import apex4j.workers.network.HeadConfig;
import apex4j.workers.network.PolicyNetwork;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

/**
 * Double DQN temporal difference error (http://arxiv.org/abs/1509.06461):
 * Q(s,a) - (r + gamma * (1 - done) * Q_target(s', argmax_a' Q(s',a'))).
 * Subclasses map the error to a loss.
 */
public abstract class TDLoss implements LossFunction {

    @Override
    public INDArray elementWise(PolicyNetwork policy, PolicyNetwork target, TransitionBatch batch, double gamma, HeadConfig head) {
        return loss(tdError(policy, target, batch, gamma, head));
    }

    protected abstract INDArray loss(INDArray tdError);

    public INDArray tdError(PolicyNetwork policy, PolicyNetwork target, TransitionBatch batch, double gamma, HeadConfig head){
        int n = batch.size();
        INDArray qsa = policy.output(batch.getStates());
        INDArray qsaNext = policy.output(batch.getNextStates());
        INDArray qsaNextTarget = target.output(batch.getNextStates());
        if(qsa.columns() != head.getOutputSize())
            throw new IllegalArgumentException(String.format(
                    "Network outputs %d action values, head expects %d", qsa.columns(), head.getOutputSize()));
        INDArray maxAct = qsaNext.argMax(1);
        double[] rewards = batch.getRewards();
        double[] dones = batch.getDones();

        double[] delta = new double[n];
        for(int i=0;i<n;i++){
            int a = batch.getActions().getInt(i, 0);
            if(a < 0 || a >= head.getOutputSize())
                throw new IllegalArgumentException("Action " + a + " outside of [0, " + head.getOutputSize() + ")");
            double next = qsaNextTarget.getDouble(i, maxAct.getInt(i));
            double y = rewards[i] + gamma * next * (1D - dones[i]);
            delta[i] = qsa.getDouble(i, a) - y;
        }
        return Nd4j.create(delta, new long[]{n, 1});
    }
}
