package apex4j.workers.memory;

import java.util.ArrayList;
import java.util.List;
import org.nd4j.linalg.api.rng.Random;

/**
 * Proportional prioritized replay memory (http://arxiv.org/abs/1511.05952).
 * Entry i is drawn with probability p_i^alpha / sum_k p_k^alpha. Workers seed the
 * priorities of the experience they emit, so entries coming from a worker batch
 * keep the priority the worker computed.
 */
public class PrioritizedReplayBuffer extends ExperienceReplayBuffer<Transition> {
    private final double alpha;
    private final double[] priorities;
    private double maxPriority;

    public PrioritizedReplayBuffer(int maxSize, double alpha, Random rnd) {
        super(maxSize, rnd);
        if(alpha < 0D)
            throw new IllegalArgumentException("alpha must be >= 0, got " + alpha);
        this.alpha = alpha;
        this.priorities = new double[maxSize];
        this.maxPriority = 1D;
    }

    /**
     * Add a transition with the current maximum priority.
     */
    @Override
    public synchronized int add(Transition t){
        return add(t, maxPriority);
    }

    public synchronized int add(Transition t, double priority){
        checkPriority(priority);
        int idx = super.add(t);
        priorities[idx] = Math.pow(priority, alpha);
        maxPriority = Math.max(maxPriority, priority);
        return idx;
    }

    /**
     * Add every transition of a worker batch with its precomputed priority.
     * @return insertion indices, in batch order
     */
    public synchronized int[] add(TransitionBatch batch, double[] batchPriorities){
        if(batchPriorities.length != batch.size())
            throw new IllegalArgumentException(String.format(
                    "Got %d priorities for a batch of %d transitions", batchPriorities.length, batch.size()));
        int[] idx = new int[batch.size()];
        for(int i=0;i<batch.size();i++)
            idx[i] = add(batch.get(i), batchPriorities[i]);
        return idx;
    }

    /**
     * Draw batchSize transitions proportionally to their priorities.
     * @param batchSize
     * @param beta importance-sampling correction exponent
     */
    public synchronized PrioritizedSample sample(int batchSize, double beta){
        int n = memory.size();
        if(n == 0)
            throw new IllegalStateException("Cannot sample from an empty replay memory");
        double total = 0D;
        double min = Double.MAX_VALUE;
        for(int i=0;i<n;i++){
            total += priorities[i];
            min = Math.min(min, priorities[i]);
        }
        double maxWeight = Math.pow(n * (min/total), -beta);

        List<Transition> samples = new ArrayList<>(batchSize);
        int[] indices = new int[batchSize];
        double[] weights = new double[batchSize];
        for(int b=0;b<batchSize;b++){
            double target = rnd.nextDouble() * total;
            int idx = find(target, n);
            indices[b] = idx;
            samples.add(memory.get(idx));
            weights[b] = Math.pow(n * (priorities[idx]/total), -beta) / maxWeight;
        }
        return new PrioritizedSample(samples, indices, weights);
    }

    public synchronized void updatePriorities(int[] indices, double[] newPriorities){
        if(indices.length != newPriorities.length)
            throw new IllegalArgumentException("indices and priorities differ in length");
        for(int i=0;i<indices.length;i++){
            checkPriority(newPriorities[i]);
            priorities[indices[i]] = Math.pow(newPriorities[i], alpha);
            maxPriority = Math.max(maxPriority, newPriorities[i]);
        }
    }

    /**
     * Stored (alpha-scaled) priority of entry idx.
     */
    public synchronized double getPriority(int idx){
        if(idx < 0 || idx >= memory.size())
            throw new IndexOutOfBoundsException("Index " + idx + " out of memory of size " + memory.size());
        return priorities[idx];
    }

    @Override
    public synchronized void clear(){
        super.clear();
        for(int i=0;i<priorities.length;i++)
            priorities[i] = 0D;
        maxPriority = 1D;
    }

    private int find(double target, int n){
        double cum = 0D;
        for(int i=0;i<n;i++){
            cum += priorities[i];
            if(target < cum)
                return i;
        }
        return n-1;
    }

    private static void checkPriority(double p){
        if(!(p > 0D))
            throw new IllegalArgumentException("Priorities must be strictly positive, got " + p);
    }
}
