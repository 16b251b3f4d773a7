package apex4j.workers.distributed;

import apex4j.workers.memory.TransitionBatch;

/**
 * Capability of scoring collected experience for prioritized replay.
 */
public interface PrioritySource {
    /**
     * @return one strictly positive priority per batch entry, in batch order
     */
    public double[] computePriorities(TransitionBatch batch);
}
