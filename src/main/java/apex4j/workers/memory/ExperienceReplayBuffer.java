package apex4j.workers.memory;

import java.util.ArrayList;
import java.util.List;
import org.nd4j.linalg.api.rng.Random;

/**
 * Uniform sample experience replay memory with maxSize capacity.
 * When maxSize is reached, the oldest element is overwritten.
 * @param <E>
 */
public class ExperienceReplayBuffer<E> {
    protected final int maxSize;
    protected int nextIdx;
    protected final List<E> memory;
    protected final Random rnd;

    public ExperienceReplayBuffer(int maxSize, Random rnd) {
        if(maxSize < 1)
            throw new IllegalArgumentException("Replay memory size must be >= 1, got " + maxSize);
        this.maxSize = maxSize;
        this.nextIdx = 0;
        this.memory = new ArrayList<>();
        this.rnd = rnd;
    }

    /**
     * Add an element to the memory returning the index of the insertion.
     * @param e
     * @return idx
     */
    public synchronized int add(E e){
        if(nextIdx>=memory.size()){
            memory.add(e);
        }else{
            memory.set(nextIdx, e);
        }
        int insertIdx = nextIdx;
        nextIdx = (nextIdx+1)%maxSize;
        return insertIdx;
    }

    public synchronized List<E> sample(int batchSize){
        //Select samples from memory with uniform distribution
        List<E> samples = new ArrayList<>();
        for(int i=0;i<Math.min(memory.size(), batchSize);i++){
            samples.add(memory.get(rnd.nextInt(memory.size())));
        }
        return samples;
    }

    /**
     * Get element in memory index idx.
     * @param idx
     * @return
     */
    public synchronized E get(int idx){
        return memory.get(idx);
    }

    public synchronized int size(){
        return memory.size();
    }

    public synchronized void clear(){
        memory.clear();
        nextIdx = 0;
    }
}
