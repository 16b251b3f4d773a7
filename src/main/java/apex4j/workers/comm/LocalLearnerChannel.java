package apex4j.workers.comm;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * In-process learner side of the worker/learner link. Experience goes through a
 * bounded queue, so emitting workers block when the learner falls behind.
 * Parameters are published into one mailbox per connected worker.
 */
public class LocalLearnerChannel {
    private static final Logger LOGGER = Logger.getLogger(LocalLearnerChannel.class.getName());

    private final BlockingQueue<Experience> experiences;
    private final Map<Integer, ConcurrentLinkedQueue<List<INDArray>>> mailboxes;

    public LocalLearnerChannel(int capacity) {
        if(capacity < 1)
            throw new IllegalArgumentException("Channel capacity must be >= 1, got " + capacity);
        this.experiences = new LinkedBlockingQueue<>(capacity);
        this.mailboxes = new ConcurrentHashMap<>();
    }

    /**
     * Register a worker and return its end of the channel.
     */
    public WorkerChannel connect(int rank){
        ConcurrentLinkedQueue<List<INDArray>> mailbox = new ConcurrentLinkedQueue<>();
        if(mailboxes.putIfAbsent(rank, mailbox) != null)
            throw new IllegalStateException("Worker " + rank + " is already connected");
        return new Endpoint(mailbox);
    }

    public void disconnect(int rank){
        mailboxes.remove(rank);
    }

    /**
     * Publish a parameter set to every connected worker. Each worker receives its own copy
     * and a mailbox only keeps the newest set.
     */
    public void publish(List<INDArray> params){
        for(Map.Entry<Integer, ConcurrentLinkedQueue<List<INDArray>>> e : mailboxes.entrySet()){
            List<INDArray> copy = new ArrayList<>(params.size());
            for(INDArray p : params)
                copy.add(p.dup());
            ConcurrentLinkedQueue<List<INDArray>> mailbox = e.getValue();
            mailbox.clear();
            mailbox.add(copy);
        }
        LOGGER.log(Level.FINE, "Published {0} parameter arrays to {1} workers", new Object[]{params.size(), mailboxes.size()});
    }

    public Experience take() throws InterruptedException {
        return experiences.take();
    }

    public Experience poll(long timeout, TimeUnit unit) throws InterruptedException {
        return experiences.poll(timeout, unit);
    }

    public int pendingExperiences(){
        return experiences.size();
    }

    public int connectedWorkers(){
        return mailboxes.size();
    }

    /**
     * Parameter sets waiting in the mailbox of a worker, 0 if it is not connected.
     */
    public int pendingParameters(int rank){
        ConcurrentLinkedQueue<List<INDArray>> mailbox = mailboxes.get(rank);
        return mailbox == null ? 0 : mailbox.size();
    }

    private class Endpoint implements WorkerChannel {
        private final ConcurrentLinkedQueue<List<INDArray>> mailbox;

        Endpoint(ConcurrentLinkedQueue<List<INDArray>> mailbox) {
            this.mailbox = mailbox;
        }

        @Override
        public void emit(Experience experience) throws InterruptedException {
            experiences.put(experience);
        }

        @Override
        public List<INDArray> pollParameters() {
            List<INDArray> latest = null;
            List<INDArray> next;
            while((next = mailbox.poll()) != null)
                latest = next;
            return latest;
        }
    }
}
