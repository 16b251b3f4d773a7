package apex4j.workers.distributed;

import apex4j.workers.comm.LocalLearnerChannel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Creates, starts and stops a set of independent workers with ranks 0..n-1.
 * Workers share nothing but the learner channel.
 */
public class WorkerPool {
    private static final Logger LOGGER = Logger.getLogger(WorkerPool.class.getName());

    private final WorkerFactory workerFactory;
    private final LocalLearnerChannel channel;
    private final List<WorkerThread> workersThreads;
    private ExecutorService es;

    public WorkerPool(WorkerFactory workerFactory, LocalLearnerChannel channel) {
        this.workerFactory = workerFactory;
        this.channel = channel;
        this.workersThreads = new ArrayList<>();
    }

    /**
     * Create and start the workers.
     * @param workers number of workers
     */
    public synchronized void start(int workers){
        if(workers < 1)
            throw new IllegalArgumentException("Number of workers must be >= 1, got " + workers);
        if(es != null)
            throw new IllegalStateException("Worker pool already started");
        workersThreads.clear();
        // create workers
        for(int i=0;i<workers;i++){
            Worker worker = workerFactory.create(i);
            workersThreads.add(new WorkerThread("worker_thread_"+i, worker));
        }
        // Start workers
        es = Executors.newCachedThreadPool();
        for(WorkerThread thread : workersThreads)
            es.execute(thread);
        LOGGER.log(Level.INFO, "Started {0} workers", workers);
    }

    /**
     * Send a new parameter set to every worker.
     */
    public void broadcast(List<INDArray> params){
        channel.publish(params);
    }

    /**
     * Iterate over worker threads checking if any is still running.
     * @return
     */
    public synchronized boolean isRunning(){
        for(WorkerThread tw : workersThreads)
            if(tw.isRunning())
                return true;
        return false;
    }

    /**
     * Stop every worker. Workers blocked on emission are interrupted.
     */
    public synchronized void shutdown(){
        for(WorkerThread tw : workersThreads)
            tw.getWorker().stop();
        if(es != null)
            es.shutdownNow();
        LOGGER.info("Worker pool shutdown requested");
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        ExecutorService current;
        synchronized (this) {
            current = es;
        }
        return current == null || current.awaitTermination(timeout, unit);
    }

    public synchronized List<Worker> getWorkers(){
        List<Worker> workers = new ArrayList<>(workersThreads.size());
        for(WorkerThread tw : workersThreads)
            workers.add(tw.getWorker());
        return Collections.unmodifiableList(workers);
    }

    /**
     * Errors that terminated workers, empty if none failed.
     */
    public synchronized List<Throwable> getFailures(){
        List<Throwable> failures = new ArrayList<>();
        for(WorkerThread tw : workersThreads)
            if(tw.getFailure() != null)
                failures.add(tw.getFailure());
        return failures;
    }

    public LocalLearnerChannel getChannel() {
        return channel;
    }
}
