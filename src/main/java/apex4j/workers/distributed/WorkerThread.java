package apex4j.workers.distributed;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread class for run each worker collection loop.
 */
public class WorkerThread extends Thread {
    private static final Logger LOGGER = Logger.getLogger(WorkerThread.class.getName());

    private final Worker worker;
    private volatile boolean running;
    private volatile Throwable failure;

    public WorkerThread(String name, Worker worker) {
        super(name);
        this.worker = worker;
        this.running = false;
    }

    public boolean isRunning() {
        return running;
    }

    public Throwable getFailure() {
        return failure;
    }

    public Worker getWorker() {
        return worker;
    }

    @Override
    public void run() {
        this.running = true;
        try {
            worker.run();
        } catch (InterruptedException ex) {
            LOGGER.log(Level.INFO, "{0} interrupted, worker {1} stopped", new Object[]{getName(), worker.getRank()});
            Thread.currentThread().interrupt();
        } catch (RuntimeException | Error ex) {
            // recorded for WorkerPool.getFailures, the executor never sees it
            failure = ex;
            LOGGER.log(Level.SEVERE, getName() + " terminated by an unrecoverable error", ex);
        } finally {
            this.running = false;
        }
    }
}
