package apex4j.workers.distributed;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Episode score and length history of a worker. Only the last averageWindow
 * episodes are kept.
 */
public class EpisodeStatistics {
    private final int averageWindow;
    private final Deque<Double> scores;
    private final Deque<Integer> steps;
    private double scoreSum;
    private long episodes;

    public EpisodeStatistics() {
        this(100);
    }

    public EpisodeStatistics(int averageWindow) {
        if(averageWindow < 1)
            throw new IllegalArgumentException("Average window must be >= 1, got " + averageWindow);
        this.averageWindow = averageWindow;
        this.scores = new ArrayDeque<>(averageWindow);
        this.steps = new ArrayDeque<>(averageWindow);
    }

    public synchronized void addResult(double score, int episodeSteps){
        if(scores.size() == averageWindow){
            scoreSum -= scores.removeFirst();
            steps.removeFirst();
        }
        scores.addLast(score);
        steps.addLast(episodeSteps);
        scoreSum += score;
        episodes++;
    }

    /**
     * Mean score over the last averageWindow episodes, 0 if there is none.
     */
    public synchronized double getLastAverageReward(){
        if(scores.isEmpty())
            return 0D;
        return scoreSum / scores.size();
    }

    /**
     * Episodes recorded since creation, including the ones no longer retained.
     */
    public synchronized long getEpisodes(){
        return episodes;
    }

    public synchronized List<Double> getScores(){
        return new ArrayList<>(scores);
    }

    public synchronized List<Integer> getSteps(){
        return new ArrayList<>(steps);
    }
}
