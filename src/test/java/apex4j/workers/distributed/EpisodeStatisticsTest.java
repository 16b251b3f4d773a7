package apex4j.workers.distributed;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EpisodeStatisticsTest {

    @Test
    void averageOverLastEpisodes() {
        EpisodeStatistics stats = new EpisodeStatistics(2);
        assertEquals(0D, stats.getLastAverageReward());
        stats.addResult(1D, 10);
        stats.addResult(3D, 20);
        stats.addResult(5D, 30);
        assertEquals(4D, stats.getLastAverageReward(), 1e-12);
        assertEquals(3, stats.getEpisodes());
        assertEquals(Integer.valueOf(30), stats.getSteps().get(1));
        assertEquals(2, stats.getScores().size());
    }

    @Test
    void historyIsBounded() {
        EpisodeStatistics stats = new EpisodeStatistics(100);
        for(int i=0;i<200000;i++)
            stats.addResult(i % 2, 5);
        assertEquals(200000L, stats.getEpisodes());
        assertEquals(100, stats.getScores().size());
        assertEquals(100, stats.getSteps().size());
        assertEquals(0.5D, stats.getLastAverageReward(), 1e-9);
    }

    @Test
    void invalidWindow() {
        assertThrows(IllegalArgumentException.class, () -> new EpisodeStatistics(0));
    }
}
