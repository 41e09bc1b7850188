package com.sandy.aiot.vision.pipeline.service.scoring;

import com.sandy.aiot.vision.pipeline.config.PipelineProperties;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static com.sandy.aiot.vision.pipeline.service.scoring.ScoringTestVectors.vector;
import static org.junit.jupiter.api.Assertions.*;

class EnsembleScorerTest {

    private static EnsembleScorer scorer() {
        PipelineProperties.Ensemble config = new PipelineProperties.Ensemble();
        config.setTrees(100);
        config.setSampleSize(64);
        config.setHistorySize(128);
        config.setMinTraining(32);
        config.setRetrainEvery(64);
        config.setFeatures(List.of("mean", "std"));
        return new EnsembleScorer("iforest", config);
    }

    private static void train(EnsembleScorer scorer) {
        Random random = new Random(7);
        for (int i = 0; i < 32; i++) {
            ScoreOutcome outcome = scorer.score(vector("temp", i, 10 + random.nextGaussian(), 1 + 0.1 * random.nextGaussian()));
            assertFalse(outcome.isScored());
        }
    }

    @Test
    void outlierScoresHigherThanTypicalWindow() {
        EnsembleScorer scorer = scorer();
        train(scorer);
        ScoreOutcome typical = scorer.score(vector("temp", 40, 10.0, 1.0));
        ScoreOutcome outlier = scorer.score(vector("temp", 41, 60.0, 9.0));
        assertTrue(typical.isScored());
        assertTrue(outlier.getScore() > typical.getScore() + 0.1,
                "outlier=" + outlier.getScore() + " typical=" + typical.getScore());
        assertTrue(ScoreDomain.UNIT.contains(outlier.getScore()));
        assertTrue(ScoreDomain.UNIT.contains(typical.getScore()));
    }

    @Test
    void trainingIsReproducible() {
        EnsembleScorer a = scorer();
        EnsembleScorer b = scorer();
        train(a);
        train(b);
        assertEquals(a.score(vector("temp", 40, 12.5, 1.3)).getScore(),
                b.score(vector("temp", 40, 12.5, 1.3)).getScore());
    }

    @Test
    void rejectsEmptyFeatureList() {
        PipelineProperties.Ensemble config = new PipelineProperties.Ensemble();
        config.setFeatures(List.of());
        assertThrows(IllegalArgumentException.class, () -> new EnsembleScorer("x", config));
    }
}
