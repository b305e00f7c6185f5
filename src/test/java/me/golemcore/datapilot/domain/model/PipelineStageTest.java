package me.golemcore.datapilot.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineStageTest {

    @Test
    void shouldNeverMoveBackwardsToEarlierStage() {
        assertEquals(PipelineStage.MODEL, PipelineStage.latest(PipelineStage.MODEL, PipelineStage.EXPLORE));
        assertEquals(PipelineStage.EXPLAIN, PipelineStage.latest(PipelineStage.MODEL, PipelineStage.EXPLAIN));
        assertEquals(PipelineStage.INGEST, PipelineStage.latest(PipelineStage.INGEST, null));
        assertEquals(PipelineStage.ENGINEER, PipelineStage.latest(null, PipelineStage.ENGINEER));
    }

    @Test
    void shouldOrderStagesByDeclaration() {
        assertTrue(PipelineStage.ENGINEER.isAfter(PipelineStage.INGEST));
        assertFalse(PipelineStage.INGEST.isAfter(PipelineStage.INGEST));
        assertTrue(PipelineStage.INGEST.isAfter(null));
        assertEquals("explain", PipelineStage.EXPLAIN.displayName());
    }
}
