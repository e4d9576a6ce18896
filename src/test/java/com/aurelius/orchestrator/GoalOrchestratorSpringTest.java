package com.aurelius.orchestrator;

import com.aurelius.core.fsm.State;
import com.aurelius.core.tool.StubToolContractFactory;
import com.aurelius.core.tool.ToolContractFactory;
import com.aurelius.orchestrator.dto.GoalRequest;
import com.aurelius.orchestrator.dto.GoalRunResult;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class GoalOrchestratorSpringTest {

    @Autowired
    private GoalOrchestrator orchestrator;

    @Autowired
    private ToolContractFactory toolContractFactory;

    @Test
    void testTestProfileWiresStubContract() {
        assertInstanceOf(StubToolContractFactory.class, toolContractFactory);
    }

    @Test
    void testGoalRunsEndToEnd() {
        GoalRunResult result = orchestrator.runGoal(GoalRequest.of("mean reversion on SPY", "data.parquet"));

        assertTrue(result.isSuccess(), result.getError());
        assertEquals(State.COMMITTED, result.getFinalState());
        assertNotNull(result.getArtifactId());
    }
}
