package mailflow.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.TreeSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FlowExecutionTest {

  @Test
  void nextExpectedStepFollowsHighestCompletedIndex() {
    assertEquals(0, execution(List.of()).nextExpectedStep());
    assertEquals(3, execution(List.of(0, 1, 2)).nextExpectedStep());
  }

  @Test
  void completedStepsAreReadOnly() {
    FlowExecution execution = execution(List.of(0));

    assertTrue(execution.isCompleted(0));
    assertFalse(execution.isCompleted(1));
    assertThrows(UnsupportedOperationException.class, () -> execution.completedSteps().add(5));
  }

  @Test
  void signalWithoutIdsIsIncomplete() {
    Instant now = Instant.now();

    assertTrue(StepSignal.create("f", "e", 0, now, now).isComplete());
    assertFalse(new StepSignal("s", "", "e", 0, 0, now, now).isComplete());
    assertFalse(new StepSignal("s", "f", "e", -1, 0, now, now).isComplete());
    assertFalse(new StepSignal("s", "f", "e", null, 0, now, now).isComplete());
  }

  private static FlowExecution execution(List<Integer> completed) {
    Instant now = Instant.now();
    return new FlowExecution("e1", "f1", "c1", ExecutionStatus.ACTIVE, 0, new TreeSet<>(completed),
        null, null, null, 0, now, now, null);
  }
}
