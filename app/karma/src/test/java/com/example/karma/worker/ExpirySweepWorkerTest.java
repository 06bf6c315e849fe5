package com.example.karma.worker;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.karma.service.ExpirySweeper;
import com.example.karma.service.SweepReport;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class ExpirySweepWorkerTest {

  @Test
  void runDelegatesToSweeper() {
    final ExpirySweeper sweeper = Mockito.mock(ExpirySweeper.class);
    when(sweeper.tick()).thenReturn(new SweepReport(1, 0, 0, 0, 0));

    new ExpirySweepWorker(sweeper).run();

    verify(sweeper).tick();
  }

  @Test
  void runSurvivesSweepFailure() {
    final ExpirySweeper sweeper = Mockito.mock(ExpirySweeper.class);
    when(sweeper.tick()).thenThrow(new IllegalStateException("db down"));

    final ExpirySweepWorker worker = new ExpirySweepWorker(sweeper);

    assertThatCode(worker::run).doesNotThrowAnyException();
  }
}
