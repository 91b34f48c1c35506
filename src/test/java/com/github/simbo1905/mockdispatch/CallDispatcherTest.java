package com.github.simbo1905.mockdispatch;

import static com.github.simbo1905.mockdispatch.Fixtures.SHAPE_AREA;
import static com.github.simbo1905.mockdispatch.Fixtures.SHAPE_CHILD;
import static com.github.simbo1905.mockdispatch.Fixtures.SHAPE_SCALE;
import static com.github.simbo1905.mockdispatch.Fixtures.call;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class CallDispatcherTest extends JulLoggingConfig {

  private static final Logger logger = Logger.getLogger(CallDispatcherTest.class.getName());

  private CallDispatcher dispatcher;

  @Before
  public void setup() {
    dispatcher = new CallDispatcher.Builder().build();
  }

  @Test
  public void testDispatchLogsEveryCallAndRecordsMatches() {
    RegisteredSetup area = dispatcher.setup(StubSetup.on(SHAPE_AREA));
    Invocation matched = call(SHAPE_AREA);
    Invocation unmatched = call(SHAPE_SCALE, 2.0);

    Assert.assertEquals(Optional.of(area), dispatcher.dispatch(matched));
    Assert.assertEquals(Optional.empty(), dispatcher.dispatch(unmatched));

    InvocationLog log = dispatcher.getInvocations();
    Assert.assertEquals(2, log.size());
    Assert.assertSame(matched, log.get(0));
    Assert.assertSame(unmatched, log.get(1));
    Assert.assertEquals(1, log.currentVersion());
  }

  @Test
  public void testFindUnverifiedSetups() {
    RegisteredSetup area = dispatcher.setup(StubSetup.on(SHAPE_AREA));
    RegisteredSetup scale = dispatcher.setup(StubSetup.on(SHAPE_SCALE));

    assertThat(dispatcher.findUnverifiedSetups(), contains(scale, area));

    dispatcher.dispatch(call(SHAPE_SCALE, 3.0));

    assertThat(dispatcher.findUnverifiedSetups(), contains(area));
  }

  @Test
  public void testOverriddenSetupIsNotRequiredToBeMatched() {
    dispatcher.setup(StubSetup.on(SHAPE_AREA));
    RegisteredSetup newer = dispatcher.setup(StubSetup.on(SHAPE_AREA));

    Assert.assertEquals(Optional.of(newer), dispatcher.dispatch(call(SHAPE_AREA)));
    assertThat(dispatcher.findUnverifiedSetups(), is(empty()));
  }

  @Test
  public void testInnerMockSetupsAreSkippedByDefault() {
    Object inner = new Fixtures.Square();
    RegisteredSetup child = dispatcher.setup(StubSetup.on(SHAPE_CHILD).returningInnerMock(inner));

    assertThat(dispatcher.findUnverifiedSetups(), is(empty()));
    assertThat(dispatcher.findUnverifiedSetups(setup -> false), contains(child));
    assertThat(dispatcher.innerMocks(), contains(inner));
  }

  @Test
  public void testUnverifiedInvocations() {
    dispatcher.setup(StubSetup.on(SHAPE_AREA));
    Invocation area = call(SHAPE_AREA);
    Invocation scale = call(SHAPE_SCALE, 1.5);
    dispatcher.dispatch(area);
    dispatcher.dispatch(scale);

    assertThat(dispatcher.unverifiedInvocations(), contains(area, scale));

    dispatcher.findUnverifiedSetups();

    List<Invocation> remaining = dispatcher.unverifiedInvocations();
    logger.log(Level.FINE, () -> "remaining: " + remaining);
    assertThat(remaining, contains(scale));
  }

  @Test
  public void testResetForgetsEverything() {
    dispatcher.setup(StubSetup.on(SHAPE_AREA));
    dispatcher.dispatch(call(SHAPE_AREA));

    dispatcher.reset();

    Assert.assertTrue(dispatcher.getSetups().isEmpty());
    Assert.assertTrue(dispatcher.getInvocations().isEmpty());
    Assert.assertEquals(Optional.empty(), dispatcher.dispatch(call(SHAPE_AREA)));
  }

  @Test
  public void testBuilderSharesSuppliedComponents() {
    SetupRegistry registry = new SetupRegistry();
    InvocationLog log = new InvocationLog();
    CallDispatcher shared =
        new CallDispatcher.Builder().setupRegistry(registry).invocationLog(log).build();

    Assert.assertSame(registry, shared.getSetups());
    Assert.assertSame(log, shared.getInvocations());
  }

  @Test
  public void testBuilderInitialCapacity() {
    CallDispatcher sized = new CallDispatcher.Builder().initialCapacity(2).build();
    sized.dispatch(call(SHAPE_AREA));

    Assert.assertEquals(2, sized.getInvocations().capacity());
  }

  @Test(expected = IllegalStateException.class)
  public void testBuilderRejectsCapacityForSuppliedLog() {
    new CallDispatcher.Builder().invocationLog(new InvocationLog()).initialCapacity(8).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBuilderRejectsNonPositiveCapacity() {
    new CallDispatcher.Builder().initialCapacity(0);
  }

  @Test
  public void testSharedLogRequiresTheSameRegistry() {
    InvocationLog log = new InvocationLog();
    SetupRegistry registry = new SetupRegistry();
    CallDispatcher first =
        new CallDispatcher.Builder().setupRegistry(registry).invocationLog(log).build();
    CallDispatcher second =
        new CallDispatcher.Builder().setupRegistry(registry).invocationLog(log).build();
    Assert.assertSame(first.getInvocations(), second.getInvocations());

    Assert.assertThrows(
        IllegalStateException.class,
        () -> new CallDispatcher.Builder().invocationLog(log).build());
    Assert.assertThrows(
        IllegalStateException.class,
        () ->
            new CallDispatcher.Builder()
                .setupRegistry(new SetupRegistry())
                .invocationLog(log)
                .build());
  }

  @Test
  public void testRegistryClearDoesNotCarryMatchesOver() {
    dispatcher.setup(StubSetup.on(SHAPE_AREA));
    dispatcher.dispatch(call(SHAPE_AREA));

    dispatcher.getSetups().clear();
    RegisteredSetup scale = dispatcher.setup(StubSetup.on(SHAPE_SCALE));

    assertThat(dispatcher.findUnverifiedSetups(), contains(scale));
  }

  @Test
  public void testConcurrentDispatchAndSetup() throws Exception {
    final int threads = 4;
    final int calls = 250;
    dispatcher.setup(StubSetup.on(SHAPE_AREA));
    ExecutorService executor = Executors.newFixedThreadPool(threads + 1);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int t = 0; t < threads; t++) {
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < calls; i++) {
                    Assert.assertTrue(dispatcher.dispatch(call(SHAPE_AREA)).isPresent());
                  }
                  return null;
                }));
      }
      futures.add(
          executor.submit(
              () -> {
                start.await();
                for (int i = 0; i < calls; i++) {
                  dispatcher.setup(StubSetup.on(SHAPE_SCALE).expecting("scale #" + i));
                }
                return null;
              }));
      start.countDown();
      // get() rethrows assertion failures raised inside the tasks
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    Assert.assertEquals(threads * calls, dispatcher.getInvocations().size());
    Assert.assertEquals(threads * calls, dispatcher.getInvocations().currentVersion());
    Assert.assertEquals(calls + 1, dispatcher.getSetups().size());
  }
}
