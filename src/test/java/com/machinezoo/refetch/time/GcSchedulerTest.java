// Part of Refetch
package com.machinezoo.refetch.time;

import static org.awaitility.Awaitility.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.time.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import org.awaitility.pollinterval.*;
import org.junit.jupiter.api.*;
import com.machinezoo.noexception.*;

public class GcSchedulerTest {
	private static final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
	@BeforeAll
	public static void awaitility() {
		setDefaultPollInterval(new FibonacciPollInterval());
	}
	private static void sleep(int millis) {
		Exceptions.sneak().run(() -> Thread.sleep(millis));
	}
	@Test
	public void expire() {
		AtomicInteger n = new AtomicInteger();
		GcScheduler gc = new GcScheduler(executor, new Object(), n::incrementAndGet);
		gc.updateGcTime(Duration.ofMillis(10));
		gc.schedule();
		assertTrue(gc.scheduled());
		await().untilAtomic(n, equalTo(1));
		assertFalse(gc.scheduled());
	}
	@Test
	public void clear() {
		AtomicInteger n = new AtomicInteger();
		GcScheduler gc = new GcScheduler(executor, new Object(), n::incrementAndGet);
		gc.updateGcTime(Duration.ofMillis(20));
		gc.schedule();
		gc.clear();
		sleep(100);
		assertEquals(0, n.get());
	}
	@Test
	public void grow() {
		GcScheduler gc = new GcScheduler(executor, new Object(), () -> {});
		gc.updateGcTime(Duration.ofMinutes(1));
		// Timeout only grows.
		gc.updateGcTime(Duration.ofSeconds(1));
		assertEquals(Duration.ofMinutes(1), gc.gcTime());
		gc.updateGcTime(Duration.ofMinutes(2));
		assertEquals(Duration.ofMinutes(2), gc.gcTime());
	}
	@Test
	public void infinite() {
		AtomicInteger n = new AtomicInteger();
		GcScheduler gc = new GcScheduler(executor, new Object(), n::incrementAndGet);
		gc.updateGcTime(Timeouts.INFINITE);
		gc.schedule();
		// Infinite timeout never fires.
		assertFalse(gc.scheduled());
	}
}
