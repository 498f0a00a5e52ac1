package org.sessionstore;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class SessionLockTableTest {

	private SessionLockTable locks;
	private ExecutorService executor;

	@Before
	public void setUp() {
		locks = new SessionLockTable();
		executor = Executors.newCachedThreadPool();
	}

	@After
	public void tearDown() {
		executor.shutdownNow();
	}

	@Test
	public void secondAcquireWaitsForRelease() throws Exception {
		SessionLockTable.Lease first = locks.acquire("abc");
		final CountDownLatch started = new CountDownLatch(1);
		Future<SessionLockTable.Lease> second = executor.submit(new Callable<SessionLockTable.Lease>() {
			public SessionLockTable.Lease call() {
				started.countDown();
				return locks.acquire("abc");
			}
		});
		started.await();

		try {
			second.get(200, TimeUnit.MILLISECONDS);
			fail("second acquire should block while the first lease is held");
		} catch(TimeoutException expected) {
		}

		first.close();
		SessionLockTable.Lease lease = second.get(5, TimeUnit.SECONDS);
		assertEquals("abc", lease.getSessionId());
		assertTrue(locks.isHeld("abc"));
		lease.close();
		assertFalse(locks.isHeld("abc"));
	}

	@Test
	public void differentIdsDoNotBlockEachOther() {
		SessionLockTable.Lease a = locks.acquire("a");
		SessionLockTable.Lease b = locks.acquire("b");
		assertEquals(2, locks.size());
		a.close();
		b.close();
		assertEquals(0, locks.size());
	}

	@Test
	public void closingALeaseTwiceDoesNotReleaseTheNextHolder() {
		SessionLockTable.Lease first = locks.acquire("abc");
		first.close();
		SessionLockTable.Lease second = locks.acquire("abc");
		first.close();
		assertTrue(locks.isHeld("abc"));
		second.close();
		assertFalse(locks.isHeld("abc"));
	}

	@Test
	public void manyWaitersAreAdmittedOneAtATime() throws Exception {
		final int waiters = 8;
		final int[] inside = new int[1];
		final int[] maxInside = new int[1];
		SessionLockTable.Lease holder = locks.acquire("shared");
		Future<?>[] futures = new Future<?>[waiters];
		for(int i = 0; i < waiters; i++) {
			futures[i] = executor.submit(new Callable<Void>() {
				public Void call() throws InterruptedException {
					try(SessionLockTable.Lease lease = locks.acquire("shared")) {
						synchronized(inside) {
							inside[0]++;
							maxInside[0] = Math.max(maxInside[0], inside[0]);
						}
						Thread.sleep(5);
						synchronized(inside) {
							inside[0]--;
						}
					}
					return null;
				}
			});
		}
		holder.close();
		for(Future<?> future : futures) {
			future.get(10, TimeUnit.SECONDS);
		}
		assertEquals(1, maxInside[0]);
		assertFalse(locks.isHeld("shared"));
	}

}
