package org.metricshub.jcae.jrt;

import static org.junit.Assert.*;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Test;

public class RegionTest {

	@Test
	public void testNewRegionIsZeroed() {
		Region region = new Region("main", 4);
		assertEquals("main", region.getName());
		assertEquals(4, region.capacity());
		assertEquals(0, region.getHead());
		assertArrayEquals(new int[] { 0, 0, 0, 0 }, region.snapshot());
	}

	@Test
	public void testValuesWrap() {
		Region region = new Region("r", 1);
		region.decrement();
		assertEquals(255, region.get());
		region.increment();
		assertEquals(0, region.get());
		region.set(0x1FF);
		assertEquals(255, region.get());
		for (int i = 0; i < 256; i++) {
			region.increment();
		}
		assertEquals(255, region.get());
	}

	@Test
	public void testHeadWraps() {
		Region region = new Region("r", 3);
		region.moveLeft();
		assertEquals(2, region.getHead());
		region.moveRight();
		assertEquals(0, region.getHead());
		region.move(-7);
		assertEquals(2, region.getHead());
		region.move(Integer.MAX_VALUE);
		assertEquals((2 + Integer.MAX_VALUE % 3) % 3, region.getHead());
		region.resetHead();
		assertEquals(0, region.getHead());
	}

	@Test
	public void testSingleCellRegionHeadNeverMoves() {
		Region region = new Region("r", 1);
		region.moveRight();
		region.moveLeft();
		region.moveLeft();
		assertEquals(0, region.getHead());
	}

	@Test
	public void testIndexedAccess() {
		Region region = new Region("r", 4);
		region.moveRight();
		region.set(42);
		assertEquals(42, region.get(1));
		assertEquals(42, region.get(5));
		assertEquals(42, region.get(-3));
		assertEquals(0, region.get(0));
	}

	@Test
	public void testCapacityMustBePositive() {
		assertThrows(IllegalArgumentException.class, () -> new Region("r", 0));
	}

	@Test
	public void testStore() {
		Map<String, Integer> capacities = new LinkedHashMap<String, Integer>();
		capacities.put("main", 2);
		capacities.put("io", 1);
		RegionStore store = new RegionStore(capacities);
		assertTrue(store.contains("main"));
		assertFalse(store.contains("other"));
		assertEquals(2, store.get("main").capacity());
		assertEquals(1, store.get("io").capacity());
		assertEquals(2, store.getRegions().size());
		assertThrows(IllegalStateException.class, () -> store.get("other"));
	}
}
