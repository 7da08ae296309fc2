package baromode.system;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import ucar.ma2.Array;
import ucar.ma2.DataType;

class ArraysTest
{
	@Test
	void resolveAxis_acceptsNegativeAxes()
	{
		assertEquals(0, Arrays.resolveAxis(0, 3));
		assertEquals(2, Arrays.resolveAxis(-1, 3));
		assertEquals(0, Arrays.resolveAxis(-3, 3));
		assertEquals(-1, Arrays.resolveAxis(3, 3));
		assertEquals(-1, Arrays.resolveAxis(-4, 3));
		assertEquals(-1, Arrays.resolveAxis(0, 0));
	}


	@Test
	void removeAndInsertAxis_areInverse()
	{
		int[] nShape = new int[]{2, 8, 3, 5};
		assertArrayEquals(new int[]{8, 3, 5}, Arrays.removeAxis(nShape, 0));
		assertArrayEquals(new int[]{2, 8, 3}, Arrays.removeAxis(nShape, 3));
		int[] nReduced = Arrays.removeAxis(nShape, 1);
		assertArrayEquals(new int[]{2, 3, 5}, nReduced);
		assertArrayEquals(nShape, Arrays.insertAxis(nReduced, 1, 8));
		assertArrayEquals(new int[]{7}, Arrays.insertAxis(new int[0], 0, 7));
	}


	@Test
	void size_ofAnEmptyShapeIsOne()
	{
		assertEquals(1L, Arrays.size(new int[0]));
		assertEquals(30L, Arrays.size(new int[]{2, 3, 5}));
		assertEquals(0L, Arrays.size(new int[]{4, 0}));
	}


	@Test
	void counters_followRowMajorOrder()
	{
		int[] nShape = new int[]{2, 3, 4};
		int[] nCounter = new int[3];
		Arrays.toCounter(0, nShape, nCounter);
		assertArrayEquals(new int[]{0, 0, 0}, nCounter);
		Arrays.toCounter(23, nShape, nCounter);
		assertArrayEquals(new int[]{1, 2, 3}, nCounter);
		Arrays.toCounter(13, nShape, nCounter);
		assertArrayEquals(new int[]{1, 0, 1}, nCounter);

		int[] nFull = new int[]{-1, -1, -1, -1};
		Arrays.expandCounter(nCounter, 2, nFull);
		assertArrayEquals(new int[]{1, 0, -1, 1}, nFull);
	}


	@Test
	void isNumeric_rejectsBooleansCharsAndStrings()
	{
		assertTrue(Arrays.isNumeric(Array.factory(DataType.DOUBLE, new int[]{2})));
		assertTrue(Arrays.isNumeric(Array.factory(DataType.SHORT, new int[]{2})));
		assertTrue(Arrays.isNumeric(Array.factory(DataType.BYTE, new int[]{2})));
		assertFalse(Arrays.isNumeric(Array.factory(DataType.BOOLEAN, new int[]{2})));
		assertFalse(Arrays.isNumeric(Array.factory(DataType.CHAR, new int[]{2})));
		assertFalse(Arrays.isNumeric(Array.factory(DataType.STRING, new int[]{2})));
	}


	@Test
	void toFloat_readsViewsInLogicalOrder()
	{
		Array oLevels = Array.factory(DataType.DOUBLE, new int[]{4}, new double[]{1000, 850, 700, 500});
		assertArrayEquals(new float[]{1000f, 850f, 700f, 500f}, Arrays.toFloat(oLevels), 0f);
		assertArrayEquals(new float[]{500f, 700f, 850f, 1000f}, Arrays.toFloat(oLevels.flip(0)), 0f);
		assertArrayEquals(new float[]{0.1f, 2.5f}, Arrays.toFloat(new double[]{0.1, 2.5}), 0f);
	}
}
