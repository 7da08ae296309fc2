package baromode.system;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.junit.jupiter.api.Test;

class SchedulingTest
{
	private static List<Callable<Integer>> squares(int nCount)
	{
		ArrayList<Callable<Integer>> oWork = new ArrayList<>();
		for (int nIndex = 0; nIndex < nCount; nIndex++)
		{
			final int nValue = nIndex;
			oWork.add(() -> nValue * nValue);
		}
		return oWork;
	}


	@Test
	void results_keepTaskOrder()
	{
		List<Integer> oSerial = Scheduling.invokeAll(1, squares(20));
		List<Integer> oThreaded = Scheduling.invokeAll(4, squares(20));
		assertEquals(20, oThreaded.size());
		assertEquals(oSerial, oThreaded);
		assertEquals(Integer.valueOf(361), oThreaded.get(19));
	}


	@Test
	void noTasks_returnsEmpty()
	{
		assertTrue(Scheduling.invokeAll(8, new ArrayList<Callable<Object>>()).isEmpty());
	}


	@Test
	void uncheckedFailures_passThrough()
	{
		List<Callable<Integer>> oWork = squares(6);
		oWork.set(3, () ->
		{
			throw new ArithmeticException("boom");
		});
		assertThrows(ArithmeticException.class, () -> Scheduling.invokeAll(3, oWork));
		assertThrows(ArithmeticException.class, () -> Scheduling.invokeAll(1, oWork));
	}


	@Test
	void checkedFailures_areWrapped()
	{
		List<Callable<Integer>> oWork = squares(4);
		oWork.set(0, () ->
		{
			throw new IOException("disk");
		});
		IllegalStateException oThreaded = assertThrows(IllegalStateException.class, () -> Scheduling.invokeAll(2, oWork));
		assertTrue(oThreaded.getCause() instanceof IOException);
		IllegalStateException oSerial = assertThrows(IllegalStateException.class, () -> Scheduling.invokeAll(1, oWork));
		assertTrue(oSerial.getCause() instanceof IOException);
	}
}
