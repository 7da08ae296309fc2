package baromode.system;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs groups of independent tasks on a fixed size thread pool that only lives
 * for the duration of the call.
 */
public abstract class Scheduling
{
	/**
	 * Counter used to name worker threads
	 */
	private static final AtomicInteger m_nThreadCount = new AtomicInteger();


	/**
	 * Log4j Logger
	 */
	private static final Logger m_oLogger = LogManager.getLogger(Scheduling.class);


	/**
	 * Default constructor. Does nothing.
	 */
	private Scheduling()
	{
	}


	/**
	 * Executes all of the tasks and waits for them to finish. With one thread
	 * or one task the tasks are run in order on the calling thread.
	 *
	 * @param <T> result type of the tasks
	 * @param nThreads maximum number of worker threads
	 * @param oWork tasks to execute
	 * @return the results of the tasks in the same order as the tasks
	 * @throws IllegalStateException if a task fails with a checked exception or
	 * the calling thread is interrupted while waiting. Unchecked exceptions
	 * thrown by a task are rethrown as is.
	 */
	public static <T> List<T> invokeAll(int nThreads, List<? extends Callable<T>> oWork)
	{
		ArrayList<T> oResults = new ArrayList(oWork.size());
		nThreads = Math.min(nThreads, oWork.size());
		if (nThreads <= 1)
		{
			for (Callable<T> oTask : oWork)
				oResults.add(call(oTask));

			return oResults;
		}

		ExecutorService oExecutor = Executors.newFixedThreadPool(nThreads, new WorkerFactory());
		try
		{
			ArrayList<Future<T>> oFutures = new ArrayList(oWork.size());
			for (Callable<T> oTask : oWork)
				oFutures.add(oExecutor.submit(oTask));

			for (Future<T> oFuture : oFutures)
				oResults.add(oFuture.get());

			return oResults;
		}
		catch (ExecutionException oEx)
		{
			Throwable oCause = oEx.getCause();
			m_oLogger.error("Worker task failed", oCause);
			if (oCause instanceof RuntimeException)
				throw (RuntimeException)oCause;
			if (oCause instanceof Error)
				throw (Error)oCause;
			throw new IllegalStateException(oCause);
		}
		catch (InterruptedException oEx)
		{
			m_oLogger.error("Interrupted while waiting for workers");
			Thread.currentThread().interrupt();
			throw new IllegalStateException(oEx);
		}
		finally
		{
			oExecutor.shutdownNow();
		}
	}


	/**
	 * Calls the task on the current thread
	 */
	private static <T> T call(Callable<T> oTask)
	{
		try
		{
			return oTask.call();
		}
		catch (RuntimeException oEx)
		{
			throw oEx;
		}
		catch (Exception oEx)
		{
			m_oLogger.error("Task failed", oEx);
			throw new IllegalStateException(oEx);
		}
	}


	/**
	 * Creates named daemon worker threads
	 */
	private static class WorkerFactory implements ThreadFactory
	{
		@Override
		public Thread newThread(Runnable oRunnable)
		{
			Thread oThread = new Thread(oRunnable, "baromode-worker-" + m_nThreadCount.incrementAndGet());
			oThread.setDaemon(true);
			return oThread;
		}
	}
}
