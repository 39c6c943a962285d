/*******************************************************************************
 * SeqDist - Pairwise alignments and evolutionary distances
 * Copyright 2026 SeqDist developers
 *
 * This file is part of SeqDist.
 *
 *     SeqDist is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     SeqDist is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with SeqDist.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package seqdist.main;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Fixed size pool of worker threads for independent tasks
 */
public class ThreadPoolManager {
	private static final int TIMEOUT_SECONDS = 30;
	
	private int maxTaskCount;
	private long secondsPerTask=1;
	private final int numThreads;
	private ThreadPoolExecutor pool;
	private int queuedTasks = 0;
	
	public ThreadPoolManager(int numberOfThreads, int maxTaskCount) {
		if(numberOfThreads<1) throw new IllegalArgumentException("Number of threads must be positive. Given: "+numberOfThreads);
		this.numThreads = numberOfThreads;
		this.maxTaskCount = Math.max(1, maxTaskCount);
		this.pool = createPool();
	}
	
	public long getSecondsPerTask() {
		return secondsPerTask;
	}
	/**
	 * @param secondsPerTask Expected maximum time in seconds for each task. The pool waits for queued tasks
	 * at most this time multiplied by the number of tasks queued since the pool was launched
	 */
	public void setSecondsPerTask(long secondsPerTask) {
		if(secondsPerTask<1) throw new IllegalArgumentException("Seconds per task must be positive. Given: "+secondsPerTask);
		this.secondsPerTask = secondsPerTask;
	}
	
	/**
	 * Adds task to the threadPoolExecutor for this instance. If the task queue limit is exceeded,
	 * the pool will be relaunched afterwards, after waiting for all queued tasks to finish.
	 * @param task task to add to the pool
	 * @throws InterruptedException if the relaunch process is interrupted
	 */
	public void queueTask(Runnable task) throws InterruptedException {
		int taskCount = pool.getQueue().size();
		if(taskCount >= maxTaskCount) {
			relaunchPool();
		}
		pool.execute(task);
		queuedTasks++;
	}
	
	/**
	 * Terminates the pool, shutting it down and waiting for it to finish all queued tasks.
	 * @throws InterruptedException if the shutdown operation is interrupted or if the tasks did not finish in time
	 */
	public void terminatePool() throws InterruptedException  {
		pool.shutdown();
		long waitSeconds = Math.max(1, queuedTasks)*secondsPerTask;
		pool.awaitTermination(waitSeconds, TimeUnit.SECONDS);
		if(!pool.isTerminated()) {
			pool.shutdownNow();
			throw new InterruptedException("The ThreadPoolExecutor did not finish queued tasks after "+waitSeconds+" seconds");
		}
	}
	
	/**
	 * Shuts down the pool, waiting for all queued tasks to finish. Then, it creates a new one.
	 * @throws InterruptedException if the shutdown operation is interrupted or if the pool was not shutdown correctly.
	 */
	private void relaunchPool() throws InterruptedException {
		this.terminatePool();
		pool = createPool();
		queuedTasks = 0;
	}
	
	private ThreadPoolExecutor createPool() {
		return new ThreadPoolExecutor(numThreads, numThreads, TIMEOUT_SECONDS, TimeUnit.SECONDS, new LinkedBlockingQueue<Runnable>());
	}
}
