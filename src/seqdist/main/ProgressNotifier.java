package seqdist.main;

/**
 * Receives progress reports from long running processes and decides if they should continue
 */
public interface ProgressNotifier {
	/**
	 * Notifies the progress of a process
	 * @param progress Number of work units finished so far
	 * @return boolean true if the process should continue, false if it should be cancelled
	 */
	public boolean keepRunning(int progress);
}
