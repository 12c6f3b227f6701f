// Part of Refetch
package com.machinezoo.refetch;

import com.machinezoo.closeablescope.*;
import com.machinezoo.refetch.util.*;

/**
 * Tells fetch functions that their result is no longer wanted.
 * Fetch functions may poll {@link #aborted()} or register a callback to stop their work early.
 */
public class AbortSignal {
	private volatile boolean aborted;
	private final ObserverList<Runnable> listeners = new ObserverList<>();
	public boolean aborted() {
		return aborted;
	}
	/**
	 * Registers callback that runs when the signal is aborted. It runs immediately if the signal is already aborted.
	 */
	public CloseableScope onAbort(Runnable listener) {
		synchronized (listeners) {
			if (!aborted)
				return listeners.subscribe(listener);
		}
		listener.run();
		return () -> {};
	}
	void abort() {
		synchronized (listeners) {
			if (aborted)
				return;
			aborted = true;
		}
		listeners.forEach(Runnable::run);
		listeners.clear();
	}
}
