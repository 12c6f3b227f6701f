// Part of Refetch
package com.machinezoo.refetch.util;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.stagean.*;

/*
 * Listeners frequently unsubscribe themselves or subscribe others while being notified.
 * Iteration runs over a copy-on-write snapshot, so such changes take effect with the next notification.
 */
/**
 * Ordered set of listeners of any type.
 * Exceptions thrown by listeners are logged and do not stop delivery to the remaining listeners.
 */
@StubDocs
public class ObserverList<L> {
	private static final Logger logger = LoggerFactory.getLogger(ObserverList.class);
	private final CopyOnWriteArrayList<L> observers = new CopyOnWriteArrayList<>();
	public boolean add(L observer) {
		Objects.requireNonNull(observer);
		return observers.addIfAbsent(observer);
	}
	public boolean remove(L observer) {
		return observers.remove(observer);
	}
	public CloseableScope subscribe(L observer) {
		add(observer);
		return () -> remove(observer);
	}
	public boolean contains(L observer) {
		return observers.contains(observer);
	}
	public int size() {
		return observers.size();
	}
	public boolean isEmpty() {
		return observers.isEmpty();
	}
	public List<L> snapshot() {
		return List.copyOf(observers);
	}
	public void clear() {
		observers.clear();
	}
	public void forEach(Consumer<? super L> action) {
		for (L observer : observers)
			ExceptionLogging.log(logger).run(() -> action.accept(observer));
	}
}
