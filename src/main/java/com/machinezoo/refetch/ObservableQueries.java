// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.refetch.util.*;
import com.machinezoo.stagean.*;

/*
 * Observers are matched to options by hash, so reordering or extending the option list keeps existing observers
 * and their results. Observers are subscribed only while this object has listeners.
 */
/**
 * Subscription to a list of resources with results combined into one value.
 * 
 * @param <C>
 *            type of combined result
 */
@StubDocs
@DraftApi("typed combinations")
public class ObservableQueries<C> {
	private final QueryClient client;
	private final QueryEnvironment env;
	private final Function<List<QueryResult<?>>, C> combine;
	private final ObserverList<Consumer<C>> listeners = new ObserverList<>();
	private final Map<ObservableQuery<?, ?, ?>, CloseableScope> subscriptions = new IdentityHashMap<>();
	private List<ObservableQuery<?, ?, ?>> observers = new ArrayList<>();
	private List<QueryResult<?>> result = new ArrayList<>();
	private C combinedResult;
	public ObservableQueries(QueryClient client, List<? extends QueryOptions<?, ?, ?>> queries, Function<List<QueryResult<?>>, C> combine) {
		Objects.requireNonNull(client);
		Objects.requireNonNull(combine);
		this.client = client;
		env = client.env();
		this.combine = combine;
		OwnerTrace.of(this).alias("queries").parent(client);
		synchronized (env.lock) {
			setResult(new ArrayList<>());
			setQueries(queries);
		}
	}
	/**
	 * Creates subscription whose combined result is the list of individual results.
	 */
	public static ObservableQueries<List<QueryResult<?>>> of(QueryClient client, List<? extends QueryOptions<?, ?, ?>> queries) {
		return new ObservableQueries<>(client, queries, r -> r);
	}
	private static class Match {
		final QueryOptions<?, ?, ?> options;
		final ObservableQuery<?, ?, ?> observer;
		Match(QueryOptions<?, ?, ?> options, ObservableQuery<?, ?, ?> observer) {
			this.options = options;
			this.observer = observer;
		}
	}
	private List<Match> findMatchingObservers(List<? extends QueryOptions<?, ?, ?>> queries) {
		Map<String, ObservableQuery<?, ?, ?>> previous = new HashMap<>();
		for (ObservableQuery<?, ?, ?> observer : observers)
			previous.put(observer.options().queryHash(), observer);
		List<Match> matches = new ArrayList<>();
		for (QueryOptions<?, ?, ?> options : queries) {
			QueryOptions<?, ?, ?> resolved = client.defaultQueryOptions(options);
			ObservableQuery<?, ?, ?> reused = previous.remove(resolved.queryHash());
			matches.add(new Match(resolved, reused != null ? reused : client.watchQuery(resolved)));
		}
		return matches;
	}
	/**
	 * Replaces the list of resources. Listeners are notified only if the list of observers changed.
	 */
	public void setQueries(List<? extends QueryOptions<?, ?, ?>> queries) {
		Objects.requireNonNull(queries);
		synchronized (env.lock) {
			List<ObservableQuery<?, ?, ?>> previous = observers;
			List<Match> matches = findMatchingObservers(queries);
			List<ObservableQuery<?, ?, ?>> next = new ArrayList<>();
			for (Match match : matches) {
				setOptions(match.observer, match.options);
				next.add(match.observer);
			}
			boolean indexChange = false;
			for (int i = 0; i < next.size(); ++i)
				if (i >= previous.size() || next.get(i) != previous.get(i))
					indexChange = true;
			if (previous.size() == next.size() && !indexChange)
				return;
			observers = next;
			List<QueryResult<?>> results = new ArrayList<>();
			for (ObservableQuery<?, ?, ?> observer : next)
				results.add(observer.getCurrentResult());
			setResult(results);
			if (listeners.isEmpty())
				return;
			for (ObservableQuery<?, ?, ?> observer : previous)
				if (!containsIdentity(next, observer))
					unsubscribeFrom(observer);
			for (ObservableQuery<?, ?, ?> observer : next)
				if (!containsIdentity(previous, observer))
					subscribeTo(observer);
			notifyListeners();
		}
	}
	public CloseableScope subscribe(Consumer<C> listener) {
		Objects.requireNonNull(listener);
		synchronized (env.lock) {
			if (listeners.add(listener) && listeners.size() == 1) {
				for (ObservableQuery<?, ?, ?> observer : observers)
					subscribeTo(observer);
			}
		}
		return () -> {
			synchronized (env.lock) {
				if (listeners.remove(listener) && listeners.isEmpty())
					destroy();
			}
		};
	}
	public void destroy() {
		synchronized (env.lock) {
			listeners.clear();
			for (ObservableQuery<?, ?, ?> observer : new ArrayList<>(subscriptions.keySet()))
				unsubscribeFrom(observer);
		}
	}
	public C getCurrentResult() {
		synchronized (env.lock) {
			return combinedResult;
		}
	}
	/**
	 * Individual results in the order of options.
	 */
	public List<QueryResult<?>> getResults() {
		synchronized (env.lock) {
			return Collections.unmodifiableList(result);
		}
	}
	public List<QueryInfo<?, ?>> queries() {
		synchronized (env.lock) {
			List<QueryInfo<?, ?>> queries = new ArrayList<>();
			for (ObservableQuery<?, ?, ?> observer : observers)
				queries.add(observer.query());
			return queries;
		}
	}
	public List<ObservableQuery<?, ?, ?>> observers() {
		synchronized (env.lock) {
			return Collections.unmodifiableList(new ArrayList<>(observers));
		}
	}
	/**
	 * Optimistic results for a list of options that may differ from the current one.
	 */
	public class OptimisticResult {
		private final List<Match> matches;
		private final List<QueryResult<?>> raw;
		private OptimisticResult(List<Match> matches, List<QueryResult<?>> raw) {
			this.matches = matches;
			this.raw = raw;
		}
		public List<QueryResult<?>> raw() {
			return Collections.unmodifiableList(raw);
		}
		public C combined() {
			return combined(raw);
		}
		public C combined(List<QueryResult<?>> results) {
			synchronized (env.lock) {
				return combineResult(new ArrayList<>(results));
			}
		}
		/**
		 * Raw results wrapped for field tracking by their observers.
		 */
		public List<QueryResult<?>> tracked() {
			List<QueryResult<?>> tracked = new ArrayList<>();
			for (int i = 0; i < matches.size(); ++i)
				tracked.add(trackResult(matches.get(i).observer, raw.get(i)));
			return tracked;
		}
	}
	public OptimisticResult getOptimisticResult(List<? extends QueryOptions<?, ?, ?>> queries) {
		Objects.requireNonNull(queries);
		synchronized (env.lock) {
			List<Match> matches = findMatchingObservers(queries);
			List<QueryResult<?>> raw = new ArrayList<>();
			for (Match match : matches)
				raw.add(optimisticResult(match.observer, match.options));
			return new OptimisticResult(matches, raw);
		}
	}
	private void onUpdate(ObservableQuery<?, ?, ?> observer, QueryResult<?> update) {
		synchronized (env.lock) {
			int index = indexOfIdentity(observers, observer);
			if (index >= 0) {
				List<QueryResult<?>> next = new ArrayList<>(result);
				next.set(index, update);
				setResult(next);
				notifyListeners();
			}
		}
	}
	private void setResult(List<QueryResult<?>> value) {
		result = value;
		combinedResult = combineResult(value);
	}
	private C combineResult(List<QueryResult<?>> input) {
		return StructuralSharing.replaceEqualDeep(combinedResult, combine.apply(input));
	}
	private void notifyListeners() {
		C current = combinedResult;
		listeners.forEach(l -> l.accept(current));
	}
	private void subscribeTo(ObservableQuery<?, ?, ?> observer) {
		if (!subscriptions.containsKey(observer))
			subscriptions.put(observer, subscribe(observer, r -> onUpdate(observer, r)));
	}
	private void unsubscribeFrom(ObservableQuery<?, ?, ?> observer) {
		CloseableScope subscription = subscriptions.remove(observer);
		if (subscription != null)
			subscription.close();
	}
	private static boolean containsIdentity(List<?> list, Object item) {
		return indexOfIdentity(list, item) >= 0;
	}
	private static int indexOfIdentity(List<?> list, Object item) {
		for (int i = 0; i < list.size(); ++i)
			if (list.get(i) == item)
				return i;
		return -1;
	}
	/*
	 * Observers and options are matched by hash at runtime, so their type parameters cannot be tracked statically.
	 */
	@SuppressWarnings("unchecked")
	private static <V, D, R> void setOptions(ObservableQuery<V, D, R> observer, QueryOptions<?, ?, ?> options) {
		observer.setOptions((QueryOptions<V, D, R>)options);
	}
	@SuppressWarnings("unchecked")
	private static <V, D, R> QueryResult<?> optimisticResult(ObservableQuery<V, D, R> observer, QueryOptions<?, ?, ?> options) {
		return observer.getOptimisticResult((QueryOptions<V, D, R>)options);
	}
	@SuppressWarnings("unchecked")
	private static <V, D, R> QueryResult<?> trackResult(ObservableQuery<V, D, R> observer, QueryResult<?> result) {
		return observer.trackResult((QueryResult<R>)result);
	}
	private static <V, D, R> CloseableScope subscribe(ObservableQuery<V, D, R> observer, Consumer<QueryResult<?>> listener) {
		return observer.subscribe(listener::accept);
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
