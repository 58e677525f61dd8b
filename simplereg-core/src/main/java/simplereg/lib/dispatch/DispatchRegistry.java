/*-
 * #%L
 * This file is part of SimpleReg.
 * %%
 * Copyright (C) 2024 SimpleReg developers
 * %%
 * SimpleReg is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * SimpleReg is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with SimpleReg.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package simplereg.lib.dispatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable table mapping dispatch keys (usually {@link simplereg.lib.images.TypeDescriptor TypeDescriptors}
 * or {@link TypeDescriptorPair TypeDescriptorPairs}) to the functions that implement an operation for them.
 * <p>
 * A registry is created with a {@link Builder}, which accepts each key only once. Once built the
 * registry cannot change, so it can be shared and queried from any thread without locking.
 * Lookups are exact: there is no fallback to a 'closest' key.
 *
 * @param <K> key type
 * @param <F> function type
 * @author SimpleReg developers
 */
public final class DispatchRegistry<K, F> {

	private final String name;
	private final Map<K, F> entries;

	private DispatchRegistry(String name, Map<K, F> entries) {
		this.name = name;
		this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
	}

	/**
	 * Create a builder for a new registry.
	 * @param <K>
	 * @param <F>
	 * @param name name of the operation, used in log and error messages
	 * @return
	 */
	public static <K, F> Builder<K, F> builder(String name) {
		return new Builder<>(name);
	}

	/**
	 * Get the name of the registry.
	 * @return
	 */
	public String getName() {
		return name;
	}

	/**
	 * Get the function registered for a key.
	 * @param key
	 * @return the function, or an empty optional if the key has not been registered
	 */
	public Optional<F> lookup(K key) {
		if (key == null)
			return Optional.empty();
		return Optional.ofNullable(entries.get(key));
	}

	/**
	 * Returns true if a function is registered for the key.
	 * @param key
	 * @return
	 */
	public boolean contains(K key) {
		return key != null && entries.containsKey(key);
	}

	/**
	 * Get all registered keys, in registration order.
	 * @return an unmodifiable set
	 */
	public Set<K> keys() {
		return entries.keySet();
	}

	/**
	 * Get the number of registered keys.
	 * @return
	 */
	public int size() {
		return entries.size();
	}

	@Override
	public String toString() {
		return "DispatchRegistry[" + name + ", " + entries.size() + " entries]";
	}


	/**
	 * Builder for a {@link DispatchRegistry}.
	 * Registration is append-only; registering a key twice is an error.
	 *
	 * @param <K>
	 * @param <F>
	 */
	public static class Builder<K, F> {

		private final String name;
		private final Map<K, F> entries = new LinkedHashMap<>();
		private boolean built = false;

		private Builder(String name) {
			this.name = Objects.requireNonNull(name);
		}

		/**
		 * Register a function for a key.
		 * @param key
		 * @param function
		 * @return this builder
		 * @throws IllegalArgumentException if the key is already registered
		 * @throws IllegalStateException if the registry has already been built
		 */
		public Builder<K, F> register(K key, F function) {
			Objects.requireNonNull(key, "Key must not be null");
			Objects.requireNonNull(function, "Function must not be null");
			if (built)
				throw new IllegalStateException("Registry " + name + " has already been built");
			if (entries.putIfAbsent(key, function) != null)
				throw new IllegalArgumentException("Duplicate registration of " + key + " for " + name);
			return this;
		}

		/**
		 * Get the number of keys registered so far.
		 * @return
		 */
		public int size() {
			return entries.size();
		}

		/**
		 * Build an immutable registry containing all registered entries.
		 * The builder cannot be used after this call.
		 * @return
		 */
		public DispatchRegistry<K, F> build() {
			if (built)
				throw new IllegalStateException("Registry " + name + " has already been built");
			built = true;
			return new DispatchRegistry<>(name, entries);
		}

	}

}
