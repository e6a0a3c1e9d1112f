package linkedmap.global;

import fj.data.List;

import java.util.Optional;
import java.util.function.Function;

/**
 * A map whose updates return a new map and leave the receiver untouched.
 */
public interface ImmutableMap<K, V> {
  int size();

  V get(K k);

  ImmutableMap<K, V> put(K k, V v);

  ImmutableMap<K, V> remove(K k);

  <W> ImmutableMap<K, W> mapValues(final Function<V, W> f);

  /** The keys in no particular order. */
  List<K> keys();

  default Optional<V> getSome(final K k) {
	return Optional.ofNullable(get(k));
  }

  default V getOrElse(final K k, final V def) {
	var got = get(k);
	return got == null ? def : got;
  }

  default boolean containsKey(final K k) {
	return get(k) != null;
  }

  default boolean isEmpty() {
	return size() == 0;
  }
}
