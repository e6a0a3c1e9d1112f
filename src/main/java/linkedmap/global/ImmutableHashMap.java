package linkedmap.global;

import fj.Ord;
import fj.P;
import fj.P2;
import fj.data.List;
import fj.data.TreeMap;

import java.util.Objects;
import java.util.function.Function;

/**
 * A persistent hash map. The entries are grouped in buckets by {@link Object#hashCode()}, and the buckets are held in a
 * persistent {@link TreeMap}, so an update rebuilds only the path to the touched bucket and shares everything else with the
 * previous version. Keys that collide live in the same bucket and are told apart with {@link Object#equals(Object)}.
 * <p>
 * Null keys and null values are not supported.
 */
public final class ImmutableHashMap<K, V> implements ImmutableMap<K, V> {

  private static final ImmutableHashMap<?, ?> EMPTY = new ImmutableHashMap<Object, Object>(0, TreeMap.empty(Ord.intOrd));

  private final int size;
  private final TreeMap<Integer, List<P2<K, V>>> buckets;

  private ImmutableHashMap(final int size, final TreeMap<Integer, List<P2<K, V>>> buckets) {
	this.size = size;
	this.buckets = buckets;
  }

  @SuppressWarnings("unchecked")
  public static <K, V> ImmutableHashMap<K, V> of() {
	return (ImmutableHashMap<K, V>) EMPTY;
  }

  public static <K, V> ImmutableHashMap<K, V> of(final K k1, final V v1) {
	return ImmutableHashMap.<K, V>of().put(k1, v1);
  }

  @Override
  public int size() {
	return this.size;
  }

  @Override
  public V get(final K k) {
	return bucketOf(k).find(entry -> entry._1().equals(k)).map(P2::_2).toNull();
  }

  @Override
  public ImmutableHashMap<K, V> put(final K k, final V v) {
	Objects.requireNonNull(k, "key");
	Objects.requireNonNull(v, "value");
	final var bucket = bucketOf(k);
	final var others = bucket.filter(entry -> !entry._1().equals(k));
	final var newSize = others.length() == bucket.length() ? this.size + 1 : this.size;
	return new ImmutableHashMap<>(newSize, this.buckets.set(k.hashCode(), others.cons(P.p(k, v))));
  }

  @Override
  public ImmutableHashMap<K, V> remove(final K k) {
	final var bucket = bucketOf(k);
	final var others = bucket.filter(entry -> !entry._1().equals(k));
	if (others.length() == bucket.length()) {
	  return this;
	} else if (others.isEmpty()) {
	  return new ImmutableHashMap<>(this.size - 1, this.buckets.delete(k.hashCode()));
	} else {
	  return new ImmutableHashMap<>(this.size - 1, this.buckets.set(k.hashCode(), others));
	}
  }

  @Override
  public <W> ImmutableHashMap<K, W> mapValues(final Function<V, W> f) {
	return new ImmutableHashMap<>(this.size, this.buckets.map(bucket -> bucket.<P2<K, W>>map(entry -> P.p(entry._1(), f.apply(entry._2())))));
  }

  @Override
  public List<K> keys() {
	return this.buckets.values().bind(bucket -> bucket.map(P2::_1));
  }

  private List<P2<K, V>> bucketOf(final K k) {
	return k == null ? List.nil() : this.buckets.get(k.hashCode()).orSome(List.nil());
  }

  @Override
  public boolean equals(final Object o) {
	if (this == o) {
	  return true;
	} else if (!(o instanceof ImmutableHashMap<?, ?> other) || other.size != this.size) {
	  return false;
	} else {
	  @SuppressWarnings("unchecked")
	  final var that = (ImmutableHashMap<K, V>) other;
	  return this.buckets.values().forall(bucket -> bucket.forall(entry -> entry._2().equals(that.get(entry._1()))));
	}
  }

  @Override
  public int hashCode() {
	return this.buckets.values()
	  .foldLeft((accum, bucket) -> bucket.foldLeft((h, entry) -> h + (entry._1().hashCode() ^ entry._2().hashCode()), accum), 0);
  }

  @Override
  public String toString() {
	return this.buckets.values()
	  .bind(bucket -> bucket.map(entry -> entry._1() + "=" + entry._2()))
	  .toJavaList()
	  .toString();
  }
}
