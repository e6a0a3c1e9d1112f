package linkedmap.ordered;

import linkedmap.global.ImmutableHashMap;
import linkedmap.global.ImmutableMap;
import lombok.EqualsAndHashCode;
import lombok.extern.slf4j.Slf4j;

import fj.data.List;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collector;
import java.util.stream.Stream;

/**
 * An immutable collection of distinct values that remembers the order in which they were last added.
 * <p>
 * Each value is its own key. The order is kept as a doubly linked list whose links are keys into a persistent hash map, so
 * membership, addition, move to the end and removal cost one map lookup plus the rewrite of at most three {@link Node}s. Every
 * update returns a new map that shares the untouched nodes with the receiver; the receiver never changes.
 * <p>
 * Null values are rejected.
 */
@Slf4j
@EqualsAndHashCode
public final class OrderedMap<K> implements Iterable<K> {

  private static final OrderedMap<?> EMPTY = new OrderedMap<>(null, null, ImmutableHashMap.of());

  /** Null iff the map is empty. */
  private final K head;
  /** Null iff the map is empty. */
  private final K tail;
  private final ImmutableMap<K, Node<K>> entries;

  private OrderedMap(final K head, final K tail, final ImmutableMap<K, Node<K>> entries) {
	this.head = head;
	this.tail = tail;
	this.entries = entries;
	assert isConsistent() : "broken links: " + entries;
  }

  @SuppressWarnings("unchecked")
  public static <K> OrderedMap<K> empty() {
	return (OrderedMap<K>) EMPTY;
  }

  @SafeVarargs
  public static <K> OrderedMap<K> of(final K... values) {
	OrderedMap<K> map = empty();
	for (K value : values) {
	  map = map.add(value);
	}
	return map;
  }

  /**
   * Adds the value at the end or, if it is already present, moves it to the end. The relative order of the other values is kept.
   *
   * @return a map whose tail is {@code value}
   */
  public OrderedMap<K> add(final K value) {
	Objects.requireNonNull(value, "value");
	if (this.entries.isEmpty()) {
	  return new OrderedMap<>(value, value, ImmutableHashMap.of(value, Node.single(value)));
	} else if (value.equals(this.tail)) {
	  return this;
	} else {
	  final OrderedMap<K> base;
	  if (this.entries.containsKey(value)) {
		log.trace("moving {} to the end", value);
		base = remove(value);
	  } else {
		base = this;
	  }
	  final var oldTail = base.tail;
	  final var newEntries = base.entries
		.put(oldTail, base.entries.get(oldTail).withNext(Optional.of(value)))
		.put(value, new Node<>(value, Optional.of(oldTail), Optional.empty()));
	  return new OrderedMap<>(base.head, value, newEntries);
	}
  }

  /** Like {@link #add(Object)} but leaves the map as it is when the value is already present. */
  public OrderedMap<K> addNew(final K value) {
	return this.entries.containsKey(value) ? this : add(value);
  }

  /**
   * Like {@link #add(Object)} but refuses values that are already present.
   *
   * @throws DuplicateValueException if {@code value} is already present
   */
  public OrderedMap<K> addNewOrThrow(final K value) {
	if (this.entries.containsKey(value)) {
	  log.debug("rejecting duplicate value {}", value);
	  throw new DuplicateValueException(value);
	}
	return add(value);
  }

  /**
   * Removes the value if present, relinking its neighbours to each other.
   *
   * @return this map when {@code value} is absent
   */
  public OrderedMap<K> remove(final K value) {
	final var node = this.entries.get(value);
	if (node == null) {
	  return this;
	} else if (value.equals(this.head) && value.equals(this.tail)) {
	  return empty();
	} else if (value.equals(this.head)) {
	  final var newHead = this.entries.get(node.next().orElseThrow());
	  final var newEntries = this.entries.remove(value)
		.put(newHead.value(), newHead.withPrevious(Optional.empty()));
	  return new OrderedMap<>(newHead.value(), this.tail, newEntries);
	} else if (value.equals(this.tail)) {
	  final var newTail = this.entries.get(node.previous().orElseThrow());
	  final var newEntries = this.entries.remove(value)
		.put(newTail.value(), newTail.withNext(Optional.empty()));
	  return new OrderedMap<>(this.head, newTail.value(), newEntries);
	} else {
	  final var previous = this.entries.get(node.previous().orElseThrow());
	  final var next = this.entries.get(node.next().orElseThrow());
	  final var newEntries = this.entries.remove(value)
		.put(previous.value(), previous.withNext(Optional.of(next.value())))
		.put(next.value(), next.withPrevious(Optional.of(previous.value())));
	  return new OrderedMap<>(this.head, this.tail, newEntries);
	}
  }

  /**
   * Like {@link #remove(Object)} but refuses values that are not present.
   *
   * @throws MissingValueException if {@code value} is absent
   */
  public OrderedMap<K> removeOrThrow(final K value) {
	if (!this.entries.containsKey(value)) {
	  log.debug("cannot remove absent value {}", value);
	  throw new MissingValueException(value);
	}
	return remove(value);
  }

  /** The stored value equal to {@code key}, or {@code def}. Does not alter the order. */
  public K get(final K key, final K def) {
	final var node = this.entries.get(key);
	return node == null ? def : node.value();
  }

  /** Like {@link #get(Object, Object)} but the default is computed only when {@code key} is absent. */
  public K getLazy(final K key, final Supplier<? extends K> def) {
	Objects.requireNonNull(def, "def");
	final var node = this.entries.get(key);
	return node == null ? def.get() : node.value();
  }

  public int size() {
	return this.entries.size();
  }

  public boolean isEmpty() {
	return this.entries.isEmpty();
  }

  public boolean contains(final K value) {
	return this.entries.containsKey(value);
  }

  public Optional<K> head() {
	return Optional.ofNullable(this.head);
  }

  public Optional<K> tail() {
	return Optional.ofNullable(this.tail);
  }

  /** The links of {@code value}, if present. */
  public Optional<Node<K>> node(final K value) {
	return this.entries.getSome(value);
  }

  /** The values from head to tail. Built eagerly on every call. */
  public List<K> toList() {
	final var buffer = new List.Buffer<K>();
	var current = this.head;
	while (current != null) {
	  buffer.snoc(current);
	  current = this.entries.get(current).next().orElse(null);
	}
	return buffer.toList();
  }

  /** The values from tail to head, following the backward links. */
  public List<K> toReversedList() {
	final var buffer = new List.Buffer<K>();
	var current = this.tail;
	while (current != null) {
	  buffer.snoc(current);
	  current = this.entries.get(current).previous().orElse(null);
	}
	return buffer.toList();
  }

  public <B> B foldLeft(final BiFunction<B, ? super K, B> f, final B initial) {
	return toList().foldLeft((B accum, K value) -> f.apply(accum, value), initial);
  }

  public Stream<K> stream() {
	return toList().toJavaList().stream();
  }

  /** Iterates a snapshot taken by {@link #toList()}. */
  @Override
  public Iterator<K> iterator() {
	return toList().iterator();
  }

  @Override
  public String toString() {
	return "OrderedMap" + toList().toJavaList();
  }

  private boolean isConsistent() {
	if (this.entries.isEmpty()) {
	  return this.head == null && this.tail == null;
	} else if (this.head == null || this.tail == null) {
	  return false;
	}
	var visited = 0;
	K previous = null;
	var current = this.head;
	while (current != null && visited < this.entries.size()) {
	  final var node = this.entries.get(current);
	  if (node == null || !Objects.equals(node.previous().orElse(null), previous) || current.equals(node.next().orElse(null))) {
		return false;
	  }
	  visited += 1;
	  previous = current;
	  current = node.next().orElse(null);
	}
	return current == null && visited == this.entries.size() && this.tail.equals(previous);
  }

  public static <K> Builder<K> builder() {
	return new Builder<>();
  }

  /** Accumulates additions on a local variable. Not meant to be shared. */
  public static class Builder<K> {
	private OrderedMap<K> current = empty();

	private Builder() {}

	public Builder<K> add(final K value) {
	  this.current = this.current.add(value);
	  return this;
	}

	public Builder<K> addAll(final OrderedMap<K> other) {
	  for (K value : other) {
		add(value);
	  }
	  return this;
	}

	public OrderedMap<K> build() {
	  return this.current;
	}
  }

  /**
   * Collects the elements of a stream with {@link #add(Object)}, so a repeated element ends up at the position of its last
   * occurrence.
   */
  public static <K> Collector<K, Builder<K>, OrderedMap<K>> collector() {
	return new Collector<>() {
	  static final Set<Characteristics> CHARACTERISTICS = Set.of();

	  @Override
	  public Supplier<Builder<K>> supplier() {
		return OrderedMap::builder;
	  }

	  @Override
	  public BiConsumer<Builder<K>, K> accumulator() {
		return Builder::add;
	  }

	  @Override
	  public BinaryOperator<Builder<K>> combiner() {
		return (left, right) -> left.addAll(right.build());
	  }

	  @Override
	  public Function<Builder<K>, OrderedMap<K>> finisher() {
		return Builder::build;
	  }

	  @Override
	  public Set<Characteristics> characteristics() {
		return CHARACTERISTICS;
	  }
	};
  }
}
