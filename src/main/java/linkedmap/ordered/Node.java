package linkedmap.ordered;

import java.util.Optional;

/**
 * The place of a value in the order of an {@link OrderedMap}. The neighbours are referenced by their keys, which are looked up in
 * the same map, never by object reference.
 */
public record Node<K>(K value, Optional<K> previous, Optional<K> next) {

  static <K> Node<K> single(final K value) {
	return new Node<>(value, Optional.empty(), Optional.empty());
  }

  Node<K> withPrevious(final Optional<K> previous) {
	return new Node<>(this.value, previous, this.next);
  }

  Node<K> withNext(final Optional<K> next) {
	return new Node<>(this.value, this.previous, next);
  }
}
