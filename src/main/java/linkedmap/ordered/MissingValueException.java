package linkedmap.ordered;

import lombok.Getter;

import java.util.NoSuchElementException;

/** Thrown by {@link OrderedMap#removeOrThrow(Object)} when the value is not present. */
@Getter
public class MissingValueException extends NoSuchElementException {

  private final transient Object value;

  public MissingValueException(final Object value) {
	this(value, String.format("value %s is not present", Repr.of(value)));
  }

  public MissingValueException(final Object value, final String message) {
	super(message);
	this.value = value;
  }
}
