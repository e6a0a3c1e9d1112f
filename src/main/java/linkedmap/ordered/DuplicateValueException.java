package linkedmap.ordered;

import lombok.Getter;

/** Thrown by {@link OrderedMap#addNewOrThrow(Object)} when the value is already present. */
@Getter
public class DuplicateValueException extends IllegalStateException {

  private final transient Object value;

  public DuplicateValueException(final Object value) {
	this(value, String.format("value %s is already present", Repr.of(value)));
  }

  public DuplicateValueException(final Object value, final String message) {
	super(message);
	this.value = value;
  }
}
