package linkedmap.ordered;

final class Repr {

  private Repr() {}

  /** Renders a value the way it would be written as a literal: strings quoted and escaped, anything else with its toString. */
  static String of(final Object value) {
	if (value instanceof CharSequence chars) {
	  return '"' + chars.toString().replace("\\", "\\\\").replace("\"", "\\\"") + '"';
	} else if (value instanceof Character c) {
	  return "'" + c + "'";
	} else {
	  return String.valueOf(value);
	}
  }
}
