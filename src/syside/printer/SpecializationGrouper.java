package syside.printer;

import syside.model.Heritage;
import syside.model.Type;

import java.util.List;

/**
 * Splits the specializations of a type into groups. The multiplicity of the
 * type is printed after the first group, or first of all when the first group
 * is empty.
 */
@FunctionalInterface
public interface SpecializationGrouper {
	List<List<Heritage>> group(Type type);
}
