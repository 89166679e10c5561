package syside;

/**
 * Base of everything the formatter throws on purpose. Printing a well-formed
 * element graph never throws one, so reaching the caller means the graph broke
 * a structural rule or an options file was rejected.
 */
public abstract class SysIDEException extends RuntimeException {
}
