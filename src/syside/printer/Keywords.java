package syside.printer;

import syside.Unreachable;
import syside.options.LanguageMode;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Reserved words of both languages. Names spelled like a reserved word have to be
 * quoted.
 */
public class Keywords {
	private Keywords() {}

	private static final Set<String> KERML = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"about", "abstract", "alias", "all", "and", "as", "assoc", "behavior", "binding", "bool", "by",
			"chains", "class", "classifier", "comment", "composite", "conjugate", "conjugates", "conjugation",
			"connector", "datatype", "default", "dependency", "derived", "differences", "disjoining", "disjoint",
			"doc", "else", "end", "expr", "false", "feature", "featured", "featuring", "filter", "first", "flow",
			"for", "from", "function", "hastype", "if", "implies", "import", "in", "inout", "interaction",
			"intersects", "inv", "inverse", "inverting", "istype", "language", "library", "locale", "member",
			"meta", "metaclass", "metadata", "multiplicity", "namespace", "nonunique", "not", "null", "of", "or",
			"ordered", "out", "package", "portion", "predicate", "private", "protected", "public", "readonly",
			"redefines", "redefinition", "references", "rep", "return", "specialization", "specializes",
			"standard", "step", "struct", "subclassifier", "subset", "subsets", "subtype", "succession", "then",
			"to", "true", "type", "typed", "typing", "unions", "xor")));

	private static final Set<String> SYSML = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"about", "abstract", "accept", "action", "actor", "after", "alias", "all", "allocate", "allocation",
			"analysis", "and", "as", "assert", "assign", "assume", "at", "attribute", "bind", "binding", "by",
			"calc", "case", "comment", "concern", "connect", "connection", "constraint", "decide", "def",
			"default", "defined", "dependency", "derived", "do", "doc", "else", "end", "entry", "enum", "event",
			"exhibit", "exit", "expose", "false", "filter", "first", "flow", "for", "fork", "frame", "from",
			"hastype", "if", "implies", "import", "in", "include", "individual", "inout", "interface", "istype",
			"item", "join", "language", "library", "locale", "loop", "merge", "message", "meta", "metadata",
			"nonunique", "not", "null", "objective", "occurrence", "of", "or", "ordered", "out", "package",
			"parallel", "part", "perform", "port", "private", "protected", "public", "readonly", "redefines",
			"ref", "references", "render", "rendering", "rep", "require", "requirement", "return", "satisfy",
			"send", "snapshot", "specializes", "stakeholder", "standard", "state", "subject", "subsets",
			"succession", "then", "timeslice", "to", "transition", "true", "until", "use", "variant",
			"variation", "verification", "verify", "via", "view", "viewpoint", "when", "while", "xor")));

	public static Set<String> of(LanguageMode mode) {
		switch (mode) {
			case KERML:
				return KERML;
			case SYSML:
				return SYSML;
			default:
				throw new Unreachable();
		}
	}
}
