package syside.printer;

import syside.errors.IssueContext;
import syside.errors.ModeViolationIssue;
import syside.model.Element;
import syside.model.Note;
import syside.options.FormatOptions;
import syside.options.LanguageMode;

import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.logging.Logger;

/**
 * State of a single print call. A context must not be shared between calls, the
 * printed note set and the warned kinds are only valid for one call.
 */
public class PrintContext {
	private static final Logger LOGGER = Logger.getLogger("SysIDE Printer");

	private final LanguageMode mode;
	private final Set<String> keywords;
	private final FormatOptions format;
	private final boolean highlighting;
	private final boolean forceFormatting;
	private final IssueContext issues;

	private final Set<Note> printed = Collections.newSetFromMap(new IdentityHashMap<>());
	private final Set<String> warnedKinds = new HashSet<>();
	private int nextGroupId = 0;

	public PrintContext(LanguageMode mode, FormatOptions format, boolean highlighting, boolean forceFormatting,
	                    IssueContext issues) {
		this.mode = mode;
		this.keywords = Keywords.of(mode);
		this.format = format;
		this.highlighting = highlighting;
		this.forceFormatting = forceFormatting;
		this.issues = issues;
		// a root namespace can only miss notes when it has no children at all
		warnedKinds.add("Namespace");
	}

	public LanguageMode getMode() {
		return mode;
	}

	public boolean isSysML() {
		return mode == LanguageMode.SYSML;
	}

	public Set<String> getKeywords() {
		return keywords;
	}

	public FormatOptions getFormat() {
		return format;
	}

	public boolean isHighlighting() {
		return highlighting;
	}

	public boolean isForceFormatting() {
		return forceFormatting;
	}

	public IssueContext getIssues() {
		return issues;
	}

	public Logger getLogger() {
		return LOGGER;
	}

	/**
	 * @return a group id unique within this print call
	 */
	public String groupId(String name) {
		return name + "#" + (nextGroupId++);
	}

	public void markPrinted(Note note) {
		printed.add(note);
	}

	public boolean isPrinted(Note note) {
		return printed.contains(note);
	}

	public Set<Note> getPrinted() {
		return Collections.unmodifiableSet(printed);
	}

	/**
	 * @return true the first time it is called for kind
	 */
	public boolean shouldWarn(String kind) {
		return warnedKinds.add(kind);
	}

	public void assertKerML(Element element) {
		if (mode != LanguageMode.KERML) {
			throw new ModeViolationIssue(element, LanguageMode.KERML);
		}
	}

	public void assertSysML(Element element) {
		if (mode != LanguageMode.SYSML) {
			throw new ModeViolationIssue(element, LanguageMode.SYSML);
		}
	}
}
