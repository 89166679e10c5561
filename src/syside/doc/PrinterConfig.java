package syside.doc;

import org.json.JSONException;
import org.json.JSONObject;
import syside.errors.InvalidFormatOptionIssue;
import syside.errors.UnknownFormatOptionIssue;
import syside.options.FormatOptionException;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Renderer settings.
 */
public class PrinterConfig {
	public static final String LINE_WIDTH = "lineWidth";
	public static final String TAB_WIDTH = "tabWidth";
	public static final String USE_SPACES = "useSpaces";
	public static final String LINE_END = "lineEnd";
	public static final String ADD_FINAL_NEWLINE = "addFinalNewline";
	public static final String HIGHLIGHTING = "highlighting";

	private static final Set<String> KEYS = new HashSet<>(Arrays.asList(
			LINE_WIDTH, TAB_WIDTH, USE_SPACES, LINE_END, ADD_FINAL_NEWLINE, HIGHLIGHTING));

	private final int lineWidth;
	private final int tabWidth;
	private final boolean useSpaces;
	private final String lineEnd;
	private final boolean addFinalNewline;
	private final boolean highlighting;

	public PrinterConfig(int lineWidth, int tabWidth, boolean useSpaces, String lineEnd, boolean addFinalNewline,
	                     boolean highlighting) {
		this.lineWidth = lineWidth;
		this.tabWidth = tabWidth;
		this.useSpaces = useSpaces;
		this.lineEnd = lineEnd;
		this.addFinalNewline = addFinalNewline;
		this.highlighting = highlighting;
	}

	public static PrinterConfig defaults() {
		return new PrinterConfig(100, 4, true, "\n", true, false);
	}

	/**
	 * Reads a config object, any missing key takes its default value.
	 *
	 * @throws FormatOptionException on unknown keys or badly typed values
	 */
	public static PrinterConfig fromJSON(JSONObject json) throws FormatOptionException {
		for (String key : json.keySet()) {
			if (!KEYS.contains(key)) {
				throw new FormatOptionException(new UnknownFormatOptionIssue(key));
			}
		}
		PrinterConfig defaults = defaults();
		try {
			String lineEnd = json.optString(LINE_END, defaults.lineEnd);
			if (!lineEnd.equals("\n") && !lineEnd.equals("\r\n")) {
				throw new FormatOptionException(new InvalidFormatOptionIssue(LINE_END, lineEnd, "\"\\n\" or \"\\r\\n\""));
			}
			return new PrinterConfig(
					json.has(LINE_WIDTH) ? json.getInt(LINE_WIDTH) : defaults.lineWidth,
					json.has(TAB_WIDTH) ? json.getInt(TAB_WIDTH) : defaults.tabWidth,
					json.has(USE_SPACES) ? json.getBoolean(USE_SPACES) : defaults.useSpaces,
					lineEnd,
					json.has(ADD_FINAL_NEWLINE) ? json.getBoolean(ADD_FINAL_NEWLINE) : defaults.addFinalNewline,
					json.has(HIGHLIGHTING) ? json.getBoolean(HIGHLIGHTING) : defaults.highlighting);
		} catch (JSONException e) {
			throw new FormatOptionException(new InvalidFormatOptionIssue("printer config", e.getMessage()));
		}
	}

	public PrinterConfig withLineWidth(int lineWidth) {
		return new PrinterConfig(lineWidth, tabWidth, useSpaces, lineEnd, addFinalNewline, highlighting);
	}

	public PrinterConfig withTabWidth(int tabWidth) {
		return new PrinterConfig(lineWidth, tabWidth, useSpaces, lineEnd, addFinalNewline, highlighting);
	}

	public PrinterConfig withUseSpaces(boolean useSpaces) {
		return new PrinterConfig(lineWidth, tabWidth, useSpaces, lineEnd, addFinalNewline, highlighting);
	}

	public PrinterConfig withLineEnd(String lineEnd) {
		return new PrinterConfig(lineWidth, tabWidth, useSpaces, lineEnd, addFinalNewline, highlighting);
	}

	public PrinterConfig withAddFinalNewline(boolean addFinalNewline) {
		return new PrinterConfig(lineWidth, tabWidth, useSpaces, lineEnd, addFinalNewline, highlighting);
	}

	public PrinterConfig withHighlighting(boolean highlighting) {
		return new PrinterConfig(lineWidth, tabWidth, useSpaces, lineEnd, addFinalNewline, highlighting);
	}

	public int getLineWidth() {
		return lineWidth;
	}

	public int getTabWidth() {
		return tabWidth;
	}

	public boolean useSpaces() {
		return useSpaces;
	}

	public String getLineEnd() {
		return lineEnd;
	}

	public boolean addFinalNewline() {
		return addFinalNewline;
	}

	public boolean isHighlighting() {
		return highlighting;
	}
}
