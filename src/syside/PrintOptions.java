package syside;

import org.json.JSONException;
import org.json.JSONObject;
import syside.doc.PrinterConfig;
import syside.errors.InvalidFormatOptionIssue;
import syside.errors.UnknownFormatOptionIssue;
import syside.options.FormatOptionException;
import syside.options.FormatOptions;
import syside.options.LanguageMode;

/**
 * Everything a print call needs besides the element graph.
 */
public class PrintOptions {
	public static final String FORMAT = "format";
	public static final String PRINTER = "printer";

	private final LanguageMode mode;
	private final FormatOptions format;
	private final PrinterConfig config;
	private final boolean forceFormatting;

	public PrintOptions(LanguageMode mode, FormatOptions format, PrinterConfig config, boolean forceFormatting) {
		this.mode = mode;
		this.format = format;
		this.config = config;
		this.forceFormatting = forceFormatting;
	}

	public PrintOptions(LanguageMode mode) {
		this(mode, FormatOptions.defaults(), PrinterConfig.defaults(), false);
	}

	/**
	 * Reads {@code {"format": {...}, "printer": {...}}}, both parts are
	 * optional.
	 */
	public static PrintOptions fromJSON(LanguageMode mode, JSONObject json) throws FormatOptionException {
		for (String key : json.keySet()) {
			if (!key.equals(FORMAT) && !key.equals(PRINTER)) {
				throw new FormatOptionException(new UnknownFormatOptionIssue(key));
			}
		}
		FormatOptions format = json.has(FORMAT)
				? FormatOptions.fromJSON(section(json, FORMAT))
				: FormatOptions.defaults();
		PrinterConfig config = json.has(PRINTER)
				? PrinterConfig.fromJSON(section(json, PRINTER))
				: PrinterConfig.defaults();
		return new PrintOptions(mode, format, config, false);
	}

	private static JSONObject section(JSONObject json, String key) throws FormatOptionException {
		try {
			return json.getJSONObject(key);
		} catch (JSONException e) {
			throw new FormatOptionException(new InvalidFormatOptionIssue(key, e.getMessage()), e);
		}
	}

	public PrintOptions withFormat(FormatOptions format) {
		return new PrintOptions(mode, format, config, forceFormatting);
	}

	public PrintOptions withConfig(PrinterConfig config) {
		return new PrintOptions(mode, format, config, forceFormatting);
	}

	public PrintOptions withLineWidth(int lineWidth) {
		return withConfig(config.withLineWidth(lineWidth));
	}

	public PrintOptions withForceFormatting(boolean forceFormatting) {
		return new PrintOptions(mode, format, config, forceFormatting);
	}

	public LanguageMode getMode() {
		return mode;
	}

	public FormatOptions getFormat() {
		return format;
	}

	public PrinterConfig getConfig() {
		return config;
	}

	public boolean isForceFormatting() {
		return forceFormatting;
	}
}
