package syside.options;

public enum LanguageMode {
	KERML("KerML"),
	SYSML("SysML");

	private final String languageName;

	LanguageMode(String languageName) {
		this.languageName = languageName;
	}

	public String getLanguageName() {
		return languageName;
	}
}
