package syside.printer;

import org.json.JSONObject;
import org.junit.Test;
import syside.PrintOptions;
import syside.SysIDEFormatter;
import syside.model.Element;
import syside.model.UsageKind;
import syside.model.Visibility;
import syside.options.FormatOptionException;
import syside.options.FormatOptions;
import syside.options.LanguageMode;

import static org.junit.Assert.assertEquals;
import static syside.model.ModelBuilder.*;

public class NamespacePrinterTest {

	private static String print(LanguageMode mode, Element element, int width, JSONObject format)
			throws FormatOptionException {
		PrintOptions options = new PrintOptions(mode)
				.withFormat(FormatOptions.fromJSON(format))
				.withLineWidth(width);
		return new SysIDEFormatter(options).printElement(element);
	}

	private static JSONObject keywordSpecialization() {
		return new JSONObject().put("declaration_specialization", "keyword");
	}

	// synthesized specializations use the token form
	@Test
	public void testSpecializationToken() throws FormatOptionException {
		assertEquals("type a :> b unions c {}",
				print(LanguageMode.KERML, type("a", specializes("b"), unions("c")), 40, new JSONObject()));
	}

	@Test
	public void testSpecializationKeywordFits() throws FormatOptionException {
		assertEquals("type a specializes b unions c {}",
				print(LanguageMode.KERML, type("a", specializes("b"), unions("c")), 40, keywordSpecialization()));
	}

	// the relationship part moves to the next line as a whole first
	@Test
	public void testSpecializationKeywordBreaksOnce() throws FormatOptionException {
		assertEquals("type a\n    specializes b unions c {}",
				print(LanguageMode.KERML, type("a", specializes("b"), unions("c")), 30, keywordSpecialization()));
	}

	@Test
	public void testSpecializationKeywordBreaksEach() throws FormatOptionException {
		assertEquals("type a\n    specializes b\n    unions c {}",
				print(LanguageMode.KERML, type("a", specializes("b"), unions("c")), 20, keywordSpecialization()));
	}

	@Test
	public void testEmptyBodySemicolon() throws FormatOptionException {
		JSONObject format = new JSONObject().put("empty_namespace_brackets", "never");
		assertEquals("type a;", print(LanguageMode.KERML, type("a"), 80, format));
	}

	// a feature value whose body expression does not fit breaks after the assignment
	@Test
	public void testFeatureValueWithBody() throws FormatOptionException {
		JSONObject format = new JSONObject()
				.put("feature_keyword", "always")
				.put("empty_namespace_brackets", "never");
		Element element = initialValue(feature("a"),
				arrow(fref("a"), "select", lambda(bool(true), featureMember(in("x")))));

		assertEquals("feature a := a->select { in x; true };", print(LanguageMode.KERML, element, 40, format));
		assertEquals("feature a :=\n" +
				"    a->select {\n" +
				"        in x;\n" +
				"        true\n" +
				"    };", print(LanguageMode.KERML, element, 25, format));
	}

	@Test
	public void testPackageMembers() throws FormatOptionException {
		Element element = pkg("P",
				member(type("A")),
				membership(Visibility.PRIVATE, type("B")));
		assertEquals("package P {\n    type A {}\n    private type B {}\n}",
				print(LanguageMode.KERML, element, 80, new JSONObject()));
	}

	@Test
	public void testPartUsage() throws FormatOptionException {
		Element element = usage(UsageKind.PART, "engine", typedBy("Engine"));
		JSONObject format = new JSONObject().put("empty_namespace_brackets", "never");
		assertEquals("part engine : Engine;", print(LanguageMode.SYSML, element, 80, format));
	}
}
