package syside.printer;

import org.apache.commons.io.IOUtils;
import org.json.JSONObject;
import org.junit.Test;
import syside.PrintOptions;
import syside.SysIDEFormatter;
import syside.model.DefinitionKind;
import syside.model.Namespace;
import syside.model.UsageKind;
import syside.options.FormatOptionException;
import syside.options.FormatOptions;
import syside.options.LanguageMode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertEquals;
import static syside.model.ModelBuilder.*;

public class DocumentPrintTest {

	private static String expected(String name) throws IOException {
		try (InputStream in = DocumentPrintTest.class.getResourceAsStream("/printer/" + name)) {
			return IOUtils.toString(in, StandardCharsets.UTF_8);
		}
	}

	private static Namespace vehicles() {
		return root(member(pkg("Vehicles",
				member(doc("Vehicle models.")),
				member(body(definition(DefinitionKind.PART, "Vehicle"),
						featureMember(usage(UsageKind.ATTRIBUTE, "mass", typedBy("Real"))),
						featureMember(usage(UsageKind.PART, "engine", typedBy("Engine"))))),
				member(usage(UsageKind.PART, "car", typedBy("Vehicle"))),
				member(body(usage(UsageKind.ACTION, "drive"),
						member(then()),
						member(decide(null)),
						member(then("fast")),
						member(then("slow")),
						member(succession("fast", "stop")))))));
	}

	@Test
	public void testVehicles() throws IOException, FormatOptionException {
		PrintOptions options = new PrintOptions(LanguageMode.SYSML)
				.withFormat(FormatOptions.fromJSON(new JSONObject().put("empty_namespace_brackets", "never")));
		assertEquals(expected("vehicles.sysml"), new SysIDEFormatter(options).printDocument(vehicles()));
	}

	// tabs replace each indentation level
	@Test
	public void testVehiclesWithTabs() throws IOException, FormatOptionException {
		PrintOptions options = new PrintOptions(LanguageMode.SYSML)
				.withFormat(FormatOptions.fromJSON(new JSONObject().put("empty_namespace_brackets", "never")));
		options = options.withConfig(options.getConfig().withUseSpaces(false));
		String printed = new SysIDEFormatter(options).printDocument(vehicles());
		assertEquals(expected("vehicles.sysml").replace("    ", "\t"), printed);
	}
}
