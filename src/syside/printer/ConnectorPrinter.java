package syside.printer;

import syside.doc.Doc;
import syside.errors.MissingMemberIssue;
import syside.model.Connector;
import syside.model.ConnectorEnd;
import syside.model.Element;
import syside.options.DeclarationFormat;
import syside.options.FormatOptions;
import syside.options.KeywordFormat;
import syside.options.PreservableFormatting;
import syside.options.Presence;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static syside.doc.DocBuilder.*;

/**
 * Prints connectors, bindings, successions and flows together with their ends.
 *
 * Binary connectors print as {@code source-keyword a binding b}, every other
 * connector lists its ends in parentheses.
 */
public class ConnectorPrinter {
	private final ModelPrinter printer;
	private final PrintContext ctx;

	public ConnectorPrinter(ModelPrinter printer) {
		this.printer = printer;
		this.ctx = printer.getContext();
	}

	/**
	 * How the ends of a connector are laid out.
	 */
	static class EndsOptions {
		/**
		 * null to choose by {@link #binaryOption}
		 */
		Boolean binary;
		PreservableFormatting<Presence> binaryOption;
		String sourceKeyword;
		/**
		 * null to always print the source keyword
		 */
		PreservableFormatting<KeywordFormat> sourceFormat;
		Doc binding;
		Doc naryPrefix;
		Consumer<List<Doc>> suffix;
		List<ConnectorEnd> ends;
		boolean endReferencesOnly;

		EndsOptions binary(boolean binary) {
			this.binary = binary;
			return this;
		}

		EndsOptions binary(PreservableFormatting<Presence> option) {
			this.binaryOption = option;
			return this;
		}

		EndsOptions source(String keyword, PreservableFormatting<KeywordFormat> format) {
			this.sourceKeyword = keyword;
			this.sourceFormat = format;
			return this;
		}

		EndsOptions binding(Doc binding) {
			this.binding = binding;
			return this;
		}

		EndsOptions naryPrefix(Doc naryPrefix) {
			this.naryPrefix = naryPrefix;
			return this;
		}

		EndsOptions suffix(Consumer<List<Doc>> suffix) {
			this.suffix = suffix;
			return this;
		}

		EndsOptions endReferencesOnly() {
			this.endReferencesOnly = true;
			return this;
		}
	}

	public Doc printConnector(Connector node) {
		FormatOptions format = ctx.getFormat();
		switch (node.getConnectorKind()) {
			case CONNECTOR:
				return printKerMLConnector("connector", node, new EndsOptions()
						.binary(format.binaryConnectors)
						.binding(text("to"))
						.source("from", format.binaryConnectorsFromKeyword)
						.suffix(valueSuffix(node)));
			case BINDING:
				return printKerMLConnector("binding", node, new EndsOptions()
						.binary(format.binaryBindingConnectors)
						.binding(text("="))
						.source("of", format.binaryBindingConnectorOfKeyword));
			case SUCCESSION:
				return printKerMLConnector("succession", node, new EndsOptions()
						.binary(format.binarySuccessions)
						.binding(text("then"))
						.source("first", format.binarySuccessionFirstKeyword));
			case ITEM_FLOW:
				return printKerMLConnector("flow", node, flowOptions(node, format.itemFlowFromKeyword));
			case SUCCESSION_ITEM_FLOW:
				return printKerMLConnector("succession flow", node,
						flowOptions(node, format.successionItemFlowFromKeyword));
			case CONNECTION:
				return printConnectorAsUsage(
						ActionPrinter.selectDeclarationKeyword(node, "connection", format.connectionUsageKeyword),
						node, new EndsOptions()
								.binary(format.binaryConnectionUsages)
								.binding(keyword("to"))
								.naryPrefix(keyword("connect"))
								.source("connect", null)
								.suffix(valueSuffix(node)),
						format.connectionUsageReferenceKeyword);
			case BINDING_AS_USAGE:
				return printConnectorAsUsage(
						ActionPrinter.selectDeclarationKeyword(node, "binding", format.bindingConnectorAsUsageKeyword),
						node, new EndsOptions()
								.binary(true)
								.binding(text("="))
								.source("bind", null),
						format.connectorAsUsageReferenceKeyword);
			case SUCCESSION_AS_USAGE:
				return printSuccessionAsUsage(node);
			case ALLOCATION:
				return printConnectorAsUsage(
						ActionPrinter.selectDeclarationKeyword(node, "allocation", format.allocationUsageKeyword),
						node, new EndsOptions()
								.binary(format.binaryAllocationUsages)
								.binding(keyword("to"))
								.naryPrefix(keyword("allocate"))
								.source("allocate", null),
						format.connectorAsUsageReferenceKeyword);
			case INTERFACE: {
				String connect = ActionPrinter.selectDeclarationKeyword(node, "connect",
						format.interfaceUsageConnectKeyword);
				return printConnectorAsUsage("interface", node, new EndsOptions()
								.binary(format.binaryInterfaceUsages)
								.binding(keyword("to"))
								.naryPrefix(connect != null ? keyword(connect) : null)
								.source("connect", format.interfaceUsageConnectKeyword),
						format.connectorAsUsageReferenceKeyword);
			}
			case FLOW_CONNECTION:
				return printFlowConnection("flow", node, flowOptions(node, format.flowConnectionUsageFromKeyword));
			case SUCCESSION_FLOW_CONNECTION:
				return printFlowConnection("succession flow", node,
						flowOptions(node, format.successionFlowConnectionUsageFromKeyword));
			case MESSAGE:
				return printFlowConnection("message", node,
						flowOptions(node, format.flowConnectionUsageFromKeyword).endReferencesOnly());
			default:
				throw new syside.Unreachable();
		}
	}

	/**
	 * Prints a succession usage in its regular {@code first a then b} form.
	 */
	public Doc printSuccessionAsUsage(Connector node) {
		return printConnectorAsUsage(
				ActionPrinter.selectDeclarationKeyword(node, "succession", ctx.getFormat().successionAsUsageKeyword),
				node, new EndsOptions()
						.binary(true)
						.binding(keyword("then"))
						.source("first", null),
				ctx.getFormat().connectorAsUsageReferenceKeyword);
	}

	private Consumer<List<Doc>> valueSuffix(Connector node) {
		return node.getValue() != null ? printer.namespaces().featureValueAppender(node) : null;
	}

	private EndsOptions flowOptions(Connector node, PreservableFormatting<KeywordFormat> sourceFormat) {
		List<Doc> suffix = new ArrayList<>();
		if (node.getValue() != null) {
			suffix.add(group(indent(SPACE, printer.print(node.getValue()))));
		}
		if (node.getItem() != null) {
			suffix.add(group(indent(LINE, keyword("of "), printer.print(node.getItem()))));
		}
		EndsOptions options = new EndsOptions()
				.binary(true)
				.binding(keyword("to"))
				.source("from", sourceFormat);
		if (!suffix.isEmpty()) {
			options.suffix(declaration -> declaration.addAll(suffix));
		}
		return options;
	}

	private Doc printKerMLConnector(String kw, Connector node, EndsOptions ends) {
		DeclarationOptions options = new DeclarationOptions();
		return printGenericConnector(node, ends, options,
				() -> printer.namespaces().printKerMLFeature(node, kw, options));
	}

	Doc printConnectorAsUsage(String kw, Connector node, EndsOptions ends,
	                          PreservableFormatting<Presence> referenceKeyword) {
		DeclarationOptions options = new DeclarationOptions().join(new ActionBodyJoiner());
		boolean ignoreRef = printer.usages().shouldIgnoreRef(node, referenceKeyword);
		return printGenericConnector(node, ends, options,
				() -> printer.usages().printGenericUsage(null, kw, node, options, ignoreRef));
	}

	private Doc printFlowConnection(String kw, Connector node, EndsOptions ends) {
		DeclarationOptions options = new DeclarationOptions().join(new ActionBodyJoiner());
		boolean ignoreRef = printer.usages().shouldIgnoreRef(node, ctx.getFormat().connectionUsageReferenceKeyword);
		return printGenericConnector(node, ends, options,
				() -> printer.usages().printGenericOccurrenceUsage(null, kw, node, options, ignoreRef));
	}

	private interface FeaturePrinter {
		Doc print();
	}

	private Doc printGenericConnector(Connector node, EndsOptions ends, DeclarationOptions options,
	                                  FeaturePrinter feature) {
		List<ConnectorEnd> connectorEnds = endsOf(node, ends);
		Consumer<List<Doc>> suffix = ends.suffix != null ? ends.suffix : declaration -> {};

		if (connectorEnds.isEmpty()) {
			options.appendToDeclaration(suffix);
			return feature.print();
		}
		if (connectorEnds.size() == 1) {
			throw new MissingMemberIssue(node, "second connector end");
		}

		boolean binary;
		if (connectorEnds.size() > 2) {
			binary = false;
		} else if (ends.binary != null) {
			binary = ends.binary;
		} else {
			binary = FormatPreservation.resolve(node, ends.binaryOption, cst -> cst.findKeyword("("),
					token -> token != null ? Presence.NEVER : Presence.ALWAYS) == Presence.ALWAYS;
		}

		if (binary) {
			options.appendToDeclaration(declaration -> {
				suffix.accept(declaration);
				if (!declaration.isEmpty()) {
					declaration.add(indent(LINE));
				}
				declaration.add(indent(printBinaryEnds(node, connectorEnds, ends)));
			});
		} else {
			options.appendToDeclaration(declaration -> {
				suffix.accept(declaration);
				String id = ctx.groupId("nary-ends");
				Doc linebreak = indent(group(LINE, id));
				if (!declaration.isEmpty()) {
					declaration.add(ends.naryPrefix != null ? SPACE : linebreak);
				}
				if (ends.naryPrefix != null) {
					declaration.add(ends.naryPrefix);
					declaration.add(linebreak);
				}
				declaration.add(indentIfBreak(printNaryEnds(connectorEnds, ends), id));
			});
		}
		return feature.print();
	}

	private List<Doc> printEnds(List<ConnectorEnd> ends, boolean referencesOnly) {
		if (referencesOnly) {
			return printer.printAll(ends, null, (end, previous) -> printEndReference(end));
		}
		return printer.printAll(ends, null);
	}

	private static List<ConnectorEnd> endsOf(Connector node, EndsOptions options) {
		return options.ends != null ? options.ends : node.getEnds();
	}

	private Doc printBinaryEnds(Connector node, List<ConnectorEnd> connectorEnds, EndsOptions options) {
		List<Doc> ends = printEnds(connectorEnds, options.endReferencesOnly);

		List<Doc> source = new ArrayList<>();
		String kw = options.sourceKeyword;
		boolean printSource = options.sourceFormat == null || FormatPreservation.resolveKeyword(node,
				options.sourceFormat, kw, KeywordFormat.ALWAYS, KeywordFormat.AS_NEEDED) == KeywordFormat.ALWAYS ||
				ActionPrinter.hasFeatureDeclaration(node);
		if (printSource) {
			source.add(keyword(kw));
			source.add(SPACE);
		}
		source.add(indent(ends.get(0)));

		return group(concat(
				group(concat(source)),
				group(concat(LINE, options.binding, SPACE, indent(ends.get(1))))));
	}

	private Doc printNaryEnds(List<ConnectorEnd> connectorEnds, EndsOptions options) {
		return group(concat(
				text("("),
				indent(SOFTLINE, join(concat(COMMA, LINE), printEnds(connectorEnds, options.endReferencesOnly))),
				SOFTLINE,
				text(")")));
	}

	private Doc printEndReference(ConnectorEnd node) {
		Element reference = ModelPrinter.required(node, node.getReference(), "reference");
		return printer.print(reference);
	}

	/**
	 * Prints {@code [multiplicity] [name references] target}.
	 */
	public Doc printConnectorEnd(ConnectorEnd node) {
		Doc target = printEndReference(node);

		List<Doc> parts = new ArrayList<>();
		if (node.getMultiplicity() != null) {
			parts.add(printer.namespaces().printMultiplicityPart(null, node.getMultiplicity()));
			parts.add(SPACE);
		}

		List<Doc> heritage = new ArrayList<>();
		if (node.getDeclaredName() != null) {
			parts.addAll(Identifiers.printIdentifiers(node, ctx));
			DeclarationFormat format = FormatPreservation.resolve(node, ctx.getFormat().declarationReferenceSubsetting,
					cst -> cst.findKeyword("::>"),
					token -> token != null ? DeclarationFormat.TOKEN : DeclarationFormat.KEYWORD);
			heritage.add(LINE);
			heritage.add(format == DeclarationFormat.TOKEN ? text("::> ") : keyword("references "));
		}
		heritage.add(target);

		parts.add(indent(group(concat(heritage))));
		return concat(parts);
	}
}
