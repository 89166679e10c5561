package syside.options;

import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;
import syside.errors.InvalidFormatOptionIssue;
import syside.errors.UnknownFormatOptionIssue;
import syside.errors.WhileLoadingOptions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Style options controlling how elements are printed. Each option can be set
 * from a JSON object under its snake_case key.
 */
public class FormatOptions {

	public PreservableFormatting<NullExpressionFormat> nullExpression = PreservableFormatting.preserve(NullExpressionFormat.NULL);

	public LiteralRealFormat literalReal = LiteralRealFormat.NONE;

	public boolean stripUnnecessaryQuotes = true;

	public boolean sequenceExpressionTrailingComma = true;

	public OperatorBreak operatorBreak = OperatorBreak.AFTER;

	public boolean bracketSpacing = true;

	public PreservableFormatting<KeywordFormat> commentKeyword = PreservableFormatting.preserve(KeywordFormat.AS_NEEDED);

	public KeywordFormat commentAboutBreak = KeywordFormat.AS_NEEDED;

	public boolean markdownComments = true;

	public PreservableFormatting<KeywordFormat> textualRepresentationKeyword = PreservableFormatting.preserve(KeywordFormat.AS_NEEDED);

	public KeywordFormat textualRepresentationLanguageBreak = KeywordFormat.ALWAYS;

	public PreservableFormatting<Presence> emptyNamespaceBrackets = PreservableFormatting.preserve(Presence.ALWAYS);

	public boolean mergeDeclarationDisjoining = false;

	public boolean mergeUnioning = false;

	public boolean mergeIntersecting = false;

	public boolean mergeDifferencing = false;

	public boolean mergeFeatureChaining = false;

	public boolean mergeDeclarationTypeFeaturing = false;

	public PreservableFormatting<DeclarationFormat> declarationSpecialization = PreservableFormatting.preserve(DeclarationFormat.TOKEN);

	public PreservableFormatting<DeclarationFormat> declarationConjugation = PreservableFormatting.preserve(DeclarationFormat.TOKEN);

	public PreservableFormatting<DeclarationFormat> declarationSubsetting = PreservableFormatting.preserve(DeclarationFormat.TOKEN);

	public PreservableFormatting<DeclarationFormat> declarationSubclassification = PreservableFormatting.preserve(DeclarationFormat.TOKEN);

	public PreservableFormatting<DeclarationFormat> declarationRedefinition = PreservableFormatting.preserve(DeclarationFormat.TOKEN);

	public PreservableFormatting<DeclarationFormat> declarationReferenceSubsetting = PreservableFormatting.preserve(DeclarationFormat.TOKEN);

	public PreservableFormatting<DeclarationFormat> declarationFeatureTyping = PreservableFormatting.preserve(DeclarationFormat.TOKEN);

	public PreservableFormatting<DeclarationFormat> declarationConjugatedPortTyping = PreservableFormatting.preserve(DeclarationFormat.TOKEN);

	public PreservableFormatting<KeywordFormat> featureValueEquals = PreservableFormatting.preserve(KeywordFormat.AS_NEEDED);

	public PreservableFormatting<KeywordFormat> featureKeyword = PreservableFormatting.preserve(KeywordFormat.AS_NEEDED);

	public PreservableFormatting<Presence> publicKeyword = PreservableFormatting.preserve(Presence.NEVER);

	public PreservableFormatting<KeywordFormat> specializationKeywordSpecialization = PreservableFormatting.preserve(KeywordFormat.AS_NEEDED);

	public PreservableFormatting<KeywordFormat> specializationKeywordSubclassification = PreservableFormatting.preserve(KeywordFormat.AS_NEEDED);

	public PreservableFormatting<KeywordFormat> specializationKeywordFeatureTyping = PreservableFormatting.preserve(KeywordFormat.AS_NEEDED);

	public PreservableFormatting<KeywordFormat> specializationKeywordSubsetting = PreservableFormatting.preserve(KeywordFormat.AS_NEEDED);

	public PreservableFormatting<KeywordFormat> specializationKeywordRedefinition = PreservableFormatting.preserve(KeywordFormat.AS_NEEDED);

	public PreservableFormatting<KeywordFormat> conjugationKeyword = PreservableFormatting.preserve(KeywordFormat.AS_NEEDED);

	public PreservableFormatting<KeywordFormat> disjoiningKeyword = PreservableFormatting.preserve(KeywordFormat.AS_NEEDED);

	public PreservableFormatting<KeywordFormat> invertingKeyword = PreservableFormatting.preserve(KeywordFormat.AS_NEEDED);

	public PreservableFormatting<KeywordFormat> featuringOfKeyword = PreservableFormatting.preserve(KeywordFormat.AS_NEEDED);

	public PreservableFormatting<KeywordFormat> dependencyFromKeyword = PreservableFormatting.fixed(KeywordFormat.ALWAYS);

	public PreservableFormatting<Presence> invariantTrueKeyword = PreservableFormatting.preserve(Presence.ALWAYS);

	public MultiplicityPlacement multiplicityPlacement = MultiplicityPlacement.FIRST_SPECIALIZATION;

	public PreservableFormatting<MetadataKeyword> metadataFeatureKeyword = PreservableFormatting.preserve(MetadataKeyword.AT);

	public PreservableFormatting<Presence> metadataBodyFeatureKeyword = PreservableFormatting.preserve(Presence.NEVER);

	public PreservableFormatting<RedefinesFormat> metadataBodyFeatureRedefines = PreservableFormatting.preserve(RedefinesFormat.NONE);

	public PreservableFormatting<Presence> binaryAllocationUsages = PreservableFormatting.preserve(Presence.ALWAYS);

	public PreservableFormatting<Presence> binaryConnectors = PreservableFormatting.preserve(Presence.ALWAYS);

	public PreservableFormatting<KeywordFormat> binaryConnectorsFromKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<Presence> binaryBindingConnectors = PreservableFormatting.preserve(Presence.ALWAYS);

	public PreservableFormatting<KeywordFormat> binaryBindingConnectorOfKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<Presence> binarySuccessions = PreservableFormatting.preserve(Presence.ALWAYS);

	public PreservableFormatting<KeywordFormat> binarySuccessionFirstKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<KeywordFormat> itemFlowFromKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<KeywordFormat> successionItemFlowFromKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<KeywordFormat> flowConnectionUsageFromKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<KeywordFormat> successionFlowConnectionUsageFromKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<OrderedNonuniquePriority> orderedNonuniquePriority = PreservableFormatting.preserve(OrderedNonuniquePriority.ORDERED);

	public PreservableFormatting<Presence> enumMemberKeyword = PreservableFormatting.preserve(Presence.NEVER);

	public PreservableFormatting<KeywordFormat> occurrenceKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<KeywordFormat> bindingConnectorAsUsageKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<KeywordFormat> successionAsUsageKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<KeywordFormat> assertConstraintUsageKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<KeywordFormat> eventOccurrenceKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<KeywordFormat> exhibitStateUsageKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<KeywordFormat> includeUseCaseUsageKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<KeywordFormat> performActionUsageKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<KeywordFormat> satisfyRequirementKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<Presence> satisfyRequirementAssertKeyword = PreservableFormatting.preserve(Presence.ALWAYS);

	public PreservableFormatting<KeywordFormat> allocationUsageKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<KeywordFormat> connectionUsageKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<Presence> binaryConnectionUsages = PreservableFormatting.preserve(Presence.ALWAYS);

	public PreservableFormatting<Presence> binaryInterfaceUsages = PreservableFormatting.preserve(Presence.ALWAYS);

	public PreservableFormatting<KeywordFormat> interfaceUsageConnectKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<KeywordFormat> actionNodeKeyword = PreservableFormatting.preserve(KeywordFormat.AS_NEEDED);

	public Parenthesize whileLoopParenthesizeCondition = Parenthesize.ON_BREAK;

	public Parenthesize whileLoopParenthesizeUntil = Parenthesize.ON_BREAK;

	public Parenthesize ifParenthesizeCondition = Parenthesize.ON_BREAK;

	public Parenthesize transitionUsageParenthesizeGuard = Parenthesize.ON_BREAK;

	public Parenthesize elementFilterParenthesize = Parenthesize.ON_BREAK;

	public PreservableFormatting<KeywordFormat> transitionUsageKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<KeywordFormat> transitionUsageFirstKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<KeywordFormat> framedConcernKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<KeywordFormat> referenceUsageKeyword = PreservableFormatting.preserve(KeywordFormat.ALWAYS);

	public PreservableFormatting<Presence> attributeUsageReferenceKeyword = PreservableFormatting.preserve(Presence.NEVER);

	public PreservableFormatting<Presence> eventOccurrenceReferenceKeyword = PreservableFormatting.preserve(Presence.NEVER);

	public PreservableFormatting<Presence> portUsageReferenceKeyword = PreservableFormatting.preserve(Presence.NEVER);

	public PreservableFormatting<Presence> connectionUsageReferenceKeyword = PreservableFormatting.preserve(Presence.NEVER);

	public PreservableFormatting<Presence> connectorAsUsageReferenceKeyword = PreservableFormatting.preserve(Presence.NEVER);

	public PreservableFormatting<Presence> exhibitStateReferenceKeyword = PreservableFormatting.preserve(Presence.NEVER);

	public PreservableFormatting<Presence> includeUseCaseReferenceKeyword = PreservableFormatting.preserve(Presence.NEVER);

	public PreservableFormatting<Presence> performActionReferenceKeyword = PreservableFormatting.preserve(Presence.NEVER);

	@FunctionalInterface
	private interface ValueReader<V> {
		V read(String key, Object value, V current) throws FormatOptionException;
	}

	private static final class Option<V> {
		private final Function<FormatOptions, V> getter;
		private final BiConsumer<FormatOptions, V> setter;
		private final ValueReader<V> reader;

		Option(Function<FormatOptions, V> getter, BiConsumer<FormatOptions, V> setter, ValueReader<V> reader) {
			this.getter = getter;
			this.setter = setter;
			this.reader = reader;
		}

		V get(FormatOptions options) {
			return getter.apply(options);
		}

		void update(FormatOptions options, String key, Object value) throws FormatOptionException {
			setter.accept(options, reader.read(key, value, getter.apply(options)));
		}

		// option values are immutable, sharing them is fine
		void copy(FormatOptions from, FormatOptions to) {
			setter.accept(to, getter.apply(from));
		}
	}

	private static final Map<String, Option<?>> OPTIONS = new LinkedHashMap<>();

	private static void flag(String key, Function<FormatOptions, Boolean> getter,
	                         BiConsumer<FormatOptions, Boolean> setter) {
		OPTIONS.put(key, new Option<>(getter, setter, (k, value, current) -> readBoolean(k, value)));
	}

	private static <T extends Enum<T> & OptionValue> void choice(String key, Class<T> type,
	                                                             Function<FormatOptions, T> getter,
	                                                             BiConsumer<FormatOptions, T> setter) {
		OPTIONS.put(key, new Option<>(getter, setter, (k, value, current) -> readAlternative(k, type, value)));
	}

	private static <T extends Enum<T> & OptionValue> void preservable(String key, Class<T> type,
	                                                                  Function<FormatOptions, PreservableFormatting<T>> getter,
	                                                                  BiConsumer<FormatOptions, PreservableFormatting<T>> setter) {
		OPTIONS.put(key, new Option<>(getter, setter, (k, value, current) -> readPreservable(k, type, value, current)));
	}

	static {
		preservable("null_expression", NullExpressionFormat.class, o -> o.nullExpression, (o, v) -> o.nullExpression = v);
		choice("literal_real", LiteralRealFormat.class, o -> o.literalReal, (o, v) -> o.literalReal = v);
		flag("strip_unnecessary_quotes", o -> o.stripUnnecessaryQuotes, (o, v) -> o.stripUnnecessaryQuotes = v);
		flag("sequence_expression_trailing_comma", o -> o.sequenceExpressionTrailingComma, (o, v) -> o.sequenceExpressionTrailingComma = v);
		choice("operator_break", OperatorBreak.class, o -> o.operatorBreak, (o, v) -> o.operatorBreak = v);
		flag("bracket_spacing", o -> o.bracketSpacing, (o, v) -> o.bracketSpacing = v);
		preservable("comment_keyword", KeywordFormat.class, o -> o.commentKeyword, (o, v) -> o.commentKeyword = v);
		choice("comment_about_break", KeywordFormat.class, o -> o.commentAboutBreak, (o, v) -> o.commentAboutBreak = v);
		flag("markdown_comments", o -> o.markdownComments, (o, v) -> o.markdownComments = v);
		preservable("textual_representation_keyword", KeywordFormat.class, o -> o.textualRepresentationKeyword, (o, v) -> o.textualRepresentationKeyword = v);
		choice("textual_representation_language_break", KeywordFormat.class, o -> o.textualRepresentationLanguageBreak, (o, v) -> o.textualRepresentationLanguageBreak = v);
		preservable("empty_namespace_brackets", Presence.class, o -> o.emptyNamespaceBrackets, (o, v) -> o.emptyNamespaceBrackets = v);
		flag("merge_declaration_disjoining", o -> o.mergeDeclarationDisjoining, (o, v) -> o.mergeDeclarationDisjoining = v);
		flag("merge_unioning", o -> o.mergeUnioning, (o, v) -> o.mergeUnioning = v);
		flag("merge_intersecting", o -> o.mergeIntersecting, (o, v) -> o.mergeIntersecting = v);
		flag("merge_differencing", o -> o.mergeDifferencing, (o, v) -> o.mergeDifferencing = v);
		flag("merge_feature_chaining", o -> o.mergeFeatureChaining, (o, v) -> o.mergeFeatureChaining = v);
		flag("merge_declaration_type_featuring", o -> o.mergeDeclarationTypeFeaturing, (o, v) -> o.mergeDeclarationTypeFeaturing = v);
		preservable("declaration_specialization", DeclarationFormat.class, o -> o.declarationSpecialization, (o, v) -> o.declarationSpecialization = v);
		preservable("declaration_conjugation", DeclarationFormat.class, o -> o.declarationConjugation, (o, v) -> o.declarationConjugation = v);
		preservable("declaration_subsetting", DeclarationFormat.class, o -> o.declarationSubsetting, (o, v) -> o.declarationSubsetting = v);
		preservable("declaration_subclassification", DeclarationFormat.class, o -> o.declarationSubclassification, (o, v) -> o.declarationSubclassification = v);
		preservable("declaration_redefinition", DeclarationFormat.class, o -> o.declarationRedefinition, (o, v) -> o.declarationRedefinition = v);
		preservable("declaration_reference_subsetting", DeclarationFormat.class, o -> o.declarationReferenceSubsetting, (o, v) -> o.declarationReferenceSubsetting = v);
		preservable("declaration_feature_typing", DeclarationFormat.class, o -> o.declarationFeatureTyping, (o, v) -> o.declarationFeatureTyping = v);
		preservable("declaration_conjugated_port_typing", DeclarationFormat.class, o -> o.declarationConjugatedPortTyping, (o, v) -> o.declarationConjugatedPortTyping = v);
		preservable("feature_value_equals", KeywordFormat.class, o -> o.featureValueEquals, (o, v) -> o.featureValueEquals = v);
		preservable("feature_keyword", KeywordFormat.class, o -> o.featureKeyword, (o, v) -> o.featureKeyword = v);
		preservable("public_keyword", Presence.class, o -> o.publicKeyword, (o, v) -> o.publicKeyword = v);
		preservable("specialization_keyword_specialization", KeywordFormat.class, o -> o.specializationKeywordSpecialization, (o, v) -> o.specializationKeywordSpecialization = v);
		preservable("specialization_keyword_subclassification", KeywordFormat.class, o -> o.specializationKeywordSubclassification, (o, v) -> o.specializationKeywordSubclassification = v);
		preservable("specialization_keyword_feature_typing", KeywordFormat.class, o -> o.specializationKeywordFeatureTyping, (o, v) -> o.specializationKeywordFeatureTyping = v);
		preservable("specialization_keyword_subsetting", KeywordFormat.class, o -> o.specializationKeywordSubsetting, (o, v) -> o.specializationKeywordSubsetting = v);
		preservable("specialization_keyword_redefinition", KeywordFormat.class, o -> o.specializationKeywordRedefinition, (o, v) -> o.specializationKeywordRedefinition = v);
		preservable("conjugation_keyword", KeywordFormat.class, o -> o.conjugationKeyword, (o, v) -> o.conjugationKeyword = v);
		preservable("disjoining_keyword", KeywordFormat.class, o -> o.disjoiningKeyword, (o, v) -> o.disjoiningKeyword = v);
		preservable("inverting_keyword", KeywordFormat.class, o -> o.invertingKeyword, (o, v) -> o.invertingKeyword = v);
		preservable("featuring_of_keyword", KeywordFormat.class, o -> o.featuringOfKeyword, (o, v) -> o.featuringOfKeyword = v);
		preservable("dependency_from_keyword", KeywordFormat.class, o -> o.dependencyFromKeyword, (o, v) -> o.dependencyFromKeyword = v);
		preservable("invariant_true_keyword", Presence.class, o -> o.invariantTrueKeyword, (o, v) -> o.invariantTrueKeyword = v);
		choice("multiplicity_placement", MultiplicityPlacement.class, o -> o.multiplicityPlacement, (o, v) -> o.multiplicityPlacement = v);
		preservable("metadata_feature_keyword", MetadataKeyword.class, o -> o.metadataFeatureKeyword, (o, v) -> o.metadataFeatureKeyword = v);
		preservable("metadata_body_feature_keyword", Presence.class, o -> o.metadataBodyFeatureKeyword, (o, v) -> o.metadataBodyFeatureKeyword = v);
		preservable("metadata_body_feature_redefines", RedefinesFormat.class, o -> o.metadataBodyFeatureRedefines, (o, v) -> o.metadataBodyFeatureRedefines = v);
		preservable("binary_allocation_usages", Presence.class, o -> o.binaryAllocationUsages, (o, v) -> o.binaryAllocationUsages = v);
		preservable("binary_connectors", Presence.class, o -> o.binaryConnectors, (o, v) -> o.binaryConnectors = v);
		preservable("binary_connectors_from_keyword", KeywordFormat.class, o -> o.binaryConnectorsFromKeyword, (o, v) -> o.binaryConnectorsFromKeyword = v);
		preservable("binary_binding_connectors", Presence.class, o -> o.binaryBindingConnectors, (o, v) -> o.binaryBindingConnectors = v);
		preservable("binary_binding_connector_of_keyword", KeywordFormat.class, o -> o.binaryBindingConnectorOfKeyword, (o, v) -> o.binaryBindingConnectorOfKeyword = v);
		preservable("binary_successions", Presence.class, o -> o.binarySuccessions, (o, v) -> o.binarySuccessions = v);
		preservable("binary_succession_first_keyword", KeywordFormat.class, o -> o.binarySuccessionFirstKeyword, (o, v) -> o.binarySuccessionFirstKeyword = v);
		preservable("item_flow_from_keyword", KeywordFormat.class, o -> o.itemFlowFromKeyword, (o, v) -> o.itemFlowFromKeyword = v);
		preservable("succession_item_flow_from_keyword", KeywordFormat.class, o -> o.successionItemFlowFromKeyword, (o, v) -> o.successionItemFlowFromKeyword = v);
		preservable("flow_connection_usage_from_keyword", KeywordFormat.class, o -> o.flowConnectionUsageFromKeyword, (o, v) -> o.flowConnectionUsageFromKeyword = v);
		preservable("succession_flow_connection_usage_from_keyword", KeywordFormat.class, o -> o.successionFlowConnectionUsageFromKeyword, (o, v) -> o.successionFlowConnectionUsageFromKeyword = v);
		preservable("ordered_nonunique_priority", OrderedNonuniquePriority.class, o -> o.orderedNonuniquePriority, (o, v) -> o.orderedNonuniquePriority = v);
		preservable("enum_member_keyword", Presence.class, o -> o.enumMemberKeyword, (o, v) -> o.enumMemberKeyword = v);
		preservable("occurrence_keyword", KeywordFormat.class, o -> o.occurrenceKeyword, (o, v) -> o.occurrenceKeyword = v);
		preservable("binding_connector_as_usage_keyword", KeywordFormat.class, o -> o.bindingConnectorAsUsageKeyword, (o, v) -> o.bindingConnectorAsUsageKeyword = v);
		preservable("succession_as_usage_keyword", KeywordFormat.class, o -> o.successionAsUsageKeyword, (o, v) -> o.successionAsUsageKeyword = v);
		preservable("assert_constraint_usage_keyword", KeywordFormat.class, o -> o.assertConstraintUsageKeyword, (o, v) -> o.assertConstraintUsageKeyword = v);
		preservable("event_occurrence_keyword", KeywordFormat.class, o -> o.eventOccurrenceKeyword, (o, v) -> o.eventOccurrenceKeyword = v);
		preservable("exhibit_state_usage_keyword", KeywordFormat.class, o -> o.exhibitStateUsageKeyword, (o, v) -> o.exhibitStateUsageKeyword = v);
		preservable("include_use_case_usage_keyword", KeywordFormat.class, o -> o.includeUseCaseUsageKeyword, (o, v) -> o.includeUseCaseUsageKeyword = v);
		preservable("perform_action_usage_keyword", KeywordFormat.class, o -> o.performActionUsageKeyword, (o, v) -> o.performActionUsageKeyword = v);
		preservable("satisfy_requirement_keyword", KeywordFormat.class, o -> o.satisfyRequirementKeyword, (o, v) -> o.satisfyRequirementKeyword = v);
		preservable("satisfy_requirement_assert_keyword", Presence.class, o -> o.satisfyRequirementAssertKeyword, (o, v) -> o.satisfyRequirementAssertKeyword = v);
		preservable("allocation_usage_keyword", KeywordFormat.class, o -> o.allocationUsageKeyword, (o, v) -> o.allocationUsageKeyword = v);
		preservable("connection_usage_keyword", KeywordFormat.class, o -> o.connectionUsageKeyword, (o, v) -> o.connectionUsageKeyword = v);
		preservable("binary_connection_usages", Presence.class, o -> o.binaryConnectionUsages, (o, v) -> o.binaryConnectionUsages = v);
		preservable("binary_interface_usages", Presence.class, o -> o.binaryInterfaceUsages, (o, v) -> o.binaryInterfaceUsages = v);
		preservable("interface_usage_connect_keyword", KeywordFormat.class, o -> o.interfaceUsageConnectKeyword, (o, v) -> o.interfaceUsageConnectKeyword = v);
		preservable("action_node_keyword", KeywordFormat.class, o -> o.actionNodeKeyword, (o, v) -> o.actionNodeKeyword = v);
		choice("while_loop_parenthesize_condition", Parenthesize.class, o -> o.whileLoopParenthesizeCondition, (o, v) -> o.whileLoopParenthesizeCondition = v);
		choice("while_loop_parenthesize_until", Parenthesize.class, o -> o.whileLoopParenthesizeUntil, (o, v) -> o.whileLoopParenthesizeUntil = v);
		choice("if_parenthesize_condition", Parenthesize.class, o -> o.ifParenthesizeCondition, (o, v) -> o.ifParenthesizeCondition = v);
		choice("transition_usage_parenthesize_guard", Parenthesize.class, o -> o.transitionUsageParenthesizeGuard, (o, v) -> o.transitionUsageParenthesizeGuard = v);
		choice("element_filter_parenthesize", Parenthesize.class, o -> o.elementFilterParenthesize, (o, v) -> o.elementFilterParenthesize = v);
		preservable("transition_usage_keyword", KeywordFormat.class, o -> o.transitionUsageKeyword, (o, v) -> o.transitionUsageKeyword = v);
		preservable("transition_usage_first_keyword", KeywordFormat.class, o -> o.transitionUsageFirstKeyword, (o, v) -> o.transitionUsageFirstKeyword = v);
		preservable("framed_concern_keyword", KeywordFormat.class, o -> o.framedConcernKeyword, (o, v) -> o.framedConcernKeyword = v);
		preservable("reference_usage_keyword", KeywordFormat.class, o -> o.referenceUsageKeyword, (o, v) -> o.referenceUsageKeyword = v);
		preservable("attribute_usage_reference_keyword", Presence.class, o -> o.attributeUsageReferenceKeyword, (o, v) -> o.attributeUsageReferenceKeyword = v);
		preservable("event_occurrence_reference_keyword", Presence.class, o -> o.eventOccurrenceReferenceKeyword, (o, v) -> o.eventOccurrenceReferenceKeyword = v);
		preservable("port_usage_reference_keyword", Presence.class, o -> o.portUsageReferenceKeyword, (o, v) -> o.portUsageReferenceKeyword = v);
		preservable("connection_usage_reference_keyword", Presence.class, o -> o.connectionUsageReferenceKeyword, (o, v) -> o.connectionUsageReferenceKeyword = v);
		preservable("connector_as_usage_reference_keyword", Presence.class, o -> o.connectorAsUsageReferenceKeyword, (o, v) -> o.connectorAsUsageReferenceKeyword = v);
		preservable("exhibit_state_reference_keyword", Presence.class, o -> o.exhibitStateReferenceKeyword, (o, v) -> o.exhibitStateReferenceKeyword = v);
		preservable("include_use_case_reference_keyword", Presence.class, o -> o.includeUseCaseReferenceKeyword, (o, v) -> o.includeUseCaseReferenceKeyword = v);
		preservable("perform_action_reference_keyword", Presence.class, o -> o.performActionReferenceKeyword, (o, v) -> o.performActionReferenceKeyword = v);
	}

	/**
	 * @return the keys of all known options, in declaration order
	 */
	public static Iterable<String> keys() {
		return Collections.unmodifiableSet(OPTIONS.keySet());
	}

	public static FormatOptions defaults() {
		return new FormatOptions();
	}

	/**
	 * Reads options from a JSON object on top of the defaults.
	 *
	 * @throws FormatOptionException if a key is unknown or a value has the wrong shape
	 */
	public static FormatOptions fromJSON(JSONObject json) throws FormatOptionException {
		FormatOptions options = new FormatOptions();
		options.update(json);
		return options;
	}

	public static FormatOptions load(Path path) throws FormatOptionException {
		String text;
		try {
			text = FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new FormatOptionException(
					new InvalidFormatOptionIssue(path.toString(), e.getMessage())
							.withContext(new WhileLoadingOptions(path.toString())), e);
		}
		try {
			return fromJSON(new JSONObject(text));
		} catch (JSONException e) {
			throw new FormatOptionException(
					new InvalidFormatOptionIssue(path.toString(), e.getMessage())
							.withContext(new WhileLoadingOptions(path.toString())), e);
		} catch (FormatOptionException e) {
			throw new FormatOptionException(
					e.getIssue().withContext(new WhileLoadingOptions(path.toString())), e);
		}
	}

	/**
	 * Overwrites the options named in {@code json}, leaving the others untouched.
	 */
	public void update(JSONObject json) throws FormatOptionException {
		for (String key : json.keySet()) {
			option(key).update(this, key, json.get(key));
		}
	}

	/**
	 * @return the current value of the option under {@code key}
	 * @throws FormatOptionException if the key is unknown
	 */
	public Object get(String key) throws FormatOptionException {
		return option(key).get(this);
	}

	public FormatOptions copy() {
		FormatOptions copy = new FormatOptions();
		for (Option<?> option : OPTIONS.values()) {
			option.copy(this, copy);
		}
		return copy;
	}

	private static Option<?> option(String key) throws FormatOptionException {
		Option<?> option = OPTIONS.get(key);
		if (option == null) {
			throw new FormatOptionException(new UnknownFormatOptionIssue(key));
		}
		return option;
	}

	private static boolean readBoolean(String key, Object value) throws FormatOptionException {
		if (!(value instanceof Boolean)) {
			throw new FormatOptionException(new InvalidFormatOptionIssue(key, String.valueOf(value), "true or false"));
		}
		return (Boolean) value;
	}

	private static <T extends Enum<T> & OptionValue> T readAlternative(String key, Class<T> type, Object value)
			throws FormatOptionException {
		if (value instanceof String) {
			for (T constant : type.getEnumConstants()) {
				if (constant.getOptionValue().equals(value)) {
					return constant;
				}
			}
		}
		throw new FormatOptionException(new InvalidFormatOptionIssue(key, String.valueOf(value), expected(type)));
	}

	/**
	 * Accepts an alternative, "preserve", or an object with "default" and
	 * "fallback" keys. Missing parts keep their current value.
	 */
	private static <T extends Enum<T> & OptionValue> PreservableFormatting<T> readPreservable(
			String key, Class<T> type, Object value, PreservableFormatting<T> current) throws FormatOptionException {
		if (value instanceof String) {
			if (PreservableFormatting.PRESERVE.equals(value)) {
				return PreservableFormatting.preserve(current.getFallback());
			}
			return PreservableFormatting.fixed(readAlternative(key, type, value));
		}
		if (value instanceof JSONObject) {
			JSONObject object = (JSONObject) value;
			for (String k : object.keySet()) {
				if (!k.equals("default") && !k.equals("fallback")) {
					throw new FormatOptionException(new UnknownFormatOptionIssue(key + "." + k));
				}
			}
			T fallback = object.has("fallback")
					? readAlternative(key + ".fallback", type, object.get("fallback"))
					: current.getFallback();
			Object defaultValue = object.opt("default");
			if (defaultValue == null || PreservableFormatting.PRESERVE.equals(defaultValue)) {
				return PreservableFormatting.preserve(fallback);
			}
			return PreservableFormatting.of(readAlternative(key + ".default", type, defaultValue), fallback);
		}
		throw new FormatOptionException(new InvalidFormatOptionIssue(key, String.valueOf(value),
				expected(type) + ", \"preserve\" or {default, fallback}"));
	}

	private static <T extends Enum<T> & OptionValue> String expected(Class<T> type) {
		StringBuilder sb = new StringBuilder();
		for (T constant : type.getEnumConstants()) {
			if (sb.length() > 0) {
				sb.append(", ");
			}
			sb.append('"').append(constant.getOptionValue()).append('"');
		}
		return sb.toString();
	}
}
