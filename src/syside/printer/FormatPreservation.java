package syside.printer;

import syside.model.ConcreteSyntax;
import syside.model.Element;
import syside.model.Token;
import syside.options.OptionValue;
import syside.options.PreservableFormatting;

import java.util.function.Function;

/**
 * Picks the alternative of a preservable option. A fixed option value always
 * wins, otherwise the alternative is read back from the concrete syntax of the
 * element, and elements without concrete syntax use the fallback.
 *
 * Resolution depends only on its arguments.
 */
public class FormatPreservation {
	private FormatPreservation() {}

	/**
	 * @param locate finds the token deciding the alternative, may return null
	 * @param classify maps the located token (or null) to an alternative
	 */
	public static <T extends Enum<T> & OptionValue> T resolve(Element element, PreservableFormatting<T> option,
	                                                          Function<ConcreteSyntax, Token> locate,
	                                                          Function<Token, T> classify) {
		if (!option.isPreserve()) {
			return option.getValue();
		}
		ConcreteSyntax cst = element.getCst();
		if (cst == null) {
			return option.getFallback();
		}
		return classify.apply(locate.apply(cst));
	}

	/**
	 * Resolves an option that is preserved by the presence of a single keyword.
	 */
	public static <T extends Enum<T> & OptionValue> T resolveKeyword(Element element, PreservableFormatting<T> option,
	                                                                 String keyword, T found, T missing) {
		return resolve(element, option, cst -> cst.findKeyword(keyword), token -> token != null ? found : missing);
	}

	/**
	 * @return the last token of the owner of element that ends before element
	 * starts, or null
	 */
	public static Token previousToken(Element owner, Element element) {
		if (owner == null || owner.getCst() == null || element.getCst() == null) {
			return null;
		}
		int start = element.getCst().getOffset();
		Token previous = null;
		for (Token token : owner.getCst().getTokens()) {
			if (token.getLocation().getEndOffset() > start) {
				break;
			}
			previous = token;
		}
		return previous;
	}
}
