package syside.model.expression;

import syside.model.Element;

/**
 * Base of all expressions. Expressions are always owned, either by another
 * expression or by the feature, relationship or action using them.
 */
public abstract class Expression extends Element {
}
