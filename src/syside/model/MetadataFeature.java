package syside.model;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code @M about x { ... }} or {@code metadata m : M;}. Members of the body are
 * feature memberships whose features start with a redefinition.
 */
public class MetadataFeature extends Feature {
	private final Reference type;
	private final List<Reference> about = new ArrayList<>();

	public MetadataFeature(Reference type) {
		super(FeatureKind.FEATURE);
		this.type = adopt(type);
	}

	public Reference getType() {
		return type;
	}

	public List<Reference> getAbout() {
		return about;
	}

	public void addAbout(Reference target) {
		about.add(adopt(target));
	}

	@Override
	public List<Element> getOwnedElements() {
		List<Element> owned = super.getOwnedElements();
		owned.add(0, type);
		owned.addAll(about);
		return owned;
	}

	@Override
	public String getKindName() {
		return "MetadataFeature";
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
