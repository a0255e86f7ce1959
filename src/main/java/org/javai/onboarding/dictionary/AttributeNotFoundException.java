package org.javai.onboarding.dictionary;

public class AttributeNotFoundException extends AttributeResolutionException {

	private final String attributeId;

	public AttributeNotFoundException(String attributeId) {
		super("attribute not found: " + attributeId);
		this.attributeId = attributeId;
	}

	public AttributeNotFoundException(String attributeId, String reference) {
		super("attribute not found: " + attributeId + " in reference " + reference);
		this.attributeId = attributeId;
	}

	public String attributeId() {
		return attributeId;
	}
}
