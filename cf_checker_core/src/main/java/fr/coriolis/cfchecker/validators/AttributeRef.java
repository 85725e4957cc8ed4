package fr.coriolis.cfchecker.validators;

import java.util.function.Consumer;

import fr.coriolis.cfchecker.filetypes.DatasetVariable;
import fr.coriolis.cfchecker.specs.AttributeValue;
import fr.coriolis.cfchecker.specs.ExpectedEntry;

/**
 * One side of an attribute comparison: who owns the attribute, its name, its
 * current value and how to write a new value (null if read-only).
 */
public final class AttributeRef {

	private final String ownerName;
	private final String attrName;
	private final AttributeValue value;
	private final Consumer<Object> updater;

	public AttributeRef(String ownerName, String attrName, AttributeValue value, Consumer<Object> updater) {
		this.ownerName = ownerName;
		this.attrName = attrName;
		this.value = value;
		this.updater = updater;
	}

	/** Attribute of an expected variable or coordinate */
	public static AttributeRef of(ExpectedEntry entry, String attrName) {
		return new AttributeRef(entry.getName(), attrName, entry.getAttribute(attrName),
				v -> entry.setAttribute(attrName, v));
	}

	/** Attribute of a dataset variable; new values are written as strings */
	public static AttributeRef of(DatasetVariable var, String attrName) {
		return new AttributeRef(var.getName(), attrName, var.getAttribute(attrName),
				v -> var.getAttributes().put(attrName, String.valueOf(v)));
	}

	public static AttributeRef readOnly(String ownerName, String attrName, AttributeValue value) {
		return new AttributeRef(ownerName, attrName, value, null);
	}

	public String getOwnerName() {
		return ownerName;
	}

	public String getAttrName() {
		return attrName;
	}

	public AttributeValue getValue() {
		return value;
	}

	public boolean isWritable() {
		return updater != null;
	}

	/**
	 * @throws IllegalStateException if the attribute is read-only
	 */
	public void update(Object newValue) {
		if (!isWritable()) {
			throw new IllegalStateException("attribute '" + attrName + "' of '" + ownerName + "' is read-only");
		}
		updater.accept(newValue);
	}

	@Override
	public String toString() {
		return ownerName + ":" + attrName + "=" + value;
	}
}
