package fla.grammar;

/**
 * Levels of the Chomsky hierarchy.
 */
public enum ChomskyType {
	TYPE_0("unrestricted"),
	TYPE_1("context sensitive"),
	TYPE_2("context free"),
	TYPE_3("regular");

	public final String description;

	ChomskyType(String description) {
		this.description = description;
	}

	@Override
	public String toString() {
		return name().replace('_', ' ').toLowerCase() + " (" + description + ")";
	}
}
