package works.avocado.exceptions;

import java.util.List;

public class CyclicInheritanceException extends SchemaException {
	private final List<String> cycle;

	public CyclicInheritanceException(List<String> cycle) {
		super("Inheritance cycle: " + String.join(" -> ", cycle));
		this.cycle = List.copyOf(cycle);
	}

	public List<String> cycle() {
		return cycle;
	}
}
